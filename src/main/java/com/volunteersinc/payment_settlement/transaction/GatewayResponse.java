package com.volunteersinc.payment_settlement.transaction;

import lombok.Value;

/**
 * Response code and description the gateway reported for a charge.
 */
@Value
public class GatewayResponse {
    String code;
    String description;
}
