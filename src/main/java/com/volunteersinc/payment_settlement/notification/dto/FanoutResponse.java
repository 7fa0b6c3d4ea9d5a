package com.volunteersinc.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.volunteersinc.payment_settlement.notification.FanoutResult;
import lombok.Value;

@Value
public class FanoutResponse {
    int recipients;
    int pushed;

    @JsonProperty("push_failures")
    int pushFailures;

    public static FanoutResponse from(FanoutResult result) {
        return new FanoutResponse(result.getRecipients(), result.getPushed(), result.getPushFailureCount());
    }
}
