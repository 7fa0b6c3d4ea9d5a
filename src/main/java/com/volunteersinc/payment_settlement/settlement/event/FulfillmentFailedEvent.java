package com.volunteersinc.payment_settlement.settlement.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.volunteersinc.payment_settlement.settlement.SettlementSource;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a payment's ledger record was settled but updating its
 * domain records failed. Consumers replay the domain side only.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class FulfillmentFailedEvent {
    public static final String EVENT_TYPE = "SettlementFulfillmentFailed";

    UUID eventId;
    SettlementSource source;
    /**
     * Transaction id or subscription id, depending on the source.
     */
    UUID recordId;
    String transactionNumber;
    String kind;
    String reason;
    String correlationId;
    Instant occurredAt;

    public String getEventType() {
        return EVENT_TYPE;
    }
}
