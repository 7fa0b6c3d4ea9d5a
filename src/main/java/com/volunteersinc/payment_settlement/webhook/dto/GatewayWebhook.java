package com.volunteersinc.payment_settlement.webhook.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Callback body posted by the payment gateway. ResponseCode "1" means the
 * charge was approved. Fields the service does not read are kept so the
 * audit row holds the whole delivery.
 */
@Data
@NoArgsConstructor
public class GatewayWebhook {

    @JsonProperty("ResponseCode")
    private String responseCode;

    @JsonProperty("ResponseDescription")
    private String responseDescription;

    @JsonProperty("TransactionNumber")
    private String transactionNumber;

    @JsonProperty("CustomOrderId")
    private String customOrderId;

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("amount")
    private String amount;

    @JsonProperty("subscription_id")
    private String subscriptionId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<String, Object> otherFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOtherField(String name, Object value) {
        otherFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOtherFields() {
        return otherFields;
    }

    /**
     * CustomOrderId, falling back to order_id.
     */
    public String resolvedOrderId() {
        return customOrderId != null && !customOrderId.isBlank() ? customOrderId : orderId;
    }

    @JsonIgnore
    public boolean isApproved() {
        return responseCode != null && "1".equals(responseCode.trim());
    }
}
