package com.volunteersinc.payment_settlement.receipt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ReceiptLineItem {
    String description;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal amount;

    @JsonCreator
    public ReceiptLineItem(@JsonProperty("description") String description,
                           @JsonProperty("quantity") int quantity,
                           @JsonProperty("unitPrice") BigDecimal unitPrice,
                           @JsonProperty("amount") BigDecimal amount) {
        this.description = description;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.amount = amount;
    }

    public static ReceiptLineItem single(String description, BigDecimal price) {
        return new ReceiptLineItem(description, 1, price, price);
    }
}
