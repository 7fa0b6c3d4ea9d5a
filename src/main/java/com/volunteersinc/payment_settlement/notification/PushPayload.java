package com.volunteersinc.payment_settlement.notification;

import lombok.Value;

import java.util.UUID;

/**
 * What a device shows, plus the data the app uses to open the linked content.
 */
@Value
public class PushPayload {
    String type;
    UUID id;
    String title;
    String body;
}
