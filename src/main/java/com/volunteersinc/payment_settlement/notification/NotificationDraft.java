package com.volunteersinc.payment_settlement.notification;

import lombok.Value;

import java.util.UUID;

/**
 * The notification row written for every recipient of one fan-out.
 */
@Value
public class NotificationDraft {
    NotificationCategory category;
    UUID relatedId;
    String title;
    String message;
    String link;

    public PushPayload toPushPayload() {
        return new PushPayload(category.getCode(), relatedId, title, message);
    }
}
