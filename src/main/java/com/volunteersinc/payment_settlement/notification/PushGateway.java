package com.volunteersinc.payment_settlement.notification;

import java.util.UUID;

/**
 * Delivers a push notification to one user's device.
 */
public interface PushGateway {

    /**
     * @return true when the push service accepted the message; false when the
     *         user has no registered device or the service rejected it
     */
    boolean send(UUID userId, PushPayload payload);
}
