package com.volunteersinc.payment_settlement.notification;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationStore {

    /**
     * Users other than the actor whose setting for the category is enabled
     * or was never set.
     */
    List<UUID> findRecipients(NotificationCategory category, UUID actorId);

    /**
     * Writes one unread notification row per recipient in a single batch.
     */
    int insertAll(List<UUID> recipients, NotificationDraft draft);

    Optional<String> findPushToken(UUID userId);
}
