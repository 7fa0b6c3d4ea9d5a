package com.volunteersinc.payment_settlement.notification;

import com.volunteersinc.payment_settlement.observability.SettlementMetrics;
import com.volunteersinc.payment_settlement.settlement.SecondaryEffect;
import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Notifies users about newly created causes, events and announcements.
 *
 * Rows are written first in one batch; pushes follow one recipient at a
 * time. A failed push is counted and reported but never stops the pushes
 * after it, and never removes the rows already written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationFanoutService {

    private final NotificationStore notificationStore;
    private final PushGateway pushGateway;
    private final SettlementMetrics metrics;

    public FanoutResult fanOut(NotificationCategory category, UUID relatedId, UUID actorId,
                               String title, String body) {
        long startTime = System.currentTimeMillis();
        NotificationDraft draft = category.draft(relatedId, title, body);

        List<UUID> recipients = notificationStore.findRecipients(category, actorId);
        if (recipients.isEmpty()) {
            log.info("No recipients for notification: category={}, relatedId={}", category.getCode(), relatedId);
            return new FanoutResult(0, 0, List.of());
        }

        int written = notificationStore.insertAll(recipients, draft);
        log.info("Notifications created: category={}, relatedId={}, rows={}",
                category.getCode(), relatedId, written);

        PushPayload payload = draft.toPushPayload();
        int pushed = 0;
        List<SecondaryFailure> failures = new ArrayList<>();
        for (UUID recipient : recipients) {
            try {
                if (pushGateway.send(recipient, payload)) {
                    pushed++;
                    metrics.recordPush(true);
                } else {
                    metrics.recordPush(false);
                    failures.add(new SecondaryFailure(SecondaryEffect.PUSH_DELIVERY,
                            "Push not delivered to user " + recipient));
                }
            } catch (RuntimeException e) {
                log.warn("Push failed, continuing with remaining recipients: userId={}, error={}",
                        recipient, e.getMessage());
                metrics.recordPush(false);
                failures.add(SecondaryFailure.of(SecondaryEffect.PUSH_DELIVERY, e));
            }
        }

        log.info("Notification fan-out complete: category={}, recipients={}, pushed={}, failures={}, durationMs={}",
                category.getCode(), recipients.size(), pushed, failures.size(),
                System.currentTimeMillis() - startTime);
        return new FanoutResult(recipients.size(), pushed, List.copyOf(failures));
    }
}
