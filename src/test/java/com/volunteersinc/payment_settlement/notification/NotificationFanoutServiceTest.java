package com.volunteersinc.payment_settlement.notification;

import com.volunteersinc.payment_settlement.observability.SettlementMetrics;
import com.volunteersinc.payment_settlement.settlement.SecondaryEffect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationFanoutServiceTest {

    private NotificationStore store;
    private PushGateway pushGateway;
    private SimpleMeterRegistry meterRegistry;
    private NotificationFanoutService service;

    private final UUID actor = UUID.randomUUID();
    private final UUID first = UUID.randomUUID();
    private final UUID second = UUID.randomUUID();
    private final UUID third = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        store = mock(NotificationStore.class);
        pushGateway = mock(PushGateway.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new NotificationFanoutService(store, pushGateway, new SettlementMetrics(meterRegistry));
    }

    @Test
    @DisplayName("One failing push does not stop the others")
    void isolatesPushFailures() {
        UUID causeId = UUID.randomUUID();
        List<UUID> recipients = List.of(first, second, third);
        when(store.findRecipients(NotificationCategory.CAUSE, actor)).thenReturn(recipients);
        when(store.insertAll(eq(recipients), any())).thenReturn(3);
        when(pushGateway.send(eq(first), any())).thenReturn(true);
        when(pushGateway.send(eq(second), any())).thenThrow(new IllegalStateException("socket closed"));
        when(pushGateway.send(eq(third), any())).thenReturn(false);

        FanoutResult result = service.fanOut(NotificationCategory.CAUSE, causeId, actor, "Clean Water", null);

        assertEquals(3, result.getRecipients());
        assertEquals(1, result.getPushed());
        assertEquals(2, result.getPushFailureCount());
        assertTrue(result.getPushFailures().stream()
            .allMatch(failure -> failure.getEffect() == SecondaryEffect.PUSH_DELIVERY));
        verify(pushGateway).send(eq(third), any());
        assertEquals(1.0, meterRegistry.counter("notification.push", "result", "delivered").count());
        assertEquals(2.0, meterRegistry.counter("notification.push", "result", "failed").count());
    }

    @Test
    @DisplayName("Rows are written with the category's title, message and link")
    void writesCauseRows() {
        UUID causeId = UUID.randomUUID();
        when(store.findRecipients(NotificationCategory.CAUSE, actor)).thenReturn(List.of(first));
        when(pushGateway.send(any(), any())).thenReturn(true);

        service.fanOut(NotificationCategory.CAUSE, causeId, actor, "Clean Water", null);

        ArgumentCaptor<NotificationDraft> draft = ArgumentCaptor.forClass(NotificationDraft.class);
        verify(store).insertAll(eq(List.of(first)), draft.capture());
        assertEquals("New Fundraising Cause", draft.getValue().getTitle());
        assertEquals("Clean Water - Help make a difference!", draft.getValue().getMessage());
        assertEquals("/causes/" + causeId, draft.getValue().getLink());
        assertEquals(causeId, draft.getValue().getRelatedId());

        ArgumentCaptor<PushPayload> payload = ArgumentCaptor.forClass(PushPayload.class);
        verify(pushGateway).send(eq(first), payload.capture());
        assertEquals("cause", payload.getValue().getType());
        assertEquals(causeId, payload.getValue().getId());
    }

    @Test
    @DisplayName("Events and announcements use their own wording")
    void draftsPerCategory() {
        UUID id = UUID.randomUUID();

        NotificationDraft event = NotificationCategory.EVENT.draft(id, "Beach Cleanup", null);
        assertEquals("New Event", event.getTitle());
        assertEquals("Beach Cleanup - Join us!", event.getMessage());
        assertEquals("/events/" + id, event.getLink());

        NotificationDraft announcement = NotificationCategory.ANNOUNCEMENT.draft(id, "Office closed", "Back Monday");
        assertEquals("Office closed", announcement.getTitle());
        assertEquals("Back Monday", announcement.getMessage());
        assertEquals("/post/" + id, announcement.getLink());
    }

    @Test
    @DisplayName("No recipients means no rows and no pushes")
    void noRecipients() {
        when(store.findRecipients(NotificationCategory.EVENT, actor)).thenReturn(List.of());

        FanoutResult result = service.fanOut(NotificationCategory.EVENT, UUID.randomUUID(), actor, "Gala", null);

        assertEquals(0, result.getRecipients());
        verify(store, never()).insertAll(any(), any());
        verify(pushGateway, never()).send(any(), any());
    }

    @Test
    @DisplayName("A failed row insert fails the fan-out before any push")
    void insertFailurePropagates() {
        when(store.findRecipients(NotificationCategory.ANNOUNCEMENT, actor)).thenReturn(List.of(first));
        when(store.insertAll(any(), any())).thenThrow(new IllegalStateException("notifications table missing"));

        assertThrows(IllegalStateException.class,
            () -> service.fanOut(NotificationCategory.ANNOUNCEMENT, UUID.randomUUID(), actor, "News", "Body"));
        verify(pushGateway, never()).send(any(), any());
    }

    @Test
    @DisplayName("Category codes parse case-insensitively")
    void parsesCategory() {
        assertEquals(NotificationCategory.ANNOUNCEMENT, NotificationCategory.fromCode("Announcement"));
        assertThrows(IllegalArgumentException.class, () -> NotificationCategory.fromCode("poll"));
    }
}
