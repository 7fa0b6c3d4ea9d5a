package com.volunteersinc.payment_settlement.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ExpoPushGatewayTest {

    private static final String PUSH_URL = "https://push.test/send";

    private MockRestServiceServer server;
    private NotificationStore store;
    private ExpoPushGateway gateway;

    private final UUID userId = UUID.randomUUID();
    private final PushPayload payload = new PushPayload("event", UUID.randomUUID(), "New Event", "Gala - Join us!");

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        store = mock(NotificationStore.class);
        gateway = new ExpoPushGateway(restTemplate, store, PUSH_URL);
    }

    @Test
    @DisplayName("Posts the message to the user's device token")
    void sendsToToken() {
        when(store.findPushToken(userId)).thenReturn(Optional.of("ExponentPushToken[abc]"));
        server.expect(requestTo(PUSH_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.to").value("ExponentPushToken[abc]"))
            .andExpect(jsonPath("$.sound").value("default"))
            .andExpect(jsonPath("$.priority").value("high"))
            .andExpect(jsonPath("$.data.type").value("event"))
            .andExpect(jsonPath("$.data.id").value(payload.getId().toString()))
            .andRespond(withSuccess("{\"data\":{\"status\":\"ok\",\"id\":\"ticket-1\"}}", MediaType.APPLICATION_JSON));

        assertTrue(gateway.send(userId, payload));
        server.verify();
    }

    @Test
    @DisplayName("An error ticket counts as undelivered")
    void errorTicket() {
        when(store.findPushToken(userId)).thenReturn(Optional.of("ExponentPushToken[abc]"));
        server.expect(requestTo(PUSH_URL))
            .andRespond(withSuccess("{\"data\":[{\"status\":\"error\",\"message\":\"DeviceNotRegistered\"}]}",
                MediaType.APPLICATION_JSON));

        assertFalse(gateway.send(userId, payload));
    }

    @Test
    @DisplayName("A server error counts as undelivered")
    void serverError() {
        when(store.findPushToken(userId)).thenReturn(Optional.of("ExponentPushToken[abc]"));
        server.expect(requestTo(PUSH_URL)).andRespond(withServerError());

        assertFalse(gateway.send(userId, payload));
    }

    @Test
    @DisplayName("Users without a token are not contacted")
    void noToken() {
        when(store.findPushToken(userId)).thenReturn(Optional.empty());

        assertFalse(gateway.send(userId, payload));
        server.verify();
    }
}
