package com.volunteersinc.payment_settlement.notification;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Push delivery through the Expo push HTTP API.
 *
 * The device token is looked up per user. A missing token, a transport
 * error or an {@code "error"} ticket all count as an undelivered push.
 */
@Component
@Slf4j
public class ExpoPushGateway implements PushGateway {

    private final RestTemplate restTemplate;
    private final NotificationStore notificationStore;
    private final String pushUrl;

    public ExpoPushGateway(@Qualifier("pushRestTemplate") RestTemplate restTemplate,
                           NotificationStore notificationStore,
                           @Value("${settlement.push.url:https://exp.host/--/api/v2/push/send}") String pushUrl) {
        this.restTemplate = restTemplate;
        this.notificationStore = notificationStore;
        this.pushUrl = pushUrl;
    }

    @Override
    public boolean send(UUID userId, PushPayload payload) {
        Optional<String> token = notificationStore.findPushToken(userId);
        if (token.isEmpty()) {
            log.debug("No push token registered: userId={}", userId);
            return false;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            JsonNode response = restTemplate.postForObject(
                pushUrl, new HttpEntity<>(buildMessage(token.get(), payload), headers), JsonNode.class);
            if (isRejected(response)) {
                log.warn("Push rejected: userId={}, response={}", userId, response);
                return false;
            }
            return true;
        } catch (RestClientException e) {
            log.warn("Push request failed: userId={}, error={}", userId, e.getMessage());
            return false;
        }
    }

    Map<String, Object> buildMessage(String token, PushPayload payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", payload.getType());
        data.put("id", payload.getId().toString());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("to", token);
        message.put("sound", "default");
        message.put("title", payload.getTitle());
        message.put("body", payload.getBody());
        message.put("data", data);
        message.put("priority", "high");
        return message;
    }

    /**
     * Expo answers with a ticket under {@code data}, either a single object
     * or an array of them.
     */
    static boolean isRejected(JsonNode response) {
        if (response == null) {
            return false;
        }
        JsonNode data = response.path("data");
        if (data.isArray()) {
            for (JsonNode ticket : data) {
                if ("error".equals(ticket.path("status").asText())) {
                    return true;
                }
            }
            return false;
        }
        return "error".equals(data.path("status").asText());
    }
}
