package com.volunteersinc.payment_settlement.webhook;

import com.volunteersinc.payment_settlement.webhook.dto.GatewayWebhook;
import com.volunteersinc.payment_settlement.webhook.dto.WebhookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives payment callbacks from the gateway. Redeliveries are answered
 * with success so the gateway stops retrying.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookController {

    private final GatewayWebhookService webhookService;

    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> receive(@RequestBody GatewayWebhook webhook,
                                                   @RequestHeader Map<String, String> headers) {
        log.debug("Received gateway webhook: transactionNumber={}", webhook.getTransactionNumber());

        WebhookResult result = webhookService.handle(webhook, headers);
        return ResponseEntity.ok(WebhookResponse.from(result));
    }
}
