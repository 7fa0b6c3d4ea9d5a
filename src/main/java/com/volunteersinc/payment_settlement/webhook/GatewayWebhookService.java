package com.volunteersinc.payment_settlement.webhook;

import com.volunteersinc.payment_settlement.observability.CorrelationContext;
import com.volunteersinc.payment_settlement.observability.SettlementMetrics;
import com.volunteersinc.payment_settlement.payment.PaymentConfirmationService;
import com.volunteersinc.payment_settlement.payment.exception.InvalidRequestException;
import com.volunteersinc.payment_settlement.payment.exception.RecordNotFoundException;
import com.volunteersinc.payment_settlement.transaction.GatewayResponse;
import com.volunteersinc.payment_settlement.transaction.PaymentSubscription;
import com.volunteersinc.payment_settlement.transaction.PaymentTransaction;
import com.volunteersinc.payment_settlement.transaction.SubscriptionStore;
import com.volunteersinc.payment_settlement.transaction.TransactionStore;
import com.volunteersinc.payment_settlement.webhook.dto.GatewayWebhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Gateway callback intake.
 *
 * Each delivery is audited before anything else. A delivery whose
 * transaction number is already in the audit trail is acknowledged without
 * being processed again. Approved charges are settled through
 * {@link PaymentConfirmationService}; declined ones mark the pending
 * transaction or the subscription failed. The audit row ends up processed,
 * or carries the error that stopped it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookService {

    private static final Set<String> SECRET_HEADERS = Set.of("authorization", "cookie");

    private final WebhookAuditStore auditStore;
    private final TransactionStore transactionStore;
    private final SubscriptionStore subscriptionStore;
    private final PaymentConfirmationService confirmationService;
    private final SettlementMetrics settlementMetrics;
    private final Clock clock;

    public WebhookResult handle(GatewayWebhook webhook, Map<String, String> headers) {
        validate(webhook);
        String transactionNumber = webhook.getTransactionNumber().trim();
        boolean subscriptionPayment = !isBlank(webhook.getSubscriptionId());
        WebhookEventType eventType = subscriptionPayment
            ? WebhookEventType.SUBSCRIPTION_PAYMENT
            : WebhookEventType.ONE_TIME_PAYMENT;

        log.info("Webhook received: eventType={}, transactionNumber={}, responseCode={}",
                eventType.getCode(), transactionNumber, webhook.getResponseCode());

        Optional<UUID> auditId;
        try {
            auditId = auditStore.recordDelivery(WebhookDelivery.builder()
                .eventType(eventType)
                .transactionNumber(transactionNumber)
                .payload(payloadOf(webhook))
                .headers(auditableHeaders(headers))
                .build());
            if (auditId.isEmpty()) {
                settlementMetrics.recordWebhook(WebhookResult.Outcome.DUPLICATE.getTag());
                log.info("Duplicate webhook acknowledged: transactionNumber={}", transactionNumber);
                return WebhookResult.duplicate();
            }
        } catch (DataAccessException e) {
            log.error("Webhook audit insert failed, processing without audit: transactionNumber={}, error={}",
                    transactionNumber, e.getMessage());
            auditId = Optional.empty();
        }

        try {
            WebhookResult result = subscriptionPayment
                ? handleSubscription(webhook.getSubscriptionId().trim(), transactionNumber, webhook.isApproved())
                : handleTransaction(webhook.resolvedOrderId().trim(), transactionNumber, webhook);
            auditId.ifPresent(id -> auditStore.markProcessed(id, clock.instant()));
            settlementMetrics.recordWebhook(result.getOutcome().getTag());
            return result;
        } catch (RuntimeException e) {
            settlementMetrics.recordWebhook("errored");
            auditId.ifPresent(id -> markErrored(id, e));
            throw e;
        }
    }

    private WebhookResult handleTransaction(String orderId, String transactionNumber, GatewayWebhook webhook) {
        PaymentTransaction transaction = transactionStore.findByOrderId(orderId)
            .orElseThrow(() -> new RecordNotFoundException("Transaction not found"));

        if (webhook.isApproved()) {
            return WebhookResult.from(confirmationService.confirmTransaction(transaction.getId(), transactionNumber));
        }

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());
        try {
            GatewayResponse response = new GatewayResponse(webhook.getResponseCode().trim(), webhook.getResponseDescription());
            boolean updated = transactionStore.markFailed(transaction.getId(), transactionNumber, response, clock.instant());
            log.info("Payment declined: responseCode={}, responseDescription={}, statusUpdated={}",
                    response.getCode(), response.getDescription(), updated);
            return WebhookResult.declined();
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private WebhookResult handleSubscription(String gatewaySubscriptionId, String transactionNumber, boolean approved) {
        PaymentSubscription subscription = subscriptionStore.findByGatewaySubscriptionId(gatewaySubscriptionId)
            .orElseThrow(() -> new RecordNotFoundException("Subscription not found"));

        if (approved) {
            return WebhookResult.from(confirmationService.confirmSubscription(subscription.getId(), transactionNumber));
        }

        MDC.put(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY, subscription.getId().toString());
        try {
            subscriptionStore.markFailed(subscription.getId(), transactionNumber, clock.instant());
            log.info("Subscription billing declined: transactionNumber={}", transactionNumber);
            return WebhookResult.declined();
        } finally {
            MDC.remove(CorrelationContext.SUBSCRIPTION_ID_MDC_KEY);
        }
    }

    private void markErrored(UUID auditId, RuntimeException failure) {
        try {
            auditStore.markErrored(auditId, failure.getMessage(), clock.instant());
        } catch (DataAccessException auditFailure) {
            log.error("Could not record webhook error: auditId={}, error={}", auditId, auditFailure.getMessage());
            failure.addSuppressed(auditFailure);
        }
    }

    private static void validate(GatewayWebhook webhook) {
        if (isBlank(webhook.getResponseCode())) {
            throw new InvalidRequestException("Missing ResponseCode");
        }
        if (isBlank(webhook.getTransactionNumber())) {
            throw new InvalidRequestException("Missing TransactionNumber");
        }
        if (isBlank(webhook.getSubscriptionId()) && isBlank(webhook.resolvedOrderId())) {
            throw new InvalidRequestException("Missing order identifier");
        }
    }

    private static Map<String, String> auditableHeaders(Map<String, String> headers) {
        if (headers == null) {
            return null;
        }
        Map<String, String> kept = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (!SECRET_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                kept.put(name, value);
            }
        });
        return kept;
    }

    private static Map<String, Object> payloadOf(GatewayWebhook webhook) {
        Map<String, Object> payload = new LinkedHashMap<>(webhook.getOtherFields());
        payload.put("ResponseCode", webhook.getResponseCode());
        payload.put("ResponseDescription", webhook.getResponseDescription());
        payload.put("TransactionNumber", webhook.getTransactionNumber());
        payload.put("CustomOrderId", webhook.getCustomOrderId());
        payload.put("order_id", webhook.getOrderId());
        payload.put("amount", webhook.getAmount());
        payload.put("subscription_id", webhook.getSubscriptionId());
        return payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
