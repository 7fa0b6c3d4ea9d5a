package com.volunteersinc.payment_settlement.transaction.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volunteersinc.payment_settlement.transaction.BillingFrequency;
import com.volunteersinc.payment_settlement.transaction.OrderType;
import com.volunteersinc.payment_settlement.transaction.ReferenceIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns the raw metadata JSON of a transaction into its typed variant.
 *
 * Parsing never fails: malformed JSON, wrong shapes and bad values degrade
 * to {@link EmptyMetadata} (or to an empty field) with a warning, since a
 * paid transaction must settle regardless of what its metadata says.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionMetadataParser {

    static final String SUBSCRIPTION_REF_KEY = "payment_subscriptions_id";
    static final String FREQUENCY_KEY = "frequency";
    static final String CAUSE_KEY = "cause_id";

    private final ObjectMapper objectMapper;

    public TransactionMetadata parse(OrderType orderType, String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            return TransactionMetadata.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawJson);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed transaction metadata: orderType={}, error={}",
                    orderType, e.getOriginalMessage());
            return TransactionMetadata.empty();
        }

        if (root == null || !root.isObject()) {
            log.warn("Ignoring non-object transaction metadata: orderType={}", orderType);
            return TransactionMetadata.empty();
        }

        return switch (orderType) {
            case MEMBERSHIP, ORGANIZATION_MEMBERSHIP -> parseMembership(root);
            case DONATION, RECURRING_DONATION -> parseDonation(root);
            case EVENT_REGISTRATION, UNKNOWN -> TransactionMetadata.empty();
        };
    }

    private TransactionMetadata parseMembership(JsonNode root) {
        UUID subscriptionRef = uuidField(root, SUBSCRIPTION_REF_KEY);
        String frequencyCode = textField(root, FREQUENCY_KEY);
        BillingFrequency frequency = BillingFrequency.fromCode(frequencyCode).orElse(null);
        if (frequencyCode != null && frequency == null) {
            log.warn("Ignoring unknown billing frequency in metadata: frequency={}", frequencyCode);
        }
        if (subscriptionRef == null && frequency == null) {
            return TransactionMetadata.empty();
        }
        return new MembershipMetadata(subscriptionRef, frequency);
    }

    private TransactionMetadata parseDonation(JsonNode root) {
        UUID causeId = uuidField(root, CAUSE_KEY);
        return causeId == null ? TransactionMetadata.empty() : new DonationMetadata(causeId);
    }

    private UUID uuidField(JsonNode root, String key) {
        String raw = textField(root, key);
        if (raw == null) {
            return null;
        }
        UUID parsed = ReferenceIds.parse(raw).orElse(null);
        if (parsed == null) {
            log.warn("Ignoring malformed id in metadata: key={}, value={}", key, raw);
        }
        return parsed;
    }

    private static String textField(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
