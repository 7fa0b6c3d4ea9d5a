package com.volunteersinc.payment_settlement.receipt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to receipts.
 *
 * One receipt per (transaction_id, transaction_number): a second issue for
 * the same pair inserts nothing. A receipt_number collision is retried
 * with a fresh number.
 */
@Repository
@Slf4j
public class JdbcReceiptIssuer implements ReceiptIssuer {

    static final String GENERATED = "generated";
    private static final int MAX_NUMBER_ATTEMPTS = 3;
    private static final TypeReference<List<ReceiptLineItem>> LINE_ITEMS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ReceiptNumberGenerator numberGenerator;
    private final Clock clock;

    public JdbcReceiptIssuer(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                             ReceiptNumberGenerator numberGenerator, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.numberGenerator = numberGenerator;
        this.clock = clock;
    }

    @Override
    public Optional<Receipt> issue(ReceiptRequest request) {
        String lineItems = writeLineItems(request.getLineItems());

        for (int attempt = 1; ; attempt++) {
            UUID id = UUID.randomUUID();
            String receiptNumber = numberGenerator.next();
            Instant issuedAt = clock.instant();
            try {
                int inserted = jdbcTemplate.update(
                    "INSERT INTO receipts (id, transaction_id, transaction_number, receipt_number, receipt_type, " +
                    "customer_name, customer_email, subtotal, processing_fee, total_amount, currency, line_items, " +
                    "payment_method, status, issued_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?) " +
                    "ON CONFLICT (transaction_id, transaction_number) DO NOTHING",
                    id,
                    request.getTransactionId(),
                    request.getTransactionNumber(),
                    receiptNumber,
                    request.getReceiptType().getCode(),
                    request.getCustomerName(),
                    request.getCustomerEmail(),
                    request.getSubtotal(),
                    request.getProcessingFee(),
                    request.getTotalAmount(),
                    request.getCurrency(),
                    lineItems,
                    request.getPaymentMethod(),
                    GENERATED,
                    Timestamp.from(issuedAt)
                );
                if (inserted == 0) {
                    return Optional.empty();
                }
                return Optional.of(Receipt.builder()
                    .id(id)
                    .receiptNumber(receiptNumber)
                    .receiptType(request.getReceiptType())
                    .transactionId(request.getTransactionId())
                    .transactionNumber(request.getTransactionNumber())
                    .customerName(request.getCustomerName())
                    .customerEmail(request.getCustomerEmail())
                    .lineItems(request.getLineItems())
                    .subtotal(request.getSubtotal())
                    .processingFee(request.getProcessingFee())
                    .totalAmount(request.getTotalAmount())
                    .currency(request.getCurrency())
                    .paymentMethod(request.getPaymentMethod())
                    .status(GENERATED)
                    .issuedAt(issuedAt)
                    .build());
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_NUMBER_ATTEMPTS) {
                    throw e;
                }
                log.debug("Receipt number collision, retrying: receiptNumber={}, attempt={}", receiptNumber, attempt);
            }
        }
    }

    @Override
    public Optional<Receipt> findByReceiptNumber(String receiptNumber) {
        List<Receipt> rows = jdbcTemplate.query(
            selectReceipts() + " WHERE receipt_number = ?",
            receiptRowMapper(),
            receiptNumber
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<Receipt> findByCustomerEmail(String customerEmail, int limit) {
        return jdbcTemplate.query(
            selectReceipts() + " WHERE customer_email = ? ORDER BY issued_at DESC LIMIT ?",
            receiptRowMapper(),
            customerEmail,
            limit
        );
    }

    private static String selectReceipts() {
        return "SELECT id, receipt_number, receipt_type, transaction_id, transaction_number, customer_name, " +
               "customer_email, line_items::text AS line_items, subtotal, processing_fee, total_amount, currency, " +
               "payment_method, status, issued_at FROM receipts";
    }

    private RowMapper<Receipt> receiptRowMapper() {
        return (rs, rowNum) -> Receipt.builder()
            .id(rs.getObject("id", UUID.class))
            .receiptNumber(rs.getString("receipt_number"))
            .receiptType(ReceiptType.fromCode(rs.getString("receipt_type")))
            .transactionId(rs.getObject("transaction_id", UUID.class))
            .transactionNumber(rs.getString("transaction_number"))
            .customerName(rs.getString("customer_name"))
            .customerEmail(rs.getString("customer_email"))
            .lineItems(readLineItems(rs.getString("line_items")))
            .subtotal(rs.getBigDecimal("subtotal"))
            .processingFee(rs.getBigDecimal("processing_fee"))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .currency(rs.getString("currency"))
            .paymentMethod(rs.getString("payment_method"))
            .status(rs.getString("status"))
            .issuedAt(rs.getTimestamp("issued_at").toInstant())
            .build();
    }

    private String writeLineItems(List<ReceiptLineItem> items) {
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize receipt line items", e);
        }
    }

    private List<ReceiptLineItem> readLineItems(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LINE_ITEMS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize receipt line items", e);
        }
    }
}
