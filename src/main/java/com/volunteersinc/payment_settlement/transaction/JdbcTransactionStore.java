package com.volunteersinc.payment_settlement.transaction;

import com.volunteersinc.payment_settlement.transaction.metadata.TransactionMetadataParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to payment_transactions.
 *
 * Status updates only apply to pending rows, so two concurrent confirmations
 * of the same transaction settle it exactly once and a refunded or failed
 * transaction is never flipped back to completed.
 */
@Repository
@Slf4j
public class JdbcTransactionStore implements TransactionStore {

    private static final String SELECT_COLUMNS =
        "SELECT id, order_id, order_type, reference_id, user_id, amount, customer_email, customer_name, " +
        "description, status, metadata::text AS metadata, created_at, updated_at, completed_at, transaction_number " +
        "FROM payment_transactions";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionMetadataParser metadataParser;

    public JdbcTransactionStore(JdbcTemplate jdbcTemplate, TransactionMetadataParser metadataParser) {
        this.jdbcTemplate = jdbcTemplate;
        this.metadataParser = metadataParser;
    }

    @Override
    public Optional<PaymentTransaction> findById(UUID id) {
        List<PaymentTransaction> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = ?",
            transactionRowMapper(),
            id
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<PaymentTransaction> findByOrderId(String orderId) {
        List<PaymentTransaction> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE order_id = ? ORDER BY created_at DESC LIMIT 1",
            transactionRowMapper(),
            orderId
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean markCompleted(UUID id, String transactionNumber, Instant completedAt) {
        Timestamp at = Timestamp.from(completedAt);
        int updated = jdbcTemplate.update(
            "UPDATE payment_transactions " +
            "SET status = ?, transaction_number = ?, completed_at = ?, updated_at = ? " +
            "WHERE id = ? AND status = ?",
            TransactionStatus.COMPLETED.getCode(),
            transactionNumber,
            at,
            at,
            id,
            TransactionStatus.PENDING.getCode()
        );
        return updated > 0;
    }

    @Override
    public boolean markFailed(UUID id, String transactionNumber, GatewayResponse response, Instant failedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE payment_transactions " +
            "SET status = ?, transaction_number = ?, response_code = ?, response_description = ?, updated_at = ? " +
            "WHERE id = ? AND status = ?",
            TransactionStatus.FAILED.getCode(),
            transactionNumber,
            response.getCode(),
            response.getDescription(),
            Timestamp.from(failedAt),
            id,
            TransactionStatus.PENDING.getCode()
        );
        return updated > 0;
    }

    private RowMapper<PaymentTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            String orderTypeCode = rs.getString("order_type");
            OrderType orderType = OrderType.fromCode(orderTypeCode);
            return PaymentTransaction.builder()
                .id(rs.getObject("id", UUID.class))
                .orderId(rs.getString("order_id"))
                .orderType(orderType)
                .orderTypeCode(orderTypeCode)
                .referenceId(parseReference(rs))
                .userId(rs.getObject("user_id", UUID.class))
                .amount(rs.getBigDecimal("amount"))
                .customerEmail(rs.getString("customer_email"))
                .customerName(rs.getString("customer_name"))
                .description(rs.getString("description"))
                .status(TransactionStatus.fromCode(rs.getString("status")))
                .metadata(metadataParser.parse(orderType, rs.getString("metadata")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .transactionNumber(rs.getString("transaction_number"))
                .build();
        };
    }

    private UUID parseReference(ResultSet rs) throws SQLException {
        String raw = rs.getString("reference_id");
        Optional<UUID> parsed = ReferenceIds.parse(raw);
        if (raw != null && !raw.isBlank() && parsed.isEmpty()) {
            log.warn("Ignoring malformed reference_id on transaction: transactionId={}, referenceId={}",
                    rs.getString("id"), raw);
        }
        return parsed.orElse(null);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
