package com.volunteersinc.payment_settlement.notification;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcNotificationStore implements NotificationStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcNotificationStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public List<UUID> findRecipients(NotificationCategory category, UUID actorId) {
        String setting = "s." + category.getSettingColumn();
        return jdbcTemplate.query(
            "SELECT u.id FROM users u " +
            "LEFT JOIN user_notification_settings s ON s.user_id = u.id " +
            "WHERE u.id <> ? AND (" + setting + " IS NULL OR " + setting + " = TRUE) " +
            "ORDER BY u.id",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            actorId
        );
    }

    @Override
    public int insertAll(List<UUID> recipients, NotificationDraft draft) {
        if (recipients.isEmpty()) {
            return 0;
        }
        Timestamp createdAt = Timestamp.from(Instant.now(clock));
        List<Object[]> rows = recipients.stream()
            .map(userId -> new Object[] {
                userId,
                draft.getCategory().getCode(),
                draft.getTitle(),
                draft.getMessage(),
                draft.getLink(),
                draft.getRelatedId(),
                createdAt
            })
            .toList();

        int[] counts = jdbcTemplate.batchUpdate(
            "INSERT INTO notifications (id, user_id, type, title, message, link, related_id, is_read, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, FALSE, ?)",
            rows
        );
        return Arrays.stream(counts).map(count -> Math.max(count, 0)).sum();
    }

    @Override
    public Optional<String> findPushToken(UUID userId) {
        List<String> tokens = jdbcTemplate.query(
            "SELECT token FROM push_tokens WHERE user_id = ? ORDER BY updated_at DESC NULLS LAST LIMIT 1",
            (rs, rowNum) -> rs.getString("token"),
            userId
        );
        return tokens.stream().filter(token -> token != null && !token.isBlank()).findFirst();
    }
}
