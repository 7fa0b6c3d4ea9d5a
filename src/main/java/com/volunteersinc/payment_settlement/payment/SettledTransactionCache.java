package com.volunteersinc.payment_settlement.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for the "already processed" check.
 *
 * Only completed transactions are cached, and completion is permanent, so
 * a hit can never be stale. A miss or an unavailable Redis simply falls
 * through to the database read.
 */
@Service
@Slf4j
public class SettledTransactionCache {

    private static final String REDIS_KEY_PREFIX = "settled-transaction:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final String SETTLED = "1";

    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public SettledTransactionCache(Optional<RedisTemplate<String, String>> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public boolean isKnownSettled(UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return false;
        }
        try {
            boolean hit = SETTLED.equals(redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + transactionId));
            if (hit) {
                log.debug("Settled transaction found in Redis: {}", transactionId);
            }
            return hit;
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for transaction {}. Falling back to database. Error: {}",
                    transactionId, e.getMessage());
            return false;
        }
    }

    /**
     * Best effort: a failed write only costs a database read later.
     */
    public void rememberSettled(UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + transactionId, SETTLED, REDIS_TTL);
        } catch (RuntimeException e) {
            log.debug("Failed to cache settled transaction in Redis: {}", e.getMessage());
        }
    }
}
