package com.flagship.escrow_engine.agreement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps create-request idempotency keys to agreement IDs.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the agreements table, where the key is stored with the row
 * 3. Re-cache database hits in Redis
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:agreement:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final AgreementStore store;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(AgreementStore store,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.store = store;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the agreement created under {@code idempotencyKey}, if any
     */
    public Optional<Long> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.parseLong(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<Long> agreementId;
        try {
            agreementId = store.findIdByIdempotencyKey(idempotencyKey);
        } catch (RuntimeException e) {
            log.error("Database lookup failed for idempotency key: {}. Error: {}", idempotencyKey, e.getMessage());
            throw new IllegalStateException("Failed to check idempotency key", e);
        }

        agreementId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return agreementId;
    }

    /**
     * Caches the mapping in Redis. The agreements table stays the source of truth,
     * so a Redis failure is only logged.
     */
    public void storeIdempotencyKey(String idempotencyKey, long agreementId) {
        requireKey(idempotencyKey);
        if (agreementId <= 0) {
            throw new IllegalArgumentException("Agreement ID must be positive");
        }
        cache(idempotencyKey, agreementId);
    }

    private void cache(String idempotencyKey, long agreementId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, Long.toString(agreementId), REDIS_TTL);
                log.debug("Cached idempotency key in Redis: {} -> {}", idempotencyKey, agreementId);
            } catch (Exception e) {
                log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
