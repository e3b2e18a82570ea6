package com.flagship.budget_ledger.idempotency;

import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for transfers and bill payments.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the ledger_operations table, the source of truth
 * 3. Record new keys in the table inside the mutation unit, and in Redis only
 *    once that unit has committed
 *
 * A replayed key returns the id produced by the first execution.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";

    private final ProcessedOperationRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerMetrics metrics;
    private final Duration redisTtl;

    public IdempotencyService(ProcessedOperationRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              LedgerMetrics metrics,
                              LedgerProperties properties) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.redisTtl = Duration.ofHours(properties.getIdempotency().getRedisTtlHours());
    }

    /**
     * @return id produced by the earlier execution of this key, if any
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findPreviousResult(UUID budgetId, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(budgetId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    metrics.recordIdempotencyHit();
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = repository.findByBudgetIdAndIdempotencyKey(budgetId, idempotencyKey)
            .map(ProcessedOperationEntity::getResultId);
        if (stored.isPresent()) {
            metrics.recordIdempotencyHit();
            cache(redisKey, stored.get());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Records the key inside the caller's mutation unit; rolled back with it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(UUID budgetId, String idempotencyKey, String operation, UUID resultId) {
        requireKey(idempotencyKey);
        repository.save(ProcessedOperationEntity.of(budgetId, idempotencyKey, operation, resultId));

        String redisKey = redisKey(budgetId, idempotencyKey);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(redisKey, resultId);
            }
        });
    }

    private void cache(String redisKey, UUID resultId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(redisKey, resultId.toString(), redisTtl);
            } catch (Exception e) {
                // the table already holds the key
                log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
            }
        });
    }

    private static String redisKey(UUID budgetId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + budgetId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
    }
}
