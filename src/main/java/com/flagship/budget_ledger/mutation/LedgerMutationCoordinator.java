package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.error.ConcurrencyConflictException;
import com.flagship.budget_ledger.error.LedgerError;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.error.LedgerResult;
import com.flagship.budget_ledger.error.TransferExecutionException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.observability.LedgerContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Runs multi-aggregate mutations as all-or-nothing units.
 *
 * Each unit:
 * 1. Opens a fresh database transaction (READ_COMMITTED, bounded by a timeout)
 * 2. Sets the unit's lock_timeout
 * 3. Locks every account the operation declares, in ascending id order, so two
 *    units touching the same accounts can never deadlock
 * 4. Runs the operation; outbox events and idempotency records are written by the
 *    operation in the same transaction
 * 5. Commits
 *
 * Any exception rolls the unit back completely. Lock and version conflicts re-run
 * the whole unit a bounded number of times. Whatever still fails is returned as a
 * {@link LedgerResult} failure: ledger errors keep their kind, anything unexpected
 * becomes TRANSFER_EXECUTION. Nothing is thrown to the caller.
 */
@Component
@Slf4j
public class LedgerMutationCoordinator {

    private static final String UNIQUE_VIOLATION = "23505";

    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final LedgerMetrics metrics;
    private final long lockTimeoutMs;

    public LedgerMutationCoordinator(@Qualifier("ledgerTransactionTemplate") TransactionTemplate transactionTemplate,
                                     @Qualifier("ledgerRetryTemplate") RetryTemplate retryTemplate,
                                     JdbcTemplate jdbcTemplate,
                                     AccountService accountService,
                                     LedgerMetrics metrics,
                                     LedgerProperties properties) {
        this.transactionTemplate = transactionTemplate;
        this.retryTemplate = retryTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
        this.metrics = metrics;
        this.lockTimeoutMs = properties.getMutation().getLockTimeoutMs();
    }

    public <C, T> LedgerResult<T> execute(LedgerOperation<C, T> operation, C command) {
        Objects.requireNonNull(operation, "operation");
        long startedAt = System.nanoTime();
        UUID budgetId = command != null ? operation.budgetOf(command) : null;

        try (LedgerContext.Scope ignored = LedgerContext.open(operation.name(), budgetId)) {
            try {
                T value = retryTemplate.execute(context -> {
                    if (context.getRetryCount() > 0) {
                        metrics.recordConflictRetry();
                        log.warn("Retrying {} after concurrency conflict (attempt {}): {}",
                            operation.name(), context.getRetryCount() + 1, describe(context.getLastThrowable()));
                    }
                    return runUnit(operation, command);
                });
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                metrics.recordCommitted(operation.name(), elapsed);
                log.info("{} committed in {} ms", operation.name(), elapsed.toMillis());
                return LedgerResult.success(value);
            } catch (LedgerException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                metrics.recordFailed(operation.name(), e.getKind(), elapsed);
                if (e instanceof TransferExecutionException) {
                    log.error("{} failed and was rolled back", operation.name(), e);
                } else {
                    log.warn("{} rejected ({}): {}", operation.name(), e.getKind(), e.getMessage());
                }
                return LedgerResult.failure(LedgerError.from(e, true));
            }
        }
    }

    /**
     * One attempt. Translates every failure into a {@link LedgerException}.
     */
    private <C, T> T runUnit(LedgerOperation<C, T> operation, C command) {
        try {
            return transactionTemplate.execute(status -> {
                if (command == null) {
                    throw new ValidationException(operation.name() + " requires a command");
                }
                applyLockTimeout();
                LockedAccounts locked = lockInOrder(operation.accountsToLock(command));
                log.debug("{} holds locks on {} account(s)", operation.name(), locked.size());
                return operation.execute(command, locked);
            });
        } catch (LedgerException e) {
            throw e;
        } catch (ConcurrencyFailureException e) {
            throw new ConcurrencyConflictException(operation.name() + " hit a lock or version conflict", e);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                // a concurrent unit inserted the same bill period, OPEN bill or idempotency key
                throw new ConcurrencyConflictException(operation.name() + " lost a race on a unique key", e);
            }
            throw new TransferExecutionException(operation.name(), e);
        } catch (IllegalArgumentException e) {
            // Money rejects mixed currencies this way
            throw new ValidationException(e.getMessage());
        } catch (RuntimeException e) {
            throw new TransferExecutionException(operation.name(), e);
        }
    }

    private void applyLockTimeout() {
        // SET LOCAL does not accept bind parameters; the value is a validated long
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
    }

    private LockedAccounts lockInOrder(Collection<UUID> accountIds) {
        SortedSet<UUID> ordered = new TreeSet<>();
        accountIds.stream().filter(Objects::nonNull).forEach(ordered::add);

        Map<UUID, Account> locked = new LinkedHashMap<>();
        for (UUID accountId : ordered) {
            locked.put(accountId, accountService.lockForUpdate(accountId));
        }
        return new LockedAccounts(locked);
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable t) {
        return t == null ? "unknown" : t.getMessage();
    }
}
