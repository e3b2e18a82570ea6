package com.flagship.budget_ledger.config;

import com.flagship.budget_ledger.error.ConcurrencyConflictException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Infrastructure beans of the mutation coordinator.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One mutation unit. READ_COMMITTED: once a unit holds an account lock, every
     * later read sees what the previous lock holder committed.
     */
    @Bean
    public TransactionTemplate ledgerTransactionTemplate(PlatformTransactionManager transactionManager,
                                                         LedgerProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setTimeout(properties.getMutation().getTimeoutSeconds());
        template.setName("ledger-mutation");
        return template;
    }

    /**
     * Re-runs a whole unit after a lock or version conflict, with exponential backoff.
     * Nothing else is retried.
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(LedgerProperties properties) {
        LedgerProperties.Mutation mutation = properties.getMutation();
        return RetryTemplate.builder()
            .maxAttempts(mutation.getMaxAttempts())
            .exponentialBackoff(mutation.getInitialBackoffMs(), mutation.getBackoffMultiplier(),
                mutation.getMaxBackoffMs())
            .retryOn(ConcurrencyConflictException.class)
            .build();
    }
}
