package com.flagship.budget_ledger.config;

import com.flagship.budget_ledger.money.CurrencyCode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under the {@code ledger} prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /** Currency used when a caller does not name one. */
    @NotNull
    private CurrencyCode defaultCurrency = CurrencyCode.BRL;

    @Valid
    private Mutation mutation = new Mutation();

    @Valid
    private Kafka kafka = new Kafka();

    @Valid
    private Outbox outbox = new Outbox();

    @Valid
    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Mutation {
        /** Attempts per unit, the first one included. */
        @Min(1)
        private int maxAttempts = 3;
        @Min(1)
        private long initialBackoffMs = 50;
        private double backoffMultiplier = 2.0;
        @Min(1)
        private long maxBackoffMs = 1000;
        /** Longest wait for an account row lock before the unit fails with a conflict. */
        @Min(1)
        private long lockTimeoutMs = 3000;
        /** Transaction timeout of one unit. */
        @Min(1)
        private int timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Kafka {
        @NotBlank
        private String topic = "ledger-events";
        @Min(1)
        private int partitions = 3;
    }

    @Getter
    @Setter
    public static class Outbox {
        @Min(1)
        private int batchSize = 100;
        @Min(1)
        private int maxRetries = 5;
    }

    @Getter
    @Setter
    public static class Idempotency {
        @Min(1)
        private long redisTtlHours = 24 * 7;
    }
}
