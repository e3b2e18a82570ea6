package com.flagship.budget_ledger.error;

import lombok.Builder;
import lombok.Value;

/**
 * Failure half of a {@link LedgerResult}.
 *
 * {@code rolledBack} is true when the failure happened inside a mutation unit and
 * every write staged by that unit was discarded.
 */
@Value
@Builder
public class LedgerError {
    LedgerErrorKind kind;
    String message;
    boolean rolledBack;
    Throwable cause;

    public static LedgerError from(LedgerException e, boolean rolledBack) {
        return LedgerError.builder()
            .kind(e.getKind())
            .message(e.getMessage())
            .rolledBack(rolledBack)
            .cause(e)
            .build();
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
