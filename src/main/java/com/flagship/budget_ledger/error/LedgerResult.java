package com.flagship.budget_ledger.error;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a public ledger operation: either a value or a {@link LedgerError}.
 *
 * Callers must branch on {@link #isSuccess()}; nothing is thrown across the
 * ledger's public boundary.
 *
 * @param <T> type of the success value ({@link Void} for operations without one)
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;

    private LedgerResult(T value, LedgerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(value, null);
    }

    public static LedgerResult<Void> done() {
        return new LedgerResult<>(null, null);
    }

    public static <T> LedgerResult<T> failure(LedgerError error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws NoSuchElementException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Result is a failure: " + error.getMessage());
        }
        return value;
    }

    /**
     * @throws NoSuchElementException if this result is a success
     */
    public LedgerError getError() {
        if (error == null) {
            throw new NoSuchElementException("Result is a success");
        }
        return error;
    }

    public boolean failedWith(LedgerErrorKind kind) {
        return error != null && error.getKind() == kind;
    }

    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new LedgerResult<>(null, error);
        }
        return new LedgerResult<>(mapper.apply(value), null);
    }

    @Override
    public String toString() {
        return error == null
            ? "LedgerResult[success=" + value + "]"
            : "LedgerResult[failure=" + error.getKind() + ": " + error.getMessage() + "]";
    }
}
