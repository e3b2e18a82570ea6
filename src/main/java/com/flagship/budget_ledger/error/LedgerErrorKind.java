package com.flagship.budget_ledger.error;

/**
 * Kinds of failure the ledger reports to its callers.
 *
 * Only {@link #CONCURRENCY_CONFLICT} is worth retrying automatically; every other
 * kind is terminal for the request that produced it.
 */
public enum LedgerErrorKind {
    /** Malformed input: non-positive amount, missing or foreign reference. */
    VALIDATION,
    /** Referenced aggregate does not exist or belongs to another budget. */
    NOT_FOUND,
    /** A structurally impossible state was detected, e.g. two OPEN bills. */
    INVARIANT_VIOLATION,
    /** Attempt to change a PAID credit card bill. */
    IMMUTABLE_BILL,
    /** Reservation or payment exceeds the account's available balance. */
    INSUFFICIENT_AVAILABLE_BALANCE,
    /** Goal amount would leave [0, target] or the goal is not ACTIVE. */
    INVALID_GOAL_STATE,
    /** Account deletion blocked by an ACTIVE goal. */
    GOAL_STILL_ATTACHED,
    /** Lock or version conflict; the caller may retry. */
    CONCURRENCY_CONFLICT,
    /** Unexpected failure in the middle of a unit; the unit was rolled back. */
    TRANSFER_EXECUTION;

    public boolean isRetryable() {
        return this == CONCURRENCY_CONFLICT;
    }
}
