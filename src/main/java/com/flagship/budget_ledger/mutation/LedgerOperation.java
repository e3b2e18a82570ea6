package com.flagship.budget_ledger.mutation;

import java.util.Collection;
import java.util.UUID;

/**
 * One kind of multi-aggregate mutation run by {@link LedgerMutationCoordinator}.
 *
 * The coordinator calls {@link #accountsToLock} inside the unit before any lock is
 * held, locks those accounts in ascending id order, then calls {@link #execute}.
 * Anything {@code execute} throws rolls back the whole unit.
 *
 * @param <C> command type
 * @param <T> result type
 */
public interface LedgerOperation<C, T> {

    String name();

    UUID budgetOf(C command);

    /**
     * Accounts whose balance the command reads or changes. May read current state;
     * {@code execute} must re-check anything that could have moved before the locks
     * were granted.
     */
    Collection<UUID> accountsToLock(C command);

    T execute(C command, LockedAccounts accounts);
}
