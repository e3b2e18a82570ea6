package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.error.ConcurrencyConflictException;
import com.flagship.budget_ledger.error.NotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Accounts whose row locks the current unit holds.
 */
public final class LockedAccounts {

    private final Map<UUID, Account> accounts;

    LockedAccounts(Map<UUID, Account> accounts) {
        this.accounts = Collections.unmodifiableMap(new LinkedHashMap<>(accounts));
    }

    public boolean contains(UUID accountId) {
        return accounts.containsKey(accountId);
    }

    /**
     * @throws ConcurrencyConflictException if the account was not locked by this unit,
     *                                      which happens when a goal moved between
     *                                      planning and locking
     */
    public Account get(UUID accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new ConcurrencyConflictException(
                "Account " + accountId + " is not locked by this unit; it changed while locks were taken", null);
        }
        return account;
    }

    /**
     * @throws NotFoundException if the locked account lives in another budget
     */
    public Account getInBudget(UUID accountId, UUID budgetId) {
        Account account = get(accountId);
        if (!account.belongsTo(budgetId)) {
            throw NotFoundException.of("Account", accountId);
        }
        return account;
    }

    public int size() {
        return accounts.size();
    }
}
