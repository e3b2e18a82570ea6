package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Moves a transaction to another category. Envelope usage follows on the next
 * read since it is derived; balances and bill totals do not depend on categories.
 */
@Component
@RequiredArgsConstructor
public class ReclassifyTransactionOperation implements LedgerOperation<ReclassifyCommand, Transaction> {

    private final TransactionStore transactionStore;

    @Override
    public String name() {
        return "reclassifyTransaction";
    }

    @Override
    public UUID budgetOf(ReclassifyCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(ReclassifyCommand command) {
        return List.of(transactionStore.get(command.getBudgetId(), command.getTransactionId()).getAccountId());
    }

    @Override
    public Transaction execute(ReclassifyCommand command, LockedAccounts accounts) {
        return transactionStore.reclassify(command.getBudgetId(), command.getTransactionId(), command.getNewCategoryId());
    }
}
