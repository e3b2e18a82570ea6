package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.creditcard.CreditCardBillLifecycleManager;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.transaction.StatusChange;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Moves a transaction along its status machine and recomputes the bill of a card
 * purchase, which fails on a PAID bill whose total would change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpdateTransactionStatusOperation implements LedgerOperation<TransactionStatusCommand, Transaction> {

    private final TransactionStore transactionStore;
    private final CreditCardBillLifecycleManager billLifecycleManager;

    @Override
    public String name() {
        return "updateTransactionStatus";
    }

    @Override
    public UUID budgetOf(TransactionStatusCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(TransactionStatusCommand command) {
        // a transaction never changes account, so the unlocked read is stable
        return List.of(transactionStore.get(command.getBudgetId(), command.getTransactionId()).getAccountId());
    }

    @Override
    public Transaction execute(TransactionStatusCommand command, LockedAccounts accounts) {
        if (command.getNewStatus() == null) {
            throw new ValidationException("Target status is required");
        }
        StatusChange change = transactionStore.updateStatus(
            command.getBudgetId(), command.getTransactionId(), command.getNewStatus());
        Transaction updated = change.getAfter();

        if (updated.isCreditCardPurchase()) {
            billLifecycleManager.recomputeFor(updated.getCreditCardId(), updated.getTransactionDate());
        }
        if (change.affectsBalance()) {
            log.debug("Balance of account {} changed by {}", updated.getAccountId(), updated.signedAmount());
        }
        return updated;
    }
}
