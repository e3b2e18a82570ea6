package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.creditcard.CreditCardBillLifecycleManager;
import com.flagship.budget_ledger.event.TransactionRecordedEvent;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Records a transaction. A credit card purchase also creates or recomputes its
 * bill in the same unit, so a purchase never exists without an up-to-date bill.
 */
@Component
@RequiredArgsConstructor
public class CreateTransactionOperation implements LedgerOperation<NewTransaction, Transaction> {

    private final TransactionStore transactionStore;
    private final CreditCardBillLifecycleManager billLifecycleManager;
    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public String name() {
        return "createTransaction";
    }

    @Override
    public UUID budgetOf(NewTransaction command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(NewTransaction command) {
        // reject foreign or unknown references before waiting for any lock
        transactionStore.validate(command);
        return List.of(command.getAccountId());
    }

    @Override
    public Transaction execute(NewTransaction command, LockedAccounts accounts) {
        if (command.getCreditCardId() != null) {
            billLifecycleManager.ensureBillAcceptsPurchase(command.getCreditCardId(), command.getTransactionDate());
        }

        Transaction recorded = transactionStore.create(command);

        UUID billId = null;
        if (recorded.isCreditCardPurchase()) {
            billId = billLifecycleManager.onTransactionCreated(
                recorded.getCreditCardId(), recorded.getTransactionDate(), recorded.getAmount());
        }

        outboxService.saveEvent(TransactionRecordedEvent.of(recorded, billId, clock.instant()));
        return recorded;
    }
}
