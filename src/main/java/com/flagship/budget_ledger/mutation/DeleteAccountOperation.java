package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.creditcard.CreditCardBill;
import com.flagship.budget_ledger.creditcard.CreditCardBillLifecycleManager;
import com.flagship.budget_ledger.error.GoalStillAttachedException;
import com.flagship.budget_ledger.event.AccountDeletedEvent;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalReservationManager;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Deletes an account with its transactions and inactive goals.
 *
 * Rejected with GOAL_STILL_ATTACHED while an ACTIVE goal reserves part of the
 * account. Bills that contained the account's card purchases are recomputed;
 * a PAID bill that would change aborts the whole deletion.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeleteAccountOperation implements LedgerOperation<DeleteAccountCommand, AccountDeletion> {

    private final AccountService accountService;
    private final TransactionStore transactionStore;
    private final GoalReservationManager goalReservationManager;
    private final CreditCardBillLifecycleManager billLifecycleManager;
    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public String name() {
        return "deleteAccount";
    }

    @Override
    public UUID budgetOf(DeleteAccountCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(DeleteAccountCommand command) {
        return List.of(accountService.getAccount(command.getBudgetId(), command.getAccountId()).getId());
    }

    @Override
    public AccountDeletion execute(DeleteAccountCommand command, LockedAccounts accounts) {
        Account account = accounts.getInBudget(command.getAccountId(), command.getBudgetId());

        List<UUID> activeGoalIds = goalReservationManager.activeGoalsOf(account.getId()).stream()
            .map(Goal::getId)
            .toList();
        if (!activeGoalIds.isEmpty()) {
            throw new GoalStillAttachedException(account.getId(), activeGoalIds);
        }

        // one date per card cycle is enough to find each affected bill
        Map<UUID, Set<LocalDate>> purchaseDatesByCard = new LinkedHashMap<>();
        for (Transaction tx : transactionStore.findByAccount(account.getId())) {
            if (tx.isCreditCardPurchase()) {
                purchaseDatesByCard.computeIfAbsent(tx.getCreditCardId(), id -> new LinkedHashSet<>())
                    .add(tx.getTransactionDate());
            }
        }

        int deletedGoals = goalReservationManager.deleteInactiveGoalsOf(account.getId());
        int deletedTransactions = transactionStore.deleteByAccount(account.getId());

        Set<UUID> recomputedBillIds = new LinkedHashSet<>();
        purchaseDatesByCard.forEach((cardId, dates) -> dates.forEach(date ->
            billLifecycleManager.recomputeFor(cardId, date)
                .map(CreditCardBill::getId)
                .ifPresent(recomputedBillIds::add)));

        accountService.delete(account.getId());

        List<UUID> billIds = List.copyOf(recomputedBillIds);
        outboxService.saveEvent(new AccountDeletedEvent(UUID.randomUUID(), account.getBudgetId(), account.getId(),
            deletedTransactions, deletedGoals, billIds, clock.instant()));
        log.info("Account {} deleted with {} transactions and {} goals; {} bills recomputed",
            account.getId(), deletedTransactions, deletedGoals, billIds.size());
        return new AccountDeletion(account.getId(), deletedTransactions, deletedGoals, billIds);
    }
}
