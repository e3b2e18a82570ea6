package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalEntity;
import com.flagship.budget_ledger.goal.GoalRepository;
import com.flagship.budget_ledger.goal.GoalStatus;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionEntity;
import com.flagship.budget_ledger.transaction.TransactionRepository;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Derives account balances from transaction history.
 *
 * Balances are derived, not stored:
 * - total = signed sum of the account's COMPLETED transactions
 * - available = total minus the reservations of ACTIVE goals sourced from the account
 *
 * Every transaction counts against the one account it names, card purchases included.
 *
 * Standalone calls read a REPEATABLE_READ snapshot so a concurrently committing
 * transfer is either fully visible or not at all. Inside a mutation unit the caller
 * already holds the account's row lock.
 */
@Service
@RequiredArgsConstructor
public class AccountBalanceCalculator {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final GoalRepository goalRepository;

    /**
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Money totalBalance(UUID accountId) {
        AccountEntity account = load(accountId);
        return transactionRepository.findByAccountIdAndStatus(accountId, TransactionStatus.COMPLETED)
            .stream()
            .map(TransactionEntity::toDomain)
            .map(Transaction::signedAmount)
            .reduce(Money.zero(account.getCurrency()), Money::plus);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Money reservedByActiveGoals(UUID accountId) {
        AccountEntity account = load(accountId);
        return goalRepository.findBySourceAccountIdAndStatus(accountId, GoalStatus.ACTIVE)
            .stream()
            .map(GoalEntity::toDomain)
            .map(Goal::getCurrentAmount)
            .reduce(Money.zero(account.getCurrency()), Money::plus);
    }

    /**
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Money availableBalance(UUID accountId) {
        return totalBalance(accountId).minus(reservedByActiveGoals(accountId));
    }

    private AccountEntity load(UUID accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }
}
