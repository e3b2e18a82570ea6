package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalEntity;
import com.flagship.budget_ledger.goal.GoalRepository;
import com.flagship.budget_ledger.goal.GoalStatus;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionEntity;
import com.flagship.budget_ledger.transaction.TransactionRepository;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import com.flagship.budget_ledger.transaction.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountBalanceCalculatorTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private GoalRepository goalRepository;

    private AccountBalanceCalculator calculator;
    private AccountEntity account;

    @BeforeEach
    void setUp() {
        calculator = new AccountBalanceCalculator(accountRepository, transactionRepository, goalRepository);
        account = AccountEntity.create(UUID.randomUUID(), "Checking", AccountType.CHECKING, CurrencyCode.BRL);
    }

    private static Money brl(long cents) {
        return Money.ofCents(cents, CurrencyCode.BRL);
    }

    private TransactionEntity completed(TransactionType type, long cents, UUID creditCardId) {
        Transaction tx = new Transaction(UUID.randomUUID(), account.getBudgetId(), account.getId(), UUID.randomUUID(),
            creditCardId, brl(cents), type, null, null, TransactionStatus.COMPLETED,
            LocalDate.of(2026, 3, 1), "", Instant.now());
        TransactionEntity entity = mock(TransactionEntity.class);
        when(entity.toDomain()).thenReturn(tx);
        return entity;
    }

    private GoalEntity activeGoal(long cents) {
        Goal goal = new Goal(UUID.randomUUID(), account.getBudgetId(), "Goal", brl(100_000), brl(cents),
            LocalDate.of(2027, 1, 1), account.getId(), GoalStatus.ACTIVE);
        GoalEntity entity = mock(GoalEntity.class);
        when(entity.toDomain()).thenReturn(goal);
        return entity;
    }

    @Test
    @DisplayName("Total is the signed sum of COMPLETED transactions: +10000 and -3000 give 7000")
    void totalBalance() {
        List<TransactionEntity> history = List.of(completed(TransactionType.INCOME, 10_000, null),
            completed(TransactionType.EXPENSE, 3_000, null));
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.findByAccountIdAndStatus(account.getId(), TransactionStatus.COMPLETED))
            .thenReturn(history);

        assertEquals(brl(7_000), calculator.totalBalance(account.getId()));
    }

    @Test
    @DisplayName("A COMPLETED card purchase counts against its account: 10000 - 3000 = 7000")
    void cardPurchasesCountAgainstAccount() {
        List<TransactionEntity> history = List.of(completed(TransactionType.INCOME, 10_000, null),
            completed(TransactionType.EXPENSE, 3_000, UUID.randomUUID()));
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.findByAccountIdAndStatus(account.getId(), TransactionStatus.COMPLETED))
            .thenReturn(history);

        assertEquals(brl(7_000), calculator.totalBalance(account.getId()));
    }

    @Test
    @DisplayName("Available balance subtracts ACTIVE goal reservations: 7000 - 2000 = 5000")
    void availableBalance() {
        List<TransactionEntity> history = List.of(completed(TransactionType.INCOME, 10_000, null),
            completed(TransactionType.EXPENSE, 3_000, null));
        List<GoalEntity> goals = List.of(activeGoal(2_000));
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.findByAccountIdAndStatus(account.getId(), TransactionStatus.COMPLETED))
            .thenReturn(history);
        when(goalRepository.findBySourceAccountIdAndStatus(account.getId(), GoalStatus.ACTIVE))
            .thenReturn(goals);

        assertEquals(brl(5_000), calculator.availableBalance(account.getId()));
    }

    @Test
    void emptyAccountIsZero() {
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.findByAccountIdAndStatus(account.getId(), TransactionStatus.COMPLETED))
            .thenReturn(List.of());

        assertTrue(calculator.totalBalance(account.getId()).isZero());
    }

    @Test
    void unknownAccount() {
        UUID missing = UUID.randomUUID();
        when(accountRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> calculator.totalBalance(missing));
    }
}
