package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.LedgerIntegrationSupport;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.creditcard.CreditCard;
import com.flagship.budget_ledger.creditcard.CreditCardBill;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerResult;
import com.flagship.budget_ledger.goal.Goal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races between units touching the same account. Account row locks serialize them,
 * so every outcome matches some sequential order.
 */
class ConcurrentMutationIntegrationTest extends LedgerIntegrationSupport {

    private <T> List<LedgerResult<T>> race(List<Callable<LedgerResult<T>>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LedgerResult<T>>> futures = new ArrayList<>();
            for (Callable<LedgerResult<T>> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<LedgerResult<T>> results = new ArrayList<>();
            for (Future<LedgerResult<T>> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static long successes(List<? extends LedgerResult<?>> results) {
        return results.stream().filter(LedgerResult::isSuccess).count();
    }

    @Test
    @DisplayName("Two reservations of 6000 against 10000 available: exactly one succeeds")
    void concurrentGoalReservations() throws Exception {
        UUID category = category("Salary");
        Account account = account("Checking");
        income(account.getId(), category, 10_000);
        Goal trip = ok(ledger.createGoal(budgetId, "Trip", brl(50_000), LocalDate.now().plusYears(1), account.getId()));
        Goal car = ok(ledger.createGoal(budgetId, "Car", brl(50_000), LocalDate.now().plusYears(1), account.getId()));

        List<Callable<LedgerResult<Goal>>> tasks = List.of(
            () -> ledger.addAmountToGoal(budgetId, trip.getId(), brl(6_000)),
            () -> ledger.addAmountToGoal(budgetId, car.getId(), brl(6_000)));

        List<LedgerResult<Goal>> results = race(tasks);

        assertEquals(1, successes(results));
        assertTrue(results.stream().anyMatch(r -> r.failedWith(LedgerErrorKind.INSUFFICIENT_AVAILABLE_BALANCE)));
        assertEquals(brl(4_000), ok(ledger.availableBalance(budgetId, account.getId())));
    }

    @Test
    @DisplayName("Ten transfers of 2000 from 10000: five succeed and the balance never goes negative")
    void concurrentTransfers() throws Exception {
        UUID category = category("Transfers");
        Account from = account("Checking");
        Account to = account("Savings");
        income(from.getId(), category, 10_000);

        List<Callable<LedgerResult<TransferReceipt>>> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(() -> ledger.transferBetweenAccounts(TransferCommand.builder()
                .budgetId(budgetId)
                .fromAccountId(from.getId())
                .toAccountId(to.getId())
                .amount(brl(2_000))
                .categoryId(category)
                .build()));
        }

        List<LedgerResult<TransferReceipt>> results = race(tasks);

        assertEquals(5, successes(results));
        assertEquals(brl(0), ok(ledger.totalBalance(budgetId, from.getId())));
        assertEquals(brl(10_000), ok(ledger.totalBalance(budgetId, to.getId())));
    }

    @Test
    @DisplayName("Opposite transfers between the same pair of accounts do not deadlock")
    void opposingTransfers() throws Exception {
        UUID category = category("Transfers");
        Account a = account("A");
        Account b = account("B");
        income(a.getId(), category, 10_000);
        income(b.getId(), category, 10_000);

        List<Callable<LedgerResult<TransferReceipt>>> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            boolean forward = i % 2 == 0;
            tasks.add(() -> ledger.transferBetweenAccounts(TransferCommand.builder()
                .budgetId(budgetId)
                .fromAccountId(forward ? a.getId() : b.getId())
                .toAccountId(forward ? b.getId() : a.getId())
                .amount(brl(1_000))
                .categoryId(category)
                .build()));
        }

        List<LedgerResult<TransferReceipt>> results = race(tasks);

        assertEquals(6, successes(results));
        assertEquals(brl(10_000), ok(ledger.totalBalance(budgetId, a.getId())));
        assertEquals(brl(10_000), ok(ledger.totalBalance(budgetId, b.getId())));
    }

    @Test
    @DisplayName("Two payments of the same bill: one pays, the other sees a PAID bill")
    void concurrentBillPayments() throws Exception {
        UUID category = category("Card");
        Account account = account("Checking");
        income(account.getId(), category, 50_000);
        CreditCard card = ok(ledger.createCreditCard(budgetId, "Gold", brl(1_000_000), 10, 20));
        purchase(account.getId(), category, card.getId(), 7_000, LocalDate.of(2026, 3, 5));
        CreditCardBill bill = ok(ledger.creditCardBills(budgetId, card.getId())).get(0);
        ok(ledger.closeBill(budgetId, bill.getId()));

        PayBillCommand pay = PayBillCommand.builder()
            .budgetId(budgetId)
            .billId(bill.getId())
            .payingAccountId(account.getId())
            .categoryId(category)
            .build();
        List<Callable<LedgerResult<BillPaymentReceipt>>> tasks = List.of(
            () -> ledger.payCreditCardBill(pay),
            () -> ledger.payCreditCardBill(pay));

        List<LedgerResult<BillPaymentReceipt>> results = race(tasks);

        assertEquals(1, successes(results));
        assertTrue(results.stream().anyMatch(r -> r.failedWith(LedgerErrorKind.IMMUTABLE_BILL)));
        assertEquals(brl(36_000), ok(ledger.totalBalance(budgetId, account.getId())));
    }
}
