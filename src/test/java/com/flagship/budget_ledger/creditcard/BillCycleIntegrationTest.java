package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.LedgerIntegrationSupport;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.envelope.Envelope;
import com.flagship.budget_ledger.envelope.EnvelopeUsage;
import com.flagship.budget_ledger.envelope.EnvelopeUsageCalculator;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.transaction.DateRange;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import com.flagship.budget_ledger.transaction.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Date-driven behavior against a real database: bill transitions over time and
 * period-scoped reads.
 */
class BillCycleIntegrationTest extends LedgerIntegrationSupport {

    @Autowired
    private CreditCardBillLifecycleManager lifecycleManager;

    @Autowired
    private EnvelopeUsageCalculator envelopeUsageCalculator;

    @Autowired
    private TransactionStore transactionStore;

    private CreditCardBill onlyBill(UUID cardId) {
        List<CreditCardBill> bills = ok(ledger.creditCardBills(budgetId, cardId));
        assertEquals(1, bills.size());
        return bills.get(0);
    }

    private BillCycleScheduler schedulerOn(LocalDate day) {
        Clock fixed = Clock.fixed(day.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        return new BillCycleScheduler(lifecycleManager, fixed);
    }

    @Test
    @DisplayName("Scheduler closes an elapsed bill, then flags it overdue after the due date")
    void schedulerAdvancesBill() {
        Account checking = account("Checking");
        UUID groceries = category("Groceries");
        CreditCard card = ok(ledger.createCreditCard(budgetId, "Visa", brl(500000), 10, 20));
        purchase(checking.getId(), groceries, card.getId(), 4200, LocalDate.of(2024, 3, 5));

        CreditCardBill bill = onlyBill(card.getId());
        assertEquals(BillStatus.OPEN, bill.getStatus());
        assertEquals(LocalDate.of(2024, 3, 10), bill.getClosingDate());
        assertEquals(LocalDate.of(2024, 3, 20), bill.getDueDate());

        schedulerOn(LocalDate.of(2024, 3, 10)).advanceBillCycles();
        assertEquals(BillStatus.OPEN, onlyBill(card.getId()).getStatus(), "closing day itself is still in the cycle");

        schedulerOn(LocalDate.of(2024, 3, 11)).advanceBillCycles();
        assertEquals(BillStatus.CLOSED, onlyBill(card.getId()).getStatus());

        schedulerOn(LocalDate.of(2024, 3, 21)).advanceBillCycles();
        CreditCardBill overdue = onlyBill(card.getId());
        assertEquals(BillStatus.OVERDUE, overdue.getStatus());
        assertEquals(4200, overdue.getAmount().getAmountInCents());
    }

    @Test
    @DisplayName("An OPEN bill cannot be marked overdue; a CLOSED one can")
    void markOverdueFollowsStateMachine() {
        Account checking = account("Checking");
        UUID groceries = category("Groceries");
        CreditCard card = ok(ledger.createCreditCard(budgetId, "Master", brl(500000), 15, 5));
        purchase(checking.getId(), groceries, card.getId(), 1000, LocalDate.of(2024, 6, 1));
        UUID billId = onlyBill(card.getId()).getId();

        assertThrows(ValidationException.class, () -> lifecycleManager.markOverdue(billId));

        ok(ledger.closeBill(budgetId, billId));
        assertEquals(BillStatus.OVERDUE, lifecycleManager.markOverdue(billId).getStatus());
    }

    @Test
    @DisplayName("Envelope percentage is usage over limit, and unbounded for a zero limit")
    void envelopePercentage() {
        Account checking = account("Checking");
        UUID dining = category("Dining");
        UUID gifts = category("Gifts");
        Envelope diningEnvelope = ok(ledger.createEnvelope(budgetId, dining, brl(20000)));
        Envelope giftsEnvelope = ok(ledger.createEnvelope(budgetId, gifts, brl(0)));
        LocalDate day = LocalDate.of(2024, 5, 12);
        record(checking.getId(), dining, TransactionType.EXPENSE, 5000, day);
        record(checking.getId(), gifts, TransactionType.EXPENSE, 100, day);
        DateRange may = DateRange.ofMonth(YearMonth.of(2024, 5));

        assertEquals(brl(5000), envelopeUsageCalculator.usage(diningEnvelope.getId(), may));
        assertEquals(25.0, envelopeUsageCalculator.usagePercentage(diningEnvelope.getId(), may), 0.0001);
        assertEquals(EnvelopeUsage.UNBOUNDED_PERCENTAGE,
            envelopeUsageCalculator.usagePercentage(giftsEnvelope.getId(), may));
        assertEquals(0.0, envelopeUsageCalculator.usagePercentage(diningEnvelope.getId(),
            DateRange.ofMonth(YearMonth.of(2024, 6))), 0.0001);
    }

    @Test
    @DisplayName("Account history for a period includes both bounds and is ordered by date")
    void accountHistoryByPeriod() {
        Account checking = account("Checking");
        UUID salary = category("Salary");
        UUID later = record(checking.getId(), salary, TransactionType.INCOME, 300, LocalDate.of(2024, 4, 30));
        UUID first = record(checking.getId(), salary, TransactionType.INCOME, 100, LocalDate.of(2024, 4, 1));
        record(checking.getId(), salary, TransactionType.INCOME, 200, LocalDate.of(2024, 5, 1));

        List<Transaction> april = transactionStore.findByAccountAndPeriod(checking.getId(),
            DateRange.ofMonth(YearMonth.of(2024, 4)));

        assertEquals(List.of(first, later), april.stream().map(Transaction::getId).toList());
    }
}
