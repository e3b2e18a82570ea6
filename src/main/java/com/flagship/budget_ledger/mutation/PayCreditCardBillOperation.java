package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountBalanceCalculator;
import com.flagship.budget_ledger.creditcard.BillStatus;
import com.flagship.budget_ledger.creditcard.CreditCardBill;
import com.flagship.budget_ledger.creditcard.CreditCardBillLifecycleManager;
import com.flagship.budget_ledger.error.ImmutableBillException;
import com.flagship.budget_ledger.error.InsufficientAvailableBalanceException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.event.CreditCardBillPaidEvent;
import com.flagship.budget_ledger.idempotency.IdempotencyService;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import com.flagship.budget_ledger.transaction.TransactionStore;
import com.flagship.budget_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Settles a credit card bill from an account: records a COMPLETED EXPENSE for the
 * bill total on the paying account and marks the bill PAID, in one unit.
 *
 * Checks, in order: the bill is not already PAID, the account's available balance
 * covers the total, the bill's cycle has ended (CLOSED or OVERDUE).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayCreditCardBillOperation implements LedgerOperation<PayBillCommand, BillPaymentReceipt> {

    static final String OPERATION = "payCreditCardBill";

    private final CreditCardBillLifecycleManager billLifecycleManager;
    private final TransactionStore transactionStore;
    private final AccountBalanceCalculator balanceCalculator;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public String name() {
        return OPERATION;
    }

    @Override
    public UUID budgetOf(PayBillCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(PayBillCommand command) {
        if (command.getPayingAccountId() == null) {
            throw new ValidationException("Paying account is required");
        }
        return List.of(command.getPayingAccountId());
    }

    @Override
    public BillPaymentReceipt execute(PayBillCommand command, LockedAccounts accounts) {
        if (command.getIdempotencyKey() != null) {
            Optional<UUID> previous = idempotencyService.findPreviousResult(command.getBudgetId(), command.getIdempotencyKey());
            if (previous.isPresent()) {
                CreditCardBill bill = billLifecycleManager.getBill(command.getBudgetId(), command.getBillId());
                log.info("Bill payment replayed for idempotency key {}", command.getIdempotencyKey());
                // a zero bill is recorded under its own id: no payment transaction exists
                UUID paymentTransactionId = previous.get().equals(bill.getId()) ? null : previous.get();
                return new BillPaymentReceipt(bill.getId(), paymentTransactionId, bill.getPaidAt(), true);
            }
        }

        Account payer = accounts.getInBudget(command.getPayingAccountId(), command.getBudgetId());
        CreditCardBill bill = billLifecycleManager.getBill(command.getBudgetId(), command.getBillId());
        if (bill.isPaid()) {
            throw new ImmutableBillException("Bill " + bill.getId() + " is already paid");
        }
        bill = billLifecycleManager.recompute(bill.getId());
        Money amount = bill.getAmount();
        if (amount.getCurrency() != payer.getCurrency()) {
            throw new ValidationException(String.format(
                "Bill currency %s differs from account currency %s", amount.getCurrency(), payer.getCurrency()));
        }

        Money available = balanceCalculator.availableBalance(payer.getId());
        if (available.isLessThan(amount)) {
            throw new InsufficientAvailableBalanceException(payer.getId(), available, amount);
        }
        if (!bill.getStatus().canTransitionTo(BillStatus.PAID)) {
            throw new ValidationException(String.format(
                "Bill %s is %s; only CLOSED or OVERDUE bills can be paid", bill.getId(), bill.getStatus()));
        }

        UUID paymentTransactionId = null;
        if (amount.isPositive()) {
            LocalDate date = command.getPaymentDate() != null ? command.getPaymentDate() : LocalDate.now(clock);
            Transaction payment = transactionStore.create(NewTransaction.builder()
                .budgetId(command.getBudgetId())
                .accountId(payer.getId())
                .categoryId(command.getCategoryId())
                .amount(amount)
                .type(TransactionType.EXPENSE)
                .status(TransactionStatus.COMPLETED)
                .transactionDate(date)
                .description("Credit card bill " + bill.getPeriod())
                .build());
            paymentTransactionId = payment.getId();
        }

        CreditCardBill paid = billLifecycleManager.markPaid(bill.getId(), clock.instant());

        if (command.getIdempotencyKey() != null) {
            idempotencyService.record(command.getBudgetId(), command.getIdempotencyKey(), OPERATION,
                paymentTransactionId != null ? paymentTransactionId : paid.getId());
        }
        outboxService.saveEvent(CreditCardBillPaidEvent.of(paid, payer.getId(), paymentTransactionId));
        return new BillPaymentReceipt(paid.getId(), paymentTransactionId, paid.getPaidAt(), false);
    }
}
