package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.creditcard.CreditCardBill;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a bill is paid. Links the bill to the payment transaction on the
 * paying account.
 */
@Value
public class CreditCardBillPaidEvent implements LedgerEvent {
    UUID eventId;
    UUID budgetId;
    UUID billId;
    UUID creditCardId;
    UUID payingAccountId;
    UUID paymentTransactionId;
    long amountInCents;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditCardBillPaid";

    @Override
    public UUID getAggregateId() {
        return billId;
    }

    @Override
    public String getAggregateType() {
        return "CreditCardBill";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CreditCardBillPaidEvent of(CreditCardBill bill, UUID payingAccountId, UUID paymentTransactionId) {
        return new CreditCardBillPaidEvent(UUID.randomUUID(), bill.getBudgetId(), bill.getId(),
            bill.getCreditCardId(), payingAccountId, paymentTransactionId,
            bill.getAmount().getAmountInCents(), bill.getAmount().getCurrency().name(), bill.getPaidAt());
    }
}
