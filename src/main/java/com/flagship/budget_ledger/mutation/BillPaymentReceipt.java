package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a bill payment. {@code paymentTransactionId} is null for a bill whose
 * total was zero: nothing had to leave the account.
 */
@Value
public class BillPaymentReceipt {
    UUID billId;
    UUID paymentTransactionId;
    Instant paidAt;
    boolean replayed;
}
