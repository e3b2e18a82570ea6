package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.util.UUID;

/**
 * Both legs of a committed transfer. {@code replayed} is true when an earlier
 * request with the same idempotency key produced them.
 */
@Value
public class TransferReceipt {
    UUID transferGroupId;
    UUID outgoingTransactionId;
    UUID incomingTransactionId;
    boolean replayed;
}
