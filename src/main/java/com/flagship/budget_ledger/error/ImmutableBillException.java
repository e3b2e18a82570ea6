package com.flagship.budget_ledger.error;

/**
 * A PAID bill cannot gain, lose or change transactions.
 */
public class ImmutableBillException extends LedgerException {

    public ImmutableBillException(String message) {
        super(LedgerErrorKind.IMMUTABLE_BILL, message);
    }
}
