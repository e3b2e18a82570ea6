package com.flagship.budget_ledger.error;

import com.flagship.budget_ledger.money.Money;
import lombok.Getter;

import java.util.UUID;

/**
 * The account's available balance (total minus active goal reservations) does not
 * cover the requested reservation or payment.
 */
@Getter
public class InsufficientAvailableBalanceException extends LedgerException {

    private final UUID accountId;
    private final Money available;
    private final Money requested;

    public InsufficientAvailableBalanceException(UUID accountId, Money available, Money requested) {
        super(LedgerErrorKind.INSUFFICIENT_AVAILABLE_BALANCE,
            String.format("Account %s has available balance %s, %s requested",
                accountId, available, requested));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }
}
