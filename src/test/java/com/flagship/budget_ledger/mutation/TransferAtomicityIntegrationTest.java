package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.LedgerIntegrationSupport;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerResult;
import com.flagship.budget_ledger.event.TransferCompletedEvent;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import com.flagship.budget_ledger.transaction.TransferDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.reset;

/**
 * A crash between the two legs of a transfer must leave no trace: no outgoing leg,
 * no outbox event, no consumed idempotency key.
 */
class TransferAtomicityIntegrationTest extends LedgerIntegrationSupport {

    @SpyBean
    private TransactionStore transactionStore;

    @Autowired
    private OutboxService outboxService;

    private int transactionCount(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE account_id = ?", Integer.class, accountId);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Failure on the incoming leg rolls back the outgoing leg")
    void secondLegFailureRollsBackEverything() {
        UUID category = category("Transfers");
        Account from = account("Checking");
        Account to = account("Savings");
        income(from.getId(), category, 10_000);

        doAnswer(invocation -> {
            NewTransaction request = invocation.getArgument(0);
            if (request.getTransferDirection() == TransferDirection.IN) {
                throw new IllegalStateException("simulated crash between legs");
            }
            return invocation.callRealMethod();
        }).when(transactionStore).create(any());

        TransferCommand command = TransferCommand.builder()
            .budgetId(budgetId)
            .fromAccountId(from.getId())
            .toAccountId(to.getId())
            .amount(brl(4_000))
            .categoryId(category)
            .idempotencyKey("crash-once")
            .build();

        LedgerResult<TransferReceipt> failed = ledger.transferBetweenAccounts(command);

        assertTrue(failed.failedWith(LedgerErrorKind.TRANSFER_EXECUTION));
        assertTrue(failed.getError().isRolledBack());
        assertEquals(1, transactionCount(from.getId()));
        assertEquals(0, transactionCount(to.getId()));
        assertEquals(brl(10_000), ok(ledger.totalBalance(budgetId, from.getId())));
        assertTrue(outboxService.getEventsOfType(budgetId, TransferCompletedEvent.EVENT_TYPE).isEmpty());

        reset(transactionStore);
        TransferReceipt retried = ok(ledger.transferBetweenAccounts(command));

        assertFalse(retried.isReplayed());
        assertEquals(brl(6_000), ok(ledger.totalBalance(budgetId, from.getId())));
        assertEquals(brl(4_000), ok(ledger.totalBalance(budgetId, to.getId())));
    }
}
