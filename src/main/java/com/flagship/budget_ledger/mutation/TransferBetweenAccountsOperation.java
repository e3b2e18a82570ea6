package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountBalanceCalculator;
import com.flagship.budget_ledger.error.InsufficientAvailableBalanceException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.event.TransferCompletedEvent;
import com.flagship.budget_ledger.idempotency.IdempotencyService;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import com.flagship.budget_ledger.transaction.TransactionStore;
import com.flagship.budget_ledger.transaction.TransactionType;
import com.flagship.budget_ledger.transaction.TransferDirection;
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
 * Moves money between two accounts as a pair of COMPLETED TRANSFER transactions
 * sharing one transfer group id: OUT on the source, IN on the destination.
 *
 * Either both legs commit or neither does. The source's available balance (after
 * goal reservations) must cover the amount.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferBetweenAccountsOperation implements LedgerOperation<TransferCommand, TransferReceipt> {

    static final String OPERATION = "transferBetweenAccounts";

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
    public UUID budgetOf(TransferCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(TransferCommand command) {
        if (command.getFromAccountId() == null || command.getToAccountId() == null) {
            throw new ValidationException("Transfer needs both a source and a destination account");
        }
        if (command.getFromAccountId().equals(command.getToAccountId())) {
            throw new ValidationException("Cannot transfer from an account to itself: " + command.getFromAccountId());
        }
        return List.of(command.getFromAccountId(), command.getToAccountId());
    }

    @Override
    public TransferReceipt execute(TransferCommand command, LockedAccounts accounts) {
        if (command.getIdempotencyKey() != null) {
            Optional<UUID> previous = idempotencyService.findPreviousResult(command.getBudgetId(), command.getIdempotencyKey());
            if (previous.isPresent()) {
                log.info("Transfer replayed for idempotency key {}", command.getIdempotencyKey());
                return replay(previous.get());
            }
        }

        Money amount = command.getAmount();
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Transfer amount must be positive: " + amount);
        }
        Account from = accounts.getInBudget(command.getFromAccountId(), command.getBudgetId());
        Account to = accounts.getInBudget(command.getToAccountId(), command.getBudgetId());
        if (from.getCurrency() != to.getCurrency() || from.getCurrency() != amount.getCurrency()) {
            throw new ValidationException(String.format(
                "Transfer of %s between %s and %s accounts is not supported",
                amount, from.getCurrency(), to.getCurrency()));
        }

        Money available = balanceCalculator.availableBalance(from.getId());
        if (available.isLessThan(amount)) {
            throw new InsufficientAvailableBalanceException(from.getId(), available, amount);
        }

        UUID transferGroupId = UUID.randomUUID();
        LocalDate date = command.getTransactionDate() != null ? command.getTransactionDate() : LocalDate.now(clock);
        Transaction outgoing = transactionStore.create(leg(command, from.getId(), TransferDirection.OUT, transferGroupId, date));
        Transaction incoming = transactionStore.create(leg(command, to.getId(), TransferDirection.IN, transferGroupId, date));

        if (command.getIdempotencyKey() != null) {
            idempotencyService.record(command.getBudgetId(), command.getIdempotencyKey(), OPERATION, transferGroupId);
        }
        outboxService.saveEvent(TransferCompletedEvent.of(command.getBudgetId(), transferGroupId, from.getId(), to.getId(),
            outgoing.getId(), incoming.getId(), amount, clock.instant()));

        return new TransferReceipt(transferGroupId, outgoing.getId(), incoming.getId(), false);
    }

    private static NewTransaction leg(TransferCommand command, UUID accountId, TransferDirection direction,
                                      UUID transferGroupId, LocalDate date) {
        return NewTransaction.builder()
            .budgetId(command.getBudgetId())
            .accountId(accountId)
            .categoryId(command.getCategoryId())
            .amount(command.getAmount())
            .type(TransactionType.TRANSFER)
            .transferDirection(direction)
            .transferGroupId(transferGroupId)
            .status(TransactionStatus.COMPLETED)
            .transactionDate(date)
            .description(command.getDescription())
            .build();
    }

    private TransferReceipt replay(UUID transferGroupId) {
        List<Transaction> legs = transactionStore.findByTransferGroup(transferGroupId);
        UUID outgoing = legs.stream()
            .filter(tx -> tx.getTransferDirection() == TransferDirection.OUT)
            .map(Transaction::getId)
            .findFirst()
            .orElse(null);
        UUID incoming = legs.stream()
            .filter(tx -> tx.getTransferDirection() == TransferDirection.IN)
            .map(Transaction::getId)
            .findFirst()
            .orElse(null);
        return new TransferReceipt(transferGroupId, outgoing, incoming, true);
    }
}
