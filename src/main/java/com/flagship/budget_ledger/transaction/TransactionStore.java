package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.account.AccountEntity;
import com.flagship.budget_ledger.account.AccountRepository;
import com.flagship.budget_ledger.category.CategoryRepository;
import com.flagship.budget_ledger.creditcard.CreditCardEntity;
import com.flagship.budget_ledger.creditcard.CreditCardRepository;
import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Persistence and validation of transactions.
 *
 * Key principles:
 * - Only validated transactions reach the database
 * - After insert only status and category may change
 * - Derived values (balances, bill totals, envelope usage) are never touched here;
 *   the mutation operations trigger whatever recomputation a change needs
 *
 * Writes use REQUIRED propagation: they join a mutation unit when one is open and
 * otherwise run in their own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionStore {

    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final CreditCardRepository creditCardRepository;

    /**
     * Validates and records a transaction.
     *
     * @return id of the new transaction
     * @throws ValidationException if the amount is not positive, type and transfer
     *                             direction disagree, the currency differs from the
     *                             account's, or a referenced account, category or card
     *                             is missing or belongs to another budget
     */
    @Transactional
    public Transaction create(NewTransaction request) {
        validate(request);

        UUID id = UUID.randomUUID();
        TransactionEntity saved = transactionRepository.save(TransactionEntity.fromRequest(id, request));
        log.debug("Recorded {} {} of {} on account {} dated {}",
            request.getStatus(), request.getType(), request.getAmount(), request.getAccountId(),
            request.getTransactionDate());
        return saved.toDomain();
    }

    /**
     * @throws NotFoundException   if no such transaction exists in the budget
     * @throws ValidationException if the status machine forbids the transition
     */
    @Transactional
    public StatusChange updateStatus(UUID budgetId, UUID transactionId, TransactionStatus newStatus) {
        TransactionEntity entity = load(budgetId, transactionId);
        Transaction before = entity.toDomain();
        Transaction after = before.withStatus(newStatus);

        entity.updateFromDomain(after);
        transactionRepository.save(entity);
        log.debug("Transaction {} moved {} -> {}", transactionId, before.getStatus(), newStatus);
        return new StatusChange(before, after);
    }

    /**
     * Moves a transaction to another category of the same budget. Amount, account
     * and date stay as they were.
     *
     * @throws ValidationException if the category is not part of the budget or the
     *                             transaction is CANCELLED
     */
    @Transactional
    public Transaction reclassify(UUID budgetId, UUID transactionId, UUID newCategoryId) {
        TransactionEntity entity = load(budgetId, transactionId);
        requireCategory(budgetId, newCategoryId);
        Transaction updated = entity.toDomain().reclassify(newCategoryId);

        entity.updateFromDomain(updated);
        transactionRepository.save(entity);
        log.debug("Transaction {} reclassified to category {}", transactionId, newCategoryId);
        return updated;
    }

    @Transactional(readOnly = true)
    public Transaction get(UUID budgetId, UUID transactionId) {
        return load(budgetId, transactionId).toDomain();
    }

    /**
     * Transactions of an account dated within {@code range}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Transaction> findByAccountAndPeriod(UUID accountId, DateRange range) {
        return toDomain(transactionRepository.findByAccountAndPeriod(accountId, range.getStart(), range.getEnd()));
    }

    /**
     * Transactions charged to a card dated within {@code range}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Transaction> findByCreditCardAndPeriod(UUID creditCardId, DateRange range) {
        return toDomain(transactionRepository.findByCreditCardAndPeriod(creditCardId, range.getStart(), range.getEnd()));
    }

    @Transactional(readOnly = true)
    public List<Transaction> findByAccount(UUID accountId) {
        return toDomain(transactionRepository.findByAccountId(accountId));
    }

    @Transactional(readOnly = true)
    public List<Transaction> findByTransferGroup(UUID transferGroupId) {
        return toDomain(transactionRepository.findByTransferGroupId(transferGroupId));
    }

    /**
     * Removes every transaction of the account. Only account deletion calls this.
     */
    @Transactional
    public int deleteByAccount(UUID accountId) {
        int deleted = transactionRepository.deleteByAccountId(accountId);
        log.debug("Deleted {} transactions of account {}", deleted, accountId);
        return deleted;
    }

    /**
     * Runs the checks {@link #create} applies, without writing anything.
     *
     * @throws ValidationException as described on {@link #create}
     */
    @Transactional(readOnly = true)
    public void validate(NewTransaction request) {
        if (request.getBudgetId() == null) {
            throw new ValidationException("Budget id is required");
        }
        if (request.getAmount() == null || !request.getAmount().isPositive()) {
            throw new ValidationException("Transaction amount must be positive: " + request.getAmount());
        }
        if (request.getType() == null) {
            throw new ValidationException("Transaction type is required");
        }
        if (request.getTransactionDate() == null) {
            throw new ValidationException("Transaction date is required");
        }
        if (request.getStatus() == null || request.getStatus() == TransactionStatus.CANCELLED) {
            throw new ValidationException("A transaction cannot be created as " + request.getStatus());
        }
        boolean isTransfer = request.getType() == TransactionType.TRANSFER;
        if (isTransfer != (request.getTransferDirection() != null)) {
            throw new ValidationException(isTransfer
                ? "Transfer direction is required for TRANSFER transactions"
                : "Transfer direction is only allowed on TRANSFER transactions");
        }

        AccountEntity account = accountRepository.findByIdAndBudgetId(request.getAccountId(), request.getBudgetId())
            .orElseThrow(() -> new ValidationException(
                "Account " + request.getAccountId() + " is not part of budget " + request.getBudgetId()));
        if (account.getCurrency() != request.getAmount().getCurrency()) {
            throw new ValidationException(String.format(
                "Transaction currency %s differs from account currency %s",
                request.getAmount().getCurrency(), account.getCurrency()));
        }

        requireCategory(request.getBudgetId(), request.getCategoryId());

        if (request.getCreditCardId() != null) {
            if (request.getType() != TransactionType.EXPENSE) {
                throw new ValidationException("Only EXPENSE transactions can be charged to a credit card");
            }
            // a purchase must land on its bill's total
            if (!request.getStatus().countsTowardBill()) {
                throw new ValidationException("A card purchase cannot be created as " + request.getStatus());
            }
            CreditCardEntity card = creditCardRepository.findByIdAndBudgetId(request.getCreditCardId(), request.getBudgetId())
                .orElseThrow(() -> new ValidationException(
                    "Credit card " + request.getCreditCardId() + " is not part of budget " + request.getBudgetId()));
            if (card.getCurrency() != request.getAmount().getCurrency()) {
                throw new ValidationException(String.format(
                    "Transaction currency %s differs from card currency %s",
                    request.getAmount().getCurrency(), card.getCurrency()));
            }
        }
    }

    private void requireCategory(UUID budgetId, UUID categoryId) {
        if (categoryId == null || categoryRepository.findByIdAndBudgetId(categoryId, budgetId).isEmpty()) {
            throw new ValidationException("Category " + categoryId + " is not part of budget " + budgetId);
        }
    }

    private TransactionEntity load(UUID budgetId, UUID transactionId) {
        return transactionRepository.findByIdAndBudgetId(transactionId, budgetId)
            .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
    }

    private static List<Transaction> toDomain(List<TransactionEntity> entities) {
        return entities.stream().map(TransactionEntity::toDomain).toList();
    }
}
