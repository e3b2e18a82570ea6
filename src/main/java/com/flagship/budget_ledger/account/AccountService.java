package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates, resolves, locks and removes accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    @Transactional
    public Account createAccount(UUID budgetId, String name, AccountType type, CurrencyCode currency) {
        if (budgetId == null) {
            throw new ValidationException("Budget id is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (type == null || currency == null) {
            throw new ValidationException("Account type and currency are required");
        }
        AccountEntity saved = accountRepository.save(AccountEntity.create(budgetId, name.trim(), type, currency));
        log.info("Created {} account {} ({}) in budget {}", type, saved.getId(), currency, budgetId);
        return saved.toDomain();
    }

    /**
     * @throws NotFoundException if the account does not exist in the budget
     */
    @Transactional(readOnly = true)
    public Account getAccount(UUID budgetId, UUID accountId) {
        return accountRepository.findByIdAndBudgetId(accountId, budgetId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    /**
     * Takes the account's row lock for the rest of the surrounding transaction.
     *
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockForUpdate(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    /**
     * Removes the account row. Callers remove what references it first.
     */
    @Transactional
    public void delete(UUID accountId) {
        AccountEntity entity = accountRepository.findById(accountId)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
        accountRepository.delete(entity);
        log.info("Deleted account {} of budget {}", accountId, entity.getBudgetId());
    }
}
