package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Registers credit cards and resolves them for the other ledger components.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditCardService {

    private final CreditCardRepository creditCardRepository;

    /**
     * @throws ValidationException if the name is blank, the limit is not positive
     *                             or a day falls outside 1..31
     */
    @Transactional
    public CreditCard createCreditCard(UUID budgetId, String name, Money creditLimit,
                                       int closingDay, int dueDay) {
        if (budgetId == null) {
            throw new ValidationException("Budget id is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Credit card name is required");
        }
        if (creditLimit == null || !creditLimit.isPositive()) {
            throw new ValidationException("Credit limit must be positive: " + creditLimit);
        }
        if (closingDay < 1 || closingDay > 31) {
            throw new ValidationException("Closing day must be between 1 and 31: " + closingDay);
        }
        if (dueDay < 1 || dueDay > 31) {
            throw new ValidationException("Due day must be between 1 and 31: " + dueDay);
        }

        CreditCard card = new CreditCard(UUID.randomUUID(), budgetId, name.trim(), creditLimit,
            closingDay, dueDay);
        creditCardRepository.save(CreditCardEntity.fromDomain(card));
        log.info("Created credit card {} (closing day {}, due day {}) in budget {}",
            card.getId(), closingDay, dueDay, budgetId);
        return card;
    }

    @Transactional(readOnly = true)
    public CreditCard getCard(UUID cardId) {
        return creditCardRepository.findById(cardId)
            .map(CreditCardEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Credit card", cardId));
    }

    /**
     * @throws NotFoundException if the card does not exist in the given budget
     */
    @Transactional(readOnly = true)
    public CreditCard getCard(UUID budgetId, UUID cardId) {
        return creditCardRepository.findByIdAndBudgetId(cardId, budgetId)
            .map(CreditCardEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Credit card", cardId));
    }
}
