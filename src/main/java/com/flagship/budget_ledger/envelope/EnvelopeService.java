package com.flagship.budget_ledger.envelope;

import com.flagship.budget_ledger.category.CategoryRepository;
import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EnvelopeService {

    private final EnvelopeRepository envelopeRepository;
    private final CategoryRepository categoryRepository;

    /**
     * @throws ValidationException if the limit is negative, the category is not part
     *                             of the budget or already has an envelope
     */
    @Transactional
    public Envelope createEnvelope(UUID budgetId, UUID categoryId, Money limit) {
        if (limit == null || limit.isNegative()) {
            throw new ValidationException("Envelope limit cannot be negative: " + limit);
        }
        if (categoryId == null || categoryRepository.findByIdAndBudgetId(categoryId, budgetId).isEmpty()) {
            throw new ValidationException("Category " + categoryId + " is not part of budget " + budgetId);
        }
        if (envelopeRepository.findByBudgetIdAndCategoryId(budgetId, categoryId).isPresent()) {
            throw new ValidationException("Category " + categoryId + " already has an envelope");
        }
        Envelope envelope = new Envelope(UUID.randomUUID(), budgetId, categoryId, limit, true);
        envelopeRepository.save(EnvelopeEntity.fromDomain(envelope));
        log.info("Created envelope {} for category {} with limit {}", envelope.getId(), categoryId, limit);
        return envelope;
    }

    /**
     * @throws NotFoundException if the envelope does not exist in the budget
     */
    @Transactional(readOnly = true)
    public Envelope getEnvelope(UUID budgetId, UUID envelopeId) {
        return envelopeRepository.findByIdAndBudgetId(envelopeId, budgetId)
            .map(EnvelopeEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Envelope", envelopeId));
    }
}
