package com.flagship.budget_ledger.envelope;

import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.DateRange;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionEntity;
import com.flagship.budget_ledger.transaction.TransactionRepository;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import com.flagship.budget_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Derives how much of an envelope has been spent in a period.
 *
 * Usage is the sum of COMPLETED EXPENSE transactions of the envelope's budget and
 * category dated within the period, both ends inclusive. The period is always
 * supplied by the caller. Transactions in a category without an envelope are
 * simply not counted anywhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnvelopeUsageCalculator {

    private final EnvelopeRepository envelopeRepository;
    private final TransactionRepository transactionRepository;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Money usage(UUID envelopeId, DateRange period) {
        return usage(load(envelopeId), period);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public double usagePercentage(UUID envelopeId, DateRange period) {
        Envelope envelope = load(envelopeId);
        return EnvelopeUsage.percentageOf(usage(envelope, period), envelope.getLimit());
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public EnvelopeUsage summarize(UUID envelopeId, DateRange period) {
        Envelope envelope = load(envelopeId);
        return EnvelopeUsage.of(envelope.getId(), period, usage(envelope, period), envelope.getLimit());
    }

    /**
     * Usage of the envelope covering {@code categoryId}, or empty when the category
     * has no envelope.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Optional<EnvelopeUsage> usageForCategory(UUID budgetId, UUID categoryId, DateRange period) {
        return envelopeRepository.findByBudgetIdAndCategoryId(budgetId, categoryId)
            .map(EnvelopeEntity::toDomain)
            .map(envelope -> EnvelopeUsage.of(envelope.getId(), period, usage(envelope, period), envelope.getLimit()));
    }

    private Money usage(Envelope envelope, DateRange period) {
        Money zero = Money.zero(envelope.getLimit().getCurrency());
        return transactionRepository.findForCategoryUsage(
                envelope.getBudgetId(), envelope.getCategoryId(),
                TransactionType.EXPENSE, TransactionStatus.COMPLETED,
                period.getStart(), period.getEnd())
            .stream()
            .map(TransactionEntity::toDomain)
            .map(Transaction::getAmount)
            .filter(amount -> {
                boolean sameCurrency = amount.getCurrency() == zero.getCurrency();
                if (!sameCurrency) {
                    log.debug("Envelope {} ignores {} expense", envelope.getId(), amount.getCurrency());
                }
                return sameCurrency;
            })
            .reduce(zero, Money::plus);
    }

    private Envelope load(UUID envelopeId) {
        return envelopeRepository.findById(envelopeId)
            .map(EnvelopeEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Envelope", envelopeId));
    }
}
