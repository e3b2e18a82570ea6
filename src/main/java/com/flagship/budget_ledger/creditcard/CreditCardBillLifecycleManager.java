package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.error.ImmutableBillException;
import com.flagship.budget_ledger.error.InvariantViolationException;
import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Keeps credit card bills in step with the card's transactions.
 *
 * Key principles:
 * - A bill's amount is recomputed from the cycle's COMPLETED and SCHEDULED card
 *   transactions every time it is touched; it is never adjusted by a delta
 * - A card has at most one OPEN bill. A purchase in a later cycle closes the
 *   current OPEN bill; a purchase back-dated into an earlier, missing cycle
 *   creates that bill directly as CLOSED
 * - PAID bills are immutable: any change that would alter their total fails
 *   with {@link ImmutableBillException}
 *
 * Every write joins the caller's transaction when one is active.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditCardBillLifecycleManager {

    private static final Comparator<CreditCardBillEntity> BY_PERIOD =
        Comparator.comparingInt(CreditCardBillEntity::getPeriodYear)
            .thenComparingInt(CreditCardBillEntity::getPeriodMonth);

    private final CreditCardBillRepository billRepository;
    private final CreditCardService creditCardService;
    private final TransactionStore transactionStore;

    /**
     * Fails fast when a purchase dated {@code date} would land on a PAID bill.
     * Called before the purchase is inserted.
     *
     * @throws ImmutableBillException if the cycle's bill is already PAID
     */
    @Transactional(readOnly = true)
    public void ensureBillAcceptsPurchase(UUID cardId, LocalDate date) {
        CreditCard card = creditCardService.getCard(cardId);
        BillingCycle cycle = BillingCycle.forPurchase(card, date);
        findBill(card, cycle)
            .filter(bill -> bill.getStatus() == BillStatus.PAID)
            .ifPresent(bill -> {
                throw new ImmutableBillException(String.format(
                    "Bill %s for card %s period %s is already paid", bill.getId(), cardId, cycle.getPeriod()));
            });
    }

    /**
     * Attaches a newly recorded card purchase to its bill, creating the bill when
     * the cycle has none yet.
     *
     * @return id of the bill the purchase belongs to
     * @throws ImmutableBillException       if the cycle's bill is PAID
     * @throws InvariantViolationException  if the card already has more than one OPEN bill
     */
    @Transactional
    public UUID onTransactionCreated(UUID cardId, LocalDate date, Money amount) {
        CreditCard card = creditCardService.getCard(cardId);
        if (amount.getCurrency() != card.getCurrency()) {
            throw new ValidationException(String.format(
                "Purchase currency %s differs from card currency %s", amount.getCurrency(), card.getCurrency()));
        }
        BillingCycle cycle = BillingCycle.forPurchase(card, date);

        Optional<CreditCardBillEntity> existing = findBill(card, cycle);
        if (existing.isPresent()) {
            CreditCardBillEntity entity = existing.get();
            if (entity.getStatus() == BillStatus.PAID) {
                throw new ImmutableBillException(String.format(
                    "Bill %s for card %s period %s is already paid", entity.getId(), cardId, cycle.getPeriod()));
            }
            CreditCardBill updated = recompute(entity, card);
            log.debug("Purchase of {} on {} added to bill {} (total {})", amount, date, updated.getId(), updated.getAmount());
            return updated.getId();
        }

        BillStatus initialStatus = resolveStatusForNewBill(card, cycle);
        CreditCardBill bill = CreditCardBill.create(card, cycle, cycleTotal(card, cycle), initialStatus);
        billRepository.save(CreditCardBillEntity.fromDomain(bill));
        log.info("Created {} bill {} for card {} period {} (closes {}, due {}, total {})",
            initialStatus, bill.getId(), cardId, cycle.getPeriod(), cycle.getClosingDate(),
            cycle.getDueDate(), bill.getAmount());
        return bill.getId();
    }

    /**
     * Recomputes the total of the bill covering {@code date}, if that bill exists.
     * Used after card transactions change status or disappear.
     */
    @Transactional
    public Optional<CreditCardBill> recomputeFor(UUID cardId, LocalDate date) {
        CreditCard card = creditCardService.getCard(cardId);
        BillingCycle cycle = BillingCycle.forPurchase(card, date);
        return findBill(card, cycle).map(entity -> recompute(entity, card));
    }

    /**
     * @throws ImmutableBillException if the bill is PAID and its total would change
     */
    @Transactional
    public CreditCardBill recompute(UUID billId) {
        CreditCardBillEntity entity = loadBill(billId);
        return recompute(entity, creditCardService.getCard(entity.getCreditCardId()));
    }

    @Transactional(readOnly = true)
    public CreditCardBill getBill(UUID budgetId, UUID billId) {
        return billRepository.findByIdAndBudgetId(billId, budgetId)
            .map(CreditCardBillEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Credit card bill", billId));
    }

    @Transactional(readOnly = true)
    public List<CreditCardBill> billsOf(UUID cardId) {
        return billRepository.findByCreditCardIdOrderByPeriodYearAscPeriodMonthAsc(cardId)
            .stream()
            .map(CreditCardBillEntity::toDomain)
            .toList();
    }

    @Transactional
    public CreditCardBill closeBill(UUID billId) {
        return transition(billId, CreditCardBill::close);
    }

    @Transactional
    public CreditCardBill markOverdue(UUID billId) {
        return transition(billId, CreditCardBill::markOverdue);
    }

    /**
     * Settles the bill. Paying an OPEN bill is rejected: its cycle has not ended.
     */
    @Transactional
    public CreditCardBill markPaid(UUID billId, Instant paidAt) {
        return transition(billId, bill -> bill.markPaid(paidAt));
    }

    /**
     * Closes every OPEN bill whose closing date is before {@code today}.
     *
     * @return number of bills closed
     */
    @Transactional
    public int closeElapsedBills(LocalDate today) {
        List<CreditCardBillEntity> elapsed = billRepository.findByStatusAndClosingDateBefore(BillStatus.OPEN, today);
        elapsed.forEach(entity -> apply(entity, CreditCardBill::close));
        return elapsed.size();
    }

    /**
     * Marks every CLOSED bill whose due date is before {@code today} as OVERDUE.
     *
     * @return number of bills marked
     */
    @Transactional
    public int markOverdueBills(LocalDate today) {
        List<CreditCardBillEntity> late = billRepository.findByStatusAndDueDateBefore(BillStatus.CLOSED, today);
        late.forEach(entity -> apply(entity, CreditCardBill::markOverdue));
        return late.size();
    }

    private BillStatus resolveStatusForNewBill(CreditCard card, BillingCycle cycle) {
        List<CreditCardBillEntity> open = billRepository.findByCreditCardIdAndStatus(card.getId(), BillStatus.OPEN);
        if (open.size() > 1) {
            throw new InvariantViolationException(String.format(
                "Credit card %s has %d OPEN bills", card.getId(), open.size()));
        }

        Optional<CreditCardBillEntity> latest = billRepository
            .findByCreditCardIdOrderByPeriodYearAscPeriodMonthAsc(card.getId())
            .stream()
            .max(BY_PERIOD);
        if (latest.isPresent() && isAfter(latest.get(), cycle)) {
            return BillStatus.CLOSED;
        }

        open.forEach(older -> {
            apply(older, CreditCardBill::close);
            log.info("Closed bill {} of card {}: a later cycle ({}) started", older.getId(), card.getId(), cycle.getPeriod());
        });
        if (!open.isEmpty()) {
            // the close must reach the one-OPEN-bill index before the new bill's insert
            billRepository.flush();
        }
        return BillStatus.OPEN;
    }

    private static boolean isAfter(CreditCardBillEntity bill, BillingCycle cycle) {
        return bill.getPeriodYear() > cycle.getPeriod().getYear()
            || (bill.getPeriodYear() == cycle.getPeriod().getYear()
                && bill.getPeriodMonth() > cycle.getPeriod().getMonthValue());
    }

    private CreditCardBill recompute(CreditCardBillEntity entity, CreditCard card) {
        CreditCardBill bill = entity.toDomain();
        BillingCycle cycle = BillingCycle.forPeriod(card, bill.getPeriod());
        CreditCardBill updated = bill.withAmount(cycleTotal(card, cycle));
        entity.updateFromDomain(updated);
        billRepository.save(entity);
        return updated;
    }

    private Money cycleTotal(CreditCard card, BillingCycle cycle) {
        return transactionStore.findByCreditCardAndPeriod(card.getId(), cycle.getRange())
            .stream()
            .filter(tx -> tx.getStatus().countsTowardBill())
            .map(Transaction::getAmount)
            .reduce(Money.zero(card.getCurrency()), Money::plus);
    }

    private Optional<CreditCardBillEntity> findBill(CreditCard card, BillingCycle cycle) {
        return billRepository.findByCreditCardIdAndPeriodYearAndPeriodMonth(
            card.getId(), cycle.getPeriod().getYear(), cycle.getPeriod().getMonthValue());
    }

    private CreditCardBillEntity loadBill(UUID billId) {
        return billRepository.findById(billId)
            .orElseThrow(() -> NotFoundException.of("Credit card bill", billId));
    }

    private CreditCardBill transition(UUID billId, UnaryOperator<CreditCardBill> change) {
        return apply(loadBill(billId), change);
    }

    private CreditCardBill apply(CreditCardBillEntity entity, UnaryOperator<CreditCardBill> change) {
        CreditCardBill before = entity.toDomain();
        CreditCardBill after = change.apply(before);
        entity.updateFromDomain(after);
        billRepository.save(entity);
        log.info("Bill {} moved {} -> {}", after.getId(), before.getStatus(), after.getStatus());
        return after;
    }
}
