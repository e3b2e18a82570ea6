package com.flagship.budget_ledger.goal;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountBalanceCalculator;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.error.InsufficientAvailableBalanceException;
import com.flagship.budget_ledger.error.InvalidGoalStateException;
import com.flagship.budget_ledger.error.NotFoundException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Manages goal reservations against their source accounts.
 *
 * Key principles:
 * - The sum of ACTIVE reservations never exceeds the source account's total
 *   balance: every increase is checked against the available balance first
 * - The check and the write happen in one mutation unit that holds the source
 *   account's row lock, so two concurrent reservations cannot both pass it
 * - Moving a goal to another account re-checks the reservation on the new account
 *   before the reference changes, in the same unit
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalReservationManager {

    private final GoalRepository goalRepository;
    private final AccountService accountService;
    private final AccountBalanceCalculator balanceCalculator;
    private final Clock clock;

    /**
     * @throws ValidationException if the target is not positive, the target date is
     *                             not in the future or the currency differs from the account's
     * @throws NotFoundException   if the source account is not part of the budget
     */
    @Transactional
    public Goal createGoal(UUID budgetId, String name, Money targetAmount, LocalDate targetDate, UUID sourceAccountId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Goal name is required");
        }
        if (targetAmount == null || !targetAmount.isPositive()) {
            throw new ValidationException("Goal target must be positive: " + targetAmount);
        }
        if (targetDate == null || !targetDate.isAfter(LocalDate.now(clock))) {
            throw new ValidationException("Goal target date must be in the future: " + targetDate);
        }
        Account account = accountService.getAccount(budgetId, sourceAccountId);
        if (account.getCurrency() != targetAmount.getCurrency()) {
            throw new ValidationException(String.format(
                "Goal currency %s differs from account currency %s", targetAmount.getCurrency(), account.getCurrency()));
        }

        Goal goal = new Goal(UUID.randomUUID(), budgetId, name.trim(), targetAmount,
            Money.zero(targetAmount.getCurrency()), targetDate, sourceAccountId, GoalStatus.ACTIVE);
        goalRepository.save(GoalEntity.fromDomain(goal));
        log.info("Created goal {} (target {}) on account {}", goal.getId(), targetAmount, sourceAccountId);
        return goal;
    }

    @Transactional(readOnly = true)
    public Goal getGoal(UUID budgetId, UUID goalId) {
        return goalRepository.findByIdAndBudgetId(goalId, budgetId)
            .map(GoalEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Goal", goalId));
    }

    /**
     * Reserves {@code amount} more of the source account's balance. Run inside a unit
     * holding the source account's lock.
     *
     * @throws InsufficientAvailableBalanceException if the account cannot cover the reservation
     * @throws InvalidGoalStateException             if the goal is not ACTIVE or the target would be exceeded
     */
    @Transactional
    public Goal addAmount(UUID budgetId, UUID goalId, Money amount) {
        GoalEntity entity = load(budgetId, goalId);
        Goal updated = entity.toDomain().add(amount);

        Money available = balanceCalculator.availableBalance(updated.getSourceAccountId());
        if (available.isLessThan(amount)) {
            throw new InsufficientAvailableBalanceException(updated.getSourceAccountId(), available, amount);
        }

        return save(entity, updated, "added " + amount);
    }

    /**
     * Releases part of the reservation back to the source account.
     *
     * @throws InvalidGoalStateException if the amount would go below zero
     */
    @Transactional
    public Goal removeAmount(UUID budgetId, UUID goalId, Money amount) {
        GoalEntity entity = load(budgetId, goalId);
        Goal updated = entity.toDomain().remove(amount);
        return save(entity, updated, "removed " + amount);
    }

    /**
     * Moves the goal and its reservation to another account of the same budget. Run
     * inside a unit holding both accounts' locks.
     *
     * @throws ValidationException                   if the account is the current one or uses another currency
     * @throws InsufficientAvailableBalanceException if the new account cannot cover the reservation
     */
    @Transactional
    public Goal transferToAccount(UUID budgetId, UUID goalId, UUID newAccountId) {
        GoalEntity entity = load(budgetId, goalId);
        Goal goal = entity.toDomain();
        if (goal.getStatus().isTerminal()) {
            throw new InvalidGoalStateException(String.format("Goal %s is %s", goalId, goal.getStatus()));
        }
        if (goal.getSourceAccountId().equals(newAccountId)) {
            throw new ValidationException("Goal " + goalId + " is already sourced from account " + newAccountId);
        }
        Account target = accountService.getAccount(budgetId, newAccountId);
        if (target.getCurrency() != goal.getCurrentAmount().getCurrency()) {
            throw new ValidationException(String.format(
                "Goal currency %s differs from account currency %s",
                goal.getCurrentAmount().getCurrency(), target.getCurrency()));
        }
        if (goal.isActive()) {
            requireAvailable(newAccountId, goal.getCurrentAmount());
        }
        return save(entity, goal.moveTo(newAccountId), "moved from account " + goal.getSourceAccountId());
    }

    /**
     * Re-activating a goal takes its reservation back, so the source account must
     * be able to cover it again. An ACTIVE goal's target date lies in the future.
     *
     * @throws InvalidGoalStateException if the status machine forbids the transition
     *                                   or the target date of a goal being re-activated has passed
     */
    @Transactional
    public Goal changeStatus(UUID budgetId, UUID goalId, GoalStatus newStatus) {
        GoalEntity entity = load(budgetId, goalId);
        Goal goal = entity.toDomain();
        Goal updated = goal.withStatus(newStatus);
        if (newStatus == GoalStatus.ACTIVE) {
            if (!goal.getTargetDate().isAfter(LocalDate.now(clock))) {
                throw new InvalidGoalStateException(String.format(
                    "Goal %s cannot be re-activated: target date %s has passed", goal.getId(), goal.getTargetDate()));
            }
            requireAvailable(goal.getSourceAccountId(), goal.getCurrentAmount());
        }
        return save(entity, updated, goal.getStatus() + " -> " + newStatus);
    }

    @Transactional(readOnly = true)
    public List<Goal> activeGoalsOf(UUID accountId) {
        return goalRepository.findBySourceAccountIdAndStatus(accountId, GoalStatus.ACTIVE).stream()
            .map(GoalEntity::toDomain)
            .toList();
    }

    /**
     * Deletes the account's goals that no longer reserve anything. Fails if any is ACTIVE.
     */
    @Transactional
    public int deleteInactiveGoalsOf(UUID accountId) {
        List<GoalEntity> goals = goalRepository.findBySourceAccountId(accountId);
        if (goals.stream().anyMatch(g -> g.getStatus() == GoalStatus.ACTIVE)) {
            throw new InvalidGoalStateException("Account " + accountId + " still has ACTIVE goals");
        }
        goalRepository.deleteAll(goals);
        return goals.size();
    }

    private void requireAvailable(UUID accountId, Money reservation) {
        Money available = balanceCalculator.availableBalance(accountId);
        if (available.isLessThan(reservation)) {
            throw new InsufficientAvailableBalanceException(accountId, available, reservation);
        }
    }

    private Goal save(GoalEntity entity, Goal updated, String change) {
        entity.updateFromDomain(updated);
        goalRepository.save(entity);
        log.info("Goal {}: {} (current {}, account {}, status {})", updated.getId(), change,
            updated.getCurrentAmount(), updated.getSourceAccountId(), updated.getStatus());
        return updated;
    }

    private GoalEntity load(UUID budgetId, UUID goalId) {
        return goalRepository.findByIdAndBudgetId(goalId, budgetId)
            .orElseThrow(() -> NotFoundException.of("Goal", goalId));
    }
}
