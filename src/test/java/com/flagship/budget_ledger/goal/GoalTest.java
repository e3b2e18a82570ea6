package com.flagship.budget_ledger.goal;

import com.flagship.budget_ledger.error.InvalidGoalStateException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GoalTest {

    private static Money brl(long cents) {
        return Money.ofCents(cents, CurrencyCode.BRL);
    }

    private static Goal goal(long current, GoalStatus status) {
        return new Goal(UUID.randomUUID(), UUID.randomUUID(), "Trip", brl(10_000), brl(current),
            LocalDate.of(2027, 1, 1), UUID.randomUUID(), status);
    }

    @Nested
    @DisplayName("Reserved amount stays within [0, target]")
    class Amounts {

        @Test
        void addAndRemove() {
            Goal goal = goal(2_000, GoalStatus.ACTIVE).add(brl(3_000)).remove(brl(1_000));

            assertEquals(brl(4_000), goal.getCurrentAmount());
            assertEquals(brl(6_000), goal.remaining());
        }

        @Test
        void cannotExceedTarget() {
            assertThrows(InvalidGoalStateException.class, () -> goal(9_000, GoalStatus.ACTIVE).add(brl(1_001)));
            assertEquals(brl(10_000), goal(9_000, GoalStatus.ACTIVE).add(brl(1_000)).getCurrentAmount());
        }

        @Test
        void cannotGoBelowZero() {
            assertThrows(InvalidGoalStateException.class, () -> goal(500, GoalStatus.ACTIVE).remove(brl(501)));
        }

        @Test
        void amountsMustBePositive() {
            assertThrows(ValidationException.class, () -> goal(0, GoalStatus.ACTIVE).add(brl(0)));
            assertThrows(ValidationException.class, () -> goal(100, GoalStatus.ACTIVE).remove(brl(-1)));
        }

        @Test
        @DisplayName("Only ACTIVE goals accept new money")
        void onlyActiveGoalsGrow() {
            assertThrows(InvalidGoalStateException.class, () -> goal(0, GoalStatus.PAUSED).add(brl(100)));
            assertEquals(brl(0), goal(100, GoalStatus.PAUSED).remove(brl(100)).getCurrentAmount());
            assertThrows(InvalidGoalStateException.class, () -> goal(100, GoalStatus.CANCELLED).remove(brl(100)));
        }
    }

    @Nested
    class Status {

        @Test
        void allowedTransitions() {
            assertTrue(GoalStatus.ACTIVE.canTransitionTo(GoalStatus.PAUSED));
            assertTrue(GoalStatus.PAUSED.canTransitionTo(GoalStatus.ACTIVE));
            assertTrue(GoalStatus.PAUSED.canTransitionTo(GoalStatus.CANCELLED));
            assertFalse(GoalStatus.COMPLETED.canTransitionTo(GoalStatus.ACTIVE));
            assertFalse(GoalStatus.CANCELLED.canTransitionTo(GoalStatus.PAUSED));
            assertTrue(GoalStatus.COMPLETED.isTerminal());
        }

        @Test
        void rejectsInvalidTransition() {
            Goal completed = goal(10_000, GoalStatus.ACTIVE).withStatus(GoalStatus.COMPLETED);

            assertEquals(GoalStatus.COMPLETED, completed.getStatus());
            assertThrows(InvalidGoalStateException.class, () -> completed.withStatus(GoalStatus.ACTIVE));
        }

        @Test
        void moveKeepsTheReservation() {
            UUID newAccount = UUID.randomUUID();
            Goal moved = goal(3_000, GoalStatus.ACTIVE).moveTo(newAccount);

            assertEquals(newAccount, moved.getSourceAccountId());
            assertEquals(brl(3_000), moved.getCurrentAmount());
        }
    }
}
