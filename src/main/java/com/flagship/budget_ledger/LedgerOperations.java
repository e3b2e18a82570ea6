package com.flagship.budget_ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountBalanceCalculator;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.creditcard.CreditCard;
import com.flagship.budget_ledger.creditcard.CreditCardBill;
import com.flagship.budget_ledger.creditcard.CreditCardBillLifecycleManager;
import com.flagship.budget_ledger.creditcard.CreditCardService;
import com.flagship.budget_ledger.envelope.Envelope;
import com.flagship.budget_ledger.envelope.EnvelopeService;
import com.flagship.budget_ledger.envelope.EnvelopeUsage;
import com.flagship.budget_ledger.envelope.EnvelopeUsageCalculator;
import com.flagship.budget_ledger.error.LedgerError;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.error.LedgerResult;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalReservationManager;
import com.flagship.budget_ledger.goal.GoalStatus;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.mutation.AccountDeletion;
import com.flagship.budget_ledger.mutation.AddAmountToGoalOperation;
import com.flagship.budget_ledger.mutation.BillPaymentReceipt;
import com.flagship.budget_ledger.mutation.ChangeGoalStatusOperation;
import com.flagship.budget_ledger.mutation.CreateTransactionOperation;
import com.flagship.budget_ledger.mutation.DeleteAccountCommand;
import com.flagship.budget_ledger.mutation.DeleteAccountOperation;
import com.flagship.budget_ledger.mutation.GoalAmountCommand;
import com.flagship.budget_ledger.mutation.GoalStatusCommand;
import com.flagship.budget_ledger.mutation.LedgerMutationCoordinator;
import com.flagship.budget_ledger.mutation.PayBillCommand;
import com.flagship.budget_ledger.mutation.PayCreditCardBillOperation;
import com.flagship.budget_ledger.mutation.ReclassifyCommand;
import com.flagship.budget_ledger.mutation.ReclassifyTransactionOperation;
import com.flagship.budget_ledger.mutation.RemoveAmountFromGoalOperation;
import com.flagship.budget_ledger.mutation.TransactionStatusCommand;
import com.flagship.budget_ledger.mutation.TransferBetweenAccountsOperation;
import com.flagship.budget_ledger.mutation.TransferCommand;
import com.flagship.budget_ledger.mutation.TransferGoalCommand;
import com.flagship.budget_ledger.mutation.TransferGoalToAccountOperation;
import com.flagship.budget_ledger.mutation.TransferReceipt;
import com.flagship.budget_ledger.mutation.UpdateTransactionStatusOperation;
import com.flagship.budget_ledger.observability.LedgerContext;
import com.flagship.budget_ledger.transaction.DateRange;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.Transaction;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Public entry point of the ledger.
 *
 * Every method returns a {@link LedgerResult}; no exception crosses this boundary.
 * Balance-affecting mutations run as units of {@link LedgerMutationCoordinator};
 * single-aggregate setup writes and reads run in their own transaction.
 *
 * Callers are trusted to have checked that the user may act on {@code budgetId}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerOperations {

    private final LedgerMutationCoordinator coordinator;
    private final CreateTransactionOperation createTransactionOperation;
    private final UpdateTransactionStatusOperation updateTransactionStatusOperation;
    private final ReclassifyTransactionOperation reclassifyTransactionOperation;
    private final TransferBetweenAccountsOperation transferBetweenAccountsOperation;
    private final PayCreditCardBillOperation payCreditCardBillOperation;
    private final AddAmountToGoalOperation addAmountToGoalOperation;
    private final RemoveAmountFromGoalOperation removeAmountFromGoalOperation;
    private final TransferGoalToAccountOperation transferGoalToAccountOperation;
    private final ChangeGoalStatusOperation changeGoalStatusOperation;
    private final DeleteAccountOperation deleteAccountOperation;

    private final AccountService accountService;
    private final AccountBalanceCalculator balanceCalculator;
    private final EnvelopeService envelopeService;
    private final EnvelopeUsageCalculator envelopeUsageCalculator;
    private final CreditCardService creditCardService;
    private final CreditCardBillLifecycleManager billLifecycleManager;
    private final GoalReservationManager goalReservationManager;

    // ==================== Mutations ====================

    public LedgerResult<UUID> createTransaction(NewTransaction request) {
        return coordinator.execute(createTransactionOperation, request).map(Transaction::getId);
    }

    public LedgerResult<Transaction> updateTransactionStatus(UUID budgetId, UUID transactionId, TransactionStatus newStatus) {
        return coordinator.execute(updateTransactionStatusOperation,
            new TransactionStatusCommand(budgetId, transactionId, newStatus));
    }

    public LedgerResult<Transaction> reclassifyTransaction(UUID budgetId, UUID transactionId, UUID newCategoryId) {
        return coordinator.execute(reclassifyTransactionOperation,
            new ReclassifyCommand(budgetId, transactionId, newCategoryId));
    }

    public LedgerResult<TransferReceipt> transferBetweenAccounts(TransferCommand command) {
        return coordinator.execute(transferBetweenAccountsOperation, command);
    }

    public LedgerResult<BillPaymentReceipt> payCreditCardBill(PayBillCommand command) {
        return coordinator.execute(payCreditCardBillOperation, command);
    }

    public LedgerResult<Goal> addAmountToGoal(UUID budgetId, UUID goalId, Money amount) {
        return coordinator.execute(addAmountToGoalOperation, new GoalAmountCommand(budgetId, goalId, amount));
    }

    public LedgerResult<Goal> removeAmountFromGoal(UUID budgetId, UUID goalId, Money amount) {
        return coordinator.execute(removeAmountFromGoalOperation, new GoalAmountCommand(budgetId, goalId, amount));
    }

    public LedgerResult<Goal> transferGoalToAccount(UUID budgetId, UUID goalId, UUID newAccountId) {
        return coordinator.execute(transferGoalToAccountOperation, new TransferGoalCommand(budgetId, goalId, newAccountId));
    }

    public LedgerResult<Goal> changeGoalStatus(UUID budgetId, UUID goalId, GoalStatus newStatus) {
        return coordinator.execute(changeGoalStatusOperation, new GoalStatusCommand(budgetId, goalId, newStatus));
    }

    public LedgerResult<AccountDeletion> deleteAccount(UUID budgetId, UUID accountId) {
        return coordinator.execute(deleteAccountOperation, new DeleteAccountCommand(budgetId, accountId));
    }

    // ==================== Setup ====================

    public LedgerResult<Account> createAccount(UUID budgetId, String name, AccountType type, CurrencyCode currency) {
        return write("createAccount", budgetId, () -> accountService.createAccount(budgetId, name, type, currency));
    }

    public LedgerResult<Goal> createGoal(UUID budgetId, String name, Money targetAmount, LocalDate targetDate,
                                         UUID sourceAccountId) {
        return write("createGoal", budgetId,
            () -> goalReservationManager.createGoal(budgetId, name, targetAmount, targetDate, sourceAccountId));
    }

    public LedgerResult<Envelope> createEnvelope(UUID budgetId, UUID categoryId, Money limit) {
        return write("createEnvelope", budgetId, () -> envelopeService.createEnvelope(budgetId, categoryId, limit));
    }

    public LedgerResult<CreditCard> createCreditCard(UUID budgetId, String name, Money creditLimit,
                                                     int closingDay, int dueDay) {
        return write("createCreditCard", budgetId,
            () -> creditCardService.createCreditCard(budgetId, name, creditLimit, closingDay, dueDay));
    }

    /**
     * Ends a bill's cycle ahead of the scheduler.
     */
    public LedgerResult<CreditCardBill> closeBill(UUID budgetId, UUID billId) {
        return write("closeBill", budgetId, () -> {
            billLifecycleManager.getBill(budgetId, billId);
            return billLifecycleManager.closeBill(billId);
        });
    }

    // ==================== Reads ====================

    public LedgerResult<Money> totalBalance(UUID budgetId, UUID accountId) {
        return read("totalBalance", budgetId, () -> {
            accountService.getAccount(budgetId, accountId);
            return balanceCalculator.totalBalance(accountId);
        });
    }

    public LedgerResult<Money> availableBalance(UUID budgetId, UUID accountId) {
        return read("availableBalance", budgetId, () -> {
            accountService.getAccount(budgetId, accountId);
            return balanceCalculator.availableBalance(accountId);
        });
    }

    public LedgerResult<EnvelopeUsage> envelopeUsage(UUID budgetId, UUID envelopeId, DateRange period) {
        return read("envelopeUsage", budgetId, () -> {
            envelopeService.getEnvelope(budgetId, envelopeId);
            return envelopeUsageCalculator.summarize(envelopeId, period);
        });
    }

    /**
     * Usage of the category's envelope; empty when the category has none.
     */
    public LedgerResult<Optional<EnvelopeUsage>> categoryUsage(UUID budgetId, UUID categoryId, DateRange period) {
        return read("categoryUsage", budgetId,
            () -> envelopeUsageCalculator.usageForCategory(budgetId, categoryId, period));
    }

    public LedgerResult<CreditCardBill> getBill(UUID budgetId, UUID billId) {
        return read("getBill", budgetId, () -> billLifecycleManager.getBill(budgetId, billId));
    }

    /**
     * Bills of a card, oldest period first.
     */
    public LedgerResult<List<CreditCardBill>> creditCardBills(UUID budgetId, UUID creditCardId) {
        return read("creditCardBills", budgetId, () -> {
            creditCardService.getCard(budgetId, creditCardId);
            return billLifecycleManager.billsOf(creditCardId);
        });
    }

    public LedgerResult<Goal> getGoal(UUID budgetId, UUID goalId) {
        return read("getGoal", budgetId, () -> goalReservationManager.getGoal(budgetId, goalId));
    }

    private <T> LedgerResult<T> write(String operation, UUID budgetId, Supplier<T> action) {
        return invoke(operation, budgetId, action, true);
    }

    private <T> LedgerResult<T> read(String operation, UUID budgetId, Supplier<T> action) {
        return invoke(operation, budgetId, action, false);
    }

    private <T> LedgerResult<T> invoke(String operation, UUID budgetId, Supplier<T> action, boolean writes) {
        try (LedgerContext.Scope ignored = LedgerContext.open(operation, budgetId)) {
            try {
                return LedgerResult.success(action.get());
            } catch (LedgerException e) {
                log.warn("{} rejected ({}): {}", operation, e.getKind(), e.getMessage());
                return LedgerResult.failure(LedgerError.from(e, writes));
            } catch (IllegalArgumentException e) {
                log.warn("{} rejected: {}", operation, e.getMessage());
                return LedgerResult.failure(LedgerError.builder()
                    .kind(LedgerErrorKind.VALIDATION)
                    .message(e.getMessage())
                    .rolledBack(writes)
                    .cause(e)
                    .build());
            } catch (RuntimeException e) {
                log.error("{} failed", operation, e);
                return LedgerResult.failure(LedgerError.builder()
                    .kind(LedgerErrorKind.TRANSFER_EXECUTION)
                    .message(operation + " failed: " + e.getMessage())
                    .rolledBack(writes)
                    .cause(e)
                    .build());
            }
        }
    }
}
