package com.flagship.budget_ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.category.CategoryType;
import com.flagship.budget_ledger.error.LedgerResult;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.NewTransaction;
import com.flagship.budget_ledger.transaction.TransactionStatus;
import com.flagship.budget_ledger.transaction.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared PostgreSQL container and fixtures for ledger integration tests.
 *
 * The container is started once per JVM and shared by every subclass, so cached
 * Spring contexts keep pointing at a live database. Each test works in a fresh
 * budget id; nothing needs cleaning up between tests.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class LedgerIntegrationSupport {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("budget_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    protected LedgerOperations ledger;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    protected UUID budgetId;

    @BeforeEach
    void newBudget() {
        budgetId = UUID.randomUUID();
    }

    protected static Money brl(long cents) {
        return Money.ofCents(cents, CurrencyCode.BRL);
    }

    protected static <T> T ok(LedgerResult<T> result) {
        assertTrue(result.isSuccess(), () -> "Expected success but got " + result);
        return result.getValue();
    }

    /**
     * Categories belong to another module; tests insert them directly.
     */
    protected UUID category(String name) {
        return category(budgetId, name);
    }

    protected UUID category(UUID budget, String name) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO categories (id, budget_id, name, category_type, active) VALUES (?, ?, ?, ?, TRUE)",
            id, budget, name, CategoryType.NEED.name());
        return id;
    }

    protected Account account(String name) {
        return ok(ledger.createAccount(budgetId, name, AccountType.CHECKING, CurrencyCode.BRL));
    }

    protected UUID record(UUID accountId, UUID categoryId, TransactionType type, long cents, LocalDate date) {
        return ok(ledger.createTransaction(NewTransaction.builder()
            .budgetId(budgetId)
            .accountId(accountId)
            .categoryId(categoryId)
            .amount(brl(cents))
            .type(type)
            .status(TransactionStatus.COMPLETED)
            .transactionDate(date)
            .description(type + " " + cents)
            .build()));
    }

    protected UUID income(UUID accountId, UUID categoryId, long cents) {
        return record(accountId, categoryId, TransactionType.INCOME, cents, LocalDate.now());
    }

    protected UUID purchase(UUID accountId, UUID categoryId, UUID cardId, long cents, LocalDate date) {
        return ok(ledger.createTransaction(NewTransaction.builder()
            .budgetId(budgetId)
            .accountId(accountId)
            .categoryId(categoryId)
            .creditCardId(cardId)
            .amount(brl(cents))
            .type(TransactionType.EXPENSE)
            .transactionDate(date)
            .description("card purchase")
            .build()));
    }
}
