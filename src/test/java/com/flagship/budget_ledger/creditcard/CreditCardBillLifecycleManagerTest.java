package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.error.InvariantViolationException;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreditCardBillLifecycleManagerTest {

    @Mock
    private CreditCardBillRepository billRepository;

    @Mock
    private CreditCardService creditCardService;

    @Mock
    private TransactionStore transactionStore;

    private CreditCardBillLifecycleManager manager;
    private CreditCard card;

    @BeforeEach
    void setUp() {
        manager = new CreditCardBillLifecycleManager(billRepository, creditCardService, transactionStore);
        card = new CreditCard(UUID.randomUUID(), UUID.randomUUID(), "Gold",
            Money.ofCents(1_000_000, CurrencyCode.BRL), 10, 20);
    }

    @Test
    @DisplayName("A card that already has two OPEN bills refuses to open a third")
    void twoOpenBillsAreAnInvariantViolation() {
        List<CreditCardBillEntity> open = List.of(mock(CreditCardBillEntity.class), mock(CreditCardBillEntity.class));
        when(creditCardService.getCard(card.getId())).thenReturn(card);
        when(billRepository.findByCreditCardIdAndPeriodYearAndPeriodMonth(card.getId(), 2026, 4))
            .thenReturn(Optional.empty());
        when(billRepository.findByCreditCardIdAndStatus(card.getId(), BillStatus.OPEN)).thenReturn(open);

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> manager.onTransactionCreated(card.getId(), LocalDate.of(2026, 4, 3),
                Money.ofCents(2_500, CurrencyCode.BRL)));

        assertEquals(LedgerErrorKind.INVARIANT_VIOLATION, e.getKind());
        verify(billRepository, never()).save(any());
    }
}
