package com.flagship.budget_ledger.creditcard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Moves bills through the time-driven part of their lifecycle: closes OPEN bills
 * whose closing date has passed and flags unpaid CLOSED bills as OVERDUE.
 *
 * Enabled with {@code ledger.bills.scheduler.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "ledger.bills.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BillCycleScheduler {

    private final CreditCardBillLifecycleManager lifecycleManager;
    private final Clock clock;

    @Scheduled(cron = "${ledger.bills.scheduler.cron:0 5 0 * * *}")
    public void advanceBillCycles() {
        LocalDate today = LocalDate.now(clock);
        try {
            int closed = lifecycleManager.closeElapsedBills(today);
            int overdue = lifecycleManager.markOverdueBills(today);
            if (closed > 0 || overdue > 0) {
                log.info("Bill cycle run for {}: closed={}, overdue={}", today, closed, overdue);
            }
        } catch (Exception e) {
            log.error("Bill cycle run for {} failed", today, e);
        }
    }
}
