package com.flagship.property_settlement.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "invoice.overdue-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvoiceOverdueSweeper {

    private final InvoiceLedgerService ledgerService;

    @Scheduled(cron = "${invoice.overdue-sweep.cron:0 15 1 * * *}")
    public void sweep() {
        try {
            ledgerService.markOverdue();
        } catch (Exception e) {
            log.error("Overdue invoice sweep failed", e);
        }
    }
}
