package com.reliefpool.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Ledger Service Application
 *
 * Relief fund ledger:
 * - Center balances, contribution totals and credit supply
 * - 1:1 contribution credits for donors
 * - Capability-authorized transfers and withdrawals
 * - Audit trail published for external observers
 */
@SpringBootApplication
public class LedgerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
