package com.coopvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Coop Vault.
 *
 * Coop Vault is the value-settlement core of a community cooperative: it escrows and
 * settles token redemptions against an external reserve currency, guards treasury
 * withdrawals behind role checks, and moves community funding proposals through
 * screening, council voting and funding.
 */
@SpringBootApplication
public class CoopVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoopVaultApplication.class, args);
    }
}
