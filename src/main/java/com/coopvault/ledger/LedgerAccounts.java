package com.coopvault.ledger;

/**
 * Well-known ledger account ids.
 */
public final class LedgerAccounts {

    /**
     * Vault custody account holding escrowed reserve units.
     */
    public static final String VAULT_CUSTODY = "vault:custody";

    private LedgerAccounts() {
    }
}
