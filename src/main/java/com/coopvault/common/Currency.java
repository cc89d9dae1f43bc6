package com.coopvault.common;

/**
 * Units handled by the vault.
 *
 * Each unit carries its fixed number of fractional digits; amounts are never
 * represented with more precision than their unit allows.
 */
public enum Currency {
    UC(18),    // Unity Coin, the redeemable reserve unit
    USDC(6),   // External settlement currency held in custody
    USD(2);

    private final int scale;

    Currency(int scale) {
        this.scale = scale;
    }

    public int getScale() {
        return scale;
    }
}
