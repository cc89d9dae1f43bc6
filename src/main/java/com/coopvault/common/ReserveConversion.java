package com.coopvault.common;

import java.math.RoundingMode;

/**
 * Fixed 1:1 conversion between the reserve unit (UC, 18 decimals) and the
 * settlement currency (USDC, 6 decimals).
 *
 * UC to USDC drops the 12 sub-cent digits the settlement currency cannot carry
 * (truncation, never rounding up). USDC to UC is always exact.
 */
public final class ReserveConversion {

    private ReserveConversion() {
    }

    public static Money toSettlementCurrency(Money reserveUnits) {
        requireCurrency(reserveUnits, Currency.UC);
        return Money.of(
            reserveUnits.getAmount().setScale(Currency.USDC.getScale(), RoundingMode.DOWN),
            Currency.USDC);
    }

    public static Money toReserveUnits(Money settlementAmount) {
        requireCurrency(settlementAmount, Currency.USDC);
        return Money.of(settlementAmount.getAmount(), Currency.UC);
    }

    private static void requireCurrency(Money money, Currency expected) {
        if (money.getCurrency() != expected) {
            throw new IllegalArgumentException(
                "Expected " + expected + " amount but got " + money.getCurrency());
        }
    }
}
