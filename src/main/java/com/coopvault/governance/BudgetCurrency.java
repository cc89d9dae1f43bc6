package com.coopvault.governance;

/**
 * Currency a proposal budget is requested in. Thresholds compare the amount only.
 */
public enum BudgetCurrency {
    UC,
    USD,
    MIXED
}
