package com.coopvault.rules;

/**
 * Interface for redemption rules.
 *
 * Each rule evaluates a redemption and returns a result indicating whether it may
 * proceed. Rules only read; they never change the vault state they are given.
 */
public interface RedemptionRule {

    /**
     * Evaluate the rule against a redemption.
     *
     * @param check the redemption and the vault state to evaluate
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(RedemptionCheck check);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
