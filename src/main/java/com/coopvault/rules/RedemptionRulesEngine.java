package com.coopvault.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rules engine that evaluates all configured rules against a redemption.
 *
 * Rules are evaluated in order, and the first rule that declines the redemption
 * decides the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedemptionRulesEngine {

    private final List<RedemptionRule> rules;

    public RuleResult evaluateRules(RedemptionCheck check) {
        log.debug("Evaluating {} rules for redemption by {}", rules.size(), check.getRequester());

        for (RedemptionRule rule : rules) {
            RuleResult result = rule.evaluate(check);

            if (!result.isApproved()) {
                log.info("Rule {} declined redemption: {}", rule.getRuleName(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        log.debug("All rules approved for redemption by {}", check.getRequester());
        return RuleResult.approve();
    }
}
