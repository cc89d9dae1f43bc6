package com.coopvault.rules;

import com.coopvault.common.exception.ErrorKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that enforces the per-request redemption cap. A zero cap means unlimited.
 */
@Component
@Order(1)
public class PerUserCapRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionCheck check) {
        var reserve = check.getReserve();
        if (!reserve.hasPerUserCap()) {
            return RuleResult.approve();
        }

        if (check.getAmount().isGreaterThan(reserve.getMaxRedemptionPerUser())) {
            return RuleResult.decline(ErrorKind.EXCEEDS_PER_USER_CAP,
                String.format("Redemption of %s exceeds per-user cap of %s",
                    check.getAmount(), reserve.getMaxRedemptionPerUser()));
        }

        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "PerUserCap";
    }
}
