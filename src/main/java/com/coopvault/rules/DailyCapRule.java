package com.coopvault.rules;

import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that enforces the global daily redemption cap. A zero cap means unlimited.
 *
 * The window is fixed, not sliding: it opens at the first redemption after the
 * previous window ran out and lasts exactly one window length. An expired window
 * counts as an empty aggregate here; the reset itself is applied by the vault only
 * once the redemption is accepted.
 */
@Component
@Order(2)
public class DailyCapRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionCheck check) {
        var reserve = check.getReserve();
        if (!reserve.hasDailyCap()) {
            return RuleResult.approve();
        }

        Money redeemedInWindow = reserve.effectiveDailyAggregate(check.getNow(), check.getDailyWindow());
        Money totalWithCurrent = redeemedInWindow.add(check.getAmount());

        if (totalWithCurrent.isGreaterThan(reserve.getMaxDailyRedemptions())) {
            return RuleResult.decline(ErrorKind.EXCEEDS_DAILY_CAP,
                String.format("Daily redemption cap exceeded. Redeemed in window: %s, Cap: %s",
                    redeemedInWindow, reserve.getMaxDailyRedemptions()));
        }

        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "DailyCap";
    }
}
