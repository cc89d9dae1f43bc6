package com.coopvault.rules;

import com.coopvault.common.exception.ErrorKind;
import lombok.Value;

/**
 * Result of a rule evaluation.
 */
@Value
public class RuleResult {
    boolean approved;
    ErrorKind kind;
    String reason;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(ErrorKind kind, String reason) {
        return new RuleResult(false, kind, reason);
    }
}
