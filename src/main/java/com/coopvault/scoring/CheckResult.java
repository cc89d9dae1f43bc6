package com.coopvault.scoring;

import lombok.Value;

/**
 * Outcome of one compliance check.
 */
@Value
public class CheckResult {
    String name;
    boolean passed;
    String note;

    public static CheckResult pass(String name) {
        return new CheckResult(name, true, null);
    }

    public static CheckResult fail(String name, String note) {
        return new CheckResult(name, false, note);
    }
}
