package com.crosschain.arb.core.execution;

import lombok.Value;

@Value
public class PreflightResult {

    private static final PreflightResult PASSED = new PreflightResult(true, null);

    boolean passed;
    String reason;

    public static PreflightResult ok() {
        return PASSED;
    }

    public static PreflightResult fail(String reason) {
        return new PreflightResult(false, reason);
    }
}
