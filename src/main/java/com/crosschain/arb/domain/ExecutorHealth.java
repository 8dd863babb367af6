package com.crosschain.arb.domain;

import lombok.Value;

@Value
public class ExecutorHealth {
    String status;
    String mode;
    int chains;
    String error;

    public boolean isHealthy() {
        return "healthy".equalsIgnoreCase(status);
    }

    public static ExecutorHealth unreachable(String error) {
        return new ExecutorHealth("error", null, 0, error);
    }
}
