package com.crosschain.arb.domain;

public enum ExecutionState {
    ENABLED, // Live execution allowed
    CONFIGURED, // RPC known, execution blocked
    DISABLED;

    public boolean isConfigured() {
        return this == ENABLED || this == CONFIGURED;
    }
}
