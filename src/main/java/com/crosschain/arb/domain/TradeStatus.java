package com.crosschain.arb.domain;

public enum TradeStatus {
    PENDING,
    SIMULATED,
    SUBMITTED,
    CONFIRMED,
    FAILED,
    REVERTED;

    public boolean isTerminal() {
        return this == SIMULATED || this == CONFIRMED || this == FAILED || this == REVERTED;
    }
}
