package com.crosschain.arb.core;

/**
 * How the evaluation of one bridge edge ended.
 */
public enum EvaluationOutcome {
    NO_RPC,
    NOT_USD_DENOMINATED,
    INSUFFICIENT_LIQUIDITY,
    NO_BRIDGE_ROUTE,
    NO_INTERMEDIATE,
    NO_QUOTE,
    UNPROFITABLE,
    REJECTED, // Executor returned FAILED
    EXECUTED,
    ERROR
}
