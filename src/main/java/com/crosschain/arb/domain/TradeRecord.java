package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * One entry of an executor's trade log. Live records start SUBMITTED and are replaced once the
 * execution service reports the outcome.
 */
@Value
@Builder(toBuilder = true)
public class TradeRecord {
    String tradeId;
    Instant timestamp;
    ExecutionMode mode;
    int chainId;
    String token;
    BigInteger amount;
    BigDecimal expectedProfit;
    BigDecimal actualProfit;
    BigDecimal gasCost;
    BigDecimal netProfit;
    TradeStatus status;
    boolean success;
    String txHash;
    String error;
    BigDecimal capitalAfter; // Paper only
}
