package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ExecutionResult {
    String tradeId;
    TradeStatus status;
    ExecutionMode mode;
    String txHash;
    BigDecimal netProfit;
    BigDecimal capitalAfter; // Paper only
    String error;
    boolean paper;
    Instant timestamp;

    public boolean isFailed() {
        return status == TradeStatus.FAILED || status == TradeStatus.REVERTED;
    }

    public static ExecutionResult failed(String tradeId, ExecutionMode mode, String reason) {
        return ExecutionResult.builder()
                .tradeId(tradeId)
                .status(TradeStatus.FAILED)
                .mode(mode)
                .error(reason)
                .paper(mode == ExecutionMode.PAPER)
                .timestamp(Instant.now())
                .build();
    }
}
