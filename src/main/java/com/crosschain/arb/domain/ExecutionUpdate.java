package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Asynchronous result event delivered by the execution service for a submitted trade.
 * The service may deliver the same event more than once.
 */
@Value
@Builder
public class ExecutionUpdate {
    String type; // "result" or "signal"
    String tradeId;
    TradeStatus status;
    BigDecimal actualProfit;
    String txHash;
    String error;

    public boolean isSuccess() {
        return status == TradeStatus.CONFIRMED;
    }
}
