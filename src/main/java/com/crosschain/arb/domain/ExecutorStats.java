package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ExecutorStats {
    long totalSignals;
    long executed;
    long paperExecuted;
    long failed;
    BigDecimal totalProfit;
    long uptimeSeconds;
}
