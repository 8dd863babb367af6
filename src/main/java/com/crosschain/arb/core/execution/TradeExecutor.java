package com.crosschain.arb.core.execution;

import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.domain.PerformanceCounters;
import com.crosschain.arb.domain.TradeRecord;
import com.crosschain.arb.domain.TradeSignal;

import java.util.List;

/**
 * Execution policy for validated signals. Implementations are safe to call from scan worker threads.
 */
public interface TradeExecutor {

    /**
     * Never throws for an ordinary rejection; failures come back as a FAILED result with a reason.
     */
    ExecutionResult submit(TradeSignal signal);

    /**
     * Applies an asynchronous outcome for a previously submitted trade. Repeated deliveries for the
     * same trade id have no further effect.
     */
    void recordExecutionResult(String tradeId, ExecutionUpdate update);

    PerformanceCounters.Snapshot performanceSummary();

    /**
     * Bounded log of this executor's trades, newest first.
     */
    List<TradeRecord> recentTrades();

    ExecutionMode mode();
}
