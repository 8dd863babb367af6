package com.crosschain.arb.core.execution;

import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.domain.PerformanceCounters;
import com.crosschain.arb.domain.TradeRecord;
import com.crosschain.arb.domain.TradeSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sends high-confidence signals live and paper-trades the rest.
 */
@Slf4j
public class HybridTradeExecutor implements TradeExecutor {

    private final PaperTradeExecutor paper;
    private final LiveTradeExecutor live;
    private final double confidenceThreshold;

    public HybridTradeExecutor(PaperTradeExecutor paper, LiveTradeExecutor live, double confidenceThreshold) {
        this.paper = paper;
        this.live = live;
        this.confidenceThreshold = confidenceThreshold;
        log.info("Hybrid execution: live at confidence >= {}", confidenceThreshold);
    }

    @Override
    public ExecutionResult submit(TradeSignal signal) {
        if (signal != null && signal.getConfidence() >= confidenceThreshold) {
            log.info("[HYBRID] Confidence {} -> LIVE", signal.getConfidence());
            return live.submit(signal);
        }
        log.debug("[HYBRID] Confidence below {} -> PAPER", confidenceThreshold);
        return paper.submit(signal);
    }

    @Override
    public void recordExecutionResult(String tradeId, ExecutionUpdate update) {
        live.recordExecutionResult(tradeId, update);
    }

    @Override
    public PerformanceCounters.Snapshot performanceSummary() {
        PerformanceCounters.Snapshot p = paper.performanceSummary();
        PerformanceCounters.Snapshot l = live.performanceSummary();
        return new PerformanceCounters.Snapshot(
                p.getTradeCount() + l.getTradeCount(),
                p.getSuccessCount() + l.getSuccessCount(),
                p.getTotalProfit().add(l.getTotalProfit()),
                p.getTotalVolume().add(l.getTotalVolume()),
                p.getInitialCapital(),
                p.getCurrentCapital());
    }

    @Override
    public List<TradeRecord> recentTrades() {
        List<TradeRecord> merged = new ArrayList<>(paper.recentTrades());
        merged.addAll(live.recentTrades());
        merged.sort(Comparator.comparing(TradeRecord::getTimestamp).reversed());
        return merged;
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.HYBRID;
    }
}
