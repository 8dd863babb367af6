package com.crosschain.arb.core.execution;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.domain.PerformanceCounters;
import com.crosschain.arb.domain.TradeRecord;
import com.crosschain.arb.domain.TradeSignal;
import com.crosschain.arb.domain.TradeStatus;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Simulated fills against a virtual capital account. Never touches a network.
 */
@Slf4j
public class PaperTradeExecutor implements TradeExecutor {

    private final ExecutionProperties.Paper settings;
    private final PerformanceCounters counters = new PerformanceCounters();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<BigDecimal> capital;
    private final TradeHistory history;

    public PaperTradeExecutor(ExecutionProperties.Paper settings, int historySize) {
        this.settings = settings;
        this.capital = new AtomicReference<>(settings.getInitialCapitalUsd());
        this.history = new TradeHistory(historySize);
        log.info("Paper trading enabled. Virtual capital ${}", settings.getInitialCapitalUsd());
    }

    @Override
    public ExecutionResult submit(TradeSignal signal) {
        if (signal == null || signal.getExpectedProfitUsd() == null) {
            log.error("[PAPER] Malformed signal rejected");
            return ExecutionResult.failed(null, ExecutionMode.PAPER, "Malformed signal");
        }

        String tradeId = "PAPER_" + signal.getChainId() + "_" + sequence.incrementAndGet();
        BigDecimal gasCost = signal.getGasCostUsd() != null ? signal.getGasCostUsd() : settings.getDefaultGasCostUsd();
        BigDecimal actualProfit = signal.getExpectedProfitUsd().multiply(settings.getSlippageFactor());
        BigDecimal netProfit = actualProfit.subtract(gasCost);
        BigDecimal capitalAfter = capital.accumulateAndGet(netProfit, BigDecimal::add);
        Instant now = Instant.now();

        counters.recordTrade(signal.getNotionalUsd());
        history.add(TradeRecord.builder()
                .tradeId(tradeId)
                .timestamp(now)
                .mode(ExecutionMode.PAPER)
                .chainId(signal.getChainId())
                .token(signal.getToken())
                .amount(signal.getAmount())
                .expectedProfit(signal.getExpectedProfitUsd())
                .actualProfit(actualProfit)
                .gasCost(gasCost)
                .netProfit(netProfit)
                .status(TradeStatus.SIMULATED)
                .success(netProfit.signum() > 0)
                .txHash("SIMULATED_" + tradeId)
                .capitalAfter(capitalAfter)
                .build());
        if (netProfit.signum() > 0) {
            counters.recordSuccess(netProfit);
        } else {
            counters.addProfit(netProfit);
        }

        log.info("[PAPER] {} chain {} | expected ${} | net ${} | capital ${}",
                tradeId, signal.getChainId(), signal.getExpectedProfitUsd(), netProfit, capitalAfter);

        return ExecutionResult.builder()
                .tradeId(tradeId)
                .status(TradeStatus.SIMULATED)
                .mode(ExecutionMode.PAPER)
                .txHash("SIMULATED_" + tradeId)
                .netProfit(netProfit)
                .capitalAfter(capitalAfter)
                .paper(true)
                .timestamp(now)
                .build();
    }

    @Override
    public void recordExecutionResult(String tradeId, ExecutionUpdate update) {
        // Paper trades settle immediately
    }

    @Override
    public PerformanceCounters.Snapshot performanceSummary() {
        return counters.snapshot(settings.getInitialCapitalUsd(), capital.get());
    }

    @Override
    public List<TradeRecord> recentTrades() {
        return history.recent();
    }

    public BigDecimal currentCapital() {
        return capital.get();
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.PAPER;
    }
}
