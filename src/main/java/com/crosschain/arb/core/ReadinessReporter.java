package com.crosschain.arb.core;

import com.crosschain.arb.core.execution.TradeExecutor;
import com.crosschain.arb.domain.PerformanceCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessReporter {

    private final ChainRegistry chainRegistry;
    private final TradeExecutor tradeExecutor;
    private final ScanMetrics metrics;
    private final ScanLoop scanLoop;

    @Scheduled(fixedDelayString = "${crosschain.scan.report-interval-ms:60000}",
            initialDelayString = "${crosschain.scan.report-interval-ms:60000}")
    public void report() {
        if (!scanLoop.isArmed()) {
            log.info("Status: scan loop not armed");
            return;
        }
        for (Map.Entry<Integer, Boolean> entry : chainRegistry.healthSnapshot().entrySet()) {
            log.info("Status: {} {} rpc={}", chainRegistry.getChainName(entry.getKey()),
                    chainRegistry.getExecutionState(entry.getKey()), entry.getValue() ? "healthy" : "unhealthy");
        }

        PerformanceCounters.Snapshot perf = tradeExecutor.performanceSummary();
        log.info("Status: {} trades={} wins={} ({}%) profit=${} volume=${}", tradeExecutor.mode(),
                perf.getTradeCount(), perf.getSuccessCount(), String.format("%.1f", perf.winRate()),
                perf.getTotalProfit(), perf.getTotalVolume());
        if (perf.hasCapital()) {
            log.info("Status: capital ${} (initial ${}) roi={}%", perf.getCurrentCapital(), perf.getInitialCapital(),
                    perf.roi().setScale(2, RoundingMode.HALF_UP));
        }
        log.info("Status: cycles={} held={} abandoned={} outcomes={}", metrics.cycles(), metrics.heldCycles(),
                metrics.abandonedCount(), metrics.snapshot());
    }
}
