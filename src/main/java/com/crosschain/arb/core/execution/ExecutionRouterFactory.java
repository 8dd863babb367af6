package com.crosschain.arb.core.execution;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.core.ChainRegistry;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.infra.TradeForwarder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRouterFactory {

    private final ExecutionProperties properties;
    private final ChainRegistry chainRegistry;
    private final TradeForwarder forwarder;
    private final PendingTradeStore pendingTrades;

    /**
     * Unknown modes fall back to paper.
     */
    public TradeExecutor create(String mode) {
        ExecutionMode parsed = ExecutionMode.parse(mode).orElseGet(() -> {
            log.warn("Unknown execution mode '{}', falling back to PAPER", mode);
            return ExecutionMode.PAPER;
        });
        return switch (parsed) {
            case PAPER -> paper();
            case LIVE -> live();
            case HYBRID -> new HybridTradeExecutor(paper(), live(),
                    properties.getHybridConfidenceThreshold());
        };
    }

    private PaperTradeExecutor paper() {
        return new PaperTradeExecutor(properties.getPaper(), properties.getHistorySize());
    }

    private LiveTradeExecutor live() {
        return new LiveTradeExecutor(properties, chainRegistry, forwarder, pendingTrades);
    }
}
