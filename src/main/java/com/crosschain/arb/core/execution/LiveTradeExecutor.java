package com.crosschain.arb.core.execution;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.core.ChainRegistry;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.domain.ExecutorResponse;
import com.crosschain.arb.domain.PerformanceCounters;
import com.crosschain.arb.domain.TradeRecord;
import com.crosschain.arb.domain.TradeSignal;
import com.crosschain.arb.domain.TradeStatus;
import com.crosschain.arb.infra.TradeForwarder;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Real-capital execution. Every signal passes the pre-flight checks before it is forwarded. There is
 * no fallback to paper: an unavailable execution service fails the trade.
 * <p>
 * The execution service may broadcast a trade's outcome before its HTTP response arrives, so a trade
 * id is known to {@link #recordExecutionResult} from the moment it is forwarded.
 */
@Slf4j
public class LiveTradeExecutor implements TradeExecutor {

    private final ExecutionProperties properties;
    private final ChainRegistry chainRegistry;
    private final TradeForwarder forwarder;
    private final PendingTradeStore pendingTrades;

    private final PerformanceCounters counters = new PerformanceCounters();
    private final AtomicLong sequence = new AtomicLong();
    private final Set<String> known = ConcurrentHashMap.newKeySet();
    private final Set<String> recorded = ConcurrentHashMap.newKeySet();
    private final TradeHistory history;

    public LiveTradeExecutor(ExecutionProperties properties, ChainRegistry chainRegistry,
                             TradeForwarder forwarder, PendingTradeStore pendingTrades) {
        this.properties = properties;
        this.chainRegistry = chainRegistry;
        this.forwarder = forwarder;
        this.pendingTrades = pendingTrades;
        this.history = new TradeHistory(properties.getHistorySize());
        log.warn("LIVE execution enabled. Real capital at risk. Min profit ${}, max slippage {} bps, max {} in flight",
                properties.getMinProfitUsd(), properties.getMaxSlippageBps(), properties.getMaxConcurrentTxs());
    }

    @Override
    public ExecutionResult submit(TradeSignal signal) {
        if (signal == null) {
            return ExecutionResult.failed(null, ExecutionMode.LIVE, "Malformed signal");
        }
        String tradeId = "LIVE_" + signal.getChainId() + "_" + sequence.incrementAndGet();

        PreflightResult preflight = validate(tradeId, signal);
        if (!preflight.isPassed()) {
            log.warn("[LIVE] {} rejected: {}", tradeId, preflight.getReason());
            return ExecutionResult.failed(tradeId, ExecutionMode.LIVE, preflight.getReason());
        }

        if (!forwarder.isAvailable()) {
            pendingTrades.clearPending(tradeId);
            log.error("[LIVE] {} not sent: execution service not available", tradeId);
            return ExecutionResult.failed(tradeId, ExecutionMode.LIVE,
                    "Execution service not available (health check failed or not initialized)");
        }

        known.add(tradeId);
        history.add(TradeRecord.builder()
                .tradeId(tradeId)
                .timestamp(Instant.now())
                .mode(ExecutionMode.LIVE)
                .chainId(signal.getChainId())
                .token(signal.getToken())
                .amount(signal.getAmount())
                .expectedProfit(signal.getExpectedProfitUsd())
                .gasCost(signal.getGasCostUsd())
                .status(TradeStatus.PENDING)
                .build());

        ExecutorResponse response;
        try {
            response = forwarder.forward(tradeId, signal);
        } catch (RuntimeException e) {
            abandon(tradeId, "Forwarding failed: " + e.getMessage());
            log.error("[LIVE] {} forwarding failed", tradeId, e);
            return ExecutionResult.failed(tradeId, ExecutionMode.LIVE, "Forwarding failed: " + e.getMessage());
        }

        if (!response.isSuccess()) {
            abandon(tradeId, "Executor rejected trade: " + response.getError());
            log.error("[LIVE] {} rejected by execution service: {}", tradeId, response.getError());
            return ExecutionResult.failed(tradeId, ExecutionMode.LIVE, "Executor rejected trade: " + response.getError());
        }

        counters.recordTrade(signal.getNotionalUsd());
        history.update(tradeId, r -> r.getStatus() == TradeStatus.PENDING
                ? r.toBuilder().status(TradeStatus.SUBMITTED).txHash(response.getTxHash()).build()
                : r);
        log.info("[LIVE] {} submitted on {} | expected ${} | tx {}",
                tradeId, chainRegistry.getChainName(signal.getChainId()), signal.getExpectedProfitUsd(), response.getTxHash());

        return ExecutionResult.builder()
                .tradeId(tradeId)
                .status(TradeStatus.SUBMITTED)
                .mode(ExecutionMode.LIVE)
                .txHash(response.getTxHash())
                .netProfit(signal.getExpectedProfitUsd())
                .paper(false)
                .timestamp(Instant.now())
                .build();
    }

    private void abandon(String tradeId, String reason) {
        known.remove(tradeId);
        pendingTrades.clearPending(tradeId);
        if (!recorded.contains(tradeId)) {
            history.update(tradeId, r -> r.toBuilder().status(TradeStatus.FAILED).error(reason).build());
        }
    }

    /**
     * Checks run in a fixed order and stop at the first failure. The in-flight slot is reserved at its
     * place in that order; a passing trade keeps it, a later failure gives it back.
     */
    PreflightResult validate(String tradeId, TradeSignal signal) {
        BigDecimal profit = signal.getExpectedProfitUsd();
        BigDecimal minimum = properties.getMinProfitUsd();
        if (profit == null) {
            return PreflightResult.fail("Missing expected profit");
        }
        if (profit.compareTo(minimum) < 0) {
            return PreflightResult.fail(String.format("Profit $%s below minimum $%s (short by $%s)",
                    profit.toPlainString(), minimum.toPlainString(), minimum.subtract(profit).toPlainString()));
        }

        if (signal.getEstimatedSlippageBps() > properties.getMaxSlippageBps()) {
            return PreflightResult.fail(String.format("Slippage %d bps exceeds maximum %d bps",
                    signal.getEstimatedSlippageBps(), properties.getMaxSlippageBps()));
        }

        PendingTradeStore.Reservation reservation = pendingTrades.tryReserve(tradeId, properties.getMaxConcurrentTxs());
        if (reservation.getOutcome() == PendingTradeStore.Outcome.REJECTED) {
            return PreflightResult.fail(String.format("Too many pending trades: %d (max %d)",
                    reservation.getPendingCount(), properties.getMaxConcurrentTxs()));
        }
        if (reservation.getOutcome() == PendingTradeStore.Outcome.UNAVAILABLE) {
            log.debug("Pending trade store unavailable, skipping concurrency check");
        }

        PreflightResult configuration = checkConfiguration(signal);
        if (!configuration.isPassed()) {
            pendingTrades.clearPending(tradeId);
        }
        return configuration;
    }

    private PreflightResult checkConfiguration(TradeSignal signal) {
        String missing = missingField(signal);
        if (missing != null) {
            return PreflightResult.fail("Missing required field: " + missing);
        }

        String key = properties.getPrivateKey();
        if (key == null || key.isBlank() || ExecutionProperties.PLACEHOLDER_PRIVATE_KEY.equals(key.strip())) {
            return PreflightResult.fail("Private key not configured");
        }

        Optional<String> executor = chainRegistry.getExecutorAddress(signal.getChainId());
        if (executor.isEmpty() || ExecutionProperties.PLACEHOLDER_EXECUTOR_ADDRESS.equals(executor.get())) {
            return PreflightResult.fail("Executor contract address not configured for "
                    + chainRegistry.getChainName(signal.getChainId()));
        }

        if (!chainRegistry.isExecutionEnabled(signal.getChainId())) {
            return PreflightResult.fail("Execution not enabled on " + chainRegistry.getChainName(signal.getChainId())
                    + " (" + chainRegistry.getExecutionState(signal.getChainId()) + ")");
        }
        return PreflightResult.ok();
    }

    private static String missingField(TradeSignal signal) {
        if (signal.getToken() == null || signal.getToken().isBlank()) {
            return "token";
        }
        if (signal.getAmount() == null || signal.getAmount().signum() <= 0) {
            return "amount";
        }
        if (signal.getHops().isEmpty()) {
            return "protocols";
        }
        if (signal.getPath().size() < 2) {
            return "path";
        }
        if (signal.getExtras().size() != signal.getHops().size()) {
            return "extras";
        }
        return null;
    }

    @Override
    public void recordExecutionResult(String tradeId, ExecutionUpdate update) {
        if (tradeId == null || !known.contains(tradeId)) {
            log.debug("[LIVE] Ignoring result for unknown trade {}", tradeId);
            return;
        }
        if (!recorded.add(tradeId)) {
            log.debug("[LIVE] Duplicate result for {} ignored", tradeId);
            return;
        }
        pendingTrades.clearPending(tradeId);
        history.update(tradeId, r -> r.toBuilder()
                .status(update.getStatus())
                .success(update.isSuccess())
                .actualProfit(update.getActualProfit())
                .netProfit(update.getActualProfit())
                .txHash(update.getTxHash() != null ? update.getTxHash() : r.getTxHash())
                .error(update.getError())
                .build());

        if (update.isSuccess()) {
            counters.recordSuccess(update.getActualProfit());
            log.info("[LIVE] {} confirmed | profit ${} | tx {}", tradeId, update.getActualProfit(), update.getTxHash());
        } else {
            log.warn("[LIVE] {} finished {}: {}", tradeId, update.getStatus(), update.getError());
        }
    }

    @Override
    public PerformanceCounters.Snapshot performanceSummary() {
        return counters.snapshot();
    }

    @Override
    public List<TradeRecord> recentTrades() {
        return history.recent();
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.LIVE;
    }
}
