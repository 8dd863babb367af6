package com.crosschain.arb.core;

import com.crosschain.arb.config.ExecutionConfig;
import com.crosschain.arb.config.RpcProperties;
import com.crosschain.arb.config.ScanProperties;
import com.crosschain.arb.domain.BridgeOpportunity;
import com.crosschain.arb.infra.ChainRpc;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The scan loop. One scheduler thread runs cycles back to back; the work of each cycle fans out to the
 * scan pool and is joined before the cycle ends, so cycles never overlap.
 */
@Slf4j
@Service
public class ScanLoop implements SmartLifecycle {

    private static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);

    private final ChainRegistry chainRegistry;
    private final OpportunityGraph graph;
    private final OpportunityEvaluator evaluator;
    private final GasTrendForecaster forecaster;
    private final ScanMetrics metrics;
    private final ScanProperties properties;
    private final RpcProperties rpcProperties;
    private final ThreadPoolTaskExecutor scanExecutor;

    private final AtomicBoolean armed = new AtomicBoolean();
    private volatile boolean running;
    private volatile boolean resumeArmed;

    public ScanLoop(ChainRegistry chainRegistry, OpportunityGraph graph, OpportunityEvaluator evaluator,
                    GasTrendForecaster forecaster, ScanMetrics metrics, ScanProperties properties,
                    RpcProperties rpcProperties, @Qualifier(ExecutionConfig.SCAN_EXECUTOR) ThreadPoolTaskExecutor scanExecutor) {
        this.chainRegistry = chainRegistry;
        this.graph = graph;
        this.evaluator = evaluator;
        this.forecaster = forecaster;
        this.metrics = metrics;
        this.properties = properties;
        this.rpcProperties = rpcProperties;
        this.scanExecutor = scanExecutor;
    }

    /**
     * Called once startup validation has passed. Until then every scheduled cycle is a no-op.
     */
    public void arm() {
        if (armed.compareAndSet(false, true)) {
            log.info("Scan loop armed: {} bridge edges, {} workers", graph.edgeCount(), properties.getWorkerThreads());
        }
    }

    public boolean isArmed() {
        return armed.get();
    }

    @Scheduled(fixedDelayString = "${crosschain.scan.cycle-delay-ms:1000}")
    public void runCycle() {
        if (!armed.get() || !running) {
            return;
        }
        try {
            scanOnce();
        } catch (Exception e) {
            log.error("Scan cycle failed", e);
        }
    }

    void scanOnce() {
        Map<Integer, Double> gasMap = fetchGasPrices();

        double primaryGas = gasMap.getOrDefault(properties.getPrimaryChainId(), 0.0);
        if (primaryGas > 0) {
            forecaster.ingestGas(primaryGas);
            if (forecaster.shouldWait()) {
                log.info("AI HOLD: gas on {} expected to drop ({} gwei), skipping cycle",
                        chainRegistry.getChainName(properties.getPrimaryChainId()), primaryGas);
                metrics.cycleHeld();
                return;
            }
        }

        List<BridgeOpportunity> edges = graph.enumerateCrossChainEdges().toList();
        if (edges.isEmpty()) {
            metrics.cycleCompleted();
            return;
        }

        List<Future<EvaluationOutcome>> tasks = new ArrayList<>(edges.size());
        for (BridgeOpportunity edge : edges) {
            tasks.add(scanExecutor.submit(() -> evaluator.evaluate(edge, gasMap)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getCycleTimeoutMs());
        int abandoned = 0;
        for (Future<EvaluationOutcome> task : tasks) {
            long remaining = deadline - System.nanoTime();
            try {
                task.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                task.cancel(true);
                abandoned++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                tasks.forEach(t -> t.cancel(true));
                return;
            } catch (ExecutionException | CancellationException e) {
                log.error("Evaluation task failed", e);
            }
        }
        if (abandoned > 0) {
            log.warn("Cycle deadline of {} ms reached, abandoned {} evaluations", properties.getCycleTimeoutMs(), abandoned);
            metrics.abandoned(abandoned);
        }
        metrics.cycleCompleted();
        log.debug("Cycle done: {} edges evaluated", edges.size());
    }

    /**
     * Gas price in gwei per connected chain. Failures and timeouts count as 0.
     */
    Map<Integer, Double> fetchGasPrices() {
        Map<Integer, CompletableFuture<Double>> futures = new LinkedHashMap<>();
        for (Integer chainId : chainRegistry.connectedChains()) {
            futures.put(chainId, CompletableFuture
                    .supplyAsync(() -> gasPriceGwei(chainId), scanExecutor)
                    .completeOnTimeout(0.0, rpcProperties.getCallTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> 0.0));
        }
        Map<Integer, Double> gasMap = new LinkedHashMap<>();
        futures.forEach((chainId, future) -> gasMap.put(chainId, future.join()));
        return gasMap;
    }

    private double gasPriceGwei(int chainId) {
        ChainRpc rpc = chainRegistry.connection(chainId).orElse(null);
        if (rpc == null) {
            return 0.0;
        }
        try {
            BigInteger wei = rpc.gasPriceWei();
            return new BigDecimal(wei).divide(WEI_PER_GWEI).doubleValue();
        } catch (RuntimeException e) {
            log.debug("[{}] Gas price unavailable: {}", chainRegistry.getChainName(chainId), e.getMessage());
            return 0.0;
        }
    }

    @Override
    public void start() {
        running = true;
        if (resumeArmed) {
            resumeArmed = false;
            armed.set(true);
            log.info("Scan loop restarted");
        }
    }

    /**
     * Disarms the loop. The scan pool is a shared bean and drains on its own shutdown, so a later
     * {@link #start()} can resume cycles on it.
     */
    @Override
    public void stop() {
        running = false;
        resumeArmed = armed.getAndSet(false);
        log.info("Scan loop stopped after {} cycles", metrics.cycles());
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
