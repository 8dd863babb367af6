package com.crosschain.arb.infra;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.config.ExecutorServiceProperties;
import com.crosschain.arb.domain.BatchExecutionResult;
import com.crosschain.arb.domain.ExecutorHealth;
import com.crosschain.arb.domain.ExecutorResponse;
import com.crosschain.arb.domain.ExecutorStats;
import com.crosschain.arb.domain.TradeSignal;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Submits signals to the execution service with bounded retry and keeps delivery counters.
 */
@Slf4j
@Service
public class ExecutionManager implements TradeForwarder {

    private final ExecutionClient client;
    private final ExecutorServiceProperties serviceProperties;
    private final String mode;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();

    private volatile boolean available;
    @Getter
    private volatile String serverMode;

    public ExecutionManager(ExecutionClient client, ExecutorServiceProperties serviceProperties,
                            ExecutionProperties executionProperties) {
        this.client = client;
        this.serviceProperties = serviceProperties;
        this.mode = executionProperties.getMode().toUpperCase(Locale.ROOT);
        log.info("ExecutionManager initialized: {} mode @ {}", mode, serviceProperties.baseUrl());
    }

    /**
     * Health-checks the execution service. A reachable but unhealthy service leaves the channel unavailable.
     */
    public boolean initialize() {
        ExecutorHealth health = client.healthCheck();
        if (!health.isHealthy()) {
            log.error("Execution service unhealthy at {}: {}", serviceProperties.baseUrl(), health.getError());
            available = false;
            return false;
        }
        serverMode = health.getMode();
        if (serverMode != null && !serverMode.equalsIgnoreCase(mode)) {
            log.warn("Mode mismatch: scanner={}, execution service={}. The service decides what is broadcast.",
                    mode, serverMode);
        }
        log.info("Connected to execution service: {} mode, {} chains", serverMode, health.getChains());
        available = true;
        return true;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public ExecutorResponse forward(String tradeId, TradeSignal signal) {
        return submitTrade(tradeId, signal);
    }

    /**
     * Retries on transport failure and on an explicit non-success answer.
     * The last answer (or the last transport error) is returned once attempts run out.
     */
    public ExecutorResponse submitTrade(String tradeId, TradeSignal signal) {
        sent.incrementAndGet();
        int attempts = Math.max(1, serviceProperties.getMaxRetries());

        ExecutorResponse last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                last = client.executeSignal(tradeId, signal);
                if (last.isSuccess()) {
                    succeeded.incrementAndGet();
                    return last;
                }
                log.warn("Trade {} attempt {}/{} rejected: {}", tradeId, attempt, attempts, last.getError());
            } catch (ExecutorTransportException e) {
                log.error("Trade {} attempt {}/{} transport error: {}", tradeId, attempt, attempts, e.getMessage());
                last = ExecutorResponse.failure(e.getMessage());
            }

            if (attempt < attempts) {
                retried.incrementAndGet();
                if (!backoff()) {
                    break;
                }
            }
        }
        failed.incrementAndGet();
        return last != null ? last : ExecutorResponse.failure("Max retries exceeded");
    }

    public BatchExecutionResult submitBatch(Map<String, TradeSignal> signals) {
        sent.addAndGet(signals.size());
        try {
            BatchExecutionResult result = client.executeBatch(signals);
            succeeded.addAndGet(result.getSucceeded());
            failed.addAndGet(result.getFailed());
            return result;
        } catch (ExecutorTransportException e) {
            log.error("Batch submission of {} signals failed: {}", signals.size(), e.getMessage());
            failed.addAndGet(signals.size());
            return BatchExecutionResult.builder()
                    .total(signals.size())
                    .failed(signals.size())
                    .build();
        }
    }

    /**
     * Client counters plus the service's own statistics when it is reachable.
     */
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("sent", sent.get());
        stats.put("succeeded", succeeded.get());
        stats.put("failed", failed.get());
        stats.put("retried", retried.get());
        stats.put("mode", mode);
        try {
            ExecutorStats server = client.getStats();
            stats.put("server", server);
        } catch (ExecutorTransportException e) {
            log.debug("Execution service stats unavailable: {}", e.getMessage());
            stats.put("server", null);
        }
        return stats;
    }

    public long sentCount() {
        return sent.get();
    }

    public long succeededCount() {
        return succeeded.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long retriedCount() {
        return retried.get();
    }

    @PreDestroy
    public void close() {
        available = false;
        client.close();
    }

    private boolean backoff() {
        try {
            Thread.sleep(serviceProperties.getRetryBackoffMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
