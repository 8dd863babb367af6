package com.crosschain.arb.core.execution;

import com.crosschain.arb.config.ExecutorServiceProperties;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.infra.ExecutionClient;
import com.crosschain.arb.infra.ExecutionUpdateListener;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.WebSocket;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds asynchronous trade outcomes from the execution service back into the active executor.
 * Only live and hybrid modes subscribe. A dropped stream is reopened after a fixed delay.
 */
@Slf4j
@Component
public class ExecutionUpdateSubscriber implements ExecutionUpdateListener {

    private final ExecutionClient client;
    private final TradeExecutor executor;
    private final TaskScheduler scheduler;
    private final ExecutorServiceProperties properties;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong received = new AtomicLong();
    private volatile WebSocket socket;

    public ExecutionUpdateSubscriber(ExecutionClient client, TradeExecutor executor, TaskScheduler scheduler,
                                     ExecutorServiceProperties properties) {
        this.client = client;
        this.executor = executor;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public void start() {
        if (executor.mode() == ExecutionMode.PAPER) {
            log.info("Paper mode: no execution update stream");
            return;
        }
        if (running.compareAndSet(false, true)) {
            connect();
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            WebSocket current = socket;
            if (current != null) {
                current.close(1000, "shutdown");
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long receivedCount() {
        return received.get();
    }

    private void connect() {
        if (running.get()) {
            socket = client.streamUpdates(this);
        }
    }

    @Override
    public void onUpdate(ExecutionUpdate update) {
        if (!"result".equals(update.getType())) {
            log.debug("Stream event {}", update.getType());
            return;
        }
        received.incrementAndGet();
        if (update.getTradeId() == null) {
            log.warn("Result event without trade id: {}", update);
            return;
        }
        executor.recordExecutionResult(update.getTradeId(), update);
    }

    @Override
    public void onClosed(Throwable cause) {
        socket = null;
        if (!running.get()) {
            return;
        }
        long delay = properties.getStreamReconnectDelayMs();
        log.warn("Execution update stream lost{}; reconnecting in {} ms",
                cause != null ? " (" + cause.getMessage() + ")" : "", delay);
        scheduler.schedule(this::connect, Instant.now().plus(Duration.ofMillis(delay)));
    }
}
