package com.crosschain.arb.infra;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.config.ExecutorServiceProperties;
import com.crosschain.arb.domain.BatchExecutionResult;
import com.crosschain.arb.domain.ExecutorHealth;
import com.crosschain.arb.domain.ExecutorResponse;
import com.crosschain.arb.domain.TradeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExecutionManagerTest {

    private final TradeSignal signal = TradeSignal.builder()
            .chainId(137)
            .token("0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359")
            .amount(BigInteger.valueOf(1_000_000_000))
            .expectedProfitUsd(new BigDecimal("12.5"))
            .build();

    private ExecutionClient client;
    private ExecutionManager manager;

    @BeforeEach
    void setUp() {
        client = mock(ExecutionClient.class);
        ExecutorServiceProperties service = new ExecutorServiceProperties();
        service.setRetryBackoffMs(0);
        manager = new ExecutionManager(client, service, new ExecutionProperties());
    }

    @Test
    void firstAttemptSucceeds() {
        when(client.executeSignal(eq("LIVE_137_1"), any())).thenReturn(
                ExecutorResponse.builder().success(true).txHash("0xabc").build());

        ExecutorResponse response = manager.submitTrade("LIVE_137_1", signal);

        assertTrue(response.isSuccess());
        assertEquals(1, manager.sentCount());
        assertEquals(1, manager.succeededCount());
        assertEquals(0, manager.retriedCount());
        assertEquals(0, manager.failedCount());
    }

    @Test
    void retriesTransportFailureThenSucceeds() {
        when(client.executeSignal(any(), any()))
                .thenThrow(new ExecutorTransportException("connection refused"))
                .thenReturn(ExecutorResponse.builder().success(true).build());

        assertTrue(manager.submitTrade("LIVE_137_1", signal).isSuccess());
        assertEquals(1, manager.retriedCount());
        assertEquals(1, manager.succeededCount());
        verify(client, times(2)).executeSignal("LIVE_137_1", signal);
    }

    @Test
    void givesUpAfterThreeAttempts() {
        when(client.executeSignal(any(), any())).thenReturn(ExecutorResponse.failure("simulation failed"));

        ExecutorResponse response = manager.submitTrade("LIVE_137_1", signal);

        assertFalse(response.isSuccess());
        assertEquals("simulation failed", response.getError());
        verify(client, times(3)).executeSignal(any(), any());
        assertEquals(1, manager.sentCount());
        assertEquals(2, manager.retriedCount());
        assertEquals(1, manager.failedCount());
    }

    @Test
    void lastTransportErrorIsReported() {
        when(client.executeSignal(any(), any())).thenThrow(new ExecutorTransportException("timeout"));

        ExecutorResponse response = manager.submitTrade("LIVE_137_1", signal);

        assertFalse(response.isSuccess());
        assertEquals("timeout", response.getError());
        assertEquals(1, manager.failedCount());
    }

    @Test
    void initializeMarksChannelAvailable() {
        assertFalse(manager.isAvailable());
        when(client.healthCheck()).thenReturn(new ExecutorHealth("healthy", "LIVE", 3, null));

        assertTrue(manager.initialize());
        assertTrue(manager.isAvailable());
        assertEquals("LIVE", manager.getServerMode());
    }

    @Test
    void unhealthyServiceStaysUnavailable() {
        when(client.healthCheck()).thenReturn(ExecutorHealth.unreachable("connection refused"));

        assertFalse(manager.initialize());
        assertFalse(manager.isAvailable());
    }

    @Test
    void batchUpdatesCounters() {
        when(client.executeBatch(anyMap())).thenReturn(
                BatchExecutionResult.builder().total(2).succeeded(1).failed(1).build());

        manager.submitBatch(Map.of("LIVE_137_1", signal, "LIVE_137_2", signal));

        assertEquals(2, manager.sentCount());
        assertEquals(1, manager.succeededCount());
        assertEquals(1, manager.failedCount());
    }

    @Test
    void statisticsIncludeClientCounters() {
        when(client.getStats()).thenThrow(new ExecutorTransportException("down"));

        Map<String, Object> stats = manager.getStatistics();

        assertEquals(0L, stats.get("sent"));
        assertEquals("PAPER", stats.get("mode"));
        assertNull(stats.get("server"));
    }
}
