package com.crosschain.arb.core;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.config.LiquidityProperties;
import com.crosschain.arb.core.execution.ExecutionUpdateSubscriber;
import com.crosschain.arb.infra.ExecutionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SystemReadinessValidatorTest {

    private static final String VALID_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String VALID_EXECUTOR = "0x52908400098527886E0F7030069857D2E4169EE7";

    private ChainRegistry registry;
    private ExecutionProperties execution;
    private LiquidityProperties liquidity;
    private ExecutionManager manager;
    private ExecutionUpdateSubscriber subscriber;
    private ScanLoop scanLoop;
    private SystemReadinessValidator validator;

    @BeforeEach
    void setUp() {
        registry = mock(ChainRegistry.class);
        execution = new ExecutionProperties();
        liquidity = new LiquidityProperties();
        manager = mock(ExecutionManager.class);
        subscriber = mock(ExecutionUpdateSubscriber.class);
        scanLoop = mock(ScanLoop.class);

        when(registry.getEnabledChains()).thenReturn(List.of(137));
        when(registry.getChainName(137)).thenReturn("polygon");
        when(registry.validateAllConfigured()).thenReturn(Map.of(1, false, 137, true, 42161, false));
        when(registry.getExecutorAddress(137)).thenReturn(Optional.of(VALID_EXECUTOR));

        validator = new SystemReadinessValidator(registry, execution, liquidity, manager, subscriber, scanLoop);
    }

    @Test
    void paperModeArmsWithoutExecutionService() {
        validator.run(null);

        verify(scanLoop).arm();
        verifyNoInteractions(manager, subscriber);
    }

    @Test
    void unhealthyExecutionChainFailsStartup() {
        when(registry.validateAllConfigured()).thenReturn(Map.of(1, true, 137, false, 42161, true));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> validator.run(null));
        assertTrue(e.getMessage().contains("polygon"));
        verify(scanLoop, never()).arm();
    }

    @Test
    void unknownModeFailsStartup() {
        execution.setMode("yolo");

        assertThrows(ConfigurationException.class, () -> validator.run(null));
    }

    @Test
    void liveModeRequiresRealKey() {
        execution.setMode("live");
        execution.setPrivateKey(ExecutionProperties.PLACEHOLDER_PRIVATE_KEY);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> validator.run(null));
        assertTrue(e.getMessage().contains("PRIVATE_KEY"));
    }

    @Test
    void liveModeRequiresExecutorAddress() {
        execution.setMode("hybrid");
        execution.setPrivateKey(VALID_KEY);
        when(registry.getExecutorAddress(137)).thenReturn(Optional.of(ExecutionProperties.PLACEHOLDER_EXECUTOR_ADDRESS));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> validator.run(null));
        assertTrue(e.getMessage().contains("Executor contract address"));
    }

    @Test
    void liveModeConnectsExecutionServiceAndStream() {
        execution.setMode("live");
        execution.setPrivateKey(VALID_KEY);
        when(manager.initialize()).thenReturn(true);

        validator.run(null);

        verify(manager).initialize();
        verify(subscriber).start();
        verify(scanLoop).arm();
    }

    @Test
    void unreachableExecutionServiceIsNotFatal() {
        execution.setMode("live");
        execution.setPrivateKey(VALID_KEY);
        when(manager.initialize()).thenReturn(false);

        validator.run(null);

        verify(scanLoop).arm();
    }

    @Test
    void safetyParametersOutOfRange() {
        execution.setMaxSlippageBps(0);
        execution.setHybridConfidenceThreshold(1.5);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> validator.run(null));
        assertTrue(e.getMessage().contains("MAX_SLIPPAGE_BPS"));
        assertTrue(e.getMessage().contains("HYBRID_CONFIDENCE_THRESHOLD"));
    }
}
