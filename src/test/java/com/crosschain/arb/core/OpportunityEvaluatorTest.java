package com.crosschain.arb.core;

import com.crosschain.arb.config.ScanProperties;
import com.crosschain.arb.core.execution.TradeExecutor;
import com.crosschain.arb.domain.BridgeOpportunity;
import com.crosschain.arb.domain.BridgeQuote;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.TokenNode;
import com.crosschain.arb.domain.TradeSignal;
import com.crosschain.arb.domain.TradeStatus;
import com.crosschain.arb.infra.BridgeRouteProvider;
import com.crosschain.arb.infra.ChainCatalog;
import com.crosschain.arb.infra.ChainRpc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OpportunityEvaluatorTest {

    private static final String USDC_POLYGON = "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359";
    private static final String USDC_ARBITRUM = "0xaf88d065e77c8cC2239327C5EDb3A432268e5831";
    private static final String WMATIC = "0x0d500B1d8E8eF31E21C99d1Db9A6444d3ADf1270";
    private static final BigInteger LOAN = new BigInteger("10000000000"); // 10,000 USDC

    private ChainRegistry registry;
    private OpportunityGraph graph;
    private LiquidityGuard guard;
    private BridgeRouteProvider bridge;
    private PriceSimulator simulator;
    private TradeExecutor executor;
    private ScanMetrics metrics;
    private OpportunityEvaluator evaluator;

    private final BridgeOpportunity usdc = BridgeOpportunity.builder()
            .srcChain(137).dstChain(42161).token("USDC")
            .tokenAddrSrc(USDC_POLYGON).tokenAddrDst(USDC_ARBITRUM)
            .decimals(6).stablecoin(true)
            .build();

    @BeforeEach
    void setUp() {
        registry = mock(ChainRegistry.class);
        graph = mock(OpportunityGraph.class);
        guard = mock(LiquidityGuard.class);
        bridge = mock(BridgeRouteProvider.class);
        simulator = mock(PriceSimulator.class);
        executor = mock(TradeExecutor.class);
        metrics = new ScanMetrics();

        when(registry.getChainName(anyInt())).thenReturn("polygon");
        when(registry.connection(137)).thenReturn(Optional.of(mock(ChainRpc.class)));
        when(graph.wrappedNative(137)).thenReturn(Optional.of(TokenNode.builder()
                .chainId(137).symbol("WMATIC").address(WMATIC).decimals(18).wrappedNative(true).build()));
        when(guard.sizeSafeLoan(USDC_POLYGON, LOAN, 6, 137)).thenReturn(LOAN);
        when(bridge.getRoute(137, 42161, USDC_POLYGON, USDC_ARBITRUM, LOAN, "0x0000000000000000000000000000000000000000"))
                .thenReturn(BridgeQuote.builder().bridgeName("stargate").estimatedOutput(LOAN)
                        .feeUsd(new BigDecimal("1.50")).build());
        when(simulator.quoteSingleHopOutput(137, USDC_POLYGON, WMATIC, LOAN, 500))
                .thenReturn(new BigInteger("25000000000000000000000"));

        evaluator = new OpportunityEvaluator(registry, new ChainCatalog(), graph, guard, bridge, simulator,
                new ProfitEngine(), new StaticConfidenceAdvisor(), executor, metrics, new ScanProperties());
    }

    private void returnLegOutputs(String rawUsdc) {
        when(simulator.quoteSingleHopOutput(137, WMATIC, USDC_POLYGON, new BigInteger("25000000000000000000000"), 3000))
                .thenReturn(new BigInteger(rawUsdc));
    }

    private static ExecutionResult simulated() {
        return ExecutionResult.builder().tradeId("PAPER_137_1").status(TradeStatus.SIMULATED)
                .mode(ExecutionMode.PAPER).paper(true).build();
    }

    @Test
    void profitableEdgeIsSubmitted() {
        returnLegOutputs("10020000000"); // 10,020 USDC back
        when(executor.submit(any())).thenReturn(simulated());

        assertEquals(EvaluationOutcome.EXECUTED, evaluator.evaluate(usdc, Map.of(137, 42.0)));

        ArgumentCaptor<TradeSignal> captor = ArgumentCaptor.forClass(TradeSignal.class);
        verify(executor).submit(captor.capture());
        TradeSignal signal = captor.getValue();
        assertEquals(137, signal.getChainId());
        assertEquals(USDC_POLYGON, signal.getToken());
        assertEquals(LOAN, signal.getAmount());
        assertEquals(TradeSignal.FLASH_SOURCE_BALANCER, signal.getFlashSource());
        assertEquals(List.of(2, 2), signal.getProtocols());
        assertEquals(List.of(USDC_POLYGON, WMATIC, USDC_POLYGON), signal.getPath());
        assertEquals(2, signal.getExtras().size());
        assertTrue(signal.getExtras().get(0).endsWith("1f4"));
        assertTrue(signal.getExtras().get(1).endsWith("bb8"));
        // 20 gross - 1.50 bridge - 2.00 gas
        assertEquals(0, new BigDecimal("16.50").compareTo(signal.getExpectedProfitUsd()));
        assertEquals(0.90, signal.getConfidence());
        assertEquals(20, signal.getEstimatedSlippageBps());
        assertEquals(42.0, signal.getHints().get("gas_price_gwei"));
        assertEquals(1, metrics.count(EvaluationOutcome.EXECUTED));
    }

    @Test
    void unprofitableEdgeIsNotSubmitted() {
        returnLegOutputs("10003000000"); // 3 gross, 3.50 fees
        assertEquals(EvaluationOutcome.UNPROFITABLE, evaluator.evaluate(usdc, Map.of()));
        verifyNoInteractions(executor);
    }

    @Test
    void failedExecutionIsRejected() {
        returnLegOutputs("10020000000");
        when(executor.submit(any())).thenReturn(ExecutionResult.failed("LIVE_137_1", ExecutionMode.LIVE, "Slippage"));

        assertEquals(EvaluationOutcome.REJECTED, evaluator.evaluate(usdc, Map.of()));
    }

    @Test
    void missingConnection() {
        when(registry.connection(137)).thenReturn(Optional.empty());
        assertEquals(EvaluationOutcome.NO_RPC, evaluator.evaluate(usdc, Map.of()));
        verifyNoInteractions(guard);
    }

    @Test
    void nonStablecoinSkipped() {
        BridgeOpportunity weth = BridgeOpportunity.builder()
                .srcChain(137).dstChain(42161).token("WETH")
                .tokenAddrSrc("0x7ceB23fD6bC0adD59E62ac25578270cFf1b9f619")
                .tokenAddrDst("0x82aF49447D8a07e3bd95BD0d56f35241523fBab1")
                .decimals(18).stablecoin(false)
                .build();
        assertEquals(EvaluationOutcome.NOT_USD_DENOMINATED, evaluator.evaluate(weth, Map.of()));
        verifyNoInteractions(guard);
    }

    @Test
    void insufficientLiquidity() {
        when(guard.sizeSafeLoan(USDC_POLYGON, LOAN, 6, 137)).thenReturn(BigInteger.ZERO);
        assertEquals(EvaluationOutcome.INSUFFICIENT_LIQUIDITY, evaluator.evaluate(usdc, Map.of()));
        verifyNoInteractions(bridge);
    }

    @Test
    void noBridgeRoute() {
        when(bridge.getRoute(anyInt(), anyInt(), anyString(), anyString(), any(), anyString())).thenReturn(null);
        assertEquals(EvaluationOutcome.NO_BRIDGE_ROUTE, evaluator.evaluate(usdc, Map.of()));
        verifyNoInteractions(simulator);
    }

    @Test
    void noWrappedNative() {
        when(graph.wrappedNative(137)).thenReturn(Optional.empty());
        assertEquals(EvaluationOutcome.NO_INTERMEDIATE, evaluator.evaluate(usdc, Map.of()));
    }

    @Test
    void zeroQuote() {
        returnLegOutputs("0");
        assertEquals(EvaluationOutcome.NO_QUOTE, evaluator.evaluate(usdc, Map.of()));
        verifyNoInteractions(executor);
    }

    @Test
    void exceptionIsContained() {
        when(bridge.getRoute(anyInt(), anyInt(), anyString(), anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("boom"));

        assertEquals(EvaluationOutcome.ERROR, evaluator.evaluate(usdc, Map.of()));
        assertEquals(1, metrics.count(EvaluationOutcome.ERROR));

        // The next edge is unaffected
        doReturn(null).when(bridge).getRoute(anyInt(), anyInt(), anyString(), anyString(), any(), anyString());
        assertEquals(EvaluationOutcome.NO_BRIDGE_ROUTE, evaluator.evaluate(usdc, Map.of()));
    }

    @Test
    void feeTierEncoding() {
        assertEquals("0x00000000000000000000000000000000000000000000000000000000000001f4",
                OpportunityEvaluator.encodeFeeTier(500));
    }
}
