package com.crosschain.arb.core;

import com.crosschain.arb.config.ScanProperties;
import com.crosschain.arb.core.execution.TradeExecutor;
import com.crosschain.arb.domain.BridgeOpportunity;
import com.crosschain.arb.domain.BridgeQuote;
import com.crosschain.arb.domain.ChainDescriptor;
import com.crosschain.arb.domain.ExecutionResult;
import com.crosschain.arb.domain.ProfitBreakdown;
import com.crosschain.arb.domain.RouteHop;
import com.crosschain.arb.domain.TokenNode;
import com.crosschain.arb.domain.TradeSignal;
import com.crosschain.arb.infra.BridgeRouteProvider;
import com.crosschain.arb.infra.ChainCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint24;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates one bridge edge end to end: liquidity, bridge route, DEX quotes, profit and routing.
 * Every failure is contained here and reported as an outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpportunityEvaluator {

    static final int PROTOCOL_UNISWAP_V3 = 2;

    private final ChainRegistry chainRegistry;
    private final ChainCatalog catalog;
    private final OpportunityGraph graph;
    private final LiquidityGuard liquidityGuard;
    private final BridgeRouteProvider bridgeRouteProvider;
    private final PriceSimulator priceSimulator;
    private final ProfitEngine profitEngine;
    private final ConfidenceAdvisor confidenceAdvisor;
    private final TradeExecutor tradeExecutor;
    private final ScanMetrics metrics;
    private final ScanProperties properties;

    public EvaluationOutcome evaluate(BridgeOpportunity opp, Map<Integer, Double> gasMap) {
        EvaluationOutcome outcome;
        try {
            outcome = doEvaluate(opp, gasMap);
        } catch (Exception e) {
            log.error("[{}] Evaluation of {} -> {} failed", chainRegistry.getChainName(opp.getSrcChain()),
                    opp.getToken(), chainRegistry.getChainName(opp.getDstChain()), e);
            outcome = EvaluationOutcome.ERROR;
        }
        metrics.record(outcome);
        return outcome;
    }

    private EvaluationOutcome doEvaluate(BridgeOpportunity opp, Map<Integer, Double> gasMap) {
        int src = opp.getSrcChain();
        String chain = chainRegistry.getChainName(src);

        if (chainRegistry.connection(src).isEmpty()) {
            log.debug("[{}] No validated RPC, skipping {}", chain, opp.getToken());
            return EvaluationOutcome.NO_RPC;
        }
        if (!opp.isStablecoin()) {
            log.debug("[{}] {} is not USD denominated, skipping", chain, opp.getToken());
            return EvaluationOutcome.NOT_USD_DENOMINATED;
        }

        BigDecimal unit = BigDecimal.TEN.pow(opp.getDecimals());
        BigInteger targetRaw = properties.getTargetTradeTokens().multiply(unit).toBigInteger();
        BigInteger loan = liquidityGuard.sizeSafeLoan(opp.getTokenAddrSrc(), targetRaw, opp.getDecimals(), src);
        if (loan.signum() == 0) {
            return EvaluationOutcome.INSUFFICIENT_LIQUIDITY;
        }

        BridgeQuote quote = bridgeRouteProvider.getRoute(src, opp.getDstChain(), opp.getTokenAddrSrc(),
                opp.getTokenAddrDst(), loan, properties.getQuoteUserAddress());
        if (quote == null) {
            log.debug("[{}] No bridge route for {} to {}", chain, opp.getToken(), chainRegistry.getChainName(opp.getDstChain()));
            return EvaluationOutcome.NO_BRIDGE_ROUTE;
        }

        Optional<TokenNode> wrapped = graph.wrappedNative(src);
        if (wrapped.isEmpty()) {
            log.debug("[{}] No wrapped native token to route through", chain);
            return EvaluationOutcome.NO_INTERMEDIATE;
        }
        String intermediate = wrapped.get().getAddress();

        BigInteger out1 = priceSimulator.quoteSingleHopOutput(src, opp.getTokenAddrSrc(), intermediate, loan,
                properties.getOutboundFeeTier());
        if (out1.signum() == 0) {
            return EvaluationOutcome.NO_QUOTE;
        }
        BigInteger out2 = priceSimulator.quoteSingleHopOutput(src, intermediate, opp.getTokenAddrSrc(), out1,
                properties.getReturnFeeTier());
        if (out2.signum() == 0) {
            return EvaluationOutcome.NO_QUOTE;
        }

        // Stablecoin loop: one token is worth one dollar
        BigDecimal loanUsd = new BigDecimal(loan).divide(unit, MathContext.DECIMAL64);
        BigDecimal grossUsd = new BigDecimal(out2).divide(unit, MathContext.DECIMAL64);
        BigDecimal bridgeFee = quote.getFeeUsd() != null ? quote.getFeeUsd() : BigDecimal.ZERO;

        ProfitBreakdown profit = profitEngine.computeNetProfit(loanUsd, grossUsd, bridgeFee,
                properties.getGasCostUsd(), properties.getFlashFeeRate());
        if (!profit.isProfitable()) {
            log.debug("[{}] {} unprofitable: net ${}", chain, opp.getToken(), profit.getNetProfit());
            return EvaluationOutcome.UNPROFITABLE;
        }
        log.info("[{}] PROFIT FOUND: {} | loan ${} | net ${} | fees ${} | via {}", chain, opp.getToken(),
                loanUsd, profit.getNetProfit(), profit.getTotalFees(), quote.getBridgeName());

        TradeSignal signal = buildSignal(opp, loan, intermediate, profit, loanUsd, quote, gasMap.getOrDefault(src, 0.0));
        ExecutionResult result = tradeExecutor.submit(signal);
        if (result.isFailed()) {
            log.warn("[{}] {} not executed: {}", chain, opp.getToken(), result.getError());
            return EvaluationOutcome.REJECTED;
        }
        log.info("[{}] {} {} as {}", chain, opp.getToken(), result.getStatus(), result.getTradeId());
        return EvaluationOutcome.EXECUTED;
    }

    TradeSignal buildSignal(BridgeOpportunity opp, BigInteger loan, String intermediate, ProfitBreakdown profit,
                            BigDecimal loanUsd, BridgeQuote quote, double gasGwei) {
        int src = opp.getSrcChain();
        String router = catalog.find(src).map(ChainDescriptor::getSwapRouterAddress).orElse(null);

        return TradeSignal.builder()
                .chainId(src)
                .token(opp.getTokenAddrSrc())
                .amount(loan)
                .flashSource(TradeSignal.FLASH_SOURCE_BALANCER)
                .hop(new RouteHop(PROTOCOL_UNISWAP_V3, router))
                .hop(new RouteHop(PROTOCOL_UNISWAP_V3, router))
                .pathToken(opp.getTokenAddrSrc())
                .pathToken(intermediate)
                .pathToken(opp.getTokenAddrSrc())
                .extra(encodeFeeTier(properties.getOutboundFeeTier()))
                .extra(encodeFeeTier(properties.getReturnFeeTier()))
                .expectedProfitUsd(profit.getNetProfit())
                .estimatedSlippageBps(properties.getEstimatedSlippageBps())
                .confidence(confidenceAdvisor.confidence(opp))
                .gasCostUsd(properties.getGasCostUsd())
                .notionalUsd(loanUsd)
                .hint("gas_price_gwei", gasGwei)
                .hint("dst_chain", opp.getDstChain())
                .hint("bridge", quote.getBridgeName())
                .hint("ai_params", confidenceAdvisor.recommendParameters(src))
                .build();
    }

    static String encodeFeeTier(int fee) {
        return "0x" + TypeEncoder.encode(new Uint24(BigInteger.valueOf(fee)));
    }
}
