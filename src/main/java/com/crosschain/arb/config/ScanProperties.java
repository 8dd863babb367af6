package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "crosschain.scan")
@NoArgsConstructor
@Getter
@Setter
public class ScanProperties {

    /** Chain whose gas price feeds the forecaster. Polygon by default. */
    private int primaryChainId = 137;

    /** Worker threads for gas fetches and edge evaluations. */
    private int workerThreads = 20;

    /** Pause between the end of one cycle and the start of the next. */
    private long cycleDelayMs = 1_000;

    /** Deadline for all evaluations of a cycle; unfinished tasks are abandoned. */
    private long cycleTimeoutMs = 60_000;

    /** Grace period for in-flight evaluations on shutdown. */
    private long shutdownGraceMs = 10_000;

    /** Loan size the evaluator starts from, in whole tokens, before the liquidity guard clamps it. */
    private BigDecimal targetTradeTokens = new BigDecimal("10000");

    /** Flat gas estimate per trade in USD. */
    private BigDecimal gasCostUsd = new BigDecimal("2.00");

    /** Flash loan fee rate. Balancer V3 charges nothing. */
    private BigDecimal flashFeeRate = BigDecimal.ZERO;

    /** Uniswap V3 fee tier of the outbound hop (token to wrapped native). */
    private int outboundFeeTier = 500;

    /** Uniswap V3 fee tier of the return hop. */
    private int returnFeeTier = 3000;

    /** Slippage estimate attached to signals, in basis points. */
    private int estimatedSlippageBps = 20;

    /** Address used for bridge route calculation. */
    private String quoteUserAddress = "0x0000000000000000000000000000000000000000";

    /** Period of the readiness and performance report. */
    private long reportIntervalMs = 60_000;
}
