package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Execution mode selection and the safety limits applied before live submission.
 * Values come from EXECUTION_MODE, PRIVATE_KEY, MIN_PROFIT_USD, MAX_SLIPPAGE_BPS,
 * MAX_CONCURRENT_TXS and HYBRID_CONFIDENCE_THRESHOLD (see application.yml).
 */
@ConfigurationProperties(prefix = "crosschain.execution")
@NoArgsConstructor
@Getter
@Setter
public class ExecutionProperties {

    public static final String PLACEHOLDER_PRIVATE_KEY = "0xYOUR_REAL_PRIVATE_KEY_HERE";
    public static final String PLACEHOLDER_EXECUTOR_ADDRESS = "0xYOUR_DEPLOYED_CONTRACT_ADDRESS_HERE";

    /** paper | live | hybrid. Unknown values fall back to paper. */
    private String mode = "paper";

    /** Signing key of the execution wallet. Only checked for presence here; signing happens in the executor. */
    private String privateKey = "";

    private BigDecimal minProfitUsd = new BigDecimal("5.0");

    private int maxSlippageBps = 50;

    /** Ceiling on trades submitted but not yet confirmed. */
    private int maxConcurrentTxs = 3;

    /** Hybrid mode sends a signal live when its confidence is at or above this value. */
    private double hybridConfidenceThreshold = 0.85;

    /** Trade records kept in memory per executor. */
    private int historySize = 500;

    private Paper paper = new Paper();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Paper {

        private BigDecimal initialCapitalUsd = new BigDecimal("100000");

        /** Applied to expected profit to model realistic fills. 0.998 = 0.2% slippage. */
        private BigDecimal slippageFactor = new BigDecimal("0.998");

        /** Gas cost charged when the signal does not carry one. */
        private BigDecimal defaultGasCostUsd = new BigDecimal("5.0");
    }
}
