package com.crosschain.arb.core;

import com.crosschain.arb.config.ExecutionProperties;
import com.crosschain.arb.config.LiquidityProperties;
import com.crosschain.arb.core.execution.ExecutionUpdateSubscriber;
import com.crosschain.arb.domain.ExecutionMode;
import com.crosschain.arb.infra.ExecutionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Startup gate. Refuses to start when the executing chain has no healthy RPC or when the execution
 * configuration is unsafe; otherwise connects the execution service and arms the scan loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SystemReadinessValidator implements ApplicationRunner {

    private final ChainRegistry chainRegistry;
    private final ExecutionProperties executionProperties;
    private final LiquidityProperties liquidityProperties;
    private final ExecutionManager executionManager;
    private final ExecutionUpdateSubscriber updateSubscriber;
    private final ScanLoop scanLoop;

    @Override
    public void run(ApplicationArguments args) {
        validate();

        ExecutionMode mode = ExecutionMode.parse(executionProperties.getMode()).orElseThrow();
        if (mode != ExecutionMode.PAPER) {
            if (!executionManager.initialize()) {
                log.error("Execution service unreachable. {} trades will fail until it is healthy", mode);
            }
            updateSubscriber.start();
        }

        chainRegistry.logExecutionSummary();
        scanLoop.arm();
        log.info("System ready: {} mode, executing on {}", mode, chainRegistry.getEnabledChains().stream()
                .map(chainRegistry::getChainName).toList());
    }

    void validate() {
        List<String> problems = new ArrayList<>();

        Optional<ExecutionMode> mode = ExecutionMode.parse(executionProperties.getMode());
        if (mode.isEmpty()) {
            problems.add("Unknown execution mode '" + executionProperties.getMode() + "' (paper, live or hybrid)");
        }

        Map<Integer, Boolean> health = chainRegistry.validateAllConfigured();
        for (Integer chainId : chainRegistry.getEnabledChains()) {
            if (!Boolean.TRUE.equals(health.get(chainId))) {
                problems.add("No healthy RPC for execution chain " + chainRegistry.getChainName(chainId));
            }
        }

        if (mode.isPresent() && mode.get() != ExecutionMode.PAPER) {
            String key = executionProperties.getPrivateKey();
            if (key == null || ExecutionProperties.PLACEHOLDER_PRIVATE_KEY.equals(key.strip())
                    || !WalletUtils.isValidPrivateKey(key.strip())) {
                problems.add("PRIVATE_KEY missing, placeholder or malformed");
            }
            for (Integer chainId : chainRegistry.getEnabledChains()) {
                Optional<String> executor = chainRegistry.getExecutorAddress(chainId);
                if (executor.isEmpty() || ExecutionProperties.PLACEHOLDER_EXECUTOR_ADDRESS.equals(executor.get())
                        || !WalletUtils.isValidAddress(executor.get())) {
                    problems.add("Executor contract address missing or invalid for " + chainRegistry.getChainName(chainId));
                }
            }
        }

        checkSafetyParameters(problems);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Readiness check failed: {}", problem));
            throw new ConfigurationException("System not ready: " + String.join("; ", problems));
        }
    }

    private void checkSafetyParameters(List<String> problems) {
        if (executionProperties.getMinProfitUsd() == null || executionProperties.getMinProfitUsd().signum() <= 0) {
            problems.add("MIN_PROFIT_USD must be positive");
        }
        if (executionProperties.getMaxSlippageBps() <= 0 || executionProperties.getMaxSlippageBps() > 10_000) {
            problems.add("MAX_SLIPPAGE_BPS must be between 1 and 10000");
        }
        if (executionProperties.getMaxConcurrentTxs() < 1) {
            problems.add("MAX_CONCURRENT_TXS must be at least 1");
        }
        double threshold = executionProperties.getHybridConfidenceThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            problems.add("HYBRID_CONFIDENCE_THRESHOLD must be within [0, 1]");
        }
        BigDecimal share = liquidityProperties.getMaxShareFraction();
        if (share == null || share.signum() <= 0 || share.compareTo(BigDecimal.ONE) > 0) {
            problems.add("Liquidity share fraction must be within (0, 1]");
        }
    }
}
