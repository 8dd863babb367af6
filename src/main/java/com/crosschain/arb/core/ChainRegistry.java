package com.crosschain.arb.core;

import com.crosschain.arb.domain.ChainDescriptor;
import com.crosschain.arb.domain.ExecutionState;
import com.crosschain.arb.infra.ChainCatalog;
import com.crosschain.arb.infra.ChainConnections;
import com.crosschain.arb.infra.ChainRpc;
import com.crosschain.arb.infra.ChainRpcFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution permission per chain plus the validated RPC connections used in steady state.
 * <p>
 * The permission table is fixed at build time. Only Polygon may execute; Ethereum and Arbitrum are
 * wired up for scanning but never execute. Nothing escalates a chain at runtime.
 */
@Slf4j
@Component
public class ChainRegistry implements ChainConnections {

    static final Set<Integer> ENABLED_CHAINS = Set.of(ChainCatalog.POLYGON);
    static final Set<Integer> CONFIGURED_CHAINS = Set.of(ChainCatalog.ETHEREUM, ChainCatalog.ARBITRUM);

    private final ChainCatalog catalog;
    private final ChainRpcFactory rpcFactory;
    private final Environment environment;

    private final Map<Integer, ChainRpc> validatedRpcs = new ConcurrentHashMap<>();
    private final Map<Integer, Boolean> health = new ConcurrentHashMap<>();

    public ChainRegistry(ChainCatalog catalog, ChainRpcFactory rpcFactory, Environment environment) {
        this.catalog = catalog;
        this.rpcFactory = rpcFactory;
        this.environment = environment;
    }

    public ExecutionState getExecutionState(int chainId) {
        if (ENABLED_CHAINS.contains(chainId)) {
            return ExecutionState.ENABLED;
        }
        if (CONFIGURED_CHAINS.contains(chainId)) {
            return ExecutionState.CONFIGURED;
        }
        return ExecutionState.DISABLED;
    }

    public boolean isExecutionEnabled(int chainId) {
        return getExecutionState(chainId) == ExecutionState.ENABLED;
    }

    public boolean isConfigured(int chainId) {
        return getExecutionState(chainId).isConfigured();
    }

    public String getChainName(int chainId) {
        return catalog.find(chainId).map(ChainDescriptor::getName).orElse("chain-" + chainId);
    }

    public List<Integer> getEnabledChains() {
        return catalog.chainIds().stream().filter(this::isExecutionEnabled).toList();
    }

    public List<Integer> getConfiguredChains() {
        return catalog.chainIds().stream().filter(this::isConfigured).toList();
    }

    /**
     * RPC URL from the chain's environment key. Local endpoints and non-HTTP schemes are refused.
     */
    public Optional<String> resolveRpcUrl(int chainId) {
        Optional<ChainDescriptor> chain = catalog.find(chainId);
        if (chain.isEmpty()) {
            log.warn("No chain metadata for chain {}", chainId);
            return Optional.empty();
        }
        String key = chain.get().getRpcEnvKey();
        String url = environment.getProperty(key);
        if (url == null || url.isBlank()) {
            log.warn("[{}] {} is not set", chain.get().getName(), key);
            return Optional.empty();
        }
        url = url.strip();
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("localhost") || lower.contains("127.0.0.1")) {
            log.warn("[{}] Refusing local RPC endpoint in {}", chain.get().getName(), key);
            return Optional.empty();
        }
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            log.warn("[{}] {} must start with http:// or https://", chain.get().getName(), key);
            return Optional.empty();
        }
        return Optional.of(url);
    }

    public Optional<String> getExecutorAddress(int chainId) {
        return catalog.find(chainId)
                .map(ChainDescriptor::getExecutorEnvKey)
                .map(environment::getProperty)
                .map(String::strip)
                .filter(address -> !address.isEmpty());
    }

    /**
     * Connects and fetches the latest block. Never throws; failures are logged and recorded as unhealthy.
     */
    public boolean validateHealth(int chainId) {
        String name = getChainName(chainId);
        Optional<String> url = resolveRpcUrl(chainId);
        if (url.isEmpty()) {
            health.put(chainId, false);
            return false;
        }
        ChainRpc rpc = null;
        try {
            rpc = rpcFactory.connect(url.get());
            BigInteger block = rpc.blockNumber();
            ChainRpc previous = validatedRpcs.put(chainId, rpc);
            if (previous != null && previous != rpc) {
                previous.close();
            }
            health.put(chainId, true);
            log.info("[{}] RPC healthy at block {}", name, block);
            return true;
        } catch (Exception e) {
            log.error("[{}] RPC health check failed: {}", name, e.getMessage());
            if (rpc != null) {
                rpc.close();
            }
            ChainRpc stale = validatedRpcs.remove(chainId);
            if (stale != null) {
                stale.close();
            }
            health.put(chainId, false);
            return false;
        }
    }

    public Map<Integer, Boolean> validateAllConfigured() {
        Map<Integer, Boolean> results = new LinkedHashMap<>();
        for (Integer chainId : getConfiguredChains()) {
            results.put(chainId, validateHealth(chainId));
        }
        return results;
    }

    @Override
    public Optional<ChainRpc> connection(int chainId) {
        return Optional.ofNullable(validatedRpcs.get(chainId));
    }

    public List<Integer> connectedChains() {
        return catalog.chainIds().stream().filter(validatedRpcs::containsKey).toList();
    }

    public boolean isHealthy(int chainId) {
        return Boolean.TRUE.equals(health.get(chainId));
    }

    public Map<Integer, Boolean> healthSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(health));
    }

    public void logExecutionSummary() {
        log.info("Chain execution summary:");
        for (ChainDescriptor chain : catalog.all()) {
            ExecutionState state = getExecutionState(chain.getChainId());
            String rpc = health.containsKey(chain.getChainId())
                    ? (isHealthy(chain.getChainId()) ? "healthy" : "unhealthy")
                    : "unchecked";
            log.info("  {} ({}): {} | rpc {}", chain.getName(), chain.getChainId(), state, rpc);
        }
    }

    @PreDestroy
    public void close() {
        validatedRpcs.values().forEach(ChainRpc::close);
        validatedRpcs.clear();
    }
}
