package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ChainDescriptor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static chain metadata. Which of these chains may execute is decided by ChainRegistry, not here.
 */
@Component
public class ChainCatalog {

    public static final int ETHEREUM = 1;
    public static final int OPTIMISM = 10;
    public static final int POLYGON = 137;
    public static final int BASE = 8453;
    public static final int ARBITRUM = 42161;

    private static final String QUOTER_V2 = "0x61fFE014bA17989E743c5F6cB21bF9697530B21e";
    private static final String SWAP_ROUTER_02 = "0x68b3465833fb72A70ecDF485E0e4C7bD8665Fc45";
    private static final String BALANCER_V3_VAULT = "0xbA1333333333a1BA1108E8412f11850A5C319bA9";

    private final Map<Integer, ChainDescriptor> chains = new LinkedHashMap<>();

    public ChainCatalog() {
        register(chain(ETHEREUM, "ethereum", "ETH", "ETHEREUM")
                .quoterAddress(QUOTER_V2).swapRouterAddress(SWAP_ROUTER_02).build());
        register(chain(OPTIMISM, "optimism", "ETH", "OPTIMISM")
                .quoterAddress(QUOTER_V2).swapRouterAddress(SWAP_ROUTER_02).build());
        register(chain(POLYGON, "polygon", "MATIC", "POLYGON")
                .quoterAddress(QUOTER_V2).swapRouterAddress(SWAP_ROUTER_02).build());
        register(chain(BASE, "base", "ETH", "BASE")
                .quoterAddress("0x3d4e44Eb1374240CE5F1B871ab261CD16335B76a")
                .swapRouterAddress("0x2626664c2603336E57B271c5C0b26F421741e481").build());
        register(chain(ARBITRUM, "arbitrum", "ETH", "ARBITRUM")
                .quoterAddress(QUOTER_V2).swapRouterAddress(SWAP_ROUTER_02).build());
    }

    private static ChainDescriptor.ChainDescriptorBuilder chain(int id, String name, String nativeSymbol, String envSuffix) {
        return ChainDescriptor.builder()
                .chainId(id)
                .name(name)
                .nativeSymbol(nativeSymbol)
                .rpcEnvKey("RPC_" + envSuffix)
                .wssEnvKey("WSS_" + envSuffix)
                .executorEnvKey("EXECUTOR_ADDRESS_" + envSuffix)
                .lenderAddress(BALANCER_V3_VAULT);
    }

    private void register(ChainDescriptor descriptor) {
        chains.put(descriptor.getChainId(), descriptor);
    }

    public Optional<ChainDescriptor> find(int chainId) {
        return Optional.ofNullable(chains.get(chainId));
    }

    public Collection<ChainDescriptor> all() {
        return chains.values();
    }

    public List<Integer> chainIds() {
        return List.copyOf(chains.keySet());
    }
}
