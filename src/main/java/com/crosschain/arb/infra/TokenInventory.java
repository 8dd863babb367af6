package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ChainDescriptor;
import com.crosschain.arb.domain.TokenNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only token and chain configuration. Data is treated as already validated.
 */
public interface TokenInventory {

    Optional<ChainDescriptor> getChainConfig(int chainId);

    List<Integer> getAllChainIds();

    Optional<String> getTokenAddress(int chainId, String symbol);

    /**
     * Token tables for the given chains, in the order requested. Unknown chains map to an empty table.
     */
    Map<Integer, Map<String, TokenNode>> fetchAllChains(List<Integer> chainIds);

    /** Symbols that can be moved between chains. */
    List<String> bridgeAssets();
}
