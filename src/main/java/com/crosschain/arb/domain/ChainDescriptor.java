package com.crosschain.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Static description of one network. Built once from the chain catalog and never mutated.
 */
@Value
@Builder
public class ChainDescriptor {
    int chainId;
    String name;
    String nativeSymbol;

    // Environment keys resolved at runtime, e.g. RPC_POLYGON
    String rpcEnvKey;
    String wssEnvKey;
    String executorEnvKey;

    String quoterAddress; // Uniswap V3 QuoterV2
    String swapRouterAddress; // Uniswap V3 SwapRouter
    String lenderAddress; // Flash loan vault whose balance bounds loan size
}
