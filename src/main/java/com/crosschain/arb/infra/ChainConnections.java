package com.crosschain.arb.infra;

import java.util.Optional;

/**
 * Source of validated RPC connections, keyed by chain id.
 */
public interface ChainConnections {

    Optional<ChainRpc> connection(int chainId);
}
