package com.crosschain.arb.infra;

import java.math.BigInteger;

/**
 * Read-only JSON-RPC access to one chain. Every method throws {@link RpcException} on failure.
 */
public interface ChainRpc extends AutoCloseable {

    BigInteger blockNumber();

    BigInteger gasPriceWei();

    /**
     * eth_call against the latest block.
     *
     * @param to   contract address
     * @param data ABI encoded call data
     * @return raw hex return data
     */
    String call(String to, String data);

    @Override
    void close();
}
