package com.crosschain.arb.infra;

import java.math.BigInteger;

/**
 * TVL lookup: how much of a token the configured flash-loan lender holds on a chain.
 */
public interface LiquiditySource {

    /**
     * @return raw token units held by the lender
     * @throws RpcException when the balance cannot be read
     */
    BigInteger poolLiquidity(int chainId, String tokenAddress);
}
