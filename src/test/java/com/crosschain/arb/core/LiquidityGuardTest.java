package com.crosschain.arb.core;

import com.crosschain.arb.config.LiquidityProperties;
import com.crosschain.arb.infra.LiquiditySource;
import com.crosschain.arb.infra.RpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LiquidityGuardTest {

    private static final String USDC = "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359";

    private LiquiditySource source;
    private LiquidityGuard guard;

    @BeforeEach
    void setUp() {
        source = mock(LiquiditySource.class);
        ChainRegistry registry = mock(ChainRegistry.class);
        when(registry.getChainName(137)).thenReturn("polygon");
        guard = new LiquidityGuard(source, registry, new LiquidityProperties());
    }

    @Test
    void clampedAmountBelowFloorAborts() {
        when(source.poolLiquidity(137, USDC)).thenReturn(BigInteger.valueOf(1_000_000));

        assertEquals(BigInteger.ZERO, guard.sizeSafeLoan(USDC, BigInteger.valueOf(500_000), 6, 137));
    }

    @Test
    void zeroLiquidityAborts() {
        when(source.poolLiquidity(137, USDC)).thenReturn(BigInteger.ZERO);

        assertEquals(BigInteger.ZERO, guard.sizeSafeLoan(USDC, BigInteger.valueOf(1_000_000_000), 6, 137));
    }

    @Test
    void liquidityErrorAborts() {
        when(source.poolLiquidity(137, USDC)).thenThrow(new RpcException("eth_call failed"));

        assertEquals(BigInteger.ZERO, guard.sizeSafeLoan(USDC, BigInteger.valueOf(1_000_000_000), 6, 137));
    }

    @Test
    void targetClampedToShareOfLiquidity() {
        // 50,000 USDC held, 20% cap = 10,000 USDC
        BigInteger liquidity = new BigInteger("50000000000");
        when(source.poolLiquidity(137, USDC)).thenReturn(liquidity);

        BigInteger result = guard.sizeSafeLoan(USDC, new BigInteger("20000000000"), 6, 137);

        assertEquals(new BigInteger("10000000000"), result);
    }

    @Test
    void capIsFloored() {
        BigInteger liquidity = new BigInteger("2500000000007");
        when(source.poolLiquidity(137, USDC)).thenReturn(liquidity);

        BigInteger result = guard.sizeSafeLoan(USDC, new BigInteger("9999999999999"), 6, 137);

        assertEquals(new BigInteger("500000000001"), result);
    }

    @Test
    void targetWithinCapIsKept() {
        when(source.poolLiquidity(137, USDC)).thenReturn(new BigInteger("1000000000000"));

        BigInteger target = new BigInteger("10000000000");
        assertEquals(target, guard.sizeSafeLoan(USDC, target, 6, 137));
    }

    @Test
    void amountExactlyAtFloorIsAllowed() {
        when(source.poolLiquidity(137, USDC)).thenReturn(new BigInteger("2500000000"));

        assertEquals(new BigInteger("500000000"), guard.sizeSafeLoan(USDC, new BigInteger("900000000"), 6, 137));
    }

    @Test
    void resultNeverExceedsCap() {
        long[] liquidities = {1, 7, 999, 12_345_678, 5_000_000_000L, 987_654_321_987L};
        for (long l : liquidities) {
            when(source.poolLiquidity(137, USDC)).thenReturn(BigInteger.valueOf(l));
            BigInteger result = guard.sizeSafeLoan(USDC, BigInteger.valueOf(Long.MAX_VALUE), 6, 137);
            assertTrue(result.compareTo(BigInteger.valueOf(l / 5)) <= 0, "liquidity " + l);
        }
    }
}
