package com.crosschain.arb.core;

import com.crosschain.arb.infra.ChainCatalog;
import com.crosschain.arb.infra.ChainConnections;
import com.crosschain.arb.infra.ChainRpc;
import com.crosschain.arb.infra.RpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PriceSimulatorTest {

    private static final String USDC = "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359";
    private static final String WMATIC = "0x0d500B1d8E8eF31E21C99d1Db9A6444d3ADf1270";
    private static final String QUOTER = "0x61fFE014bA17989E743c5F6cB21bF9697530B21e";

    private ChainConnections connections;
    private ChainRpc rpc;
    private PriceSimulator simulator;

    @BeforeEach
    void setUp() {
        connections = mock(ChainConnections.class);
        rpc = mock(ChainRpc.class);
        when(connections.connection(137)).thenReturn(Optional.of(rpc));
        simulator = new PriceSimulator(connections, new ChainCatalog());
    }

    @Test
    void decodesAmountOut() {
        String encoded = "0x"
                + TypeEncoder.encode(new Uint256(new BigInteger("1234500000000000000000")))
                + TypeEncoder.encode(new Uint256(BigInteger.ONE))
                + TypeEncoder.encode(new Uint256(BigInteger.ONE))
                + TypeEncoder.encode(new Uint256(BigInteger.valueOf(120_000)));
        when(rpc.call(eq(QUOTER), anyString())).thenReturn(encoded);

        BigInteger out = simulator.quoteSingleHopOutput(137, USDC, WMATIC, BigInteger.valueOf(1_000_000_000), 500);

        assertEquals(new BigInteger("1234500000000000000000"), out);
    }

    @Test
    void encodesQuoteExactInputSingle() {
        String data = FunctionEncoder.encode(
                PriceSimulator.quoteFunction(USDC, WMATIC, BigInteger.valueOf(1_000_000), 3000));

        // quoteExactInputSingle((address,address,uint256,uint24,uint160))
        assertTrue(data.startsWith("0xc6a5026a"), data);
        assertEquals(10 + 5 * 64, data.length());
    }

    @Test
    void revertYieldsZero() {
        when(rpc.call(eq(QUOTER), anyString())).thenThrow(new RpcException("eth_call reverted: SPL"));

        assertEquals(BigInteger.ZERO, simulator.quoteSingleHopOutput(137, USDC, WMATIC, BigInteger.TEN, 500));
    }

    @Test
    void emptyResultYieldsZero() {
        when(rpc.call(eq(QUOTER), anyString())).thenReturn("0x");

        assertEquals(BigInteger.ZERO, simulator.quoteSingleHopOutput(137, USDC, WMATIC, BigInteger.TEN, 500));
    }

    @Test
    void missingConnectionYieldsZero() {
        assertEquals(BigInteger.ZERO, simulator.quoteSingleHopOutput(1, USDC, WMATIC, BigInteger.TEN, 500));
        assertEquals(BigInteger.ZERO, simulator.quoteSingleHopOutput(56, USDC, WMATIC, BigInteger.TEN, 500));
        verifyNoInteractions(rpc);
    }
}
