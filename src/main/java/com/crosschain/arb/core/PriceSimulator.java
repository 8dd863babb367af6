package com.crosschain.arb.core;

import com.crosschain.arb.domain.ChainDescriptor;
import com.crosschain.arb.infra.ChainCatalog;
import com.crosschain.arb.infra.ChainConnections;
import com.crosschain.arb.infra.ChainRpc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Single-hop output quotes from Uniswap V3 QuoterV2 via eth_call. Any failure means "not viable now" and yields 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceSimulator {

    private final ChainConnections connections;
    private final ChainCatalog catalog;

    public BigInteger quoteSingleHopOutput(int chainId, String tokenIn, String tokenOut,
                                           BigInteger amountIn, int feeTier) {
        String quoter = catalog.find(chainId).map(ChainDescriptor::getQuoterAddress).orElse(null);
        if (quoter == null) {
            log.debug("No quoter for chain {}", chainId);
            return BigInteger.ZERO;
        }
        Optional<ChainRpc> rpc = connections.connection(chainId);
        if (rpc.isEmpty()) {
            log.debug("No connection for chain {}", chainId);
            return BigInteger.ZERO;
        }

        Function quote = quoteFunction(tokenIn, tokenOut, amountIn, feeTier);
        try {
            String raw = rpc.get().call(quoter, FunctionEncoder.encode(quote));
            List<Type> decoded = FunctionReturnDecoder.decode(raw, quote.getOutputParameters());
            if (decoded.isEmpty()) {
                log.debug("Empty quote {} -> {} on chain {}", tokenIn, tokenOut, chainId);
                return BigInteger.ZERO;
            }
            return (BigInteger) decoded.get(0).getValue();
        } catch (RuntimeException e) {
            log.debug("Quote {} -> {} fee {} on chain {} failed: {}", tokenIn, tokenOut, feeTier, chainId, e.getMessage());
            return BigInteger.ZERO;
        }
    }

    static Function quoteFunction(String tokenIn, String tokenOut, BigInteger amountIn, int feeTier) {
        return new Function(
                "quoteExactInputSingle",
                List.of(new QuoteExactInputSingleParams(tokenIn, tokenOut, amountIn, feeTier)),
                List.of(new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint160>() {
                        },
                        new TypeReference<Uint32>() {
                        },
                        new TypeReference<Uint256>() {
                        }));
    }

    /**
     * (tokenIn, tokenOut, amountIn, fee, sqrtPriceLimitX96) with no price limit.
     */
    static class QuoteExactInputSingleParams extends StaticStruct {
        QuoteExactInputSingleParams(String tokenIn, String tokenOut, BigInteger amountIn, int fee) {
            super(new Address(tokenIn),
                    new Address(tokenOut),
                    new Uint256(amountIn),
                    new Uint24(BigInteger.valueOf(fee)),
                    new Uint160(BigInteger.ZERO));
        }
    }
}
