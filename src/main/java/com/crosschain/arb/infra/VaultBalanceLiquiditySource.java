package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ChainDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Reads ERC-20 balanceOf(vault) for the chain's flash-loan lender.
 */
@Slf4j
@Component
public class VaultBalanceLiquiditySource implements LiquiditySource {

    private final ChainConnections connections;
    private final ChainCatalog catalog;

    public VaultBalanceLiquiditySource(ChainConnections connections, ChainCatalog catalog) {
        this.connections = connections;
        this.catalog = catalog;
    }

    @Override
    public BigInteger poolLiquidity(int chainId, String tokenAddress) {
        ChainDescriptor chain = catalog.find(chainId)
                .orElseThrow(() -> new RpcException("Unknown chain " + chainId));
        if (chain.getLenderAddress() == null) {
            throw new RpcException("No lender address for chain " + chain.getName());
        }
        ChainRpc rpc = connections.connection(chainId)
                .orElseThrow(() -> new RpcException("No validated RPC for chain " + chain.getName()));

        Function balanceOf = new Function(
                "balanceOf",
                List.of(new Address(chain.getLenderAddress())),
                List.of(new TypeReference<Uint256>() {
                }));

        String raw = rpc.call(tokenAddress, FunctionEncoder.encode(balanceOf));
        List<Type> decoded = FunctionReturnDecoder.decode(raw, balanceOf.getOutputParameters());
        if (decoded.isEmpty()) {
            throw new RpcException("Empty balanceOf result for " + tokenAddress + " on " + chain.getName());
        }
        BigInteger balance = (BigInteger) decoded.get(0).getValue();
        log.debug("[{}] TVL check: lender holds {} units of {}", chain.getName(), balance, tokenAddress);
        return balance;
    }
}
