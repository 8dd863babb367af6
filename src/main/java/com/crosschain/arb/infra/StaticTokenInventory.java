package com.crosschain.arb.infra;

import com.crosschain.arb.domain.ChainDescriptor;
import com.crosschain.arb.domain.TokenNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class StaticTokenInventory implements TokenInventory {

    private static final List<String> BRIDGE_ASSETS = List.of("USDC", "USDT", "DAI", "WETH");

    private final ChainCatalog catalog;
    private final Map<Integer, Map<String, TokenNode>> registry = new HashMap<>();

    public StaticTokenInventory(ChainCatalog catalog) {
        this.catalog = catalog;

        chain(ChainCatalog.ETHEREUM)
                .nativeToken("ETH")
                .wrapped("WETH", "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", 18)
                .stable("USDC", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", 6)
                .stable("USDT", "0xdAC17F958D2ee523a2206206994597C13D831ec7", 6)
                .stable("DAI", "0x6B175474E89094C44Da98b954EedeAC495271d0F", 18);

        chain(ChainCatalog.POLYGON)
                .nativeToken("MATIC")
                .wrapped("WMATIC", "0x0d500B1d8E8eF31E21C99d1Db9A6444d3ADf1270", 18)
                .token("WETH", "0x7ceB23fD6bC0adD59E62ac25578270cFf1b9f619", 18)
                .stable("USDC", "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359", 6)
                .stable("USDC.e", "0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174", 6)
                .stable("USDT", "0xc2132D05D31c914a87C6611C10748AEb04B58e8F", 6)
                .stable("DAI", "0x8f3Cf7ad23Cd3CaDbD9735AFf958023239c6A063", 18);

        chain(ChainCatalog.ARBITRUM)
                .nativeToken("ETH")
                .wrapped("WETH", "0x82aF49447D8a07e3bd95BD0d56f35241523fBab1", 18)
                .stable("USDC", "0xaf88d065e77c8cC2239327C5EDb3A432268e5831", 6)
                .stable("USDT", "0xFd086bC7CD5C481DCC9C85ebE478A1C0b69FCbb9", 6)
                .stable("DAI", "0xDA10009cBd5D07dd0CeCc66161FC93D7c9000da1", 18);

        chain(ChainCatalog.OPTIMISM)
                .nativeToken("ETH")
                .wrapped("WETH", "0x4200000000000000000000000000000000000006", 18)
                .stable("USDC", "0x0b2C639c533813f4Aa9D7837CAf62653d097Ff85", 6)
                .stable("USDT", "0x94b008aA00579c1307B0EF2c499aD98a8ce58e58", 6)
                .stable("DAI", "0xDA10009cBd5D07dd0CeCc66161FC93D7c9000da1", 18);

        chain(ChainCatalog.BASE)
                .nativeToken("ETH")
                .wrapped("WETH", "0x4200000000000000000000000000000000000006", 18)
                .stable("USDC", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", 6)
                .stable("DAI", "0x50c5725949A6F0c72E6C4a641F24049A917DB0Cb", 18);
    }

    @Override
    public Optional<ChainDescriptor> getChainConfig(int chainId) {
        return catalog.find(chainId);
    }

    @Override
    public List<Integer> getAllChainIds() {
        return catalog.chainIds();
    }

    @Override
    public Optional<String> getTokenAddress(int chainId, String symbol) {
        return Optional.ofNullable(registry.getOrDefault(chainId, Map.of()).get(symbol))
                .map(TokenNode::getAddress);
    }

    @Override
    public Map<Integer, Map<String, TokenNode>> fetchAllChains(List<Integer> chainIds) {
        log.info("Fetching token inventories for {} chains...", chainIds.size());
        Map<Integer, Map<String, TokenNode>> inventory = new LinkedHashMap<>();
        for (Integer chainId : chainIds) {
            Map<String, TokenNode> tokens = registry.get(chainId);
            if (tokens == null) {
                log.warn("Chain {} not found in token registry", chainId);
                inventory.put(chainId, Map.of());
            } else {
                inventory.put(chainId, Collections.unmodifiableMap(tokens));
            }
        }
        return inventory;
    }

    @Override
    public List<String> bridgeAssets() {
        return BRIDGE_ASSETS;
    }

    private TableBuilder chain(int chainId) {
        return new TableBuilder(chainId, registry.computeIfAbsent(chainId, k -> new LinkedHashMap<>()));
    }

    private static final class TableBuilder {
        private static final String NATIVE_ADDRESS = "0x0000000000000000000000000000000000000000";

        private final int chainId;
        private final Map<String, TokenNode> tokens;

        private TableBuilder(int chainId, Map<String, TokenNode> tokens) {
            this.chainId = chainId;
            this.tokens = tokens;
        }

        TableBuilder nativeToken(String symbol) {
            return put(base(symbol, NATIVE_ADDRESS, 18).nativeAsset(true).build());
        }

        TableBuilder wrapped(String symbol, String address, int decimals) {
            return put(base(symbol, address, decimals).wrappedNative(true).build());
        }

        TableBuilder stable(String symbol, String address, int decimals) {
            return put(base(symbol, address, decimals).stablecoin(true).build());
        }

        TableBuilder token(String symbol, String address, int decimals) {
            return put(base(symbol, address, decimals).build());
        }

        private TokenNode.TokenNodeBuilder base(String symbol, String address, int decimals) {
            return TokenNode.builder().chainId(chainId).symbol(symbol).address(address).decimals(decimals);
        }

        private TableBuilder put(TokenNode node) {
            tokens.put(node.getSymbol(), node);
            return this;
        }
    }
}
