package com.crosschain.arb.core;

import com.crosschain.arb.config.ScanProperties;
import com.crosschain.arb.domain.BridgeOpportunity;
import com.crosschain.arb.domain.TokenNode;
import com.crosschain.arb.infra.ChainCatalog;
import com.crosschain.arb.infra.StaticTokenInventory;
import com.crosschain.arb.infra.TokenInventory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class OpportunityGraphTest {

    private static TokenNode token(int chainId, String symbol, boolean wrapped) {
        return TokenNode.builder()
                .chainId(chainId)
                .symbol(symbol)
                .address("0x" + symbol + chainId)
                .decimals(6)
                .stablecoin(!wrapped)
                .wrappedNative(wrapped)
                .build();
    }

    private static TokenInventory threeChainInventory() {
        Map<Integer, Map<String, TokenNode>> tables = new LinkedHashMap<>();
        tables.put(137, Map.of("USDC", token(137, "USDC", false), "WMATIC", token(137, "WMATIC", true)));
        tables.put(1, Map.of("USDC", token(1, "USDC", false), "DAI", token(1, "DAI", false)));
        tables.put(42161, Map.of("USDC", token(42161, "USDC", false)));

        TokenInventory inventory = mock(TokenInventory.class);
        when(inventory.getAllChainIds()).thenReturn(List.of(1, 137, 42161));
        when(inventory.fetchAllChains(anyList())).thenReturn(tables);
        when(inventory.bridgeAssets()).thenReturn(List.of("USDC", "DAI"));
        return inventory;
    }

    @Test
    void symbolOnThreeChainsGivesSixEdges() {
        OpportunityGraph graph = new OpportunityGraph(threeChainInventory(), new ScanProperties());

        List<BridgeOpportunity> edges = graph.enumerateCrossChainEdges().toList();

        assertEquals(6, edges.size());
        assertEquals(6, graph.edgeCount());
        assertTrue(edges.stream().allMatch(e -> e.getSrcChain() != e.getDstChain()));
        assertTrue(edges.stream().allMatch(e -> e.getToken().equals("USDC")));
        long distinctPairs = edges.stream().map(e -> e.getSrcChain() + ">" + e.getDstChain()).distinct().count();
        assertEquals(6, distinctPairs);
    }

    @Test
    void primaryChainRequestedFirst() {
        TokenInventory inventory = threeChainInventory();
        new OpportunityGraph(inventory, new ScanProperties());

        verify(inventory).fetchAllChains(List.of(137, 1, 42161));
    }

    @Test
    void enumerationIsRepeatable() {
        OpportunityGraph graph = new OpportunityGraph(threeChainInventory(), new ScanProperties());

        assertEquals(graph.enumerateCrossChainEdges().count(), graph.enumerateCrossChainEdges().count());
    }

    @Test
    void nodeLookups() {
        OpportunityGraph graph = new OpportunityGraph(threeChainInventory(), new ScanProperties());

        assertEquals(5, graph.nodeCount());
        assertEquals("0xWMATIC137", graph.wrappedNative(137).orElseThrow().getAddress());
        assertTrue(graph.wrappedNative(1).isEmpty());
        assertTrue(graph.node(42161, "USDC").isPresent());
        assertTrue(graph.node(42161, "DAI").isEmpty());
    }

    @Test
    void staticInventoryEdgeCounts() {
        OpportunityGraph graph = new OpportunityGraph(new StaticTokenInventory(new ChainCatalog()), new ScanProperties());

        Map<String, Long> perSymbol = graph.enumerateCrossChainEdges()
                .collect(Collectors.groupingBy(BridgeOpportunity::getToken, Collectors.counting()));

        assertEquals(20L, perSymbol.get("USDC")); // 5 chains
        assertEquals(12L, perSymbol.get("USDT")); // no USDT on base
        assertEquals(20L, perSymbol.get("DAI"));
        assertEquals(20L, perSymbol.get("WETH"));
        assertEquals("0x0d500B1d8E8eF31E21C99d1Db9A6444d3ADf1270",
                graph.wrappedNative(ChainCatalog.POLYGON).orElseThrow().getAddress());
    }
}
