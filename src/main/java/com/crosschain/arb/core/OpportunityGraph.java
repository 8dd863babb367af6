package com.crosschain.arb.core;

import com.crosschain.arb.config.ScanProperties;
import com.crosschain.arb.domain.BridgeEdge;
import com.crosschain.arb.domain.BridgeOpportunity;
import com.crosschain.arb.domain.TokenNode;
import com.crosschain.arb.infra.TokenInventory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Token nodes per (chain, symbol) and directed bridge edges between chains carrying the same bridge asset.
 * Built once; read-only afterwards.
 */
@Slf4j
@Component
public class OpportunityGraph {

    private final Map<Integer, Map<String, TokenNode>> nodes;
    private final List<BridgeEdge> edges;

    public OpportunityGraph(TokenInventory inventory, ScanProperties scanProperties) {
        List<Integer> chainIds = new ArrayList<>();
        chainIds.add(scanProperties.getPrimaryChainId());
        for (Integer chainId : inventory.getAllChainIds()) {
            if (!chainIds.contains(chainId)) {
                chainIds.add(chainId);
            }
        }

        Map<Integer, Map<String, TokenNode>> tables = new LinkedHashMap<>();
        inventory.fetchAllChains(chainIds).forEach((chainId, tokens) ->
                tables.put(chainId, Collections.unmodifiableMap(new LinkedHashMap<>(tokens))));
        this.nodes = Collections.unmodifiableMap(tables);
        this.edges = List.copyOf(buildEdges(inventory.bridgeAssets()));

        log.info("Opportunity graph built: {} chains, {} nodes, {} bridge edges",
                nodes.size(), nodeCount(), edges.size());
    }

    private List<BridgeEdge> buildEdges(List<String> bridgeAssets) {
        List<BridgeEdge> result = new ArrayList<>();
        List<Integer> chains = new ArrayList<>(nodes.keySet());
        for (String symbol : bridgeAssets) {
            for (int i = 0; i < chains.size(); i++) {
                TokenNode a = nodes.get(chains.get(i)).get(symbol);
                if (a == null) {
                    continue;
                }
                for (int j = i + 1; j < chains.size(); j++) {
                    TokenNode b = nodes.get(chains.get(j)).get(symbol);
                    if (b == null) {
                        continue;
                    }
                    result.add(new BridgeEdge(a, b));
                    result.add(new BridgeEdge(b, a));
                }
            }
        }
        return result;
    }

    /**
     * Fresh lazy stream on every call, so each scan cycle sees every edge once.
     */
    public Stream<BridgeOpportunity> enumerateCrossChainEdges() {
        return edges.stream().map(BridgeOpportunity::of);
    }

    public int nodeCount() {
        return nodes.values().stream().mapToInt(Map::size).sum();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Optional<TokenNode> node(int chainId, String symbol) {
        return Optional.ofNullable(nodes.getOrDefault(chainId, Map.of()).get(symbol));
    }

    public Optional<TokenNode> wrappedNative(int chainId) {
        return nodes.getOrDefault(chainId, Map.of()).values().stream()
                .filter(TokenNode::isWrappedNative)
                .findFirst();
    }
}
