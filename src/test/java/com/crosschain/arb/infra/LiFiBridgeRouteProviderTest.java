package com.crosschain.arb.infra;

import com.crosschain.arb.config.BridgeProperties;
import com.crosschain.arb.domain.BridgeQuote;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class LiFiBridgeRouteProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final LiFiBridgeRouteProvider provider = new LiFiBridgeRouteProvider(mapper, new BridgeProperties());

    @Test
    void quoteMapping() throws Exception {
        String json = """
                {
                  "tool": "stargateV2",
                  "estimate": {
                    "toAmount": "9985000000",
                    "feeCosts": [
                      {"name": "LP fee", "amountUSD": "1.20"},
                      {"name": "Relayer fee", "amountUSD": "0.35"}
                    ]
                  },
                  "transactionRequest": {"data": "0xdeadbeef"}
                }
                """;

        BridgeQuote quote = provider.parseQuote(mapper.readTree(json));

        assertEquals("stargateV2", quote.getBridgeName());
        assertEquals(new BigInteger("9985000000"), quote.getEstimatedOutput());
        assertEquals(0, new BigDecimal("1.55").compareTo(quote.getFeeUsd()));
        assertEquals("0xdeadbeef", quote.getTxData());
    }

    @Test
    void noFeesIsZero() throws Exception {
        BridgeQuote quote = provider.parseQuote(mapper.readTree("{\"tool\":\"across\",\"estimate\":{\"toAmount\":\"5\"}}"));

        assertEquals(0, BigDecimal.ZERO.compareTo(quote.getFeeUsd()));
        assertNull(quote.getTxData());
    }

    @Test
    void missingAmountIsNoRoute() throws Exception {
        assertNull(provider.parseQuote(mapper.readTree("{\"message\":\"No available quotes for the requested transfer\"}")));
    }
}
