package com.crosschain.arb.infra;

import com.crosschain.arb.config.BridgeProperties;
import com.crosschain.arb.domain.BridgeQuote;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

/**
 * Li.Fi quote endpoint adapter. The route algorithm itself lives in the aggregator.
 */
@Slf4j
@Service
public class LiFiBridgeRouteProvider implements BridgeRouteProvider {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BridgeProperties properties;

    public LiFiBridgeRouteProvider(ObjectMapper objectMapper, BridgeProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public BridgeQuote getRoute(int srcChain, int dstChain, String tokenAddress, String dstTokenAddress,
                                BigInteger amountRaw, String userAddress) {
        HttpUrl base = HttpUrl.parse(properties.getBaseUrl());
        if (base == null) {
            log.error("Invalid bridge base URL: {}", properties.getBaseUrl());
            return null;
        }
        HttpUrl url = base.newBuilder()
                .addPathSegments("v1/quote")
                .addQueryParameter("fromChain", String.valueOf(srcChain))
                .addQueryParameter("toChain", String.valueOf(dstChain))
                .addQueryParameter("fromToken", tokenAddress)
                .addQueryParameter("toToken", dstTokenAddress)
                .addQueryParameter("fromAmount", amountRaw.toString())
                .addQueryParameter("fromAddress", userAddress)
                .build();

        Request.Builder request = new Request.Builder().url(url).header("Accept", "application/json");
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            request.header("x-lifi-api-key", properties.getApiKey());
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.debug("No bridge route {} -> {} for {}: HTTP {}", srcChain, dstChain, tokenAddress, response.code());
                return null;
            }
            return parseQuote(objectMapper.readTree(response.body().string()));
        } catch (IOException e) {
            log.warn("Bridge quote failed {} -> {} for {}: {}", srcChain, dstChain, tokenAddress, e.getMessage());
            return null;
        }
    }

    BridgeQuote parseQuote(JsonNode root) {
        JsonNode estimate = root.path("estimate");
        String toAmount = estimate.path("toAmount").asText("");
        if (toAmount.isEmpty()) {
            return null;
        }
        BigDecimal feeUsd = BigDecimal.ZERO;
        for (JsonNode fee : estimate.path("feeCosts")) {
            feeUsd = feeUsd.add(new BigDecimal(fee.path("amountUSD").asText("0")));
        }
        return BridgeQuote.builder()
                .bridgeName(root.path("tool").asText("unknown"))
                .estimatedOutput(new BigInteger(toAmount))
                .feeUsd(feeUsd)
                .txData(root.path("transactionRequest").path("data").asText(null))
                .build();
    }
}
