package com.crosschain.arb.infra;

import com.crosschain.arb.config.ExecutorServiceProperties;
import com.crosschain.arb.domain.BatchExecutionResult;
import com.crosschain.arb.domain.ExecutionUpdate;
import com.crosschain.arb.domain.ExecutorHealth;
import com.crosschain.arb.domain.ExecutorResponse;
import com.crosschain.arb.domain.ExecutorStats;
import com.crosschain.arb.domain.SimulationResponse;
import com.crosschain.arb.domain.TradeSignal;
import com.crosschain.arb.domain.TradeStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HTTP and WebSocket client for the external execution service.
 * The service signs and broadcasts; this side only sends signals and reads status back.
 */
@Slf4j
@Service
public class ExecutionClient {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorServiceProperties properties;

    @Autowired
    public ExecutionClient(ObjectMapper objectMapper, ExecutorServiceProperties properties) {
        this(new OkHttpClient.Builder()
                .callTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build(), objectMapper, properties);
    }

    ExecutionClient(OkHttpClient httpClient, ObjectMapper objectMapper, ExecutorServiceProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        log.info("ExecutionClient initialized: {}", properties.baseUrl());
    }

    public ExecutorHealth healthCheck() {
        try {
            JsonNode body = get("/health");
            ExecutorHealth health = new ExecutorHealth(
                    body.path("status").asText("unhealthy"),
                    body.path("mode").asText(null),
                    body.path("chains").asInt(0),
                    body.path("error").asText(null));
            log.info("Execution service health: {} ({} mode, {} chains)", health.getStatus(), health.getMode(), health.getChains());
            return health;
        } catch (ExecutorTransportException e) {
            log.error("Health check error: {}", e.getMessage());
            return ExecutorHealth.unreachable(e.getMessage());
        }
    }

    public ExecutorResponse executeSignal(String tradeId, TradeSignal signal) {
        log.info("Sending trade signal {} for chain {}", tradeId, signal.getChainId());
        JsonNode body = post("/execute", toPayload(tradeId, signal));
        ExecutorResponse response = toResponse(body);
        if (response.isSuccess()) {
            log.info("Execution accepted: {} mode, tx {}", response.getMode(), response.getTxHash());
        } else {
            log.error("Execution failed: {}", response.getError());
        }
        return response;
    }

    public BatchExecutionResult executeBatch(Map<String, TradeSignal> signals) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("signals");
        signals.forEach((tradeId, signal) -> array.add(toPayload(tradeId, signal)));

        log.info("Sending batch of {} trade signals", signals.size());
        JsonNode body = post("/execute/batch", payload);

        BatchExecutionResult.BatchExecutionResultBuilder result = BatchExecutionResult.builder()
                .total(body.path("total").asInt(signals.size()))
                .succeeded(body.path("succeeded").asInt(0))
                .failed(body.path("failed").asInt(body.has("error") ? signals.size() : 0));
        for (JsonNode item : body.path("results")) {
            result.result(toResponse(item));
        }
        BatchExecutionResult batch = result.build();
        log.info("Batch result: {}/{} succeeded", batch.getSucceeded(), batch.getTotal());
        return batch;
    }

    public SimulationResponse simulateSignal(String tradeId, TradeSignal signal) {
        log.info("Simulating trade {} for chain {}", tradeId, signal.getChainId());
        JsonNode body = post("/simulate", toPayload(tradeId, signal));
        return SimulationResponse.builder()
                .success(body.path("success").asBoolean(false))
                .simulation(body.get("simulation"))
                .error(body.path("error").asText(null))
                .build();
    }

    public ExecutorStats getStats() {
        JsonNode body = get("/stats");
        return ExecutorStats.builder()
                .totalSignals(body.path("total_signals").asLong(0))
                .executed(body.path("executed").asLong(0))
                .paperExecuted(body.path("paper_executed").asLong(0))
                .failed(body.path("failed").asLong(0))
                .totalProfit(new BigDecimal(body.path("total_profit").asText("0")))
                .uptimeSeconds(body.path("uptime").asLong(0))
                .build();
    }

    /**
     * Opens the update stream. Each text frame is parsed and handed to the listener on OkHttp's reader thread.
     */
    public WebSocket streamUpdates(ExecutionUpdateListener listener) {
        Request request = new Request.Builder().url(properties.streamUrl()).build();
        log.info("Connecting to execution update stream: {}", properties.streamUrl());
        return httpClient.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                log.info("Execution update stream connected");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                try {
                    parseUpdate(objectMapper.readTree(text)).ifPresent(listener::onUpdate);
                } catch (JsonProcessingException e) {
                    log.warn("Discarding unreadable stream message: {}", e.getMessage());
                }
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(NORMAL_CLOSURE, null);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                log.info("Execution update stream closed: {} {}", code, reason);
                listener.onClosed(null);
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                log.error("Execution update stream error: {}", t.getMessage());
                listener.onClosed(t);
            }
        });
    }

    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        log.info("ExecutionClient closed");
    }

    ObjectNode toPayload(String tradeId, TradeSignal signal) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("chainId", signal.getChainId());
        node.put("token", signal.getToken());
        node.put("amount", signal.getAmount().toString());
        node.put("flashSource", signal.getFlashSource());
        putArray(node, "protocols", signal.getProtocols());
        putArray(node, "routers", signal.getRouters());
        putArray(node, "path", signal.getPath());
        putArray(node, "extras", signal.getExtras());
        node.put("expected_profit", signal.getExpectedProfitUsd());
        node.put("gas_estimate", signal.getGasCostUsd());
        node.put("trade_id", tradeId);
        node.put("estimated_slippage_bps", signal.getEstimatedSlippageBps());
        node.put("confidence_score", signal.getConfidence());
        node.set("hints", objectMapper.valueToTree(signal.getHints()));
        return node;
    }

    /**
     * Maps stream events carrying a trade outcome to a "result" update. Other event types pass through
     * with their raw type and no status.
     */
    Optional<ExecutionUpdate> parseUpdate(JsonNode event) {
        String type = event.path("type").asText("");
        switch (type) {
            case "result", "execution_result" -> {
                JsonNode result = event.has("result") ? event.get("result") : event;
                return Optional.of(ExecutionUpdate.builder()
                        .type("result")
                        .tradeId(text(result, "trade_id"))
                        .status(parseStatus(result.path("status").asText(
                                result.path("success").asBoolean(false) ? "SUCCESS" : "FAILED")))
                        .actualProfit(decimal(result, "actual_profit"))
                        .txHash(text(result, "txHash"))
                        .error(text(result, "error"))
                        .build());
            }
            case "live_execution" -> {
                // Sent after one confirmation
                JsonNode signal = event.path("signal");
                return Optional.of(ExecutionUpdate.builder()
                        .type("result")
                        .tradeId(text(signal, "trade_id"))
                        .status(TradeStatus.CONFIRMED)
                        .actualProfit(decimal(signal, "expected_profit"))
                        .txHash(text(event, "txHash"))
                        .build());
            }
            case "" -> {
                return Optional.empty();
            }
            default -> {
                return Optional.of(ExecutionUpdate.builder().type(type).build());
            }
        }
    }

    static TradeStatus parseStatus(String status) {
        return switch (status.toUpperCase(Locale.ROOT)) {
            case "SUCCESS", "CONFIRMED" -> TradeStatus.CONFIRMED;
            case "REVERTED" -> TradeStatus.REVERTED;
            default -> TradeStatus.FAILED;
        };
    }

    private ExecutorResponse toResponse(JsonNode body) {
        return ExecutorResponse.builder()
                .success(body.path("success").asBoolean(false))
                .mode(text(body, "mode"))
                .txHash(text(body, "txHash"))
                .error(text(body, "error"))
                .build();
    }

    private JsonNode get(String path) {
        Request request = new Request.Builder()
                .url(properties.baseUrl() + path)
                .header("Accept", "application/json")
                .build();
        return execute(request);
    }

    private JsonNode post(String path, JsonNode payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ExecutorTransportException("Cannot serialize request for " + path, e);
        }
        log.debug("POST {} {}", path, json);
        Request request = new Request.Builder()
                .url(properties.baseUrl() + path)
                .post(RequestBody.create(json, JSON))
                .header("Accept", "application/json")
                .build();
        return execute(request);
    }

    private JsonNode execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            JsonNode node = readJson(body);
            if (node == null || !node.isObject()) {
                // Error responses are only useful when they carry a JSON body
                throw new ExecutorTransportException("HTTP " + response.code() + " from "
                        + request.url().encodedPath() + " without a JSON body");
            }
            if (!response.isSuccessful()) {
                log.warn("Execution service returned HTTP {} for {}: {}", response.code(),
                        request.url().encodedPath(), node.path("error").asText(""));
            }
            return node;
        } catch (IOException e) {
            throw new ExecutorTransportException(request.method() + " " + request.url().encodedPath() + " failed: "
                    + e.getMessage(), e);
        }
    }

    private JsonNode readJson(String body) {
        if (body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static void putArray(ObjectNode node, String field, List<?> values) {
        ArrayNode array = node.putArray(field);
        for (Object value : values) {
            if (value instanceof Integer i) {
                array.add(i);
            } else {
                array.add(String.valueOf(value));
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : new BigDecimal(value.asText());
    }
}
