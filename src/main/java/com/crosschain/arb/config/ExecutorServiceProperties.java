package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the external execution service and the retry policy for submissions.
 */
@ConfigurationProperties(prefix = "crosschain.executor-service")
@NoArgsConstructor
@Getter
@Setter
public class ExecutorServiceProperties {

    private String host = "localhost";

    private int port = 8545;

    /** Total timeout per HTTP request to the execution service. */
    private int timeoutSeconds = 30;

    /** Attempts per submission, including the first one. */
    private int maxRetries = 3;

    /** Fixed delay between submission attempts. */
    private long retryBackoffMs = 1_000;

    /** Delay before reopening a dropped update stream. */
    private long streamReconnectDelayMs = 5_000;

    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    public String streamUrl() {
        return "ws://" + host + ":" + port;
    }
}
