package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crosschain.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    private long connectTimeoutMs = 5_000;

    /** Hard limit for a single JSON-RPC call, including retries inside OkHttp. */
    private long callTimeoutMs = 10_000;
}
