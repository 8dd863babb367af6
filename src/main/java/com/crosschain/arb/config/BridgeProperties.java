package com.crosschain.arb.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crosschain.bridge")
@NoArgsConstructor
@Getter
@Setter
public class BridgeProperties {

    private String baseUrl = "https://li.quest";

    /** Optional integrator API key, sent as x-lifi-api-key. */
    private String apiKey = "";

    private int timeoutSeconds = 10;
}
