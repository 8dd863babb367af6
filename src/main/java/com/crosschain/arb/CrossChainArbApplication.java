package com.crosschain.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class CrossChainArbApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // OkHttp resolves RPC hosts faster without IPv6 fallbacks
        SpringApplication.run(CrossChainArbApplication.class, args);
    }

}
