package com.crosschain.arb.core;

/**
 * Configuration that makes it unsafe to start scanning.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
