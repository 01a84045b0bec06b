package com.delta.newsdiscovery.crawl.policy;

public class PolicyConfigurationException extends RuntimeException {
    public PolicyConfigurationException(String message) {
        super(message);
    }
}
