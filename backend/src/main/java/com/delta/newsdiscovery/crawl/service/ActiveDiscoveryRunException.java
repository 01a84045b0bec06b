package com.delta.newsdiscovery.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveDiscoveryRunException extends RuntimeException {
    public ActiveDiscoveryRunException(String message) {
        super(message);
    }
}
