package com.delta.newsdiscovery.crawl.port;

public class PageExtractionException extends Exception {
    public PageExtractionException(String message) {
        super(message);
    }

    public PageExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
