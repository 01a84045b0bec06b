package com.delta.newsdiscovery.crawl.source;

public class BulkSourceException extends RuntimeException {
    public BulkSourceException(String message) {
        super(message);
    }

    public BulkSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
