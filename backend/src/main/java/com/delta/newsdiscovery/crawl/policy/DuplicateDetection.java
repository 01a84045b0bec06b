package com.delta.newsdiscovery.crawl.policy;

public record DuplicateDetection(boolean enabled, int fingerprintSize) {
    private static final DuplicateDetection DISABLED = new DuplicateDetection(false, 0);

    public static DuplicateDetection disabled() {
        return DISABLED;
    }

    public static DuplicateDetection fingerprintOf(int size) {
        return new DuplicateDetection(true, size);
    }
}
