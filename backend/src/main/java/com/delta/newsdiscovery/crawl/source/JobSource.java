package com.delta.newsdiscovery.crawl.source;

import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceSummary;

import java.util.Iterator;

/**
 * A producer of discovery records. {@link #open()} may be called once; the returned iterator is lazy
 * and may throw an unchecked exception, which ends this source only.
 */
public interface JobSource {

    String name();

    Iterator<JobRecord> open();

    /**
     * Counters so far. Complete once the iterator returned by {@link #open()} is exhausted.
     */
    SourceSummary summary();
}
