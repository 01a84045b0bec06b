package com.delta.newsdiscovery.crawl.output;

import com.delta.newsdiscovery.crawl.model.JobRecord;

@FunctionalInterface
public interface JobRecordSink {
    void accept(JobRecord record);
}
