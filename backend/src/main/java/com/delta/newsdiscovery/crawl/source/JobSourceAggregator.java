package com.delta.newsdiscovery.crawl.source;

import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import com.delta.newsdiscovery.crawl.output.JobRecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Chains sources in registration order. A source that throws is ended and recorded as failed; the
 * records it produced before failing are kept and the next source starts.
 */
public class JobSourceAggregator implements Iterable<JobRecord> {
    private static final Logger log = LoggerFactory.getLogger(JobSourceAggregator.class);

    private final List<JobSource> sources;
    private final Map<String, String> failures = Collections.synchronizedMap(new LinkedHashMap<>());

    public JobSourceAggregator(List<JobSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public List<JobSource> sources() {
        return sources;
    }

    /**
     * Single-use: every source is opened once.
     */
    @Override
    public Iterator<JobRecord> iterator() {
        return new ChainedIterator();
    }

    /**
     * Drains all sources into the sink one after another. Returns the number of records handed over.
     */
    public long drainTo(JobRecordSink sink) {
        long count = 0;
        for (JobRecord record : this) {
            sink.accept(record);
            count++;
        }
        return count;
    }

    /**
     * Drains every source on its own worker into a private buffer. Once all workers are done the
     * records are handed to the sink in ascending {@code discoveryOrder}, the order in which the shared
     * dedup index granted their claims, so the sink never sees that order go backwards.
     */
    public long drainConcurrently(Executor executor, JobRecordSink sink) {
        List<CompletableFuture<List<JobRecord>>> futures = new ArrayList<>();
        for (JobSource source : sources) {
            futures.add(CompletableFuture.supplyAsync(() -> drainSource(source), executor));
        }
        List<JobRecord> merged = new ArrayList<>();
        for (CompletableFuture<List<JobRecord>> future : futures) {
            merged.addAll(future.join());
        }
        merged.sort(Comparator.comparingLong(JobRecord::discoveryOrder));
        for (JobRecord record : merged) {
            sink.accept(record);
        }
        return merged.size();
    }

    public Map<String, String> failures() {
        synchronized (failures) {
            return Map.copyOf(failures);
        }
    }

    public List<SourceSummary> summaries() {
        List<SourceSummary> summaries = new ArrayList<>(sources.size());
        for (JobSource source : sources) {
            SourceSummary summary = source.summary();
            String failure = failures.get(source.name());
            summaries.add(failure == null ? summary : summary.withFailure(failure));
        }
        return summaries;
    }

    private List<JobRecord> drainSource(JobSource source) {
        List<JobRecord> buffer = new ArrayList<>();
        Iterator<JobRecord> records = openSafely(source);
        while (records != null && advanceSafely(source, records)) {
            buffer.add(records.next());
        }
        return buffer;
    }

    private Iterator<JobRecord> openSafely(JobSource source) {
        try {
            return source.open();
        } catch (RuntimeException e) {
            recordFailure(source, e);
            return null;
        }
    }

    private boolean advanceSafely(JobSource source, Iterator<JobRecord> records) {
        try {
            return records.hasNext();
        } catch (RuntimeException e) {
            recordFailure(source, e);
            return false;
        }
    }

    private void recordFailure(JobSource source, RuntimeException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        failures.put(source.name(), message);
        log.warn("Source {} failed and was skipped: {}", source.name(), message, e);
    }

    private final class ChainedIterator implements Iterator<JobRecord> {
        private int index;
        private JobSource currentSource;
        private Iterator<JobRecord> current;

        @Override
        public boolean hasNext() {
            while (true) {
                if (current != null && advanceSafely(currentSource, current)) {
                    return true;
                }
                current = null;
                if (index >= sources.size()) {
                    return false;
                }
                currentSource = sources.get(index++);
                current = openSafely(currentSource);
            }
        }

        @Override
        public JobRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("All sources are exhausted");
            }
            return current.next();
        }
    }
}
