package com.delta.newsdiscovery.crawl.service;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.dedup.DedupIndex;
import com.delta.newsdiscovery.crawl.engine.CancellationSignal;
import com.delta.newsdiscovery.crawl.engine.DiscoveryRunContext;
import com.delta.newsdiscovery.crawl.engine.TraversalListener;
import com.delta.newsdiscovery.crawl.model.DiscoveryRunSummary;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import com.delta.newsdiscovery.crawl.output.NdjsonJobRecordWriter;
import com.delta.newsdiscovery.crawl.persistence.DiscoveryRunJdbcRepository;
import com.delta.newsdiscovery.crawl.port.PersistedUrlPort;
import com.delta.newsdiscovery.crawl.source.JobSource;
import com.delta.newsdiscovery.crawl.source.JobSourceAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one discovery pass over the configured sources and writes the jobs file. Only one run may be
 * active at a time.
 */
@Service
public class DiscoveryRunService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunService.class);

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_FAILED = "FAILED";

    private final DiscoveryProperties properties;
    private final JobSourceFactory sourceFactory;
    private final PersistedUrlPort persistedUrls;
    private final DiscoveryRunJdbcRepository runRepository;
    private final ExecutorService discoveryExecutor;
    private final ObjectMapper objectMapper;
    private final AtomicReference<CancellationSignal> activeRun = new AtomicReference<>();

    public DiscoveryRunService(
        DiscoveryProperties properties,
        JobSourceFactory sourceFactory,
        PersistedUrlPort persistedUrls,
        DiscoveryRunJdbcRepository runRepository,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.sourceFactory = sourceFactory;
        this.persistedUrls = persistedUrls;
        this.runRepository = runRepository;
        this.discoveryExecutor = discoveryExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * @param sourceNames subset of configured sources; empty runs all of them
     */
    public DiscoveryRunSummary run(List<String> sourceNames) {
        CancellationSignal cancellation = new CancellationSignal();
        if (!activeRun.compareAndSet(null, cancellation)) {
            throw new ActiveDiscoveryRunException("A discovery run is already in progress");
        }
        try {
            return runExclusive(sourceNames == null ? List.of() : sourceNames, cancellation);
        } finally {
            activeRun.set(null);
        }
    }

    /**
     * Asks the active run, if any, to stop at the next page boundary.
     */
    public boolean cancelActiveRun() {
        CancellationSignal signal = activeRun.get();
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for the active discovery run");
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private DiscoveryRunSummary runExclusive(List<String> sourceNames, CancellationSignal cancellation) {
        DedupIndex dedupIndex = properties.isResume() ? new DedupIndex(persistedUrls.loadExisting()) : new DedupIndex();
        AtomicLong runIdHolder = new AtomicLong();
        TraversalListener listener = report -> runRepository.insertCategoryResult(runIdHolder.get(), report);
        DiscoveryRunContext context = new DiscoveryRunContext(dedupIndex, cancellation, listener);
        List<JobSource> sources = sourceFactory.create(sourceNames, context);

        Instant startedAt = Instant.now();
        long runId = runRepository.insertDiscoveryRun(startedAt, "RUNNING", "discovery started");
        runIdHolder.set(runId);
        log.info(
            "Discovery run {} started: sources={}, resume={}, persistedUrls={}",
            runId,
            sources.stream().map(JobSource::name).toList(),
            properties.isResume(),
            dedupIndex.persistedSize()
        );

        String status;
        String notes;
        long emitted = 0;
        List<SourceSummary> summaries = List.of();
        JobSourceAggregator aggregator = new JobSourceAggregator(sources);
        try (NdjsonJobRecordWriter writer = new NdjsonJobRecordWriter(outputPath(), objectMapper)) {
            emitted = properties.isConcurrentSources()
                ? aggregator.drainConcurrently(discoveryExecutor, writer)
                : aggregator.drainTo(writer);
            summaries = aggregator.summaries();
            status = statusOf(summaries, cancellation);
            notes = "sources=" + summaries.size() + ", failedSources=" + aggregator.failures().keySet();
        } catch (Exception e) {
            log.warn("Discovery run {} failed", runId, e);
            summaries = aggregator.summaries();
            status = STATUS_FAILED;
            notes = "exception=" + e.getClass().getSimpleName();
        }

        Instant finishedAt = Instant.now();
        runRepository.completeDiscoveryRun(runId, finishedAt, status, emitted, notes);
        log.info("Discovery run {} finished with status {}: emitted={}", runId, status, emitted);
        for (SourceSummary summary : summaries) {
            log.info(
                "Summary {}: total={}, emitted={}, skippedExisting={}, skippedDuplicate={}, skippedInvalid={}, failure={}",
                summary.sourceName(),
                summary.total(),
                summary.emitted(),
                summary.skippedExisting(),
                summary.skippedDuplicate(),
                summary.skippedInvalid(),
                summary.failure()
            );
        }
        return new DiscoveryRunSummary(
            runId,
            startedAt,
            finishedAt,
            status,
            emitted,
            summaries,
            STATUS_COMPLETED.equals(status) ? 0 : 1
        );
    }

    static String statusOf(List<SourceSummary> summaries, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            return STATUS_CANCELLED;
        }
        boolean hadErrors = summaries.stream().anyMatch(summary -> summary.failed() || summary.anyCategoryBlocked());
        return hadErrors ? STATUS_COMPLETED_WITH_ERRORS : STATUS_COMPLETED;
    }

    private Path outputPath() {
        Path path = Paths.get(properties.getOutputFile());
        return path.isAbsolute() ? path : Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
