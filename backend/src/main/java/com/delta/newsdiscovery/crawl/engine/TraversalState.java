package com.delta.newsdiscovery.crawl.engine;

import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.policy.TerminationReason;

import java.util.List;

/**
 * Mutable bookkeeping of one category traversal. Owned by a single traversal; not thread-safe.
 */
public class TraversalState {

    public enum Phase {
        FETCHING,
        EXTRACTING,
        EVALUATING,
        EMITTING,
        TERMINATED
    }

    private int currentPage = 1;
    private int consecutiveEmptyPages;
    private List<String> previousFingerprint = List.of();
    private TerminationReason terminationReason;
    private Phase phase = Phase.FETCHING;

    private int pagesVisited;
    private int emitted;
    private int skippedExisting;
    private int skippedDuplicate;
    private int skippedInvalid;
    private int extractionFailures;
    private int fetchFailures;

    public int currentPage() {
        return currentPage;
    }

    public int advancePage() {
        return ++currentPage;
    }

    public int consecutiveEmptyPages() {
        return consecutiveEmptyPages;
    }

    public void recordPageYield(int emittedCount) {
        if (emittedCount == 0) {
            consecutiveEmptyPages++;
        } else {
            consecutiveEmptyPages = 0;
        }
    }

    public List<String> previousFingerprint() {
        return previousFingerprint;
    }

    /**
     * An empty fingerprint never matches, so a page without links cannot be mistaken for a loop.
     */
    public boolean repeatsPreviousFingerprint(List<String> fingerprint) {
        return !previousFingerprint.isEmpty() && previousFingerprint.equals(fingerprint);
    }

    public void rememberFingerprint(List<String> fingerprint) {
        previousFingerprint = fingerprint == null ? List.of() : List.copyOf(fingerprint);
    }

    public Phase phase() {
        return phase;
    }

    public void enter(Phase next) {
        if (phase == Phase.TERMINATED) {
            throw new IllegalStateException("Traversal already terminated with " + terminationReason);
        }
        if (next == Phase.TERMINATED) {
            throw new IllegalArgumentException("Use terminate(reason) to end a traversal");
        }
        phase = next;
    }

    public void terminate(TerminationReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("termination reason is required");
        }
        if (terminationReason != null) {
            throw new IllegalStateException(
                "Termination reason already set to " + terminationReason + ", refusing " + reason
            );
        }
        terminationReason = reason;
        phase = Phase.TERMINATED;
    }

    public boolean isTerminated() {
        return terminationReason != null;
    }

    public TerminationReason terminationReason() {
        return terminationReason;
    }

    public void countPageVisited() {
        pagesVisited++;
    }

    public void countEmitted() {
        emitted++;
    }

    public void countSkippedExisting() {
        skippedExisting++;
    }

    public void countSkippedDuplicate() {
        skippedDuplicate++;
    }

    public void countSkippedInvalid() {
        skippedInvalid++;
    }

    public void countExtractionFailure() {
        extractionFailures++;
    }

    public void countFetchFailure() {
        fetchFailures++;
    }

    public int pagesVisited() {
        return pagesVisited;
    }

    public int emitted() {
        return emitted;
    }

    public TraversalReport toReport(String sourceName, String categorySlug) {
        return new TraversalReport(
            sourceName,
            categorySlug,
            pagesVisited,
            emitted,
            skippedExisting,
            skippedDuplicate,
            skippedInvalid,
            extractionFailures,
            fetchFailures,
            terminationReason
        );
    }
}
