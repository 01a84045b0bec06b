package com.delta.newsdiscovery.crawl.engine;

import com.delta.newsdiscovery.crawl.dedup.ClaimOutcome;
import com.delta.newsdiscovery.crawl.model.CategoryDefinition;
import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.model.FetchOutcome;
import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceKind;
import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.policy.EmptyPageDefinition;
import com.delta.newsdiscovery.crawl.policy.HttpFailureMode;
import com.delta.newsdiscovery.crawl.policy.TerminationPolicy;
import com.delta.newsdiscovery.crawl.policy.TerminationReason;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.port.PageFetchPort;
import com.delta.newsdiscovery.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-use traversal of one category. A page is fetched only when the consumer asks for more
 * records than the previous pages produced, so a consumer that stops early stops the fetching too.
 */
public class CategoryTraversal implements Iterator<JobRecord> {
    private static final Logger log = LoggerFactory.getLogger(CategoryTraversal.class);

    private final String sourceName;
    private final CategoryDefinition category;
    private final TerminationPolicy policy;
    private final PageFetchPort fetchPort;
    private final PageExtractorPort extractPort;
    private final DiscoveryRunContext context;
    private final TraversalState state = new TraversalState();
    private final Deque<JobRecord> pending = new ArrayDeque<>();
    private boolean reported;

    CategoryTraversal(
        String sourceName,
        CategoryDefinition category,
        TerminationPolicy policy,
        PageFetchPort fetchPort,
        PageExtractorPort extractPort,
        DiscoveryRunContext context
    ) {
        this.sourceName = sourceName;
        this.category = category;
        this.policy = policy;
        this.fetchPort = fetchPort;
        this.extractPort = extractPort;
        this.context = context;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !state.isTerminated()) {
            visitPage();
        }
        if (pending.isEmpty()) {
            reportOnce();
            return false;
        }
        return true;
    }

    @Override
    public JobRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Category " + category.slug() + " traversal is finished");
        }
        return pending.poll();
    }

    public TraversalState state() {
        return state;
    }

    public CategoryDefinition category() {
        return category;
    }

    /**
     * Ends this traversal after an error escaped it. Records not yet handed out are dropped and the
     * category is reported as {@link TerminationReason#FETCH_FAILURE} unless it had already stopped.
     */
    public TraversalReport abandon(RuntimeException cause) {
        log.warn("Category {} of {} aborted on page {}", category.slug(), sourceName, state.currentPage(), cause);
        pending.clear();
        if (!state.isTerminated()) {
            state.terminate(TerminationReason.FETCH_FAILURE);
        }
        reportOnce();
        return state.toReport(sourceName, category.slug());
    }

    private void visitPage() {
        if (context.cancellation().isCancelled()) {
            state.terminate(TerminationReason.CANCELLED);
            return;
        }

        int page = state.currentPage();
        String target = targetFor(page);
        if (target == null) {
            state.terminate(TerminationReason.CATALOG_EXHAUSTED);
            return;
        }

        state.enter(TraversalState.Phase.FETCHING);
        FetchOutcome outcome = fetchPort.fetch(target);
        state.countPageVisited();

        int emittedCount;
        if (!outcome.isSuccessful()) {
            state.countFetchFailure();
            log.warn(
                "Fetch failed for {} page {} ({}): {} status={}",
                category.slug(),
                page,
                target,
                outcome.failureKind(),
                outcome.statusCode()
            );
            if (policy.httpFailureMode() == HttpFailureMode.HALT) {
                state.terminate(TerminationReason.FETCH_FAILURE);
                return;
            }
            state.rememberFingerprint(List.of());
            emittedCount = 0;
        } else {
            state.enter(TraversalState.Phase.EXTRACTING);
            List<ExtractedLink> links = extractLinks(outcome.body(), target, page);

            state.enter(TraversalState.Phase.EVALUATING);
            if (policy.duplicateDetection().enabled()) {
                List<String> fingerprint = fingerprintOf(links, policy.duplicateDetection().fingerprintSize(), target);
                if (state.repeatsPreviousFingerprint(fingerprint)) {
                    log.debug("Page {} of {} repeats the previous page, stopping", page, category.slug());
                    state.terminate(TerminationReason.DUPLICATE_PAGINATION);
                    return;
                }
                state.rememberFingerprint(fingerprint);
            }

            state.enter(TraversalState.Phase.EMITTING);
            int newRecords = emit(links, target, page);
            emittedCount = policy.emptyDefinition() == EmptyPageDefinition.RAW_EXTRACTED_COUNT ? links.size() : newRecords;
            log.debug(
                "Category {} page {}: extracted={}, emitted={}, counted={}",
                category.slug(),
                page,
                links.size(),
                newRecords,
                emittedCount
            );
        }

        state.recordPageYield(emittedCount);
        if (policy.hasEmptyPageGuard() && state.consecutiveEmptyPages() >= policy.maxEmptyPages()) {
            state.terminate(TerminationReason.EMPTY_PAGE_LIMIT);
            return;
        }
        int nextPage = state.advancePage();
        if (policy.hasPageCeiling() && nextPage > policy.maxPages()) {
            state.terminate(TerminationReason.MAX_PAGES_REACHED);
        }
    }

    private String targetFor(int page) {
        if (page == 1 && category.hasLandingPage()) {
            return category.landingUrl();
        }
        return category.timelineUrl(page);
    }

    private List<ExtractedLink> extractLinks(String body, String pageUrl, int page) {
        try {
            List<ExtractedLink> links = extractPort.extract(body, pageUrl);
            return links == null ? List.of() : links;
        } catch (PageExtractionException | RuntimeException e) {
            state.countExtractionFailure();
            log.warn("Extraction failed for {} page {} ({}): {}", category.slug(), page, pageUrl, e.toString());
            return List.of();
        }
    }

    private static List<String> fingerprintOf(List<ExtractedLink> links, int size, String pageUrl) {
        List<String> fingerprint = new ArrayList<>(size);
        for (ExtractedLink link : links) {
            if (fingerprint.size() >= size) {
                break;
            }
            String normalized = UrlNormalizer.resolve(pageUrl, link.url());
            if (normalized != null) {
                fingerprint.add(normalized);
            }
        }
        return fingerprint;
    }

    private int emit(List<ExtractedLink> links, String pageUrl, int page) {
        SourceKind kind = page == 1 && category.hasLandingPage() ? SourceKind.LANDING_PAGE : SourceKind.CATEGORY_TIMELINE;
        int emitted = 0;
        for (ExtractedLink link : links) {
            String url = UrlNormalizer.resolve(pageUrl, link.url());
            if (url == null) {
                state.countSkippedInvalid();
                continue;
            }
            ClaimOutcome claim = context.dedupIndex().tryClaim(url);
            if (claim == ClaimOutcome.ALREADY_PERSISTED) {
                state.countSkippedExisting();
                continue;
            }
            if (claim == ClaimOutcome.ALREADY_CLAIMED) {
                state.countSkippedDuplicate();
                continue;
            }
            pending.add(JobRecord.fromCategory(
                url,
                category.slug(),
                kind,
                link.lastModified(),
                context.nextDiscoveryOrder(),
                sourceName
            ));
            state.countEmitted();
            emitted++;
        }
        return emitted;
    }

    private void reportOnce() {
        if (reported) {
            return;
        }
        reported = true;
        TraversalReport report = state.toReport(sourceName, category.slug());
        log.info(
            "Category {} finished: reason={}, pages={}, emitted={}, skippedExisting={}, skippedDuplicate={}, "
                + "skippedInvalid={}, extractionFailures={}, fetchFailures={}",
            report.categorySlug(),
            report.terminationReason(),
            report.pagesVisited(),
            report.emitted(),
            report.skippedExisting(),
            report.skippedDuplicate(),
            report.skippedInvalid(),
            report.extractionFailures(),
            report.fetchFailures()
        );
        context.listener().onCategoryComplete(report);
    }
}
