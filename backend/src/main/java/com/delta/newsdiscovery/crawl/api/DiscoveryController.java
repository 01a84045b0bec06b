package com.delta.newsdiscovery.crawl.api;

import com.delta.newsdiscovery.crawl.model.ConfiguredSourceView;
import com.delta.newsdiscovery.crawl.model.DiscoveryRunSummary;
import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.persistence.DiscoveryRunJdbcRepository;
import com.delta.newsdiscovery.crawl.service.DiscoveryRunService;
import com.delta.newsdiscovery.crawl.service.JobSourceFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {
    private final DiscoveryRunService discoveryRunService;
    private final JobSourceFactory jobSourceFactory;
    private final DiscoveryRunJdbcRepository runRepository;

    public DiscoveryController(
        DiscoveryRunService discoveryRunService,
        JobSourceFactory jobSourceFactory,
        DiscoveryRunJdbcRepository runRepository
    ) {
        this.discoveryRunService = discoveryRunService;
        this.jobSourceFactory = jobSourceFactory;
        this.runRepository = runRepository;
    }

    @PostMapping("/runs")
    public DiscoveryRunSummary run(@RequestBody(required = false) DiscoveryRunRequest request) {
        List<String> sources = request == null || request.sources() == null ? List.of() : request.sources();
        return discoveryRunService.run(sources);
    }

    @PostMapping("/runs/active/cancel")
    public Map<String, Object> cancelActive() {
        return Map.of("cancelled", discoveryRunService.cancelActiveRun());
    }

    @GetMapping("/runs/{runId}/categories")
    public List<TraversalReport> categoryResults(@PathVariable long runId) {
        if (runRepository.findRunStatus(runId) == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown discovery run " + runId);
        }
        return runRepository.findCategoryResults(runId);
    }

    @GetMapping("/sources")
    public List<ConfiguredSourceView> sources() {
        return jobSourceFactory.describeSources();
    }
}
