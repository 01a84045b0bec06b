package com.delta.newsdiscovery.crawl.api;

import com.delta.newsdiscovery.crawl.model.ConfiguredSourceView;
import com.delta.newsdiscovery.crawl.model.DiscoveryRunSummary;
import com.delta.newsdiscovery.crawl.model.SourceType;
import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.persistence.DiscoveryRunJdbcRepository;
import com.delta.newsdiscovery.crawl.policy.PolicyConfigurationException;
import com.delta.newsdiscovery.crawl.policy.TerminationReason;
import com.delta.newsdiscovery.crawl.service.ActiveDiscoveryRunException;
import com.delta.newsdiscovery.crawl.service.DiscoveryRunService;
import com.delta.newsdiscovery.crawl.service.JobSourceFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DiscoveryControllerTest {

    @Mock
    private DiscoveryRunService discoveryRunService;

    @Mock
    private JobSourceFactory jobSourceFactory;

    @Mock
    private DiscoveryRunJdbcRepository runRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DiscoveryController controller = new DiscoveryController(discoveryRunService, jobSourceFactory, runRepository);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new DiscoveryExceptionHandler())
            .build();
    }

    @Test
    void runForwardsRequestedSources() throws Exception {
        when(discoveryRunService.run(List.of("znews"))).thenReturn(
            new DiscoveryRunSummary(5L, Instant.now(), Instant.now(), "COMPLETED", 12L, List.of(), 0)
        );

        mockMvc.perform(post("/api/discovery/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sources\": [\"znews\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(5))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.emittedCount").value(12));
    }

    @Test
    void runWithoutBodyRunsEverySource() throws Exception {
        when(discoveryRunService.run(List.of())).thenReturn(
            new DiscoveryRunSummary(6L, Instant.now(), Instant.now(), "COMPLETED", 0L, List.of(), 0)
        );

        mockMvc.perform(post("/api/discovery/runs")).andExpect(status().isOk());

        verify(discoveryRunService).run(List.of());
    }

    @Test
    void activeRunAnswersConflict() throws Exception {
        when(discoveryRunService.run(List.of())).thenThrow(new ActiveDiscoveryRunException("A discovery run is already in progress"));

        mockMvc.perform(post("/api/discovery/runs"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_discovery_run"));
    }

    @Test
    void configurationErrorAnswersBadRequest() throws Exception {
        when(discoveryRunService.run(List.of("nope"))).thenThrow(new PolicyConfigurationException("Unknown source 'nope'"));

        mockMvc.perform(post("/api/discovery/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sources\": [\"nope\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_configuration"))
            .andExpect(jsonPath("$.message").value("Unknown source 'nope'"));
    }

    @Test
    void cancelReportsWhetherARunWasActive() throws Exception {
        when(discoveryRunService.cancelActiveRun()).thenReturn(false);

        mockMvc.perform(post("/api/discovery/runs/active/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void categoryResultsOfKnownAndUnknownRuns() throws Exception {
        when(runRepository.findRunStatus(3L)).thenReturn("COMPLETED");
        when(runRepository.findCategoryResults(3L)).thenReturn(List.of(
            new TraversalReport("kenh14", "star", 7, 140, 0, 2, 0, 0, 0, TerminationReason.EMPTY_PAGE_LIMIT)
        ));
        when(runRepository.findRunStatus(4L)).thenReturn(null);

        mockMvc.perform(get("/api/discovery/runs/3/categories"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].categorySlug").value("star"))
            .andExpect(jsonPath("$[0].terminationReason").value("EMPTY_PAGE_LIMIT"));
        mockMvc.perform(get("/api/discovery/runs/4/categories"))
            .andExpect(status().isNotFound());
    }

    @Test
    void listsConfiguredSources() throws Exception {
        when(jobSourceFactory.describeSources()).thenReturn(List.of(
            new ConfiguredSourceView("kenh14", SourceType.CATEGORY, "kenh14", "timeline-tolerant", List.of(), 600, 3,
                "TOLERATE_AS_EMPTY", null, "POST_DEDUP_COUNT")
        ));

        mockMvc.perform(get("/api/discovery/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("kenh14"))
            .andExpect(jsonPath("$[0].maxPages").value(600));
    }
}
