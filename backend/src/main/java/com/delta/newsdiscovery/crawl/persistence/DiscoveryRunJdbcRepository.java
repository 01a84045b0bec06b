package com.delta.newsdiscovery.crawl.persistence;

import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.policy.TerminationReason;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class DiscoveryRunJdbcRepository {
    private static final RowMapper<TraversalReport> REPORT_MAPPER = (rs, rowNum) -> new TraversalReport(
        rs.getString("source_name"),
        rs.getString("category_slug"),
        rs.getInt("pages_visited"),
        rs.getInt("emitted"),
        rs.getInt("skipped_existing"),
        rs.getInt("skipped_duplicate"),
        rs.getInt("skipped_invalid"),
        rs.getInt("extraction_failures"),
        rs.getInt("fetch_failures"),
        TerminationReason.valueOf(rs.getString("termination_reason"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public DiscoveryRunJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertDiscoveryRun(Instant startedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", notes);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO discovery_runs (started_at, status, notes)
                VALUES (:startedAt, :status, :notes)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert discovery run");
        }
        return key.longValue();
    }

    public void completeDiscoveryRun(long runId, Instant finishedAt, String status, long emittedCount, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("emittedCount", emittedCount)
            .addValue("notes", notes);
        jdbc.update(
            """
                UPDATE discovery_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    emitted_count = :emittedCount,
                    notes = :notes
                WHERE id = :runId
                """,
            params
        );
    }

    public void insertCategoryResult(long runId, TraversalReport report) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("sourceName", report.sourceName() == null ? "" : report.sourceName())
            .addValue("categorySlug", report.categorySlug())
            .addValue("pagesVisited", report.pagesVisited())
            .addValue("emitted", report.emitted())
            .addValue("skippedExisting", report.skippedExisting())
            .addValue("skippedDuplicate", report.skippedDuplicate())
            .addValue("skippedInvalid", report.skippedInvalid())
            .addValue("extractionFailures", report.extractionFailures())
            .addValue("fetchFailures", report.fetchFailures())
            .addValue("terminationReason", report.terminationReason().name())
            .addValue("outcome", report.terminationReason().outcome().name());
        jdbc.update(
            """
                INSERT INTO discovery_category_results (
                    discovery_run_id,
                    source_name,
                    category_slug,
                    pages_visited,
                    emitted,
                    skipped_existing,
                    skipped_duplicate,
                    skipped_invalid,
                    extraction_failures,
                    fetch_failures,
                    termination_reason,
                    outcome
                )
                VALUES (
                    :runId,
                    :sourceName,
                    :categorySlug,
                    :pagesVisited,
                    :emitted,
                    :skippedExisting,
                    :skippedDuplicate,
                    :skippedInvalid,
                    :extractionFailures,
                    :fetchFailures,
                    :terminationReason,
                    :outcome
                )
                """,
            params
        );
    }

    public List<TraversalReport> findCategoryResults(long runId) {
        return jdbc.query(
            """
                SELECT source_name,
                       category_slug,
                       pages_visited,
                       emitted,
                       skipped_existing,
                       skipped_duplicate,
                       skipped_invalid,
                       extraction_failures,
                       fetch_failures,
                       termination_reason
                FROM discovery_category_results
                WHERE discovery_run_id = :runId
                ORDER BY id
                """,
            new MapSqlParameterSource("runId", runId),
            REPORT_MAPPER
        );
    }

    public String findRunStatus(long runId) {
        List<String> statuses = jdbc.queryForList(
            "SELECT status FROM discovery_runs WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            String.class
        );
        return statuses.isEmpty() ? null : statuses.get(0);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
