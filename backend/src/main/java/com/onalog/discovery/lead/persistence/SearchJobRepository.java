package com.onalog.discovery.lead.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onalog.discovery.lead.model.NewSearchJob;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.model.SearchTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class SearchJobRepository {
    private static final Logger log = LoggerFactory.getLogger(SearchJobRepository.class);
    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public SearchJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insert(NewSearchJob job) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantOwner", job.tenantOwner())
            .addValue("queryText", job.queryText())
            .addValue("countryFilter", job.countryFilter(), Types.VARCHAR)
            .addValue("locationFilter", job.locationFilter(), Types.VARCHAR)
            .addValue("industryHint", job.industryHint(), Types.VARCHAR)
            .addValue("resultTarget", job.resultTarget())
            .addValue("priority", job.priority())
            .addValue("status", SearchJobStatus.PENDING.dbValue())
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO search_jobs (
                    tenant_owner,
                    query_text,
                    country_filter,
                    location_filter,
                    industry_hint,
                    result_target,
                    priority,
                    status,
                    created_at,
                    updated_at
                )
                VALUES (
                    :tenantOwner,
                    :queryText,
                    :countryFilter,
                    :locationFilter,
                    :industryHint,
                    :resultTarget,
                    :priority,
                    :status,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("search_jobs insert returned no id");
        }
        return key.longValue();
    }

    public SearchJob findById(long id) {
        List<SearchJob> rows = jdbc.query(
            """
                SELECT *
                FROM search_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            searchJobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<SearchJob> findByTenant(String tenantOwner, int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM search_jobs
                WHERE tenant_owner = :tenantOwner
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("tenantOwner", tenantOwner)
                .addValue("limit", Math.max(1, limit)),
            searchJobRowMapper()
        );
    }

    public boolean exists(long id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM search_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * Moves the job forward. Backward moves and moves out of a terminal status are ignored; returns whether a
     * row changed.
     */
    public boolean updateStatus(long id, SearchJobStatus next) {
        List<String> allowedFrom = Arrays.stream(SearchJobStatus.values())
            .filter(current -> current.canTransitionTo(next))
            .map(SearchJobStatus::dbValue)
            .toList();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", next.dbValue())
            .addValue("allowedFrom", allowedFrom)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE search_jobs
                SET status = :status,
                    updated_at = :now
                WHERE id = :id
                  AND status IN (:allowedFrom)
                """,
            params
        );
        return updated > 0;
    }

    public void markStarted(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET started_at = COALESCE(started_at, :now),
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        updateStatus(id, SearchJobStatus.SEARCHING);
    }

    public void recordSearchOutcome(long id, int totalResults, Map<String, Object> telemetry, String shortfallReason) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("totalResults", Math.max(0, totalResults))
            .addValue("telemetry", writeJson(telemetry), Types.VARCHAR)
            .addValue("shortfallReason", truncate(shortfallReason), Types.VARCHAR)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET total_results = :totalResults,
                    provider_telemetry = :telemetry,
                    shortfall_reason = :shortfallReason,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void updateTotalResults(long id, int totalResults) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("totalResults", Math.max(0, totalResults))
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET total_results = :totalResults,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Re-derives the progress counters from persisted leads. Counters never decrease, so a lead deleted after
     * being counted does not roll progress back.
     */
    public void syncCounters(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enriched", "enriched")
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET extracted_count = GREATEST(
                        extracted_count,
                        (SELECT COUNT(*) FROM leads l WHERE l.search_job_id = :id AND l.is_duplicate = FALSE)
                    ),
                    enriched_count = GREATEST(
                        enriched_count,
                        (SELECT COUNT(*) FROM leads l
                         WHERE l.search_job_id = :id
                           AND l.is_duplicate = FALSE
                           AND l.enrichment_status = :enriched)
                    ),
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public int extractedCount(long id) {
        List<Integer> rows = jdbc.query(
            "SELECT extracted_count FROM search_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            (rs, rowNum) -> rs.getInt("extracted_count")
        );
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    public void markFailed(long id, String errorMessage) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("errorMessage", truncate(errorMessage), Types.VARCHAR)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET error_message = :errorMessage,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        updateStatus(id, SearchJobStatus.FAILED);
    }

    public void markCompleted(long id) {
        if (!updateStatus(id, SearchJobStatus.COMPLETED)) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE search_jobs
                SET completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public int delete(long id) {
        return jdbc.update(
            "DELETE FROM search_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id)
        );
    }

    public long insertTemplate(String tenantOwner, String name, SearchJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantOwner", tenantOwner)
            .addValue("name", name)
            .addValue("queryText", job.queryText())
            .addValue("countryFilter", job.countryFilter(), Types.VARCHAR)
            .addValue("locationFilter", job.locationFilter(), Types.VARCHAR)
            .addValue("industryHint", job.industryHint(), Types.VARCHAR)
            .addValue("resultTarget", job.resultTarget())
            .addValue("now", Timestamp.from(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO search_templates (
                    tenant_owner, name, query_text, country_filter, location_filter, industry_hint,
                    result_target, created_at
                )
                VALUES (
                    :tenantOwner, :name, :queryText, :countryFilter, :locationFilter, :industryHint,
                    :resultTarget, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("search_templates insert returned no id");
        }
        return key.longValue();
    }

    public List<SearchTemplate> findTemplates(String tenantOwner) {
        return jdbc.query(
            """
                SELECT *
                FROM search_templates
                WHERE tenant_owner = :tenantOwner
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource().addValue("tenantOwner", tenantOwner),
            (rs, rowNum) -> new SearchTemplate(
                rs.getLong("id"),
                rs.getString("tenant_owner"),
                rs.getString("name"),
                rs.getString("query_text"),
                rs.getString("country_filter"),
                rs.getString("location_filter"),
                rs.getString("industry_hint"),
                rs.getInt("result_target"),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    private RowMapper<SearchJob> searchJobRowMapper() {
        return (rs, rowNum) -> new SearchJob(
            rs.getLong("id"),
            rs.getString("tenant_owner"),
            rs.getString("query_text"),
            rs.getString("country_filter"),
            rs.getString("location_filter"),
            rs.getString("industry_hint"),
            rs.getInt("result_target"),
            rs.getInt("priority"),
            SearchJobStatus.fromDb(rs.getString("status")),
            rs.getInt("total_results"),
            rs.getInt("extracted_count"),
            rs.getInt("enriched_count"),
            readJsonMap(rs.getString("provider_telemetry")),
            rs.getString("shortfall_reason"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize provider telemetry", e);
            return null;
        }
    }

    private Map<String, Object> readJsonMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse provider telemetry", e);
            return Map.of();
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_MESSAGE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_MESSAGE_LENGTH);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
