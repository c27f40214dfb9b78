package com.onalog.discovery.lead.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onalog.discovery.lead.collab.EnrichmentResult;
import com.onalog.discovery.lead.model.DecisionMaker;
import com.onalog.discovery.lead.model.EnrichmentStatus;
import com.onalog.discovery.lead.model.ExtractionStatus;
import com.onalog.discovery.lead.model.Lead;
import com.onalog.discovery.lead.model.LeadQuery;
import com.onalog.discovery.lead.util.HostnameNormalizer;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class LeadRepository {
    private static final Logger log = LoggerFactory.getLogger(LeadRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<DecisionMaker>> DECISION_MAKER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public LeadRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts the lead. Non-duplicate leads with a real website carry a dedupe key, so a second non-duplicate for
     * the same host in the same job fails with a {@code DataIntegrityViolationException}; so does a lead whose job
     * was deleted.
     */
    public long insert(Lead lead) {
        String normalizedHost = HostnameNormalizer.isPlaceholderLink(lead.website())
            ? null
            : emptyToNull(HostnameNormalizer.normalize(lead.website()));
        String dedupeKey = lead.duplicate() ? null : normalizedHost;
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("searchJobId", lead.searchJobId())
            .addValue("companyName", lead.companyName())
            .addValue("website", lead.website(), Types.VARCHAR)
            .addValue("normalizedHost", normalizedHost, Types.VARCHAR)
            .addValue("dedupeKey", dedupeKey, Types.VARCHAR)
            .addValue("emails", writeJson(lead.emails()), Types.VARCHAR)
            .addValue("phoneNumbers", writeJson(lead.phoneNumbers()), Types.VARCHAR)
            .addValue("address", lead.address(), Types.VARCHAR)
            .addValue("country", lead.country(), Types.VARCHAR)
            .addValue("industry", lead.industry(), Types.VARCHAR)
            .addValue("decisionMakers", writeJson(lead.decisionMakers()), Types.VARCHAR)
            .addValue("socialLinks", writeJson(lead.socialLinks()), Types.VARCHAR)
            .addValue("duplicate", lead.duplicate())
            .addValue("duplicateOf", lead.duplicateOfLeadId(), Types.BIGINT)
            .addValue("extractionStatus", statusOrDefault(lead.extractionStatus()).dbValue())
            .addValue("enrichmentStatus", lead.enrichmentStatus() == null
                ? EnrichmentStatus.PENDING.dbValue()
                : lead.enrichmentStatus().dbValue())
            .addValue("qualityScore", lead.qualityScore(), Types.INTEGER)
            .addValue("verificationScore", lead.verificationScore(), Types.INTEGER)
            .addValue("signalStrength", lead.signalStrength(), Types.INTEGER)
            .addValue("source", lead.source(), Types.VARCHAR)
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO leads (
                    search_job_id, company_name, website, normalized_host, dedupe_key, emails, phone_numbers,
                    address, country, industry, decision_makers, social_links, is_duplicate, duplicate_of_lead_id,
                    extraction_status, enrichment_status, quality_score, verification_score, signal_strength,
                    source, created_at, updated_at
                )
                VALUES (
                    :searchJobId, :companyName, :website, :normalizedHost, :dedupeKey, :emails, :phoneNumbers,
                    :address, :country, :industry, :decisionMakers, :socialLinks, :duplicate, :duplicateOf,
                    :extractionStatus, :enrichmentStatus, :qualityScore, :verificationScore, :signalStrength,
                    :source, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("leads insert returned no id");
        }
        return key.longValue();
    }

    public Long findNonDuplicateIdByHost(long searchJobId, String normalizedHost) {
        if (normalizedHost == null || normalizedHost.isBlank()) {
            return null;
        }
        List<Long> rows = jdbc.query(
            """
                SELECT id
                FROM leads
                WHERE search_job_id = :searchJobId
                  AND normalized_host = :host
                  AND is_duplicate = FALSE
                ORDER BY id ASC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("searchJobId", searchJobId)
                .addValue("host", normalizedHost),
            (rs, rowNum) -> rs.getLong("id")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<LeadName> findNonDuplicateNames(long searchJobId) {
        return jdbc.query(
            """
                SELECT id, company_name
                FROM leads
                WHERE search_job_id = :searchJobId
                  AND is_duplicate = FALSE
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("searchJobId", searchJobId),
            (rs, rowNum) -> new LeadName(rs.getLong("id"), rs.getString("company_name"))
        );
    }

    public boolean existsNonDuplicate(long leadId, long searchJobId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM leads
                WHERE id = :id
                  AND search_job_id = :searchJobId
                  AND is_duplicate = FALSE
                """,
            new MapSqlParameterSource()
                .addValue("id", leadId)
                .addValue("searchJobId", searchJobId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public int countOtherJobsWithHost(long searchJobId, String normalizedHost) {
        if (normalizedHost == null || normalizedHost.isBlank()) {
            return 0;
        }
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(DISTINCT search_job_id)
                FROM leads
                WHERE normalized_host = :host
                  AND search_job_id <> :searchJobId
                  AND is_duplicate = FALSE
                """,
            new MapSqlParameterSource()
                .addValue("host", normalizedHost)
                .addValue("searchJobId", searchJobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public int countNonDuplicate(long searchJobId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM leads
                WHERE search_job_id = :searchJobId
                  AND is_duplicate = FALSE
                """,
            new MapSqlParameterSource().addValue("searchJobId", searchJobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void updateEnrichmentStatus(long leadId, EnrichmentStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", leadId)
            .addValue("status", status.dbValue())
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE leads
                SET enrichment_status = :status,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Stores the enrichment output. Collaborator values only fill gaps or replace empty lists; extracted contact
     * data is never overwritten with nulls.
     */
    public void applyEnrichment(long leadId, EnrichmentResult result) {
        List<DecisionMaker> decisionMakers = result.decisionMakers();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", leadId)
            .addValue("status", EnrichmentStatus.ENRICHED.dbValue())
            .addValue("industry", result.industry(), Types.VARCHAR)
            .addValue("companySize", result.companySize(), Types.VARCHAR)
            .addValue("emailPattern", result.emailPattern(), Types.VARCHAR)
            .addValue("signalStrength", result.signalStrength(), Types.INTEGER)
            .addValue("verificationScore", result.verificationScore(), Types.INTEGER)
            .addValue(
                "decisionMakers",
                decisionMakers == null || decisionMakers.isEmpty() ? null : writeJson(decisionMakers),
                Types.VARCHAR
            )
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE leads
                SET enrichment_status = :status,
                    industry = COALESCE(industry, :industry),
                    company_size = COALESCE(:companySize, company_size),
                    email_pattern = COALESCE(:emailPattern, email_pattern),
                    signal_strength = COALESCE(:signalStrength, signal_strength),
                    verification_score = COALESCE(:verificationScore, verification_score),
                    decision_makers = COALESCE(:decisionMakers, decision_makers),
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public Lead findById(long leadId) {
        List<Lead> rows = jdbc.query(
            "SELECT * FROM leads WHERE id = :id",
            new MapSqlParameterSource().addValue("id", leadId),
            leadRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Non-duplicate leads of one job ranked by quality, verification and signal strength; missing scores always
     * rank last.
     */
    public List<Lead> findResults(long searchJobId, LeadQuery query) {
        MapSqlParameterSource params = resultParams(searchJobId, query)
            .addValue("limit", Math.max(1, query.limit()))
            .addValue("offset", Math.max(0, query.offset()));
        return jdbc.query(
            """
                SELECT *
                FROM leads
                WHERE search_job_id = :searchJobId
                  AND is_duplicate = FALSE
                  AND (:minScore IS NULL OR quality_score >= :minScore)
                  AND (:country IS NULL OR LOWER(country) = :country)
                  AND (:industry IS NULL OR LOWER(industry) LIKE :industry)
                ORDER BY quality_score DESC NULLS LAST,
                         verification_score DESC NULLS LAST,
                         signal_strength DESC NULLS LAST,
                         id ASC
                LIMIT :limit OFFSET :offset
                """,
            params,
            leadRowMapper()
        );
    }

    public long countResults(long searchJobId, LeadQuery query) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM leads
                WHERE search_job_id = :searchJobId
                  AND is_duplicate = FALSE
                  AND (:minScore IS NULL OR quality_score >= :minScore)
                  AND (:country IS NULL OR LOWER(country) = :country)
                  AND (:industry IS NULL OR LOWER(industry) LIKE :industry)
                """,
            resultParams(searchJobId, query),
            Long.class
        );
        return count == null ? 0 : count;
    }

    private MapSqlParameterSource resultParams(long searchJobId, LeadQuery query) {
        String country = blankToNull(query.country());
        String industry = blankToNull(query.industry());
        return new MapSqlParameterSource()
            .addValue("searchJobId", searchJobId)
            .addValue("minScore", query.minScore(), Types.INTEGER)
            .addValue("country", country == null ? null : country.toLowerCase(Locale.ROOT), Types.VARCHAR)
            .addValue(
                "industry",
                industry == null ? null : "%" + industry.toLowerCase(Locale.ROOT) + "%",
                Types.VARCHAR
            );
    }

    private RowMapper<Lead> leadRowMapper() {
        return (rs, rowNum) -> new Lead(
            rs.getLong("id"),
            rs.getLong("search_job_id"),
            rs.getString("company_name"),
            rs.getString("website"),
            readJson(rs.getString("emails"), STRING_LIST, List.of()),
            readJson(rs.getString("phone_numbers"), STRING_LIST, List.of()),
            rs.getString("address"),
            rs.getString("country"),
            rs.getString("industry"),
            readJson(rs.getString("decision_makers"), DECISION_MAKER_LIST, List.of()),
            readJson(rs.getString("social_links"), STRING_MAP, Map.of()),
            rs.getBoolean("is_duplicate"),
            nullableLong(rs.getObject("duplicate_of_lead_id")),
            ExtractionStatus.fromDb(rs.getString("extraction_status")),
            EnrichmentStatus.fromDb(rs.getString("enrichment_status")),
            nullableInt(rs.getObject("quality_score")),
            nullableInt(rs.getObject("verification_score")),
            nullableInt(rs.getObject("signal_strength")),
            rs.getString("source"),
            rs.getTimestamp("created_at") == null ? null : rs.getTimestamp("created_at").toInstant()
        );
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize lead column", e);
            return null;
        }
    }

    private <T> T readJson(String json, TypeReference<? extends T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse lead column", e);
            return fallback;
        }
    }

    private static ExtractionStatus statusOrDefault(ExtractionStatus status) {
        return status == null ? ExtractionStatus.EXTRACTED : status;
    }

    private static Long nullableLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }

    private static Integer nullableInt(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    public record LeadName(long id, String companyName) {
    }
}
