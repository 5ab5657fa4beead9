package com.firmenakte.aggregate.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.AggregationRunView;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredArtifact;
import com.firmenakte.aggregate.model.StoredCompanyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class CompanyRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(CompanyRecordRepository.class);
    public static final String RUN_RUNNING = "RUNNING";
    public static final String RUN_COMPLETED = "COMPLETED";
    public static final String RUN_FAILED = "FAILED";
    public static final String RUN_ABORTED = "ABORTED";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CompanyRecordRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("company_records", countTable("company_records"));
        counts.put("company_artifacts", countTable("company_artifacts"));
        counts.put("aggregation_runs", countTable("aggregation_runs"));
        return counts;
    }

    public long upsertCompanyRecord(
        IdentityFingerprint fingerprint,
        CompanyIdentity identity,
        String recordJson,
        String reportJson,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", fingerprint.hash())
            .addValue("identityKey", fingerprint.key())
            .addValue("companyName", identity.companyName())
            .addValue("registernummer", identity.registernummer())
            .addValue("ustIdnr", identity.ustIdnr())
            .addValue("recordJson", recordJson)
            .addValue("reportJson", reportJson)
            .addValue("now", toTimestamp(now));

        String update = """
            UPDATE company_records
            SET company_name = COALESCE(CAST(:companyName AS TEXT), company_name),
                registernummer = COALESCE(CAST(:registernummer AS TEXT), registernummer),
                ust_idnr = COALESCE(CAST(:ustIdnr AS TEXT), ust_idnr),
                record_json = :recordJson,
                report_json = :reportJson,
                updated_at = :now,
                aggregation_count = aggregation_count + 1
            WHERE fingerprint = :fingerprint
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO company_records (
                            fingerprint, identity_key, company_name, registernummer, ust_idnr,
                            record_json, report_json, first_seen_at, updated_at, aggregation_count
                        )
                        VALUES (
                            :fingerprint, :identityKey, :companyName, :registernummer, :ustIdnr,
                            :recordJson, :reportJson, :now, :now, 1
                        )
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                // a concurrent run inserted the same company first
                jdbc.update(update, params);
            }
        }

        Long id = jdbc.queryForObject(
            "SELECT id FROM company_records WHERE fingerprint = :fingerprint",
            params,
            Long.class
        );
        return id == null ? 0L : id;
    }

    public void replaceArtifacts(long companyRecordId, List<StoredArtifact> artifacts, Instant storedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("companyRecordId", companyRecordId);
        jdbc.update("DELETE FROM company_artifacts WHERE company_record_id = :companyRecordId", params);
        for (StoredArtifact artifact : artifacts) {
            jdbc.update(
                """
                    INSERT INTO company_artifacts (
                        company_record_id, source, artifact_field, format, source_url,
                        storage_path, sha256, size_bytes, stored_at
                    )
                    VALUES (
                        :companyRecordId, :source, :artifactField, :format, :sourceUrl,
                        :storagePath, :sha256, :sizeBytes, :storedAt
                    )
                    """,
                new MapSqlParameterSource()
                    .addValue("companyRecordId", companyRecordId)
                    .addValue("source", artifact.source().key())
                    .addValue("artifactField", artifact.artifactField() == null ? null : artifact.artifactField().key())
                    .addValue("format", artifact.format().name())
                    .addValue("sourceUrl", artifact.sourceUrl())
                    .addValue("storagePath", artifact.storagePath())
                    .addValue("sha256", artifact.sha256())
                    .addValue("sizeBytes", artifact.sizeBytes())
                    .addValue("storedAt", toTimestamp(storedAt))
            );
        }
    }

    public Optional<StoredCompanyRecord> findCompanyRecord(String fingerprint) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("fingerprint", fingerprint);
        List<StoredCompanyRecord> rows = jdbc.query(
            """
                SELECT id, fingerprint, identity_key, company_name, registernummer, ust_idnr,
                       record_json, report_json, first_seen_at, updated_at, aggregation_count
                FROM company_records
                WHERE fingerprint = :fingerprint
                """,
            params,
            (rs, rowNum) -> new StoredCompanyRecord(
                rs.getLong("id"),
                rs.getString("fingerprint"),
                rs.getString("identity_key"),
                rs.getString("company_name"),
                rs.getString("registernummer"),
                rs.getString("ust_idnr"),
                readJson(rs.getString("record_json")),
                readJson(rs.getString("report_json")),
                List.of(),
                toInstant(rs.getTimestamp("first_seen_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getInt("aggregation_count")
            )
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        StoredCompanyRecord row = rows.get(0);
        List<StoredArtifact> artifacts = findArtifacts(row.id());
        return Optional.of(new StoredCompanyRecord(
            row.id(),
            row.fingerprint(),
            row.identityKey(),
            row.companyName(),
            row.registernummer(),
            row.ustIdnr(),
            row.record(),
            row.report(),
            artifacts,
            row.firstSeenAt(),
            row.updatedAt(),
            row.aggregationCount()
        ));
    }

    public List<StoredArtifact> findArtifacts(long companyRecordId) {
        return jdbc.query(
            """
                SELECT source, artifact_field, format, source_url, storage_path, sha256, size_bytes
                FROM company_artifacts
                WHERE company_record_id = :companyRecordId
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("companyRecordId", companyRecordId),
            (rs, rowNum) -> new StoredArtifact(
                SourceId.fromKey(rs.getString("source")),
                rs.getString("artifact_field") == null ? null : CanonicalField.fromKey(rs.getString("artifact_field")),
                DocumentFormat.valueOf(rs.getString("format")),
                rs.getString("source_url"),
                rs.getString("storage_path"),
                rs.getString("sha256"),
                rs.getLong("size_bytes")
            )
        );
    }

    public long countCompanyRecords(String fingerprint) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM company_records WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource().addValue("fingerprint", fingerprint),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public long insertAggregationRun(IdentityFingerprint fingerprint, CompanyIdentity identity, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", fingerprint.hash())
            .addValue("companyName", identity.companyName())
            .addValue("registernummer", identity.registernummer())
            .addValue("ustIdnr", identity.ustIdnr())
            .addValue("status", RUN_RUNNING)
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO aggregation_runs (
                    fingerprint,
                    company_name,
                    registernummer,
                    ust_idnr,
                    status,
                    started_at
                )
                VALUES (
                    :fingerprint,
                    :companyName,
                    :registernummer,
                    :ustIdnr,
                    :status,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public void completeAggregationRun(long runId, Instant finishedAt, String status, String reportJson, String storageError) {
        jdbc.update(
            """
                UPDATE aggregation_runs
                SET status = :status,
                    finished_at = :finishedAt,
                    report_json = COALESCE(CAST(:reportJson AS TEXT), report_json),
                    storage_error = :storageError
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("status", status)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("reportJson", reportJson)
                .addValue("storageError", storageError)
        );
    }

    public Optional<AggregationRunView> findAggregationRun(long runId) {
        List<AggregationRunView> rows = jdbc.query(
            "SELECT * FROM aggregation_runs WHERE id = :runId",
            new MapSqlParameterSource().addValue("runId", runId),
            runMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<AggregationRunView> findRunningAggregationRuns() {
        return jdbc.query(
            "SELECT * FROM aggregation_runs WHERE status = :status ORDER BY started_at",
            new MapSqlParameterSource().addValue("status", RUN_RUNNING),
            runMapper()
        );
    }

    private RowMapper<AggregationRunView> runMapper() {
        return (rs, rowNum) -> new AggregationRunView(
            rs.getLong("id"),
            rs.getString("fingerprint"),
            rs.getString("company_name"),
            rs.getString("registernummer"),
            rs.getString("ust_idnr"),
            rs.getString("status"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("storage_error"),
            readJson(rs.getString("report_json"))
        );
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored JSON could not be read: {}", e.getOriginalMessage());
            return null;
        }
    }

    private long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
