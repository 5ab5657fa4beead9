package com.firmenakte.aggregate.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.AggregationReport;
import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredArtifact;
import com.firmenakte.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class JdbcPersistenceSink implements PersistenceSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcPersistenceSink.class);

    private final CompanyRecordRepository repository;
    private final FileArtifactStore artifactStore;
    private final AggregatorProperties properties;
    private final ObjectMapper objectMapper;

    public JdbcPersistenceSink(
        CompanyRecordRepository repository,
        FileArtifactStore artifactStore,
        AggregatorProperties properties,
        ObjectMapper objectMapper
    ) {
        this.repository = repository;
        this.artifactStore = artifactStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void persist(
        CompanyIdentity identity,
        CanonicalCompanyRecord record,
        AggregationReport report,
        Map<SourceId, List<RawDocument>> rawArtifacts
    ) throws StorageException {
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        Instant now = Instant.now();
        try {
            String recordJson = objectMapper.writeValueAsString(record);
            String reportJson = objectMapper.writeValueAsString(report);
            List<StoredArtifact> artifacts = properties.getArtifacts().isEnabled()
                ? artifactStore.store(fingerprint, rawArtifacts)
                : List.of();
            long recordId = repository.upsertCompanyRecord(fingerprint, identity, recordJson, reportJson, now);
            repository.replaceArtifacts(recordId, artifacts, now);
            log.info(
                "Stored company record {} ({}) with {} fields and {} artifacts",
                fingerprint.key(),
                recordId,
                record.fields().size(),
                artifacts.size()
            );
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to serialize record for " + fingerprint.key(), e);
        } catch (IOException e) {
            throw new StorageException("Unable to write artifacts for " + fingerprint.key(), e);
        } catch (DataAccessException e) {
            throw new StorageException("Unable to store record for " + fingerprint.key(), e);
        }
    }
}
