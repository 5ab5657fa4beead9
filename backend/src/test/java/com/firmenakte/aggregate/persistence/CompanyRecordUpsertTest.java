package com.firmenakte.aggregate.persistence;

import com.firmenakte.aggregate.model.AggregationRunView;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredArtifact;
import com.firmenakte.aggregate.model.StoredCompanyRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CompanyRecordUpsertTest {

    @Autowired
    private CompanyRecordRepository repository;

    @Test
    void secondAggregationReplacesRecordInPlace() {
        String suffix = UUID.randomUUID().toString().substring(0, 6).toUpperCase();
        CompanyIdentity identity = new CompanyIdentity("Upsert Co " + suffix, "HRB" + suffix, null).normalized();
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        Instant first = Instant.parse("2026-03-01T10:00:00Z");

        long id = repository.upsertCompanyRecord(fingerprint, identity, "{\"fields\":{}}", "{}", first);
        long again = repository.upsertCompanyRecord(
            fingerprint,
            new CompanyIdentity(null, identity.registernummer(), "DE123456789"),
            "{\"fields\":{\"umsatz\":1}}",
            "{\"run_id\":2}",
            first.plusSeconds(60)
        );

        assertEquals(id, again);
        assertEquals(1L, repository.countCompanyRecords(fingerprint.hash()));
        StoredCompanyRecord stored = repository.findCompanyRecord(fingerprint.hash()).orElseThrow();
        assertEquals(2, stored.aggregationCount());
        assertEquals(identity.companyName(), stored.companyName());
        assertEquals("DE123456789", stored.ustIdnr());
        assertEquals(1, stored.record().path("fields").path("umsatz").asInt());
        assertEquals(first, stored.firstSeenAt());
        assertEquals(first.plusSeconds(60), stored.updatedAt());
    }

    @Test
    void artifactsAreReplacedOnEachStore() {
        String suffix = UUID.randomUUID().toString().substring(0, 6).toUpperCase();
        CompanyIdentity identity = new CompanyIdentity("Artifact Co " + suffix, null, null).normalized();
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        long id = repository.upsertCompanyRecord(fingerprint, identity, "{}", "{}", Instant.now());

        repository.replaceArtifacts(id, List.of(
            artifact(SourceId.NORTHDATA, CanonicalField.HTML_FILEPATH, DocumentFormat.HTML),
            artifact(SourceId.HANDELSREGISTER, CanonicalField.PDF_FILEPATH, DocumentFormat.PDF)
        ), Instant.now());
        repository.replaceArtifacts(id, List.of(
            artifact(SourceId.HANDELSREGISTER, CanonicalField.XML_FILEPATH, DocumentFormat.XML)
        ), Instant.now());

        List<StoredArtifact> artifacts = repository.findArtifacts(id);
        assertEquals(1, artifacts.size());
        assertEquals(CanonicalField.XML_FILEPATH, artifacts.get(0).artifactField());
        assertEquals(SourceId.HANDELSREGISTER, artifacts.get(0).source());
    }

    @Test
    void aggregationRunLifecycle() {
        CompanyIdentity identity = new CompanyIdentity("Run Co " + UUID.randomUUID(), null, null).normalized();
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        Instant startedAt = Instant.now().minusSeconds(30);

        long runId = repository.insertAggregationRun(fingerprint, identity, startedAt);
        assertTrue(repository.findRunningAggregationRuns().stream().anyMatch(run -> run.runId() == runId));

        repository.completeAggregationRun(runId, Instant.now(), CompanyRecordRepository.RUN_COMPLETED, "{\"sources\":{}}", null);

        AggregationRunView run = repository.findAggregationRun(runId).orElseThrow();
        assertEquals(CompanyRecordRepository.RUN_COMPLETED, run.status());
        assertEquals(fingerprint.hash(), run.fingerprint());
        assertNotNull(run.finishedAt());
        assertNotNull(run.report());
        assertNull(run.storageError());
        assertTrue(repository.findRunningAggregationRuns().stream().noneMatch(r -> r.runId() == runId));
    }

    @Test
    void completingWithoutReportKeepsEarlierReport() {
        CompanyIdentity identity = new CompanyIdentity("Abort Co " + UUID.randomUUID(), null, null).normalized();
        long runId = repository.insertAggregationRun(IdentityFingerprint.of(identity), identity, Instant.now());
        repository.completeAggregationRun(runId, Instant.now(), CompanyRecordRepository.RUN_ABORTED, null, "aborted_on_startup");

        AggregationRunView run = repository.findAggregationRun(runId).orElseThrow();
        assertEquals(CompanyRecordRepository.RUN_ABORTED, run.status());
        assertEquals("aborted_on_startup", run.storageError());
        assertNull(run.report());
    }

    private StoredArtifact artifact(SourceId source, CanonicalField field, DocumentFormat format) {
        return new StoredArtifact(source, field, format, "https://example.com/" + field.key(), "/tmp/" + field.key(), "ab", 2L);
    }
}
