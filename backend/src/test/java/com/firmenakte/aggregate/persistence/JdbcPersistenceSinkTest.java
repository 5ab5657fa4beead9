package com.firmenakte.aggregate.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.AggregationReport;
import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.FieldValue;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredArtifact;
import com.firmenakte.config.AggregatorConfig;
import com.firmenakte.config.AggregatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcPersistenceSinkTest {
    private static final CompanyIdentity MAGNA = new CompanyIdentity("MAGNA Powertrain GmbH", "HRB12345", null);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new AggregatorConfig().objectMapper();
    private CompanyRecordRepository repository;
    private AggregatorProperties properties;
    private JdbcPersistenceSink sink;

    @BeforeEach
    void setUp() {
        repository = mock(CompanyRecordRepository.class);
        properties = new AggregatorProperties();
        properties.getArtifacts().setDirectory(tempDir.toString());
        sink = new JdbcPersistenceSink(repository, new FileArtifactStore(properties), properties, objectMapper);
    }

    @Test
    @SuppressWarnings("unchecked")
    void writesArtifactsThenRecord() throws Exception {
        when(repository.upsertCompanyRecord(any(), any(), anyString(), anyString(), any())).thenReturn(42L);
        Map<SourceId, List<RawDocument>> documents = new LinkedHashMap<>();
        documents.put(SourceId.HANDELSREGISTER, List.of(
            new RawDocument(DocumentFormat.XML, CanonicalField.XML_FILEPATH, "https://hr/si", "<xjustiz/>".getBytes(StandardCharsets.UTF_8), "application/xml"),
            new RawDocument(DocumentFormat.PDF, CanonicalField.PDF_FILEPATH, "https://hr/ad", new byte[] {'%', 'P', 'D', 'F'}, "application/pdf")
        ));

        sink.persist(MAGNA, record(), report(), documents);

        ArgumentCaptor<String> recordJson = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> reportJson = ArgumentCaptor.forClass(String.class);
        verify(repository).upsertCompanyRecord(
            eq(IdentityFingerprint.of(MAGNA)),
            eq(MAGNA),
            recordJson.capture(),
            reportJson.capture(),
            any(Instant.class)
        );
        JsonNode stored = objectMapper.readTree(recordJson.getValue());
        assertThat(stored.path("fields").path("gerichtsstand").asText()).isEqualTo("Berlin (Charlottenburg)");
        assertThat(stored.path("provenance").path("gerichtsstand").path("source").asText()).isEqualTo("handelsregister");
        assertThat(stored.path("data_sources").get(0).asText()).isEqualTo("handelsregister");
        assertThat(objectMapper.readTree(reportJson.getValue()).path("fingerprint").asText())
            .isEqualTo(IdentityFingerprint.of(MAGNA).hash());

        ArgumentCaptor<List<StoredArtifact>> artifacts = ArgumentCaptor.forClass(List.class);
        verify(repository).replaceArtifacts(eq(42L), artifacts.capture(), any(Instant.class));
        assertThat(artifacts.getValue()).extracting(StoredArtifact::artifactField)
            .containsExactly(CanonicalField.XML_FILEPATH, CanonicalField.PDF_FILEPATH);
        Path xml = Path.of(artifacts.getValue().get(0).storagePath());
        assertThat(xml.getFileName().toString()).isEqualTo("handelsregister_xml_filepath.xml");
        assertThat(Files.readString(xml)).isEqualTo("<xjustiz/>");
        assertThat(xml.getParent().getFileName().toString()).isEqualTo(IdentityFingerprint.of(MAGNA).hash());
    }

    @Test
    void skipsFilesWhenArtifactsDisabled() throws Exception {
        properties.getArtifacts().setEnabled(false);
        when(repository.upsertCompanyRecord(any(), any(), anyString(), anyString(), any())).thenReturn(7L);

        sink.persist(MAGNA, record(), report(), Map.of(
            SourceId.NORTHDATA,
            List.of(RawDocument.html(CanonicalField.HTML_FILEPATH, "https://nd/magna", "<html></html>"))
        ));

        verify(repository).replaceArtifacts(eq(7L), eq(List.of()), any(Instant.class));
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void databaseFailureBecomesStorageException() {
        when(repository.upsertCompanyRecord(any(), any(), anyString(), anyString(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> sink.persist(MAGNA, record(), report(), Map.of()))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("reg:HRB12345")
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verify(repository, never()).replaceArtifacts(anyLong(), any(), any());
    }

    private CanonicalCompanyRecord record() {
        Instant fetchedAt = Instant.parse("2026-03-01T10:00:00Z");
        Map<CanonicalField, FieldValue> fields = new LinkedHashMap<>();
        fields.put(CanonicalField.GERICHTSSTAND, new FieldValue("Berlin (Charlottenburg)", SourceId.HANDELSREGISTER, fetchedAt));
        fields.put(CanonicalField.WEBSITE, new FieldValue("https://www.magna.com", SourceId.LINKEDIN, fetchedAt));
        return new CanonicalCompanyRecord(fields, fetchedAt, List.of(SourceId.HANDELSREGISTER, SourceId.LINKEDIN));
    }

    private AggregationReport report() {
        Instant now = Instant.parse("2026-03-01T10:00:05Z");
        return new AggregationReport(
            1L,
            MAGNA,
            IdentityFingerprint.of(MAGNA).hash(),
            now.minusSeconds(5),
            now,
            Map.of(),
            Map.of(CanonicalField.GERICHTSSTAND.key(), SourceId.HANDELSREGISTER),
            List.of(),
            List.of()
        );
    }
}
