package com.firmenakte.aggregate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.AggregationReport;
import com.firmenakte.aggregate.model.AggregationResult;
import com.firmenakte.aggregate.model.AggregationRunView;
import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.SourceReport;
import com.firmenakte.aggregate.model.SourceResult;
import com.firmenakte.aggregate.model.SourceStatus;
import com.firmenakte.aggregate.persistence.CompanyRecordRepository;
import com.firmenakte.aggregate.persistence.IdentityFingerprint;
import com.firmenakte.aggregate.persistence.PersistenceSink;
import com.firmenakte.aggregate.persistence.StorageException;
import com.firmenakte.aggregate.source.SourceAdapter;
import com.firmenakte.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one aggregation: fans out a pipeline per source, waits for each up to its deadline, merges the
 * partial maps and hands the record to the persistence sink. Source failures end up in the report;
 * only an unusable identity is raised to the caller.
 */
@Service
public class CompanyAggregationService {
    private static final Logger log = LoggerFactory.getLogger(CompanyAggregationService.class);

    private final List<SourceAdapter> adapters;
    private final SourcePipelineRunner pipelineRunner;
    private final FieldMerger fieldMerger;
    private final CompanyDirectory companyDirectory;
    private final PersistenceSink persistenceSink;
    private final CompanyRecordRepository repository;
    private final AggregatorProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService sourceExecutor;
    private final ExecutorService aggregationRunExecutor;

    public CompanyAggregationService(
        List<SourceAdapter> adapters,
        SourcePipelineRunner pipelineRunner,
        FieldMerger fieldMerger,
        CompanyDirectory companyDirectory,
        PersistenceSink persistenceSink,
        CompanyRecordRepository repository,
        AggregatorProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        @Qualifier("aggregationRunExecutor") ExecutorService aggregationRunExecutor
    ) {
        this.adapters = adapters.stream().sorted(Comparator.comparing(SourceAdapter::source)).toList();
        this.pipelineRunner = pipelineRunner;
        this.fieldMerger = fieldMerger;
        this.companyDirectory = companyDirectory;
        this.persistenceSink = persistenceSink;
        this.repository = repository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sourceExecutor = sourceExecutor;
        this.aggregationRunExecutor = aggregationRunExecutor;
    }

    public AggregationResult aggregate(CompanyIdentity requested) {
        CompanyIdentity identity = accept(requested);
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        Instant startedAt = Instant.now();
        Long runId = null;
        try {
            runId = repository.insertAggregationRun(fingerprint, identity, startedAt);
        } catch (DataAccessException e) {
            log.warn("Unable to record aggregation run for {}", identity.displayName(), e);
        }
        return execute(identity, fingerprint, runId, startedAt);
    }

    /** Queues the aggregation and returns its run id immediately; poll {@link #findRun} for the report. */
    public long startAsync(CompanyIdentity requested) {
        CompanyIdentity identity = accept(requested);
        IdentityFingerprint fingerprint = IdentityFingerprint.of(identity);
        Instant startedAt = Instant.now();
        long runId = repository.insertAggregationRun(fingerprint, identity, startedAt);
        aggregationRunExecutor.submit(() -> {
            try {
                execute(identity, fingerprint, runId, startedAt);
            } catch (Exception e) {
                log.warn("Aggregation run {} failed", runId, e);
                repository.completeAggregationRun(runId, Instant.now(), CompanyRecordRepository.RUN_FAILED, null, e.getMessage());
            }
        });
        return runId;
    }

    public Optional<AggregationRunView> findRun(long runId) {
        return repository.findAggregationRun(runId);
    }

    CompanyIdentity accept(CompanyIdentity requested) {
        if (requested == null || !requested.hasIdentifyingField()) {
            throw new InvalidIdentityException(
                "At least one of company_name, registernummer or ust_idnr is required (" + FailureKind.INVALID_IDENTITY + ")"
            );
        }
        CompanyIdentity identity = requested.normalized();
        if (!identity.hasUstIdnr()) {
            Optional<String> ust = companyDirectory.findUstIdnr(identity);
            if (ust.isPresent()) {
                identity = identity.withUstIdnr(ust.get());
            }
        }
        return identity;
    }

    private AggregationResult execute(CompanyIdentity identity, IdentityFingerprint fingerprint, Long runId, Instant startedAt) {
        long startNanos = System.nanoTime();
        long globalDeadline = startNanos + TimeUnit.SECONDS.toNanos(properties.getRun().getDeadlineSeconds());
        log.info("Aggregation {} started for {} ({})", runId, identity.displayName(), fingerprint.key());

        Map<SourceId, PendingSource> pending = new EnumMap<>(SourceId.class);
        for (SourceAdapter adapter : adapters) {
            SourceId source = adapter.source();
            AggregatorProperties.Source settings = properties.source(source);
            SourceResultRecorder recorder = new SourceResultRecorder(source);
            if (!settings.isEnabled()) {
                recorder.skip("source disabled");
                pending.put(source, new PendingSource(recorder, null, 0L));
                continue;
            }
            if (!adapter.supports(identity)) {
                recorder.skip("identity has no field this source can search by");
                pending.put(source, new PendingSource(recorder, null, 0L));
                continue;
            }
            RetryPolicy policy = RetryPolicy.from(settings);
            Future<SourceResult> future = sourceExecutor.submit(() -> pipelineRunner.run(identity, adapter, policy, recorder));
            long deadline = Math.min(globalDeadline, startNanos + TimeUnit.SECONDS.toNanos(settings.getTimeoutSeconds()));
            pending.put(source, new PendingSource(recorder, future, deadline));
        }

        Map<SourceId, SourceResult> results = new EnumMap<>(SourceId.class);
        for (Map.Entry<SourceId, PendingSource> entry : pending.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
        }

        List<PartialFieldMap> partials = new ArrayList<>();
        Map<SourceId, List<RawDocument>> rawArtifacts = new EnumMap<>(SourceId.class);
        for (SourceResult result : results.values()) {
            if (result.contributed()) {
                partials.add(result.fields());
            }
            if (!result.rawDocuments().isEmpty()) {
                rawArtifacts.put(result.source(), result.rawDocuments());
            }
        }
        FieldMerger.MergeOutcome merged = fieldMerger.merge(partials, MergePolicy.from(properties.getMerge()), Instant.now());
        CanonicalCompanyRecord record = merged.record();
        Instant finishedAt = Instant.now();
        AggregationReport report = buildReport(runId, identity, fingerprint, startedAt, finishedAt, results, merged);

        boolean persisted = false;
        String storageError = null;
        try {
            persistenceSink.persist(identity, record, report, rawArtifacts);
            persisted = true;
        } catch (StorageException e) {
            log.warn("Aggregation {} for {} could not be stored: {}", runId, identity.displayName(), e.getMessage(), e);
            storageError = e.getMessage();
        }

        if (runId != null) {
            completeRun(runId, finishedAt, report, storageError);
        }
        log.info(
            "Aggregation {} for {} finished: fields={}, success={}, partial={}, failed={}, skipped={}, conflicts={}, persisted={}",
            runId,
            identity.displayName(),
            record.fields().size(),
            report.countByStatus(SourceStatus.SUCCESS),
            report.countByStatus(SourceStatus.PARTIAL_SUCCESS),
            report.countByStatus(SourceStatus.FAILED),
            report.countByStatus(SourceStatus.SKIPPED),
            report.conflicts().size(),
            persisted
        );
        return new AggregationResult(record, report, persisted, storageError);
    }

    private SourceResult await(SourceId source, PendingSource pending) {
        if (pending.future() == null) {
            return pending.recorder().result();
        }
        long remaining = pending.deadlineNanos() - System.nanoTime();
        try {
            return pending.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            SourceResult result = pending.recorder().fail(FailureKind.TIMEOUT, "deadline exceeded");
            pending.future().cancel(true);
            if (result.failureKind() == FailureKind.TIMEOUT) {
                log.warn("{} did not finish before its deadline after {} attempts", source.key(), result.attemptCount());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.future().cancel(true);
            return pending.recorder().fail(FailureKind.TIMEOUT, "aggregation interrupted");
        } catch (CancellationException e) {
            return pending.recorder().fail(FailureKind.TIMEOUT, "pipeline cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("{} pipeline failed unexpectedly", source.key(), cause);
            return pending.recorder().fail(FailureKind.TRANSIENT_NETWORK, "pipeline error: " + cause);
        }
    }

    private AggregationReport buildReport(
        Long runId,
        CompanyIdentity identity,
        IdentityFingerprint fingerprint,
        Instant startedAt,
        Instant finishedAt,
        Map<SourceId, SourceResult> results,
        FieldMerger.MergeOutcome merged
    ) {
        Map<SourceId, SourceReport> sources = new LinkedHashMap<>();
        results.forEach((source, result) -> sources.put(source, SourceReport.from(result)));

        Map<String, SourceId> fieldSources = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            merged.record().field(field).ifPresentOrElse(
                value -> fieldSources.put(field.key(), value.source()),
                () -> missing.add(field.key())
            );
        }
        return new AggregationReport(
            runId,
            identity,
            fingerprint.hash(),
            startedAt,
            finishedAt,
            sources,
            fieldSources,
            missing,
            merged.conflicts()
        );
    }

    private void completeRun(long runId, Instant finishedAt, AggregationReport report, String storageError) {
        try {
            repository.completeAggregationRun(
                runId,
                finishedAt,
                CompanyRecordRepository.RUN_COMPLETED,
                objectMapper.writeValueAsString(report),
                storageError
            );
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Unable to complete aggregation run {}", runId, e);
        }
    }

    private record PendingSource(SourceResultRecorder recorder, Future<SourceResult> future, long deadlineNanos) {
    }
}
