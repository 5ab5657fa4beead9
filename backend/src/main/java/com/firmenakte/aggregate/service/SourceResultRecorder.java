package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.AttemptRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.SourceResult;
import com.firmenakte.aggregate.model.SourceStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects attempts for one source and produces its result exactly once. The pipeline thread and the
 * orchestrator (on deadline) may race to finish; the first one wins and later calls return the
 * existing result.
 */
public final class SourceResultRecorder {
    private final SourceId source;
    private final Instant startedAt;
    private final List<AttemptRecord> attempts = new CopyOnWriteArrayList<>();
    private final AtomicReference<SourceResult> result = new AtomicReference<>();

    public SourceResultRecorder(SourceId source) {
        this.source = source;
        this.startedAt = Instant.now();
    }

    public SourceId source() {
        return source;
    }

    public void recordAttempt(AttemptRecord attempt) {
        if (result.get() == null) {
            attempts.add(attempt);
        }
    }

    public SourceResult succeed(
        SourceStatus status,
        PartialFieldMap fields,
        Map<CanonicalField, String> artifacts,
        List<RawDocument> rawDocuments,
        String detail
    ) {
        return complete(new SourceResult(
            source,
            status,
            fields,
            artifacts,
            rawDocuments,
            List.copyOf(attempts),
            elapsed(),
            null,
            detail
        ));
    }

    public SourceResult fail(FailureKind kind, String detail) {
        return complete(new SourceResult(
            source,
            SourceStatus.FAILED,
            null,
            Map.of(),
            List.of(),
            List.copyOf(attempts),
            elapsed(),
            kind,
            detail
        ));
    }

    public SourceResult skip(String detail) {
        return complete(new SourceResult(
            source,
            SourceStatus.SKIPPED,
            null,
            Map.of(),
            List.of(),
            List.of(),
            elapsed(),
            null,
            detail
        ));
    }

    public boolean isFinished() {
        return result.get() != null;
    }

    public SourceResult result() {
        return result.get();
    }

    public int attemptCount() {
        return attempts.size();
    }

    private SourceResult complete(SourceResult candidate) {
        result.compareAndSet(null, candidate);
        return result.get();
    }

    private Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
