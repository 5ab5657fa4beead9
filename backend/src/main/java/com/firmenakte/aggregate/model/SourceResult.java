package com.firmenakte.aggregate.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record SourceResult(
    SourceId source,
    SourceStatus status,
    PartialFieldMap fields,
    Map<CanonicalField, String> artifacts,
    List<RawDocument> rawDocuments,
    List<AttemptRecord> attempts,
    Duration elapsed,
    FailureKind failureKind,
    String detail
) {
    public SourceResult {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
        rawDocuments = rawDocuments == null ? List.of() : List.copyOf(rawDocuments);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public boolean contributed() {
        return (status == SourceStatus.SUCCESS || status == SourceStatus.PARTIAL_SUCCESS)
            && fields != null
            && !fields.isEmpty();
    }

    public int attemptCount() {
        return attempts.size();
    }
}
