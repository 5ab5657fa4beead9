package com.firmenakte.aggregate.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SourceReport(
    SourceStatus status,
    FailureKind failureKind,
    String detail,
    int attemptCount,
    long elapsedMs,
    List<AttemptRecord> attempts,
    List<String> fieldsContributed,
    Map<String, String> artifacts
) {
    public static SourceReport from(SourceResult result) {
        List<String> contributed = result.fields() == null
            ? List.of()
            : result.fields().values().keySet().stream().map(CanonicalField::key).toList();
        Map<String, String> artifacts = new LinkedHashMap<>();
        result.artifacts().forEach((field, ref) -> artifacts.put(field.key(), ref));
        return new SourceReport(
            result.status(),
            result.failureKind(),
            result.detail(),
            result.attemptCount(),
            result.elapsed().toMillis(),
            result.attempts(),
            contributed,
            artifacts
        );
    }
}
