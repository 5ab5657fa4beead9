package com.firmenakte.aggregate.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AggregationReport(
    Long runId,
    CompanyIdentity identity,
    String fingerprint,
    Instant startedAt,
    Instant finishedAt,
    Map<SourceId, SourceReport> sources,
    Map<String, SourceId> fieldSources,
    List<String> missingFields,
    List<FieldConflict> conflicts
) {
    public SourceStatus statusOf(SourceId source) {
        SourceReport report = sources.get(source);
        return report == null ? null : report.status();
    }

    public boolean allSourcesFailed() {
        return !sources.isEmpty()
            && sources.values().stream().allMatch(report -> report.status() == SourceStatus.FAILED);
    }

    public long countByStatus(SourceStatus status) {
        return sources.values().stream().filter(report -> report.status() == status).count();
    }
}
