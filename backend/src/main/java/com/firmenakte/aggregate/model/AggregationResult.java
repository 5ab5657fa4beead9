package com.firmenakte.aggregate.model;

public record AggregationResult(
    CanonicalCompanyRecord record,
    AggregationReport report,
    boolean persisted,
    String storageError
) {
}
