package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record AggregationRunView(
    long runId,
    String fingerprint,
    String companyName,
    String registernummer,
    String ustIdnr,
    String status,
    Instant startedAt,
    Instant finishedAt,
    String storageError,
    JsonNode report
) {
}
