package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record StoredCompanyRecord(
    long id,
    String fingerprint,
    String identityKey,
    String companyName,
    String registernummer,
    String ustIdnr,
    JsonNode record,
    JsonNode report,
    List<StoredArtifact> artifacts,
    Instant firstSeenAt,
    Instant updatedAt,
    int aggregationCount
) {
}
