package com.firmenakte.aggregate.model;

public record StoredArtifact(
    SourceId source,
    CanonicalField artifactField,
    DocumentFormat format,
    String sourceUrl,
    String storagePath,
    String sha256,
    long sizeBytes
) {
}
