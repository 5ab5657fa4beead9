package com.firmenakte.aggregate.model;

import java.time.Instant;
import java.util.List;

/**
 * Documents fetched for one company in one attempt. {@code failures} describes documents the source
 * listed but could not deliver; a non-empty list makes the attempt a partial success.
 */
public record RawPayload(
    SourceId source,
    List<RawDocument> documents,
    Instant fetchedAt,
    List<String> failures
) {
    public RawPayload {
        documents = documents == null ? List.of() : List.copyOf(documents);
        fetchedAt = fetchedAt == null ? Instant.now() : fetchedAt;
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public RawPayload(SourceId source, List<RawDocument> documents, Instant fetchedAt) {
        this(source, documents, fetchedAt, List.of());
    }
}
