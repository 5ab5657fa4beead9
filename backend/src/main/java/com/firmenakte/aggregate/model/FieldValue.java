package com.firmenakte.aggregate.model;

import java.time.Instant;

public record FieldValue(
    Object value,
    SourceId source,
    Instant fetchedAt
) {
}
