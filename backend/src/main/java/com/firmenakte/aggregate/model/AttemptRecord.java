package com.firmenakte.aggregate.model;

import java.time.Duration;
import java.time.Instant;

public record AttemptRecord(
    int attempt,
    Instant startedAt,
    Duration duration,
    String outcome,
    FailureKind failureKind,
    String detail
) {
    public static final String OUTCOME_SUCCESS = "SUCCESS";
    public static final String OUTCOME_PARTIAL = "PARTIAL";
    public static final String OUTCOME_FAILED = "FAILED";

    public boolean failed() {
        return failureKind != null;
    }
}
