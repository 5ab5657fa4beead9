package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.config.AggregatorProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-source retry settings. Whether a failure is retried depends on its kind alone.
 * An expired session, a missing record and an invalid identity are final no matter what
 * {@code retryable-kinds} lists.
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffPolicy backoff,
    Set<FailureKind> retryableKinds
) {
    private static final Set<FailureKind> NEVER_RETRIED = Collections.unmodifiableSet(
        EnumSet.of(FailureKind.AUTH_EXPIRED, FailureKind.RECORD_NOT_FOUND, FailureKind.INVALID_IDENTITY)
    );

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoff = backoff == null ? BackoffPolicy.none() : backoff;
        Set<FailureKind> kinds = EnumSet.noneOf(FailureKind.class);
        if (retryableKinds != null) {
            kinds.addAll(retryableKinds);
        }
        kinds.removeAll(NEVER_RETRIED);
        retryableKinds = Set.copyOf(kinds);
    }

    public static RetryPolicy from(AggregatorProperties.Source source) {
        return new RetryPolicy(
            source.getMaxAttempts(),
            new BackoffPolicy(
                BackoffPolicy.parseKind(source.getBackoff()),
                Duration.ofMillis(source.getBaseDelayMs()),
                Duration.ofMillis(source.getMaxDelayMs()),
                source.isJitter()
            ),
            source.getRetryableKinds()
        );
    }

    public static RetryPolicy defaults(int maxAttempts, BackoffPolicy backoff) {
        Set<FailureKind> kinds = EnumSet.noneOf(FailureKind.class);
        for (FailureKind kind : FailureKind.values()) {
            if (kind.isRetryableByDefault()) {
                kinds.add(kind);
            }
        }
        return new RetryPolicy(maxAttempts, backoff, kinds);
    }

    public boolean isRetryable(FailureKind kind) {
        return kind != null && !NEVER_RETRIED.contains(kind) && retryableKinds.contains(kind);
    }
}
