package com.firmenakte.aggregate.service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

public record BackoffPolicy(
    Kind kind,
    Duration baseDelay,
    Duration maxDelay,
    boolean jitter
) {
    public enum Kind {
        FIXED,
        EXPONENTIAL
    }

    public BackoffPolicy {
        kind = kind == null ? Kind.EXPONENTIAL : kind;
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
    }

    public static BackoffPolicy none() {
        return new BackoffPolicy(Kind.FIXED, Duration.ZERO, Duration.ZERO, false);
    }

    public static Kind parseKind(String raw) {
        if (raw == null || raw.isBlank()) {
            return Kind.EXPONENTIAL;
        }
        return "fixed".equals(raw.trim().toLowerCase(Locale.ROOT)) ? Kind.FIXED : Kind.EXPONENTIAL;
    }

    /** Delay to wait after {@code failedAttempts} consecutive failures (1 for the first retry). */
    public Duration delayAfter(int failedAttempts) {
        if (baseDelay.isZero()) {
            return Duration.ZERO;
        }
        long delayMs = baseDelay.toMillis();
        if (kind == Kind.EXPONENTIAL) {
            int shift = Math.min(Math.max(0, failedAttempts - 1), 20);
            delayMs = delayMs * (1L << shift);
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        if (jitter && delayMs > 1) {
            delayMs = ThreadLocalRandom.current().nextLong(delayMs / 2, delayMs + 1);
        }
        return Duration.ofMillis(delayMs);
    }
}
