package com.firmenakte.aggregate.model;

public enum FailureKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    TRANSIENT_NETWORK(true),
    AUTH_EXPIRED(false),
    RECORD_NOT_FOUND(false),
    MALFORMED_RESPONSE(false),
    INVALID_IDENTITY(false);

    private final boolean retryableByDefault;

    FailureKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
