package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.model.FailureKind;

/**
 * The only failure an adapter reports. Site- and transport-specific errors are classified into a
 * {@link FailureKind} before they leave the adapter.
 */
public class SourceFetchException extends Exception {
    private final FailureKind kind;

    public SourceFetchException(FailureKind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    public SourceFetchException(FailureKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
