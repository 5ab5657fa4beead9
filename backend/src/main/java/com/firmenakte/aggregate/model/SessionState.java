package com.firmenakte.aggregate.model;

import java.time.Instant;

public record SessionState(
    SourceId source,
    String credentialBlob,
    Instant lastValidatedAt,
    boolean valid
) {
    public SessionState invalidated() {
        return new SessionState(source, credentialBlob, lastValidatedAt, false);
    }

    public boolean usable() {
        return valid && credentialBlob != null && !credentialBlob.isBlank();
    }
}
