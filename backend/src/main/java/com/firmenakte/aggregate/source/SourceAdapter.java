package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;

public interface SourceAdapter {
    SourceId source();

    /** Sources behind a login get the current session passed to {@link #fetch}. */
    boolean requiresSession();

    /** Whether the identity carries enough for this source to search with. */
    boolean supports(CompanyIdentity identity);

    /**
     * One fetch attempt. Never retries; {@code session} is null for sources that do not require one.
     */
    RawPayload fetch(CompanyIdentity identity, SessionState session) throws SourceFetchException;
}
