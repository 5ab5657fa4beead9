package com.firmenakte.aggregate.session;

import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;

import java.io.IOException;
import java.util.Optional;

public interface SessionStore {
    Optional<SessionState> read(SourceId source) throws IOException;

    void write(SessionState state) throws IOException;
}
