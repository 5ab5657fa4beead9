package com.firmenakte.aggregate.session;

import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Process-wide session state for sources that need a login. The manager detects and reports expiry;
 * it never re-authenticates. Only {@link #markInvalid} and the external {@link #refresh} mutate state.
 */
@Service
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore store;
    private final Map<SourceId, SessionState> sessions = new ConcurrentHashMap<>();
    private final Set<SourceId> loaded = ConcurrentHashMap.newKeySet();

    public SessionManager(SessionStore store) {
        this.store = store;
    }

    public Optional<SessionState> load(SourceId source) {
        ensureLoaded(source);
        return Optional.ofNullable(sessions.get(source));
    }

    public boolean isValid(SourceId source) {
        return load(source).map(SessionState::usable).orElse(false);
    }

    /**
     * Returns true when this call flipped a valid session to invalid. Concurrent runs that detect the
     * same expiry see exactly one transition.
     */
    public boolean markInvalid(SourceId source) {
        return invalidate(source, current -> true);
    }

    /**
     * Invalidates the session only while it still holds the credential the caller used. A rejection
     * observed with a credential that has since been refreshed leaves the new session valid.
     */
    public boolean markInvalid(SessionState observed) {
        return invalidate(
            observed.source(),
            current -> Objects.equals(current.credentialBlob(), observed.credentialBlob())
                && Objects.equals(current.lastValidatedAt(), observed.lastValidatedAt())
        );
    }

    private boolean invalidate(SourceId source, Predicate<SessionState> stillCurrent) {
        ensureLoaded(source);
        AtomicBoolean transitioned = new AtomicBoolean(false);
        SessionState updated = sessions.computeIfPresent(source, (key, current) -> {
            if (!current.valid() || !stillCurrent.test(current)) {
                return current;
            }
            transitioned.set(true);
            return current.invalidated();
        });
        if (transitioned.get()) {
            log.warn("Session for {} marked invalid; re-authentication required", source.key());
            persist(updated);
        } else if (updated != null && updated.valid()) {
            log.debug("Session for {} was refreshed since the rejected request, keeping it", source.key());
        }
        return transitioned.get();
    }

    public SessionState refresh(SourceId source, String credentialBlob) {
        if (credentialBlob == null || credentialBlob.isBlank()) {
            throw new IllegalArgumentException("Credential blob must not be blank");
        }
        SessionState state = new SessionState(source, credentialBlob.trim(), Instant.now(), true);
        loaded.add(source);
        sessions.put(source, state);
        log.info("Session for {} refreshed", source.key());
        persist(state);
        return state;
    }

    private void ensureLoaded(SourceId source) {
        if (loaded.contains(source)) {
            return;
        }
        synchronized (this) {
            if (loaded.contains(source)) {
                return;
            }
            try {
                store.read(source).ifPresent(state -> sessions.putIfAbsent(source, state));
            } catch (IOException e) {
                log.warn("Unable to read stored session for {}", source.key(), e);
            }
            loaded.add(source);
        }
    }

    private void persist(SessionState state) {
        if (state == null) {
            return;
        }
        try {
            store.write(state);
        } catch (IOException e) {
            log.warn("Unable to persist session state for {}", state.source().key(), e);
        }
    }
}
