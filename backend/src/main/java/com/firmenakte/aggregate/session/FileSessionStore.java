package com.firmenakte.aggregate.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps one JSON file per stateful source. The files are produced by the out-of-band login step;
 * this store only reads them and records invalidation.
 */
@Component
public class FileSessionStore implements SessionStore {
    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileSessionStore(ObjectMapper objectMapper, AggregatorProperties properties) {
        this.objectMapper = objectMapper;
        this.directory = Path.of(properties.getSession().getDirectory());
    }

    @Override
    public Optional<SessionState> read(SourceId source) throws IOException {
        Path file = fileFor(source);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        StoredSession stored = objectMapper.readValue(file.toFile(), StoredSession.class);
        if (stored == null || stored.credentialBlob() == null || stored.credentialBlob().isBlank()) {
            return Optional.empty();
        }
        boolean valid = stored.valid() == null || stored.valid();
        return Optional.of(new SessionState(source, stored.credentialBlob(), stored.lastValidatedAt(), valid));
    }

    @Override
    public void write(SessionState state) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(state.source());
        Path temp = Files.createTempFile(directory, state.source().key(), ".tmp");
        objectMapper.writeValue(
            temp.toFile(),
            new StoredSession(state.credentialBlob(), state.lastValidatedAt(), state.valid())
        );
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path fileFor(SourceId source) {
        return directory.resolve(source.key() + ".json");
    }

    record StoredSession(
        @JsonProperty("credential_blob") String credentialBlob,
        @JsonProperty("last_validated_at") Instant lastValidatedAt,
        @JsonProperty("valid") Boolean valid
    ) {
    }
}
