package com.firmenakte.aggregate.persistence;

import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredArtifact;
import com.firmenakte.aggregate.util.HashUtils;
import com.firmenakte.config.AggregatorProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw source documents on disk, one directory per company fingerprint. File names depend only on
 * source and artifact field, so a re-run overwrites the previous download.
 */
@Component
public class FileArtifactStore {
    private final Path root;

    public FileArtifactStore(AggregatorProperties properties) {
        this.root = Path.of(properties.getArtifacts().getDirectory());
    }

    public List<StoredArtifact> store(IdentityFingerprint fingerprint, Map<SourceId, List<RawDocument>> documents) throws IOException {
        List<StoredArtifact> stored = new ArrayList<>();
        if (documents == null || documents.isEmpty()) {
            return stored;
        }
        Path directory = root.resolve(fingerprint.hash());
        Files.createDirectories(directory);
        for (Map.Entry<SourceId, List<RawDocument>> entry : documents.entrySet()) {
            int index = 0;
            for (RawDocument document : entry.getValue()) {
                index++;
                String name = entry.getKey().key() + "_"
                    + (document.artifactField() == null ? "document" + index : document.artifactField().key())
                    + extension(document.format());
                Path target = directory.resolve(name);
                Path temp = Files.createTempFile(directory, entry.getKey().key(), ".tmp");
                Files.write(temp, document.content());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                stored.add(new StoredArtifact(
                    entry.getKey(),
                    document.artifactField(),
                    document.format(),
                    document.artifactRef(),
                    target.toAbsolutePath().toString(),
                    HashUtils.sha256Hex(document.content()),
                    document.content().length
                ));
            }
        }
        return stored;
    }

    private String extension(DocumentFormat format) {
        return switch (format) {
            case HTML -> ".html";
            case PDF -> ".pdf";
            case XML -> ".xml";
        };
    }
}
