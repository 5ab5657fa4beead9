package com.firmenakte.aggregate.model;

import java.nio.charset.StandardCharsets;

public record RawDocument(
    DocumentFormat format,
    CanonicalField artifactField,
    String artifactRef,
    byte[] content,
    String contentType
) {
    public RawDocument {
        if (format == null) {
            throw new IllegalArgumentException("Document format is required");
        }
        if (artifactField != null && artifactField.group() != FieldGroup.ARTIFACT) {
            throw new IllegalArgumentException("Not an artifact field: " + artifactField.key());
        }
        content = content == null ? new byte[0] : content;
    }

    public static RawDocument html(CanonicalField artifactField, String artifactRef, String html) {
        byte[] bytes = html == null ? new byte[0] : html.getBytes(StandardCharsets.UTF_8);
        return new RawDocument(DocumentFormat.HTML, artifactField, artifactRef, bytes, "text/html");
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public boolean isEmpty() {
        return content.length == 0;
    }
}
