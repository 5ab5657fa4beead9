package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceId {
    HANDELSREGISTER("handelsregister"),
    NORTHDATA("northdata"),
    LINKEDIN("linkedin"),
    UNTERNEHMENSREGISTER("unternehmensregister");

    private final String key;

    SourceId(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SourceId fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source key must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SourceId source : values()) {
            if (source.key.equals(normalized) || source.name().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + value);
    }
}
