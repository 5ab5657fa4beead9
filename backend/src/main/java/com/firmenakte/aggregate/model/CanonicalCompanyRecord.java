package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class CanonicalCompanyRecord {
    private final Map<CanonicalField, FieldValue> fields;
    private final Instant aggregatedAt;
    private final List<SourceId> dataSources;

    public CanonicalCompanyRecord(Map<CanonicalField, FieldValue> fields, Instant aggregatedAt, List<SourceId> dataSources) {
        EnumMap<CanonicalField, FieldValue> copy = new EnumMap<>(CanonicalField.class);
        if (fields != null) {
            copy.putAll(fields);
        }
        this.fields = Collections.unmodifiableMap(copy);
        this.aggregatedAt = aggregatedAt == null ? Instant.now() : aggregatedAt;
        this.dataSources = dataSources == null ? List.of() : List.copyOf(dataSources);
    }

    public Optional<Object> value(CanonicalField field) {
        FieldValue fieldValue = fields.get(field);
        return fieldValue == null ? Optional.empty() : Optional.ofNullable(fieldValue.value());
    }

    public Optional<FieldValue> field(CanonicalField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(CanonicalField field) {
        return fields.containsKey(field);
    }

    public Map<CanonicalField, FieldValue> fields() {
        return fields;
    }

    @JsonProperty("aggregated_at")
    public Instant aggregatedAt() {
        return aggregatedAt;
    }

    @JsonProperty("data_sources")
    public List<SourceId> dataSources() {
        return dataSources;
    }

    @JsonProperty("fields")
    public Map<String, Object> toValueMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        fields.forEach((field, value) -> out.put(field.key(), value.value()));
        return out;
    }

    @JsonProperty("provenance")
    public Map<String, Map<String, Object>> provenance() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        fields.forEach((field, value) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", value.source() == null ? null : value.source().key());
            entry.put("fetched_at", value.fetchedAt());
            out.put(field.key(), entry);
        });
        return out;
    }
}
