package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fields one source found for one run. Blank text is never stored, so a missing key always means
 * "not found"; {@code false} and empty lists are kept as confirmed values.
 */
public final class PartialFieldMap {
    private final SourceId source;
    private final Instant fetchedAt;
    private final Map<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);

    public PartialFieldMap(SourceId source, Instant fetchedAt) {
        this.source = source;
        this.fetchedAt = fetchedAt == null ? Instant.now() : fetchedAt;
    }

    public SourceId source() {
        return source;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    public PartialFieldMap put(CanonicalField field, Object value) {
        Object normalized = normalize(field, value);
        if (normalized != null) {
            values.put(field, normalized);
        }
        return this;
    }

    public PartialFieldMap putIfAbsent(CanonicalField field, Object value) {
        if (!values.containsKey(field)) {
            put(field, value);
        }
        return this;
    }

    /** Copies fields not yet present; earlier documents of the same source win. */
    public PartialFieldMap addMissing(PartialFieldMap other) {
        if (other == null) {
            return this;
        }
        for (Map.Entry<CanonicalField, Object> entry : other.values.entrySet()) {
            values.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public Optional<Object> get(CanonicalField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean contains(CanonicalField field) {
        return values.containsKey(field);
    }

    public Map<CanonicalField, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Object> toKeyedMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((field, value) -> out.put(field.key(), value));
        return out;
    }

    private static Integer exactInt(CanonicalField field, Number number) {
        try {
            if (number instanceof Integer integer) {
                return integer;
            }
            if (number instanceof Long || number instanceof Short || number instanceof Byte) {
                return Math.toIntExact(number.longValue());
            }
            return new BigDecimal(number.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(
                "Field " + field.key() + " expects a whole number in int range, got " + number, e
            );
        }
    }

    private static Object normalize(CanonicalField field, Object value) {
        if (field == null) {
            throw new IllegalArgumentException("Field is required");
        }
        if (value == null) {
            return null;
        }
        switch (field.type()) {
            case TEXT -> {
                if (!(value instanceof String text)) {
                    throw typeMismatch(field, value);
                }
                String trimmed = text.trim().replaceAll("\\s+", " ");
                return trimmed.isEmpty() ? null : trimmed;
            }
            case INTEGER -> {
                if (!(value instanceof Number number)) {
                    throw typeMismatch(field, value);
                }
                return exactInt(field, number);
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal decimal) {
                    return decimal;
                }
                if (!(value instanceof Number number)) {
                    throw typeMismatch(field, value);
                }
                return new BigDecimal(number.toString());
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    throw typeMismatch(field, value);
                }
                return value;
            }
            case TEXT_LIST -> {
                if (!(value instanceof List<?> list)) {
                    throw typeMismatch(field, value);
                }
                List<String> cleaned = new ArrayList<>();
                for (Object item : list) {
                    if (item == null) {
                        continue;
                    }
                    String text = item.toString().trim().replaceAll("\\s+", " ");
                    if (!text.isEmpty() && !cleaned.contains(text)) {
                        cleaned.add(text);
                    }
                }
                return List.copyOf(cleaned);
            }
            default -> throw typeMismatch(field, value);
        }
    }

    private static IllegalArgumentException typeMismatch(CanonicalField field, Object value) {
        return new IllegalArgumentException(
            "Field " + field.key() + " expects " + field.type() + " but got " + value.getClass().getSimpleName()
        );
    }
}
