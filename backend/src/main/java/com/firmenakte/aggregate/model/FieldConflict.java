package com.firmenakte.aggregate.model;

public record FieldConflict(
    CanonicalField field,
    SourceId keptSource,
    Object keptValue,
    SourceId discardedSource,
    Object discardedValue,
    String reason
) {
    public static final String LOWER_PRIORITY = "LOWER_PRIORITY";
    public static final String OLDER_AT_EQUAL_PRIORITY = "OLDER_AT_EQUAL_PRIORITY";
    public static final String SOURCE_ORDER_AT_EQUAL_PRIORITY = "SOURCE_ORDER_AT_EQUAL_PRIORITY";
}
