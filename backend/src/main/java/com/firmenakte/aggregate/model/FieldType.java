package com.firmenakte.aggregate.model;

import java.math.BigDecimal;
import java.util.List;

public enum FieldType {
    TEXT(String.class),
    INTEGER(Integer.class),
    DECIMAL(BigDecimal.class),
    BOOLEAN(Boolean.class),
    TEXT_LIST(List.class);

    private final Class<?> javaType;

    FieldType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public boolean accepts(Object value) {
        return value != null && javaType.isInstance(value);
    }

    public Class<?> javaType() {
        return javaType;
    }
}
