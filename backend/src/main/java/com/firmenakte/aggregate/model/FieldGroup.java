package com.firmenakte.aggregate.model;

import java.util.Locale;

public enum FieldGroup {
    REGISTRY,
    FINANCIAL,
    REAL_ESTATE,
    MISC,
    CONTACT,
    ARTIFACT,
    TAX;

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
