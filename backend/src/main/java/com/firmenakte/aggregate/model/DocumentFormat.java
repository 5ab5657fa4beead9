package com.firmenakte.aggregate.model;

public enum DocumentFormat {
    HTML,
    PDF,
    XML
}
