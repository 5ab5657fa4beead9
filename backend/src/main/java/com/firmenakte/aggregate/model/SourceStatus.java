package com.firmenakte.aggregate.model;

public enum SourceStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED,
    SKIPPED
}
