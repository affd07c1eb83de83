package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of item categories the classifier may emit.
 */
public enum ItemCategory {
    MEASUREMENT,
    STITCH,
    PROCESS,
    AUTOMATION,
    CONSTRUCTION_NOTE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
