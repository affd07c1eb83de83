package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether an item was read literally from the document or inferred from a construction phrase.
 */
public enum ItemSource {
    EXPLICIT,
    INFERRED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
