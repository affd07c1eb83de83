package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Garment section used by the item-level output. Declaration order is the order of the
 * section keys in the JSON envelope.
 */
public enum Section {
    COLLAR,
    SLEEVE,
    CUFF,
    POCKET,
    FRONT,
    BACK,
    ASSEMBLY;

    /**
     * @return lower-case key used in the JSON envelope and as the name prefix of items
     */
    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
