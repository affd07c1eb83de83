package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why an extracted fact matters downstream: machine gauge setting, folder/template selection,
 * construction risk or automation applicability.
 */
public enum Relevance {
    GAUGE,
    FOLDER,
    RISK,
    AUTOMATION;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
