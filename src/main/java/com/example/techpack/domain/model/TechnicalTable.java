package com.example.techpack.domain.model;

import java.util.List;

/**
 * Table-mode output: components in canonical order, only those with at least one row.
 */
public record TechnicalTable(List<ComponentTables> components) {

    public static TechnicalTable empty() {
        return new TechnicalTable(List.of());
    }
}
