package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined result envelope returned to controllers and the CLI.
 * Serializes as {@code {collar: [...], ..., assembly: [...], technicalTable, baseInformation}}.
 */
public final class TechPackAnalysis {

    private final Map<Section, List<TechPackItem>> sections;
    private final TechnicalTable technicalTable;
    private final BaseInformation baseInformation;

    /**
     * Creates the envelope. Every {@link Section} is present in the result, missing ones as empty lists.
     *
     * @param sections        item lists per section
     * @param technicalTable  strict per-component tables
     * @param baseInformation header facts of the document
     */
    public TechPackAnalysis(Map<Section, List<TechPackItem>> sections,
                            TechnicalTable technicalTable,
                            BaseInformation baseInformation) {
        EnumMap<Section, List<TechPackItem>> copy = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            List<TechPackItem> items = sections == null ? null : sections.get(section);
            copy.put(section, items == null ? List.of() : List.copyOf(items));
        }
        this.sections = Collections.unmodifiableMap(copy);
        this.technicalTable = technicalTable == null ? TechnicalTable.empty() : technicalTable;
        this.baseInformation = baseInformation == null ? BaseInformation.empty() : baseInformation;
    }

    /**
     * @return envelope with every section, table and field empty
     */
    public static TechPackAnalysis empty() {
        return new TechPackAnalysis(Map.of(), TechnicalTable.empty(), BaseInformation.empty());
    }

    /**
     * @return section lists keyed by their lower-case name, flattened into the top-level JSON object
     */
    @JsonAnyGetter
    public Map<String, List<TechPackItem>> getSectionEntries() {
        Map<String, List<TechPackItem>> entries = new LinkedHashMap<>();
        sections.forEach((section, items) -> entries.put(section.key(), items));
        return entries;
    }

    @JsonIgnore
    public Map<Section, List<TechPackItem>> getSections() {
        return sections;
    }

    /**
     * @param section requested section
     * @return items collected for the section, never {@code null}
     */
    public List<TechPackItem> itemsFor(Section section) {
        return sections.get(section);
    }

    public TechnicalTable getTechnicalTable() {
        return technicalTable;
    }

    public BaseInformation getBaseInformation() {
        return baseInformation;
    }
}
