package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;

/**
 * Domain DTO for a single decision-relevant fact attached to a garment section.
 * {@code name} is always namespaced with the section (e.g. {@code collar_stand_height}).
 */
@JsonPropertyOrder({"category", "name", "value", "source", "relevance"})
public record TechPackItem(
        ItemCategory category,
        String name,
        String value,
        ItemSource source,
        Relevance relevance
) {

    /**
     * @return key that identifies duplicates within one section
     */
    public String dedupKey() {
        return category.key() + '|' + name + '|' + value.toLowerCase(Locale.ROOT);
    }
}
