package com.example.techpack.application.parser;

import com.example.techpack.domain.model.ItemCategory;
import com.example.techpack.domain.model.ItemSource;
import com.example.techpack.domain.model.Relevance;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackItem;
import com.example.techpack.domain.model.TechPackVocabulary;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-pass accumulator of section items. Owns the item lists and the keys already seen in each
 * section, and is discarded once the pass completes.
 */
final class SectionItemCollector {

    private final NameResolver nameResolver;
    private final TechPackVocabulary vocabulary;
    private final Map<Section, List<TechPackItem>> items = new EnumMap<>(Section.class);
    private final Map<Section, Set<String>> seenKeys = new EnumMap<>(Section.class);

    SectionItemCollector(NameResolver nameResolver, TechPackVocabulary vocabulary) {
        this.nameResolver = nameResolver;
        this.vocabulary = vocabulary;
        for (Section section : Section.values()) {
            items.put(section, new ArrayList<>());
            seenKeys.put(section, new HashSet<>());
        }
    }

    /**
     * Adds an item unless its value is empty or a bare noise word, or an item with the same
     * category, name and case-insensitive value already exists in the section.
     *
     * @param section   target section
     * @param category  item category
     * @param rawName   label to resolve into a namespaced name
     * @param value     item value
     * @param source    explicit or inferred
     * @param relevance relevance tag, or {@code null} to derive it from the resolved name
     * @return {@code true} when the item was added
     */
    boolean add(Section section, ItemCategory category, String rawName, String value,
                ItemSource source, Relevance relevance) {
        if (category == null || rawName == null || rawName.isBlank() || value == null) {
            return false;
        }
        String trimmed = value.strip();
        if (trimmed.isEmpty() || vocabulary.isNoiseWord(trimmed)) {
            return false;
        }
        String name = nameResolver.resolveName(section, rawName);
        Relevance tag = relevance != null ? relevance : nameResolver.resolveRelevance(name);
        TechPackItem item = new TechPackItem(category, name, trimmed, source == null ? ItemSource.EXPLICIT : source, tag);
        if (!seenKeys.get(section).add(item.dedupKey())) {
            return false;
        }
        items.get(section).add(item);
        return true;
    }

    /**
     * @return copy of the collected items, every section present
     */
    Map<Section, List<TechPackItem>> snapshot() {
        Map<Section, List<TechPackItem>> copy = new EnumMap<>(Section.class);
        items.forEach((section, list) -> copy.put(section, List.copyOf(list)));
        return copy;
    }
}
