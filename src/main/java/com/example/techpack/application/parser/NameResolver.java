package com.example.techpack.application.parser;

import com.example.techpack.domain.model.Relevance;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw label fragments into namespaced item names ({@code collar_stand_height}) and tags
 * them with a manufacturing relevance.
 */
@Component
public class NameResolver {

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+");

    private final TechPackVocabulary vocabulary;

    public NameResolver(TechPackVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Builds an unambiguous name for a label within a section. The result is never empty,
     * always starts with the section key and carries no stray {@code front}/{@code back} words.
     *
     * @param section  section the label belongs to
     * @param rawLabel free-text label
     * @return {@code section_label}, {@code section_spec} when nothing usable is left, or
     *         {@code section_dimension} when the label is empty
     */
    public String resolveName(Section section, String rawLabel) {
        String prefix = section.key();
        if (rawLabel == null || rawLabel.isBlank()) {
            return prefix + "_dimension";
        }
        String text = rawLabel.toLowerCase(Locale.ROOT).replace('_', ' ');
        text = DISALLOWED.matcher(text).replaceAll(" ");
        Set<String> stripped = new LinkedHashSet<>(vocabulary.stopWords());
        stripped.add(prefix);
        for (String word : stripped) {
            text = text.replaceAll("\\b" + Pattern.quote(word) + "\\b", " ");
        }
        text = SEPARATORS.matcher(text.strip()).replaceAll("_");
        if (text.isEmpty() || vocabulary.isNoiseWord(text)) {
            return prefix + "_spec";
        }
        return prefix + "_" + text;
    }

    /**
     * Looks the name up in the term table; the first term contained in the name wins.
     * Names matching no term are treated as risk items that warrant manual review.
     *
     * @param name resolved item name
     * @return relevance tag
     */
    public Relevance resolveRelevance(String name) {
        if (name == null) {
            return Relevance.RISK;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Relevance> entry : vocabulary.relevanceTerms().entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return Relevance.RISK;
    }
}
