package com.example.techpack.domain.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parts of a tech pack analysis a caller can ask for. Each one maps to a single engine, so an
 * unrequested part is never computed and stays empty in the envelope.
 */
public enum AnalysisFeature {
    /** Section item lists (collar ... assembly). */
    SECTION_ITEMS,
    /** Per-component construction, base measurement and grading tables. */
    TECHNICAL_TABLE,
    /** Buyer, order number and the other header facts. */
    BASE_INFORMATION;

    /**
     * @return a fresh set with every part of the analysis
     */
    public static EnumSet<AnalysisFeature> everything() {
        return EnumSet.allOf(AnalysisFeature.class);
    }

    /**
     * Reads the {@code features} request values. Names are case-insensitive and may use
     * {@code -} instead of {@code _}; names that denote no part are skipped. When nothing usable
     * remains, the whole analysis is requested.
     *
     * @param requested raw feature names, possibly {@code null}
     * @return the requested parts, never empty
     */
    public static EnumSet<AnalysisFeature> parseRequested(Collection<String> requested) {
        EnumSet<AnalysisFeature> parts = EnumSet.noneOf(AnalysisFeature.class);
        if (requested != null) {
            requested.stream()
                    .filter(Objects::nonNull)
                    .map(AnalysisFeature::byName)
                    .flatMap(Optional::stream)
                    .forEach(parts::add);
        }
        return parts.isEmpty() ? everything() : parts;
    }

    private static Optional<AnalysisFeature> byName(String name) {
        String constant = name.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (AnalysisFeature feature : values()) {
            if (feature.name().equals(constant)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }
}
