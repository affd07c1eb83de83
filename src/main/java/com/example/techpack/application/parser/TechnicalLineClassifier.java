package com.example.techpack.application.parser;

import org.springframework.stereotype.Component;

/**
 * Single dispatch point for the technical table: every classified line gets exactly one
 * category, with grading taking precedence over construction, and construction over base
 * measurement.
 */
@Component
public class TechnicalLineClassifier {

    private final TechPackPatterns patterns;

    public TechnicalLineClassifier(TechPackPatterns patterns) {
        this.patterns = patterns;
    }

    /**
     * @param line trimmed, non-heading line
     * @return the one category the line contributes to
     */
    public LineCategory classify(String line) {
        if (!patterns.findSizeTokens(line).isEmpty()) {
            return LineCategory.GRADING;
        }
        if (patterns.findStitchCode(line).isPresent() || patterns.findConstructionPhrase(line).isPresent()) {
            return LineCategory.CONSTRUCTION;
        }
        return LineCategory.BASE_MEASUREMENT;
    }
}
