package com.example.techpack.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only vocabularies that drive naming, relevance and line filtering.
 * Built once (from configuration or {@link #defaults()}) and injected into the parsers, so tests
 * can substitute their own word lists.
 */
public final class TechPackVocabulary {

    private static final List<String> DEFAULT_NOISE_WORDS = List.of(
            "front", "back", "side", "collar", "pocket", "yoke", "sleeve", "cuff", "frontback");
    private static final List<String> DEFAULT_STOP_WORDS = List.of(
            "front", "back", "frontback", "assembly", "detail", "section", "item");
    private static final List<String> DEFAULT_MEASUREMENT_KEYWORDS = List.of(
            "margin", "hem", "seam", "stand", "height", "width", "placket",
            "cuff", "opening", "allowance", "depth", "run", "spread", "trimming", "fold");
    private static final List<String> DEFAULT_IGNORE_LINE_TERMS = List.of(
            "buyer", "style ref", "order no", "season", "modified",
            "main label", "size label", "w/c label", "barcode",
            "dressed", "cotton", "brand", "logo", "sheet", "page", "spec actual");
    private static final List<String> DEFAULT_TECHNICAL_IGNORE_TERMS = List.of(
            "buyer", "style ref", "order no", "season", "modified", "wash care", "finishing",
            "fabric", "trim", "care instruction", "barcode", "w/c label", "dressed", "cotton",
            "brand", "logo", "sheet", "page\\s*\\d", "--\\s*\\d+\\s+of\\s+\\d+\\s*--");
    private static final List<String> DEFAULT_MEASUREMENT_ROW_REJECT_TERMS = List.of(
            "buyer", "style", "order", "wash", "care", "label",
            "xs", "s-", "m-", "l-", "xl", "2xl", "3xl");

    private final Set<String> noiseWords;
    private final Set<String> stopWords;
    private final List<String> measurementKeywords;
    private final Map<String, Relevance> relevanceTerms;
    private final List<String> measurementRowRejectTerms;
    private final Pattern ignoreLinePattern;
    private final Pattern technicalIgnorePattern;

    /**
     * Creates a vocabulary. Word lists are lower-cased; ignore terms are regular expression
     * fragments matched case-insensitively anywhere in a line.
     *
     * @param noiseWords                bare component words never accepted as a name or value
     * @param stopWords                 words stripped from item names
     * @param measurementKeywords       words that make a measurement label relevant
     * @param relevanceTerms            ordered term to relevance lookup, first hit wins
     * @param ignoreLineTerms           administrative boilerplate skipped by the item classifier
     * @param technicalIgnoreTerms      boilerplate skipped by the technical table builder
     * @param measurementRowRejectTerms tokens that disqualify a base measurement label
     */
    public TechPackVocabulary(List<String> noiseWords,
                              List<String> stopWords,
                              List<String> measurementKeywords,
                              Map<String, Relevance> relevanceTerms,
                              List<String> ignoreLineTerms,
                              List<String> technicalIgnoreTerms,
                              List<String> measurementRowRejectTerms) {
        this.noiseWords = Collections.unmodifiableSet(lowerCased(noiseWords));
        this.stopWords = Collections.unmodifiableSet(lowerCased(stopWords));
        this.measurementKeywords = List.copyOf(lowerCased(measurementKeywords));
        Map<String, Relevance> terms = new LinkedHashMap<>();
        relevanceTerms.forEach((term, relevance) -> terms.put(term.toLowerCase(Locale.ROOT), relevance));
        this.relevanceTerms = Collections.unmodifiableMap(terms);
        this.measurementRowRejectTerms = List.copyOf(lowerCased(measurementRowRejectTerms));
        this.ignoreLinePattern = alternation(ignoreLineTerms);
        this.technicalIgnorePattern = alternation(technicalIgnoreTerms);
    }

    /**
     * @return the built-in vocabulary used by the CLI and when no overrides are configured
     */
    public static TechPackVocabulary defaults() {
        return new TechPackVocabulary(
                DEFAULT_NOISE_WORDS,
                DEFAULT_STOP_WORDS,
                DEFAULT_MEASUREMENT_KEYWORDS,
                defaultRelevanceTerms(),
                DEFAULT_IGNORE_LINE_TERMS,
                DEFAULT_TECHNICAL_IGNORE_TERMS,
                DEFAULT_MEASUREMENT_ROW_REJECT_TERMS
        );
    }

    public static Map<String, Relevance> defaultRelevanceTerms() {
        Map<String, Relevance> terms = new LinkedHashMap<>();
        terms.put("margin", Relevance.GAUGE);
        terms.put("allowance", Relevance.GAUGE);
        terms.put("run", Relevance.AUTOMATION);
        terms.put("stitch", Relevance.RISK);
        terms.put("spi", Relevance.RISK);
        terms.put("notch", Relevance.AUTOMATION);
        terms.put("hem", Relevance.FOLDER);
        terms.put("fold", Relevance.FOLDER);
        terms.put("binding", Relevance.FOLDER);
        terms.put("piping", Relevance.FOLDER);
        terms.put("pleat", Relevance.FOLDER);
        terms.put("gather", Relevance.FOLDER);
        terms.put("smocking", Relevance.AUTOMATION);
        terms.put("clean_finish", Relevance.FOLDER);
        terms.put("double_fold", Relevance.FOLDER);
        return terms;
    }

    public static List<String> defaultNoiseWords() {
        return DEFAULT_NOISE_WORDS;
    }

    public static List<String> defaultStopWords() {
        return DEFAULT_STOP_WORDS;
    }

    public static List<String> defaultMeasurementKeywords() {
        return DEFAULT_MEASUREMENT_KEYWORDS;
    }

    public static List<String> defaultIgnoreLineTerms() {
        return DEFAULT_IGNORE_LINE_TERMS;
    }

    public static List<String> defaultTechnicalIgnoreTerms() {
        return DEFAULT_TECHNICAL_IGNORE_TERMS;
    }

    public static List<String> defaultMeasurementRowRejectTerms() {
        return DEFAULT_MEASUREMENT_ROW_REJECT_TERMS;
    }

    /**
     * @param word candidate, compared case-insensitively after trimming
     * @return {@code true} when the word is a bare component noise word
     */
    public boolean isNoiseWord(String word) {
        return word != null && noiseWords.contains(word.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @param text lower-cased text
     * @return {@code true} when any noise word occurs as a substring
     */
    public boolean containsNoiseWord(String text) {
        return noiseWords.stream().anyMatch(text::contains);
    }

    /**
     * @param text lower-cased text
     * @return {@code true} when any measurement keyword occurs as a substring
     */
    public boolean containsMeasurementKeyword(String text) {
        return measurementKeywords.stream().anyMatch(text::contains);
    }

    /**
     * @param label lower-cased base measurement label
     * @return {@code true} when the label still carries administrative or size-column tokens
     */
    public boolean isRejectedMeasurementLabel(String label) {
        return measurementRowRejectTerms.stream().anyMatch(label::contains);
    }

    public boolean isIgnoredLine(String line) {
        return ignoreLinePattern != null && ignoreLinePattern.matcher(line).find();
    }

    public boolean isTechnicalIgnoredLine(String line) {
        return technicalIgnorePattern != null && technicalIgnorePattern.matcher(line).find();
    }

    public Set<String> stopWords() {
        return stopWords;
    }

    public Map<String, Relevance> relevanceTerms() {
        return relevanceTerms;
    }

    private static Set<String> lowerCased(List<String> values) {
        if (values == null) {
            return new LinkedHashSet<>();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Pattern alternation(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return null;
        }
        String joined = terms.stream()
                .filter(term -> term != null && !term.isBlank())
                .map(term -> "(?:" + term + ")")
                .collect(Collectors.joining("|"));
        return joined.isEmpty() ? null : Pattern.compile(joined, Pattern.CASE_INSENSITIVE);
    }
}
