package com.example.techpack.application.parser;

import com.example.techpack.domain.model.BaseMeasurementRow;
import com.example.techpack.domain.model.ComponentTables;
import com.example.techpack.domain.model.ConstructionRow;
import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.NormalizedMeasurement;
import com.example.techpack.domain.model.SizeLabel;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strict engine that files every line under exactly one of grading, construction or base
 * measurement for the current component, and merges the rows into three tables per component.
 * No inference happens here: a row only exists when its tokens are literally on the line.
 */
@Component
public class TechnicalTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(TechnicalTableBuilder.class);
    private static final int MAX_LINE_LENGTH = 250;
    private static final int MAX_LABEL_LENGTH = 80;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DANGLING_SEPARATORS = Pattern.compile("^[\\s:;,|\\-]+|[\\s:;,|\\-]+$");

    private final TechPackPatterns patterns;
    private final UnitNormalizer unitNormalizer;
    private final TechnicalLineClassifier lineClassifier;
    private final TechPackVocabulary vocabulary;

    public TechnicalTableBuilder(TechPackPatterns patterns,
                                 UnitNormalizer unitNormalizer,
                                 TechnicalLineClassifier lineClassifier,
                                 TechPackVocabulary vocabulary) {
        this.patterns = patterns;
        this.unitNormalizer = unitNormalizer;
        this.lineClassifier = lineClassifier;
        this.vocabulary = vocabulary;
    }

    /**
     * Runs one pass over the lines of a document.
     *
     * @param lines extracted lines in reading order
     * @return tables per component that received at least one line, unordered and possibly empty
     */
    public Map<GarmentComponent, ComponentTables> collect(List<String> lines) {
        Map<GarmentComponent, ComponentTableAccumulator> accumulators = new EnumMap<>(GarmentComponent.class);
        ComponentHeaderTracker tracker = new ComponentHeaderTracker(patterns);
        if (lines != null) {
            for (String rawLine : lines) {
                if (rawLine == null) {
                    continue;
                }
                String line = rawLine.strip();
                if (line.isEmpty() || line.length() > MAX_LINE_LENGTH || vocabulary.isTechnicalIgnoredLine(line)) {
                    continue;
                }
                if (tracker.consumeHeader(line)) {
                    log.debug("Technical table switched to component {}", tracker.current());
                    continue;
                }
                ComponentTableAccumulator tables = accumulators.computeIfAbsent(
                        tracker.current(), ComponentTableAccumulator::new);
                switch (lineClassifier.classify(line)) {
                    case GRADING -> addGrading(line, tables);
                    case CONSTRUCTION -> addConstruction(line, tables);
                    case BASE_MEASUREMENT -> addBaseMeasurement(line, tables);
                }
            }
        }
        Map<GarmentComponent, ComponentTables> result = new EnumMap<>(GarmentComponent.class);
        accumulators.forEach((component, tables) -> result.put(component, tables.toTables()));
        return result;
    }

    private void addGrading(String line, ComponentTableAccumulator tables) {
        List<TechPackPatterns.SizeToken> tokens = patterns.findSizeTokens(line);
        String parameter = truncate(cleanLabel(withoutSizeTokens(line, tokens)));
        if (parameter.isEmpty()) {
            parameter = "Size";
        }
        for (TechPackPatterns.SizeToken token : tokens) {
            String cell = unitNormalizer.normalize(token.number(), token.unit())
                    .map(NormalizedMeasurement::asCell)
                    .orElse(token.number() + (token.unit() == null ? "" : token.unit()));
            for (SizeLabel size : token.sizes()) {
                tables.putGrading(parameter, size, cell);
            }
        }
    }

    private void addConstruction(String line, ComponentTableAccumulator tables) {
        Optional<String> stitchCode = patterns.findStitchCode(line);
        Optional<TechPackPatterns.SpiToken> spi = patterns.findSpi(line);
        Optional<String> constructionPhrase = patterns.findConstructionPhrase(line);
        Optional<TechPackPatterns.Measurement> measurement = patterns.findMeasurement(line);

        String operation = line;
        if (spi.isPresent()) {
            operation = operation.replace(spi.get().text(), "");
        }
        if (stitchCode.isPresent()) {
            operation = operation.replace(stitchCode.get(), "");
        }
        if (constructionPhrase.isPresent()) {
            operation = operation.replace(constructionPhrase.get(), "");
        }
        if (measurement.isPresent()) {
            operation = operation.replace(measurement.get().text(), "");
        }
        operation = truncate(WHITESPACE.matcher(operation).replaceAll(" ").strip());
        if (operation.isEmpty()) {
            operation = "Operation";
        }

        ConstructionRow row = new ConstructionRow(
                operation,
                stitchCode.or(() -> constructionPhrase).orElse(""),
                spi.map(TechPackPatterns.SpiToken::gauge).orElse(""),
                measurement.map(found -> found.text().strip()).orElse("")
        );
        if (!tables.addConstruction(row)) {
            log.debug("Merged duplicate construction row {}", row);
        }
    }

    private void addBaseMeasurement(String line, ComponentTableAccumulator tables) {
        Optional<TechPackPatterns.Measurement> first = patterns.findMeasurement(line);
        if (first.isEmpty()) {
            return;
        }
        TechPackPatterns.Measurement measurement = first.get();
        Optional<NormalizedMeasurement> normalized = unitNormalizer.normalize(measurement);
        if (normalized.isEmpty()) {
            return;
        }
        String parameter = cleanLabel(line.replace(measurement.text(), " "));
        if (parameter.isEmpty() || parameter.length() > MAX_LABEL_LENGTH) {
            parameter = "Dimension";
        }
        if (vocabulary.isRejectedMeasurementLabel(parameter.toLowerCase(Locale.ROOT))) {
            log.debug("Rejected base measurement label '{}'", parameter);
            return;
        }
        tables.addBaseMeasurement(new BaseMeasurementRow(
                parameter,
                normalized.get().valueText(),
                normalized.get().unit(),
                ""
        ));
    }

    /**
     * Cuts the matched spans out of the line by offset, so a token that also occurs inside a longer
     * one ({@code S-7cm} in {@code XS-7cm}) leaves nothing behind.
     */
    private static String withoutSizeTokens(String line, List<TechPackPatterns.SizeToken> tokens) {
        StringBuilder label = new StringBuilder(line.length());
        int position = 0;
        for (TechPackPatterns.SizeToken token : tokens) {
            label.append(line, position, token.start()).append(' ');
            position = token.end();
        }
        return label.append(line.substring(position)).toString();
    }

    private static String cleanLabel(String text) {
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return DANGLING_SEPARATORS.matcher(collapsed).replaceAll("");
    }

    private static String truncate(String text) {
        return text.length() > MAX_LABEL_LENGTH ? text.substring(0, MAX_LABEL_LENGTH).strip() : text;
    }
}
