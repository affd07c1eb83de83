package com.example.techpack.application.parser;

import com.example.techpack.domain.model.ItemCategory;
import com.example.techpack.domain.model.ItemSource;
import com.example.techpack.domain.model.Relevance;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackItem;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loose, inference-friendly engine that turns each line into zero or more section items:
 * measurements, stitches, processes, automation hints and construction notes, including notes
 * inferred from construction phrases that are not literally present in the text.
 */
@Component
public class ItemClassifier {

    private static final Logger log = LoggerFactory.getLogger(ItemClassifier.class);
    private static final int MAX_LABEL_LENGTH = 120;
    private static final int SHORT_LABEL_LENGTH = 25;
    private static final String FOLDER_NOTE_PREFIX = "Likely requires folder for ";
    private static final String MARGIN_FALLBACK = "Margin/allowance specified";
    private static final String DEFAULT_FOLDER_TERM = "clean finish";

    private final TechPackPatterns patterns;
    private final NameResolver nameResolver;
    private final TechPackVocabulary vocabulary;

    public ItemClassifier(TechPackPatterns patterns, NameResolver nameResolver, TechPackVocabulary vocabulary) {
        this.patterns = patterns;
        this.nameResolver = nameResolver;
        this.vocabulary = vocabulary;
    }

    /**
     * Classifies the ordered lines of one document.
     *
     * @param lines extracted lines in reading order
     * @return items per section, every section present
     */
    public Map<Section, List<TechPackItem>> classify(List<String> lines) {
        SectionTracker tracker = new SectionTracker();
        SectionItemCollector collector = new SectionItemCollector(nameResolver, vocabulary);
        if (lines == null) {
            return collector.snapshot();
        }
        int ignored = 0;
        for (String rawLine : lines) {
            if (rawLine == null) {
                continue;
            }
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (vocabulary.isIgnoredLine(line)) {
                ignored++;
                continue;
            }
            classifyLine(tracker.update(line), line, collector);
        }
        log.debug("Item classification skipped {} administrative lines out of {}", ignored, lines.size());
        return collector.snapshot();
    }

    private void classifyLine(Section section, String line, SectionItemCollector collector) {
        String lower = line.toLowerCase(Locale.ROOT);

        List<TechPackPatterns.Measurement> measurements = patterns.findMeasurements(line);
        for (TechPackPatterns.Measurement measurement : measurements) {
            String label = line.replaceFirst(Pattern.quote(measurement.text()), "").strip();
            if (isRelevantMeasurementLabel(label)) {
                collector.add(section, ItemCategory.MEASUREMENT, label, measurement.compact(),
                        ItemSource.EXPLICIT, Relevance.GAUGE);
            }
        }

        patterns.findStitchCode(line).ifPresent(code -> {
            String value = patterns.findSpi(line)
                    .map(spi -> code + " (SPI " + spi.gauge() + ")")
                    .orElse(code);
            collector.add(section, ItemCategory.STITCH, "stitch_type", value, ItemSource.EXPLICIT, Relevance.RISK);
        });

        Optional<String> constructionPhrase = patterns.findConstructionPhrase(line);
        constructionPhrase.ifPresent(phrase -> {
            collector.add(section, ItemCategory.PROCESS, phrase, phrase, ItemSource.EXPLICIT, Relevance.FOLDER);
            collector.add(section, ItemCategory.CONSTRUCTION_NOTE, section.key() + "_folder_requirement",
                    FOLDER_NOTE_PREFIX + phrase, ItemSource.INFERRED, Relevance.FOLDER);
        });

        patterns.findAutomationPhrase(line).ifPresent(phrase ->
                collector.add(section, ItemCategory.AUTOMATION, "automation_type", phrase,
                        ItemSource.EXPLICIT, Relevance.AUTOMATION));

        if ((lower.contains("margin") || lower.contains("allowance")) && !line.contains(":")) {
            String value = measurements.isEmpty() ? MARGIN_FALLBACK : measurements.get(0).compact();
            collector.add(section, ItemCategory.CONSTRUCTION_NOTE, section.key() + "_seam_spec", value,
                    ItemSource.INFERRED, Relevance.GAUGE);
        }

        // second, independent folder inference; a bare "hem" or similar trigger without a
        // construction phrase is reported as a clean finish
        if (patterns.findFolderPhrase(line).isPresent()) {
            String term = constructionPhrase.orElse(DEFAULT_FOLDER_TERM);
            String name = section.key() + "_" + term.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
            collector.add(section, ItemCategory.CONSTRUCTION_NOTE, name, FOLDER_NOTE_PREFIX + term,
                    ItemSource.INFERRED, Relevance.FOLDER);
        }
    }

    /**
     * Suppresses layout artifacts (page coordinates, table borders) that happen to look like a
     * number with a unit.
     *
     * @param label line with the measurement removed
     * @return {@code true} when the label reads like a construction measurement
     */
    boolean isRelevantMeasurementLabel(String label) {
        if (label == null || label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
            return false;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        if (vocabulary.containsMeasurementKeyword(lower)) {
            return true;
        }
        return label.length() < SHORT_LABEL_LENGTH && !vocabulary.containsNoiseWord(lower);
    }
}
