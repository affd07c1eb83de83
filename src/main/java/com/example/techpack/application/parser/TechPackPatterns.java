package com.example.techpack.application.parser;

import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.SizeLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless recognizers shared by both classification engines.
 * Each recognizer returns the matched text plus its captured parts, or nothing.
 */
@Component
public class TechPackPatterns {

    private static final Pattern MEASUREMENT = Pattern.compile(
            "(?<number>\\d+\\s?/\\s?\\d+|\\d+(?:\\.\\d+)?)\\s?(?<unit>mm|cm|\"|\u201D|\u2033|inch|')",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STITCH_CODE = Pattern.compile(
            "\\b(?:SNLS|DNCS|T/S|S/B|SPI|Box stitch|Lock stitch)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SPI = Pattern.compile("SPI\\s?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSTRUCTION_PHRASE = Pattern.compile(
            "back tack|double fold|clean finish|raw edge|binding|facing|hem fold",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FOLDER_PHRASE = Pattern.compile(
            "clean finish|double fold|binding|hem|facing|raw edge|back tack",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AUTOMATION = Pattern.compile(
            "auto|pneumatic|operation|notch",
            Pattern.CASE_INSENSITIVE);

    // XS-5cm, S-M-5.5cm, 2XL-3XL-6.5cm; never T/S 5mm or S 1/16"
    private static final String SIZE = "3XL|2XL|XS|XL|S|M|L";
    private static final Pattern SIZE_TOKEN = Pattern.compile(
            "(?<![\\w/])(?<chain>(?:(?:" + SIZE + ")\\s*[-/]\\s*)*)(?<size>" + SIZE + ")"
                    + "\\s*[-:]?\\s*(?<number>\\d+(?:\\.\\d+)?)(?!\\d|\\.\\d|\\s*/\\s*\\d)\\s*(?<unit>mm|cm)?");
    private static final Pattern SIZE_IN_CHAIN = Pattern.compile(SIZE);

    private static final Pattern COMPONENT_HEADING = Pattern.compile(
            "^(?:ASSEMBLY|(?:REGULAR\\s+CUTAWAY\\s+)?COLLAR|(?:SHORT\\s+)?SLEEVE|FRONT"
                    + "|(?:STRAIGHT\\s+)?BACK|(?:STRAIGHT\\s+)?YOKE|POCKET|CUFF)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final List<HeadingKeyword> HEADING_KEYWORDS = List.of(
            new HeadingKeyword("assembly", GarmentComponent.ASSEMBLY),
            new HeadingKeyword("collar", GarmentComponent.COLLAR),
            new HeadingKeyword("sleeve", GarmentComponent.SLEEVE),
            new HeadingKeyword("front", GarmentComponent.FRONT),
            new HeadingKeyword("back", GarmentComponent.BACK),
            new HeadingKeyword("yoke", GarmentComponent.YOKE),
            new HeadingKeyword("pocket", GarmentComponent.POCKET),
            new HeadingKeyword("cuff", GarmentComponent.CUFF)
    );

    /**
     * Finds every measurement (number followed by a unit) in reading order.
     *
     * @param line text line
     * @return matches, possibly empty
     */
    public List<Measurement> findMeasurements(String line) {
        List<Measurement> matches = new ArrayList<>();
        Matcher matcher = MEASUREMENT.matcher(line);
        while (matcher.find()) {
            matches.add(new Measurement(matcher.group(), matcher.group("number"), matcher.group("unit")));
        }
        return matches;
    }

    public Optional<Measurement> findMeasurement(String line) {
        Matcher matcher = MEASUREMENT.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new Measurement(matcher.group(), matcher.group("number"), matcher.group("unit")));
    }

    public Optional<String> findStitchCode(String line) {
        return firstMatch(STITCH_CODE, line);
    }

    public Optional<SpiToken> findSpi(String line) {
        Matcher matcher = SPI.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new SpiToken(matcher.group(), matcher.group(1)));
    }

    public Optional<String> findConstructionPhrase(String line) {
        return firstMatch(CONSTRUCTION_PHRASE, line);
    }

    /**
     * Looks for phrases that imply a folder or template (a superset of the construction
     * phrases that also includes a bare {@code hem}). Matches anywhere, also inside words.
     *
     * @param line text line
     * @return first folder-implying phrase
     */
    public Optional<String> findFolderPhrase(String line) {
        return firstMatch(FOLDER_PHRASE, line);
    }

    public Optional<String> findAutomationPhrase(String line) {
        return firstMatch(AUTOMATION, line);
    }

    /**
     * Finds every size token on the line. A chained token such as {@code S-M-5.5cm} carries
     * all of its size labels.
     *
     * @param line text line
     * @return size tokens in reading order
     */
    public List<SizeToken> findSizeTokens(String line) {
        List<SizeToken> tokens = new ArrayList<>();
        Matcher matcher = SIZE_TOKEN.matcher(line);
        while (matcher.find()) {
            List<SizeLabel> sizes = new ArrayList<>();
            Matcher chain = SIZE_IN_CHAIN.matcher(matcher.group("chain"));
            while (chain.find()) {
                sizes.add(SizeLabel.fromLabel(chain.group()));
            }
            sizes.add(SizeLabel.fromLabel(matcher.group("size")));
            tokens.add(new SizeToken(matcher.group(), List.copyOf(sizes), matcher.group("number"), matcher.group("unit"),
                    matcher.start(), matcher.end()));
        }
        return tokens;
    }

    /**
     * Recognizes an isolated section heading: either a known component heading in any case, or
     * an all-caps line without digits that names a component.
     *
     * @param line trimmed text line
     * @return the component the heading opens, or empty when the line is not a heading
     */
    public Optional<GarmentComponent> matchSectionHeader(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        boolean heading = COMPONENT_HEADING.matcher(line).matches()
                || (isAllCaps(line) && line.chars().noneMatch(Character::isDigit));
        if (!heading) {
            return Optional.empty();
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (HeadingKeyword keyword : HEADING_KEYWORDS) {
            if (lower.contains(keyword.keyword())) {
                return Optional.of(keyword.component());
            }
        }
        return Optional.empty();
    }

    private static boolean isAllCaps(String line) {
        return line.chars().anyMatch(Character::isLetter)
                && line.chars().noneMatch(Character::isLowerCase);
    }

    private static Optional<String> firstMatch(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * A number followed by a unit.
     *
     * @param text   full matched text, e.g. {@code 2.5cm}
     * @param number numeric part, decimal or {@code a/b}
     * @param unit   unit as written ({@code mm}, {@code cm}, an inch mark or {@code inch})
     */
    public record Measurement(String text, String number, String unit) {

        /**
         * @return number and unit without the separating whitespace, e.g. {@code 1/2"}
         */
        public String compact() {
            return number + unit;
        }
    }

    /**
     * @param text  matched text, e.g. {@code SPI 12}
     * @param gauge stitches per inch
     */
    public record SpiToken(String text, String gauge) {
    }

    /**
     * @param text   matched text, e.g. {@code S-M-5.5cm}
     * @param sizes  every size label the value applies to
     * @param number numeric value
     * @param unit   {@code mm}, {@code cm} or {@code null}
     * @param start  offset of the first matched character in the line
     * @param end    offset after the last matched character
     */
    public record SizeToken(String text, List<SizeLabel> sizes, String number, String unit, int start, int end) {
    }

    private record HeadingKeyword(String keyword, GarmentComponent component) {
    }
}
