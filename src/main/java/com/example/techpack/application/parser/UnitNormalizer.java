package com.example.techpack.application.parser;

import com.example.techpack.domain.model.NormalizedMeasurement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a raw numeric token into one canonical metric magnitude/unit pair so that grading and
 * measurement tables stay comparable across documents with mixed unit conventions.
 * <p>
 * Fractions ({@code a/b}) and numbers without a metric unit are inches. The result is expressed in
 * millimetres below 10 mm and in centimetres otherwise, rounded half-up to two decimals.
 */
@Component
public class UnitNormalizer {

    private static final BigDecimal MM_PER_INCH = new BigDecimal("25.4");
    private static final BigDecimal MM_PER_CM = BigDecimal.TEN;
    private static final Pattern FRACTION = Pattern.compile("(\\d+)\\s*/\\s*(\\d+)");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    /**
     * Normalizes a number with an optional unit.
     *
     * @param number raw numeric text, decimal or fraction, optionally carrying inch marks
     * @param unit   raw unit text; only {@code mm} and {@code cm} are metric, anything else means inches
     * @return canonical measurement, or empty when the number cannot be parsed
     */
    public Optional<NormalizedMeasurement> normalize(String number, String unit) {
        if (number == null || number.isBlank()) {
            return Optional.empty();
        }
        String cleaned = number.strip().replace("\"", "").replace("'", "");
        Optional<BigDecimal> millimetres = toMillimetres(cleaned, unit == null ? "" : unit.strip().toLowerCase(Locale.ROOT));
        return millimetres.map(this::toCanonical);
    }

    /**
     * Shorthand for {@link #normalize(String, String)} on a recognized measurement.
     *
     * @param measurement measurement found by {@link TechPackPatterns}
     * @return canonical measurement, or empty when the number cannot be parsed
     */
    public Optional<NormalizedMeasurement> normalize(TechPackPatterns.Measurement measurement) {
        return normalize(measurement.number(), measurement.unit());
    }

    private Optional<BigDecimal> toMillimetres(String number, String unit) {
        Matcher fraction = FRACTION.matcher(number);
        if (fraction.matches()) {
            BigDecimal denominator = new BigDecimal(fraction.group(2));
            if (denominator.signum() == 0) {
                return Optional.empty();
            }
            BigDecimal inches = new BigDecimal(fraction.group(1)).divide(denominator, MathContext.DECIMAL64);
            return Optional.of(inches.multiply(MM_PER_INCH));
        }
        if (!DECIMAL.matcher(number).matches()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(number);
        return Optional.of(switch (unit) {
            case "cm" -> value.multiply(MM_PER_CM);
            case "mm" -> value;
            default -> value.multiply(MM_PER_INCH);
        });
    }

    private NormalizedMeasurement toCanonical(BigDecimal millimetres) {
        BigDecimal rounded = millimetres.setScale(2, RoundingMode.HALF_UP);
        if (rounded.compareTo(BigDecimal.TEN) >= 0) {
            BigDecimal centimetres = rounded.divide(MM_PER_CM, 2, RoundingMode.HALF_UP);
            return new NormalizedMeasurement(centimetres, NormalizedMeasurement.CENTIMETRE);
        }
        return new NormalizedMeasurement(rounded, NormalizedMeasurement.MILLIMETRE);
    }
}
