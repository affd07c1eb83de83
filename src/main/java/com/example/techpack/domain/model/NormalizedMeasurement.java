package com.example.techpack.domain.model;

import java.math.BigDecimal;

/**
 * Canonical magnitude/unit pair: millimetres below 10 mm, centimetres from 10 mm upwards,
 * both rounded to two decimals.
 *
 * @param value rounded magnitude
 * @param unit  {@code mm} or {@code cm}
 */
public record NormalizedMeasurement(BigDecimal value, String unit) {

    public static final String MILLIMETRE = "mm";
    public static final String CENTIMETRE = "cm";

    /**
     * @return magnitude without trailing zeros, e.g. {@code 2.5} or {@code 5}
     */
    public String valueText() {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    /**
     * @return value and unit joined, e.g. {@code 5cm}
     */
    public String asCell() {
        return valueText() + unit;
    }
}
