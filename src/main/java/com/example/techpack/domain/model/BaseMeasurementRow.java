package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the base measurement table. {@code value} is the canonical numeric string produced by
 * the unit normalizer and {@code unit} is either {@code mm} or {@code cm}.
 */
@JsonPropertyOrder({"parameter", "value", "unit", "relatedOperation"})
public record BaseMeasurementRow(
        String parameter,
        String value,
        String unit,
        String relatedOperation
) {
}
