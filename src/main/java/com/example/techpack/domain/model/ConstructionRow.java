package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the construction table: one sewing operation with its stitch type and density.
 * Optional columns are empty strings, never {@code null}.
 */
@JsonPropertyOrder({"operation", "stitchType", "spiGauge", "notes"})
public record ConstructionRow(
        String operation,
        String stitchType,
        String spiGauge,
        String notes
) {
}
