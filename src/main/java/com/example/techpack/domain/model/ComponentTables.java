package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The three strict tables collected for one garment component.
 */
@JsonPropertyOrder({"component", "constructionTable", "baseMeasurementsTable", "gradingTable"})
public record ComponentTables(
        GarmentComponent component,
        List<ConstructionRow> constructionTable,
        List<BaseMeasurementRow> baseMeasurementsTable,
        List<GradingRow> gradingTable
) {

    /**
     * @return {@code true} when none of the tables holds a row
     */
    public boolean isEmpty() {
        return constructionTable.isEmpty() && baseMeasurementsTable.isEmpty() && gradingTable.isEmpty();
    }
}
