package com.example.techpack.application.parser;

import com.example.techpack.domain.model.BaseMeasurementRow;
import com.example.techpack.domain.model.ComponentTables;
import com.example.techpack.domain.model.ConstructionRow;
import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.GradingRow;
import com.example.techpack.domain.model.SizeLabel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable tables of one component during a single pass. Construction rows are merged on
 * (operation, stitch type, SPI); grading rows are merged on the parameter text.
 */
final class ComponentTableAccumulator {

    private final GarmentComponent component;
    private final List<ConstructionRow> constructionRows = new ArrayList<>();
    private final Set<String> constructionKeys = new HashSet<>();
    private final List<BaseMeasurementRow> baseMeasurements = new ArrayList<>();
    private final Map<String, Map<SizeLabel, String>> gradingRows = new LinkedHashMap<>();

    ComponentTableAccumulator(GarmentComponent component) {
        this.component = component;
    }

    /**
     * @param row candidate construction row
     * @return {@code false} when an identical operation/stitch/SPI row already exists
     */
    boolean addConstruction(ConstructionRow row) {
        String key = row.operation() + '\u0000' + row.stitchType() + '\u0000' + row.spiGauge();
        if (!constructionKeys.add(key)) {
            return false;
        }
        constructionRows.add(row);
        return true;
    }

    void addBaseMeasurement(BaseMeasurementRow row) {
        baseMeasurements.add(row);
    }

    /**
     * Writes a value into a size column, creating the parameter row on first sight.
     *
     * @param parameter grading parameter label
     * @param size      size column
     * @param cell      value with unit
     */
    void putGrading(String parameter, SizeLabel size, String cell) {
        gradingRows.computeIfAbsent(parameter, key -> new EnumMap<>(SizeLabel.class)).put(size, cell);
    }

    ComponentTables toTables() {
        List<GradingRow> grading = new ArrayList<>(gradingRows.size());
        gradingRows.forEach((parameter, cells) -> grading.add(new GradingRow(
                parameter,
                cells.getOrDefault(SizeLabel.XS, ""),
                cells.getOrDefault(SizeLabel.S, ""),
                cells.getOrDefault(SizeLabel.M, ""),
                cells.getOrDefault(SizeLabel.L, ""),
                cells.getOrDefault(SizeLabel.XL, ""),
                cells.getOrDefault(SizeLabel.XXL, ""),
                cells.getOrDefault(SizeLabel.XXXL, "")
        )));
        return new ComponentTables(component, List.copyOf(constructionRows), List.copyOf(baseMeasurements), List.copyOf(grading));
    }
}
