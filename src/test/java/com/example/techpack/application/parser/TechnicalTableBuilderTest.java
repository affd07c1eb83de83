package com.example.techpack.application.parser;

import com.example.techpack.domain.model.BaseMeasurementRow;
import com.example.techpack.domain.model.ComponentTables;
import com.example.techpack.domain.model.ConstructionRow;
import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.GradingRow;
import com.example.techpack.domain.model.SizeLabel;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests covering the strict technical table engine.
 */
class TechnicalTableBuilderTest {

    private final TechPackPatterns patterns = new TechPackPatterns();
    private final TechnicalTableBuilder builder = new TechnicalTableBuilder(
            patterns, new UnitNormalizer(), new TechnicalLineClassifier(patterns), TechPackVocabulary.defaults());

    /**
     * Header, base measurement and construction line of a single component.
     */
    @Test
    void collectsCollarTables() {
        Map<GarmentComponent, ComponentTables> result = builder.collect(List.of(
                "COLLAR",
                "Collar stand height 2.5cm",
                "SNLS stitch SPI 12"
        ));

        assertThat(result).containsOnlyKeys(GarmentComponent.COLLAR);
        ComponentTables collar = result.get(GarmentComponent.COLLAR);
        assertThat(collar.baseMeasurementsTable()).containsExactly(
                new BaseMeasurementRow("Collar stand height", "2.5", "cm", ""));
        assertThat(collar.constructionTable()).containsExactly(
                new ConstructionRow("stitch", "SNLS", "12", ""));
        assertThat(collar.gradingTable()).isEmpty();
    }

    @Test
    void splitsGradingValuesPerSize() {
        GradingRow row = builder.collect(List.of("Hem XS-5cm S-7cm"))
                .get(GarmentComponent.ASSEMBLY).gradingTable().get(0);

        assertThat(row.parameter()).isEqualTo("Hem");
        assertThat(row.valueFor(SizeLabel.XS)).isEqualTo("5cm");
        assertThat(row.valueFor(SizeLabel.S)).isEqualTo("7cm");
        assertThat(row.valueFor(SizeLabel.M)).isEmpty();
        assertThat(row.valueFor(SizeLabel.XXXL)).isEmpty();
    }

    /**
     * A token that is also the tail of a later token must not leave fragments in the label.
     */
    @Test
    void overlappingTokenTextsLeaveACleanParameter() {
        GradingRow row = builder.collect(List.of("Hem S-7cm XS-7cm"))
                .get(GarmentComponent.ASSEMBLY).gradingTable().get(0);

        assertThat(row).isEqualTo(new GradingRow("Hem", "7cm", "7cm", "", "", "", "", ""));
    }

    @Test
    void chainedRangeFillsEverySizeAndMergesByParameter() {
        List<GradingRow> grading = builder.collect(List.of(
                "Cuff opening S-M-5.5cm",
                "Cuff opening L-6cm"
        )).get(GarmentComponent.ASSEMBLY).gradingTable();

        assertThat(grading).containsExactly(new GradingRow("Cuff opening", "", "5.5cm", "5.5cm", "6cm", "", "", ""));
    }

    @Test
    void unitlessGradingValuesAreInches() {
        GradingRow row = builder.collect(List.of("Chest XS-20 S-21"))
                .get(GarmentComponent.ASSEMBLY).gradingTable().get(0);

        assertThat(row.parameter()).isEqualTo("Chest");
        assertThat(row.xs()).isEqualTo("50.8cm");
        assertThat(row.s()).isEqualTo("53.34cm");
    }

    @Test
    void identicalConstructionRowsMergeWithinAComponent() {
        Map<GarmentComponent, ComponentTables> result = builder.collect(List.of(
                "FRONT",
                "Placket SNLS SPI 12",
                "Placket SNLS SPI 12",
                "BACK",
                "Placket SNLS SPI 12"
        ));

        assertThat(result.get(GarmentComponent.FRONT).constructionTable())
                .containsExactly(new ConstructionRow("Placket", "SNLS", "12", ""));
        assertThat(result.get(GarmentComponent.BACK).constructionTable()).hasSize(1);
    }

    @Test
    void constructionPhraseFillsStitchTypeAndNotes() {
        ConstructionRow row = builder.collect(List.of("Sleeve opening binding 1cm"))
                .get(GarmentComponent.ASSEMBLY).constructionTable().get(0);

        assertThat(row).isEqualTo(new ConstructionRow("Sleeve opening", "binding", "", "1cm"));
    }

    @Test
    void narrativeMentionDoesNotSwitchComponent() {
        Map<GarmentComponent, ComponentTables> result = builder.collect(List.of("Collar band 3cm"));

        assertThat(result).containsOnlyKeys(GarmentComponent.ASSEMBLY);
        assertThat(result.get(GarmentComponent.ASSEMBLY).baseMeasurementsTable())
                .containsExactly(new BaseMeasurementRow("Collar band", "3", "cm", ""));
    }

    @Test
    void fractionalBaseMeasurementIsNormalized() {
        BaseMeasurementRow row = builder.collect(List.of("POCKET", "Pocket depth: 3/8\""))
                .get(GarmentComponent.POCKET).baseMeasurementsTable().get(0);

        assertThat(row).isEqualTo(new BaseMeasurementRow("Pocket depth", "9.53", "mm", ""));
    }

    @Test
    void boilerplateAndRejectedLabelsProduceNoRows() {
        Map<GarmentComponent, ComponentTables> result = builder.collect(List.of(
                "Page 2",
                "-- 1 of 3 --",
                "Fabric weight 2cm",
                "Label position 3cm",
                "Line without any measurement",
                "x".repeat(251) + " 2cm"
        ));

        assertThat(result.values()).allSatisfy(tables -> assertThat(tables.isEmpty()).isTrue());
    }

    @Test
    void emptyInputYieldsNoComponents() {
        assertThat(builder.collect(List.of())).isEmpty();
        assertThat(builder.collect(null)).isEmpty();
    }
}
