package com.example.techpack.application.parser;

import com.example.techpack.domain.model.ItemCategory;
import com.example.techpack.domain.model.ItemSource;
import com.example.techpack.domain.model.Relevance;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackItem;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests covering item-mode classification.
 */
class ItemClassifierTest {

    private final TechPackVocabulary vocabulary = TechPackVocabulary.defaults();
    private final ItemClassifier classifier = new ItemClassifier(
            new TechPackPatterns(), new NameResolver(vocabulary), vocabulary);

    @Test
    void emptyInputYieldsEverySectionEmpty() {
        Map<Section, List<TechPackItem>> result = classifier.classify(List.of());

        assertThat(result).containsOnlyKeys(Section.values());
        assertThat(result.values()).allSatisfy(items -> assertThat(items).isEmpty());
    }

    @Test
    void measurementAndStitchGoToTrackedSection() {
        Map<Section, List<TechPackItem>> result = classifier.classify(List.of(
                "Collar stand height 2.5cm",
                "SNLS stitch SPI 12"
        ));

        assertThat(result.get(Section.COLLAR)).containsExactly(
                new TechPackItem(ItemCategory.MEASUREMENT, "collar_stand_height", "2.5cm", ItemSource.EXPLICIT, Relevance.GAUGE),
                new TechPackItem(ItemCategory.STITCH, "collar_stitch_type", "SNLS (SPI 12)", ItemSource.EXPLICIT, Relevance.RISK)
        );
        assertThat(result.get(Section.ASSEMBLY)).isEmpty();
    }

    /**
     * A construction phrase yields the explicit process plus two inferred folder notes.
     */
    @Test
    void constructionPhraseInfersFolderRequirement() {
        List<TechPackItem> sleeve = classifier.classify(List.of("Sleeve hem double fold 1cm")).get(Section.SLEEVE);

        assertThat(sleeve).containsExactly(
                new TechPackItem(ItemCategory.MEASUREMENT, "sleeve_hem_double_fold", "1cm", ItemSource.EXPLICIT, Relevance.GAUGE),
                new TechPackItem(ItemCategory.PROCESS, "sleeve_double_fold", "double fold", ItemSource.EXPLICIT, Relevance.FOLDER),
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "sleeve_folder_requirement",
                        "Likely requires folder for double fold", ItemSource.INFERRED, Relevance.FOLDER),
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "sleeve_double_fold",
                        "Likely requires folder for double fold", ItemSource.INFERRED, Relevance.FOLDER)
        );
    }

    @Test
    void everyConstructionPhraseIsAFolderProcess() {
        List<TechPackItem> collar = classifier.classify(List.of(
                "Collar back tack",
                "Collar raw edge",
                "Collar facing"
        )).get(Section.COLLAR);

        assertThat(collar).filteredOn(item -> item.category() == ItemCategory.PROCESS)
                .extracting(TechPackItem::value, TechPackItem::relevance)
                .containsExactly(
                        tuple("back tack", Relevance.FOLDER),
                        tuple("raw edge", Relevance.FOLDER),
                        tuple("facing", Relevance.FOLDER));
        assertThat(collar).contains(
                new TechPackItem(ItemCategory.PROCESS, "collar_tack", "back tack", ItemSource.EXPLICIT, Relevance.FOLDER));
    }

    /**
     * A folder trigger without a construction phrase is reported as a clean finish.
     */
    @Test
    void bareFolderTriggerFallsBackToCleanFinish() {
        List<TechPackItem> sleeve = classifier.classify(List.of("Sleeve hem 2cm")).get(Section.SLEEVE);

        assertThat(sleeve).containsExactly(
                new TechPackItem(ItemCategory.MEASUREMENT, "sleeve_hem", "2cm", ItemSource.EXPLICIT, Relevance.GAUGE),
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "sleeve_clean_finish",
                        "Likely requires folder for clean finish", ItemSource.INFERRED, Relevance.FOLDER));
    }

    @Test
    void folderTriggerMatchesInsideWords() {
        List<TechPackItem> sleeve = classifier.classify(List.of("Sleeve stitch them together")).get(Section.SLEEVE);

        assertThat(sleeve).containsExactly(
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "sleeve_clean_finish",
                        "Likely requires folder for clean finish", ItemSource.INFERRED, Relevance.FOLDER));
    }

    @Test
    void allowanceWithoutColonAddsSeamSpec() {
        List<TechPackItem> assembly = classifier.classify(List.of("Side seam allowance 1cm")).get(Section.ASSEMBLY);

        assertThat(assembly).containsExactly(
                new TechPackItem(ItemCategory.MEASUREMENT, "assembly_side_seam_allowance", "1cm", ItemSource.EXPLICIT, Relevance.GAUGE),
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "assembly_seam_spec", "1cm", ItemSource.INFERRED, Relevance.GAUGE)
        );
    }

    @Test
    void allowanceWithColonIsOnlyAMeasurement() {
        List<TechPackItem> assembly = classifier.classify(List.of("Seam allowance: 1cm")).get(Section.ASSEMBLY);

        assertThat(assembly).extracting(TechPackItem::name).containsExactly("assembly_seam_allowance");
    }

    @Test
    void marginWithoutMeasurementUsesPlaceholder() {
        List<TechPackItem> assembly = classifier.classify(List.of("Keep margin even")).get(Section.ASSEMBLY);

        assertThat(assembly).containsExactly(
                new TechPackItem(ItemCategory.CONSTRUCTION_NOTE, "assembly_seam_spec", "Margin/allowance specified",
                        ItemSource.INFERRED, Relevance.GAUGE));
    }

    @Test
    void automationPhraseIsExplicit() {
        List<TechPackItem> pocket = classifier.classify(List.of("Pocket setting pneumatic")).get(Section.POCKET);

        assertThat(pocket).containsExactly(
                new TechPackItem(ItemCategory.AUTOMATION, "pocket_automation_type", "pneumatic", ItemSource.EXPLICIT, Relevance.AUTOMATION));
    }

    @Test
    void tracksFrontAndBack() {
        Map<Section, List<TechPackItem>> result = classifier.classify(List.of(
                "Front placket width 3cm",
                "Back pleat depth 2cm"
        ));

        assertThat(result.get(Section.FRONT)).extracting(TechPackItem::name).containsExactly("front_placket_width");
        assertThat(result.get(Section.BACK)).extracting(TechPackItem::name).containsExactly("back_pleat_depth");
    }

    @Test
    void administrativeLinesAndDuplicatesAreSkipped() {
        Map<Section, List<TechPackItem>> result = classifier.classify(List.of(
                "Buyer: ACME 2cm",
                "Page 1 of 3",
                "Collar stand height 2.5cm",
                "collar stand height 2.5CM"
        ));

        assertThat(result.get(Section.COLLAR)).hasSize(1);
        assertThat(result.get(Section.ASSEMBLY)).isEmpty();
    }

    @Test
    void rejectsLayoutArtifactsAsMeasurementLabels() {
        assertThat(classifier.isRelevantMeasurementLabel("")).isFalse();
        assertThat(classifier.isRelevantMeasurementLabel("Front")).isFalse();
        assertThat(classifier.isRelevantMeasurementLabel("x 12 y")).isTrue();
        assertThat(classifier.isRelevantMeasurementLabel("a long sentence that describes the back panel shape")).isFalse();
        assertThat(classifier.isRelevantMeasurementLabel("a long sentence that describes the back panel seam")).isTrue();
    }
}
