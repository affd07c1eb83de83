package com.example.techpack.application.parser;

import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.Section;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for both section trackers: keyword driven in item mode, header driven in table mode.
 */
class SectionTrackerTest {

    @Test
    void itemModeStartsInAssemblyAndPersists() {
        SectionTracker tracker = new SectionTracker();

        assertThat(tracker.current()).isEqualTo(Section.ASSEMBLY);
        assertThat(tracker.update("Front placket 3cm")).isEqualTo(Section.FRONT);
        assertThat(tracker.update("Topstitch 1/4\"")).isEqualTo(Section.FRONT);
    }

    @Test
    void frontWithBackMeansBack() {
        SectionTracker tracker = new SectionTracker();

        assertThat(tracker.update("Front and back shoulder seam")).isEqualTo(Section.BACK);
    }

    @Test
    void keywordPrecedenceAndYokeFolding() {
        SectionTracker tracker = new SectionTracker();

        assertThat(tracker.update("Collar and cuff edge")).isEqualTo(Section.COLLAR);
        assertThat(tracker.update("Sleeve cuff opening")).isEqualTo(Section.CUFF);
        assertThat(tracker.update("Back yoke seam")).isEqualTo(Section.ASSEMBLY);
        assertThat(tracker.update("Pocket on sleeve")).isEqualTo(Section.SLEEVE);
    }

    @Test
    void tableModeOnlyMovesOnHeaders() {
        ComponentHeaderTracker tracker = new ComponentHeaderTracker(new TechPackPatterns());

        assertThat(tracker.current()).isEqualTo(GarmentComponent.ASSEMBLY);
        assertThat(tracker.consumeHeader("Sleeve hem 2cm")).isFalse();
        assertThat(tracker.current()).isEqualTo(GarmentComponent.ASSEMBLY);
        assertThat(tracker.consumeHeader("SHORT SLEEVE")).isTrue();
        assertThat(tracker.current()).isEqualTo(GarmentComponent.SLEEVE);
        assertThat(tracker.consumeHeader("Collar stand 3cm")).isFalse();
        assertThat(tracker.current()).isEqualTo(GarmentComponent.SLEEVE);
    }
}
