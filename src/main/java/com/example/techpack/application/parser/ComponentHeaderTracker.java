package com.example.techpack.application.parser;

import com.example.techpack.domain.model.GarmentComponent;

import java.util.Optional;

/**
 * Table-mode tracker of the current component. Only isolated heading lines move it, so a
 * narrative line mentioning another part in passing never drags rows into the wrong component.
 * One instance per table pass.
 */
final class ComponentHeaderTracker {

    private final TechPackPatterns patterns;
    private GarmentComponent current = GarmentComponent.ASSEMBLY;

    ComponentHeaderTracker(TechPackPatterns patterns) {
        this.patterns = patterns;
    }

    /**
     * Switches component when the line is a section heading.
     *
     * @param line trimmed line
     * @return {@code true} when the line was a heading and must not be classified
     */
    boolean consumeHeader(String line) {
        Optional<GarmentComponent> heading = patterns.matchSectionHeader(line);
        heading.ifPresent(component -> current = component);
        return heading.isPresent();
    }

    GarmentComponent current() {
        return current;
    }
}
