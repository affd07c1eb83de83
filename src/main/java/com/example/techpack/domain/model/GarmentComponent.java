package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Component of the strict technical table. Declaration order is the canonical output order.
 * {@link #YOKE} only exists here; the item-level output folds it into {@link Section#ASSEMBLY}.
 */
public enum GarmentComponent {
    ASSEMBLY("Assembly"),
    COLLAR("Collar"),
    SLEEVE("Sleeve"),
    CUFF("Cuff"),
    FRONT("Front"),
    BACK("Back"),
    YOKE("Yoke"),
    POCKET("Pocket");

    private final String displayName;

    GarmentComponent(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return title-case name written to the {@code component} field
     */
    @JsonValue
    public String displayName() {
        return displayName;
    }
}
