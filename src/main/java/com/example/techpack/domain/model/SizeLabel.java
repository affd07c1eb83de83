package com.example.techpack.domain.model;

import java.util.Locale;

/**
 * Size columns of the grading table, in column order.
 */
public enum SizeLabel {
    XS("XS"),
    S("S"),
    M("M"),
    L("L"),
    XL("XL"),
    XXL("2XL"),
    XXXL("3XL");

    private final String label;

    SizeLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a size token as written in the document.
     *
     * @param token raw token such as {@code xl} or {@code 2XL}
     * @return matching size or {@code null} when the token is not a size label
     */
    public static SizeLabel fromLabel(String token) {
        if (token == null) {
            return null;
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (SizeLabel size : values()) {
            if (size.label.equals(normalized)) {
                return size;
            }
        }
        return null;
    }
}
