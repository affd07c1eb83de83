package com.example.techpack.application.parser;

import com.example.techpack.domain.model.Section;

import java.util.Locale;

/**
 * Item-mode tracker of the current garment section. Any keyword occurrence in a line moves the
 * section; the value persists across lines until new evidence appears.
 * One instance per classification pass.
 */
final class SectionTracker {

    private Section current = Section.ASSEMBLY;

    /**
     * Updates the current section from the keywords of a line.
     * Precedence: collar, cuff, sleeve, pocket, yoke (folded into assembly), front unless the
     * line also mentions back, back.
     *
     * @param line trimmed line
     * @return the section in effect for this line
     */
    Section update(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("collar")) {
            current = Section.COLLAR;
        } else if (lower.contains("cuff")) {
            current = Section.CUFF;
        } else if (lower.contains("sleeve")) {
            current = Section.SLEEVE;
        } else if (lower.contains("pocket")) {
            current = Section.POCKET;
        } else if (lower.contains("yoke")) {
            current = Section.ASSEMBLY;
        } else if (lower.contains("front") && !lower.contains("back")) {
            current = Section.FRONT;
        } else if (lower.contains("back")) {
            current = Section.BACK;
        }
        return current;
    }

    Section current() {
        return current;
    }
}
