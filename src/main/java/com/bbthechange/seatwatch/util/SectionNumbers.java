package com.bbthechange.seatwatch.util;

import java.util.Locale;

/**
 * Normalization for section numbers and the other identity fields of a tracked section.
 */
public final class SectionNumbers {

    private static final int SECTION_WIDTH = 2;

    private SectionNumbers() {
    }

    /**
     * Left-pads a section number with zeros to two characters ("2" becomes "02").
     * Values already two or more characters long are returned unchanged; null is treated as empty.
     */
    public static String normalizeSection(String section) {
        String value = section == null ? "" : section.trim();
        if (value.length() >= SECTION_WIDTH) {
            return value;
        }
        return "0".repeat(SECTION_WIDTH - value.length()) + value;
    }

    public static String normalizeSubject(String subject) {
        return subject == null ? null : subject.trim().toUpperCase(Locale.ROOT);
    }
}
