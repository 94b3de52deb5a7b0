package com.audico.pricelist.util;

import java.util.Locale;

/**
 * Text canonicalization shared by fingerprinting and search.
 *
 * <p>Normalization is lossy: it lowercases, drops every character that is
 * not an ASCII letter, digit or whitespace, and collapses whitespace runs. "AVR-X1800H",
 * "avr x1800h" and "AVR_X1800H" all end up in the same neighbourhood.
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    /**
     * Returns the normalized form of {@code input}; {@code null} becomes "".
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Convert non-breaking spaces to regular spaces</li>
     *   <li>Lowercase (root locale)</li>
     *   <li>Remove everything except a-z, 0-9 and whitespace</li>
     *   <li>Collapse whitespace and trim</li>
     * </ol>
     */
    public static String normalize(String input) {
        if (input == null) return "";
        String s = input.replace('\u00A0', ' ').toLowerCase(Locale.ROOT);
        s = s.replaceAll("[^a-z0-9\\s]", "");
        return s.replaceAll("\\s+", " ").trim();
    }

    /** Normalized form with all whitespace removed. */
    public static String compact(String input) {
        return normalize(input).replace(" ", "");
    }

    /** True for null, empty or whitespace-only (including non-breaking spaces). */
    public static boolean isBlank(String input) {
        return input == null || input.replace('\u00A0', ' ').isBlank();
    }
}
