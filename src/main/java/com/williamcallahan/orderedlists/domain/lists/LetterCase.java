package com.williamcallahan.orderedlists.domain.lists;

import java.util.Locale;

/**
 * Presentation case of a single marker, tracked apart from its value.
 */
public enum LetterCase {
    UPPER,
    LOWER,
    /** Markers without letters: digits and bullet glyphs. */
    NONE;

    /**
     * Detects the case of a marker token.
     *
     * @param marker bare marker token
     * @return {@link #NONE} when the marker holds no letters
     */
    public static LetterCase of(String marker) {
        boolean sawLetter = false;
        boolean allUpper = true;
        boolean allLower = true;
        for (int index = 0; index < marker.length(); index++) {
            char character = marker.charAt(index);
            if (!Character.isLetter(character)) {
                continue;
            }
            sawLetter = true;
            allUpper &= Character.isUpperCase(character);
            allLower &= Character.isLowerCase(character);
        }
        if (!sawLetter) {
            return NONE;
        }
        if (allUpper) {
            return UPPER;
        }
        return allLower ? LOWER : NONE;
    }

    /**
     * Re-cases a generated marker to this case; {@link #NONE} leaves it untouched.
     *
     * @param marker generated marker
     * @return re-cased marker
     */
    public String apply(String marker) {
        return switch (this) {
            case UPPER -> marker.toUpperCase(Locale.ROOT);
            case LOWER -> marker.toLowerCase(Locale.ROOT);
            case NONE -> marker;
        };
    }
}
