package com.williamcallahan.orderedlists.domain.lists;

/**
 * Numeral encoding used for multi-letter (nested alphabetical) markers.
 */
public enum NestedAlphabeticalMode {
    /** Multi-letter markers are not a list system of their own. */
    DISABLED,
    /** {@code aa, ab, ac ... az, ba}: bijective base-26. */
    BIJECTIVE,
    /** {@code aa, bb, cc ... zz, aaa}: one run of a single repeated letter per value. */
    REPEATED;

    public boolean isEnabled() {
        return this != DISABLED;
    }
}
