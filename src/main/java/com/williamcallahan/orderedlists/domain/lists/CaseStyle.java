package com.williamcallahan.orderedlists.domain.lists;

/**
 * Letter cases the marker grammar recognizes.
 */
public enum CaseStyle {
    UPPER,
    LOWER,
    BOTH,
    NONE;

    public boolean hasUppercase() {
        return this == UPPER || this == BOTH;
    }

    public boolean hasLowercase() {
        return this == LOWER || this == BOTH;
    }
}
