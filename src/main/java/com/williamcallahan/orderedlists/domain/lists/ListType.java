package com.williamcallahan.orderedlists.domain.lists;

/**
 * Numbering systems a list marker can belong to.
 *
 * <p>The first four systems are ordered and map a positive value to a canonical marker.
 * {@link #UNORDERED} carries no value, only a {@link BulletGlyph}.</p>
 */
public enum ListType {
    ALPHABETICAL,
    ROMAN,
    NESTED_ALPHABETICAL,
    NUMBERED,
    UNORDERED;

    /**
     * Returns whether markers of this system carry an ordinal value.
     *
     * @return true for every system except {@link #UNORDERED}
     */
    public boolean isOrdered() {
        return this != UNORDERED;
    }
}
