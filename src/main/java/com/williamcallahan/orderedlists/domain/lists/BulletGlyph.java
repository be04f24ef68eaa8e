package com.williamcallahan.orderedlists.domain.lists;

import java.util.Optional;

/**
 * Bullet characters recognized as unordered list markers.
 */
public enum BulletGlyph {
    ASTERISK('*'),
    DASH('-'),
    PLUS('+');

    private final char markerChar;

    BulletGlyph(char markerChar) {
        this.markerChar = markerChar;
    }

    /**
     * Resolves a bare marker token to its bullet glyph.
     *
     * @param marker marker token
     * @return glyph when the token is exactly one bullet character
     */
    public static Optional<BulletGlyph> fromMarker(String marker) {
        if (marker == null || marker.length() != 1) {
            return Optional.empty();
        }
        char candidate = marker.charAt(0);
        for (BulletGlyph glyph : values()) {
            if (glyph.markerChar == candidate) {
                return Optional.of(glyph);
            }
        }
        return Optional.empty();
    }
}
