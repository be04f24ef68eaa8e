package com.williamcallahan.orderedlists.domain.lists;

import java.util.Optional;

/**
 * Separators that may follow (or surround) an ordered list marker.
 */
public enum ListSeparator {
    /** {@code a.} */
    DOT("."),
    /** {@code a)} */
    PARENTHESIS(")"),
    /** {@code (a)} */
    DOUBLE_PARENTHESIS("()");

    private final String symbol;

    ListSeparator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Wraps a bare marker with this separator.
     *
     * @param marker bare marker token
     * @return marker text as it appears in a line
     */
    public String decorate(String marker) {
        if (this == DOUBLE_PARENTHESIS) {
            return "(" + marker + ")";
        }
        return marker + symbol;
    }

    /**
     * Resolves the separator for a single trailing character.
     *
     * @param character character following the marker
     * @return matching separator, or empty for anything other than {@code .} and {@code )}
     */
    public static Optional<ListSeparator> fromTrailingChar(char character) {
        return switch (character) {
            case '.' -> Optional.of(DOT);
            case ')' -> Optional.of(PARENTHESIS);
            default -> Optional.empty();
        };
    }
}
