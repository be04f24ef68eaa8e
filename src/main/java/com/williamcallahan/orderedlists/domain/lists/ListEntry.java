package com.williamcallahan.orderedlists.domain.lists;

import java.util.Objects;

/**
 * A classified line together with its zero-based position in the document.
 *
 * @param lineNumber zero-based line index
 * @param line classified line
 */
public record ListEntry(int lineNumber, MarkerLine line) {

    public ListEntry {
        Objects.requireNonNull(line, "Marker line cannot be null");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must be non-negative");
        }
    }

    /**
     * Returns the same line moved to another position.
     *
     * @param newLineNumber zero-based line index
     * @return relocated entry
     */
    public ListEntry atLine(int newLineNumber) {
        return new ListEntry(newLineNumber, line);
    }
}
