package com.williamcallahan.orderedlists.domain.lists;

import java.util.List;
import java.util.Objects;

/**
 * Inserts a new line so that it becomes line {@code lineNumber}.
 *
 * @param lineNumber zero-based index the inserted line will occupy
 * @param text inserted line text
 */
public record LineInsertion(int lineNumber, String text) implements LineChange {

    public LineInsertion {
        Objects.requireNonNull(text, "Inserted text cannot be null");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must be non-negative");
        }
    }

    @Override
    public void applyTo(List<String> lines) {
        lines.add(lineNumber, text);
    }
}
