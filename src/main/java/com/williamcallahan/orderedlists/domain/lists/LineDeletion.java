package com.williamcallahan.orderedlists.domain.lists;

import java.util.List;

/**
 * Removes one line; the lines after it move up by one.
 *
 * @param lineNumber zero-based line index
 */
public record LineDeletion(int lineNumber) implements LineChange {

    public LineDeletion {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must be non-negative");
        }
    }

    @Override
    public void applyTo(List<String> lines) {
        lines.remove(lineNumber);
    }
}
