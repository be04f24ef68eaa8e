package com.williamcallahan.orderedlists.domain.lists;

import java.util.List;
import java.util.Objects;

/**
 * Replaces the text of one line.
 *
 * @param lineNumber zero-based line index
 * @param text new line text
 */
public record LineRewrite(int lineNumber, String text) implements LineChange {

    public LineRewrite {
        Objects.requireNonNull(text, "Rewrite text cannot be null");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must be non-negative");
        }
    }

    @Override
    public void applyTo(List<String> lines) {
        lines.set(lineNumber, text);
    }
}
