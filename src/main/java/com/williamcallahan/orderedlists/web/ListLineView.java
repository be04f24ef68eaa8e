package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.lists.ListEntry;
import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import java.util.OptionalInt;

/**
 * One classified list line in API responses.
 *
 * @param lineNumber zero-based line index
 * @param type numbering system
 * @param level indentation level
 * @param indentation raw leading whitespace
 * @param marker bare marker token
 * @param separator marker separator; {@code null} for bullets
 * @param value decoded marker value; {@code null} for bullets
 * @param content text after the marker
 */
public record ListLineView(
    int lineNumber,
    ListType type,
    int level,
    String indentation,
    String marker,
    ListSeparator separator,
    Integer value,
    String content
) {

    static ListLineView of(ListEntry entry, OptionalInt value) {
        MarkerLine line = entry.line();
        boolean ordered = line.type().isOrdered();
        return new ListLineView(
            entry.lineNumber(),
            line.type(),
            line.indentationLevel(),
            line.indentation(),
            line.marker(),
            ordered ? line.separator() : null,
            value.isPresent() ? value.getAsInt() : null,
            line.content()
        );
    }
}
