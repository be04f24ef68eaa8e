package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.Indentation;

/**
 * A line split into its marker parts by the grammar, before classification.
 *
 * @param indentation raw leading whitespace
 * @param marker bare marker token, or the bullet glyph
 * @param separator separator as written; {@link ListSeparator#DOT} for bullets
 * @param content text after the marker including the single leading space
 * @param bullet whether the line used the bullet shape
 */
public record MarkerMatch(
        String indentation,
        String marker,
        ListSeparator separator,
        String content,
        boolean bullet) {

    /**
     * Rebuilds the match of an already classified line.
     *
     * @param line classified line
     * @return match with the same parts
     */
    public static MarkerMatch of(MarkerLine line) {
        return new MarkerMatch(line.indentation(), line.marker(), line.separator(), line.content(),
                line.type() == ListType.UNORDERED);
    }

    public int indentationLevel() {
        return Indentation.levelOf(indentation);
    }

    MarkerLine toLine(ListType type) {
        return new MarkerLine(type, indentation, marker, separator, content);
    }
}
