package com.williamcallahan.orderedlists.domain.lists;

import java.util.Objects;

/**
 * A single classified list line.
 *
 * <p>Rendering with {@link #lineText()} reproduces the source line exactly: indentation, marker,
 * separator, then content. Unordered lines render their bullet glyph with no separator; their
 * {@code separator} is always {@link ListSeparator#DOT} and carries no meaning.</p>
 *
 * @param type numbering system of the marker
 * @param indentation raw leading whitespace
 * @param marker bare marker token without separator or parentheses
 * @param separator separator following or surrounding the marker
 * @param content text after the marker, including its leading space
 */
public record MarkerLine(
        ListType type,
        String indentation,
        String marker,
        ListSeparator separator,
        String content) {

    public MarkerLine {
        Objects.requireNonNull(type, "List type cannot be null");
        Objects.requireNonNull(indentation, "Indentation cannot be null");
        Objects.requireNonNull(separator, "Separator cannot be null");
        Objects.requireNonNull(content, "Content cannot be null");
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException("Marker cannot be null or empty");
        }
    }

    /**
     * Renders the line back to text.
     *
     * @return indentation, marker with separator, and content
     */
    public String lineText() {
        if (type == ListType.UNORDERED) {
            return indentation + marker + content;
        }
        return indentation + separator.decorate(marker) + content;
    }

    /**
     * Returns the length of everything before the content.
     *
     * @return prefix length in characters
     */
    public int prefixLength() {
        return lineText().length() - content.length();
    }

    public int indentationLevel() {
        return Indentation.levelOf(indentation);
    }

    public LetterCase letterCase() {
        return LetterCase.of(marker);
    }

    /**
     * Re-cases a generated marker to match this line's marker.
     *
     * @param generatedMarker marker produced by a codec
     * @return marker in this line's case
     */
    public String applyCaseStyle(String generatedMarker) {
        return letterCase().apply(generatedMarker);
    }

    /**
     * Returns whether the content holds anything besides whitespace.
     *
     * @return true when the content is blank
     */
    public boolean hasBlankContent() {
        return content.isBlank();
    }

    public MarkerLine withType(ListType newType) {
        return new MarkerLine(newType, indentation, marker, separator, content);
    }

    public MarkerLine withIndentation(String newIndentation) {
        return new MarkerLine(type, newIndentation, marker, separator, content);
    }

    public MarkerLine withMarker(String newMarker) {
        return new MarkerLine(type, indentation, newMarker, separator, content);
    }

    public MarkerLine withSeparator(ListSeparator newSeparator) {
        return new MarkerLine(type, indentation, marker, newSeparator, content);
    }

    public MarkerLine withContent(String newContent) {
        return new MarkerLine(type, indentation, marker, separator, newContent);
    }

    /**
     * Returns this line one level deeper.
     *
     * @return line with a tab prepended to its indentation
     */
    public MarkerLine increaseIndentation() {
        return withIndentation(Indentation.increase(indentation));
    }

    /**
     * Returns this line one level shallower.
     *
     * @return line with one level removed from its indentation
     * @throws IndentationUnderflowException when the line is already at level 0
     */
    public MarkerLine decreaseIndentation() {
        return withIndentation(Indentation.decrease(indentation));
    }
}
