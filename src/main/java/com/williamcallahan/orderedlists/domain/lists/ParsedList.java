package com.williamcallahan.orderedlists.domain.lists;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A maximal, contiguous, validly nested run of classified list lines.
 *
 * @param entries lines in document order; line numbers increase by exactly one
 */
public record ParsedList(List<ListEntry> entries) {

    public ParsedList {
        Objects.requireNonNull(entries, "Entries cannot be null");
        entries = List.copyOf(entries);
        for (int index = 1; index < entries.size(); index++) {
            int previous = entries.get(index - 1).lineNumber();
            if (entries.get(index).lineNumber() != previous + 1) {
                throw new IllegalArgumentException(
                        "Parsed list lines must be contiguous, found " + previous + " then "
                                + entries.get(index).lineNumber());
            }
        }
    }

    public static ParsedList empty() {
        return new ParsedList(List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the first line number of the list.
     *
     * @return zero-based line index
     * @throws IllegalStateException when the list is empty
     */
    public int firstLineNumber() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Empty list has no first line");
        }
        return entries.get(0).lineNumber();
    }

    /**
     * Returns the last line number of the list.
     *
     * @return zero-based line index
     * @throws IllegalStateException when the list is empty
     */
    public int lastLineNumber() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Empty list has no last line");
        }
        return entries.get(entries.size() - 1).lineNumber();
    }

    public boolean containsLine(int lineNumber) {
        return !entries.isEmpty() && lineNumber >= firstLineNumber() && lineNumber <= lastLineNumber();
    }

    /**
     * Looks up the entry for a document line.
     *
     * @param lineNumber zero-based line index
     * @return entry when the line belongs to this list
     */
    public Optional<ListEntry> entryAt(int lineNumber) {
        if (!containsLine(lineNumber)) {
            return Optional.empty();
        }
        return Optional.of(entries.get(lineNumber - firstLineNumber()));
    }

    /**
     * Returns the classified lines without their positions.
     *
     * @return lines in document order
     */
    public List<MarkerLine> lines() {
        return entries.stream().map(ListEntry::line).toList();
    }
}
