package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * A parsed list in API responses.
 *
 * @param firstLine index of the first line
 * @param lastLine index of the last line
 * @param lines classified lines
 */
public record ParsedListView(
    int firstLine,
    int lastLine,
    List<ListLineView> lines
) {

    static ParsedListView of(ParsedList list, Function<MarkerLine, OptionalInt> valueOf) {
        List<ListLineView> lines = list.entries().stream()
            .map(entry -> ListLineView.of(entry, valueOf.apply(entry.line())))
            .toList();
        return new ParsedListView(list.firstLineNumber(), list.lastLineNumber(), lines);
    }
}
