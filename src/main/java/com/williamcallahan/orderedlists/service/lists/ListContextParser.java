package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListEntry;
import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the lists in a range of lines.
 *
 * <p>Each line is matched by the grammar, classified against its sibling and admitted only if its
 * indentation is at most one level deeper than the deepest open level. Unindented bullets and
 * unindented {@code 1.}/{@code 1)} lines never start a list; those belong to ordinary markdown.
 * Lines are kept exactly as written; correcting markers is the resequencer's job.</p>
 */
public final class ListContextParser {

    private final MarkerGrammar grammar;
    private final MarkerClassifier classifier;

    public ListContextParser(MarkerGrammar grammar, MarkerClassifier classifier) {
        this.grammar = grammar;
        this.classifier = classifier;
    }

    /**
     * Returns every list in {@code [from, toExclusive)}, in document order.
     *
     * @param lines document lines
     * @param from first line index to scan
     * @param toExclusive index after the last line to scan
     * @return disjoint lists, possibly none
     */
    public List<ParsedList> parse(List<String> lines, int from, int toExclusive) {
        checkRange(lines, from, toExclusive);
        List<ParsedList> lists = new ArrayList<>();
        int cursor = from;
        while (cursor < toExclusive) {
            ParsedList list = parseFrom(lines, cursor, toExclusive);
            if (list.isEmpty()) {
                cursor++;
            } else {
                lists.add(list);
                cursor = list.lastLineNumber() + 1;
            }
        }
        return lists;
    }

    /**
     * Parses the list that starts exactly at {@code start}.
     *
     * @param lines document lines
     * @param start index of the first line
     * @param toExclusive index after the last line the list may cover
     * @return the list, or an empty list when no list starts at {@code start}
     */
    public ParsedList parseFrom(List<String> lines, int start, int toExclusive) {
        checkRange(lines, start, toExclusive);
        ContextStack stack = new ContextStack();
        List<ListEntry> entries = new ArrayList<>();
        for (int lineNumber = start; lineNumber < toExclusive; lineNumber++) {
            Optional<MarkerLine> admitted = admitLine(stack, lines.get(lineNumber));
            if (admitted.isEmpty()) {
                break;
            }
            stack.put(admitted.get().indentationLevel(), admitted.get());
            entries.add(new ListEntry(lineNumber, admitted.get()));
        }
        return new ParsedList(entries);
    }

    /**
     * Finds the list a line belongs to.
     *
     * <p>Walks up and down from the target over list-shaped lines, then parses that run and keeps
     * the list that covers the target.</p>
     *
     * @param lines document lines
     * @param target line index
     * @return the list holding the target, or empty
     */
    public Optional<ParsedList> findListContaining(List<String> lines, int target) {
        if (target < 0 || target >= lines.size() || !grammar.matches(lines.get(target))) {
            return Optional.empty();
        }
        int runStart = target;
        while (runStart > 0 && grammar.matches(lines.get(runStart - 1))) {
            runStart--;
        }
        int runEnd = target + 1;
        while (runEnd < lines.size() && grammar.matches(lines.get(runEnd))) {
            runEnd++;
        }
        return parse(lines, runStart, runEnd).stream()
                .filter(list -> list.containsLine(target))
                .findFirst();
    }

    /**
     * Matches a raw line and classifies it against the open contexts.
     *
     * @param stack contexts seen so far in this scan
     * @param lineText raw line
     * @return the classified line, or empty when the line is not list-shaped or ends the list
     */
    Optional<MarkerLine> admitLine(ContextStack stack, String lineText) {
        return grammar.match(lineText).flatMap(match -> admit(stack, match));
    }

    /**
     * Classifies a matched line against the open contexts.
     *
     * <p>Deeper contexts are discarded from the stack as a side effect; the caller records the
     * returned line with {@link ContextStack#put}.</p>
     *
     * @param stack contexts seen so far in this scan
     * @param match grammar match of the next line
     * @return the classified line, or empty when the line ends the list
     */
    Optional<MarkerLine> admit(ContextStack stack, MarkerMatch match) {
        int level = match.indentationLevel();
        if (!stack.canEnter(level)) {
            return Optional.empty();
        }
        stack.truncateTo(level);
        Optional<MarkerLine> sibling = stack.siblingAt(level);
        Optional<MarkerLine> parent = stack.parentOf(level);

        Optional<ListType> type = classifier.classify(match.marker(), sibling.orElse(null));
        if (type.isEmpty()) {
            return Optional.empty();
        }
        if (level > 0 && sibling.isEmpty() && parent.isEmpty()) {
            return Optional.empty();
        }
        if (level == 0 && sibling.isEmpty() && isHostOwned(type.get(), match.separator())) {
            return Optional.empty();
        }
        return Optional.of(match.toLine(type.get()));
    }

    private static boolean isHostOwned(ListType type, ListSeparator separator) {
        if (type == ListType.UNORDERED) {
            return true;
        }
        return type == ListType.NUMBERED && separator != ListSeparator.DOUBLE_PARENTHESIS;
    }

    private static void checkRange(List<String> lines, int from, int toExclusive) {
        if (from < 0 || toExclusive > lines.size() || from > toExclusive) {
            throw new IllegalArgumentException(
                    "Invalid line range [" + from + ", " + toExclusive + ") for " + lines.size() + " lines");
        }
    }
}
