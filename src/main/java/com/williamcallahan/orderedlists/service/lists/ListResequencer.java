package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.LineRewrite;
import com.williamcallahan.orderedlists.domain.lists.ListEntry;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import com.williamcallahan.orderedlists.domain.lists.RejectionReason;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes markers from an edit point to the end of a list.
 *
 * <p>Lines before the edit point are taken as they are and seed the context stack. The edited line
 * becomes the successor of its sibling, or the first marker under its parent. Every later line
 * that has a sibling becomes that sibling's successor; a later line opening a level keeps its own
 * marker. The walk uses the same admission rules as parsing and stops at the first line that would
 * not parse under the corrected contexts. When a document is given, the walk goes on past the
 * list's last line, since a repaired list can absorb lines that used to end it. Only lines whose
 * text changes are returned.</p>
 */
public final class ListResequencer {

    private final ListContextParser parser;
    private final MarkerSequence sequence;

    public ListResequencer(ListContextParser parser, MarkerSequence sequence) {
        this.parser = parser;
        this.sequence = sequence;
    }

    public List<LineRewrite> resequence(ParsedList list, int editedLineNumber, MarkerLine editedLine) {
        return resequence(List.of(), list, editedLineNumber, editedLine);
    }

    /**
     * Replaces one line of a list and repairs it and every line after it.
     *
     * @param document document lines after any insertion or deletion, used to follow the list
     *                 past its last entry; may be empty
     * @param list list holding the edited line, numbered against {@code document}
     * @param editedLineNumber line index of the edit
     * @param editedLine new state of the line; its marker is recomputed
     * @return rewrites in document order
     * @throws ListEditRejectedException when the edited line skips a level or has no context
     * @throws MarkerCodecException when a successor cannot be encoded
     */
    public List<LineRewrite> resequence(List<String> document, ParsedList list, int editedLineNumber,
                                        MarkerLine editedLine) {
        if (!list.containsLine(editedLineNumber)) {
            throw new ListEditRejectedException(RejectionReason.NOT_A_LIST_LINE,
                    "Line " + editedLineNumber + " is not part of the list");
        }
        return walk(document, list, editedLineNumber, editedLine);
    }

    public List<LineRewrite> resequenceFrom(ParsedList list, int firstLineNumber) {
        return resequenceFrom(List.of(), list, firstLineNumber);
    }

    /**
     * Repairs every line from {@code firstLineNumber} on, without forcing any line.
     *
     * @param document document lines the list is numbered against; may be empty
     * @param list list to repair
     * @param firstLineNumber first line index to recompute
     * @return rewrites in document order
     * @throws MarkerCodecException when a successor cannot be encoded
     */
    public List<LineRewrite> resequenceFrom(List<String> document, ParsedList list, int firstLineNumber) {
        return walk(document, list, firstLineNumber, null);
    }

    private List<LineRewrite> walk(List<String> document, ParsedList list, int fromLineNumber,
                                   MarkerLine forcedLine) {
        ContextStack stack = new ContextStack();
        List<LineRewrite> rewrites = new ArrayList<>();
        for (ListEntry entry : list.entries()) {
            MarkerLine current = entry.line();
            if (entry.lineNumber() < fromLineNumber) {
                stack.put(current.indentationLevel(), current);
                continue;
            }

            MarkerLine rebuilt;
            if (forcedLine != null && entry.lineNumber() == fromLineNumber) {
                rebuilt = rebuildEdited(stack, entry.lineNumber(), forcedLine);
            } else {
                Optional<MarkerLine> admitted = parser.admit(stack, MarkerMatch.of(current));
                if (admitted.isEmpty()) {
                    return rewrites;
                }
                rebuilt = continueSibling(stack, admitted.get());
            }
            record(stack, rewrites, entry.lineNumber(), current.lineText(), rebuilt);
        }

        int lineNumber = list.isEmpty() ? document.size() : list.lastLineNumber() + 1;
        for (; lineNumber < document.size(); lineNumber++) {
            String text = document.get(lineNumber);
            Optional<MarkerLine> admitted = parser.admitLine(stack, text);
            if (admitted.isEmpty()) {
                break;
            }
            record(stack, rewrites, lineNumber, text, continueSibling(stack, admitted.get()));
        }
        return rewrites;
    }

    private static void record(ContextStack stack, List<LineRewrite> rewrites, int lineNumber, String currentText,
                               MarkerLine rebuilt) {
        stack.put(rebuilt.indentationLevel(), rebuilt);
        String rebuiltText = rebuilt.lineText();
        if (!rebuiltText.equals(currentText)) {
            rewrites.add(new LineRewrite(lineNumber, rebuiltText));
        }
    }

    private MarkerLine rebuildEdited(ContextStack stack, int lineNumber, MarkerLine editedLine) {
        int level = editedLine.indentationLevel();
        if (!stack.canEnter(level)) {
            throw new ListEditRejectedException(RejectionReason.INDENTATION_JUMP,
                    "Line " + lineNumber + " would skip from depth " + stack.depth() + " to level " + level);
        }
        stack.truncateTo(level);
        Optional<MarkerLine> sibling = stack.siblingAt(level);
        if (sibling.isPresent()) {
            return sequence.successor(sibling.get(), editedLine);
        }
        Optional<MarkerLine> parent = stack.parentOf(level);
        if (parent.isPresent()) {
            return sequence.firstMarker(parent.get(), editedLine);
        }
        if (level == 0) {
            return editedLine;
        }
        throw new ListEditRejectedException(RejectionReason.NO_CONTEXT,
                "No sibling or parent found to determine the marker of line " + lineNumber);
    }

    private MarkerLine continueSibling(ContextStack stack, MarkerLine line) {
        return stack.siblingAt(line.indentationLevel())
                .map(sibling -> sequence.successor(sibling, line))
                .orElse(line);
    }
}
