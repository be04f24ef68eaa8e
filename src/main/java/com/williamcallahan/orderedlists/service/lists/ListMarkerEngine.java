package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.IndentationUnderflowException;
import com.williamcallahan.orderedlists.domain.lists.LineChange;
import com.williamcallahan.orderedlists.domain.lists.LineDeletion;
import com.williamcallahan.orderedlists.domain.lists.LineInsertion;
import com.williamcallahan.orderedlists.domain.lists.LineRewrite;
import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import com.williamcallahan.orderedlists.domain.lists.ListEditPlan;
import com.williamcallahan.orderedlists.domain.lists.ListEntry;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import com.williamcallahan.orderedlists.domain.lists.RejectionReason;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsing and editing operations for one settings value.
 *
 * <p>Instances hold only immutable collaborators and may be shared between threads. Every edit
 * either returns a complete {@link ListEditPlan} or a rejection that changes nothing.</p>
 */
public final class ListMarkerEngine {

    private static final Logger logger = LoggerFactory.getLogger(ListMarkerEngine.class);

    private final MarkerSettings settings;
    private final ListContextParser parser;
    private final MarkerSequence sequence;
    private final ListResequencer resequencer;

    public ListMarkerEngine(MarkerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Marker settings cannot be null");
        this.parser = new ListContextParser(new MarkerGrammar(settings), new MarkerClassifier(settings));
        this.sequence = new MarkerSequence(settings);
        this.resequencer = new ListResequencer(parser, sequence);
    }

    public MarkerSettings settings() {
        return settings;
    }

    public List<ParsedList> parse(List<String> lines) {
        return parse(lines, 0, lines.size());
    }

    /**
     * Finds every list in a range of lines.
     *
     * @param lines document lines
     * @param from first line index
     * @param toExclusive index after the last line
     * @return disjoint lists in document order
     */
    public List<ParsedList> parse(List<String> lines, int from, int toExclusive) {
        List<ParsedList> lists = parser.parse(lines, from, toExclusive);
        logger.debug("Parsed {} list(s) from lines [{}, {})", lists.size(), from, toExclusive);
        return lists;
    }

    public Optional<ParsedList> findListContaining(List<String> lines, int target) {
        return parser.findListContaining(lines, target);
    }

    /**
     * Decodes the value of a classified line.
     *
     * @param line classified line
     * @return value, or empty for bullets and undecodable markers
     */
    public OptionalInt valueOf(MarkerLine line) {
        if (!line.type().isOrdered()) {
            return OptionalInt.empty();
        }
        return NumeralCodecs.forType(line.type(), settings.nestedAlphabeticalMode()).tryDecode(line.marker());
    }

    /**
     * Replaces the content of a list line and repairs the markers from that line on.
     *
     * @param list list holding the line
     * @param lineNumber line index
     * @param newContent content after the marker
     * @return outcome with the rewrites to apply
     */
    public ListEditOutcome resequence(ParsedList list, int lineNumber, String newContent) {
        return attempt("resequence", lineNumber, () -> {
            MarkerLine current = list.entryAt(lineNumber)
                    .orElseThrow(() -> notAListLine(lineNumber))
                    .line();
            MarkerLine edited = current.withContent(normalizeContent(newContent));
            return ListEditPlan.of(resequencer.resequence(list, lineNumber, edited));
        });
    }

    public ListEditOutcome editContent(List<String> lines, int lineNumber, String newContent) {
        return attempt("edit", lineNumber, () -> {
            Located located = locate(lines, lineNumber);
            MarkerLine edited = located.line().withContent(normalizeContent(newContent));
            return ListEditPlan.of(resequencer.resequence(lines, located.list(), lineNumber, edited));
        });
    }

    /**
     * Handles Enter on a list line.
     *
     * <p>With content, the text after {@code splitColumn} moves to a new line carrying the next
     * marker. The column may sit right after the marker, which moves the whole content. On a line with blank content the line is outdented, or cleared at level 0 so the
     * list ends.</p>
     *
     * @param lines document lines
     * @param lineNumber line holding the cursor
     * @param splitColumn cursor column within the line
     * @return outcome with the changes to apply
     */
    public ListEditOutcome continueList(List<String> lines, int lineNumber, int splitColumn) {
        return attempt("continue", lineNumber, () -> {
            Located located = locate(lines, lineNumber);
            MarkerLine line = located.line();
            String text = line.lineText();
            int column = Math.min(splitColumn, text.length());
            if (column < line.prefixLength()) {
                throw new ListEditRejectedException(RejectionReason.CURSOR_INSIDE_MARKER,
                        "Column " + splitColumn + " is inside the marker of line " + lineNumber);
            }

            if (line.hasBlankContent()) {
                if (line.indentationLevel() == 0) {
                    return ListEditPlan.of(List.of(new LineRewrite(lineNumber, "")));
                }
                return ListEditPlan.of(resequencer.resequence(lines, located.list(), lineNumber,
                        line.decreaseIndentation()));
            }

            String headContent = text.substring(line.prefixLength(), column);
            MarkerLine head = line.withContent(headContent.isEmpty() ? " " : headContent);
            String tail = text.substring(column);
            MarkerLine inserted = sequence.successor(head, line.withContent(" " + tail.stripLeading()));

            List<ListEntry> shifted = new ArrayList<>();
            for (ListEntry entry : located.list().entries()) {
                if (entry.lineNumber() < lineNumber) {
                    shifted.add(entry);
                } else if (entry.lineNumber() == lineNumber) {
                    shifted.add(new ListEntry(lineNumber, head));
                    shifted.add(new ListEntry(lineNumber + 1, inserted));
                } else {
                    shifted.add(entry.atLine(entry.lineNumber() + 1));
                }
            }

            List<String> document = new ArrayList<>(lines);
            document.set(lineNumber, head.lineText());
            document.add(lineNumber + 1, inserted.lineText());

            List<LineChange> changes = new ArrayList<>();
            if (!head.lineText().equals(text)) {
                changes.add(new LineRewrite(lineNumber, head.lineText()));
            }
            changes.add(new LineInsertion(lineNumber + 1, inserted.lineText()));
            changes.addAll(resequencer.resequence(document, new ParsedList(shifted), lineNumber + 1, inserted));
            return ListEditPlan.of(changes);
        });
    }

    public ListEditOutcome indent(List<String> lines, int lineNumber) {
        return attempt("indent", lineNumber, () -> {
            Located located = locate(lines, lineNumber);
            return ListEditPlan.of(resequencer.resequence(lines, located.list(), lineNumber,
                    located.line().increaseIndentation()));
        });
    }

    public ListEditOutcome outdent(List<String> lines, int lineNumber) {
        return attempt("outdent", lineNumber, () -> {
            Located located = locate(lines, lineNumber);
            return ListEditPlan.of(resequencer.resequence(lines, located.list(), lineNumber,
                    located.line().decreaseIndentation()));
        });
    }

    /**
     * Deletes a list line and repairs the lines that followed it.
     *
     * <p>When the first line of a list is removed, the next line at the same level takes over its
     * marker so the list keeps its starting point. Children of the removed line that sit before
     * that line lose their parent and drop out of the list.</p>
     *
     * @param lines document lines
     * @param lineNumber line to delete
     * @return outcome with the deletion and rewrites to apply
     */
    public ListEditOutcome removeLine(List<String> lines, int lineNumber) {
        return attempt("remove", lineNumber, () -> {
            Located located = locate(lines, lineNumber);
            MarkerLine removed = located.line();

            List<ListEntry> remaining = new ArrayList<>();
            for (ListEntry entry : located.list().entries()) {
                if (entry.lineNumber() < lineNumber) {
                    remaining.add(entry);
                } else if (entry.lineNumber() > lineNumber) {
                    remaining.add(entry.atLine(entry.lineNumber() - 1));
                }
            }
            List<String> document = new ArrayList<>(lines);
            document.remove(lineNumber);

            List<LineChange> changes = new ArrayList<>();
            changes.add(new LineDeletion(lineNumber));

            int resumeLine = lineNumber;
            if (lineNumber == located.list().firstLineNumber()) {
                int followerIndex = indexOfFollower(remaining, removed.indentationLevel());
                if (followerIndex >= 0) {
                    remaining = new ArrayList<>(remaining.subList(followerIndex, remaining.size()));
                    ListEntry follower = remaining.get(0);
                    resumeLine = follower.lineNumber();
                    if (follower.line().type().isOrdered() == removed.type().isOrdered()) {
                        MarkerLine takeover = follower.line().withType(removed.type())
                                .withMarker(removed.marker())
                                .withSeparator(removed.separator());
                        remaining.set(0, new ListEntry(resumeLine, takeover));
                        if (!takeover.lineText().equals(follower.line().lineText())) {
                            changes.add(new LineRewrite(resumeLine, takeover.lineText()));
                            document.set(resumeLine, takeover.lineText());
                        }
                    }
                }
            }

            if (!remaining.isEmpty()) {
                changes.addAll(resequencer.resequenceFrom(document, new ParsedList(remaining), resumeLine));
            }
            return ListEditPlan.of(changes);
        });
    }

    private static int indexOfFollower(List<ListEntry> entries, int level) {
        for (int index = 0; index < entries.size(); index++) {
            int entryLevel = entries.get(index).line().indentationLevel();
            if (entryLevel == level) {
                return index;
            }
            if (entryLevel < level) {
                return -1;
            }
        }
        return -1;
    }

    private ListEditOutcome attempt(String operation, int lineNumber, Supplier<ListEditPlan> planner) {
        try {
            ListEditPlan plan = planner.get();
            logger.debug("{} on line {} produced {} change(s)", operation, lineNumber, plan.changes().size());
            return ListEditOutcome.applied(plan);
        } catch (ListEditRejectedException rejected) {
            return reject(operation, lineNumber, rejected.getReason(), rejected.getMessage());
        } catch (MarkerCodecException codecFailure) {
            return reject(operation, lineNumber, RejectionReason.CODEC_RANGE,
                    codecFailure.getListType() + ": " + codecFailure.getMessage());
        } catch (IndentationUnderflowException underflow) {
            return reject(operation, lineNumber, RejectionReason.INDENTATION_UNDERFLOW, underflow.getMessage());
        }
    }

    private static ListEditOutcome reject(String operation, int lineNumber, RejectionReason reason, String message) {
        logger.debug("{} on line {} rejected ({}): {}", operation, lineNumber, reason, message);
        return ListEditOutcome.rejected(reason, message);
    }

    private Located locate(List<String> lines, int lineNumber) {
        Objects.requireNonNull(lines, "Lines cannot be null");
        return findListContaining(lines, lineNumber)
                .flatMap(list -> list.entryAt(lineNumber).map(entry -> new Located(list, entry.line())))
                .orElseThrow(() -> notAListLine(lineNumber));
    }

    private static ListEditRejectedException notAListLine(int lineNumber) {
        return new ListEditRejectedException(RejectionReason.NOT_A_LIST_LINE,
                "Line " + lineNumber + " is not part of a list");
    }

    private static String normalizeContent(String content) {
        if (content == null || content.isEmpty()) {
            return " ";
        }
        return content.startsWith(" ") ? content : " " + content;
    }

    private record Located(ParsedList list, MarkerLine line) {}
}
