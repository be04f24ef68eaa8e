package com.williamcallahan.orderedlists.service.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.orderedlists.domain.lists.LineChange;
import com.williamcallahan.orderedlists.domain.lists.LineDeletion;
import com.williamcallahan.orderedlists.domain.lists.LineInsertion;
import com.williamcallahan.orderedlists.domain.lists.LineRewrite;
import com.williamcallahan.orderedlists.domain.lists.ListEditPlan;
import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import com.williamcallahan.orderedlists.domain.lists.RejectionReason;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/**
 * Verifies the editing operations end to end on document lines.
 */
class ListMarkerEngineTest {

    private final ListMarkerEngine engine = new ListMarkerEngine(MarkerSettings.defaults());

    @Test
    void continueList_atEndOfLine_insertsNextMarker() {
        List<String> lines = List.of("a. first");

        ListEditOutcome outcome = engine.continueList(lines, 0, 8);

        assertEquals(List.of(new LineInsertion(1, "b. ")), changes(outcome));
        assertEquals(List.of("a. first", "b. "), applied(outcome).applyTo(lines));
    }

    @Test
    void continueList_midLine_movesTailToNewLine() {
        List<String> lines = List.of("A. hello world");

        ListEditOutcome outcome = engine.continueList(lines, 0, 8);

        assertEquals(List.of(new LineRewrite(0, "A. hello"), new LineInsertion(1, "B. world")), changes(outcome));
    }

    @Test
    void continueList_withFollowers_renumbersThem() {
        List<String> lines = List.of("i. one", "ii. two");

        List<String> result = applied(engine.continueList(lines, 0, 6)).applyTo(lines);

        assertEquals(List.of("i. one", "ii. ", "iii. two"), result);
        assertEquals(1, engine.parse(result).size());
        assertEquals(3, engine.parse(result).get(0).size());
    }

    @Test
    void continueList_cursorInsideMarker_isRejected() {
        assertRejected(RejectionReason.CURSOR_INSIDE_MARKER, engine.continueList(List.of("a. text"), 0, 0));
        assertRejected(RejectionReason.CURSOR_INSIDE_MARKER, engine.continueList(List.of("a. text"), 0, 1));
    }

    @Test
    void continueList_cursorRightAfterMarker_movesWholeContent() {
        List<String> lines = List.of("a. text", "b. more");

        ListEditOutcome outcome = engine.continueList(lines, 0, 2);

        assertEquals(List.of(new LineRewrite(0, "a. "), new LineInsertion(1, "b. text"), new LineRewrite(2, "c. more")),
                changes(outcome));
        assertEquals(List.of("a. ", "b. text", "c. more"), applied(outcome).applyTo(lines));
    }

    @Test
    void continueList_afterZ_startsNestedLetters() {
        ListEditOutcome outcome = engine.continueList(List.of("z. last"), 0, 7);

        assertEquals(List.of(new LineInsertion(1, "aa. ")), changes(outcome));
    }

    @Test
    void continueList_afterZ_nestedDisabled_isRejected() {
        ListMarkerEngine flat = new ListMarkerEngine(
                MarkerSettings.defaults().withNestedAlphabeticalMode(NestedAlphabeticalMode.DISABLED));

        assertRejected(RejectionReason.CODEC_RANGE, flat.continueList(List.of("y. a", "z. b"), 1, 4));
    }

    @Test
    void continueList_blankNestedLine_outdents() {
        ListEditOutcome outcome = engine.continueList(List.of("A. x", "\ta. "), 1, 4);

        assertEquals(List.of(new LineRewrite(1, "B. ")), changes(outcome));
    }

    @Test
    void continueList_blankTopLevelLine_endsList() {
        List<String> lines = List.of("a. x", "b. ");

        ListEditOutcome outcome = engine.continueList(lines, 1, 3);

        assertEquals(List.of("a. x", ""), applied(outcome).applyTo(lines));
    }

    @Test
    void continueList_plainLine_isRejected() {
        assertRejected(RejectionReason.NOT_A_LIST_LINE, engine.continueList(List.of("plain"), 0, 3));
    }

    @Test
    void indent_lastLine_startsNestedList() {
        assertEquals(List.of(new LineRewrite(1, "\ta. y")), changes(engine.indent(List.of("a. x", "b. y"), 1)));
    }

    @Test
    void indent_firstLine_isRejectedAndChangesNothing() {
        ListEditOutcome outcome = engine.indent(List.of("A. x", "B. y", "C. z"), 0);

        assertRejected(RejectionReason.INDENTATION_JUMP, outcome);
    }

    @Test
    void indent_withLegalOrdering_usesLevelTable() {
        ListMarkerEngine legal = new ListMarkerEngine(MarkerSettings.defaults().withFirstMarkerOverrideEnabled(true));

        assertEquals(List.of(new LineRewrite(1, "\tI. y")), changes(legal.indent(List.of("A. x", "B. y"), 1)));
    }

    @Test
    void outdent_nestedLine_joinsParentLevel() {
        ListEditOutcome outcome = engine.outdent(List.of("A. x", "\ta. y", "\tb. z"), 1);

        assertEquals(List.of(new LineRewrite(1, "B. y")), changes(outcome));
    }

    @Test
    void outdent_lineEndingList_renumbersLinesItUsedToCutOff() {
        List<String> lines = List.of("a. start", "\tA. t0", "\t\ti. t1", "\t\t1) t2", "\tb) t3");

        List<String> result = applied(engine.outdent(lines, 2)).applyTo(lines);

        assertEquals(List.of("a. start", "\tA. t0", "\tB. t1", "\t\t1) t2", "\tC. t3"), result);
        assertEquals(List.of(), changes(engine.editContent(result, 0, "start")));
    }

    @Test
    void editContent_aboveSublist_keepsSublistSeparator() {
        List<String> lines = List.of("A. x", "B. y", "\ti) p", "\tii) q");

        assertEquals(List.of(new LineRewrite(0, "A. changed")), changes(engine.editContent(lines, 0, "changed")));
    }

    @Test
    void outdent_topLevelLine_isRejected() {
        assertRejected(RejectionReason.INDENTATION_UNDERFLOW, engine.outdent(List.of("a. x"), 0));
    }

    @Test
    void editContent_keepsMarker() {
        assertEquals(List.of(new LineRewrite(1, "b. new")), changes(engine.editContent(List.of("a. x", "b. y"), 1, "new")));
    }

    @Test
    void resequence_parsedList_rewritesContent() {
        ParsedList list = engine.parse(List.of("a. x", "b. y")).get(0);

        assertEquals(List.of(new LineRewrite(1, "b. z")), changes(engine.resequence(list, 1, "z")));
        assertRejected(RejectionReason.NOT_A_LIST_LINE, engine.resequence(list, 4, "z"));
    }

    @Test
    void removeLine_middle_renumbersFollowers() {
        List<String> lines = List.of("a. x", "b. y", "c. z");

        ListEditOutcome outcome = engine.removeLine(lines, 1);

        assertEquals(List.of(new LineDeletion(1), new LineRewrite(1, "b. z")), changes(outcome));
        assertEquals(List.of("a. x", "b. z"), applied(outcome).applyTo(lines));
    }

    @Test
    void removeLine_first_passesStartingMarkerOn() {
        List<String> lines = List.of("b. x", "c. y", "d. z");

        List<String> result = applied(engine.removeLine(lines, 0)).applyTo(lines);

        assertEquals(List.of("b. y", "c. z"), result);
    }

    @Test
    void removeLine_lineEndingList_renumbersLinesItUsedToCutOff() {
        List<String> lines = List.of("a. x", "\ti. y", "\t1) z", "\t5) w");

        ListEditOutcome outcome = engine.removeLine(lines, 1);

        assertEquals(List.of(new LineDeletion(1), new LineRewrite(2, "\t2) w")), changes(outcome));
        List<String> result = applied(outcome).applyTo(lines);
        assertEquals(List.of("a. x", "\t1) z", "\t2) w"), result);
        assertEquals(List.of(), changes(engine.editContent(result, 0, "x")));
    }

    @Test
    void removeLine_firstWithChildren_passesMarkerToNextTopLevelLine() {
        List<String> lines = List.of("a. x", "\ti. child", "b. y", "c. z");

        ListEditOutcome outcome = engine.removeLine(lines, 0);

        assertEquals(List.of(new LineDeletion(0), new LineRewrite(1, "a. y"), new LineRewrite(2, "b. z")),
                changes(outcome));
        assertEquals(List.of("\ti. child", "a. y", "b. z"), applied(outcome).applyTo(lines));
    }

    @Test
    void removeLine_first_keepsSublistSeparator() {
        List<String> lines = List.of("a. x", "b. y", "\t(i) p", "\t(ii) q");

        ListEditOutcome outcome = engine.removeLine(lines, 0);

        assertEquals(List.of(new LineDeletion(0), new LineRewrite(0, "a. y")), changes(outcome));
    }

    @Test
    void removeLine_last_deletesOnly() {
        assertEquals(List.of(new LineDeletion(1)), changes(engine.removeLine(List.of("a. x", "b. y"), 1)));
        assertEquals(List.of(new LineDeletion(0)), changes(engine.removeLine(List.of("a. x"), 0)));
    }

    @Test
    void valueOf_decodesOrderedLinesOnly() {
        assertEquals(OptionalInt.of(3),
                engine.valueOf(new MarkerLine(ListType.ALPHABETICAL, "", "c", ListSeparator.DOT, " x")));
        assertEquals(OptionalInt.empty(),
                engine.valueOf(new MarkerLine(ListType.UNORDERED, "", "-", ListSeparator.DOT, " x")));
    }

    private static List<LineChange> changes(ListEditOutcome outcome) {
        return applied(outcome).changes();
    }

    private static ListEditPlan applied(ListEditOutcome outcome) {
        ListEditOutcome.Applied applied = assertInstanceOf(ListEditOutcome.Applied.class, outcome);
        assertTrue(outcome.isApplied());
        return applied.plan();
    }

    private static void assertRejected(RejectionReason reason, ListEditOutcome outcome) {
        assertFalse(outcome.isApplied());
        assertEquals(reason, assertInstanceOf(ListEditOutcome.Rejected.class, outcome).reason());
    }
}
