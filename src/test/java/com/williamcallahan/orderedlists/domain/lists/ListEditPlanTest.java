package com.williamcallahan.orderedlists.domain.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that plan changes apply in order against the evolving document.
 */
class ListEditPlanTest {

    @Test
    void applyTo_insertionShiftsLaterRewrites() {
        ListEditPlan plan = ListEditPlan.of(List.of(
                new LineRewrite(0, "a. head"),
                new LineInsertion(1, "b. tail"),
                new LineRewrite(2, "c. next")));

        List<String> result = plan.applyTo(List.of("a. head tail", "b. next"));

        assertEquals(List.of("a. head", "b. tail", "c. next"), result);
    }

    @Test
    void applyTo_deletionShiftsLaterRewrites() {
        ListEditPlan plan = ListEditPlan.of(List.of(new LineDeletion(1), new LineRewrite(1, "b. z")));

        assertEquals(List.of("a. x", "b. z"), plan.applyTo(List.of("a. x", "b. y", "c. z")));
    }

    @Test
    void applyTo_leavesInputUntouched() {
        List<String> source = List.of("a. x");

        ListEditPlan.of(List.of(new LineRewrite(0, "b. x"))).applyTo(source);

        assertEquals(List.of("a. x"), source);
    }

    @Test
    void parsedList_rejectsGapsBetweenLines() {
        MarkerLine line = new MarkerLine(ListType.ALPHABETICAL, "", "a", ListSeparator.DOT, " x");

        assertThrows(IllegalArgumentException.class,
                () -> new ParsedList(List.of(new ListEntry(0, line), new ListEntry(2, line))));
    }
}
