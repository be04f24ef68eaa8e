package com.williamcallahan.orderedlists.domain.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Verifies rendering and copy helpers of classified lines.
 */
class MarkerLineTest {

    @Test
    void lineText_rendersEachSeparatorForm() {
        assertEquals("\tb) text",
                new MarkerLine(ListType.ALPHABETICAL, "\t", "b", ListSeparator.PARENTHESIS, " text").lineText());
        assertEquals("(iv) text",
                new MarkerLine(ListType.ROMAN, "", "iv", ListSeparator.DOUBLE_PARENTHESIS, " text").lineText());
        assertEquals("12. text",
                new MarkerLine(ListType.NUMBERED, "", "12", ListSeparator.DOT, " text").lineText());
    }

    @Test
    void lineText_bulletOmitsSeparator() {
        MarkerLine bullet = new MarkerLine(ListType.UNORDERED, "    ", "-", ListSeparator.DOT, " item");

        assertEquals("    - item", bullet.lineText());
        assertEquals(5, bullet.prefixLength());
    }

    @Test
    void prefixLength_coversIndentationAndMarker() {
        assertEquals(3, new MarkerLine(ListType.ALPHABETICAL, "\t", "b", ListSeparator.DOT, " x").prefixLength());
        assertEquals(4, new MarkerLine(ListType.ROMAN, "", "iv", ListSeparator.DOUBLE_PARENTHESIS, " x").prefixLength());
    }

    @Test
    void letterCase_tracksMarkerCase() {
        assertEquals(LetterCase.UPPER, line("AB").letterCase());
        assertEquals(LetterCase.LOWER, line("ab").letterCase());
        assertEquals(LetterCase.NONE, new MarkerLine(ListType.NUMBERED, "", "12", ListSeparator.DOT, " x").letterCase());
    }

    @Test
    void applyCaseStyle_followsThisLine() {
        assertEquals("D", line("C").applyCaseStyle("d"));
        assertEquals("aa", line("z").applyCaseStyle("AA"));
    }

    @Test
    void hasBlankContent_detectsWhitespaceOnlyContent() {
        assertTrue(line("a").withContent(" ").hasBlankContent());
        assertTrue(line("a").withContent("   \t").hasBlankContent());
        assertFalse(line("a").hasBlankContent());
    }

    @Test
    void constructor_rejectsEmptyMarker() {
        assertThrows(IllegalArgumentException.class,
                () -> new MarkerLine(ListType.ALPHABETICAL, "", "", ListSeparator.DOT, " x"));
    }

    @Test
    void indentationEdits_moveOneLevel() {
        MarkerLine nested = line("a").increaseIndentation();

        assertEquals("\ta. text", nested.lineText());
        assertEquals(1, nested.indentationLevel());
        assertEquals("a. text", nested.decreaseIndentation().lineText());
        assertThrows(IndentationUnderflowException.class, () -> line("a").decreaseIndentation());
    }

    private static MarkerLine line(String marker) {
        return new MarkerLine(ListType.ALPHABETICAL, "", marker, ListSeparator.DOT, " text");
    }
}
