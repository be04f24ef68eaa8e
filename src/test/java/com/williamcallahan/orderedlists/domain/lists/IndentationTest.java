package com.williamcallahan.orderedlists.domain.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Verifies whitespace quantization and level edits.
 */
class IndentationTest {

    @Test
    void levelOf_tabAndFourSpaces_reportSameLevel() {
        assertEquals(1, Indentation.levelOf("\t"));
        assertEquals(1, Indentation.levelOf("    "));
    }

    @Test
    void levelOf_partialSpaceGroups_contributeNothing() {
        assertEquals(0, Indentation.levelOf(""));
        assertEquals(0, Indentation.levelOf("   "));
        assertEquals(1, Indentation.levelOf("     "));
        assertEquals(1, Indentation.levelOf("  \t"));
    }

    @Test
    void levelOf_mixedTabsAndSpaces_addsLevels() {
        assertEquals(2, Indentation.levelOf("\t    "));
        assertEquals(2, Indentation.levelOf("        "));
        assertEquals(3, Indentation.levelOf("\t\t    "));
    }

    @Test
    void increase_prependsTab() {
        assertEquals("\t", Indentation.increase(""));
        assertEquals("\t  ", Indentation.increase("  "));
    }

    @Test
    void decrease_removesOneTabOrFourSpaces() {
        assertEquals("", Indentation.decrease("\t"));
        assertEquals("", Indentation.decrease("    "));
        assertEquals("\t", Indentation.decrease("\t\t"));
        assertEquals("\t", Indentation.decrease("\t    "));
    }

    @Test
    void decrease_keepsResidualSpaces() {
        assertEquals(" ", Indentation.decrease("     "));
        assertEquals("  ", Indentation.decrease("\t  "));
    }

    @Test
    void decrease_atLevelZero_isRejected() {
        assertThrows(IndentationUnderflowException.class, () -> Indentation.decrease(""));
        assertThrows(IndentationUnderflowException.class, () -> Indentation.decrease("   "));
    }
}
