package com.williamcallahan.orderedlists.domain.lists;

/**
 * Quantizes leading whitespace into nesting levels.
 *
 * <p>Each tab is one level. Each complete run of four spaces is one level; a trailing group of
 * fewer than four spaces adds nothing but is kept verbatim when a level is removed.</p>
 */
public final class Indentation {

    /** Number of spaces forming one level. */
    public static final int SPACES_PER_LEVEL = 4;

    private static final char TAB = '\t';
    private static final char SPACE = ' ';

    private Indentation() {}

    /**
     * Computes the nesting level of an indentation string.
     *
     * @param indentation leading whitespace
     * @return level, never negative
     */
    public static int levelOf(String indentation) {
        int level = 0;
        int cursor = 0;
        while (cursor < indentation.length()) {
            char character = indentation.charAt(cursor);
            if (character == TAB) {
                level++;
                cursor++;
                continue;
            }
            if (character == SPACE) {
                int runLength = 0;
                while (cursor < indentation.length() && indentation.charAt(cursor) == SPACE) {
                    runLength++;
                    cursor++;
                }
                level += runLength / SPACES_PER_LEVEL;
                continue;
            }
            cursor++;
        }
        return level;
    }

    /**
     * Adds one level by prepending a tab.
     *
     * @param indentation current indentation
     * @return indentation one level deeper
     */
    public static String increase(String indentation) {
        return TAB + indentation;
    }

    /**
     * Removes one level from the end of the indentation: one tab, or four spaces.
     *
     * <p>Trailing spaces that do not form a complete level are set aside before the level is
     * removed and appended again afterwards.</p>
     *
     * @param indentation current indentation
     * @return indentation one level shallower
     * @throws IndentationUnderflowException when the indentation is already at level 0
     */
    public static String decrease(String indentation) {
        if (levelOf(indentation) == 0) {
            throw new IndentationUnderflowException(indentation);
        }
        int trailingSpaces = 0;
        for (int index = indentation.length() - 1; index >= 0 && indentation.charAt(index) == SPACE; index--) {
            trailingSpaces++;
        }
        int partialSpaces = trailingSpaces % SPACES_PER_LEVEL;
        String remaining = indentation.substring(0, indentation.length() - partialSpaces);

        if (remaining.endsWith(String.valueOf(TAB))) {
            remaining = remaining.substring(0, remaining.length() - 1);
        } else if (trailingSpaces >= SPACES_PER_LEVEL) {
            remaining = remaining.substring(0, remaining.length() - SPACES_PER_LEVEL);
        } else {
            throw new IndentationUnderflowException(indentation);
        }
        return remaining + " ".repeat(partialSpaces);
    }
}
