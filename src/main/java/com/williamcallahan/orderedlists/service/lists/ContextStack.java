package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Most recent line per indentation level during one scan. Slot {@code i} holds level {@code i};
 * the stack only ever grows by one level at a time.
 */
final class ContextStack {

    private final List<MarkerLine> levels = new ArrayList<>();

    int depth() {
        return levels.size();
    }

    /**
     * Returns whether a line at the level can be placed without skipping a level.
     *
     * @param level indentation level of the incoming line
     * @return true when the level is at most one deeper than the deepest known level
     */
    boolean canEnter(int level) {
        return level >= 0 && level <= levels.size();
    }

    /**
     * Drops every context deeper than the level.
     *
     * @param level level that stays in scope
     */
    void truncateTo(int level) {
        while (levels.size() > level + 1) {
            levels.remove(levels.size() - 1);
        }
    }

    Optional<MarkerLine> siblingAt(int level) {
        if (level < 0 || level >= levels.size()) {
            return Optional.empty();
        }
        return Optional.of(levels.get(level));
    }

    Optional<MarkerLine> parentOf(int level) {
        return siblingAt(level - 1);
    }

    /**
     * Records a line as the context of its level.
     *
     * @param level level of the line
     * @param line classified line
     */
    void put(int level, MarkerLine line) {
        if (!canEnter(level)) {
            throw new IllegalStateException("Cannot enter level " + level + " from depth " + levels.size());
        }
        truncateTo(level);
        if (level == levels.size()) {
            levels.add(line);
        } else {
            levels.set(level, line);
        }
    }
}
