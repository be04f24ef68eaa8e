package com.williamcallahan.orderedlists.domain.lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered line changes that carry out one editing operation.
 *
 * @param changes changes in application order
 */
public record ListEditPlan(List<LineChange> changes) {

    public ListEditPlan {
        Objects.requireNonNull(changes, "Changes cannot be null");
        changes = List.copyOf(changes);
    }

    public static ListEditPlan of(List<? extends LineChange> changes) {
        return new ListEditPlan(List.copyOf(changes));
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Applies every change to a copy of the given document.
     *
     * @param lines current document lines
     * @return document lines after the plan
     */
    public List<String> applyTo(List<String> lines) {
        List<String> result = new ArrayList<>(lines);
        for (LineChange change : changes) {
            change.applyTo(result);
        }
        return result;
    }
}
