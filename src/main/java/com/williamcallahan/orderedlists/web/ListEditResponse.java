package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import com.williamcallahan.orderedlists.domain.lists.RejectionReason;
import java.util.List;

/**
 * Response for the editing endpoints.
 *
 * @param status {@code applied} or {@code rejected}
 * @param reason rejection category, or {@code null}
 * @param message rejection message, or {@code null}
 * @param changes changes to apply in order; empty when rejected
 * @param lines document after the changes; unchanged when rejected
 */
public record ListEditResponse(
    String status,
    RejectionReason reason,
    String message,
    List<LineChangeView> changes,
    List<String> lines
) {

    static ListEditResponse of(ListEditOutcome outcome, List<String> lines) {
        if (outcome instanceof ListEditOutcome.Applied applied) {
            List<LineChangeView> changes = applied.plan().changes().stream().map(LineChangeView::of).toList();
            return new ListEditResponse("applied", null, null, changes, applied.plan().applyTo(lines));
        }
        ListEditOutcome.Rejected rejected = (ListEditOutcome.Rejected) outcome;
        return new ListEditResponse("rejected", rejected.reason(), rejected.message(), List.of(), lines);
    }
}
