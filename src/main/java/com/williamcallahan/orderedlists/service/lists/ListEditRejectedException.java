package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.RejectionReason;

/**
 * Raised when an edit cannot be carried out because of the list's structure.
 */
public class ListEditRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public ListEditRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
