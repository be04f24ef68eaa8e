package com.williamcallahan.orderedlists.domain.lists;

import java.util.Objects;

/**
 * Result of an editing operation: either a complete plan or a rejection with no changes.
 */
public sealed interface ListEditOutcome permits ListEditOutcome.Applied, ListEditOutcome.Rejected {

    /**
     * Returns whether the caller should apply a plan.
     *
     * @return true for {@link Applied}
     */
    boolean isApplied();

    /**
     * The operation succeeded; every change must be applied together.
     *
     * @param plan changes to apply
     */
    record Applied(ListEditPlan plan) implements ListEditOutcome {
        public Applied {
            Objects.requireNonNull(plan, "Plan cannot be null");
        }

        @Override
        public boolean isApplied() {
            return true;
        }
    }

    /**
     * The operation failed; the document must be left unmodified.
     *
     * @param reason rejection category
     * @param message diagnostic message
     */
    record Rejected(RejectionReason reason, String message) implements ListEditOutcome {
        public Rejected {
            Objects.requireNonNull(reason, "Rejection reason cannot be null");
            Objects.requireNonNull(message, "Rejection message cannot be null");
        }

        @Override
        public boolean isApplied() {
            return false;
        }
    }

    static ListEditOutcome applied(ListEditPlan plan) {
        return new Applied(plan);
    }

    static ListEditOutcome rejected(RejectionReason reason, String message) {
        return new Rejected(reason, message);
    }
}
