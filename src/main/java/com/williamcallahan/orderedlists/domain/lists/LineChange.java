package com.williamcallahan.orderedlists.domain.lists;

import java.util.List;

/**
 * One edit to a document of lines.
 *
 * <p>Line numbers refer to the document as it stands after every earlier change of the same
 * {@link ListEditPlan} has been applied.</p>
 */
public sealed interface LineChange permits LineInsertion, LineDeletion, LineRewrite {

    /**
     * Returns the zero-based line this change targets.
     *
     * @return line index
     */
    int lineNumber();

    /**
     * Applies this change to a mutable list of lines.
     *
     * @param lines document lines, modified in place
     */
    void applyTo(List<String> lines);
}
