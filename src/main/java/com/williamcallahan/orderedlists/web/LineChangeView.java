package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.lists.LineChange;
import com.williamcallahan.orderedlists.domain.lists.LineDeletion;
import com.williamcallahan.orderedlists.domain.lists.LineInsertion;
import com.williamcallahan.orderedlists.domain.lists.LineRewrite;

/**
 * One line change in API responses.
 *
 * @param kind {@code insert}, {@code delete} or {@code rewrite}
 * @param line target line, counted after the earlier changes
 * @param text new line text; {@code null} for deletions
 */
public record LineChangeView(String kind, int line, String text) {

    static LineChangeView of(LineChange change) {
        if (change instanceof LineInsertion insertion) {
            return new LineChangeView("insert", insertion.lineNumber(), insertion.text());
        }
        if (change instanceof LineDeletion deletion) {
            return new LineChangeView("delete", deletion.lineNumber(), null);
        }
        LineRewrite rewrite = (LineRewrite) change;
        return new LineChangeView("rewrite", rewrite.lineNumber(), rewrite.text());
    }
}
