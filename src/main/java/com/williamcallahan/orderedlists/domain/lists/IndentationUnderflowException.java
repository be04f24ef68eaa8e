package com.williamcallahan.orderedlists.domain.lists;

/**
 * Signals an attempt to decrease indentation below level 0.
 */
public class IndentationUnderflowException extends IllegalStateException {

    /**
     * Creates an underflow exception for the given indentation text.
     *
     * @param indentation indentation that has no complete level left to remove
     */
    public IndentationUnderflowException(String indentation) {
        super("Cannot decrease indentation below level 0 (indentation '" + visible(indentation) + "')");
    }

    private static String visible(String indentation) {
        return indentation.replace("\t", "\\t");
    }
}
