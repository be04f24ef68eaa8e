package com.williamcallahan.orderedlists.domain.lists;

/**
 * Why an editing operation left the document untouched.
 */
public enum RejectionReason {
    /** The target line is not part of any recognized list. */
    NOT_A_LIST_LINE,
    /** A marker value could not be encoded or decoded under its system. */
    CODEC_RANGE,
    /** The line is already at indentation level 0. */
    INDENTATION_UNDERFLOW,
    /** The line would sit more than one level below the deepest established level. */
    INDENTATION_JUMP,
    /** A nested line has neither a sibling nor a parent to derive its marker from. */
    NO_CONTEXT,
    /** The split position falls inside the marker prefix. */
    CURSOR_INSIDE_MARKER
}
