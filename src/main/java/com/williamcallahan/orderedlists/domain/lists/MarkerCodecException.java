package com.williamcallahan.orderedlists.domain.lists;

/**
 * Signals a marker that cannot be decoded, or a value that cannot be encoded, under a numbering system.
 */
public class MarkerCodecException extends IllegalArgumentException {

    private final ListType listType;

    /**
     * Creates a codec exception for the given system.
     *
     * @param listType numbering system that rejected the input
     * @param message failure summary
     */
    public MarkerCodecException(ListType listType, String message) {
        super(message);
        this.listType = listType;
    }

    /**
     * Returns the numbering system that rejected the input.
     *
     * @return list type
     */
    public ListType getListType() {
        return listType;
    }
}
