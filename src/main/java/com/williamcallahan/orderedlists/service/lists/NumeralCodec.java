package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import java.util.OptionalInt;

/**
 * Converts between a marker token and its ordinal value for one numbering system.
 *
 * <p>Letter codecs decode case-insensitively and always encode lowercase; case is applied
 * separately from the marker being continued.</p>
 */
public interface NumeralCodec {

    /**
     * Returns the numbering system handled by this codec.
     *
     * @return list type
     */
    ListType listType();

    /**
     * Decodes a marker to its value.
     *
     * @param marker bare marker token
     * @return value, at least 1
     * @throws MarkerCodecException when the marker is empty, malformed or out of range
     */
    int decode(String marker);

    /**
     * Encodes a value to its canonical lowercase marker.
     *
     * @param value ordinal value
     * @return marker token
     * @throws MarkerCodecException when the value is outside the system's range
     */
    String encode(int value);

    /**
     * Decodes a marker without signalling failure through an exception.
     *
     * @param marker bare marker token
     * @return value, or empty when the marker does not decode
     */
    default OptionalInt tryDecode(String marker) {
        try {
            return OptionalInt.of(decode(marker));
        } catch (MarkerCodecException invalidMarker) {
            return OptionalInt.empty();
        }
    }

    default boolean canDecode(String marker) {
        return tryDecode(marker).isPresent();
    }
}
