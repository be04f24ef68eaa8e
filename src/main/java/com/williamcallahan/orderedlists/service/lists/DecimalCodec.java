package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;

/**
 * Arabic numerals: {@code 1, 2, 3 ...}.
 */
final class DecimalCodec implements NumeralCodec {

    @Override
    public ListType listType() {
        return ListType.NUMBERED;
    }

    @Override
    public int decode(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new MarkerCodecException(listType(), "Numbered marker cannot be empty");
        }
        for (int index = 0; index < marker.length(); index++) {
            char digit = marker.charAt(index);
            if (digit < '0' || digit > '9') {
                throw new MarkerCodecException(listType(), "Invalid digit in numbered marker '" + marker + "'");
            }
        }
        int value;
        try {
            value = Integer.parseInt(marker);
        } catch (NumberFormatException overflow) {
            throw new MarkerCodecException(listType(), "Numbered marker '" + marker + "' overflows");
        }
        if (value < 1) {
            throw new MarkerCodecException(listType(), "Numbered marker '" + marker + "' must be at least 1");
        }
        return value;
    }

    @Override
    public String encode(int value) {
        if (value < 1) {
            throw new MarkerCodecException(listType(), "Numbered value out of range: " + value);
        }
        return Integer.toString(value);
    }
}
