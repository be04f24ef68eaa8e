package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import java.util.Locale;

/**
 * Bijective base-26 numeration: {@code a=1 ... z=26, aa=27 ... az=52, ba=53}.
 *
 * <p>There is no zero digit, so encoding reduces with {@code (n - 1) mod 26} rather than a
 * positional base conversion.</p>
 */
final class AlphabeticalCodec implements NumeralCodec {

    static final int ALPHABET_SIZE = 26;

    private final ListType listType;

    AlphabeticalCodec(ListType listType) {
        this.listType = listType;
    }

    @Override
    public ListType listType() {
        return listType;
    }

    @Override
    public int decode(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new MarkerCodecException(listType, "Alphabetical marker cannot be empty");
        }
        String lowerMarker = marker.toLowerCase(Locale.ROOT);
        long value = 0;
        for (int index = 0; index < lowerMarker.length(); index++) {
            int letterValue = letterValue(lowerMarker.charAt(index));
            if (letterValue < 1) {
                throw new MarkerCodecException(listType,
                        "Out of bounds letter in alphabetical marker '" + marker + "'");
            }
            value = value * ALPHABET_SIZE + letterValue;
            if (value > Integer.MAX_VALUE) {
                throw new MarkerCodecException(listType, "Alphabetical marker '" + marker + "' overflows");
            }
        }
        return (int) value;
    }

    @Override
    public String encode(int value) {
        if (value < 1) {
            throw new MarkerCodecException(listType, "Alphabetical value out of range: " + value);
        }
        StringBuilder marker = new StringBuilder();
        int remaining = value;
        while (remaining > 0) {
            remaining--;
            marker.append((char) ('a' + remaining % ALPHABET_SIZE));
            remaining /= ALPHABET_SIZE;
        }
        return marker.reverse().toString();
    }

    static int letterValue(char letter) {
        if (letter < 'a' || letter > 'z') {
            return 0;
        }
        return letter - 'a' + 1;
    }
}
