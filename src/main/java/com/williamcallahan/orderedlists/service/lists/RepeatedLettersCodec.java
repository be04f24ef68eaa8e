package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import java.util.Locale;

/**
 * Repeated-letter numeration: {@code a ... z, aa, bb ... zz, aaa ...}.
 *
 * <p>Every marker is a run of one letter. A run of length {@code L} of the letter at position
 * {@code p} (1-26) has value {@code 26 * (L - 1) + p}.</p>
 */
final class RepeatedLettersCodec implements NumeralCodec {

    /** Longest run accepted in either direction. */
    static final int MAX_RUN_LENGTH = 10;

    @Override
    public ListType listType() {
        return ListType.NESTED_ALPHABETICAL;
    }

    @Override
    public int decode(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new MarkerCodecException(listType(), "Repeated letters marker cannot be empty");
        }
        String lowerMarker = marker.toLowerCase(Locale.ROOT);
        char firstLetter = lowerMarker.charAt(0);
        for (int index = 1; index < lowerMarker.length(); index++) {
            if (lowerMarker.charAt(index) != firstLetter) {
                throw new MarkerCodecException(listType(),
                        "Repeated letters mode requires all letters to be the same, but found '" + marker + "'");
            }
        }
        int letterPosition = AlphabeticalCodec.letterValue(firstLetter);
        if (letterPosition < 1) {
            throw new MarkerCodecException(listType(),
                    "Out of bounds letter in repeated letters marker '" + marker + "'");
        }
        if (lowerMarker.length() > MAX_RUN_LENGTH) {
            throw new MarkerCodecException(listType(),
                    "Repeated letters marker '" + marker + "' is longer than " + MAX_RUN_LENGTH);
        }
        return baseValue(lowerMarker.length()) + letterPosition;
    }

    @Override
    public String encode(int value) {
        if (value < 1) {
            throw new MarkerCodecException(listType(), "Repeated letters value out of range: " + value);
        }
        int runLength = (value - 1) / AlphabeticalCodec.ALPHABET_SIZE + 1;
        if (runLength > MAX_RUN_LENGTH) {
            throw new MarkerCodecException(listType(), "Value " + value + " too large for repeated letters mode");
        }
        int letterPosition = value - baseValue(runLength);
        char letter = (char) ('a' + letterPosition - 1);
        return String.valueOf(letter).repeat(runLength);
    }

    private static int baseValue(int runLength) {
        return AlphabeticalCodec.ALPHABET_SIZE * (runLength - 1);
    }
}
