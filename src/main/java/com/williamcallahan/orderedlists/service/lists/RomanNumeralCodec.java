package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Roman numerals from {@code i} (1) to {@code mmmcmxcix} (3999).
 *
 * <p>{@link #decode} sums symbols right to left and subtracts a symbol smaller than the one
 * after it. It accepts some malformed strings such as {@code iiii}; {@link #isWellFormed} is the
 * authority on whether text is a roman numeral at all.</p>
 */
final class RomanNumeralCodec implements NumeralCodec {

    static final int MAX_VALUE = 3999;

    private static final Pattern WELL_FORMED =
            Pattern.compile("m{0,3}(cm|cd|d?c{0,3})(xc|xl|l?x{0,3})(ix|iv|v?i{0,3})");

    private static final int[] VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] NUMERALS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    @Override
    public ListType listType() {
        return ListType.ROMAN;
    }

    /**
     * Checks the structure of a roman numeral, case-insensitively.
     *
     * @param marker candidate marker
     * @return true only for canonical numerals between 1 and 3999
     */
    static boolean isWellFormed(String marker) {
        if (marker == null || marker.isEmpty()) {
            return false;
        }
        return WELL_FORMED.matcher(marker.toLowerCase(Locale.ROOT)).matches();
    }

    @Override
    public int decode(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new MarkerCodecException(listType(), "Roman marker cannot be empty");
        }
        String roman = marker.toLowerCase(Locale.ROOT);
        int value = 0;
        int previousSymbol = 0;
        for (int index = roman.length() - 1; index >= 0; index--) {
            int symbol = symbolValue(roman.charAt(index));
            if (symbol == 0) {
                throw new MarkerCodecException(listType(), "Invalid roman numeral found in marker '" + marker + "'");
            }
            if (symbol < previousSymbol) {
                value -= symbol;
            } else {
                value += symbol;
            }
            previousSymbol = symbol;
            if (value > MAX_VALUE * 2) {
                throw new MarkerCodecException(listType(), "Roman marker '" + marker + "' is out of range");
            }
        }
        if (value < 1 || value > MAX_VALUE) {
            throw new MarkerCodecException(listType(), "Roman marker '" + marker + "' is out of range: " + value);
        }
        return value;
    }

    @Override
    public String encode(int value) {
        if (value < 1 || value > MAX_VALUE) {
            throw new MarkerCodecException(listType(), "Roman value out of range: " + value);
        }
        StringBuilder numeral = new StringBuilder();
        int remaining = value;
        for (int index = 0; index < VALUES.length; index++) {
            while (remaining >= VALUES[index]) {
                numeral.append(NUMERALS[index]);
                remaining -= VALUES[index];
            }
        }
        return numeral.toString();
    }

    private static int symbolValue(char symbol) {
        return switch (symbol) {
            case 'i' -> 1;
            case 'v' -> 5;
            case 'x' -> 10;
            case 'l' -> 50;
            case 'c' -> 100;
            case 'd' -> 500;
            case 'm' -> 1000;
            default -> 0;
        };
    }
}
