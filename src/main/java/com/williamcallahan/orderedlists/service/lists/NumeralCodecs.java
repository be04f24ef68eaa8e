package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;

/**
 * Selects the codec for a numbering system.
 *
 * <p>Single-letter alphabetical lists always count bijectively; the nested mode only changes how
 * multi-letter markers are read and written.</p>
 */
public final class NumeralCodecs {

    private static final NumeralCodec ALPHABETICAL = new AlphabeticalCodec(ListType.ALPHABETICAL);
    private static final NumeralCodec NESTED_BIJECTIVE = new AlphabeticalCodec(ListType.NESTED_ALPHABETICAL);
    private static final NumeralCodec NESTED_REPEATED = new RepeatedLettersCodec();
    private static final NumeralCodec ROMAN = new RomanNumeralCodec();
    private static final NumeralCodec DECIMAL = new DecimalCodec();

    private NumeralCodecs() {}

    /**
     * Returns the codec for a list type under the configured nested mode.
     *
     * @param type ordered list type
     * @param nestedMode encoding used for multi-letter markers
     * @return codec for the type
     * @throws MarkerCodecException for unordered lists, or nested lists while nesting is disabled
     */
    public static NumeralCodec forType(ListType type, NestedAlphabeticalMode nestedMode) {
        return switch (type) {
            case ALPHABETICAL -> ALPHABETICAL;
            case ROMAN -> ROMAN;
            case NUMBERED -> DECIMAL;
            case NESTED_ALPHABETICAL -> switch (nestedMode) {
                case BIJECTIVE -> NESTED_BIJECTIVE;
                case REPEATED -> NESTED_REPEATED;
                case DISABLED -> throw new MarkerCodecException(type, "Nested alphabetical lists are disabled");
            };
            case UNORDERED -> throw new MarkerCodecException(type, "Unordered lists carry no value");
        };
    }

    /**
     * Checks whether text is a canonical roman numeral between 1 and 3999.
     *
     * @param marker candidate marker, any case
     * @return true when the structure is valid
     */
    public static boolean isRomanNumeral(String marker) {
        return RomanNumeralCodec.isWellFormed(marker);
    }
}
