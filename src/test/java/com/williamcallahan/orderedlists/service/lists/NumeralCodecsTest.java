package com.williamcallahan.orderedlists.service.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;
import java.util.Locale;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/**
 * Verifies the numeral systems behind list markers.
 */
class NumeralCodecsTest {

    private static final NumeralCodec BIJECTIVE =
            NumeralCodecs.forType(ListType.NESTED_ALPHABETICAL, NestedAlphabeticalMode.BIJECTIVE);
    private static final NumeralCodec REPEATED =
            NumeralCodecs.forType(ListType.NESTED_ALPHABETICAL, NestedAlphabeticalMode.REPEATED);
    private static final NumeralCodec ROMAN = NumeralCodecs.forType(ListType.ROMAN, NestedAlphabeticalMode.BIJECTIVE);
    private static final NumeralCodec DECIMAL =
            NumeralCodecs.forType(ListType.NUMBERED, NestedAlphabeticalMode.BIJECTIVE);

    @Test
    void bijective_decodesWithoutZeroDigit() {
        assertEquals(1, BIJECTIVE.decode("a"));
        assertEquals(26, BIJECTIVE.decode("z"));
        assertEquals(27, BIJECTIVE.decode("aa"));
        assertEquals(52, BIJECTIVE.decode("az"));
        assertEquals(53, BIJECTIVE.decode("ba"));
        assertEquals(702, BIJECTIVE.decode("zz"));
        assertEquals(703, BIJECTIVE.decode("aaa"));
    }

    @Test
    void bijective_encodesCarryAtZ() {
        assertEquals("z", BIJECTIVE.encode(26));
        assertEquals("aa", BIJECTIVE.encode(27));
        assertEquals("az", BIJECTIVE.encode(52));
        assertEquals("ba", BIJECTIVE.encode(53));
        assertEquals("aaa", BIJECTIVE.encode(703));
    }

    @Test
    void bijective_ignoresCaseOnDecode() {
        assertEquals(53, BIJECTIVE.decode("BA"));
    }

    @Test
    void bijective_rejectsNonLettersAndZero() {
        assertThrows(MarkerCodecException.class, () -> BIJECTIVE.decode(""));
        assertThrows(MarkerCodecException.class, () -> BIJECTIVE.decode("a1"));
        assertThrows(MarkerCodecException.class, () -> BIJECTIVE.encode(0));
        assertEquals(OptionalInt.empty(), BIJECTIVE.tryDecode("é"));
    }

    @Test
    void repeated_groupsValuesByRunLength() {
        assertEquals(27, REPEATED.decode("aa"));
        assertEquals(52, REPEATED.decode("zz"));
        assertEquals(53, REPEATED.decode("aaa"));
        assertEquals("aa", REPEATED.encode(27));
        assertEquals("zz", REPEATED.encode(52));
        assertEquals("aaa", REPEATED.encode(53));
    }

    @Test
    void repeated_rejectsMixedLetters() {
        assertThrows(MarkerCodecException.class, () -> REPEATED.decode("ab"));
        assertFalse(REPEATED.canDecode("ab"));
    }

    @Test
    void repeated_capsRunLength() {
        assertEquals("z".repeat(10), REPEATED.encode(260));
        assertThrows(MarkerCodecException.class, () -> REPEATED.encode(261));
        assertThrows(MarkerCodecException.class, () -> REPEATED.decode("a".repeat(11)));
    }

    @Test
    void roman_decodesSubtractivePairs() {
        assertEquals(4, ROMAN.decode("iv"));
        assertEquals(9, ROMAN.decode("ix"));
        assertEquals(1994, ROMAN.decode("mcmxciv"));
        assertEquals(1994, ROMAN.decode("MCMXCIV"));
    }

    @Test
    void roman_validatorRejectsNonCanonicalNumerals() {
        assertFalse(NumeralCodecs.isRomanNumeral("iiii"));
        assertFalse(NumeralCodecs.isRomanNumeral("vx"));
        assertFalse(NumeralCodecs.isRomanNumeral(""));
        assertTrue(NumeralCodecs.isRomanNumeral("MMMCMXCIX"));
        assertTrue(NumeralCodecs.isRomanNumeral("xl"));
    }

    @Test
    void roman_rejectsValuesOutsideRange() {
        assertEquals("mmmcmxcix", ROMAN.encode(3999));
        assertThrows(MarkerCodecException.class, () -> ROMAN.encode(0));
        assertThrows(MarkerCodecException.class, () -> ROMAN.encode(4000));
        assertThrows(MarkerCodecException.class, () -> ROMAN.decode("mmmm"));
        assertThrows(MarkerCodecException.class, () -> ROMAN.decode("ab"));
    }

    @Test
    void decimal_acceptsPositiveIntegersOnly() {
        assertEquals(12, DECIMAL.decode("12"));
        assertEquals("7", DECIMAL.encode(7));
        assertThrows(MarkerCodecException.class, () -> DECIMAL.decode("0"));
        assertThrows(MarkerCodecException.class, () -> DECIMAL.decode("99999999999"));
    }

    @Test
    void encodeThenDecode_returnsValueInEverySystem() {
        NumeralCodec alphabetical = NumeralCodecs.forType(ListType.ALPHABETICAL, NestedAlphabeticalMode.BIJECTIVE);
        for (int value = 1; value <= 26; value++) {
            assertEquals(value, alphabetical.decode(alphabetical.encode(value)));
        }
        for (int value = 1; value <= RomanNumeralCodec.MAX_VALUE; value++) {
            assertEquals(value, ROMAN.decode(ROMAN.encode(value)));
            assertEquals(value, BIJECTIVE.decode(BIJECTIVE.encode(value)));
            assertEquals(value, DECIMAL.decode(DECIMAL.encode(value)));
        }
        for (int value = 1; value <= 26 * RepeatedLettersCodec.MAX_RUN_LENGTH; value++) {
            assertEquals(value, REPEATED.decode(REPEATED.encode(value)));
        }
    }

    @Test
    void decodeThenEncode_returnsMarkerIgnoringCase() {
        assertEquals("xiv", ROMAN.encode(ROMAN.decode("XIV")).toLowerCase(Locale.ROOT));
        assertEquals("ba", BIJECTIVE.encode(BIJECTIVE.decode("BA")));
        assertEquals("ccc", REPEATED.encode(REPEATED.decode("ccc")));
    }

    @Test
    void forType_selectsCodecByNestedMode() {
        assertSame(ListType.NESTED_ALPHABETICAL, REPEATED.listType());
        assertEquals(703, BIJECTIVE.decode("aaa"));
        assertEquals(53, REPEATED.decode("aaa"));
    }

    @Test
    void forType_rejectsSystemsWithoutValues() {
        assertThrows(MarkerCodecException.class,
                () -> NumeralCodecs.forType(ListType.NESTED_ALPHABETICAL, NestedAlphabeticalMode.DISABLED));
        assertThrows(MarkerCodecException.class,
                () -> NumeralCodecs.forType(ListType.UNORDERED, NestedAlphabeticalMode.BIJECTIVE));
    }
}
