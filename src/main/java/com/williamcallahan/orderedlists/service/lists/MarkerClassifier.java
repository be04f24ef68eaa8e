package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.BulletGlyph;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import java.util.Optional;

/**
 * Decides which numbering system a marker token belongs to.
 *
 * <p>Without context the precedence is bullet, number, roman numeral, single letter, then letter
 * run, so {@code c} reads as roman 100. With a sibling context the sibling's system wins whenever
 * the token is also valid in it, so {@code c} after {@code b} reads as the letter 3. An
 * alphabetical context moves to nested letters once it has reached {@code z} or the token is
 * already several letters long; a single letter after {@code z} is rejected.</p>
 */
public final class MarkerClassifier {

    private final MarkerSettings settings;

    public MarkerClassifier(MarkerSettings settings) {
        this.settings = settings;
    }

    /**
     * Classifies a marker without context.
     *
     * @param marker bare marker token
     * @return list type, or empty when no enabled system accepts the token
     */
    public Optional<ListType> classify(String marker) {
        if (marker == null || marker.isEmpty()) {
            return Optional.empty();
        }
        if (BulletGlyph.fromMarker(marker).isPresent()) {
            return Optional.of(ListType.UNORDERED);
        }
        if (isDigits(marker)) {
            return accepts(ListType.NUMBERED, marker) ? Optional.of(ListType.NUMBERED) : Optional.empty();
        }
        if (!isLetters(marker)) {
            return Optional.empty();
        }
        if (accepts(ListType.ROMAN, marker)) {
            return Optional.of(ListType.ROMAN);
        }
        if (accepts(ListType.ALPHABETICAL, marker)) {
            return Optional.of(ListType.ALPHABETICAL);
        }
        if (accepts(ListType.NESTED_ALPHABETICAL, marker)) {
            return Optional.of(ListType.NESTED_ALPHABETICAL);
        }
        return Optional.empty();
    }

    /**
     * Classifies a marker following a sibling at the same level.
     *
     * @param marker bare marker token
     * @param context previous sibling, or {@code null} for none
     * @return list type, or empty when the token cannot continue the sibling's list
     */
    public Optional<ListType> classify(String marker, MarkerLine context) {
        if (context == null) {
            return classify(marker);
        }
        if (marker == null || marker.isEmpty()) {
            return Optional.empty();
        }

        ListType contextType = context.type();
        if (contextType == ListType.ALPHABETICAL && isLetters(marker)) {
            return classifyAfterLetter(marker, context);
        }

        Optional<ListType> intrinsic = classify(marker);
        if (intrinsic.isPresent() && intrinsic.get() == contextType) {
            return intrinsic;
        }
        if (accepts(contextType, marker)) {
            return Optional.of(contextType);
        }
        return Optional.empty();
    }

    private Optional<ListType> classifyAfterLetter(String marker, MarkerLine context) {
        boolean alphabetExhausted = NumeralCodecs.forType(ListType.ALPHABETICAL, settings.nestedAlphabeticalMode())
                .tryDecode(context.marker())
                .orElse(0) >= AlphabeticalCodec.ALPHABET_SIZE;
        if (marker.length() > 1 || alphabetExhausted) {
            // a single letter after z has no successor value and ends the list
            return accepts(ListType.NESTED_ALPHABETICAL, marker)
                    ? Optional.of(ListType.NESTED_ALPHABETICAL)
                    : Optional.empty();
        }
        return accepts(ListType.ALPHABETICAL, marker) ? Optional.of(ListType.ALPHABETICAL) : Optional.empty();
    }

    /**
     * Checks whether a token is a valid marker of the given system under the current settings.
     *
     * @param type candidate system
     * @param marker bare marker token
     * @return true when the system is enabled and the token decodes in it
     */
    public boolean accepts(ListType type, String marker) {
        return switch (type) {
            case UNORDERED -> BulletGlyph.fromMarker(marker).isPresent();
            case NUMBERED -> isDigits(marker)
                    && NumeralCodecs.forType(ListType.NUMBERED, settings.nestedAlphabeticalMode()).canDecode(marker);
            case ROMAN -> settings.romanEnabled() && NumeralCodecs.isRomanNumeral(marker);
            case ALPHABETICAL -> settings.alphabeticalEnabled() && marker.length() == 1 && isLetters(marker);
            case NESTED_ALPHABETICAL -> settings.nestedAlphabeticalMode().isEnabled()
                    && marker.length() > 1
                    && isLetters(marker)
                    && NumeralCodecs.forType(type, settings.nestedAlphabeticalMode()).canDecode(marker);
        };
    }

    private static boolean isDigits(String marker) {
        for (int index = 0; index < marker.length(); index++) {
            char character = marker.charAt(index);
            if (character < '0' || character > '9') {
                return false;
            }
        }
        return !marker.isEmpty();
    }

    private static boolean isLetters(String marker) {
        for (int index = 0; index < marker.length(); index++) {
            char character = marker.charAt(index);
            boolean lower = character >= 'a' && character <= 'z';
            boolean upper = character >= 'A' && character <= 'Z';
            if (!lower && !upper) {
                return false;
            }
        }
        return !marker.isEmpty();
    }
}
