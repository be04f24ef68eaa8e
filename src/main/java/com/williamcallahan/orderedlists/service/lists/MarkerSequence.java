package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.LetterCase;
import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.ListType;
import com.williamcallahan.orderedlists.domain.lists.MarkerCodecException;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import java.util.Optional;

/**
 * Generates markers: the successor of a sibling and the first marker of a new level.
 */
public final class MarkerSequence {

    private final MarkerSettings settings;

    public MarkerSequence(MarkerSettings settings) {
        this.settings = settings;
    }

    /**
     * Decodes the value of an ordered line.
     *
     * @param line classified line
     * @return value, at least 1
     * @throws MarkerCodecException when the line is unordered or its marker does not decode
     */
    public int valueOf(MarkerLine line) {
        return NumeralCodecs.forType(line.type(), settings.nestedAlphabeticalMode()).decode(line.marker());
    }

    /**
     * Rebuilds a line as the next sibling of the context line.
     *
     * <p>The result takes the context's system, case and separator and keeps the line's own
     * indentation and content. An alphabetical list past {@code z} continues as nested letters.
     * Bullets have no sequence, so a bullet following a bullet keeps its own glyph.</p>
     *
     * @param context previous sibling
     * @param line line to rebuild
     * @return rebuilt line
     * @throws MarkerCodecException when the next value cannot be encoded
     */
    public MarkerLine successor(MarkerLine context, MarkerLine line) {
        if (context.type() == ListType.UNORDERED && line.type() == ListType.UNORDERED) {
            return line;
        }
        if (context.type() == ListType.UNORDERED) {
            return new MarkerLine(ListType.UNORDERED, line.indentation(), context.marker(), ListSeparator.DOT,
                    line.content());
        }

        int nextValue;
        try {
            nextValue = Math.addExact(valueOf(context), 1);
        } catch (ArithmeticException overflow) {
            throw new MarkerCodecException(context.type(), "No successor for marker '" + context.marker() + "'");
        }

        ListType nextType = context.type();
        if (nextType == ListType.ALPHABETICAL && nextValue > AlphabeticalCodec.ALPHABET_SIZE) {
            if (!settings.nestedAlphabeticalMode().isEnabled()) {
                throw new MarkerCodecException(nextType,
                        "Alphabet exhausted after '" + context.marker() + "' and nested lists are disabled");
            }
            nextType = ListType.NESTED_ALPHABETICAL;
        }

        String generated = NumeralCodecs.forType(nextType, settings.nestedAlphabeticalMode()).encode(nextValue);
        return new MarkerLine(nextType, line.indentation(), context.applyCaseStyle(generated),
                context.separator(), line.content());
    }

    /**
     * Rebuilds a line as the first entry of a level opened under the parent.
     *
     * @param parent line one level up
     * @param line line to rebuild
     * @return rebuilt line with value 1 of its system
     */
    public MarkerLine firstMarker(MarkerLine parent, MarkerLine line) {
        if (settings.firstMarkerOverrideEnabled()) {
            Optional<MarkerLine> override = legalOrderingFirstMarker(parent, line).filter(this::isEnabled);
            if (override.isPresent()) {
                return override.get();
            }
        }

        if (line.type() == ListType.UNORDERED) {
            return line.withSeparator(ListSeparator.DOT);
        }
        String marker = switch (line.type()) {
            case ALPHABETICAL -> line.applyCaseStyle("a");
            case ROMAN -> line.applyCaseStyle("i");
            case NESTED_ALPHABETICAL -> line.applyCaseStyle(
                    NumeralCodecs.forType(ListType.NESTED_ALPHABETICAL, settings.nestedAlphabeticalMode())
                            .encode(AlphabeticalCodec.ALPHABET_SIZE + 1));
            case NUMBERED, UNORDERED -> "1";
        };
        return line.withMarker(marker).withSeparator(parent.separator());
    }

    // A., I., 1., a), aa), (1), (a), (aa), (i)
    private Optional<MarkerLine> legalOrderingFirstMarker(MarkerLine parent, MarkerLine line) {
        LetterCase parentCase = parent.letterCase();
        ListSeparator parentSeparator = parent.separator();
        return switch (parent.type()) {
            case ALPHABETICAL -> {
                if (parentCase == LetterCase.UPPER && parentSeparator == ListSeparator.DOT) {
                    yield Optional.of(first(line, ListType.ROMAN, "I", ListSeparator.DOT));
                }
                if (parentCase == LetterCase.LOWER && parentSeparator != ListSeparator.DOT) {
                    yield Optional.of(first(line, ListType.NESTED_ALPHABETICAL, "aa", parentSeparator));
                }
                yield Optional.empty();
            }
            case ROMAN -> parentCase == LetterCase.UPPER && parentSeparator == ListSeparator.DOT
                    ? Optional.of(first(line, ListType.NUMBERED, "1", ListSeparator.DOT))
                    : Optional.empty();
            case NUMBERED -> switch (parentSeparator) {
                case DOT -> Optional.of(first(line, ListType.ALPHABETICAL, "a", ListSeparator.PARENTHESIS));
                case DOUBLE_PARENTHESIS ->
                        Optional.of(first(line, ListType.ALPHABETICAL, "a", ListSeparator.DOUBLE_PARENTHESIS));
                case PARENTHESIS -> Optional.empty();
            };
            case NESTED_ALPHABETICAL -> {
                if (parentCase != LetterCase.LOWER) {
                    yield Optional.empty();
                }
                if (parentSeparator == ListSeparator.PARENTHESIS) {
                    yield Optional.of(first(line, ListType.NUMBERED, "1", ListSeparator.DOUBLE_PARENTHESIS));
                }
                if (parentSeparator == ListSeparator.DOUBLE_PARENTHESIS) {
                    yield Optional.of(first(line, ListType.ROMAN, "i", ListSeparator.DOUBLE_PARENTHESIS));
                }
                yield Optional.empty();
            }
            case UNORDERED -> Optional.empty();
        };
    }

    private boolean isEnabled(MarkerLine candidate) {
        if (candidate.separator() != ListSeparator.DOT && !settings.parenthesesEnabled()) {
            return false;
        }
        return switch (candidate.type()) {
            case ALPHABETICAL -> settings.alphabeticalEnabled();
            case ROMAN -> settings.romanEnabled();
            case NESTED_ALPHABETICAL -> settings.nestedAlphabeticalMode().isEnabled();
            case NUMBERED, UNORDERED -> true;
        };
    }

    private static MarkerLine first(MarkerLine line, ListType type, String marker, ListSeparator separator) {
        return new MarkerLine(type, line.indentation(), marker, separator, line.content());
    }
}
