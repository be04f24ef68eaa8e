package com.williamcallahan.orderedlists.service.lists;

import com.williamcallahan.orderedlists.domain.lists.CaseStyle;
import com.williamcallahan.orderedlists.domain.lists.ListSeparator;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes list-shaped lines for one settings value.
 *
 * <p>Three shapes are tried in order: a bullet line ({@code - x}), a standard line
 * ({@code a. x}, {@code a) x}) and a double parenthesis line ({@code (a) x}). Every shape needs
 * exactly one space between the marker and the content. Matching is purely syntactic; whether a
 * matched token is a valid marker is decided by {@link MarkerClassifier}.</p>
 */
public final class MarkerGrammar {

    private static final Pattern BULLET_LINE = Pattern.compile("^([ \\t]*)([*+\\-])( .*)$");
    private static final String DIGITS = "[0-9]+";

    private final Pattern standardLine;
    private final Pattern doubleParenthesisLine;
    private final String markerPattern;

    /**
     * Compiles the patterns for a settings value.
     *
     * @param settings enabled systems and cases
     */
    public MarkerGrammar(MarkerSettings settings) {
        this.markerPattern = buildMarkerPattern(settings);
        String separators = settings.parenthesesEnabled() ? "[.)]" : "[.]";
        this.standardLine = Pattern.compile("^([ \\t]*)(" + markerPattern + ")(" + separators + ")( .*)$");
        this.doubleParenthesisLine = settings.parenthesesEnabled()
                ? Pattern.compile("^([ \\t]*)\\((" + markerPattern + ")\\)( .*)$")
                : null;
    }

    /**
     * Splits a line into marker parts.
     *
     * @param lineText raw line without its line terminator
     * @return the parts, or empty when the line is not list-shaped
     */
    public Optional<MarkerMatch> match(String lineText) {
        if (lineText == null || lineText.isEmpty()) {
            return Optional.empty();
        }

        Matcher bullet = BULLET_LINE.matcher(lineText);
        if (bullet.matches()) {
            return Optional.of(new MarkerMatch(bullet.group(1), bullet.group(2), ListSeparator.DOT,
                    bullet.group(3), true));
        }

        Matcher standard = standardLine.matcher(lineText);
        if (standard.matches()) {
            ListSeparator separator = ListSeparator.fromTrailingChar(standard.group(3).charAt(0))
                    .orElseThrow(() -> new IllegalStateException("Unexpected separator " + standard.group(3)));
            return Optional.of(new MarkerMatch(standard.group(1), standard.group(2), separator,
                    standard.group(4), false));
        }

        if (doubleParenthesisLine != null) {
            Matcher wrapped = doubleParenthesisLine.matcher(lineText);
            if (wrapped.matches()) {
                return Optional.of(new MarkerMatch(wrapped.group(1), wrapped.group(2),
                        ListSeparator.DOUBLE_PARENTHESIS, wrapped.group(3), false));
            }
        }
        return Optional.empty();
    }

    public boolean matches(String lineText) {
        return match(lineText).isPresent();
    }

    /**
     * Returns the marker token alternation, for diagnostics.
     *
     * @return regular expression source of the marker token
     */
    public String markerPattern() {
        return markerPattern;
    }

    private static String buildMarkerPattern(MarkerSettings settings) {
        List<String> letterClasses = new ArrayList<>();
        CaseStyle caseStyle = settings.caseStyle();
        if (caseStyle.hasUppercase()) {
            letterClasses.add("[A-Z]");
        }
        if (caseStyle.hasLowercase()) {
            letterClasses.add("[a-z]");
        }

        // Cases stay in separate alternatives so "Ab" never matches.
        List<String> alternatives = new ArrayList<>();
        boolean multiLetter = settings.nestedAlphabeticalMode().isEnabled() || settings.romanEnabled();
        boolean singleLetter = settings.alphabeticalEnabled() || settings.romanEnabled();
        if (multiLetter) {
            for (String letterClass : letterClasses) {
                alternatives.add(letterClass + "{2,}");
            }
        }
        if (singleLetter) {
            alternatives.addAll(letterClasses);
        }
        alternatives.add(DIGITS);
        return String.join("|", alternatives);
    }
}
