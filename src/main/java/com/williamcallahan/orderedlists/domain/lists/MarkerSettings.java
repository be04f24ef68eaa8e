package com.williamcallahan.orderedlists.domain.lists;

import java.util.Objects;

/**
 * Read-only configuration consumed by the marker grammar, classifier and resequencer.
 *
 * <p>Instances are immutable values; callers that want different behavior build a new instance
 * with the {@code with*} methods and pass it to the core.</p>
 *
 * @param alphabeticalEnabled whether single-letter markers ({@code A.}, {@code a)}) are recognized
 * @param romanEnabled whether roman numeral markers ({@code IV.}, {@code ii)}) are recognized
 * @param nestedAlphabeticalMode encoding for multi-letter markers
 * @param caseStyle letter cases the grammar accepts
 * @param parenthesesEnabled whether {@code a)} and {@code (a)} forms are recognized
 * @param firstMarkerOverrideEnabled whether new levels start from the legal-ordering table
 */
public record MarkerSettings(
        boolean alphabeticalEnabled,
        boolean romanEnabled,
        NestedAlphabeticalMode nestedAlphabeticalMode,
        CaseStyle caseStyle,
        boolean parenthesesEnabled,
        boolean firstMarkerOverrideEnabled) {

    private static final MarkerSettings DEFAULTS =
            new MarkerSettings(true, true, NestedAlphabeticalMode.BIJECTIVE, CaseStyle.BOTH, true, false);

    public MarkerSettings {
        Objects.requireNonNull(nestedAlphabeticalMode, "Nested alphabetical mode cannot be null");
        Objects.requireNonNull(caseStyle, "Case style cannot be null");
    }

    /**
     * Returns the settings used when nothing is configured.
     *
     * @return default settings
     */
    public static MarkerSettings defaults() {
        return DEFAULTS;
    }

    public MarkerSettings withAlphabeticalEnabled(boolean enabled) {
        return new MarkerSettings(enabled, romanEnabled, nestedAlphabeticalMode, caseStyle,
                parenthesesEnabled, firstMarkerOverrideEnabled);
    }

    public MarkerSettings withRomanEnabled(boolean enabled) {
        return new MarkerSettings(alphabeticalEnabled, enabled, nestedAlphabeticalMode, caseStyle,
                parenthesesEnabled, firstMarkerOverrideEnabled);
    }

    public MarkerSettings withNestedAlphabeticalMode(NestedAlphabeticalMode mode) {
        return new MarkerSettings(alphabeticalEnabled, romanEnabled, mode, caseStyle,
                parenthesesEnabled, firstMarkerOverrideEnabled);
    }

    public MarkerSettings withCaseStyle(CaseStyle style) {
        return new MarkerSettings(alphabeticalEnabled, romanEnabled, nestedAlphabeticalMode, style,
                parenthesesEnabled, firstMarkerOverrideEnabled);
    }

    public MarkerSettings withParenthesesEnabled(boolean enabled) {
        return new MarkerSettings(alphabeticalEnabled, romanEnabled, nestedAlphabeticalMode, caseStyle,
                enabled, firstMarkerOverrideEnabled);
    }

    public MarkerSettings withFirstMarkerOverrideEnabled(boolean enabled) {
        return new MarkerSettings(alphabeticalEnabled, romanEnabled, nestedAlphabeticalMode, caseStyle,
                parenthesesEnabled, enabled);
    }
}
