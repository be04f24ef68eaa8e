package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.lists.CaseStyle;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;

/**
 * Per-request changes to the configured marker settings. Absent fields keep the configured value.
 *
 * @param alphabeticalEnabled single-letter markers
 * @param romanEnabled roman numeral markers
 * @param nestedAlphabeticalMode multi-letter encoding
 * @param caseStyle accepted letter cases
 * @param parenthesesEnabled {@code a)} and {@code (a)} forms
 * @param firstMarkerOverrideEnabled legal-ordering first markers
 */
public record MarkerSettingsOverride(
    Boolean alphabeticalEnabled,
    Boolean romanEnabled,
    NestedAlphabeticalMode nestedAlphabeticalMode,
    CaseStyle caseStyle,
    Boolean parenthesesEnabled,
    Boolean firstMarkerOverrideEnabled
) {

    /**
     * Applies the present fields on top of a base value.
     *
     * @param base configured settings
     * @return settings for this request
     */
    public MarkerSettings applyTo(MarkerSettings base) {
        MarkerSettings settings = base;
        if (alphabeticalEnabled != null) {
            settings = settings.withAlphabeticalEnabled(alphabeticalEnabled);
        }
        if (romanEnabled != null) {
            settings = settings.withRomanEnabled(romanEnabled);
        }
        if (nestedAlphabeticalMode != null) {
            settings = settings.withNestedAlphabeticalMode(nestedAlphabeticalMode);
        }
        if (caseStyle != null) {
            settings = settings.withCaseStyle(caseStyle);
        }
        if (parenthesesEnabled != null) {
            settings = settings.withParenthesesEnabled(parenthesesEnabled);
        }
        if (firstMarkerOverrideEnabled != null) {
            settings = settings.withFirstMarkerOverrideEnabled(firstMarkerOverrideEnabled);
        }
        return settings;
    }
}
