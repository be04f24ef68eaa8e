package com.williamcallahan.orderedlists.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.orderedlists.domain.lists.CaseStyle;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies list marker property validation and conversion.
 */
class ListMarkerPropertiesTest {

    private static final String NESTED_MODE_KEY = "app.lists.nested-alphabetical-mode";
    private static final String CACHE_SIZE_KEY = "app.lists.grammar-cache.max-size";
    private static final String CACHE_EXPIRY_KEY = "app.lists.grammar-cache.expire-after";

    @Test
    void defaults_matchMarkerSettingsDefaults() {
        ListMarkerProperties props = new ListMarkerProperties();

        assertDoesNotThrow(props::validateConfiguration);
        assertEquals(MarkerSettings.defaults(), props.toMarkerSettings());
    }

    @Test
    void toMarkerSettings_carriesBoundValues() {
        ListMarkerProperties props = new ListMarkerProperties();
        props.setRomanEnabled(false);
        props.setNestedAlphabeticalMode(NestedAlphabeticalMode.REPEATED);
        props.setCaseStyle(CaseStyle.LOWER);
        props.setFirstMarkerOverrideEnabled(true);

        MarkerSettings settings = props.toMarkerSettings();

        assertEquals(MarkerSettings.defaults()
                .withRomanEnabled(false)
                .withNestedAlphabeticalMode(NestedAlphabeticalMode.REPEATED)
                .withCaseStyle(CaseStyle.LOWER)
                .withFirstMarkerOverrideEnabled(true), settings);
    }

    @Test
    void validateConfiguration_missingNestedMode_namesKey() {
        ListMarkerProperties props = new ListMarkerProperties();
        props.setNestedAlphabeticalMode(null);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class, props::validateConfiguration);
        assertTrue(failure.getMessage().contains(NESTED_MODE_KEY), failure.getMessage());
    }

    @Test
    void validateConfiguration_nonPositiveCacheSize_namesKey() {
        ListMarkerProperties props = new ListMarkerProperties();
        props.getGrammarCache().setMaxSize(0);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class, props::validateConfiguration);
        assertTrue(failure.getMessage().contains(CACHE_SIZE_KEY), failure.getMessage());
    }

    @Test
    void validateConfiguration_zeroExpiry_namesKey() {
        ListMarkerProperties props = new ListMarkerProperties();
        props.getGrammarCache().setExpireAfter(Duration.ZERO);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class, props::validateConfiguration);
        assertTrue(failure.getMessage().contains(CACHE_EXPIRY_KEY), failure.getMessage());
    }

    @Test
    void validateConfiguration_missingCacheSection_fails() {
        ListMarkerProperties props = new ListMarkerProperties();
        props.setGrammarCache(null);

        assertThrows(IllegalArgumentException.class, props::validateConfiguration);
    }
}
