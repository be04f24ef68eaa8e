package com.williamcallahan.orderedlists.config;

import com.williamcallahan.orderedlists.domain.lists.CaseStyle;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the configured marker settings as the application-wide default.
 */
@Configuration
public class ListMarkerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ListMarkerConfig.class);

    @Bean
    public MarkerSettings markerSettings(ListMarkerProperties properties) {
        MarkerSettings settings = properties.toMarkerSettings();
        logger.info("List markers: alphabetical={}, roman={}, nested={}, case={}, parentheses={}, firstMarkerOverride={}",
                settings.alphabeticalEnabled(), settings.romanEnabled(), settings.nestedAlphabeticalMode(),
                settings.caseStyle(), settings.parenthesesEnabled(), settings.firstMarkerOverrideEnabled());
        boolean lettersEnabled = settings.alphabeticalEnabled()
                || settings.romanEnabled()
                || settings.nestedAlphabeticalMode().isEnabled();
        if (settings.caseStyle() == CaseStyle.NONE && lettersEnabled) {
            logger.warn("Case style NONE disables every letter marker; only numbered and bullet lists are recognized");
        }
        return settings;
    }
}
