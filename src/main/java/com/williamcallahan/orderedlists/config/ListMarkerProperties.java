package com.williamcallahan.orderedlists.config;

import com.williamcallahan.orderedlists.domain.lists.CaseStyle;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.NestedAlphabeticalMode;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Marker recognition settings bound from {@code app.lists.*}.
 */
@ConfigurationProperties(prefix = "app.lists")
public class ListMarkerProperties {

    private static final long CACHE_SIZE_DEF = 64L;
    private static final Duration CACHE_EXPIRY_DEF = Duration.ofMinutes(30);
    private static final String NESTED_MODE_KEY = "app.lists.nested-alphabetical-mode";
    private static final String CASE_STYLE_KEY = "app.lists.case-style";
    private static final String CACHE_SIZE_KEY = "app.lists.grammar-cache.max-size";
    private static final String CACHE_EXPIRY_KEY = "app.lists.grammar-cache.expire-after";
    private static final String NULL_VALUE_FMT = "%s must not be null.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private boolean alphabeticalEnabled = true;
    private boolean romanEnabled = true;
    private NestedAlphabeticalMode nestedAlphabeticalMode = NestedAlphabeticalMode.BIJECTIVE;
    private CaseStyle caseStyle = CaseStyle.BOTH;
    private boolean parenthesesEnabled = true;
    private boolean firstMarkerOverrideEnabled = false;
    private GrammarCache grammarCache = new GrammarCache();

    /**
     * Validates marker settings after binding.
     */
    @PostConstruct
    public void validateConfiguration() {
        requireNonNull(NESTED_MODE_KEY, nestedAlphabeticalMode);
        requireNonNull(CASE_STYLE_KEY, caseStyle);
        if (grammarCache == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_VALUE_FMT, "app.lists.grammar-cache"));
        }
        grammarCache.validateConfiguration();
    }

    /**
     * Builds the immutable settings value consumed by the list engine.
     *
     * @return settings reflecting the bound properties
     */
    public MarkerSettings toMarkerSettings() {
        return new MarkerSettings(alphabeticalEnabled, romanEnabled, nestedAlphabeticalMode, caseStyle,
                parenthesesEnabled, firstMarkerOverrideEnabled);
    }

    private static void requireNonNull(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_VALUE_FMT, key));
        }
    }

    public boolean isAlphabeticalEnabled() { return alphabeticalEnabled; }
    public void setAlphabeticalEnabled(boolean alphabeticalEnabled) { this.alphabeticalEnabled = alphabeticalEnabled; }

    public boolean isRomanEnabled() { return romanEnabled; }
    public void setRomanEnabled(boolean romanEnabled) { this.romanEnabled = romanEnabled; }

    public NestedAlphabeticalMode getNestedAlphabeticalMode() { return nestedAlphabeticalMode; }
    public void setNestedAlphabeticalMode(NestedAlphabeticalMode nestedAlphabeticalMode) {
        this.nestedAlphabeticalMode = nestedAlphabeticalMode;
    }

    public CaseStyle getCaseStyle() { return caseStyle; }
    public void setCaseStyle(CaseStyle caseStyle) { this.caseStyle = caseStyle; }

    public boolean isParenthesesEnabled() { return parenthesesEnabled; }
    public void setParenthesesEnabled(boolean parenthesesEnabled) { this.parenthesesEnabled = parenthesesEnabled; }

    public boolean isFirstMarkerOverrideEnabled() { return firstMarkerOverrideEnabled; }
    public void setFirstMarkerOverrideEnabled(boolean firstMarkerOverrideEnabled) {
        this.firstMarkerOverrideEnabled = firstMarkerOverrideEnabled;
    }

    public GrammarCache getGrammarCache() { return grammarCache; }
    public void setGrammarCache(GrammarCache grammarCache) { this.grammarCache = grammarCache; }

    /**
     * Bounds of the cache holding one compiled engine per distinct settings value.
     */
    public static class GrammarCache {
        private long maxSize = CACHE_SIZE_DEF;
        private Duration expireAfter = CACHE_EXPIRY_DEF;

        void validateConfiguration() {
            if (maxSize <= 0) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, CACHE_SIZE_KEY));
            }
            requireNonNull(CACHE_EXPIRY_KEY, expireAfter);
            if (expireAfter.isZero() || expireAfter.isNegative()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, CACHE_EXPIRY_KEY));
            }
        }

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }

        public Duration getExpireAfter() { return expireAfter; }
        public void setExpireAfter(Duration expireAfter) { this.expireAfter = expireAfter; }
    }
}
