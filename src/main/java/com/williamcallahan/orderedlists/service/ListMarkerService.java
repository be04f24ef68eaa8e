package com.williamcallahan.orderedlists.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.orderedlists.config.ListMarkerProperties;
import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import com.williamcallahan.orderedlists.domain.lists.MarkerLine;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import com.williamcallahan.orderedlists.service.lists.ListMarkerEngine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for list parsing and editing.
 *
 * <p>Compiling a grammar costs a few regular expressions, so one {@link ListMarkerEngine} is kept
 * per distinct {@link MarkerSettings} value. A {@code null} settings argument means the
 * configured defaults.</p>
 */
@Service
public class ListMarkerService {

    private static final Logger logger = LoggerFactory.getLogger(ListMarkerService.class);

    private final MarkerSettings defaultSettings;
    private final Cache<MarkerSettings, ListMarkerEngine> engineCache;

    public ListMarkerService(MarkerSettings defaultSettings, ListMarkerProperties properties) {
        this.defaultSettings = Objects.requireNonNull(defaultSettings, "Default marker settings cannot be null");
        this.engineCache = Caffeine.newBuilder()
                .maximumSize(properties.getGrammarCache().getMaxSize())
                .expireAfterAccess(properties.getGrammarCache().getExpireAfter())
                .recordStats()
                .build();
        logger.info("ListMarkerService initialized with grammar cache of {} entries",
                properties.getGrammarCache().getMaxSize());
    }

    public MarkerSettings getDefaultSettings() {
        return defaultSettings;
    }

    /**
     * Returns the engine for a settings value, compiling it on first use.
     *
     * @param settings settings, or {@code null} for the defaults
     * @return shared engine
     */
    public ListMarkerEngine engineFor(MarkerSettings settings) {
        MarkerSettings effective = settings == null ? defaultSettings : settings;
        return engineCache.get(effective, key -> {
            logger.debug("Compiling list grammar for {}", key);
            return new ListMarkerEngine(key);
        });
    }

    public List<ParsedList> parse(List<String> lines, int from, int toExclusive, MarkerSettings settings) {
        return engineFor(settings).parse(lines, from, toExclusive);
    }

    public Optional<ParsedList> findListContaining(List<String> lines, int lineNumber, MarkerSettings settings) {
        return engineFor(settings).findListContaining(lines, lineNumber);
    }

    public OptionalInt valueOf(MarkerLine line, MarkerSettings settings) {
        return engineFor(settings).valueOf(line);
    }

    public ListEditOutcome continueList(List<String> lines, int lineNumber, int column, MarkerSettings settings) {
        return engineFor(settings).continueList(lines, lineNumber, column);
    }

    public ListEditOutcome indent(List<String> lines, int lineNumber, MarkerSettings settings) {
        return engineFor(settings).indent(lines, lineNumber);
    }

    public ListEditOutcome outdent(List<String> lines, int lineNumber, MarkerSettings settings) {
        return engineFor(settings).outdent(lines, lineNumber);
    }

    public ListEditOutcome editContent(List<String> lines, int lineNumber, String content, MarkerSettings settings) {
        return engineFor(settings).editContent(lines, lineNumber, content);
    }

    public ListEditOutcome removeLine(List<String> lines, int lineNumber, MarkerSettings settings) {
        return engineFor(settings).removeLine(lines, lineNumber);
    }

    /**
     * Gets grammar cache statistics.
     */
    public CacheStats getCacheStats() {
        var stats = engineCache.stats();
        return new CacheStats(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            engineCache.estimatedSize()
        );
    }

    /**
     * Clears the grammar cache.
     */
    public void clearCache() {
        engineCache.invalidateAll();
        logger.info("List grammar cache cleared");
    }

    /**
     * Cache statistics record.
     */
    public record CacheStats(
        long hitCount,
        long missCount,
        long evictionCount,
        long size
    ) {
        public double hitRate() {
            long total = hitCount + missCount;
            return total == 0 ? 0.0 : (double) hitCount / total;
        }
    }
}
