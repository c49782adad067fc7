package de.mirkosertic.nlpquery.config;

import de.mirkosertic.nlpquery.ValidationException;
import org.jspecify.annotations.Nullable;

/**
 * Runtime switches of the query pipeline. Replaced as a whole on every update.
 *
 * @param cacheTtlMs   lifetime of a cached result in milliseconds
 * @param maxCacheSize number of cached results before the oldest is evicted
 */
public record PipelineConfiguration(
        boolean enableQueryExpansion,
        boolean enableMultilingualSupport,
        boolean enableTemplateSystem,
        boolean enableQueryRefinement,
        boolean enableVoiceInput,
        boolean cacheEnabled,
        long cacheTtlMs,
        int maxCacheSize,
        PerformanceMode performanceOptimization,
        boolean debugMode
) {

    public static final long DEFAULT_CACHE_TTL_MS = 300_000;
    public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

    public PipelineConfiguration {
        if (cacheTtlMs <= 0) {
            throw new ValidationException("Cache TTL must be positive: " + cacheTtlMs);
        }
        if (maxCacheSize <= 0) {
            throw new ValidationException("Cache size must be positive: " + maxCacheSize);
        }
        if (performanceOptimization == null) {
            performanceOptimization = PerformanceMode.BASIC;
        }
    }

    /**
     * Every component and the cache enabled, basic performance mode, debug off.
     */
    public static PipelineConfiguration defaults() {
        return new PipelineConfiguration(true, true, true, true, true, true,
                DEFAULT_CACHE_TTL_MS, DEFAULT_MAX_CACHE_SIZE, PerformanceMode.BASIC, false);
    }

    /**
     * A copy with every non-null field of the update applied.
     *
     * @throws ValidationException if the result has a non-positive cache TTL or size
     */
    public PipelineConfiguration merge(final ConfigurationUpdate update) {
        return new PipelineConfiguration(
                pick(update.enableQueryExpansion(), enableQueryExpansion),
                pick(update.enableMultilingualSupport(), enableMultilingualSupport),
                pick(update.enableTemplateSystem(), enableTemplateSystem),
                pick(update.enableQueryRefinement(), enableQueryRefinement),
                pick(update.enableVoiceInput(), enableVoiceInput),
                pick(update.cacheEnabled(), cacheEnabled),
                update.cacheTtlMs() != null ? update.cacheTtlMs() : cacheTtlMs,
                update.maxCacheSize() != null ? update.maxCacheSize() : maxCacheSize,
                update.performanceOptimization() != null ? update.performanceOptimization() : performanceOptimization,
                pick(update.debugMode(), debugMode));
    }

    private static boolean pick(final @Nullable Boolean value, final boolean current) {
        return value != null ? value : current;
    }
}
