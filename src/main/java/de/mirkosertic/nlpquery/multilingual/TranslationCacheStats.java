package de.mirkosertic.nlpquery.multilingual;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Point-in-time view of the translation memo of {@link MultilingualProcessor}.
 *
 * @param lookups       translations requested through {@link MultilingualProcessor#translateText}
 * @param evictions     memoized translations dropped because the memo ran over its maximum size
 * @param invalidations times the whole memo was discarded after a dictionary change
 * @param size          memoized translations right now
 */
public record TranslationCacheStats(long lookups, long hits, long misses, long evictions, long invalidations,
                                    long size) {

    static TranslationCacheStats of(final CacheStats stats, final long invalidations, final long size) {
        return new TranslationCacheStats(stats.requestCount(), stats.hitCount(), stats.missCount(),
                stats.evictionCount(), invalidations, size);
    }

    /**
     * Share of lookups answered from the memo, 0.0 before the first lookup.
     */
    public double hitRatio() {
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
