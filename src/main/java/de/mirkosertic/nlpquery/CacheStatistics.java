package de.mirkosertic.nlpquery;

/**
 * @param hitRatio hits divided by lookups, 0 before the first lookup
 */
public record CacheStatistics(int size, int maxSize, long hits, long misses, long evictions, double hitRatio) {
}
