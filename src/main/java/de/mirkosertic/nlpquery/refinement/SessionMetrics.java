package de.mirkosertic.nlpquery.refinement;

/**
 * Snapshot of the counters of a session.
 *
 * @param averageSatisfaction mean over rated queries, 0 when nothing is rated
 * @param successfulSearches  rated queries with a satisfaction of at least 0.7
 */
public record SessionMetrics(int totalQueries, int refinementCount, double averageSatisfaction,
                             int successfulSearches) {
}
