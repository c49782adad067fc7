package de.mirkosertic.nlpquery.expansion;

/**
 * Summary figures of the last corpus analysis.
 */
public record CorpusStats(long totalTerms, int uniqueTerms, int technicalTerms, int conceptClusters) {
}
