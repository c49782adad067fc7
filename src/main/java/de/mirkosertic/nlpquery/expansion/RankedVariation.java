package de.mirkosertic.nlpquery.expansion;

/**
 * An alternative query string with its score and a human readable reason.
 */
public record RankedVariation(String query, double score, String explanation) {
}
