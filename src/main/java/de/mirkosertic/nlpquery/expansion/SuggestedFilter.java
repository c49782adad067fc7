package de.mirkosertic.nlpquery.expansion;

/**
 * A search filter suggested from the query terms, e.g. {@code documentType=pdf}.
 */
public record SuggestedFilter(String type, String value, double relevance) {
}
