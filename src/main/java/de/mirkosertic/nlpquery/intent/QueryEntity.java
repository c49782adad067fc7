package de.mirkosertic.nlpquery.intent;

/**
 * A typed span extracted from a query.
 *
 * @param type       entity kind
 * @param value      the text as it appeared in the query
 * @param normalized canonical form used for matching and filtering
 */
public record QueryEntity(EntityType type, String value, String normalized) {
}
