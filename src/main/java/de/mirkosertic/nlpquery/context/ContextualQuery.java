package de.mirkosertic.nlpquery.context;

import java.util.List;

/**
 * A query enriched with organizational, user and collection context.
 *
 * @param suggestedTerms  at most 5 distinct additional terms
 * @param alternatives    at most 3 distinct rewritten queries
 * @param clarifications  at most 2 distinct questions for ambiguous queries
 */
public record ContextualQuery(
        String originalQuery,
        String enhancedQuery,
        List<OrganizationalContext> organizationalContexts,
        UserContext userContext,
        DocumentCollectionContext collectionContext,
        List<String> suggestedTerms,
        List<String> alternatives,
        List<String> clarifications
) {

    public ContextualQuery {
        organizationalContexts = List.copyOf(organizationalContexts);
        suggestedTerms = List.copyOf(suggestedTerms);
        alternatives = List.copyOf(alternatives);
        clarifications = List.copyOf(clarifications);
    }
}
