package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;

import java.util.List;

/**
 * A document written in the other language than the query, linked through translation.
 */
public record CrossLanguageMatch(
        String query,
        Language queryLanguage,
        DocumentSearchResult document,
        Language documentLanguage,
        double matchScore,
        String translatedQuery,
        List<MatchedTerm> matchedTerms
) {

    public CrossLanguageMatch {
        matchedTerms = List.copyOf(matchedTerms);
    }
}
