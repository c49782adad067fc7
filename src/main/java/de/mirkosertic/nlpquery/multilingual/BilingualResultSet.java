package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;

import java.util.List;
import java.util.Map;

/**
 * Documents grouped by how their language relates to the query language.
 *
 * @param languageDistribution detected language code to number of documents, over all documents
 */
public record BilingualResultSet(
        String originalQuery,
        Language queryLanguage,
        List<DocumentSearchResult> sameLanguage,
        List<CrossLanguageMatch> crossLanguage,
        List<DocumentSearchResult> mixed,
        int totalMatches,
        Map<String, Integer> languageDistribution
) {

    public BilingualResultSet {
        sameLanguage = List.copyOf(sameLanguage);
        crossLanguage = List.copyOf(crossLanguage);
        mixed = List.copyOf(mixed);
        languageDistribution = Map.copyOf(languageDistribution);
    }
}
