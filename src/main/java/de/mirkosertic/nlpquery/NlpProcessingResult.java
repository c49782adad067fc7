package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.expansion.ExpandedQuery;
import de.mirkosertic.nlpquery.multilingual.MultilingualQueryResult;
import de.mirkosertic.nlpquery.refinement.RefinementSuggestion;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.template.ExecutableTemplate;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * @param processedQuery the query sent to the search backend: template text, else the top
 *                       expansion variation, else the original query
 * @param confidence     mean confidence of the stages that ran
 */
public record NlpProcessingResult(
        String originalQuery,
        String processedQuery,
        @Nullable ExpandedQuery expandedQuery,
        @Nullable MultilingualQueryResult multilingualResult,
        @Nullable ExecutableTemplate templateMatch,
        List<RefinementSuggestion> refinementSuggestions,
        List<DocumentSearchResult> searchResults,
        double confidence,
        long processingTimeMs,
        ProcessingMetadata metadata
) {

    public static final double FALLBACK_CONFIDENCE = 0.3;
    public static final String FALLBACK_COMPONENT = "fallback";

    public NlpProcessingResult {
        refinementSuggestions = List.copyOf(refinementSuggestions);
        searchResults = List.copyOf(searchResults);
    }

    /**
     * The fixed result returned when the pipeline itself fails.
     */
    public static NlpProcessingResult fallback(final String query, final long processingTimeMs) {
        return new NlpProcessingResult(query, query, null, null, null, List.of(), List.of(),
                FALLBACK_CONFIDENCE, processingTimeMs,
                new ProcessingMetadata(List.of(FALLBACK_COMPONENT), false, true));
    }

    /**
     * This result as served from the cache.
     */
    public NlpProcessingResult asCacheHit(final long lookupTimeMs) {
        return new NlpProcessingResult(originalQuery, processedQuery, expandedQuery, multilingualResult, templateMatch,
                refinementSuggestions, searchResults, confidence, lookupTimeMs,
                new ProcessingMetadata(metadata.usedComponents(), true, metadata.errorOccurred()));
    }
}
