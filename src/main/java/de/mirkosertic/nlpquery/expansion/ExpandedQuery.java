package de.mirkosertic.nlpquery.expansion;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link QueryExpander#expandQuery}.
 *
 * @param originalQuery    the query as given
 * @param expandedTerms    expansion terms by descending confidence
 * @param rankedVariations at most five alternative queries by descending score
 * @param suggestedFilters at most three filters by descending relevance
 */
public record ExpandedQuery(
        String originalQuery,
        List<ExpansionTerm> expandedTerms,
        List<RankedVariation> rankedVariations,
        List<SuggestedFilter> suggestedFilters
) {

    public ExpandedQuery {
        expandedTerms = List.copyOf(expandedTerms);
        rankedVariations = List.copyOf(rankedVariations);
        suggestedFilters = List.copyOf(suggestedFilters);
    }

    public boolean isEmpty() {
        return expandedTerms.isEmpty() && rankedVariations.isEmpty();
    }

    public Optional<RankedVariation> topVariation() {
        return rankedVariations.isEmpty() ? Optional.empty() : Optional.of(rankedVariations.get(0));
    }
}
