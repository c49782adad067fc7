package de.mirkosertic.nlpquery.refinement;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * A proposed change to the current query of a session.
 *
 * @param parameters filter values such as {@code documentType}, {@code author} or {@code dateRange}
 * @param newQuery   the complete replacement query, when the suggestion carries one
 */
public record RefinementSuggestion(
        String id,
        RefinementType type,
        String title,
        String description,
        String action,
        double confidence,
        Map<String, String> parameters,
        @Nullable String newQuery,
        String expectedImprovement
) {

    public RefinementSuggestion {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
