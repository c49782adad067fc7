package de.mirkosertic.nlpquery.template;

import java.util.List;
import java.util.Map;

/**
 * A template with its parameters filled in.
 *
 * @param suggestedFilters search filters derived from recognized parameters, keyed by
 *                         {@code documentTypes}, {@code authors} and {@code status}
 */
public record ExecutableTemplate(
        QuestionTemplate template,
        Map<String, String> parameters,
        String generatedQuery,
        Map<String, List<String>> suggestedFilters
) {

    public ExecutableTemplate {
        parameters = Map.copyOf(parameters);
        suggestedFilters = Map.copyOf(suggestedFilters);
    }
}
