package de.mirkosertic.nlpquery.template;

import java.util.Map;

public record TemplateSuggestion(QuestionTemplate template, double relevanceScore, String reason,
                                 Map<String, String> suggestedParameters) {

    public TemplateSuggestion {
        suggestedParameters = Map.copyOf(suggestedParameters);
    }
}
