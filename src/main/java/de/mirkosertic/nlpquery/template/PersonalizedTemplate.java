package de.mirkosertic.nlpquery.template;

import java.util.List;
import java.util.Map;

/**
 * A template text with guessed parameter values filled in as {@code [value]}.
 */
public record PersonalizedTemplate(String personalizedText, Map<String, String> suggestedParameters,
                                   List<String> contextHints, double relevanceScore) {

    public PersonalizedTemplate {
        suggestedParameters = Map.copyOf(suggestedParameters);
        contextHints = List.copyOf(contextHints);
    }
}
