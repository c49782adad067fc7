package de.mirkosertic.nlpquery.search;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a speech recognition call.
 */
public record VoiceRecognitionResult(
        boolean recognized,
        double confidence,
        Map<String, Object> parameters,
        List<String> suggestions
) {
    public VoiceRecognitionResult {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
