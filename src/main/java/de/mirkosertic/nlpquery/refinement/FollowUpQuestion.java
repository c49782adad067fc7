package de.mirkosertic.nlpquery.refinement;

import java.util.List;
import java.util.Map;

/**
 * A question to ask the user after a query.
 *
 * @param priority 0 to 9, higher is asked first
 */
public record FollowUpQuestion(
        String id,
        String text,
        FollowUpType type,
        int priority,
        Map<String, Object> context,
        List<String> suggestedAnswers
) {

    public FollowUpQuestion {
        context = context == null ? Map.of() : Map.copyOf(context);
        suggestedAnswers = suggestedAnswers == null ? List.of() : List.copyOf(suggestedAnswers);
    }
}
