package de.mirkosertic.nlpquery.refinement;

import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * One query of a session together with its results.
 *
 * @param satisfaction user rating in [0,1], null until rated
 */
public record SessionQuery(
        String text,
        QueryIntent intent,
        Instant timestamp,
        List<DocumentSearchResult> results,
        @Nullable Double satisfaction
) {

    public SessionQuery {
        results = List.copyOf(results);
    }

    public int resultCount() {
        return results.size();
    }

    SessionQuery withSatisfaction(final double value) {
        return new SessionQuery(text, intent, timestamp, results, value);
    }
}
