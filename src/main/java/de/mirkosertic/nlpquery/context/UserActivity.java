package de.mirkosertic.nlpquery.context;

import org.jspecify.annotations.Nullable;

/**
 * A single user interaction. Any combination of the fields may be set.
 */
public record UserActivity(@Nullable String query, @Nullable String documentId, @Nullable String topic) {

    public static UserActivity query(final String query) {
        return new UserActivity(query, null, null);
    }

    public static UserActivity document(final String documentId) {
        return new UserActivity(null, documentId, null);
    }

    public static UserActivity topic(final String topic) {
        return new UserActivity(null, null, topic);
    }
}
