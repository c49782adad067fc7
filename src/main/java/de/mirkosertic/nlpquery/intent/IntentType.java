package de.mirkosertic.nlpquery.intent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classified purpose of a query. Declaration order is the classification order.
 */
public enum IntentType {

    SEARCH,
    FILTER,
    ANALYTICS,
    ACTION,
    CONTEXT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
