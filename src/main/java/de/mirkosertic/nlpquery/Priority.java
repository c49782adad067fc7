package de.mirkosertic.nlpquery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Scheduling hint of a query. Only {@link #HIGH} changes behavior, and only in aggressive mode.
 */
public enum Priority {

    LOW,
    NORMAL,
    HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
