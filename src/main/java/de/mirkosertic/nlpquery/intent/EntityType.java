package de.mirkosertic.nlpquery.intent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {

    DOCUMENT_TYPE,
    DATE,
    AUTHOR,
    TOPIC;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
