package de.mirkosertic.nlpquery.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContextType {

    DEPARTMENT,
    PROJECT,
    TEAM,
    DOMAIN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
