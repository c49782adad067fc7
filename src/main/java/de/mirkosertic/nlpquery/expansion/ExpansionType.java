package de.mirkosertic.nlpquery.expansion;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExpansionType {

    SYNONYM,
    RELATED,
    ACRONYM,
    SEMANTIC,
    TECHNICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
