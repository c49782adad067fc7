package de.mirkosertic.nlpquery.expansion;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an expansion term came from.
 */
public enum ExpansionSource {

    CORPUS,
    DICTIONARY,
    CONTEXT,
    USER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
