package de.mirkosertic.nlpquery.multilingual;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a query term was linked to a document term.
 */
public enum TranslationType {

    DIRECT,
    TRANSLATED,
    TRANSLITERATED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
