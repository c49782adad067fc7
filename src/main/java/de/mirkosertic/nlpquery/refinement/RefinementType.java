package de.mirkosertic.nlpquery.refinement;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of rewrite a refinement suggestion applies to the current query.
 */
public enum RefinementType {

    FILTER,
    EXPAND,
    NARROW,
    ALTERNATIVE,
    CLARIFY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
