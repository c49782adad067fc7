package de.mirkosertic.nlpquery.refinement;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FollowUpType {

    CLARIFICATION,
    EXPANSION,
    SUGGESTION,
    VALIDATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
