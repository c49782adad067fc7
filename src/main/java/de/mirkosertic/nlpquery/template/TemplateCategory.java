package de.mirkosertic.nlpquery.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.nlpquery.ValidationException;

import java.util.Locale;

public enum TemplateCategory {

    DISCOVERY,
    ANALYTICS,
    STATUS,
    ACTION,
    CUSTOM;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TemplateCategory fromCode(final String code) {
        for (final TemplateCategory category : values()) {
            if (category.code().equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new ValidationException("Unknown template category: " + code);
    }
}
