package de.mirkosertic.nlpquery.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.nlpquery.ValidationException;

import java.util.Locale;

/**
 * Input kind of a template parameter.
 */
public enum ParameterType {

    TEXT,
    SELECT,
    DATE,
    NUMBER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParameterType fromCode(final String code) {
        for (final ParameterType type : values()) {
            if (type.code().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new ValidationException("Unknown parameter type: " + code);
    }
}
