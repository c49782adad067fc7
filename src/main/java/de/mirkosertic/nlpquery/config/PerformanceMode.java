package de.mirkosertic.nlpquery.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.nlpquery.ValidationException;

import java.util.Locale;

/**
 * {@link #AGGRESSIVE} warms up components, preloads templates, lets high priority queries bypass
 * the work queue and chunks batches.
 */
public enum PerformanceMode {

    BASIC,
    AGGRESSIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PerformanceMode fromCode(final String code) {
        if (code != null) {
            for (final PerformanceMode mode : values()) {
                if (mode.code().equalsIgnoreCase(code.trim())) {
                    return mode;
                }
            }
        }
        throw new ValidationException("Unknown performance mode: " + code);
    }
}
