package de.mirkosertic.nlpquery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Languages understood by the pipeline. {@link #MIXED} is only ever produced by language detection.
 */
public enum Language {

    EN("en"),
    AR("ar"),
    MIXED("mixed");

    private final String code;

    Language(final String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isRightToLeft() {
        return this == AR;
    }

    /**
     * The other query language. Only defined for {@link #EN} and {@link #AR}.
     */
    public Language opposite() {
        return switch (this) {
            case EN -> AR;
            case AR -> EN;
            case MIXED -> throw new IllegalStateException("Mixed language has no opposite");
        };
    }

    /**
     * Resolve a language code such as {@code "en"} or {@code "AR"}.
     *
     * @throws ValidationException if the code is unknown
     */
    @JsonCreator
    public static Language fromCode(final String code) {
        if (code == null) {
            throw new ValidationException("Language must not be null");
        }
        final String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (final Language language : values()) {
            if (language.code.equals(normalized)) {
                return language;
            }
        }
        throw new ValidationException("Unsupported language: " + code);
    }

    /**
     * Resolve a query language. Only {@code en} and {@code ar} are accepted.
     *
     * @throws ValidationException for unknown codes and for {@code mixed}
     */
    public static Language queryLanguage(final String code) {
        final Language language = fromCode(code);
        if (language == MIXED) {
            throw new ValidationException("Language must be either \"en\" or \"ar\"");
        }
        return language;
    }
}
