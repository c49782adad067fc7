package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Language view of a single query: its detection, its translation into every query language and
 * the documents of the other language it reaches.
 */
public record MultilingualQueryResult(
        LanguageDetectionResult detection,
        Map<Language, TranslationResult> translations,
        List<CrossLanguageMatch> crossLanguageMatches
) {

    public MultilingualQueryResult {
        translations = Map.copyOf(translations);
        crossLanguageMatches = List.copyOf(crossLanguageMatches);
    }

    public Optional<TranslationResult> translationInto(final Language language) {
        return Optional.ofNullable(translations.get(language));
    }

    public MultilingualQueryResult withCrossLanguageMatches(final List<CrossLanguageMatch> matches) {
        return new MultilingualQueryResult(detection, translations, matches);
    }
}
