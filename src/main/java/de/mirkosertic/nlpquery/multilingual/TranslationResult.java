package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;

/**
 * Outcome of a dictionary translation. The confidence is the share of tokens that were actually
 * translated, {@code 1.0} when source and target language are the same.
 */
public record TranslationResult(
        String originalText,
        String translatedText,
        Language sourceLanguage,
        Language targetLanguage,
        double confidence
) {

    static TranslationResult identity(final String text, final Language language) {
        return new TranslationResult(text, text, language, language, 1.0);
    }
}
