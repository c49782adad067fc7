package de.mirkosertic.nlpquery.multilingual;

/**
 * Sizes of the translation dictionaries.
 */
public record TranslationStats(int arabicToEnglishMappings, int englishToArabicMappings, int transliterationPatterns) {
}
