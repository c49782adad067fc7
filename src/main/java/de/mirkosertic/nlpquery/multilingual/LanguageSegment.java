package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;

/**
 * A contiguous run of one script inside a text.
 *
 * @param language {@link Language#EN} for Latin script, {@link Language#AR} for Arabic script
 * @param text     the run as it appears in the text
 * @param start    index of the first character of the run
 * @param end      index after the last character of the run
 */
public record LanguageSegment(Language language, String text, int start, int end) {
}
