package de.mirkosertic.nlpquery.multilingual;

import de.mirkosertic.nlpquery.Language;

import java.util.List;

/**
 * Detected language of a text together with its script runs in text order.
 */
public record LanguageDetectionResult(Language language, double confidence, List<LanguageSegment> segments) {

    public LanguageDetectionResult {
        segments = List.copyOf(segments);
    }

    public boolean hasSegment(final Language segmentLanguage) {
        return segments.stream().anyMatch(segment -> segment.language() == segmentLanguage);
    }
}
