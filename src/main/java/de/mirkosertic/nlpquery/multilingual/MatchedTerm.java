package de.mirkosertic.nlpquery.multilingual;

public record MatchedTerm(String queryTerm, String documentTerm, TranslationType translationType) {
}
