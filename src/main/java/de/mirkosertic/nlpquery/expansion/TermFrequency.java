package de.mirkosertic.nlpquery.expansion;

public record TermFrequency(String term, int frequency) {
}
