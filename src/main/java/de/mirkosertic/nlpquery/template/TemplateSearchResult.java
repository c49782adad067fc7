package de.mirkosertic.nlpquery.template;

import java.util.List;

public record TemplateSearchResult(QuestionTemplate template, double score, List<String> matchedText,
                                   List<String> matchedTags) {

    public TemplateSearchResult {
        matchedText = List.copyOf(matchedText);
        matchedTags = List.copyOf(matchedTags);
    }
}
