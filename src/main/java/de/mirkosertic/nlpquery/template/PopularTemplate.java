package de.mirkosertic.nlpquery.template;

public record PopularTemplate(QuestionTemplate template, long usageCount, long uniqueUsers) {
}
