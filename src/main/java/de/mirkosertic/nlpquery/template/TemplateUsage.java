package de.mirkosertic.nlpquery.template;

import java.time.Instant;

/**
 * Usage figures of one template.
 *
 * @param uniqueUsers   approximation derived from the usage count alone, see
 *                      {@link QuestionTemplateLibrary#approximateUniqueUsers(long)}
 * @param distinctUsers exact number of different user ids that used the template
 */
public record TemplateUsage(String templateId, long usageCount, long uniqueUsers, int distinctUsers, Instant lastUsed) {
}
