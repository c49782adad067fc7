package de.mirkosertic.nlpquery.template;

import java.time.Instant;
import java.util.List;

/**
 * Portable set of templates as written by {@link QuestionTemplateLibrary#exportTemplates}.
 */
public record TemplateExport(String version, Instant timestamp, List<QuestionTemplate> templates) {

    public static final String CURRENT_VERSION = "1.0.0";

    public TemplateExport {
        templates = templates == null ? List.of() : List.copyOf(templates);
    }
}
