package de.mirkosertic.nlpquery.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import de.mirkosertic.nlpquery.Language;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A reusable question with {@code {name}} placeholders.
 *
 * @param template the question text with placeholders
 * @param priority ranking weight, at least 1
 */
public record QuestionTemplate(
        String id,
        TemplateCategory category,
        String title,
        String description,
        String template,
        List<TemplateParameter> parameters,
        Language language,
        List<String> examples,
        List<String> tags,
        int priority
) {

    public QuestionTemplate {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        examples = examples == null ? List.of() : List.copyOf(examples);
        tags = tags == null ? List.of() : List.copyOf(tags);
        priority = Math.max(1, priority);
    }

    /**
     * Whether every field an imported template must carry is present.
     */
    @JsonIgnore
    public boolean isComplete() {
        return notBlank(id) && notBlank(title) && notBlank(description) && notBlank(template)
                && category != null && language != null;
    }

    private static boolean notBlank(final @Nullable String value) {
        return value != null && !value.isBlank();
    }
}
