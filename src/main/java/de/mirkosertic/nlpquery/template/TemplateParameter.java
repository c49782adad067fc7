package de.mirkosertic.nlpquery.template;

import java.util.List;

/**
 * A {@code {name}} placeholder of a template.
 *
 * @param options allowed values of a {@link ParameterType#SELECT} parameter, empty otherwise
 */
public record TemplateParameter(String name, ParameterType type, boolean required, List<String> options) {

    public TemplateParameter {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static TemplateParameter text(final String name) {
        return new TemplateParameter(name, ParameterType.TEXT, true, List.of());
    }

    public static TemplateParameter select(final String name, final List<String> options) {
        return new TemplateParameter(name, ParameterType.SELECT, true, options);
    }

    public String placeholder() {
        return "{" + name + "}";
    }
}
