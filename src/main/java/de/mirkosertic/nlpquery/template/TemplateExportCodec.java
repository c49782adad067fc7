package de.mirkosertic.nlpquery.template;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.nlpquery.ValidationException;

/**
 * JSON form of {@link TemplateExport}.
 */
public final class TemplateExportCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TemplateExportCodec() {
    }

    public static String toJson(final TemplateExport export) {
        try {
            return OBJECT_MAPPER.writeValueAsString(export);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template export", e);
        }
    }

    /**
     * Parse an export document.
     *
     * @throws ValidationException if the document is not valid JSON or does not describe an export
     */
    public static TemplateExport fromJson(final String json) {
        try {
            return OBJECT_MAPPER.readValue(json, TemplateExport.class);
        } catch (final JsonProcessingException e) {
            throw new ValidationException("Invalid template export: " + e.getOriginalMessage());
        }
    }
}
