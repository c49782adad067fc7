package de.mirkosertic.nlpquery.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vocabulary and typical queries of a department, project, team or domain.
 *
 * @param terminology term to synonyms, in declaration order
 */
public record OrganizationalContext(
        String id,
        String name,
        ContextType type,
        Map<String, List<String>> terminology,
        List<String> commonQueries,
        List<String> documentTypes
) {

    public OrganizationalContext {
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        terminology.forEach((term, synonyms) -> copy.put(term, List.copyOf(synonyms)));
        terminology = Collections.unmodifiableMap(copy);
        commonQueries = List.copyOf(commonQueries);
        documentTypes = List.copyOf(documentTypes);
    }
}
