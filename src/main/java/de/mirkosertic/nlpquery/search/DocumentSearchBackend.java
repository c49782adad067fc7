package de.mirkosertic.nlpquery.search;

import java.util.List;

/**
 * The document-search backend the pipeline materializes its final query against.
 *
 * <p>Retries and timeouts are the backend's responsibility; the pipeline calls it
 * once per processed query and treats any exception as an empty result.</p>
 */
public interface DocumentSearchBackend {

    /**
     * Run a search.
     *
     * @param query the final query string selected by the pipeline
     * @return matching documents, best first
     */
    List<DocumentSearchResult> search(String query);

    /**
     * A backend that never finds anything.
     */
    static DocumentSearchBackend empty() {
        return query -> List.of();
    }
}
