package de.mirkosertic.nlpquery.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of intent extraction.
 *
 * @param type       the classified intent
 * @param action     the action verb found in the query, or the intent's default verb
 * @param confidence classification confidence in [0,1]
 * @param entities   extracted entities in extraction order
 * @param parameters intent specific parameters such as {@code aggregation}, {@code exclusive} or {@code context}
 */
public record QueryIntent(
        IntentType type,
        String action,
        double confidence,
        List<QueryEntity> entities,
        Map<String, Object> parameters
) {

    public QueryIntent {
        entities = entities == null ? List.of() : List.copyOf(entities);
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * All entities of the given type in extraction order.
     */
    public List<QueryEntity> entitiesOf(final EntityType entityType) {
        return entities.stream().filter(e -> e.type() == entityType).toList();
    }

    /**
     * The normalized value of the first entity of the given type.
     */
    public Optional<String> firstNormalized(final EntityType entityType) {
        return entities.stream()
                .filter(e -> e.type() == entityType)
                .map(QueryEntity::normalized)
                .findFirst();
    }
}
