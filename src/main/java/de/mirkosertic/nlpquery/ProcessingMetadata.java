package de.mirkosertic.nlpquery;

import java.util.List;

/**
 * @param usedComponents names of the stages that produced output, in stage order
 * @param errorOccurred  true only for the fallback result
 */
public record ProcessingMetadata(List<String> usedComponents, boolean cacheHit, boolean errorOccurred) {

    public ProcessingMetadata {
        usedComponents = List.copyOf(usedComponents);
    }
}
