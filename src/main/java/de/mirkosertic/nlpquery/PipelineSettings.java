package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.config.ApplicationConfig;

import java.time.Duration;

/**
 * Startup settings of the pipeline that cannot change at runtime.
 *
 * @param batchChunkSize queries processed concurrently per chunk of an aggressive batch
 * @param sessionMaxAge  inactivity after which {@link NlpQueryPipeline#cleanupSessions()} drops a session
 * @param maxExpansions  expansion terms requested per query
 */
public record PipelineSettings(int batchChunkSize, Duration sessionMaxAge, int maxExpansions) {

    public PipelineSettings {
        if (batchChunkSize <= 0) {
            throw new ValidationException("Batch chunk size must be positive: " + batchChunkSize);
        }
        if (maxExpansions <= 0) {
            throw new ValidationException("Expansion count must be positive: " + maxExpansions);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(10, Duration.ofHours(24), 10);
    }

    public static PipelineSettings from(final ApplicationConfig config) {
        return new PipelineSettings(config.getBatchChunkSize(), Duration.ofMillis(config.getSessionMaxAgeMs()),
                config.getMaxExpansions());
    }
}
