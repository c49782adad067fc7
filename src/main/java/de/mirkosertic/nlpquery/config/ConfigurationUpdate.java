package de.mirkosertic.nlpquery.config;

import org.jspecify.annotations.Nullable;

/**
 * Partial configuration change. Null fields keep their current value.
 */
public record ConfigurationUpdate(
        @Nullable Boolean enableQueryExpansion,
        @Nullable Boolean enableMultilingualSupport,
        @Nullable Boolean enableTemplateSystem,
        @Nullable Boolean enableQueryRefinement,
        @Nullable Boolean enableVoiceInput,
        @Nullable Boolean cacheEnabled,
        @Nullable Long cacheTtlMs,
        @Nullable Integer maxCacheSize,
        @Nullable PerformanceMode performanceOptimization,
        @Nullable Boolean debugMode
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private @Nullable Boolean enableQueryExpansion;
        private @Nullable Boolean enableMultilingualSupport;
        private @Nullable Boolean enableTemplateSystem;
        private @Nullable Boolean enableQueryRefinement;
        private @Nullable Boolean enableVoiceInput;
        private @Nullable Boolean cacheEnabled;
        private @Nullable Long cacheTtlMs;
        private @Nullable Integer maxCacheSize;
        private @Nullable PerformanceMode performanceOptimization;
        private @Nullable Boolean debugMode;

        private Builder() {
        }

        public Builder enableQueryExpansion(final boolean value) {
            this.enableQueryExpansion = value;
            return this;
        }

        public Builder enableMultilingualSupport(final boolean value) {
            this.enableMultilingualSupport = value;
            return this;
        }

        public Builder enableTemplateSystem(final boolean value) {
            this.enableTemplateSystem = value;
            return this;
        }

        public Builder enableQueryRefinement(final boolean value) {
            this.enableQueryRefinement = value;
            return this;
        }

        public Builder enableVoiceInput(final boolean value) {
            this.enableVoiceInput = value;
            return this;
        }

        public Builder cacheEnabled(final boolean value) {
            this.cacheEnabled = value;
            return this;
        }

        public Builder cacheTtlMs(final long value) {
            this.cacheTtlMs = value;
            return this;
        }

        public Builder maxCacheSize(final int value) {
            this.maxCacheSize = value;
            return this;
        }

        public Builder performanceOptimization(final PerformanceMode value) {
            this.performanceOptimization = value;
            return this;
        }

        public Builder debugMode(final boolean value) {
            this.debugMode = value;
            return this;
        }

        public ConfigurationUpdate build() {
            return new ConfigurationUpdate(enableQueryExpansion, enableMultilingualSupport, enableTemplateSystem,
                    enableQueryRefinement, enableVoiceInput, cacheEnabled, cacheTtlMs, maxCacheSize,
                    performanceOptimization, debugMode);
        }
    }
}
