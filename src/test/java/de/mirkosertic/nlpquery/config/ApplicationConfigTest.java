package de.mirkosertic.nlpquery.config;

import de.mirkosertic.nlpquery.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationConfigTest {

    private static ApplicationConfig load(final String resource, final Path userConfig, final Map<String, String> env,
                                          final Properties properties) {
        return ApplicationConfig.load(resource, userConfig, env::get, properties);
    }

    @Test
    void shouldLoadClasspathDefaults() {
        final ApplicationConfig config = load("application.yaml", null, Map.of(), new Properties());

        final PipelineConfiguration pipeline = config.toPipelineConfiguration();
        assertThat(pipeline).isEqualTo(PipelineConfiguration.defaults());
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getQueueCapacity()).isEqualTo(1000);
        assertThat(config.getBatchChunkSize()).isEqualTo(10);
        assertThat(config.getSessionMaxAgeMs()).isEqualTo(86_400_000L);
        assertThat(config.getDefaultLanguage()).isEqualTo(Language.EN);
        assertThat(config.getMaxExpansions()).isEqualTo(10);
    }

    @Test
    void shouldApplyYamlAndResolvePlaceholderDefaults() {
        final ApplicationConfig config = load("test-config.yaml", null, Map.of(), new Properties());

        final PipelineConfiguration pipeline = config.toPipelineConfiguration();
        assertThat(pipeline.enableQueryExpansion()).isFalse();
        assertThat(pipeline.enableVoiceInput()).isFalse();
        assertThat(pipeline.enableTemplateSystem()).isTrue();
        assertThat(pipeline.performanceOptimization()).isEqualTo(PerformanceMode.AGGRESSIVE);
        assertThat(pipeline.cacheTtlMs()).isEqualTo(60_000L);
        assertThat(pipeline.maxCacheSize()).isEqualTo(25);
        assertThat(config.getBatchChunkSize()).isEqualTo(3);
        assertThat(config.getSessionMaxAgeMs()).isEqualTo(3_600_000L);
        assertThat(config.getDefaultLanguage()).isEqualTo(Language.AR);
    }

    @Test
    void shouldResolvePlaceholdersFromEnvironment() {
        final ApplicationConfig config = load("test-config.yaml", null,
                Map.of("NLPQUERY_TEST_TTL", "1234"), new Properties());

        assertThat(config.getCacheTtlMs()).isEqualTo(1234L);
    }

    @Test
    void shouldPreferEnvironmentOverSystemPropertiesOverUserFile(@TempDir final Path dir) throws IOException {
        final Path userConfig = dir.resolve("config.yaml");
        Files.writeString(userConfig, """
                nlp:
                  cache:
                    max-size: 50
                    ttl-ms: 1000
                  pipeline:
                    debug-mode: true
                """);
        final Properties properties = new Properties();
        properties.setProperty("nlpquery.cache.max-size", "75");
        properties.setProperty("nlpquery.performance-mode", "aggressive");

        final ApplicationConfig config = load("application.yaml", userConfig,
                Map.of(ApplicationConfig.ENV_MAX_CACHE_SIZE, "99", ApplicationConfig.ENV_CACHE_ENABLED, "false"),
                properties);

        assertThat(config.getMaxCacheSize()).isEqualTo(99);
        assertThat(config.getCacheTtlMs()).isEqualTo(1000L);
        assertThat(config.isDebugMode()).isTrue();
        assertThat(config.isCacheEnabled()).isFalse();
        assertThat(config.getPerformanceMode()).isEqualTo(PerformanceMode.AGGRESSIVE);
    }

    @Test
    void shouldKeepDefaultsForInvalidValues(@TempDir final Path dir) throws IOException {
        final Path userConfig = dir.resolve("config.yaml");
        Files.writeString(userConfig, """
                nlp:
                  cache:
                    ttl-ms: soon
                  pipeline:
                    performance-optimization: turbo
                  defaults:
                    language: mixed
                """);

        final ApplicationConfig config = load("application.yaml", userConfig,
                Map.of(ApplicationConfig.ENV_DEBUG, "maybe"), new Properties());

        assertThat(config.getCacheTtlMs()).isEqualTo(PipelineConfiguration.DEFAULT_CACHE_TTL_MS);
        assertThat(config.getPerformanceMode()).isEqualTo(PerformanceMode.BASIC);
        assertThat(config.getDefaultLanguage()).isEqualTo(Language.EN);
        assertThat(config.isDebugMode()).isFalse();
    }

    @Test
    void shouldSurviveMalformedOrMissingFiles(@TempDir final Path dir) throws IOException {
        final Path userConfig = dir.resolve("config.yaml");
        Files.writeString(userConfig, "nlp: [unclosed");

        final ApplicationConfig config = load("does-not-exist.yaml", userConfig, Map.of(), new Properties());

        assertThat(config.toPipelineConfiguration()).isEqualTo(PipelineConfiguration.defaults());
    }
}
