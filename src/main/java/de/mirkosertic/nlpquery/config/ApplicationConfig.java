package de.mirkosertic.nlpquery.config;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.NlpQueryException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Startup configuration of the query pipeline.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.nlpquery/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_CACHE_ENABLED = "NLPQUERY_CACHE_ENABLED";
    static final String ENV_CACHE_TTL_MS = "NLPQUERY_CACHE_TTL_MS";
    static final String ENV_MAX_CACHE_SIZE = "NLPQUERY_MAX_CACHE_SIZE";
    static final String ENV_PERFORMANCE_MODE = "NLPQUERY_PERFORMANCE_MODE";
    static final String ENV_DEBUG = "NLPQUERY_DEBUG";

    private static final String CONFIG_DIR = ".nlpquery";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Function<String, String> environment;
    private final Properties systemProperties;

    // Pipeline switches
    private boolean enableQueryExpansion = true;
    private boolean enableMultilingualSupport = true;
    private boolean enableTemplateSystem = true;
    private boolean enableQueryRefinement = true;
    private boolean enableVoiceInput = true;
    private PerformanceMode performanceMode = PerformanceMode.BASIC;
    private boolean debugMode = false;

    // Cache settings
    private boolean cacheEnabled = true;
    private long cacheTtlMs = PipelineConfiguration.DEFAULT_CACHE_TTL_MS;
    private int maxCacheSize = PipelineConfiguration.DEFAULT_MAX_CACHE_SIZE;

    // Execution settings
    private int workerThreads = 4;
    private int queueCapacity = 1000;
    private int batchChunkSize = 10;

    // Session and query defaults
    private long sessionMaxAgeMs = 24 * 60 * 60 * 1000L;
    private Language defaultLanguage = Language.EN;
    private int maxExpansions = 10;

    private ApplicationConfig(final Function<String, String> environment, final Properties systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(DEFAULT_CONFIG_FILE, getUserConfigPath(), System::getenv, System.getProperties());
    }

    /**
     * Load configuration from the given classpath resource, an optional user file and the given
     * environment and system properties.
     */
    static ApplicationConfig load(final String classpathResource, final @Nullable Path userConfig,
                                  final Function<String, String> environment, final Properties systemProperties) {
        final ApplicationConfig config = new ApplicationConfig(environment, systemProperties);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath(classpathResource);

        // Step 2: Load user config file (may override some settings)
        if (userConfig != null) {
            config.loadFromUserConfig(userConfig);
        }

        // Step 3: System properties, then environment variables (highest priority)
        config.applySystemPropertyOverrides();
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: cacheEnabled={}, cacheTtlMs={}, maxCacheSize={}, performanceMode={}, debugMode={}",
                config.cacheEnabled, config.cacheTtlMs, config.maxCacheSize, config.performanceMode.code(),
                config.debugMode);

        return config;
    }

    private void loadFromClasspath(final String resource) {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", resource);
                }
            } else {
                logger.warn("Config resource not found on classpath: {}", resource);
            }
        } catch (final IOException | YAMLException | ClassCastException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException | YAMLException | ClassCastException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> nlpConfig = (Map<String, Object>) config.get("nlp");
        if (nlpConfig == null) {
            return;
        }

        final Map<String, Object> pipelineConfig = (Map<String, Object>) nlpConfig.get("pipeline");
        if (pipelineConfig != null) {
            applyPipelineConfig(pipelineConfig);
        }

        final Map<String, Object> cacheConfig = (Map<String, Object>) nlpConfig.get("cache");
        if (cacheConfig != null) {
            if (cacheConfig.containsKey("enabled")) {
                this.cacheEnabled = booleanValue(cacheConfig.get("enabled"), cacheEnabled);
            }
            if (cacheConfig.containsKey("ttl-ms")) {
                this.cacheTtlMs = longValue(cacheConfig.get("ttl-ms"), cacheTtlMs);
            }
            if (cacheConfig.containsKey("max-size")) {
                this.maxCacheSize = intValue(cacheConfig.get("max-size"), maxCacheSize);
            }
        }

        final Map<String, Object> executionConfig = (Map<String, Object>) nlpConfig.get("execution");
        if (executionConfig != null) {
            if (executionConfig.containsKey("worker-threads")) {
                this.workerThreads = intValue(executionConfig.get("worker-threads"), workerThreads);
            }
            if (executionConfig.containsKey("queue-capacity")) {
                this.queueCapacity = intValue(executionConfig.get("queue-capacity"), queueCapacity);
            }
            if (executionConfig.containsKey("batch-chunk-size")) {
                this.batchChunkSize = intValue(executionConfig.get("batch-chunk-size"), batchChunkSize);
            }
        }

        final Map<String, Object> sessionConfig = (Map<String, Object>) nlpConfig.get("session");
        if (sessionConfig != null && sessionConfig.containsKey("max-age-ms")) {
            this.sessionMaxAgeMs = longValue(sessionConfig.get("max-age-ms"), sessionMaxAgeMs);
        }

        final Map<String, Object> defaultsConfig = (Map<String, Object>) nlpConfig.get("defaults");
        if (defaultsConfig != null) {
            if (defaultsConfig.containsKey("language")) {
                this.defaultLanguage = languageValue(defaultsConfig.get("language"), defaultLanguage);
            }
            if (defaultsConfig.containsKey("max-expansions")) {
                this.maxExpansions = intValue(defaultsConfig.get("max-expansions"), maxExpansions);
            }
        }
    }

    private void applyPipelineConfig(final Map<String, Object> pipelineConfig) {
        if (pipelineConfig.containsKey("enable-query-expansion")) {
            this.enableQueryExpansion = booleanValue(pipelineConfig.get("enable-query-expansion"), enableQueryExpansion);
        }
        if (pipelineConfig.containsKey("enable-multilingual-support")) {
            this.enableMultilingualSupport = booleanValue(pipelineConfig.get("enable-multilingual-support"),
                    enableMultilingualSupport);
        }
        if (pipelineConfig.containsKey("enable-template-system")) {
            this.enableTemplateSystem = booleanValue(pipelineConfig.get("enable-template-system"), enableTemplateSystem);
        }
        if (pipelineConfig.containsKey("enable-query-refinement")) {
            this.enableQueryRefinement = booleanValue(pipelineConfig.get("enable-query-refinement"),
                    enableQueryRefinement);
        }
        if (pipelineConfig.containsKey("enable-voice-input")) {
            this.enableVoiceInput = booleanValue(pipelineConfig.get("enable-voice-input"), enableVoiceInput);
        }
        if (pipelineConfig.containsKey("performance-optimization")) {
            this.performanceMode = performanceValue(pipelineConfig.get("performance-optimization"), performanceMode);
        }
        if (pipelineConfig.containsKey("debug-mode")) {
            this.debugMode = booleanValue(pipelineConfig.get("debug-mode"), debugMode);
        }
    }

    private void applySystemPropertyOverrides() {
        applyCacheEnabled(systemProperties.getProperty("nlpquery.cache.enabled"), "nlpquery.cache.enabled");
        applyTtl(systemProperties.getProperty("nlpquery.cache.ttl-ms"));
        applySize(systemProperties.getProperty("nlpquery.cache.max-size"));
        applyMode(systemProperties.getProperty("nlpquery.performance-mode"));
        applyDebug(systemProperties.getProperty("nlpquery.debug"));
    }

    private void applyEnvironmentOverrides() {
        applyCacheEnabled(environment.apply(ENV_CACHE_ENABLED), ENV_CACHE_ENABLED);
        applyTtl(environment.apply(ENV_CACHE_TTL_MS));
        applySize(environment.apply(ENV_MAX_CACHE_SIZE));
        applyMode(environment.apply(ENV_PERFORMANCE_MODE));
        applyDebug(environment.apply(ENV_DEBUG));
    }

    private void applyCacheEnabled(final @Nullable String value, final String source) {
        if (isSet(value)) {
            this.cacheEnabled = booleanValue(value, cacheEnabled);
            logger.info("Cache enabled from {}: {}", source, cacheEnabled);
        }
    }

    private void applyTtl(final @Nullable String value) {
        if (isSet(value)) {
            this.cacheTtlMs = longValue(value, cacheTtlMs);
        }
    }

    private void applySize(final @Nullable String value) {
        if (isSet(value)) {
            this.maxCacheSize = intValue(value, maxCacheSize);
        }
    }

    private void applyMode(final @Nullable String value) {
        if (isSet(value)) {
            this.performanceMode = performanceValue(value, performanceMode);
        }
    }

    private void applyDebug(final @Nullable String value) {
        if (isSet(value)) {
            this.debugMode = booleanValue(value, debugMode);
        }
    }

    private static boolean isSet(final @Nullable String value) {
        return value != null && !value.trim().isEmpty();
    }

    private boolean booleanValue(final Object value, final boolean fallback) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        final String text = resolveVariables(String.valueOf(value)).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        logger.warn("Ignoring invalid boolean value '{}'", text);
        return fallback;
    }

    private long longValue(final Object value, final long fallback) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        final String text = resolveVariables(String.valueOf(value)).trim();
        try {
            return Long.parseLong(text);
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring invalid number '{}'", text);
            return fallback;
        }
    }

    private int intValue(final Object value, final int fallback) {
        return (int) longValue(value, fallback);
    }

    private PerformanceMode performanceValue(final Object value, final PerformanceMode fallback) {
        try {
            return PerformanceMode.fromCode(resolveVariables(String.valueOf(value)));
        } catch (final NlpQueryException e) {
            logger.warn("Ignoring performance mode: {}", e.getMessage());
            return fallback;
        }
    }

    private Language languageValue(final Object value, final Language fallback) {
        try {
            return Language.queryLanguage(resolveVariables(String.valueOf(value)));
        } catch (final NlpQueryException e) {
            logger.warn("Ignoring default language: {}", e.getMessage());
            return fallback;
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.apply(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * The runtime switches described by this configuration.
     */
    public PipelineConfiguration toPipelineConfiguration() {
        return new PipelineConfiguration(enableQueryExpansion, enableMultilingualSupport, enableTemplateSystem,
                enableQueryRefinement, enableVoiceInput, cacheEnabled, cacheTtlMs, maxCacheSize, performanceMode,
                debugMode);
    }

    // Getters
    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheTtlMs() {
        return cacheTtlMs;
    }

    public int getMaxCacheSize() {
        return maxCacheSize;
    }

    public PerformanceMode getPerformanceMode() {
        return performanceMode;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getBatchChunkSize() {
        return batchChunkSize;
    }

    public long getSessionMaxAgeMs() {
        return sessionMaxAgeMs;
    }

    public Language getDefaultLanguage() {
        return defaultLanguage;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }
}
