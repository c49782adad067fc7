package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.config.ApplicationConfig;
import de.mirkosertic.nlpquery.config.ConfigurationUpdate;
import de.mirkosertic.nlpquery.config.LoggingConfigurator;
import de.mirkosertic.nlpquery.config.PerformanceMode;
import de.mirkosertic.nlpquery.config.PipelineConfiguration;
import de.mirkosertic.nlpquery.context.ContextManager;
import de.mirkosertic.nlpquery.context.UserActivity;
import de.mirkosertic.nlpquery.expansion.ExpandedQuery;
import de.mirkosertic.nlpquery.expansion.QueryExpander;
import de.mirkosertic.nlpquery.intent.EntityType;
import de.mirkosertic.nlpquery.intent.IntentExtractor;
import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.multilingual.MultilingualProcessor;
import de.mirkosertic.nlpquery.multilingual.MultilingualQueryResult;
import de.mirkosertic.nlpquery.refinement.QueryRefinementEngine;
import de.mirkosertic.nlpquery.refinement.RefinementAnalysis;
import de.mirkosertic.nlpquery.refinement.RefinementSuggestion;
import de.mirkosertic.nlpquery.search.DocumentSearchBackend;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.search.SpeechRecognizer;
import de.mirkosertic.nlpquery.template.ExecutableTemplate;
import de.mirkosertic.nlpquery.template.QuestionTemplate;
import de.mirkosertic.nlpquery.template.QuestionTemplateLibrary;
import de.mirkosertic.nlpquery.template.TemplateParameter;
import de.mirkosertic.nlpquery.template.TemplateSearchResult;
import de.mirkosertic.nlpquery.util.QuerySanitizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs a query through intent extraction, expansion, language handling, template matching and
 * refinement, then materializes the selected query against the search backend.
 *
 * <p>Stages run sequentially within one call. Independent calls may run concurrently and share the
 * result cache and the refinement sessions.</p>
 */
public class NlpQueryPipeline {

    private static final Logger logger = LoggerFactory.getLogger(NlpQueryPipeline.class);

    public static final String INTENT_EXTRACTOR = "IntentExtractor";
    public static final String QUERY_EXPANDER = "QueryExpander";
    public static final String MULTILINGUAL_PROCESSOR = "MultilingualProcessor";
    public static final String TEMPLATE_LIBRARY = "QuestionTemplateLibrary";
    public static final String REFINEMENT_ENGINE = "QueryRefinementEngine";

    static final int TEMPLATE_CANDIDATES = 5;
    static final String ANONYMOUS_USER = "anonymous";

    private final IntentExtractor intentExtractor;
    private final QueryExpander queryExpander;
    private final ContextManager contextManager;
    private final MultilingualProcessor multilingualProcessor;
    private final QuestionTemplateLibrary templateLibrary;
    private final QueryRefinementEngine refinementEngine;
    private final DocumentSearchBackend searchBackend;
    private final SpeechRecognizer speechRecognizer;
    private final PipelineExecutor executor;
    private final PipelineSettings settings;
    private final Clock clock;

    private final ResultCache cache;
    private final PipelineMetrics metrics = new PipelineMetrics();
    private final Map<String, String> userSessions = new ConcurrentHashMap<>();

    private volatile PipelineConfiguration configuration;

    public NlpQueryPipeline(final IntentExtractor intentExtractor,
                            final QueryExpander queryExpander,
                            final ContextManager contextManager,
                            final MultilingualProcessor multilingualProcessor,
                            final QuestionTemplateLibrary templateLibrary,
                            final QueryRefinementEngine refinementEngine,
                            final DocumentSearchBackend searchBackend,
                            final SpeechRecognizer speechRecognizer,
                            final PipelineConfiguration configuration,
                            final PipelineExecutor executor,
                            final Clock clock) {
        this(intentExtractor, queryExpander, contextManager, multilingualProcessor, templateLibrary, refinementEngine,
                searchBackend, speechRecognizer, configuration, executor, PipelineSettings.defaults(), clock);
    }

    public NlpQueryPipeline(final IntentExtractor intentExtractor,
                            final QueryExpander queryExpander,
                            final ContextManager contextManager,
                            final MultilingualProcessor multilingualProcessor,
                            final QuestionTemplateLibrary templateLibrary,
                            final QueryRefinementEngine refinementEngine,
                            final DocumentSearchBackend searchBackend,
                            final SpeechRecognizer speechRecognizer,
                            final PipelineConfiguration configuration,
                            final PipelineExecutor executor,
                            final PipelineSettings settings,
                            final Clock clock) {
        this.intentExtractor = intentExtractor;
        this.queryExpander = queryExpander;
        this.contextManager = contextManager;
        this.multilingualProcessor = multilingualProcessor;
        this.templateLibrary = templateLibrary;
        this.refinementEngine = refinementEngine;
        this.searchBackend = searchBackend;
        this.speechRecognizer = speechRecognizer;
        this.executor = executor;
        this.settings = settings;
        this.clock = clock;
        this.configuration = configuration;
        this.cache = new ResultCache(Duration.ofMillis(configuration.cacheTtlMs()), configuration.maxCacheSize(), clock);

        if (configuration.debugMode()) {
            LoggingConfigurator.applyDebugMode(true);
        }
        if (configuration.performanceOptimization() == PerformanceMode.AGGRESSIVE) {
            warmUp();
        }
        logger.info("NLP query pipeline ready (expansion={}, multilingual={}, templates={}, refinement={}, voice={}, cache={}, mode={})",
                configuration.enableQueryExpansion(), configuration.enableMultilingualSupport(),
                configuration.enableTemplateSystem(), configuration.enableQueryRefinement(),
                configuration.enableVoiceInput(), configuration.cacheEnabled(),
                configuration.performanceOptimization().code());
    }

    /**
     * Wire every component with its defaults from the startup configuration.
     */
    public static NlpQueryPipeline create(final ApplicationConfig config, final DocumentSearchBackend searchBackend,
                                          final SpeechRecognizer speechRecognizer) {
        final Clock clock = Clock.systemUTC();
        return new NlpQueryPipeline(
                new IntentExtractor(),
                new QueryExpander(),
                new ContextManager(clock),
                new MultilingualProcessor(),
                new QuestionTemplateLibrary(clock),
                new QueryRefinementEngine(clock),
                searchBackend,
                speechRecognizer,
                config.toPipelineConfiguration(),
                new PipelineExecutor(config),
                PipelineSettings.from(config),
                clock);
    }

    public NlpProcessingResult processQuery(final String query) {
        return processQuery(query, ProcessingOptions.defaults());
    }

    /**
     * Process a query synchronously.
     *
     * @throws ValidationException for an empty, too short or too long query
     */
    public NlpProcessingResult processQuery(final String query, final ProcessingOptions options) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must be a non-empty string");
        }
        final long start = clock.millis();
        final PipelineConfiguration config = configuration;
        final Language language = options.language() != null ? options.language() : IntentExtractor.inferLanguage(query);
        final String cacheKey = ResultCache.fingerprint(query, language, options.userId());

        if (config.cacheEnabled() && !options.skipCache()) {
            final Optional<NlpProcessingResult> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                final long elapsed = clock.millis() - start;
                metrics.recordQuery(elapsed, true, false);
                logger.debug("Cache hit for '{}'", query);
                return cached.get().asCacheHit(elapsed);
            }
        }

        final QueryIntent intent;
        try {
            intent = intentExtractor.extract(query, language);
        } catch (final ValidationException e) {
            throw e;
        } catch (final RuntimeException e) {
            final long elapsed = clock.millis() - start;
            logger.error("Intent extraction failed for '{}', returning fallback result", query, e);
            metrics.recordQuery(elapsed, false, true);
            return NlpProcessingResult.fallback(query, elapsed);
        }

        try {
            return runStages(query, options, config, language, cacheKey, intent, start);
        } catch (final ValidationException e) {
            throw e;
        } catch (final RuntimeException e) {
            final long elapsed = clock.millis() - start;
            logger.error("Processing of '{}' failed, returning fallback result", query, e);
            metrics.recordQuery(elapsed, false, true);
            return NlpProcessingResult.fallback(query, elapsed);
        }
    }

    private NlpProcessingResult runStages(final String query, final ProcessingOptions options,
                                          final PipelineConfiguration config, final Language language,
                                          final String cacheKey, final QueryIntent intent, final long start) {
        final List<String> used = new ArrayList<>();
        final List<Double> confidences = new ArrayList<>();
        used.add(INTENT_EXTRACTOR);
        confidences.add(intent.confidence());

        ExpandedQuery expanded = null;
        if (config.enableQueryExpansion()) {
            expanded = runStage(QUERY_EXPANDER, used,
                    () -> queryExpander.expandQuery(query, settings.maxExpansions(), language));
            if (expanded != null && !expanded.isEmpty()) {
                confidences.add(expansionConfidence(expanded));
            }
        }

        MultilingualQueryResult multilingual = null;
        if (config.enableMultilingualSupport()) {
            multilingual = runStage(MULTILINGUAL_PROCESSOR, used, () -> multilingualProcessor.processQuery(query));
            if (multilingual != null) {
                confidences.add(multilingual.detection().confidence());
            }
        }

        ExecutableTemplate templateMatch = null;
        if (config.enableTemplateSystem()) {
            final List<TemplateSearchResult> candidates = runStage(TEMPLATE_LIBRARY, used,
                    () -> templateLibrary.searchTemplates(query, TEMPLATE_CANDIDATES));
            if (candidates != null && !candidates.isEmpty()) {
                confidences.add(candidates.get(0).score());
                templateMatch = bestExecutableTemplate(query, intent, candidates);
            }
        }

        final String processedQuery = selectQuery(query, templateMatch, expanded);
        final List<DocumentSearchResult> searchResults = search(processedQuery);

        if (multilingual != null && !searchResults.isEmpty()) {
            try {
                multilingual = multilingual.withCrossLanguageMatches(
                        multilingualProcessor.findCrossLanguageMatches(query, searchResults));
            } catch (final RuntimeException e) {
                logger.warn("Cross-language matching failed for '{}': {}", query, e.getMessage());
                metrics.recordComponentFailure(MULTILINGUAL_PROCESSOR);
            }
        }

        List<RefinementSuggestion> suggestions = List.of();
        if (config.enableQueryRefinement()) {
            final RefinementOutcome refined = runStage(REFINEMENT_ENGINE, used, () -> {
                final String sessionId = sessionFor(options);
                final RefinementAnalysis analysis =
                        refinementEngine.addQueryToSession(sessionId, query, intent, searchResults);
                return new RefinementOutcome(analysis, refinementEngine.getRefinementSuggestions(sessionId));
            });
            if (refined != null) {
                confidences.add(refined.analysis().confidence());
                suggestions = refined.suggestions();
            }
        }

        if (options.userId() != null) {
            try {
                contextManager.updateUserActivity(options.userId(), UserActivity.query(query));
            } catch (final RuntimeException e) {
                logger.warn("Could not record activity of user '{}': {}", options.userId(), e.getMessage());
            }
        }

        final double confidence = confidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        final long elapsed = clock.millis() - start;
        final NlpProcessingResult result = new NlpProcessingResult(query, processedQuery, expanded, multilingual,
                templateMatch, suggestions, searchResults, confidence, elapsed,
                new ProcessingMetadata(used, false, false));

        if (config.cacheEnabled()) {
            cache.put(cacheKey, result);
        }
        metrics.recordQuery(elapsed, false, false);
        logger.debug("Processed '{}' into '{}' with confidence {} using {} in {}ms",
                query, processedQuery, confidence, used, elapsed);
        return result;
    }

    /**
     * Process a query on the work queue. In aggressive mode a high priority query runs directly on
     * the calling thread.
     */
    public CompletableFuture<NlpProcessingResult> processQueryAsync(final String query, final ProcessingOptions options) {
        if (configuration.performanceOptimization() == PerformanceMode.AGGRESSIVE
                && options.priority() == Priority.HIGH) {
            try {
                return CompletableFuture.completedFuture(processQuery(query, options));
            } catch (final RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return executor.submit(() -> processQuery(query, options));
    }

    /**
     * Process several queries, results in input order. Aggressive mode processes chunks of
     * {@link PipelineSettings#batchChunkSize()} queries and waits for each chunk before starting the next.
     *
     * @throws ValidationException if any query is invalid
     */
    public List<NlpProcessingResult> processQueryBatch(final List<String> queries, final ProcessingOptions options) {
        final List<NlpProcessingResult> results = new ArrayList<>(queries.size());
        if (configuration.performanceOptimization() == PerformanceMode.AGGRESSIVE) {
            for (int from = 0; from < queries.size(); from += settings.batchChunkSize()) {
                final List<String> chunk = queries.subList(from, Math.min(from + settings.batchChunkSize(), queries.size()));
                results.addAll(joinAll(chunk.stream()
                        .map(q -> executor.submit(() -> processQuery(q, options)))
                        .toList()));
            }
        } else {
            results.addAll(joinAll(queries.stream()
                    .map(q -> executor.submit(() -> processQuery(q, options)))
                    .toList()));
        }
        return results;
    }

    private static List<NlpProcessingResult> joinAll(final List<CompletableFuture<NlpProcessingResult>> futures) {
        final List<NlpProcessingResult> results = new ArrayList<>(futures.size());
        for (final CompletableFuture<NlpProcessingResult> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw e;
            }
        }
        return results;
    }

    /**
     * Recognize a transcribed utterance and process it as a query.
     *
     * @throws IllegalStateException if voice input is disabled
     */
    public VoiceQueryResult processVoiceQuery(final String text, final ProcessingOptions options) {
        if (!configuration.enableVoiceInput()) {
            throw new IllegalStateException("Voice input is disabled");
        }
        return new VoiceQueryResult(speechRecognizer.processVoiceInput(text), processQuery(text, options));
    }

    /**
     * Apply the non-null fields of the update. Takes effect for the next query.
     *
     * @throws ValidationException if the merged configuration is invalid; the current one is kept
     */
    public synchronized PipelineConfiguration updateConfiguration(final ConfigurationUpdate update) {
        final PipelineConfiguration previous = configuration;
        final PipelineConfiguration merged = previous.merge(update);
        configuration = merged;

        cache.reconfigure(Duration.ofMillis(merged.cacheTtlMs()), merged.maxCacheSize());
        if (previous.cacheEnabled() && !merged.cacheEnabled()) {
            cache.clear();
        } else if (stagesChanged(previous, merged)) {
            logger.info("Enabled pipeline stages changed, dropping {} cached results", cache.size());
            cache.clear();
        }
        if (previous.debugMode() != merged.debugMode()) {
            LoggingConfigurator.applyDebugMode(merged.debugMode());
        }
        if (update.performanceOptimization() == PerformanceMode.AGGRESSIVE) {
            warmUp();
        }
        logger.info("Pipeline configuration updated: {}", merged);
        return merged;
    }

    // Cached results name the stages that produced them
    private static boolean stagesChanged(final PipelineConfiguration previous, final PipelineConfiguration merged) {
        return previous.enableQueryExpansion() != merged.enableQueryExpansion()
                || previous.enableMultilingualSupport() != merged.enableMultilingualSupport()
                || previous.enableTemplateSystem() != merged.enableTemplateSystem()
                || previous.enableQueryRefinement() != merged.enableQueryRefinement()
                || previous.enableVoiceInput() != merged.enableVoiceInput();
    }

    private void warmUp() {
        logger.info("Aggressive mode: warming up intent patterns, expansion dictionaries and templates");
        intentExtractor.warmUp();
        queryExpander.warmUp();
        templateLibrary.preloadTemplates();
    }

    public PipelineConfiguration getConfiguration() {
        return configuration;
    }

    public CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    public PipelineMetrics.Snapshot getPerformanceMetrics() {
        return metrics.snapshot();
    }

    public QueryRefinementEngine getRefinementEngine() {
        return refinementEngine;
    }

    /**
     * Drop refinement sessions inactive for longer than the configured session age.
     *
     * @return number of removed sessions
     */
    public int cleanupSessions() {
        final int removed = refinementEngine.cleanupOldSessions(settings.sessionMaxAge());
        if (removed > 0) {
            userSessions.values().removeIf(sessionId -> refinementEngine.getSession(sessionId).isEmpty());
        }
        return removed;
    }

    /**
     * Clear the result cache and reset the metrics.
     */
    public void cleanup() {
        cache.clear();
        metrics.reset();
        logger.info("Pipeline cache and metrics cleared");
    }

    public void shutdown() {
        executor.shutdown();
        multilingualProcessor.close();
    }

    private <T> @Nullable T runStage(final String component, final List<String> used, final Supplier<T> stage) {
        try {
            final T output = stage.get();
            if (output != null) {
                used.add(component);
            }
            return output;
        } catch (final RuntimeException e) {
            logger.warn("{} failed, continuing without it: {}", component, e.getMessage());
            metrics.recordComponentFailure(component);
            return null;
        }
    }

    private static double expansionConfidence(final ExpandedQuery expanded) {
        return expanded.topVariation()
                .map(variation -> variation.score())
                .orElseGet(() -> expanded.expandedTerms().isEmpty() ? 0.0 : expanded.expandedTerms().get(0).confidence());
    }

    private @Nullable ExecutableTemplate bestExecutableTemplate(final String query, final QueryIntent intent,
                                                                 final List<TemplateSearchResult> candidates) {
        for (final TemplateSearchResult candidate : candidates) {
            final Optional<Map<String, String>> parameters = fillParameters(candidate.template(), query, intent);
            if (parameters.isEmpty()) {
                continue;
            }
            try {
                return templateLibrary.executeTemplate(candidate.template().id(), parameters.get());
            } catch (final RuntimeException e) {
                logger.warn("Template '{}' could not be executed: {}", candidate.template().id(), e.getMessage());
                metrics.recordComponentFailure(TEMPLATE_LIBRARY);
            }
        }
        return null;
    }

    /**
     * Parameters of the template taken from the intent entities, or empty if a required one is missing.
     */
    static Optional<Map<String, String>> fillParameters(final QuestionTemplate template, final String query,
                                                        final QueryIntent intent) {
        final Map<String, String> values = new HashMap<>();
        for (final TemplateParameter parameter : template.parameters()) {
            final Optional<String> value = switch (parameter.name()) {
                case "type" -> intent.firstNormalized(EntityType.DOCUMENT_TYPE);
                case "author" -> intent.firstNormalized(EntityType.AUTHOR);
                case "topic" -> intent.firstNormalized(EntityType.TOPIC);
                case "status" -> parameter.options().stream()
                        .filter(option -> QuerySanitizer.wholeWord(option).matcher(query).find())
                        .findFirst();
                default -> Optional.empty();
            };
            if (value.isPresent()) {
                values.put(parameter.name(), value.get());
            } else if (parameter.required()) {
                return Optional.empty();
            }
        }
        return Optional.of(values);
    }

    private static String selectQuery(final String query, final @Nullable ExecutableTemplate template,
                                      final @Nullable ExpandedQuery expanded) {
        if (template != null && !template.generatedQuery().isBlank()) {
            return template.generatedQuery();
        }
        if (expanded != null) {
            final Optional<String> variation = expanded.topVariation().map(v -> v.query());
            if (variation.isPresent()) {
                return variation.get();
            }
        }
        return query;
    }

    private List<DocumentSearchResult> search(final String processedQuery) {
        try {
            final List<DocumentSearchResult> results = searchBackend.search(processedQuery);
            return results == null ? List.of() : results.stream().filter(Objects::nonNull).toList();
        } catch (final RuntimeException e) {
            logger.warn("Search backend failed for '{}': {}", processedQuery, e.getMessage());
            return List.of();
        }
    }

    private String sessionFor(final ProcessingOptions options) {
        if (options.sessionId() != null) {
            return options.sessionId();
        }
        final String user = options.userId() != null ? options.userId() : ANONYMOUS_USER;
        return userSessions.compute(user, (key, existing) -> {
            if (existing != null && refinementEngine.getSession(existing).isPresent()) {
                return existing;
            }
            return refinementEngine.createSession(key, contextManager.getCurrentUserContext()
                    .filter(context -> context.getId().equals(key))
                    .orElse(null));
        });
    }

    private record RefinementOutcome(RefinementAnalysis analysis, List<RefinementSuggestion> suggestions) {
    }
}
