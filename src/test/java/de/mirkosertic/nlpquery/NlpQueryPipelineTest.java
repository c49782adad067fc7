package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.config.ConfigurationUpdate;
import de.mirkosertic.nlpquery.config.PerformanceMode;
import de.mirkosertic.nlpquery.config.PipelineConfiguration;
import de.mirkosertic.nlpquery.context.ContextManager;
import de.mirkosertic.nlpquery.context.UserActivity;
import de.mirkosertic.nlpquery.expansion.ExpandedQuery;
import de.mirkosertic.nlpquery.expansion.QueryExpander;
import de.mirkosertic.nlpquery.expansion.RankedVariation;
import de.mirkosertic.nlpquery.intent.EntityType;
import de.mirkosertic.nlpquery.intent.IntentExtractor;
import de.mirkosertic.nlpquery.intent.IntentType;
import de.mirkosertic.nlpquery.intent.QueryEntity;
import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.multilingual.LanguageDetectionResult;
import de.mirkosertic.nlpquery.multilingual.MultilingualProcessor;
import de.mirkosertic.nlpquery.multilingual.MultilingualQueryResult;
import de.mirkosertic.nlpquery.refinement.QueryRefinementEngine;
import de.mirkosertic.nlpquery.refinement.RefinementAnalysis;
import de.mirkosertic.nlpquery.search.DocumentSearchBackend;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.search.SpeechRecognizer;
import de.mirkosertic.nlpquery.search.VoiceRecognitionResult;
import de.mirkosertic.nlpquery.template.ExecutableTemplate;
import de.mirkosertic.nlpquery.template.QuestionTemplate;
import de.mirkosertic.nlpquery.template.QuestionTemplateLibrary;
import de.mirkosertic.nlpquery.template.TemplateSearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("NlpQueryPipeline")
class NlpQueryPipelineTest {

    private static final QueryIntent PDF_SEARCH = new QueryIntent(IntentType.SEARCH, "find", 0.8,
            List.of(new QueryEntity(EntityType.DOCUMENT_TYPE, "PDF", "pdf")), Map.of());

    private static final DocumentSearchResult BUDGET =
            DocumentSearchResult.of("d1", "Budget report", "Annual budget", "pdf");

    private MutableClock clock;
    private IntentExtractor intentExtractor;
    private QueryExpander expander;
    private ContextManager contextManager;
    private MultilingualProcessor multilingual;
    private QuestionTemplateLibrary templates;
    private QueryRefinementEngine refinement;
    private DocumentSearchBackend backend;
    private SpeechRecognizer speech;
    private PipelineExecutor executor;
    private NlpQueryPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        intentExtractor = mock(IntentExtractor.class);
        expander = mock(QueryExpander.class);
        contextManager = mock(ContextManager.class);
        multilingual = mock(MultilingualProcessor.class);
        templates = mock(QuestionTemplateLibrary.class);
        refinement = mock(QueryRefinementEngine.class);
        backend = mock(DocumentSearchBackend.class);
        speech = mock(SpeechRecognizer.class);
        executor = new PipelineExecutor(2, 16);

        when(intentExtractor.extract(anyString(), any(Language.class))).thenReturn(PDF_SEARCH);
        when(backend.search(anyString())).thenReturn(List.of());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static PipelineConfiguration intentOnly() {
        return new PipelineConfiguration(false, false, false, false, false, true,
                60_000, 3, PerformanceMode.BASIC, false);
    }

    private static PipelineConfiguration allEnabled() {
        return new PipelineConfiguration(true, true, true, true, true, true,
                60_000, 100, PerformanceMode.BASIC, false);
    }

    private NlpQueryPipeline pipeline(final PipelineConfiguration configuration) {
        return pipeline(configuration, refinement);
    }

    private NlpQueryPipeline pipeline(final PipelineConfiguration configuration, final QueryRefinementEngine engine) {
        pipeline = new NlpQueryPipeline(intentExtractor, expander, contextManager, multilingual, templates, engine,
                backend, speech, configuration, executor, new PipelineSettings(2, Duration.ofHours(1), 10), clock);
        return pipeline;
    }

    private void stubRemainingStages() {
        when(multilingual.processQuery(anyString())).thenReturn(new MultilingualQueryResult(
                new LanguageDetectionResult(Language.EN, 1.0, List.of()), Map.of(), List.of()));
        when(templates.searchTemplates(anyString(), anyInt())).thenReturn(List.of());
        when(refinement.createSession(anyString(), any())).thenReturn("session-1");
        when(refinement.addQueryToSession(anyString(), anyString(), any(), any())).thenReturn(new RefinementAnalysis(
                new RefinementAnalysis.QueryQuality(0.6, 0.6, 0.6),
                new RefinementAnalysis.ResultQuality(0.6, 0.6, 0.6), List.of(), 0.6));
        when(refinement.getRefinementSuggestions(anyString())).thenReturn(List.of());
    }

    private static ExpandedQuery expansionWithVariation(final String query, final String variation) {
        return new ExpandedQuery(query, List.of(),
                List.of(new RankedVariation(variation, 0.9, "Synonym expansion")), List.of());
    }

    @Nested
    @DisplayName("result cache")
    class Caching {

        @Test
        void shouldServeSecondIdenticalQueryFromCache() {
            pipeline(intentOnly());

            final NlpProcessingResult first = pipeline.processQuery("find pdf documents");
            final NlpProcessingResult second = pipeline.processQuery("find pdf documents");

            assertThat(first.metadata().cacheHit()).isFalse();
            assertThat(second.metadata().cacheHit()).isTrue();
            assertThat(second.processedQuery()).isEqualTo(first.processedQuery());
            verify(intentExtractor, times(1)).extract(anyString(), any(Language.class));
            verify(backend, times(1)).search(anyString());
            assertThat(pipeline.getCacheStatistics().hits()).isEqualTo(1);
        }

        @Test
        void shouldBypassLookupWhenSkipCacheIsSet() {
            pipeline(intentOnly());
            final ProcessingOptions skip = ProcessingOptions.defaults().withSkipCache(true);

            pipeline.processQuery("find pdf documents", skip);
            final NlpProcessingResult second = pipeline.processQuery("find pdf documents", skip);

            assertThat(second.metadata().cacheHit()).isFalse();
            verify(intentExtractor, times(2)).extract(anyString(), any(Language.class));
        }

        @Test
        void shouldRecomputeAfterTtlExpired() {
            pipeline(intentOnly());

            pipeline.processQuery("find pdf documents");
            clock.advance(Duration.ofMinutes(2));
            final NlpProcessingResult second = pipeline.processQuery("find pdf documents");

            assertThat(second.metadata().cacheHit()).isFalse();
            verify(intentExtractor, times(2)).extract(anyString(), any(Language.class));
        }

        @Test
        void shouldKeepCacheWithinMaximumSize() {
            pipeline(intentOnly());

            for (int i = 0; i < 5; i++) {
                pipeline.processQuery("find report " + i);
            }

            final CacheStatistics statistics = pipeline.getCacheStatistics();
            assertThat(statistics.size()).isEqualTo(3);
            assertThat(statistics.evictions()).isEqualTo(2);
        }

        @Test
        void shouldEvictOldestEntryFirst() {
            pipeline(intentOnly());
            for (int i = 0; i < 4; i++) {
                pipeline.processQuery("find report " + i);
            }

            assertThat(pipeline.processQuery("find report 0").metadata().cacheHit()).isFalse();
            assertThat(pipeline.processQuery("find report 3").metadata().cacheHit()).isTrue();
        }

        @Test
        void shouldKeepResultsOfDifferentUsersApart() {
            pipeline(intentOnly());

            pipeline.processQuery("find pdf documents", ProcessingOptions.defaults().withUserId("alice"));
            final NlpProcessingResult bob =
                    pipeline.processQuery("find pdf documents", ProcessingOptions.defaults().withUserId("bob"));

            assertThat(bob.metadata().cacheHit()).isFalse();
        }

        @Test
        void shouldNotCacheWhenDisabled() {
            pipeline(intentOnly());
            pipeline.updateConfiguration(ConfigurationUpdate.builder().cacheEnabled(false).build());

            pipeline.processQuery("find pdf documents");
            pipeline.processQuery("find pdf documents");

            verify(intentExtractor, times(2)).extract(anyString(), any(Language.class));
            assertThat(pipeline.getCacheStatistics().size()).isZero();
        }

        @Test
        void shouldTrimCacheWhenMaximumSizeShrinks() {
            pipeline(intentOnly());
            for (int i = 0; i < 3; i++) {
                pipeline.processQuery("find report " + i);
            }

            pipeline.updateConfiguration(ConfigurationUpdate.builder().maxCacheSize(1).build());

            assertThat(pipeline.getCacheStatistics().size()).isEqualTo(1);
            assertThat(pipeline.getCacheStatistics().maxSize()).isEqualTo(1);
        }

        @Test
        void shouldDropCachedResultsWhenStageIsDisabled() {
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenReturn(expansionWithVariation("find pdf documents", "find pdf files"));
            pipeline(new PipelineConfiguration(true, false, false, false, false, true,
                    60_000, 10, PerformanceMode.BASIC, false));
            pipeline.processQuery("find pdf documents");

            pipeline.updateConfiguration(ConfigurationUpdate.builder().enableQueryExpansion(false).build());
            final NlpProcessingResult result = pipeline.processQuery("find pdf documents");

            assertThat(result.metadata().cacheHit()).isFalse();
            assertThat(result.metadata().usedComponents()).containsExactly(NlpQueryPipeline.INTENT_EXTRACTOR);
            assertThat(result.expandedQuery()).isNull();
            verify(intentExtractor, times(2)).extract(anyString(), any(Language.class));
        }

        @Test
        void shouldKeepCachedResultsWhenOnlyTtlChanges() {
            pipeline(intentOnly());
            pipeline.processQuery("find pdf documents");

            pipeline.updateConfiguration(ConfigurationUpdate.builder().cacheTtlMs(120_000).build());

            assertThat(pipeline.processQuery("find pdf documents").metadata().cacheHit()).isTrue();
        }

        @Test
        void shouldClearCacheAndMetricsOnCleanup() {
            pipeline(intentOnly());
            pipeline.processQuery("find pdf documents");

            pipeline.cleanup();

            assertThat(pipeline.getCacheStatistics().size()).isZero();
            assertThat(pipeline.getPerformanceMetrics().totalQueries()).isZero();
        }
    }

    @Nested
    @DisplayName("stages")
    class Stages {

        @Test
        void shouldOnlyRunEnabledComponents() {
            final NlpProcessingResult result = pipeline(intentOnly()).processQuery("find pdf documents");

            assertThat(result.metadata().usedComponents()).containsExactly(NlpQueryPipeline.INTENT_EXTRACTOR);
            assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
            verifyNoInteractions(expander, multilingual, templates, refinement);
        }

        @Test
        void shouldRunAllStagesInOrder() {
            stubRemainingStages();
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenReturn(new ExpandedQuery("find pdf documents", List.of(), List.of(), List.of()));

            final NlpProcessingResult result = pipeline(allEnabled()).processQuery("find pdf documents");

            assertThat(result.metadata().usedComponents()).containsExactly(
                    NlpQueryPipeline.INTENT_EXTRACTOR,
                    NlpQueryPipeline.QUERY_EXPANDER,
                    NlpQueryPipeline.MULTILINGUAL_PROCESSOR,
                    NlpQueryPipeline.TEMPLATE_LIBRARY,
                    NlpQueryPipeline.REFINEMENT_ENGINE);
            // intent 0.8, detection 1.0, refinement 0.6; empty expansion and no template contribute nothing
            assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
            assertThat(result.metadata().errorOccurred()).isFalse();
        }

        @Test
        void shouldOmitFailingStageAndContinue() {
            stubRemainingStages();
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenThrow(new IllegalStateException("dictionary unavailable"));

            final NlpProcessingResult result = pipeline(allEnabled()).processQuery("find pdf documents");

            assertThat(result.metadata().usedComponents())
                    .doesNotContain(NlpQueryPipeline.QUERY_EXPANDER)
                    .contains(NlpQueryPipeline.MULTILINGUAL_PROCESSOR, NlpQueryPipeline.REFINEMENT_ENGINE);
            assertThat(result.expandedQuery()).isNull();
            assertThat(result.metadata().errorOccurred()).isFalse();
            assertThat(pipeline.getPerformanceMetrics().componentFailures())
                    .containsEntry(NlpQueryPipeline.QUERY_EXPANDER, 1L);
        }

        @Test
        void shouldTreatSearchBackendFailureAsNoResults() {
            when(backend.search(anyString())).thenThrow(new IllegalStateException("backend down"));

            final NlpProcessingResult result = pipeline(intentOnly()).processQuery("find pdf documents");

            assertThat(result.searchResults()).isEmpty();
            assertThat(result.metadata().errorOccurred()).isFalse();
        }

        @Test
        void shouldAttachCrossLanguageMatchesOverSearchResults() {
            stubRemainingStages();
            when(backend.search(anyString())).thenReturn(List.of(BUDGET));

            final NlpProcessingResult result = pipeline(allEnabled()).processQuery("find pdf documents");

            assertThat(result.searchResults()).containsExactly(BUDGET);
            assertThat(result.multilingualResult()).isNotNull();
            verify(multilingual).findCrossLanguageMatches("find pdf documents", List.of(BUDGET));
        }

        @Test
        void shouldRecordUserActivity() {
            pipeline(intentOnly()).processQuery("find pdf documents", ProcessingOptions.defaults().withUserId("alice"));

            verify(contextManager).updateUserActivity(eq("alice"), any(UserActivity.class));
        }

        @Test
        void shouldReuseOneSessionPerUser() {
            final QueryRefinementEngine engine = new QueryRefinementEngine(clock);
            final PipelineConfiguration refinementOnly = new PipelineConfiguration(false, false, false, true, false,
                    false, 60_000, 10, PerformanceMode.BASIC, false);
            pipeline(refinementOnly, engine);
            final ProcessingOptions alice = ProcessingOptions.defaults().withUserId("alice");

            pipeline.processQuery("find pdf documents", alice);
            pipeline.processQuery("find budget report", alice);

            assertThat(engine.sessionCount()).isEqualTo(1);
        }

        @Test
        void shouldAddQueryToGivenSession() {
            final QueryRefinementEngine engine = new QueryRefinementEngine(clock);
            final PipelineConfiguration refinementOnly = new PipelineConfiguration(false, false, false, true, false,
                    false, 60_000, 10, PerformanceMode.BASIC, false);
            pipeline(refinementOnly, engine);
            final String session = engine.createSession("carol", null);

            final NlpProcessingResult result = pipeline.processQuery("find pdf documents",
                    ProcessingOptions.defaults().withSessionId(session));

            assertThat(result.metadata().usedComponents()).contains(NlpQueryPipeline.REFINEMENT_ENGINE);
            assertThat(engine.getSession(session))
                    .hasValueSatisfying(s -> assertThat(s.getQueries()).hasSize(1));
        }
    }

    @Nested
    @DisplayName("final query selection")
    class QuerySelection {

        private final QuestionTemplate findByType = new QuestionTemplateLibrary().requireTemplate("find-documents-by-type");

        @Test
        void shouldPreferTemplateQuery() {
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenReturn(expansionWithVariation("show pdf files", "show pdf documents"));
            when(templates.searchTemplates(anyString(), anyInt()))
                    .thenReturn(List.of(new TemplateSearchResult(findByType, 0.7, List.of(), List.of())));
            when(templates.executeTemplate("find-documents-by-type", Map.of("type", "pdf")))
                    .thenReturn(new ExecutableTemplate(findByType, Map.of("type", "pdf"), "Find pdf documents", Map.of()));
            final PipelineConfiguration configuration = new PipelineConfiguration(true, false, true, false, false,
                    true, 60_000, 10, PerformanceMode.BASIC, false);

            final NlpProcessingResult result = pipeline(configuration).processQuery("show pdf files");

            assertThat(result.processedQuery()).isEqualTo("Find pdf documents");
            assertThat(result.templateMatch()).isNotNull();
            // intent 0.8, variation 0.9, template 0.7
            assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
            verify(backend).search("Find pdf documents");
        }

        @Test
        void shouldFallBackToTopVariation() {
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenReturn(expansionWithVariation("show pdf files", "show pdf documents"));
            final PipelineConfiguration configuration = new PipelineConfiguration(true, false, false, false, false,
                    true, 60_000, 10, PerformanceMode.BASIC, false);

            final NlpProcessingResult result = pipeline(configuration).processQuery("show pdf files");

            assertThat(result.processedQuery()).isEqualTo("show pdf documents");
            verify(backend).search("show pdf documents");
        }

        @Test
        void shouldUseRawQueryWithoutTemplateOrVariation() {
            when(expander.expandQuery(anyString(), anyInt(), any(Language.class)))
                    .thenReturn(new ExpandedQuery("show pdf files", List.of(), List.of(), List.of()));

            final PipelineConfiguration configuration = new PipelineConfiguration(true, false, false, false, false,
                    true, 60_000, 10, PerformanceMode.BASIC, false);
            final NlpProcessingResult result = pipeline(configuration).processQuery("show pdf files");

            assertThat(result.processedQuery()).isEqualTo("show pdf files");
        }

        @Test
        void shouldSkipTemplateWhoseRequiredParameterIsMissing() {
            when(intentExtractor.extract(anyString(), any(Language.class)))
                    .thenReturn(new QueryIntent(IntentType.SEARCH, "find", 0.5, List.of(), Map.of()));
            when(templates.searchTemplates(anyString(), anyInt()))
                    .thenReturn(List.of(new TemplateSearchResult(findByType, 0.6, List.of(), List.of())));
            final PipelineConfiguration configuration = new PipelineConfiguration(false, false, true, false, false,
                    true, 60_000, 10, PerformanceMode.BASIC, false);

            final NlpProcessingResult result = pipeline(configuration).processQuery("find documents");

            assertThat(result.templateMatch()).isNull();
            assertThat(result.processedQuery()).isEqualTo("find documents");
            verify(templates, never()).executeTemplate(anyString(), any());
        }

        @Test
        void shouldFillStatusFromQueryWords() {
            final QuestionTemplate statusTemplate = new QuestionTemplateLibrary().requireTemplate("show-document-status");

            final Optional<Map<String, String>> parameters = NlpQueryPipeline.fillParameters(statusTemplate,
                    "show Approved documents", PDF_SEARCH);

            assertThat(parameters).contains(Map.of("status", "approved"));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void shouldReturnFallbackWhenIntentExtractionFails() {
            when(intentExtractor.extract(anyString(), any(Language.class)))
                    .thenThrow(new IllegalStateException("pattern table corrupt"));

            final NlpProcessingResult result = pipeline(allEnabled()).processQuery("find pdf documents");

            assertThat(result.confidence()).isEqualTo(NlpProcessingResult.FALLBACK_CONFIDENCE);
            assertThat(result.metadata().errorOccurred()).isTrue();
            assertThat(result.metadata().usedComponents()).containsExactly(NlpProcessingResult.FALLBACK_COMPONENT);
            verifyNoInteractions(expander, multilingual, templates, refinement, backend);
            assertThat(pipeline.getPerformanceMetrics().fallbacks()).isEqualTo(1);
        }

        @Test
        void shouldNotCacheFallbackResults() {
            when(intentExtractor.extract(anyString(), any(Language.class)))
                    .thenThrow(new IllegalStateException("pattern table corrupt"));
            pipeline(intentOnly());

            pipeline.processQuery("find pdf documents");
            pipeline.processQuery("find pdf documents");

            verify(intentExtractor, times(2)).extract(anyString(), any(Language.class));
            assertThat(pipeline.getPerformanceMetrics().errorRate()).isEqualTo(1.0);
        }

        @Test
        void shouldReturnFallbackWhenTemplateMatchingFails() {
            when(templates.searchTemplates(anyString(), anyInt()))
                    .thenReturn(List.of(new TemplateSearchResult(null, 0.9, List.of(), List.of())));
            pipeline(new PipelineConfiguration(false, false, true, false, false, true,
                    60_000, 3, PerformanceMode.BASIC, false));

            final NlpProcessingResult result = pipeline.processQuery("find pdf documents");

            assertThat(result.confidence()).isEqualTo(NlpProcessingResult.FALLBACK_CONFIDENCE);
            assertThat(result.metadata().errorOccurred()).isTrue();
            assertThat(result.metadata().usedComponents()).containsExactly(NlpProcessingResult.FALLBACK_COMPONENT);
            assertThat(pipeline.getCacheStatistics().size()).isZero();
            assertThat(pipeline.getPerformanceMetrics().fallbacks()).isEqualTo(1);
        }

        @Test
        void shouldSkipMissingSearchResults() {
            when(backend.search(anyString())).thenReturn(Arrays.asList(BUDGET, null));

            final NlpProcessingResult result = pipeline(intentOnly()).processQuery("find pdf documents");

            assertThat(result.searchResults()).containsExactly(BUDGET);
            assertThat(result.metadata().errorOccurred()).isFalse();
        }

        @Test
        void shouldNotCountRefinementConfidenceWhenSuggestionsFail() {
            stubRemainingStages();
            when(refinement.getRefinementSuggestions(anyString()))
                    .thenThrow(new IllegalStateException("session store unavailable"));
            pipeline(new PipelineConfiguration(false, false, false, true, false, true,
                    60_000, 3, PerformanceMode.BASIC, false));

            final NlpProcessingResult result = pipeline.processQuery("find pdf documents");

            assertThat(result.metadata().usedComponents()).containsExactly(NlpQueryPipeline.INTENT_EXTRACTOR);
            assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
            assertThat(result.refinementSuggestions()).isEmpty();
            assertThat(pipeline.getPerformanceMetrics().componentFailures())
                    .containsEntry(NlpQueryPipeline.REFINEMENT_ENGINE, 1L);
        }

        @Test
        void shouldPropagateValidationErrors() {
            when(intentExtractor.extract(anyString(), any(Language.class)))
                    .thenThrow(new ValidationException("Query exceeds maximum length of 500 characters"));
            pipeline(intentOnly());

            assertThatThrownBy(() -> pipeline.processQuery("x".repeat(600)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldRejectBlankQuery() {
            pipeline(intentOnly());

            assertThatThrownBy(() -> pipeline.processQuery("   "))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(intentExtractor);
        }
    }

    @Nested
    @DisplayName("voice input")
    class Voice {

        @Test
        void shouldFailFastWhenVoiceIsDisabled() {
            pipeline(intentOnly());

            assertThatThrownBy(() -> pipeline.processVoiceQuery("find pdf documents", ProcessingOptions.defaults()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Voice input is disabled");
            verifyNoInteractions(speech);
        }

        @Test
        void shouldDelegateToSpeechRecognizer() {
            final VoiceRecognitionResult recognized = new VoiceRecognitionResult(true, 0.95, Map.of(), List.of());
            when(speech.processVoiceInput("find pdf documents")).thenReturn(recognized);
            pipeline(intentOnly());
            pipeline.updateConfiguration(ConfigurationUpdate.builder().enableVoiceInput(true).build());

            final VoiceQueryResult result = pipeline.processVoiceQuery("find pdf documents", ProcessingOptions.defaults());

            assertThat(result.voiceResult()).isEqualTo(recognized);
            assertThat(result.result().originalQuery()).isEqualTo("find pdf documents");
        }
    }

    @Nested
    @DisplayName("concurrency and performance modes")
    class Modes {

        @Test
        void shouldReturnBatchResultsInInputOrder() {
            pipeline(intentOnly());
            final List<String> queries = List.of("query one", "query two", "query three", "query four", "query five");

            final List<NlpProcessingResult> results = pipeline.processQueryBatch(queries, ProcessingOptions.defaults());

            assertThat(results).extracting(NlpProcessingResult::originalQuery).containsExactlyElementsOf(queries);
        }

        @Test
        void shouldReturnChunkedBatchResultsInInputOrder() {
            pipeline(intentOnly());
            pipeline.updateConfiguration(ConfigurationUpdate.builder()
                    .performanceOptimization(PerformanceMode.AGGRESSIVE).build());
            final List<String> queries = List.of("query one", "query two", "query three", "query four", "query five");

            final List<NlpProcessingResult> results = pipeline.processQueryBatch(queries, ProcessingOptions.defaults());

            assertThat(results).extracting(NlpProcessingResult::originalQuery).containsExactlyElementsOf(queries);
        }

        @Test
        void shouldWarmUpWhenSwitchingToAggressiveMode() {
            pipeline(intentOnly());

            pipeline.updateConfiguration(ConfigurationUpdate.builder()
                    .performanceOptimization(PerformanceMode.AGGRESSIVE).build());

            verify(intentExtractor).warmUp();
            verify(expander).warmUp();
            verify(templates).preloadTemplates();
            assertThat(pipeline.getConfiguration().performanceOptimization()).isEqualTo(PerformanceMode.AGGRESSIVE);
        }

        @Test
        void shouldNotWarmUpForOtherUpdates() {
            pipeline(intentOnly());

            pipeline.updateConfiguration(ConfigurationUpdate.builder().enableQueryExpansion(true).build());

            verify(intentExtractor, never()).warmUp();
            verify(templates, never()).preloadTemplates();
            assertThat(pipeline.getConfiguration().enableQueryExpansion()).isTrue();
        }

        @Test
        void shouldRunHighPriorityQueriesInlineInAggressiveMode() {
            final AtomicReference<String> thread = new AtomicReference<>();
            when(intentExtractor.extract(anyString(), any(Language.class))).thenAnswer(invocation -> {
                thread.set(Thread.currentThread().getName());
                return PDF_SEARCH;
            });
            pipeline(intentOnly());
            pipeline.updateConfiguration(ConfigurationUpdate.builder()
                    .performanceOptimization(PerformanceMode.AGGRESSIVE).build());

            final CompletableFuture<NlpProcessingResult> future = pipeline.processQueryAsync("find pdf documents",
                    ProcessingOptions.defaults().withPriority(Priority.HIGH));

            assertThat(future).isDone();
            assertThat(thread.get()).isEqualTo(Thread.currentThread().getName());
        }

        @Test
        void shouldQueueQueriesInBasicMode() {
            final AtomicReference<String> thread = new AtomicReference<>();
            when(intentExtractor.extract(anyString(), any(Language.class))).thenAnswer(invocation -> {
                thread.set(Thread.currentThread().getName());
                return PDF_SEARCH;
            });
            pipeline(intentOnly());

            final NlpProcessingResult result = pipeline.processQueryAsync("find pdf documents",
                    ProcessingOptions.defaults().withPriority(Priority.HIGH)).join();

            assertThat(result.originalQuery()).isEqualTo("find pdf documents");
            assertThat(thread.get()).startsWith("nlp-query-");
        }

        @Test
        void shouldRejectInvalidUpdateAndKeepConfiguration() {
            pipeline(intentOnly());

            assertThatThrownBy(() -> pipeline.updateConfiguration(ConfigurationUpdate.builder().cacheTtlMs(0).build()))
                    .isInstanceOf(ValidationException.class);
            assertThat(pipeline.getConfiguration()).isEqualTo(intentOnly());
        }
    }
}
