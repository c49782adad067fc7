package de.mirkosertic.nlpquery.template;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.NotFoundException;
import de.mirkosertic.nlpquery.ValidationException;
import de.mirkosertic.nlpquery.context.UserActivity;
import de.mirkosertic.nlpquery.context.UserContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("QuestionTemplateLibrary")
class QuestionTemplateLibraryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private QuestionTemplateLibrary library;

    @BeforeEach
    void setUp() {
        library = new QuestionTemplateLibrary(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static QuestionTemplate custom(final String id, final String text) {
        return new QuestionTemplate(id, TemplateCategory.CUSTOM, "Custom " + id, "A custom template", text,
                List.of(TemplateParameter.text("topic")), Language.EN, List.of(), List.of("custom"), 1);
    }

    @Nested
    @DisplayName("catalog")
    class Catalog {

        @Test
        void shouldShipBuiltInTemplatesInBothLanguages() {
            assertThat(library.getTemplates(null, null)).hasSize(12);
            assertThat(library.getTemplates(null, Language.AR)).hasSize(6);
            assertThat(library.getTemplates(TemplateCategory.DISCOVERY, Language.AR))
                    .extracting(QuestionTemplate::id)
                    .containsExactly("find-documents-by-type-ar", "find-documents-by-author-ar",
                            "find-recent-documents-ar");
        }

        @Test
        void shouldNotRemoveBuiltInTemplates() {
            assertThat(library.removeTemplate("find-documents-by-type")).isFalse();
            assertThat(library.getTemplate("find-documents-by-type")).isPresent();
            assertThat(library.removeTemplate("does-not-exist")).isFalse();
        }

        @Test
        void shouldAddAndRemoveCustomTemplates() {
            library.addTemplate(custom("my-template", "Find {topic} notes"));

            assertThat(library.getTemplate("my-template")).isPresent();
            assertThat(library.removeTemplate("my-template")).isTrue();
            assertThat(library.getTemplate("my-template")).isEmpty();
        }

        @Test
        void shouldRejectIncompleteTemplates() {
            final QuestionTemplate incomplete = new QuestionTemplate("broken", TemplateCategory.CUSTOM, "", "desc",
                    "text", null, Language.EN, null, null, 0);

            assertThatThrownBy(() -> library.addTemplate(incomplete)).isInstanceOf(ValidationException.class);
            assertThat(incomplete.priority()).isEqualTo(1);
            assertThat(incomplete.parameters()).isEmpty();
        }
    }

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        void shouldFillPlaceholdersAndSuggestFilters() {
            final ExecutableTemplate executable =
                    library.executeTemplate("find-documents-by-type", Map.of("type", "PDF"));

            assertThat(executable.generatedQuery()).isEqualTo("Find PDF documents");
            assertThat(executable.suggestedFilters()).containsEntry("documentTypes", List.of("pdf"));
            assertThat(executable.parameters()).containsEntry("type", "PDF");
        }

        @Test
        void shouldSuggestAuthorFilter() {
            final ExecutableTemplate executable = library.executeTemplate("find-documents-by-author-and-topic",
                    Map.of("author", "Alice", "topic", "budget"));

            assertThat(executable.generatedQuery()).isEqualTo("Find documents by Alice about budget");
            assertThat(executable.suggestedFilters()).containsOnlyKeys("authors");
        }

        @Test
        void shouldReplaceRepeatedPlaceholders() {
            library.addTemplate(custom("compare", "Compare {topic} with last year {topic}"));

            assertThat(library.executeTemplate("compare", Map.of("topic", "sales")).generatedQuery())
                    .isEqualTo("Compare sales with last year sales");
        }

        @Test
        void shouldRejectMissingOrEmptyRequiredParameters() {
            assertThatThrownBy(() -> library.executeTemplate("find-documents-by-author-and-topic",
                    Map.of("author", "Alice")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Missing required parameter: topic");
            assertThatThrownBy(() -> library.executeTemplate("find-documents-by-type", Map.of("type", "")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldFailForUnknownTemplate() {
            assertThatThrownBy(() -> library.executeTemplate("nope", Map.of()))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        void shouldCapScoreAndReportMatches() {
            final List<TemplateSearchResult> results = library.searchTemplates("status", 5);

            assertThat(results).hasSize(2);
            assertThat(results.get(0).template().id()).isEqualTo("show-document-status");
            assertThat(results.get(0).score()).isEqualTo(1.0);
            assertThat(results.get(0).matchedTags()).containsExactly("status");
            assertThat(results.get(0).matchedText()).hasSize(2);
            // the Arabic body only matches through its {status} placeholder
            assertThat(results.get(1).template().id()).isEqualTo("show-document-status-ar");
            assertThat(results.get(1).score()).isCloseTo(0.6, within(1e-9));
            assertThat(results.get(1).matchedTags()).isEmpty();
        }

        @Test
        void shouldScoreTagAndDescriptionMatches() {
            assertThat(library.searchTemplates("workflow", 5)).singleElement().satisfies(result -> {
                assertThat(result.score()).isCloseTo(0.4, within(1e-9));
                assertThat(result.matchedText()).isEmpty();
            });
            assertThat(library.searchTemplates("analytics", 5)).singleElement()
                    .satisfies(result -> assertThat(result.score()).isCloseTo(0.7, within(1e-9)));
        }

        @Test
        void shouldOrderByScoreAndTruncate() {
            assertThat(library.searchTemplates("type", 5))
                    .extracting(result -> result.template().id())
                    .containsExactly("find-documents-by-type", "count-documents-by-type", "find-documents-by-type-ar");
            assertThat(library.searchTemplates("type", 2)).hasSize(2);
        }

        @Test
        void shouldReturnNothingForBlankQuery() {
            assertThat(library.searchTemplates("  ", 5)).isEmpty();
        }

        @Test
        void shouldKeepPreloadedIndexCurrent() {
            library.preloadTemplates();
            library.addTemplate(custom("contracts", "Find contracts about {topic}"));

            assertThat(library.searchTemplates("contracts", 5))
                    .extracting(result -> result.template().id())
                    .containsExactly("contracts");
        }
    }

    @Nested
    @DisplayName("suggestions")
    class Suggestions {

        @Test
        void shouldPreferUserLanguageAndPriority() {
            final UserContext user = new UserContext("u1", "analyst", null, List.of(), Language.AR, List.of());

            final List<TemplateSuggestion> suggestions = library.suggestTemplates(user, null, 3);

            assertThat(suggestions)
                    .extracting(suggestion -> suggestion.template().id())
                    .containsExactly("download-document-ar", "find-documents-by-type-ar", "find-documents-by-author-ar");
            assertThat(suggestions.get(0).reason()).isEqualTo("Matches your language preference");
        }

        @Test
        void shouldMatchQueryText() {
            final TemplateSuggestion first = library.suggestTemplates(null, "download", 5).get(0);

            assertThat(first.template().id()).isEqualTo("download-document");
            assertThat(first.relevanceScore()).isEqualTo(1.0);
            assertThat(first.reason()).isEqualTo("Matches your search query");
        }

        @Test
        void shouldPersonalizeWithoutChangingTemplate() {
            final UserContext user = new UserContext("u1", "analyst", "it", List.of(), Language.EN, List.of("pdf"));
            user.record(UserActivity.topic("budget"));
            final QuestionTemplate template = library.requireTemplate("find-documents-by-type");

            final PersonalizedTemplate personalized = library.personalizeTemplate(template, user);

            assertThat(personalized.personalizedText()).isEqualTo("Find [pdf] documents");
            assertThat(personalized.suggestedParameters()).containsEntry("type", "pdf");
            assertThat(personalized.contextHints()).containsExactly(
                    "Based on your recent topics: budget",
                    "Your preferred document types: pdf",
                    "Tailored for it department");
            assertThat(library.requireTemplate("find-documents-by-type").template()).isEqualTo("Find {type} documents");
        }
    }

    @Nested
    @DisplayName("usage analytics")
    class Usage {

        @Test
        void shouldTrackApproximateAndDistinctUsers() {
            library.trackTemplateUsage("find-recent-documents", "u1");
            library.trackTemplateUsage("find-recent-documents", "u1");
            library.trackTemplateUsage("find-recent-documents", "u2");

            final TemplateUsage usage = library.getUsageAnalytics().get("find-recent-documents");
            assertThat(usage.usageCount()).isEqualTo(3);
            assertThat(usage.uniqueUsers()).isEqualTo(2);
            assertThat(usage.distinctUsers()).isEqualTo(2);
            assertThat(usage.lastUsed()).isEqualTo(NOW);
        }

        @Test
        void shouldApproximateAtLeastOneUser() {
            assertThat(QuestionTemplateLibrary.approximateUniqueUsers(0)).isEqualTo(1);
            assertThat(QuestionTemplateLibrary.approximateUniqueUsers(1)).isEqualTo(1);
            assertThat(QuestionTemplateLibrary.approximateUniqueUsers(5)).isEqualTo(4);
        }

        @Test
        void shouldRankPopularTemplatesAndIgnoreRemovedOnes() {
            library.addTemplate(custom("temp", "Temp {topic}"));
            for (int i = 0; i < 5; i++) {
                library.trackTemplateUsage("temp", "u" + i);
            }
            library.trackTemplateUsage("download-document", "u1");
            library.trackTemplateUsage("find-recent-documents", "u1");
            library.trackTemplateUsage("find-recent-documents", "u2");
            library.removeTemplate("temp");

            assertThat(library.getPopularTemplates(5))
                    .extracting(popular -> popular.template().id())
                    .containsExactly("find-recent-documents", "download-document");
        }

        @Test
        void shouldRejectUsageOfUnknownTemplate() {
            assertThatThrownBy(() -> library.trackTemplateUsage("nope", "u1")).isInstanceOf(NotFoundException.class);
        }

        @Test
        void shouldClearAnalytics() {
            library.trackTemplateUsage("download-document", "u1");
            library.clearUsageAnalytics();

            assertThat(library.getUsageAnalytics()).isEmpty();
        }
    }

    @Nested
    @DisplayName("export and import")
    class ExportImport {

        @Test
        void shouldExportSelectedTemplates() {
            final TemplateExport export = library.exportTemplates(List.of("find-documents-by-type", "nope"));

            assertThat(export.version()).isEqualTo(TemplateExport.CURRENT_VERSION);
            assertThat(export.timestamp()).isEqualTo(NOW);
            assertThat(export.templates()).extracting(QuestionTemplate::id).containsExactly("find-documents-by-type");
        }

        @Test
        void shouldRoundTripCustomTemplatesThroughJson() {
            library.addTemplate(custom("travel", "Find travel reports about {topic}"));
            final String json = library.exportTemplatesAsJson(List.of("travel"));

            assertThat(json).contains("\"custom\"").contains("2024-06-01T12:00:00Z").doesNotContain("complete");

            final QuestionTemplateLibrary other = new QuestionTemplateLibrary();
            assertThat(other.importTemplatesFromJson(json, false)).isEqualTo(1);
            assertThat(other.getTemplate("travel")).contains(library.requireTemplate("travel"));
        }

        @Test
        void shouldOnlyReplaceExistingTemplatesWhenAsked() {
            final String json = library.exportTemplatesAsJson(List.of("find-documents-by-type"));

            assertThat(library.importTemplatesFromJson(json, false)).isZero();
            assertThat(library.importTemplatesFromJson(json, true)).isEqualTo(1);
        }

        @Test
        void shouldSkipIncompleteTemplates() {
            final String json = """
                    {"version":"1.0.0","timestamp":"2024-06-01T12:00:00Z","templates":[
                      {"id":"half","category":"custom","description":"d","template":"t","language":"en"}
                    ]}
                    """;

            assertThat(library.importTemplatesFromJson(json, true)).isZero();
            assertThat(library.getTemplate("half")).isEmpty();
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> library.importTemplatesFromJson("{not json", false))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
