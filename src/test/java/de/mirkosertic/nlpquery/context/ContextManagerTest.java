package de.mirkosertic.nlpquery.context;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.intent.IntentType;
import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContextManager")
class ContextManagerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private ContextManager manager;

    @BeforeEach
    void setUp() {
        manager = new ContextManager(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static QueryIntent searchIntent(final double confidence) {
        return new QueryIntent(IntentType.SEARCH, "find", confidence, List.of(), Map.of());
    }

    private static UserContext user(final String department, final List<String> preferredTypes) {
        return new UserContext("u1", "analyst", department, List.of("read"), Language.EN, preferredTypes);
    }

    @Test
    void shouldSeedDepartmentContexts() {
        assertThat(manager.getAllOrganizationalContexts())
                .extracting(OrganizationalContext::id)
                .containsExactly("it", "hr", "legal");
    }

    @Test
    void shouldFindContextsByTerminologyAndCommonQueries() {
        assertThat(manager.getRelevantContexts("server maintenance", null))
                .extracting(OrganizationalContext::id)
                .containsExactly("it");
        assertThat(manager.getRelevantContexts("contract templates", null))
                .extracting(OrganizationalContext::id)
                .containsExactly("legal");
    }

    @Test
    void shouldPutUserDepartmentFirst() {
        assertThat(manager.getRelevantContexts("server backup", user("hr", List.of())))
                .extracting(OrganizationalContext::id)
                .containsExactly("hr", "it");
    }

    @Test
    void shouldSuggestTerminologySynonymsAndAlternatives() {
        final ContextualQuery contextual = manager.enhanceQuery("server logs", searchIntent(0.9), null);

        assertThat(contextual.enhancedQuery()).isEqualTo("server logs");
        assertThat(contextual.suggestedTerms()).containsExactly("infrastructure", "hardware", "system");
        assertThat(contextual.alternatives())
                .containsExactly("infrastructure logs", "hardware logs", "system logs");
        assertThat(contextual.clarifications()).isEmpty();
        assertThat(contextual.userContext().getId()).isEqualTo("default");
        assertThat(contextual.collectionContext().totalDocuments()).isZero();
    }

    @Test
    void shouldAddUserPreferencesAndTwoRecentTopics() {
        final UserContext user = user(null, List.of("pdf"));
        user.record(UserActivity.topic("legal"));
        user.record(UserActivity.topic("hiring"));
        user.record(UserActivity.topic("budget"));

        final ContextualQuery contextual = manager.enhanceQuery("quarterly numbers", searchIntent(0.9), user);

        assertThat(contextual.suggestedTerms()).containsExactly("pdf", "budget", "hiring");
        assertThat(contextual.alternatives()).containsExactly("quarterly numbers (pdf)");
    }

    @Test
    void shouldOnlyHintDocumentTypeForSearchIntents() {
        final QueryIntent analytics = new QueryIntent(IntentType.ANALYTICS, "count", 0.9, List.of(), Map.of());

        final ContextualQuery contextual = manager.enhanceQuery("count numbers", analytics, user(null, List.of("pdf")));

        assertThat(contextual.suggestedTerms()).doesNotContain("pdf");
    }

    @Test
    void shouldAskForClarificationWhenIntentIsUncertain() {
        manager.updateDocumentCollectionContext(List.of(
                DocumentSearchResult.of("1", "A", null, "pdf"),
                DocumentSearchResult.of("2", "B", null, "pdf"),
                DocumentSearchResult.of("3", "C", null, "docx")));

        final ContextualQuery contextual = manager.enhanceQuery("server contract", searchIntent(0.5), null);

        assertThat(contextual.clarifications()).containsExactly(
                "Are you looking for documents from: Information Technology, Legal Department?",
                "Are you looking for: pdf, docx?");
    }

    @Test
    void shouldCapSuggestionsAndAlternatives() {
        final UserContext user = user(null, List.of("pdf"));
        user.record(UserActivity.topic("budget"));

        final ContextualQuery contextual = manager.enhanceQuery("server backup policy", searchIntent(0.9), user);

        assertThat(contextual.suggestedTerms()).hasSize(5);
        assertThat(contextual.alternatives()).hasSize(3);
    }

    @Test
    void shouldMergeCompletionsFromAllSources() {
        final UserContext user = user(null, List.of());
        manager.setUserContext(user);
        manager.updateUserActivity("u1", UserActivity.query("security audit 2024"));
        manager.updateDocumentCollectionContext(List.of(
                DocumentSearchResult.of("1", "Security handbook", null, "pdf").withTags(List.of("security"))));

        assertThat(manager.getQuerySuggestions("secu", null)).containsExactly(
                "security audit 2024",
                "security audit documents",
                "find documents about security",
                "show me security documents");
    }

    @Test
    void shouldIgnoreActivityOfOtherUsers() {
        final UserContext user = user(null, List.of());
        manager.setUserContext(user);

        manager.updateUserActivity("someone-else", UserActivity.query("budget"));

        assertThat(user.getRecentQueries()).isEmpty();
        assertThat(manager.getCurrentUserContext()).containsSame(user);
    }

    @Test
    void shouldBoundActivityLists() {
        final UserContext user = user(null, List.of());
        manager.setUserContext(user);

        for (int i = 0; i < 25; i++) {
            manager.updateUserActivity("u1", UserActivity.query("query " + i));
            manager.updateUserActivity("u1", UserActivity.document("doc-" + i));
        }
        manager.updateUserActivity("u1", UserActivity.query("query 24"));

        assertThat(user.getRecentQueries()).hasSize(10).startsWith("query 24", "query 24", "query 23");
        assertThat(user.getRecentDocuments()).hasSize(10).first().isEqualTo("doc-24");
        assertThat(user.getSearchHistory()).hasSize(20).doesNotHaveDuplicates().first().isEqualTo("query 24");
    }

    @Test
    void shouldComputeCollectionStatistics() {
        manager.updateDocumentCollectionContext(List.of(
                new DocumentSearchResult("1", "Budget plan", "budget tax numbers", "pdf", "Alice",
                        NOW.minus(Duration.ofDays(2)), "en", List.of("finance"), 5, null),
                new DocumentSearchResult("2", "خطة الميزانية", null, "docx", "Omar",
                        NOW.minus(Duration.ofDays(4)), "ar", List.of("finance", "planning"), 12, null),
                DocumentSearchResult.of("3", "Notes", null, "txt")));

        final DocumentCollectionContext collection = manager.getDocumentCollectionContext().orElseThrow();

        assertThat(collection.totalDocuments()).isEqualTo(3);
        assertThat(collection.documentTypes()).containsEntry("pdf", 1).containsEntry("docx", 1);
        assertThat(collection.authors()).containsExactly("Alice", "Omar");
        assertThat(collection.topics()).containsExactly("finance", "planning");
        assertThat(collection.mostAccessedDocuments()).containsExactly("2", "1");
        assertThat(collection.languageDistribution())
                .containsEntry("en", 1).containsEntry("ar", 1).containsEntry("unknown", 1);
        assertThat(collection.commonTerms()).containsEntry("budget", 2).containsEntry("الميزانية", 1)
                .doesNotContainKey("tax");
        assertThat(collection.averageDocumentAgeMs()).isEqualTo(Duration.ofDays(2).toMillis());
    }

    @Test
    void shouldRegisterAdditionalContexts() {
        manager.addOrganizationalContext(new OrganizationalContext("finance", "Finance", ContextType.DEPARTMENT,
                Map.of("invoice", List.of("bill")), List.of("invoice archive"), List.of("invoices")));

        assertThat(manager.getRelevantContexts("unpaid invoice", null))
                .extracting(OrganizationalContext::id)
                .containsExactly("finance");
    }
}
