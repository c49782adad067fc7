package de.mirkosertic.nlpquery.refinement;

import de.mirkosertic.nlpquery.NotFoundException;
import de.mirkosertic.nlpquery.ValidationException;
import de.mirkosertic.nlpquery.context.UserContext;
import de.mirkosertic.nlpquery.intent.EntityType;
import de.mirkosertic.nlpquery.intent.IntentType;
import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Keeps per-session query history and derives refinement suggestions and follow-up questions from
 * every added query and its results.
 *
 * <p>Sessions are only reclaimed by {@link #cleanupOldSessions(Duration)}; there is no background
 * timer.</p>
 */
public class QueryRefinementEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryRefinementEngine.class);

    public static final Duration DEFAULT_SESSION_MAX_AGE = Duration.ofHours(24);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> AMBIGUOUS_TERMS = Set.of("it", "this", "that", "thing", "stuff");

    private static final int MAX_DOCUMENT_TYPES = 5;
    private static final int MAX_AUTHOR_FILTERS = 3;
    private static final int MAX_TOPIC_EXPANSIONS = 2;
    private static final int MAX_ALTERNATIVE_PHRASINGS = 2;
    private static final int MANY_RESULTS = 50;
    private static final int NARROWING_RESULTS = 20;
    private static final int RECENT_FILTER_RESULTS = 10;
    private static final int FEW_RESULTS = 5;

    private final Clock clock;
    private final Map<String, QuerySession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionSequence = new AtomicLong();

    public QueryRefinementEngine() {
        this(Clock.systemUTC());
    }

    public QueryRefinementEngine(final Clock clock) {
        this.clock = clock;
    }

    // ========== Sessions ==========

    /**
     * Open a new session.
     *
     * @return the session id
     */
    public String createSession(final String userId, final @Nullable UserContext userContext) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id must not be empty");
        }
        final Instant now = clock.instant();
        final String sessionId = "session_" + userId + "_" + now.toEpochMilli() + "_" + sessionSequence.incrementAndGet();
        sessions.put(sessionId, new QuerySession(sessionId, userId, now, userContext));
        logger.debug("Created session '{}'", sessionId);
        return sessionId;
    }

    public Optional<QuerySession> getSession(final String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    private QuerySession requireSession(final String sessionId) {
        final QuerySession session = sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("Session", sessionId);
        }
        return session;
    }

    public void updateSessionContext(final String sessionId, final @Nullable UserContext userContext) {
        requireSession(sessionId).setUserContext(userContext);
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Remove every session whose latest query, or creation when it has none, is older than
     * {@code maxAge}.
     *
     * @return the number of removed sessions
     */
    public int cleanupOldSessions(final Duration maxAge) {
        final Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (final Map.Entry<String, QuerySession> entry : sessions.entrySet()) {
            if (entry.getValue().lastActivity().isBefore(cutoff) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Removed {} sessions inactive for more than {}", removed, maxAge);
        }
        return removed;
    }

    // ========== Queries ==========

    /**
     * Record a query and its results, then replace the session's suggestions and follow-up
     * questions.
     *
     * @return the analysis of the added query
     * @throws NotFoundException   if the session does not exist
     * @throws ValidationException if the query is empty
     */
    public RefinementAnalysis addQueryToSession(final String sessionId, final String query, final QueryIntent intent,
                                                final List<DocumentSearchResult> results) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must not be empty");
        }
        final QuerySession session = requireSession(sessionId);
        final List<DocumentSearchResult> safeResults = results == null ? List.of() : results;

        synchronized (session) {
            final Optional<SessionQuery> previous = session.lastQuery();
            final boolean followsEarlierQuery = previous.isPresent();
            final @Nullable UserContext user = session.getUserContext().orElse(null);

            final RefinementAnalysis analysis = analyze(query, intent, safeResults);

            final List<RefinementSuggestion> refinements = new ArrayList<>();
            addFilterRefinements(refinements, safeResults);
            addExpansionRefinements(refinements, query, intent, safeResults, user);
            addNarrowingRefinements(refinements, query, safeResults, previous.map(SessionQuery::text).orElse(null));
            addAlternativeQueries(refinements, query, intent);
            addClarifications(refinements, query, analysis);

            final List<FollowUpQuestion> followUps = followUpQuestions(query, safeResults, user, followsEarlierQuery);

            session.addQuery(new SessionQuery(query, intent, clock.instant(), safeResults, null),
                    analysis, refinements, followUps);
            logger.debug("Session '{}': query '{}' with {} results, {} refinements, {} follow-ups",
                    sessionId, query, safeResults.size(), refinements.size(), followUps.size());
            return analysis;
        }
    }

    /**
     * Suggestions for the latest query, highest confidence first.
     */
    public List<RefinementSuggestion> getRefinementSuggestions(final String sessionId) {
        return requireSession(sessionId).getRefinements();
    }

    /**
     * Follow-up questions for the latest query, highest priority first.
     */
    public List<FollowUpQuestion> getFollowUpQuestions(final String sessionId) {
        return requireSession(sessionId).getFollowUpQuestions();
    }

    public Optional<RefinementAnalysis> getLatestAnalysis(final String sessionId) {
        return requireSession(sessionId).getLatestAnalysis();
    }

    /**
     * Rewrite the session's current query with one of its suggestions.
     *
     * @throws NotFoundException if the session or the suggestion does not exist
     */
    public String applyRefinement(final String sessionId, final String refinementId) {
        final QuerySession session = requireSession(sessionId);
        final RefinementSuggestion refinement = session.findRefinement(refinementId)
                .orElseThrow(() -> new NotFoundException("Refinement", refinementId));
        session.countRefinement();

        final String query = session.getCurrentQuery();
        return switch (refinement.type()) {
            case FILTER -> applyFilter(query, refinement);
            case EXPAND -> refinement.newQuery() != null ? refinement.newQuery() : query + " OR related OR similar";
            case NARROW -> refinement.newQuery() != null ? refinement.newQuery() : query + " AND specific";
            case ALTERNATIVE -> refinement.newQuery() != null ? refinement.newQuery() : query;
            case CLARIFY -> query + " (specific context needed)";
        };
    }

    private static String applyFilter(final String query, final RefinementSuggestion refinement) {
        final Map<String, String> parameters = refinement.parameters();
        if (parameters.containsKey("documentType")) {
            return query + " filetype:" + parameters.get("documentType");
        }
        if (parameters.containsKey("author")) {
            return query + " author:\"" + parameters.get("author") + "\"";
        }
        if (parameters.containsKey("dateRange")) {
            return query + " date:" + parameters.get("dateRange");
        }
        return query;
    }

    /**
     * Rate a query of the session.
     *
     * @param queryIndex   position of the query in the session, starting at 0
     * @param satisfaction rating in [0,1]
     */
    public void recordSatisfaction(final String sessionId, final int queryIndex, final double satisfaction) {
        if (Double.isNaN(satisfaction) || satisfaction < 0.0 || satisfaction > 1.0) {
            throw new ValidationException("Satisfaction must be between 0 and 1: " + satisfaction);
        }
        final QuerySession session = requireSession(sessionId);
        if (!session.rate(queryIndex, satisfaction)) {
            throw new NotFoundException("Query", sessionId + "#" + queryIndex);
        }
    }

    public SessionMetrics getSessionAnalytics(final String sessionId) {
        return requireSession(sessionId).getMetrics();
    }

    // ========== Analysis ==========

    RefinementAnalysis analyze(final String query, final QueryIntent intent, final List<DocumentSearchResult> results) {
        final RefinementAnalysis.QueryQuality queryQuality = new RefinementAnalysis.QueryQuality(
                specificity(query, intent), clarity(query, intent), completeness(query, intent));
        final RefinementAnalysis.ResultQuality resultQuality = new RefinementAnalysis.ResultQuality(
                relevance(results), coverage(results), diversity(results));

        final List<String> opportunities = new ArrayList<>();
        if (queryQuality.specificity() < 0.6) {
            opportunities.add("Query could be more specific");
        }
        if (queryQuality.clarity() < 0.6) {
            opportunities.add("Query could be clearer");
        }
        if (resultQuality.relevance() < 0.7) {
            opportunities.add("Results may not be highly relevant");
        }
        if (results.isEmpty()) {
            opportunities.add("No results found");
        }
        if (results.size() > MANY_RESULTS) {
            opportunities.add("Too many results, could narrow down");
        }

        final double confidence = (queryQuality.specificity() + queryQuality.clarity()
                + queryQuality.completeness() + resultQuality.relevance()) / 4;
        return new RefinementAnalysis(queryQuality, resultQuality, opportunities, clamp(confidence));
    }

    private static double specificity(final String query, final QueryIntent intent) {
        double score = 0.5;
        score += Math.min(words(query).size() * 0.1, 0.3);
        score += intent.entities().size() * 0.1;
        if (!intent.entitiesOf(EntityType.DOCUMENT_TYPE).isEmpty()) {
            score += 0.1;
        }
        if (!intent.entitiesOf(EntityType.AUTHOR).isEmpty()) {
            score += 0.1;
        }
        if (!intent.entitiesOf(EntityType.DATE).isEmpty()) {
            score += 0.1;
        }
        return clamp(score);
    }

    private static double clarity(final String query, final QueryIntent intent) {
        double score = 0.7;
        if (words(query).stream().anyMatch(AMBIGUOUS_TERMS::contains)) {
            score -= 0.3;
        }
        if (query.contains("?")) {
            score += 0.1;
        }
        if (intent.confidence() < 0.6) {
            score -= 0.2;
        }
        return clamp(score);
    }

    private static double completeness(final String query, final QueryIntent intent) {
        double score = 0.6;
        if (!intent.entities().isEmpty()) {
            score += 0.2;
        }
        if (intent.entities().size() > 2) {
            score += 0.1;
        }
        final int wordCount = words(query).size();
        if (wordCount >= 3 && wordCount <= 8) {
            score += 0.1;
        }
        return clamp(score);
    }

    private static double relevance(final List<DocumentSearchResult> results) {
        if (results.isEmpty()) {
            return 0.0;
        }
        return clamp(results.stream()
                .mapToDouble(result -> result.score() != null ? result.score() : 0.5)
                .average()
                .orElse(0.0));
    }

    private static double coverage(final List<DocumentSearchResult> results) {
        return Math.min(results.size() / 20.0, 1.0);
    }

    private static double diversity(final List<DocumentSearchResult> results) {
        if (results.isEmpty()) {
            return 0.0;
        }
        final long types = results.stream().map(DocumentSearchResult::type).distinct().count();
        final long authors = results.stream().map(DocumentSearchResult::author).filter(Objects::nonNull).distinct().count();
        return (Math.min(types / 5.0, 1.0) + Math.min(authors / 10.0, 1.0)) / 2;
    }

    // ========== Suggestion generators ==========

    private static void addFilterRefinements(final List<RefinementSuggestion> refinements,
                                             final List<DocumentSearchResult> results) {
        final List<String> types = documentTypes(results);
        if (types.size() > 1) {
            for (final String type : types) {
                final String upper = type.toUpperCase(Locale.ROOT);
                refinements.add(new RefinementSuggestion("filter_type_" + type, RefinementType.FILTER,
                        "Filter by " + upper + " documents",
                        "Show only " + upper + " documents from the results",
                        "Add document type filter: " + type, 0.8, Map.of("documentType", type), null,
                        "More focused results by document type"));
            }
        }

        if (results.size() > RECENT_FILTER_RESULTS) {
            refinements.add(new RefinementSuggestion("filter_recent", RefinementType.FILTER,
                    "Show recent documents only", "Filter to documents created in the last month",
                    "Add date filter: last month", 0.7, Map.of("dateRange", "last_month"), null,
                    "More current and relevant documents"));
        }

        final List<String> authors = results.stream()
                .map(DocumentSearchResult::author)
                .filter(author -> author != null && !author.isBlank())
                .distinct()
                .toList();
        if (authors.size() > 1 && authors.size() <= 5) {
            for (final String author : authors.subList(0, Math.min(MAX_AUTHOR_FILTERS, authors.size()))) {
                refinements.add(new RefinementSuggestion("filter_author_" + author, RefinementType.FILTER,
                        "Filter by author: " + author, "Show only documents by " + author,
                        "Add author filter: " + author, 0.6, Map.of("author", author), null,
                        "Focus on specific author's work"));
            }
        }
    }

    private static void addExpansionRefinements(final List<RefinementSuggestion> refinements, final String query,
                                                final QueryIntent intent, final List<DocumentSearchResult> results,
                                                final @Nullable UserContext user) {
        if (results.size() < FEW_RESULTS) {
            refinements.add(new RefinementSuggestion("expand_synonyms", RefinementType.EXPAND,
                    "Broaden search with synonyms", "Include related terms and synonyms to find more documents",
                    "Add related terms to search", 0.7, Map.of(), null, "Find more relevant documents"));

            if (intent.entities().size() > 2) {
                refinements.add(new RefinementSuggestion("expand_remove_filters", RefinementType.EXPAND,
                        "Remove some filters", "Your search might be too specific. Try removing some constraints.",
                        "Simplify search criteria", 0.6, Map.of(), null, "Cast a wider net for results"));
            }
        }

        if (user != null) {
            final String lower = query.toLowerCase(Locale.ROOT);
            user.getRecentTopics().stream()
                    .limit(MAX_TOPIC_EXPANSIONS)
                    .filter(topic -> !lower.contains(topic.toLowerCase(Locale.ROOT)))
                    .forEach(topic -> refinements.add(new RefinementSuggestion("expand_topic_" + topic,
                            RefinementType.EXPAND, "Include \"" + topic + "\" in search",
                            "Add " + topic + " to your search based on your recent activity",
                            "Expand search to include " + topic, 0.5, Map.of(), query + " " + topic,
                            "Leverage your search history")));
        }
    }

    private static void addNarrowingRefinements(final List<RefinementSuggestion> refinements, final String query,
                                                final List<DocumentSearchResult> results,
                                                final @Nullable String previousQuery) {
        if (results.size() > NARROWING_RESULTS) {
            refinements.add(new RefinementSuggestion("narrow_specific_terms", RefinementType.NARROW,
                    "Add more specific terms", "Add more specific keywords to reduce the number of results",
                    "Make search more specific", 0.8, Map.of(), null, "More precise and relevant results"));

            if (!query.contains("\"")) {
                refinements.add(new RefinementSuggestion("narrow_exact_phrase", RefinementType.NARROW,
                        "Search for exact phrase", "Use quotes to search for the exact phrase",
                        "Add quotes for exact match", 0.7, Map.of(), "\"" + query + "\"",
                        "Find documents with exact phrase match"));
            }
        }

        if (previousQuery != null && !commonTerms(query, previousQuery).isEmpty()) {
            refinements.add(new RefinementSuggestion("narrow_context", RefinementType.NARROW,
                    "Add context from previous search", "Combine insights from your previous search",
                    "Build on previous search", 0.6, Map.of(), null, "More contextually relevant results"));
        }
    }

    private static void addAlternativeQueries(final List<RefinementSuggestion> refinements, final String query,
                                              final QueryIntent intent) {
        final String lower = query.toLowerCase(Locale.ROOT);
        final List<String> phrasings = new ArrayList<>();
        if (!lower.startsWith("find")) {
            phrasings.add("find " + query);
        }
        if (!lower.contains("about") && intent.type() == IntentType.SEARCH) {
            phrasings.add("documents about " + query);
        }
        if (!lower.contains("how to")) {
            phrasings.add("how to " + query);
        }

        final List<String> alternatives = phrasings.subList(0, Math.min(MAX_ALTERNATIVE_PHRASINGS, phrasings.size()));
        for (int i = 0; i < alternatives.size(); i++) {
            final String alternative = alternatives.get(i);
            refinements.add(new RefinementSuggestion("alternative_" + i, RefinementType.ALTERNATIVE,
                    "Try: \"" + alternative + "\"", "Alternative way to phrase your search",
                    "Use alternative phrasing", 0.6, Map.of(), alternative,
                    "Different perspective on the same topic"));
        }

        if (!lower.startsWith("how") && !lower.startsWith("what") && !lower.startsWith("why")) {
            refinements.add(new RefinementSuggestion("alternative_question", RefinementType.ALTERNATIVE,
                    "Try as a question", "Rephrase as a question for different results",
                    "Convert to question format", 0.5, Map.of(), "How to " + query,
                    "Find how-to guides and explanations"));
        }
    }

    private static void addClarifications(final List<RefinementSuggestion> refinements, final String query,
                                          final RefinementAnalysis analysis) {
        if (analysis.queryQuality().clarity() < 0.6) {
            refinements.add(new RefinementSuggestion("clarify_ambiguous", RefinementType.CLARIFY,
                    "Clarify ambiguous terms", "Your query contains terms that could have multiple meanings",
                    "Add clarifying context", 0.7, Map.of(), null, "Remove ambiguity for better results"));
        }
        if (words(query).size() < 3) {
            refinements.add(new RefinementSuggestion("clarify_short", RefinementType.CLARIFY,
                    "Add more context", "Your search is quite short. Adding more context could help.",
                    "Expand with more details", 0.6, Map.of(), null, "More comprehensive search results"));
        }
    }

    private static List<FollowUpQuestion> followUpQuestions(final String query, final List<DocumentSearchResult> results,
                                                            final @Nullable UserContext user,
                                                            final boolean followsEarlierQuery) {
        final List<FollowUpQuestion> questions = new ArrayList<>();

        if (results.isEmpty()) {
            questions.add(new FollowUpQuestion("no_results_clarify",
                    "I couldn't find any results. Would you like to try a broader search or use different keywords?",
                    FollowUpType.CLARIFICATION, 9, Map.of(),
                    List.of("Try broader search", "Use different keywords", "Check spelling")));
        } else if (results.size() > MANY_RESULTS) {
            questions.add(new FollowUpQuestion("too_many_results",
                    "I found many results. Would you like me to help narrow down the search?",
                    FollowUpType.SUGGESTION, 7, Map.of(),
                    List.of("Yes, narrow down", "Show all results", "Add filters")));
        }

        final List<String> types = documentTypes(results);
        if (types.size() > 1) {
            questions.add(new FollowUpQuestion("document_type_preference",
                    "I found " + String.join(", ", types) + " documents. Are you looking for a specific type?",
                    FollowUpType.CLARIFICATION, 6, Map.of("documentTypes", types),
                    types.stream().map(type -> "Show " + type + " only").toList()));
        }

        if (user != null) {
            final String lower = query.toLowerCase(Locale.ROOT);
            user.getRecentTopics().stream()
                    .filter(topic -> !lower.contains(topic.toLowerCase(Locale.ROOT)))
                    .findFirst()
                    .ifPresent(topic -> questions.add(new FollowUpQuestion("related_topics",
                            "Based on your recent searches, would you also like to include results about " + topic + "?",
                            FollowUpType.EXPANSION, 5, Map.of("suggestedTopic", topic),
                            List.of("Yes, include it", "No, keep current search", "Show both separately"))));
        }

        if (followsEarlierQuery) {
            questions.add(new FollowUpQuestion("satisfaction_check",
                    "Are you finding what you're looking for, or would you like me to suggest a different approach?",
                    FollowUpType.VALIDATION, 4, Map.of(),
                    List.of("This is helpful", "Try different approach", "Need more specific results")));
        }
        return questions;
    }

    // ========== Helpers ==========

    private static List<String> documentTypes(final List<DocumentSearchResult> results) {
        return results.stream()
                .map(DocumentSearchResult::type)
                .filter(Objects::nonNull)
                .distinct()
                .limit(MAX_DOCUMENT_TYPES)
                .toList();
    }

    private static List<String> words(final String query) {
        final String trimmed = query.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? List.of() : Arrays.asList(WHITESPACE.split(trimmed));
    }

    static Set<String> commonTerms(final String first, final String second) {
        final Set<String> secondTerms = new LinkedHashSet<>(words(second));
        final Set<String> common = new LinkedHashSet<>();
        for (final String term : words(first)) {
            if (term.length() > 2 && secondTerms.contains(term)) {
                common.add(term);
            }
        }
        return common;
    }

    private static double clamp(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
