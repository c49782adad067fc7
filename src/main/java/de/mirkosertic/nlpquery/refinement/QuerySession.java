package de.mirkosertic.nlpquery.refinement;

import de.mirkosertic.nlpquery.context.UserContext;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Query history of one user session. Suggestions and follow-up questions are replaced on every
 * added query, never accumulated.
 */
public class QuerySession {

    static final double SUCCESS_THRESHOLD = 0.7;

    private final String id;
    private final String userId;
    private final Instant createdAt;
    private final List<SessionQuery> queries = new ArrayList<>();

    private String currentQuery = "";
    private List<RefinementSuggestion> refinements = List.of();
    private List<FollowUpQuestion> followUpQuestions = List.of();
    private @Nullable RefinementAnalysis latestAnalysis;
    private @Nullable UserContext userContext;
    private int refinementCount;

    QuerySession(final String id, final String userId, final Instant createdAt, final @Nullable UserContext userContext) {
        this.id = id;
        this.userId = userId;
        this.createdAt = createdAt;
        this.userContext = userContext;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized List<SessionQuery> getQueries() {
        return List.copyOf(queries);
    }

    public synchronized String getCurrentQuery() {
        return currentQuery;
    }

    public synchronized List<RefinementSuggestion> getRefinements() {
        return refinements;
    }

    public synchronized List<FollowUpQuestion> getFollowUpQuestions() {
        return followUpQuestions;
    }

    public synchronized Optional<RefinementAnalysis> getLatestAnalysis() {
        return Optional.ofNullable(latestAnalysis);
    }

    public synchronized Optional<UserContext> getUserContext() {
        return Optional.ofNullable(userContext);
    }

    synchronized void setUserContext(final @Nullable UserContext context) {
        this.userContext = context;
    }

    synchronized void addQuery(final SessionQuery query, final RefinementAnalysis analysis,
                               final List<RefinementSuggestion> newRefinements,
                               final List<FollowUpQuestion> newFollowUps) {
        queries.add(query);
        currentQuery = query.text();
        latestAnalysis = analysis;
        refinements = newRefinements.stream()
                .sorted(Comparator.comparingDouble(RefinementSuggestion::confidence).reversed())
                .toList();
        followUpQuestions = newFollowUps.stream()
                .sorted(Comparator.comparingInt(FollowUpQuestion::priority).reversed())
                .toList();
    }

    synchronized Optional<SessionQuery> lastQuery() {
        return queries.isEmpty() ? Optional.empty() : Optional.of(queries.get(queries.size() - 1));
    }

    synchronized Optional<RefinementSuggestion> findRefinement(final String refinementId) {
        return refinements.stream().filter(r -> r.id().equals(refinementId)).findFirst();
    }

    synchronized void countRefinement() {
        refinementCount++;
    }

    /**
     * @return false if no query has the given index
     */
    synchronized boolean rate(final int index, final double satisfaction) {
        if (index < 0 || index >= queries.size()) {
            return false;
        }
        queries.set(index, queries.get(index).withSatisfaction(satisfaction));
        return true;
    }

    /**
     * Time of the latest query, or the creation time for a session without queries.
     */
    synchronized Instant lastActivity() {
        return queries.stream()
                .map(SessionQuery::timestamp)
                .max(Comparator.naturalOrder())
                .orElse(createdAt);
    }

    public synchronized SessionMetrics getMetrics() {
        final List<Double> ratings = queries.stream()
                .map(SessionQuery::satisfaction)
                .filter(Objects::nonNull)
                .toList();
        final double average = ratings.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        final int successful = (int) ratings.stream().filter(rating -> rating >= SUCCESS_THRESHOLD).count();
        return new SessionMetrics(queries.size(), refinementCount, average, successful);
    }
}
