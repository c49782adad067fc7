package de.mirkosertic.nlpquery.context;

import de.mirkosertic.nlpquery.intent.IntentType;
import de.mirkosertic.nlpquery.intent.QueryIntent;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.util.QuerySanitizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Blends organizational vocabulary, the current user's activity and document collection
 * statistics into query enhancements and completions.
 *
 * <p>The organizational catalog is copy-on-write, the current user and the collection
 * snapshot are replaced atomically.</p>
 */
public class ContextManager {

    private static final Logger logger = LoggerFactory.getLogger(ContextManager.class);

    static final double CLARIFICATION_THRESHOLD = 0.7;

    private static final int MAX_SUGGESTED_TERMS = 5;
    private static final int MAX_ALTERNATIVES = 3;
    private static final int MAX_CLARIFICATIONS = 2;
    private static final int MAX_COMPLETIONS = 8;
    private static final int RECENT_TOPIC_HINTS = 2;
    private static final int CLARIFIED_DOCUMENT_TYPES = 3;

    private final Clock clock;

    private volatile Map<String, OrganizationalContext> organizationalContexts;
    private volatile @Nullable UserContext currentUserContext;
    private volatile @Nullable DocumentCollectionContext collectionContext;

    public ContextManager() {
        this(Clock.systemUTC());
    }

    public ContextManager(final Clock clock) {
        this.clock = clock;
        final Map<String, OrganizationalContext> defaults = new LinkedHashMap<>();
        for (final OrganizationalContext context : defaultContexts()) {
            defaults.put(context.id(), context);
        }
        this.organizationalContexts = defaults;
    }

    /**
     * Add a context or replace the one with the same id.
     */
    public synchronized void addOrganizationalContext(final OrganizationalContext context) {
        final Map<String, OrganizationalContext> copy = new LinkedHashMap<>(organizationalContexts);
        copy.put(context.id(), context);
        organizationalContexts = copy;
        logger.debug("Registered organizational context '{}'", context.id());
    }

    public List<OrganizationalContext> getAllOrganizationalContexts() {
        return List.copyOf(organizationalContexts.values());
    }

    public void setUserContext(final @Nullable UserContext userContext) {
        this.currentUserContext = userContext;
    }

    public Optional<UserContext> getCurrentUserContext() {
        return Optional.ofNullable(currentUserContext);
    }

    /**
     * Replace the collection snapshot with statistics of the given documents.
     */
    public void updateDocumentCollectionContext(final List<DocumentSearchResult> documents) {
        final DocumentCollectionContext snapshot = DocumentCollectionContext.of(documents, clock);
        collectionContext = snapshot;
        logger.info("Document collection context updated: {} documents, {} types, {} topics",
                snapshot.totalDocuments(), snapshot.documentTypes().size(), snapshot.topics().size());
    }

    public Optional<DocumentCollectionContext> getDocumentCollectionContext() {
        return Optional.ofNullable(collectionContext);
    }

    /**
     * Contexts relevant to a query: the user's own department first, then every other context whose
     * terminology or common queries overlap with the query, in catalog order.
     *
     * @param user the user to consider, or null for the current user
     */
    public List<OrganizationalContext> getRelevantContexts(final String query, final @Nullable UserContext user) {
        final UserContext effectiveUser = user != null ? user : currentUserContext;
        final Map<String, OrganizationalContext> catalog = organizationalContexts;
        final List<OrganizationalContext> relevant = new ArrayList<>();

        final String department = effectiveUser != null ? effectiveUser.getDepartment() : null;
        if (department != null && catalog.containsKey(department)) {
            relevant.add(catalog.get(department));
        }

        final String lower = query.toLowerCase(Locale.ROOT);
        for (final OrganizationalContext context : catalog.values()) {
            if (context.id().equals(department)) {
                continue;
            }
            if (mentionsTerminology(context, lower) || matchesCommonQuery(context, lower)) {
                relevant.add(context);
            }
        }
        return relevant;
    }

    private static boolean mentionsTerminology(final OrganizationalContext context, final String lowerQuery) {
        for (final Map.Entry<String, List<String>> entry : context.terminology().entrySet()) {
            if (lowerQuery.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return true;
            }
            for (final String synonym : entry.getValue()) {
                if (lowerQuery.contains(synonym.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean matchesCommonQuery(final OrganizationalContext context, final String lowerQuery) {
        for (final String common : context.commonQueries()) {
            final String lowerCommon = common.toLowerCase(Locale.ROOT);
            if (lowerQuery.contains(lowerCommon) || lowerCommon.contains(lowerQuery)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Enhance a query with organizational synonyms, user preferences and, for uncertain intents,
     * clarification questions.
     */
    public ContextualQuery enhanceQuery(final String originalQuery, final QueryIntent intent,
                                        final @Nullable UserContext user) {
        final UserContext effectiveUser = user != null ? user : currentUserContext;
        final List<OrganizationalContext> relevant = getRelevantContexts(originalQuery, effectiveUser);

        final Set<String> suggestedTerms = new LinkedHashSet<>();
        final Set<String> alternatives = new LinkedHashSet<>();
        final Set<String> clarifications = new LinkedHashSet<>();

        for (final OrganizationalContext context : relevant) {
            for (final Map.Entry<String, List<String>> entry : context.terminology().entrySet()) {
                final Pattern term = QuerySanitizer.wholeWord(entry.getKey());
                if (!term.matcher(originalQuery).find()) {
                    continue;
                }
                suggestedTerms.addAll(entry.getValue());
                for (final String synonym : entry.getValue()) {
                    alternatives.add(term.matcher(originalQuery).replaceAll(Matcher.quoteReplacement(synonym)));
                }
            }
        }

        final String lowerQuery = originalQuery.toLowerCase(Locale.ROOT);
        if (effectiveUser != null) {
            final List<String> preferredTypes = effectiveUser.getPreferredDocumentTypes();
            if (intent.type() == IntentType.SEARCH && !preferredTypes.isEmpty()) {
                final String hint = preferredTypes.get(0);
                if (!lowerQuery.contains(hint.toLowerCase(Locale.ROOT))) {
                    suggestedTerms.add(hint);
                    alternatives.add(originalQuery + " (" + hint + ")");
                }
            }

            effectiveUser.getRecentTopics().stream()
                    .limit(RECENT_TOPIC_HINTS)
                    .filter(topic -> !lowerQuery.contains(topic.toLowerCase(Locale.ROOT)))
                    .forEach(suggestedTerms::add);
        }

        final DocumentCollectionContext collection = collectionContext;
        if (intent.confidence() < CLARIFICATION_THRESHOLD) {
            if (relevant.size() > 1) {
                final String departments = relevant.stream()
                        .map(OrganizationalContext::name)
                        .collect(Collectors.joining(", "));
                clarifications.add("Are you looking for documents from: " + departments + "?");
            }
            if (collection != null && !collection.documentTypes().isEmpty()) {
                clarifications.add("Are you looking for: "
                        + String.join(", ", collection.topDocumentTypes(CLARIFIED_DOCUMENT_TYPES)) + "?");
            }
        }

        return new ContextualQuery(
                originalQuery,
                originalQuery,
                relevant,
                effectiveUser != null ? effectiveUser : UserContext.defaultContext(),
                collection != null ? collection : DocumentCollectionContext.empty(),
                limit(suggestedTerms, MAX_SUGGESTED_TERMS),
                limit(alternatives, MAX_ALTERNATIVES),
                limit(clarifications, MAX_CLARIFICATIONS));
    }

    /**
     * Completions for a partially typed query, from the user's search history, organizational
     * common queries, collection terms and collection topics.
     */
    public List<String> getQuerySuggestions(final String partialQuery, final @Nullable UserContext user) {
        final UserContext effectiveUser = user != null ? user : currentUserContext;
        final String partial = partialQuery.toLowerCase(Locale.ROOT);
        final Set<String> suggestions = new LinkedHashSet<>();

        if (effectiveUser != null) {
            effectiveUser.getSearchHistory().stream()
                    .filter(query -> query.toLowerCase(Locale.ROOT).startsWith(partial))
                    .forEach(suggestions::add);
        }

        for (final OrganizationalContext context : getRelevantContexts(partialQuery, effectiveUser)) {
            context.commonQueries().stream()
                    .filter(query -> query.toLowerCase(Locale.ROOT).contains(partial))
                    .forEach(suggestions::add);
        }

        final DocumentCollectionContext collection = collectionContext;
        if (collection != null) {
            collection.commonTerms().keySet().stream()
                    .filter(term -> term.startsWith(partial))
                    .forEach(term -> suggestions.add("find documents about " + term));
            collection.topics().stream()
                    .filter(topic -> topic.toLowerCase(Locale.ROOT).contains(partial))
                    .forEach(topic -> suggestions.add("show me " + topic + " documents"));
        }

        return limit(suggestions, MAX_COMPLETIONS);
    }

    /**
     * Record activity of the current user. Activity of any other user is ignored.
     */
    public void updateUserActivity(final String userId, final UserActivity activity) {
        final UserContext current = currentUserContext;
        if (current == null || !Objects.equals(current.getId(), userId)) {
            return;
        }
        current.record(activity);
    }

    private static List<String> limit(final Set<String> values, final int max) {
        return values.stream().limit(max).toList();
    }

    static List<OrganizationalContext> defaultContexts() {
        final Map<String, List<String>> itTerms = new LinkedHashMap<>();
        itTerms.put("server", List.of("infrastructure", "hardware", "system"));
        itTerms.put("database", List.of("db", "data store", "repository"));
        itTerms.put("api", List.of("interface", "service", "endpoint"));
        itTerms.put("security", List.of("authentication", "authorization", "access control"));
        itTerms.put("backup", List.of("recovery", "restore", "archive"));

        final Map<String, List<String>> hrTerms = new LinkedHashMap<>();
        hrTerms.put("employee", List.of("staff", "personnel", "team member"));
        hrTerms.put("policy", List.of("procedure", "guideline", "rule"));
        hrTerms.put("benefit", List.of("compensation", "package", "perk"));
        hrTerms.put("training", List.of("development", "education", "course"));
        hrTerms.put("performance", List.of("evaluation", "review", "assessment"));

        final Map<String, List<String>> legalTerms = new LinkedHashMap<>();
        legalTerms.put("contract", List.of("agreement", "terms", "deal"));
        legalTerms.put("compliance", List.of("regulation", "standard", "requirement"));
        legalTerms.put("liability", List.of("responsibility", "obligation", "duty"));
        legalTerms.put("intellectual property", List.of("ip", "patent", "trademark", "copyright"));
        legalTerms.put("dispute", List.of("conflict", "disagreement", "issue"));

        return List.of(
                new OrganizationalContext("it", "Information Technology", ContextType.DEPARTMENT, itTerms,
                        List.of("system maintenance reports", "security audit documents",
                                "infrastructure specifications", "api documentation"),
                        List.of("specifications", "manuals", "reports", "documentation")),
                new OrganizationalContext("hr", "Human Resources", ContextType.DEPARTMENT, hrTerms,
                        List.of("employee handbook", "policy documents", "training materials", "performance reviews"),
                        List.of("policies", "handbooks", "forms", "training")),
                new OrganizationalContext("legal", "Legal Department", ContextType.DEPARTMENT, legalTerms,
                        List.of("contract templates", "compliance documentation", "legal opinions",
                                "regulatory requirements"),
                        List.of("contracts", "legal opinions", "compliance", "regulations")));
    }
}
