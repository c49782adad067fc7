package de.mirkosertic.nlpquery.template;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.NotFoundException;
import de.mirkosertic.nlpquery.ValidationException;
import de.mirkosertic.nlpquery.context.UserContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Catalog of question templates: execution, search, suggestions, personalization and usage
 * analytics.
 *
 * <p>The catalog is copy-on-write and keeps insertion order. Built-in templates can be replaced but
 * not removed.</p>
 */
public class QuestionTemplateLibrary {

    private static final Logger logger = LoggerFactory.getLogger(QuestionTemplateLibrary.class);

    private static final double TEMPLATE_TEXT_WEIGHT = 0.6;
    private static final double TITLE_WEIGHT = 0.5;
    private static final double DESCRIPTION_WEIGHT = 0.3;
    private static final double TAG_WEIGHT = 0.4;
    private static final double EXAMPLE_WEIGHT = 0.2;

    private static final int MAX_TOPIC_HINTS = 3;

    private final Clock clock;
    private final Set<String> builtInIds;
    private final Map<String, UsageRecord> usage = new ConcurrentHashMap<>();

    private volatile Map<String, QuestionTemplate> templates;
    private volatile @Nullable Map<String, SearchableText> searchIndex;

    /**
     * Lowercased searchable fields of one template.
     */
    private record SearchableText(String template, String title, String description, List<String> tags,
                                  List<String> examples) {

        static SearchableText of(final QuestionTemplate template) {
            return new SearchableText(
                    lower(template.template()),
                    lower(template.title()),
                    lower(template.description()),
                    template.tags().stream().map(QuestionTemplateLibrary::lower).toList(),
                    template.examples().stream().map(QuestionTemplateLibrary::lower).toList());
        }
    }

    private static final class UsageRecord {

        private long count;
        private final Set<String> users = new HashSet<>();
        private Instant lastUsed;

        synchronized void record(final String userId, final Instant now) {
            count++;
            users.add(userId);
            lastUsed = now;
        }

        synchronized TemplateUsage snapshot(final String templateId) {
            return new TemplateUsage(templateId, count, approximateUniqueUsers(count), users.size(), lastUsed);
        }
    }

    public QuestionTemplateLibrary() {
        this(Clock.systemUTC());
    }

    public QuestionTemplateLibrary(final Clock clock) {
        this.clock = clock;
        final Map<String, QuestionTemplate> defaults = new LinkedHashMap<>();
        for (final QuestionTemplate template : DefaultTemplates.all()) {
            defaults.put(template.id(), template);
        }
        this.templates = defaults;
        this.builtInIds = Set.copyOf(defaults.keySet());
    }

    // ========== Catalog ==========

    /**
     * Templates in catalog order, optionally restricted to a category and a language.
     */
    public List<QuestionTemplate> getTemplates(final @Nullable TemplateCategory category, final @Nullable Language language) {
        return templates.values().stream()
                .filter(template -> category == null || template.category() == category)
                .filter(template -> language == null || template.language() == language)
                .toList();
    }

    public Optional<QuestionTemplate> getTemplate(final String id) {
        return Optional.ofNullable(templates.get(id));
    }

    /**
     * @throws NotFoundException if no template has the given id
     */
    public QuestionTemplate requireTemplate(final String id) {
        final QuestionTemplate template = templates.get(id);
        if (template == null) {
            throw new NotFoundException("Template", id);
        }
        return template;
    }

    /**
     * Add a template or replace the one with the same id.
     *
     * @throws ValidationException if id, title, description, text, category or language is missing
     */
    public synchronized void addTemplate(final QuestionTemplate template) {
        if (!template.isComplete()) {
            throw new ValidationException("Template is incomplete: " + template.id());
        }
        final Map<String, QuestionTemplate> copy = new LinkedHashMap<>(templates);
        copy.put(template.id(), template);
        publish(copy);
        logger.debug("Added template '{}'", template.id());
    }

    /**
     * Remove a custom template.
     *
     * @return false for built-in templates and unknown ids
     */
    public synchronized boolean removeTemplate(final String id) {
        if (builtInIds.contains(id) || !templates.containsKey(id)) {
            return false;
        }
        final Map<String, QuestionTemplate> copy = new LinkedHashMap<>(templates);
        copy.remove(id);
        publish(copy);
        logger.debug("Removed template '{}'", id);
        return true;
    }

    private void publish(final Map<String, QuestionTemplate> catalog) {
        templates = catalog;
        if (searchIndex != null) {
            searchIndex = buildIndex(catalog);
        }
    }

    /**
     * Build the lowercase search index for the current catalog. Later catalog changes keep the
     * index up to date.
     */
    public void preloadTemplates() {
        final Map<String, SearchableText> index = buildIndex(templates);
        searchIndex = index;
        logger.info("Preloaded search index for {} templates", index.size());
    }

    private static Map<String, SearchableText> buildIndex(final Map<String, QuestionTemplate> catalog) {
        final Map<String, SearchableText> index = new ConcurrentHashMap<>();
        catalog.forEach((id, template) -> index.put(id, SearchableText.of(template)));
        return index;
    }

    private SearchableText searchableText(final QuestionTemplate template) {
        final Map<String, SearchableText> index = searchIndex;
        if (index != null) {
            final SearchableText indexed = index.get(template.id());
            if (indexed != null) {
                return indexed;
            }
        }
        return SearchableText.of(template);
    }

    // ========== Execution ==========

    /**
     * Fill every {@code {name}} placeholder of a template.
     *
     * @throws NotFoundException   if the template does not exist
     * @throws ValidationException if a required parameter is missing or empty
     */
    public ExecutableTemplate executeTemplate(final String templateId, final Map<String, String> parameters) {
        final QuestionTemplate template = requireTemplate(templateId);

        for (final TemplateParameter parameter : template.parameters()) {
            final String value = parameters.get(parameter.name());
            if (parameter.required() && (value == null || value.isEmpty())) {
                throw new ValidationException("Missing required parameter: " + parameter.name());
            }
        }

        String generated = template.template();
        for (final TemplateParameter parameter : template.parameters()) {
            final String value = parameters.get(parameter.name());
            generated = generated.replace(parameter.placeholder(), value == null ? "" : value);
        }

        final Map<String, String> given = parameters.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        final ExecutableTemplate executable =
                new ExecutableTemplate(template, given, generated.trim(), suggestedFilters(parameters));
        logger.debug("Executed template '{}' into '{}'", templateId, executable.generatedQuery());
        return executable;
    }

    private static Map<String, List<String>> suggestedFilters(final Map<String, String> parameters) {
        final Map<String, List<String>> filters = new LinkedHashMap<>();
        final String type = parameters.get("type");
        if (type != null && !type.isEmpty()) {
            filters.put("documentTypes", List.of(type.toLowerCase(Locale.ROOT)));
        }
        final String author = parameters.get("author");
        if (author != null && !author.isEmpty()) {
            filters.put("authors", List.of(author));
        }
        final String status = parameters.get("status");
        if (status != null && !status.isEmpty()) {
            filters.put("status", List.of(status));
        }
        return filters;
    }

    // ========== Search and suggestions ==========

    /**
     * Templates whose text, title, description, tags or examples contain the query, best first.
     * Each field adds its weight once: text 0.6, title 0.5, tags 0.4, description 0.3, examples 0.2,
     * the total capped at 1.0.
     */
    public List<TemplateSearchResult> searchTemplates(final String query, final int maxResults) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final String needle = lower(query.trim());

        final List<TemplateSearchResult> results = new ArrayList<>();
        for (final QuestionTemplate template : templates.values()) {
            final SearchableText text = searchableText(template);

            double score = 0.0;
            final List<String> matchedText = new ArrayList<>();
            if (text.template().contains(needle)) {
                score += TEMPLATE_TEXT_WEIGHT;
                matchedText.add(template.template());
            }
            if (text.title().contains(needle)) {
                score += TITLE_WEIGHT;
                matchedText.add(template.title());
            }
            if (text.description().contains(needle)) {
                score += DESCRIPTION_WEIGHT;
            }
            final List<String> matchedTags = new ArrayList<>();
            for (int i = 0; i < text.tags().size(); i++) {
                if (text.tags().get(i).contains(needle)) {
                    matchedTags.add(template.tags().get(i));
                }
            }
            if (!matchedTags.isEmpty()) {
                score += TAG_WEIGHT;
            }
            if (text.examples().stream().anyMatch(example -> example.contains(needle))) {
                score += EXAMPLE_WEIGHT;
            }

            if (score > 0.0) {
                results.add(new TemplateSearchResult(template, Math.min(1.0, score), matchedText, matchedTags));
            }
        }

        return results.stream()
                .sorted(Comparator.comparingDouble(TemplateSearchResult::score).reversed())
                .limit(Math.max(0, maxResults))
                .toList();
    }

    /**
     * Rank every template for a user and an optional query text.
     */
    public List<TemplateSuggestion> suggestTemplates(final @Nullable UserContext user, final @Nullable String queryText,
                                                     final int maxSuggestions) {
        final List<TemplateSuggestion> suggestions = new ArrayList<>();
        for (final QuestionTemplate template : templates.values()) {
            final double relevance = relevance(template, user, queryText);
            if (relevance > 0.0) {
                suggestions.add(new TemplateSuggestion(template, relevance, reason(template, user, queryText),
                        suggestParameters(template, user)));
            }
        }
        return suggestions.stream()
                .sorted(Comparator.comparingDouble(TemplateSuggestion::relevanceScore).reversed())
                .limit(Math.max(0, maxSuggestions))
                .toList();
    }

    private double relevance(final QuestionTemplate template, final @Nullable UserContext user,
                             final @Nullable String queryText) {
        double score = template.priority() * 0.2;
        final String body = lower(template.template());

        if (user != null && user.getPreferredLanguage() == template.language()) {
            score += 0.3;
        }

        if (queryText != null && !queryText.isBlank()) {
            final String query = lower(queryText);
            if (body.contains(query)) {
                score += 0.4;
            }
            if (template.tags().stream().anyMatch(tag -> query.contains(lower(tag)))) {
                score += 0.3;
            }
        }

        if (user != null && sharesRecentTopic(template, body, user)) {
            score += 0.2;
        }

        final String department = user != null ? user.getDepartment() : null;
        if (department != null && template.tags().contains(department)) {
            score += 0.2;
        }

        return Math.min(1.0, score);
    }

    private static boolean sharesRecentTopic(final QuestionTemplate template, final String body, final UserContext user) {
        for (final String topic : user.getRecentTopics()) {
            final String lowerTopic = lower(topic);
            if (body.contains(lowerTopic)
                    || template.tags().stream().anyMatch(tag -> lowerTopic.contains(lower(tag)))) {
                return true;
            }
        }
        return false;
    }

    private static String reason(final QuestionTemplate template, final @Nullable UserContext user,
                                 final @Nullable String queryText) {
        final String body = lower(template.template());
        if (queryText != null && !queryText.isBlank() && body.contains(lower(queryText))) {
            return "Matches your search query";
        }
        if (user != null && user.getPreferredLanguage() == template.language()) {
            return "Matches your language preference";
        }
        if (user != null && user.getRecentTopics().stream().anyMatch(topic -> body.contains(lower(topic)))) {
            return "Related to your recent activity";
        }
        return "Popular template";
    }

    private static Map<String, String> suggestParameters(final QuestionTemplate template, final @Nullable UserContext user) {
        final Map<String, String> suggested = new LinkedHashMap<>();
        if (user == null) {
            return suggested;
        }
        for (final TemplateParameter parameter : template.parameters()) {
            if ("type".equals(parameter.name()) && !user.getPreferredDocumentTypes().isEmpty()) {
                suggested.put("type", user.getPreferredDocumentTypes().get(0));
            }
        }
        return suggested;
    }

    /**
     * Fill guessed parameter values into a copy of the template text, marked as {@code [value]}.
     * The template itself is not changed.
     */
    public PersonalizedTemplate personalizeTemplate(final QuestionTemplate template, final @Nullable UserContext user) {
        final Map<String, String> suggested = suggestParameters(template, user);

        String personalized = template.template();
        for (final TemplateParameter parameter : template.parameters()) {
            final String value = suggested.get(parameter.name());
            if (value != null && !value.isEmpty()) {
                personalized = personalized.replace(parameter.placeholder(), "[" + value + "]");
            }
        }

        final List<String> hints = new ArrayList<>();
        if (user != null) {
            final List<String> topics = user.getRecentTopics();
            if (!topics.isEmpty()) {
                hints.add("Based on your recent topics: "
                        + String.join(", ", topics.subList(0, Math.min(MAX_TOPIC_HINTS, topics.size()))));
            }
            if (!user.getPreferredDocumentTypes().isEmpty()) {
                hints.add("Your preferred document types: " + String.join(", ", user.getPreferredDocumentTypes()));
            }
            if (user.getDepartment() != null) {
                hints.add("Tailored for " + user.getDepartment() + " department");
            }
        }

        return new PersonalizedTemplate(personalized, suggested, hints, relevance(template, user, null));
    }

    // ========== Usage analytics ==========

    /**
     * Count one use of a template by a user.
     *
     * @throws NotFoundException if the template does not exist
     */
    public void trackTemplateUsage(final String templateId, final String userId) {
        requireTemplate(templateId);
        usage.computeIfAbsent(templateId, id -> new UsageRecord()).record(userId, clock.instant());
    }

    /**
     * Estimated number of users from the usage count alone, assuming every user applies a template
     * about one and a half times. This is an approximation, not a distinct count; see
     * {@link TemplateUsage#distinctUsers()} for the exact figure.
     */
    public static long approximateUniqueUsers(final long usageCount) {
        return Math.max(1, (long) Math.floor((usageCount + 1) / 1.5));
    }

    public Map<String, TemplateUsage> getUsageAnalytics() {
        final Map<String, TemplateUsage> analytics = new LinkedHashMap<>();
        usage.forEach((id, record) -> analytics.put(id, record.snapshot(id)));
        return analytics;
    }

    /**
     * Most used templates first. Usage of templates removed since is ignored.
     */
    public List<PopularTemplate> getPopularTemplates(final int maxResults) {
        final Map<String, QuestionTemplate> catalog = templates;
        final List<PopularTemplate> popular = new ArrayList<>();
        usage.forEach((id, record) -> {
            final QuestionTemplate template = catalog.get(id);
            if (template != null) {
                final TemplateUsage snapshot = record.snapshot(id);
                popular.add(new PopularTemplate(template, snapshot.usageCount(), snapshot.uniqueUsers()));
            }
        });
        return popular.stream()
                .sorted(Comparator.comparingLong(PopularTemplate::usageCount).reversed())
                .limit(Math.max(0, maxResults))
                .toList();
    }

    public void clearUsageAnalytics() {
        usage.clear();
    }

    // ========== Export and import ==========

    /**
     * Export the given templates, or the whole catalog when {@code templateIds} is null. Unknown ids
     * are skipped.
     */
    public TemplateExport exportTemplates(final @Nullable Collection<String> templateIds) {
        final Map<String, QuestionTemplate> catalog = templates;
        final List<QuestionTemplate> exported = templateIds == null
                ? List.copyOf(catalog.values())
                : templateIds.stream().map(catalog::get).filter(Objects::nonNull).toList();
        return new TemplateExport(TemplateExport.CURRENT_VERSION, clock.instant(), exported);
    }

    public String exportTemplatesAsJson(final @Nullable Collection<String> templateIds) {
        return TemplateExportCodec.toJson(exportTemplates(templateIds));
    }

    /**
     * Import templates. Incomplete templates are skipped, so are templates whose id already exists
     * unless {@code replace} is set.
     *
     * @return the number of templates added or replaced
     */
    public synchronized int importTemplates(final TemplateExport export, final boolean replace) {
        final Map<String, QuestionTemplate> copy = new LinkedHashMap<>(templates);
        int imported = 0;
        for (final QuestionTemplate template : export.templates()) {
            if (!template.isComplete()) {
                logger.warn("Skipping incomplete template '{}' during import", template.id());
                continue;
            }
            if (!replace && copy.containsKey(template.id())) {
                logger.debug("Skipping existing template '{}' during import", template.id());
                continue;
            }
            copy.put(template.id(), template);
            imported++;
        }
        publish(copy);
        logger.info("Imported {} of {} templates (export version {})",
                imported, export.templates().size(), export.version());
        return imported;
    }

    /**
     * @throws ValidationException if the JSON cannot be parsed
     */
    public int importTemplatesFromJson(final String json, final boolean replace) {
        return importTemplates(TemplateExportCodec.fromJson(json), replace);
    }

    private static String lower(final @Nullable String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
