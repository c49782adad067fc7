package de.mirkosertic.nlpquery.intent;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.ValidationException;
import de.mirkosertic.nlpquery.util.QuerySanitizer;
import de.mirkosertic.nlpquery.util.Scripts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text query into a {@link QueryIntent}.
 *
 * <p>Processing steps:</p>
 * <ol>
 *   <li>sanitize with {@link QuerySanitizer} and validate length and language</li>
 *   <li>normalize: lowercase and expand common abbreviations</li>
 *   <li>classify the intent by the ordered pattern groups of {@link IntentPatterns}</li>
 *   <li>extract entities from the sanitized text, keeping the original case</li>
 *   <li>compute the confidence</li>
 * </ol>
 *
 * <p>The extractor holds no mutable state and can be shared between threads.</p>
 */
public class IntentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(IntentExtractor.class);

    public static final int MIN_QUERY_LENGTH = 2;
    public static final int MAX_QUERY_LENGTH = 500;

    private static final Map<Pattern, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put(QuerySanitizer.wholeWord("docs"), "documents");
        ABBREVIATIONS.put(QuerySanitizer.wholeWord("pics"), "pictures");
        ABBREVIATIONS.put(QuerySanitizer.wholeWord("vids"), "videos");
        ABBREVIATIONS.put(QuerySanitizer.wholeWord("وثائق"), "مستندات");
        ABBREVIATIONS.put(QuerySanitizer.wholeWord("صور"), "صورة");
    }

    private static final Map<String, String> DOCUMENT_TYPES = Map.ofEntries(
            Map.entry("pdf", "pdf"),
            Map.entry("word", "docx"),
            Map.entry("excel", "xlsx"),
            Map.entry("powerpoint", "pptx"),
            Map.entry("image", "image"),
            Map.entry("photo", "image"),
            Map.entry("video", "video"),
            Map.entry("audio", "audio"),
            Map.entry("text", "txt"),
            Map.entry("ملف", "document"),
            Map.entry("مستند", "document"),
            Map.entry("صورة", "image"),
            Map.entry("صور", "image"),
            Map.entry("فيديو", "video"),
            Map.entry("صوت", "audio"),
            Map.entry("نص", "txt"));

    private static final Map<String, Integer> RELATIVE_DAYS = Map.of(
            "today", 0,
            "yesterday", -1,
            "tomorrow", 1,
            "اليوم", 0,
            "أمس", -1,
            "غداً", 1,
            "غدا", 1);

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private static final Pattern AGGREGATION_COUNT = Pattern.compile("\\b(?:count|how\\s+many)|كم|عدد",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATION_SUM = Pattern.compile("\\b(?:sum|total)|مجموع", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATION_AVERAGE = Pattern.compile("\\baverage|معدل", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCLUSIVE = Pattern.compile("\\b(?:only|just)\\b|فقط", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPE_RECENT = Pattern.compile("\\b(?:recent|latest)|أحدث", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPE_POPULAR = Pattern.compile("\\b(?:popular|trending)|شائع",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPE_SIMILAR = Pattern.compile("\\b(?:similar|related)|مشابه",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> CLARIFICATIONS_EN = List.of(
            "Are you looking for specific documents?",
            "Do you want to filter by document type?",
            "Would you like to specify a time range?");
    private static final List<String> CLARIFICATIONS_AR = List.of(
            "هل تريد البحث عن مستندات معينة؟",
            "هل تقصد نوع ملف محدد؟",
            "هل تريد تحديد فترة زمنية معينة؟");

    private final IntentPatterns patterns;
    private final Clock clock;

    public IntentExtractor() {
        this(IntentPatterns.defaults(), Clock.systemUTC());
    }

    public IntentExtractor(final IntentPatterns patterns, final Clock clock) {
        this.patterns = patterns;
        this.clock = clock;
    }

    /**
     * Extract the intent of a query, inferring the language from its script.
     */
    public QueryIntent extract(final String query) {
        if (query == null) {
            throw new ValidationException("Query must be a non-empty string");
        }
        return extract(query, inferLanguage(query));
    }

    /**
     * Extract the intent of a query.
     *
     * @param query    the raw query text
     * @param language {@code en} or {@code ar}
     * @throws ValidationException for empty, too short or too long queries and unsupported languages
     */
    public QueryIntent extract(final String query, final String language) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must be a non-empty string");
        }
        return extract(query, Language.queryLanguage(language));
    }

    public QueryIntent extract(final String query, final Language language) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must be a non-empty string");
        }
        if (language == null || language == Language.MIXED) {
            throw new ValidationException("Language must be either \"en\" or \"ar\"");
        }

        final String sanitized = QuerySanitizer.sanitize(query);
        if (sanitized.length() > MAX_QUERY_LENGTH) {
            throw new ValidationException("Query exceeds maximum length of " + MAX_QUERY_LENGTH + " characters");
        }
        if (sanitized.length() < MIN_QUERY_LENGTH) {
            throw new ValidationException("Query must be at least " + MIN_QUERY_LENGTH + " characters long");
        }

        final String normalized = normalize(sanitized);
        final IntentType type = classify(normalized, language);
        final boolean patternMatched = matchesAny(patterns.intentPatterns(type, language), normalized);
        final String action = patternMatched ? extractAction(normalized, type, language) : "find";
        final Map<String, Object> parameters = extractParameters(normalized, type);
        final List<QueryEntity> entities = extractEntities(sanitized);
        final double confidence = confidence(normalized, entities.size(), patternMatched);

        if (logger.isDebugEnabled()) {
            logger.debug("Classified '{}' ({}) as {} / {} with {} entities, confidence {}",
                    normalized, language.code(), type.code(), action, entities.size(), confidence);
        }

        return new QueryIntent(type, action, confidence, entities, parameters);
    }

    /**
     * A query is ambiguous when the confidence is low or it consists of a single word.
     */
    public boolean isAmbiguous(final String query, final double confidence) {
        if (query == null) {
            return true;
        }
        return confidence < 0.6 || tokenCount(query.trim()) < 2;
    }

    /**
     * Up to two localized prompts asking the user to narrow an ambiguous query.
     */
    public List<String> clarificationQuestions(final Language language) {
        final List<String> questions = language == Language.AR ? CLARIFICATIONS_AR : CLARIFICATIONS_EN;
        return questions.subList(0, 2);
    }

    /**
     * Run every compiled pattern once so that later queries do not pay for lazy regex setup.
     */
    public void warmUp() {
        final String sample = "find pdf documents by John Smith about budget today \"report\" ابحث عن مستند";
        int matches = 0;
        for (final Pattern pattern : patterns.allPatterns()) {
            if (pattern.matcher(sample).find()) {
                matches++;
            }
        }
        logger.debug("Warmed up {} intent patterns ({} matched the sample)", patterns.allPatterns().size(), matches);
    }

    /**
     * Arabic when Arabic letters outnumber Latin letters, English otherwise.
     */
    public static Language inferLanguage(final String text) {
        return Scripts.countArabicLetters(text) > Scripts.countLatinLetters(text) ? Language.AR : Language.EN;
    }

    String normalize(final String sanitized) {
        String normalized = sanitized.toLowerCase(Locale.ROOT);
        for (final Map.Entry<Pattern, String> abbreviation : ABBREVIATIONS.entrySet()) {
            normalized = abbreviation.getKey().matcher(normalized).replaceAll(Matcher.quoteReplacement(abbreviation.getValue()));
        }
        return QuerySanitizer.collapseWhitespace(normalized);
    }

    private IntentType classify(final String normalized, final Language language) {
        for (final IntentType type : IntentType.values()) {
            if (matchesAny(patterns.intentPatterns(type, language), normalized)) {
                return type;
            }
        }
        return IntentType.SEARCH;
    }

    private String extractAction(final String normalized, final IntentType type, final Language language) {
        final List<String> vocabulary = patterns.actions(type, language);
        for (final String action : vocabulary) {
            if (QuerySanitizer.wholeWord(action).matcher(normalized).find()) {
                return action;
            }
        }
        return vocabulary.get(0);
    }

    private Map<String, Object> extractParameters(final String normalized, final IntentType type) {
        final Map<String, Object> parameters = new LinkedHashMap<>();

        if (type == IntentType.ANALYTICS) {
            if (AGGREGATION_COUNT.matcher(normalized).find()) {
                parameters.put("aggregation", "count");
            } else if (AGGREGATION_SUM.matcher(normalized).find()) {
                parameters.put("aggregation", "sum");
            } else if (AGGREGATION_AVERAGE.matcher(normalized).find()) {
                parameters.put("aggregation", "average");
            }
        } else if (type == IntentType.FILTER && EXCLUSIVE.matcher(normalized).find()) {
            parameters.put("exclusive", Boolean.TRUE);
        }

        // Context scope applies to every intent type
        if (SCOPE_RECENT.matcher(normalized).find()) {
            parameters.put("context", "recent");
        } else if (SCOPE_POPULAR.matcher(normalized).find()) {
            parameters.put("context", "popular");
        } else if (SCOPE_SIMILAR.matcher(normalized).find()) {
            parameters.put("context", "similar");
        }

        return parameters;
    }

    /**
     * Extract typed entities and quoted topics from sanitized, original-case text.
     * Duplicates of the same type and normalized value are reported once.
     */
    public List<QueryEntity> extractEntities(final String sanitized) {
        final List<QueryEntity> entities = new ArrayList<>();
        final Set<String> seen = new HashSet<>();

        for (final Map.Entry<EntityType, List<Pattern>> entry : patterns.entityPatterns().entrySet()) {
            final EntityType type = entry.getKey();
            for (final Pattern pattern : entry.getValue()) {
                final Matcher matcher = pattern.matcher(sanitized);
                if (!matcher.find()) {
                    continue;
                }
                final String raw = matcher.groupCount() >= 1 && matcher.group(1) != null
                        ? matcher.group(1)
                        : matcher.group();
                final String value = raw.trim();
                if (value.isEmpty()) {
                    continue;
                }
                addEntity(entities, seen, new QueryEntity(type, value, normalizeEntity(value, type)));
            }
        }

        final Matcher quoted = QUOTED.matcher(sanitized);
        while (quoted.find()) {
            final String value = quoted.group(1).trim();
            if (!value.isEmpty()) {
                addEntity(entities, seen, new QueryEntity(EntityType.TOPIC, value, value.toLowerCase(Locale.ROOT)));
            }
        }

        return entities;
    }

    private static void addEntity(final List<QueryEntity> entities, final Set<String> seen, final QueryEntity entity) {
        if (seen.add(entity.type() + "|" + entity.normalized())) {
            entities.add(entity);
        }
    }

    private String normalizeEntity(final String value, final EntityType type) {
        final String lower = value.toLowerCase(Locale.ROOT);
        return switch (type) {
            case DOCUMENT_TYPE -> DOCUMENT_TYPES.getOrDefault(lower, lower);
            case DATE -> {
                final Integer offset = RELATIVE_DAYS.get(lower);
                yield offset != null ? LocalDate.now(clock).plusDays(offset).toString() : lower;
            }
            case AUTHOR, TOPIC -> lower;
        };
    }

    private static double confidence(final String normalized, final int entityCount, final boolean patternMatched) {
        double confidence = 0.5;
        if (tokenCount(normalized) > 3) {
            confidence += 0.2;
        }
        confidence += entityCount * 0.1;
        if (patternMatched) {
            confidence += 0.2;
        }
        return Math.min(confidence, 1.0);
    }

    private static boolean matchesAny(final List<Pattern> candidates, final String text) {
        for (final Pattern pattern : candidates) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static int tokenCount(final String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return text.split(" ").length;
    }
}
