package de.mirkosertic.nlpquery.intent;

import de.mirkosertic.nlpquery.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pattern tables driving intent classification, action lookup and entity extraction.
 *
 * <p>Intent patterns are grouped per language and per {@link IntentType}. English patterns
 * anchor on a leading word boundary, Arabic patterns match anywhere because Arabic words
 * commonly carry attached prefixes.</p>
 */
public final class IntentPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final Map<Language, Map<IntentType, List<Pattern>>> intentPatterns;
    private final Map<IntentType, Map<Language, List<String>>> actionVocabulary;
    private final Map<EntityType, List<Pattern>> entityPatterns;

    private IntentPatterns(final Map<Language, Map<IntentType, List<Pattern>>> intentPatterns,
                           final Map<IntentType, Map<Language, List<String>>> actionVocabulary,
                           final Map<EntityType, List<Pattern>> entityPatterns) {
        this.intentPatterns = intentPatterns;
        this.actionVocabulary = actionVocabulary;
        this.entityPatterns = entityPatterns;
    }

    /**
     * The built-in English and Arabic tables.
     */
    public static IntentPatterns defaults() {
        final Map<Language, Map<IntentType, List<Pattern>>> intents = new EnumMap<>(Language.class);

        final Map<IntentType, List<Pattern>> english = new EnumMap<>(IntentType.class);
        english.put(IntentType.SEARCH, compile("\\b(?:find|search|look\\s+for|get|where\\s+is|locate)"));
        english.put(IntentType.FILTER, compile("\\b(?:filter|narrow|refine|limit|only|just|specifically)"));
        english.put(IntentType.ANALYTICS, compile(
                "\\b(?:how\\s+many|count|total|sum|average|statistics|stats|analy[sz]e)"));
        english.put(IntentType.ACTION, compile("\\b(?:open|download|share|delete|edit|copy|move|organi[sz]e)"));
        english.put(IntentType.CONTEXT, compile(
                "\\bshow\\s+me\\s+(?:recent|latest|new|popular|trending|similar|related)"));
        intents.put(Language.EN, english);

        final Map<IntentType, List<Pattern>> arabic = new EnumMap<>(IntentType.class);
        arabic.put(IntentType.SEARCH, compile("(?:ابحث|اعثر|أين)"));
        arabic.put(IntentType.FILTER, compile("(?:صفّي|صفي|حدد|اختر|فقط)"));
        arabic.put(IntentType.ANALYTICS, compile("(?:كم|عدد|مجموع|معدل|إحصائيات|تحليل)"));
        arabic.put(IntentType.ACTION, compile("(?:افتح|حمّل|شارك|احذف|عدّل|انسخ|انقل|نظّم)"));
        arabic.put(IntentType.CONTEXT, compile("(?:أظهر|اعرض)\\s+(?:أحدث|جديد|شائع|مشابه|مثل|قريب)"));
        intents.put(Language.AR, arabic);

        final Map<IntentType, Map<Language, List<String>>> actions = new EnumMap<>(IntentType.class);
        actions.put(IntentType.SEARCH, vocabulary(
                List.of("find", "search", "look", "get", "show", "locate"),
                List.of("ابحث", "اعثر", "أظهر", "اعرض")));
        actions.put(IntentType.FILTER, vocabulary(
                List.of("filter", "narrow", "refine", "limit", "select"),
                List.of("صفّي", "حدد", "اختر")));
        actions.put(IntentType.ANALYTICS, vocabulary(
                List.of("count", "analyze", "summarize", "calculate"),
                List.of("احسب", "حلّل", "لخّص")));
        actions.put(IntentType.ACTION, vocabulary(
                List.of("open", "download", "share", "delete", "edit"),
                List.of("افتح", "حمّل", "شارك", "احذف", "عدّل")));
        actions.put(IntentType.CONTEXT, vocabulary(
                List.of("show", "find", "get"),
                List.of("أظهر", "اعثر", "اعرض")));

        final Map<EntityType, List<Pattern>> entities = new EnumMap<>(EntityType.class);
        entities.put(EntityType.DOCUMENT_TYPE, compile(
                "\\b(pdf|word|excel|powerpoint|image|photo|video|audio|text|document)s?\\b",
                "(ملف|مستند|صورة|فيديو|صوت|نص)",
                "(صور)"));
        entities.put(EntityType.DATE, compile(
                "\\b(?:today|yesterday|tomorrow|last\\s+week|next\\s+week|this\\s+month|last\\s+month)\\b",
                "\\b(?:\\d{1,2}/\\d{1,2}/\\d{4}|\\d{4}-\\d{2}-\\d{2})\\b",
                "(?:اليوم|أمس|غداً|غدا|الأسبوع\\s+الماضي|الشهر\\s+الماضي|هذا\\s+الشهر)"));
        entities.put(EntityType.AUTHOR, compile(
                "\\b(?:created\\s+by|authored\\s+by|written\\s+by|by|from)\\s+"
                        + "([a-zA-Z]+(?:\\s+[a-zA-Z]+)*?)(?=\\s+(?:about|regarding|concerning)\\b|\\s*$)",
                "(?:من\\s+قبل|بواسطة|كتبه|أنشأه)\\s+([a-zA-Z\\u0600-\\u06FF]+(?:\\s+[a-zA-Z\\u0600-\\u06FF]+)*)"));
        entities.put(EntityType.TOPIC, compile(
                "\\b(?:about|regarding|concerning|related\\s+to)\\s+([a-zA-Z\\s]+)",
                "(?:حول|بخصوص|متعلق\\s+بـ)\\s+([a-zA-Z\\u0600-\\u06FF\\s]+)"));

        return new IntentPatterns(intents, actions, entities);
    }

    /**
     * Patterns of one intent group, the query language first and the other language second,
     * so that mixed queries still classify.
     */
    public List<Pattern> intentPatterns(final IntentType type, final Language language) {
        final List<Pattern> result = new ArrayList<>(intentPatterns.get(language).getOrDefault(type, List.of()));
        result.addAll(intentPatterns.get(language.opposite()).getOrDefault(type, List.of()));
        return result;
    }

    /**
     * The action verbs of an intent in preference order. Falls back to the English vocabulary.
     */
    public List<String> actions(final IntentType type, final Language language) {
        final Map<Language, List<String>> byLanguage = actionVocabulary.get(type);
        if (byLanguage == null) {
            return List.of("find");
        }
        final List<String> words = byLanguage.get(language);
        return words != null ? words : byLanguage.getOrDefault(Language.EN, List.of("find"));
    }

    public Map<EntityType, List<Pattern>> entityPatterns() {
        return entityPatterns;
    }

    /**
     * Every compiled pattern, used to warm up the regex engine.
     */
    public List<Pattern> allPatterns() {
        final List<Pattern> all = new ArrayList<>();
        intentPatterns.values().forEach(groups -> groups.values().forEach(all::addAll));
        entityPatterns.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    private static List<Pattern> compile(final String... regexes) {
        final List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (final String regex : regexes) {
            patterns.add(Pattern.compile(regex, FLAGS));
        }
        return List.copyOf(patterns);
    }

    private static Map<Language, List<String>> vocabulary(final List<String> english, final List<String> arabic) {
        final Map<Language, List<String>> map = new EnumMap<>(Language.class);
        map.put(Language.EN, english);
        map.put(Language.AR, arabic);
        return map;
    }
}
