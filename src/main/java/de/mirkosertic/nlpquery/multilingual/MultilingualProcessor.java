package de.mirkosertic.nlpquery.multilingual;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.ValidationException;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.util.Scripts;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Arabic and English language handling: script based detection, dictionary translation with a
 * transliteration fallback, cross-language document matching and right-to-left formatting.
 *
 * <p>Translations are memoized in a bounded Caffeine cache that is discarded whenever a
 * dictionary or transliteration entry is added.</p>
 */
public class MultilingualProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MultilingualProcessor.class);

    static final int DEFAULT_CACHE_SIZE = 1_000;
    static final int DEFAULT_MAX_CROSS_LANGUAGE_RESULTS = 20;
    static final int DEFAULT_MAX_BILINGUAL_CROSS_RESULTS = 10;

    private static final double NO_LETTERS_CONFIDENCE = 0.5;
    private static final double MIN_SEGMENT_CONFIDENCE = 0.3;
    private static final double MIN_TRANSLATION_CONFIDENCE = 0.3;
    private static final double MIN_MATCH_SCORE = 0.3;
    private static final double TITLE_BOOST = 0.2;
    private static final int MAX_PHRASE_WORDS = 3;

    private static final String RIGHT_TO_LEFT_EMBEDDING = "\u202B";
    private static final String POP_DIRECTIONAL_FORMATTING = "\u202C";
    private static final String ARABIC_ARTICLE = "ال";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{M}\\p{N}_]");

    private final Map<String, List<String>> arabicToEnglish = new ConcurrentHashMap<>();
    private final Map<String, List<String>> englishToArabic = new ConcurrentHashMap<>();
    private final Map<String, String> transliterations = new ConcurrentHashMap<>();
    private final Map<String, String> reverseTransliterations = new ConcurrentHashMap<>();

    private final QueryTextAnalyzer analyzer = new QueryTextAnalyzer();
    private final Cache<TranslationKey, TranslationResult> translationCache;
    private final AtomicLong invalidations = new AtomicLong();

    private record TranslationKey(String text, Language target, @Nullable Language source) {
    }

    private record Translation(String text, int tokenCount) {
    }

    public MultilingualProcessor() {
        this(DEFAULT_CACHE_SIZE);
    }

    /**
     * @param translationCacheSize maximum number of memoized translations
     */
    public MultilingualProcessor(final int translationCacheSize) {
        this.translationCache = Caffeine.newBuilder()
                .maximumSize(translationCacheSize)
                .recordStats()
                .build();

        DefaultTranslations.arabicToEnglish().forEach(this::putTranslation);
        DefaultTranslations.transliterations().forEach(this::putTransliteration);
    }

    // ========== Detection ==========

    /**
     * Detect the language of a text and split it into script runs.
     *
     * <p>A run starts at a letter and extends over following letters of the same script and any
     * non-letters between them. Text without letters is reported as English with confidence 0.5,
     * text with a single script as that language with a confidence equal to the share of
     * non-whitespace characters that are letters, and text with both scripts as
     * {@link Language#MIXED}.</p>
     */
    public LanguageDetectionResult detectLanguage(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return new LanguageDetectionResult(Language.EN, NO_LETTERS_CONFIDENCE, List.of());
        }

        final List<LanguageSegment> segments = new ArrayList<>();
        Language runLanguage = null;
        int runStart = 0;
        int runEnd = 0;
        long arabicLetters = 0;
        long latinLetters = 0;
        long nonWhitespace = 0;

        int i = 0;
        while (i < text.length()) {
            final int codePoint = text.codePointAt(i);
            final int next = i + Character.charCount(codePoint);
            if (!Character.isWhitespace(codePoint)) {
                nonWhitespace++;
            }

            final Language charLanguage;
            if (Scripts.isArabicLetter(codePoint)) {
                charLanguage = Language.AR;
                arabicLetters++;
            } else if (Scripts.isLatinLetter(codePoint)) {
                charLanguage = Language.EN;
                latinLetters++;
            } else {
                charLanguage = null;
            }

            if (charLanguage != null) {
                if (charLanguage != runLanguage) {
                    if (runLanguage != null) {
                        segments.add(new LanguageSegment(runLanguage, text.substring(runStart, runEnd), runStart, runEnd));
                    }
                    runLanguage = charLanguage;
                    runStart = i;
                }
                runEnd = next;
            }
            i = next;
        }
        if (runLanguage != null) {
            segments.add(new LanguageSegment(runLanguage, text.substring(runStart, runEnd), runStart, runEnd));
        }

        final long letters = arabicLetters + latinLetters;
        if (letters == 0) {
            return new LanguageDetectionResult(Language.EN, NO_LETTERS_CONFIDENCE, segments);
        }
        if (arabicLetters > 0 && latinLetters > 0) {
            return new LanguageDetectionResult(Language.MIXED,
                    (double) Math.max(arabicLetters, latinLetters) / letters, segments);
        }
        final Language language = arabicLetters > 0 ? Language.AR : Language.EN;
        return new LanguageDetectionResult(language, (double) letters / nonWhitespace, segments);
    }

    // ========== Translation ==========

    public TranslationResult translateText(final String text, final Language targetLanguage) {
        return translateText(text, targetLanguage, null);
    }

    /**
     * Translate word by word, preferring the longest dictionary phrase at each position.
     *
     * @param sourceLanguage source language, detected from the text when null
     * @throws ValidationException if the target language is {@link Language#MIXED}
     */
    public TranslationResult translateText(final String text, final Language targetLanguage,
                                           final @Nullable Language sourceLanguage) {
        if (targetLanguage == Language.MIXED) {
            throw new ValidationException("Target language must be either \"en\" or \"ar\"");
        }

        final TranslationKey key = new TranslationKey(text, targetLanguage, sourceLanguage);
        final TranslationResult cached = translationCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        final TranslationResult result = translate(text, targetLanguage, sourceLanguage);
        translationCache.put(key, result);
        return result;
    }

    private TranslationResult translate(final String text, final Language target, final @Nullable Language sourceLanguage) {
        final Language source = sourceLanguage != null ? sourceLanguage : detectLanguage(text).language();
        if (source == Language.MIXED) {
            return translateMixed(text, target);
        }
        if (source == target) {
            return TranslationResult.identity(text, source);
        }

        final String trimmed = text.trim();
        final String[] tokens = trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
        final List<String> output = new ArrayList<>(tokens.length);
        int translatedTokens = 0;

        int i = 0;
        while (i < tokens.length) {
            final Translation translation = translateAt(tokens, i, source, target);
            if (translation != null) {
                output.add(translation.text());
                translatedTokens += translation.tokenCount();
                i += translation.tokenCount();
            } else {
                output.add(tokens[i]);
                i++;
            }
        }

        final double confidence = tokens.length == 0 ? 0.0 : (double) translatedTokens / tokens.length;
        return new TranslationResult(text, String.join(" ", output), source, target, confidence);
    }

    private @Nullable Translation translateAt(final String[] tokens, final int position,
                                              final Language source, final Language target) {
        final int longest = Math.min(MAX_PHRASE_WORDS, tokens.length - position);
        for (int length = longest; length >= 1; length--) {
            final StringBuilder phrase = new StringBuilder();
            for (int j = position; j < position + length; j++) {
                if (phrase.length() > 0) {
                    phrase.append(' ');
                }
                phrase.append(clean(tokens[j]));
            }
            final String translated = lookup(phrase.toString(), source, target);
            if (translated != null) {
                return new Translation(translated, length);
            }
        }
        return null;
    }

    private @Nullable String lookup(final String term, final Language source, final Language target) {
        if (term.isEmpty()) {
            return null;
        }
        final List<String> translations = dictionaryTranslations(term, source, target);
        if (!translations.isEmpty()) {
            return translations.get(0);
        }
        return transliterationOf(term, source);
    }

    private List<String> dictionaryTranslations(final String term, final Language source, final Language target) {
        if (source == Language.AR && target == Language.EN) {
            final List<String> direct = arabicToEnglish.get(term);
            if (direct != null) {
                return direct;
            }
            if (term.startsWith(ARABIC_ARTICLE) && term.length() > ARABIC_ARTICLE.length() + 1) {
                return arabicToEnglish.getOrDefault(term.substring(ARABIC_ARTICLE.length()), List.of());
            }
            return List.of();
        }
        if (source == Language.EN && target == Language.AR) {
            return englishToArabic.getOrDefault(term, List.of());
        }
        return List.of();
    }

    private @Nullable String transliterationOf(final String term, final Language source) {
        return source == Language.EN ? transliterations.get(term) : reverseTransliterations.get(term);
    }

    private TranslationResult translateMixed(final String text, final Language target) {
        final LanguageDetectionResult detection = detectLanguage(text);
        final StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        int translatedSegments = 0;

        for (final LanguageSegment segment : detection.segments()) {
            output.append(text, cursor, segment.start());
            String replacement = segment.text();
            if (segment.language() != target) {
                final TranslationResult translation = translate(segment.text(), target, segment.language());
                if (translation.confidence() > MIN_SEGMENT_CONFIDENCE) {
                    replacement = translation.translatedText();
                    translatedSegments++;
                }
            }
            output.append(replacement);
            cursor = segment.end();
        }
        output.append(text.substring(cursor));

        final double confidence = detection.segments().isEmpty()
                ? 0.0
                : (double) translatedSegments / detection.segments().size();
        return new TranslationResult(text, output.toString(), Language.MIXED, target, confidence);
    }

    private static String clean(final String token) {
        return NON_WORD.matcher(token.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    // ========== Cross-language matching ==========

    public List<CrossLanguageMatch> findCrossLanguageMatches(final String query, final List<DocumentSearchResult> documents) {
        return findCrossLanguageMatches(query, documents, DEFAULT_MAX_CROSS_LANGUAGE_RESULTS);
    }

    /**
     * Documents written in the other language than the query that the translated query reaches.
     * Documents in the query's language and documents with mixed text are skipped, so are
     * documents the query cannot be translated for with a confidence of at least 0.3, and
     * documents scoring 0.3 or less.
     */
    public List<CrossLanguageMatch> findCrossLanguageMatches(final String query, final List<DocumentSearchResult> documents,
                                                             final int maxResults) {
        final Language queryLanguage = detectLanguage(query).language();
        if (queryLanguage == Language.MIXED) {
            logger.debug("Skipping cross-language matching for mixed-language query '{}'", query);
            return List.of();
        }

        final List<CrossLanguageMatch> matches = new ArrayList<>();
        for (final DocumentSearchResult document : documents) {
            final Language documentLanguage = detectLanguage(document.fullText()).language();
            if (documentLanguage == queryLanguage || documentLanguage == Language.MIXED) {
                continue;
            }

            final TranslationResult translation = translateText(query, documentLanguage, queryLanguage);
            if (translation.confidence() < MIN_TRANSLATION_CONFIDENCE) {
                continue;
            }

            final double score = matchScore(translation.translatedText(), document);
            if (score > MIN_MATCH_SCORE) {
                matches.add(new CrossLanguageMatch(query, queryLanguage, document, documentLanguage, score,
                        translation.translatedText(), matchedTerms(query, document, queryLanguage, documentLanguage)));
            }
        }

        return matches.stream()
                .sorted(Comparator.comparingDouble(CrossLanguageMatch::matchScore).reversed())
                .limit(Math.max(0, maxResults))
                .toList();
    }

    /**
     * Weighted share of translated query terms found in the document (terms longer than three
     * characters weigh 1.0, shorter ones 0.5), plus up to 0.2 for terms found in the title.
     */
    private double matchScore(final String translatedQuery, final DocumentSearchResult document) {
        final List<String> queryTerms = analyzer.terms(translatedQuery);
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        final String documentText = analyzer.normalize(document.fullText());
        final String titleText = analyzer.normalize(document.title());

        double matchedWeight = 0.0;
        double totalWeight = 0.0;
        int titleMatches = 0;
        for (final String term : queryTerms) {
            final double weight = term.length() > 3 ? 1.0 : 0.5;
            totalWeight += weight;
            if (documentText.contains(term)) {
                matchedWeight += weight;
            }
            if (titleText.contains(term)) {
                titleMatches++;
            }
        }

        final double base = matchedWeight / totalWeight;
        final double titleBoost = titleMatches > 0 ? TITLE_BOOST * titleMatches / queryTerms.size() : 0.0;
        return Math.min(1.0, base + titleBoost);
    }

    private List<MatchedTerm> matchedTerms(final String query, final DocumentSearchResult document,
                                           final Language queryLanguage, final Language documentLanguage) {
        final String documentText = analyzer.normalize(document.fullText());
        final Set<MatchedTerm> matched = new LinkedHashSet<>();

        for (final String token : WHITESPACE.split(query.trim())) {
            final String term = clean(token);
            if (term.isEmpty()) {
                continue;
            }
            for (final String translation : dictionaryTranslations(term, queryLanguage, documentLanguage)) {
                if (containsNormalized(documentText, translation)) {
                    matched.add(new MatchedTerm(term, translation, TranslationType.TRANSLATED));
                }
            }
            final String transliteration = transliterationOf(term, queryLanguage);
            if (transliteration != null && containsNormalized(documentText, transliteration)) {
                matched.add(new MatchedTerm(term, transliteration, TranslationType.TRANSLITERATED));
            }
            if (containsNormalized(documentText, term)) {
                matched.add(new MatchedTerm(term, term, TranslationType.DIRECT));
            }
        }
        return List.copyOf(matched);
    }

    private boolean containsNormalized(final String normalizedText, final String term) {
        final String normalizedTerm = analyzer.normalize(term);
        return !normalizedTerm.isEmpty() && normalizedText.contains(normalizedTerm);
    }

    // ========== Result grouping ==========

    /**
     * Group documents with the same-language bucket computed from the documents themselves.
     */
    public BilingualResultSet createBilingualResultSet(final String query, final List<DocumentSearchResult> allDocuments) {
        final Language queryLanguage = effectiveQueryLanguage(query);
        final List<DocumentSearchResult> sameLanguage = allDocuments.stream()
                .filter(document -> detectLanguage(document.fullText()).language() == queryLanguage)
                .toList();
        return createBilingualResultSet(query, allDocuments, sameLanguage, DEFAULT_MAX_BILINGUAL_CROSS_RESULTS);
    }

    /**
     * Group documents into same-language results (as given), cross-language matches and documents
     * with mixed text. A mixed-language query is treated as English.
     */
    public BilingualResultSet createBilingualResultSet(final String query, final List<DocumentSearchResult> allDocuments,
                                                       final List<DocumentSearchResult> sameLanguageResults,
                                                       final int maxCrossLanguageResults) {
        final Language queryLanguage = effectiveQueryLanguage(query);
        final List<CrossLanguageMatch> crossLanguage =
                findCrossLanguageMatches(query, allDocuments, maxCrossLanguageResults);

        final List<DocumentSearchResult> mixed = new ArrayList<>();
        final Map<String, Integer> distribution = new TreeMap<>();
        for (final DocumentSearchResult document : allDocuments) {
            final Language documentLanguage = detectLanguage(document.fullText()).language();
            distribution.merge(documentLanguage.code(), 1, Integer::sum);
            if (documentLanguage == Language.MIXED) {
                mixed.add(document);
            }
        }

        return new BilingualResultSet(query, queryLanguage, sameLanguageResults, crossLanguage, mixed,
                sameLanguageResults.size() + crossLanguage.size() + mixed.size(), distribution);
    }

    private Language effectiveQueryLanguage(final String query) {
        final Language detected = detectLanguage(query).language();
        return detected == Language.MIXED ? Language.EN : detected;
    }

    // ========== Right-to-left ==========

    public boolean shouldUseRTL(final String text) {
        return detectLanguage(text).hasSegment(Language.AR);
    }

    /**
     * Wrap every Arabic run of mixed text in right-to-left embedding marks. Pure Arabic and text
     * without Arabic are returned unchanged.
     */
    public String formatForRTL(final String text) {
        final LanguageDetectionResult detection = detectLanguage(text);
        if (detection.language() != Language.MIXED || !detection.hasSegment(Language.AR)) {
            return text;
        }

        final StringBuilder formatted = new StringBuilder(text.length() + 2 * detection.segments().size());
        int cursor = 0;
        for (final LanguageSegment segment : detection.segments()) {
            if (segment.language() != Language.AR) {
                continue;
            }
            formatted.append(text, cursor, segment.start())
                    .append(RIGHT_TO_LEFT_EMBEDDING)
                    .append(segment.text())
                    .append(POP_DIRECTIONAL_FORMATTING);
            cursor = segment.end();
        }
        formatted.append(text.substring(cursor));
        return formatted.toString();
    }

    // ========== Query view ==========

    public MultilingualQueryResult processQuery(final String query) {
        return processQuery(query, List.of());
    }

    /**
     * Detect the query language, translate the query into English and Arabic and, when documents
     * are given, match it against the documents of the other language.
     */
    public MultilingualQueryResult processQuery(final String query, final List<DocumentSearchResult> documents) {
        final LanguageDetectionResult detection = detectLanguage(query);
        final Map<Language, TranslationResult> translations = new EnumMap<>(Language.class);
        translations.put(Language.EN, translateText(query, Language.EN));
        translations.put(Language.AR, translateText(query, Language.AR));

        final List<CrossLanguageMatch> matches = documents.isEmpty()
                ? List.of()
                : findCrossLanguageMatches(query, documents);

        logger.debug("Multilingual view of '{}': language={} confidence={} crossLanguageMatches={}",
                query, detection.language().code(), detection.confidence(), matches.size());
        return new MultilingualQueryResult(detection, translations, matches);
    }

    // ========== Dictionaries ==========

    /**
     * Set the English translations of an Arabic term and register the reverse direction.
     */
    public void addTranslationMapping(final String arabic, final List<String> english) {
        if (arabic == null || arabic.isBlank() || english == null || english.isEmpty()) {
            throw new ValidationException("Translation mapping needs an Arabic term and at least one English term");
        }
        putTranslation(arabic.trim(), english);
        invalidateTranslations();
        logger.debug("Added translation mapping '{}' -> {}", arabic, english);
    }

    public void addTransliterationPattern(final String source, final String target) {
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            throw new ValidationException("Transliteration pattern needs a source and a target");
        }
        putTransliteration(source.trim().toLowerCase(Locale.ROOT), target.trim());
        invalidateTranslations();
        logger.debug("Added transliteration pattern '{}' -> '{}'", source, target);
    }

    private void putTranslation(final String arabic, final List<String> english) {
        arabicToEnglish.put(arabic, List.copyOf(english));
        for (final String term : english) {
            englishToArabic.merge(term.toLowerCase(Locale.ROOT), List.of(arabic), MultilingualProcessor::appendDistinct);
        }
    }

    private void putTransliteration(final String source, final String target) {
        transliterations.put(source, target);
        reverseTransliterations.put(target, source);
    }

    private void invalidateTranslations() {
        translationCache.invalidateAll();
        invalidations.incrementAndGet();
    }

    private static List<String> appendDistinct(final List<String> existing, final List<String> additional) {
        final Set<String> merged = new LinkedHashSet<>(existing);
        merged.addAll(additional);
        return List.copyOf(merged);
    }

    public TranslationStats getTranslationStats() {
        return new TranslationStats(arabicToEnglish.size(), englishToArabic.size(), transliterations.size());
    }

    public TranslationCacheStats getTranslationCacheStats() {
        translationCache.cleanUp();
        return TranslationCacheStats.of(translationCache.stats(), invalidations.get(), translationCache.estimatedSize());
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
