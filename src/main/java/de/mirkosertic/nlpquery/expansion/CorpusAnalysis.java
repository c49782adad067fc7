package de.mirkosertic.nlpquery.expansion;

import de.mirkosertic.nlpquery.search.DocumentSearchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable knowledge extracted from a document snapshot: term frequencies, adjacent-term
 * co-occurrence, technical terms, acronym definitions and concept clusters.
 */
public final class CorpusAnalysis {

    static final Pattern TERM = Pattern.compile("[\\w\\u0600-\\u06FF]{2,}");

    private static final int MIN_INDEXED_TERM_LENGTH = 3;
    private static final int CLUSTER_MIN_FREQUENCY = 3;
    private static final int CLUSTER_MIN_COOCCURRENCE = 2;
    private static final int CLUSTER_SIZE = 5;
    private static final int MAX_ACRONYM_EXPANSION_LENGTH = 100;

    private static final Pattern UPPERCASE_RUN = Pattern.compile("\\b[A-Z]{2,}\\b");

    static final List<Pattern> TECHNICAL_PATTERNS = List.of(
            UPPERCASE_RUN,                                                                   // acronyms
            Pattern.compile("\\b\\w+\\.(?:js|ts|py|java|cpp|h|css|html|php|rb|go|rs)\\b"),   // file names
            Pattern.compile("\\b\\w+\\.(?:com|org|net|edu|gov)\\b"),                         // domains
            Pattern.compile("\\b\\d+\\.\\d+\\.\\d+\\.\\d+\\b"),                               // IPv4
            Pattern.compile("\\b[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}\\b"),
            Pattern.compile("\\b\\w+://\\w+"),                                               // URLs
            Pattern.compile("\\b[A-Z][a-z]+[A-Z][a-z]+"),                                    // CamelCase
            Pattern.compile("\\b\\w+_\\w+"),                                                 // snake_case
            Pattern.compile("\\b\\w+-\\w+")                                                  // kebab-case
    );

    private final Map<String, Integer> termFrequency;
    private final Map<String, Map<String, Integer>> cooccurrence;
    private final Set<String> technicalTerms;
    private final Map<String, List<String>> acronymDefinitions;
    private final Map<String, List<String>> conceptClusters;

    private CorpusAnalysis(final Map<String, Integer> termFrequency,
                           final Map<String, Map<String, Integer>> cooccurrence,
                           final Set<String> technicalTerms,
                           final Map<String, List<String>> acronymDefinitions,
                           final Map<String, List<String>> conceptClusters) {
        this.termFrequency = Collections.unmodifiableMap(termFrequency);
        this.cooccurrence = Collections.unmodifiableMap(cooccurrence);
        this.technicalTerms = Collections.unmodifiableSet(technicalTerms);
        this.acronymDefinitions = Collections.unmodifiableMap(acronymDefinitions);
        this.conceptClusters = Collections.unmodifiableMap(conceptClusters);
    }

    /**
     * Analyze the title and content of every document.
     */
    public static CorpusAnalysis analyze(final List<DocumentSearchResult> documents) {
        final Map<String, Integer> termFrequency = new LinkedHashMap<>();
        final Map<String, Map<String, Integer>> cooccurrence = new HashMap<>();
        final Set<String> technicalTerms = new LinkedHashSet<>();
        final Map<String, List<String>> acronymDefinitions = new LinkedHashMap<>();

        for (final DocumentSearchResult document : documents) {
            final String originalText = document.fullText();
            final List<String> words = extractTerms(originalText.toLowerCase(Locale.ROOT));

            for (final String word : words) {
                if (word.length() >= MIN_INDEXED_TERM_LENGTH) {
                    termFrequency.merge(word, 1, Integer::sum);
                }
            }

            for (int i = 0; i < words.size() - 1; i++) {
                final String first = words.get(i);
                final String second = words.get(i + 1);
                if (first.length() >= MIN_INDEXED_TERM_LENGTH && second.length() >= MIN_INDEXED_TERM_LENGTH) {
                    cooccurrence.computeIfAbsent(first, k -> new LinkedHashMap<>()).merge(second, 1, Integer::sum);
                }
            }

            // Technical terms and acronym definitions need the original case
            for (final Pattern pattern : TECHNICAL_PATTERNS) {
                final Matcher matcher = pattern.matcher(originalText);
                while (matcher.find()) {
                    technicalTerms.add(matcher.group().toLowerCase(Locale.ROOT));
                }
            }

            final Matcher acronyms = UPPERCASE_RUN.matcher(originalText);
            while (acronyms.find()) {
                final String acronym = acronyms.group();
                final List<String> expansions = findAcronymDefinitions(acronym, originalText);
                if (!expansions.isEmpty()) {
                    final List<String> known = acronymDefinitions.computeIfAbsent(
                            acronym.toLowerCase(Locale.ROOT), k -> new ArrayList<>());
                    for (final String expansion : expansions) {
                        if (!known.contains(expansion)) {
                            known.add(expansion);
                        }
                    }
                }
            }
        }

        final Map<String, List<String>> conceptClusters = new LinkedHashMap<>();
        for (final Map.Entry<String, Integer> entry : termFrequency.entrySet()) {
            if (entry.getValue() < CLUSTER_MIN_FREQUENCY) {
                continue;
            }
            final Map<String, Integer> neighbours = cooccurrence.get(entry.getKey());
            if (neighbours == null) {
                continue;
            }
            final List<String> related = neighbours.entrySet().stream()
                    .filter(n -> n.getValue() >= CLUSTER_MIN_COOCCURRENCE)
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                    .limit(CLUSTER_SIZE)
                    .map(Map.Entry::getKey)
                    .toList();
            if (!related.isEmpty()) {
                conceptClusters.put(entry.getKey(), related);
            }
        }

        final Map<String, List<String>> frozenDefinitions = new LinkedHashMap<>();
        acronymDefinitions.forEach((k, v) -> frozenDefinitions.put(k, List.copyOf(v)));

        return new CorpusAnalysis(termFrequency, cooccurrence, technicalTerms, frozenDefinitions, conceptClusters);
    }

    /**
     * Tokenize into runs of at least two word or Arabic characters.
     */
    static List<String> extractTerms(final String text) {
        final List<String> terms = new ArrayList<>();
        final Matcher matcher = TERM.matcher(text);
        while (matcher.find()) {
            terms.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return terms;
    }

    /**
     * Find definitions written as {@code Application Programming Interface (API)}. The words right
     * before the parenthesis are used when their initials spell the acronym, otherwise the whole
     * sentence fragment is taken.
     */
    static List<String> findAcronymDefinitions(final String acronym, final String text) {
        final List<String> expansions = new ArrayList<>();
        final Pattern definition = Pattern.compile("([^.!?()]*?)\\(" + Pattern.quote(acronym) + "\\)");
        final Matcher matcher = definition.matcher(text);
        while (matcher.find()) {
            final String fragment = matcher.group(1).trim();
            final String expansion = initialsMatch(fragment, acronym);
            if (expansion.length() > acronym.length() && expansion.length() < MAX_ACRONYM_EXPANSION_LENGTH) {
                expansions.add(expansion);
            }
        }
        return expansions;
    }

    private static String initialsMatch(final String fragment, final String acronym) {
        final String[] words = fragment.split("\\s+");
        if (words.length < acronym.length()) {
            return fragment;
        }
        final StringBuilder initials = new StringBuilder();
        for (int i = words.length - acronym.length(); i < words.length; i++) {
            initials.append(words[i].isEmpty() ? ' ' : words[i].charAt(0));
        }
        if (initials.toString().equalsIgnoreCase(acronym)) {
            return String.join(" ", List.of(words).subList(words.length - acronym.length(), words.length));
        }
        return fragment;
    }

    public Map<String, Integer> termFrequency() {
        return termFrequency;
    }

    public int frequency(final String term) {
        return termFrequency.getOrDefault(term, 0);
    }

    public Map<String, Integer> cooccurrences(final String term) {
        return cooccurrence.getOrDefault(term, Map.of());
    }

    public Set<String> technicalTerms() {
        return technicalTerms;
    }

    public boolean isTechnical(final String term) {
        return technicalTerms.contains(term);
    }

    public List<String> acronymDefinitions(final String acronym) {
        return acronymDefinitions.getOrDefault(acronym.toLowerCase(Locale.ROOT), List.of());
    }

    public List<String> cluster(final String term) {
        return conceptClusters.getOrDefault(term, List.of());
    }

    public CorpusStats stats() {
        final long total = termFrequency.values().stream().mapToLong(Integer::longValue).sum();
        return new CorpusStats(total, termFrequency.size(), technicalTerms.size(), conceptClusters.size());
    }
}
