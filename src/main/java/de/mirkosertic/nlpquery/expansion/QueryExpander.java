package de.mirkosertic.nlpquery.expansion;

import de.mirkosertic.nlpquery.Language;
import de.mirkosertic.nlpquery.search.DocumentSearchResult;
import de.mirkosertic.nlpquery.util.QuerySanitizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;

/**
 * Expands queries with synonyms, acronyms and corpus derived related terms.
 *
 * <p>The synonym and acronym dictionaries can be extended at runtime. Corpus knowledge comes
 * from the last {@link #analyzeCorpus} call and is replaced as a whole snapshot, so expansion
 * can run concurrently with a new analysis.</p>
 */
public class QueryExpander {

    private static final Logger logger = LoggerFactory.getLogger(QueryExpander.class);

    static final double SYNONYM_CONFIDENCE = 0.8;
    static final double ACRONYM_CONFIDENCE = 0.9;
    static final double RELATED_CONFIDENCE_CAP = 0.7;
    static final double TECHNICAL_CONFIDENCE = 0.6;

    private static final int MAX_VARIATIONS = 5;
    private static final int MAX_FILTERS = 3;

    private static final Set<String> DOCUMENT_TYPE_WORDS = Set.of("pdf", "document", "report", "manual", "guide");
    private static final Set<String> RECENT_WORDS = Set.of("recent", "latest");
    private static final Set<String> OLDER_WORDS = Set.of("new", "old", "archived");

    private static final String ARABIC_ARTICLE = "ال";

    private final Map<String, List<String>> synonyms;
    private final Map<String, List<String>> acronyms;

    private volatile @Nullable CorpusAnalysis corpus;

    public QueryExpander() {
        this(DefaultDictionaries.synonyms(), DefaultDictionaries.acronyms());
    }

    public QueryExpander(final Map<String, List<String>> synonyms, final Map<String, List<String>> acronyms) {
        this.synonyms = new ConcurrentHashMap<>();
        synonyms.forEach((term, values) -> this.synonyms.put(term.toLowerCase(Locale.ROOT), List.copyOf(values)));
        this.acronyms = new ConcurrentHashMap<>();
        acronyms.forEach((acronym, values) -> this.acronyms.put(acronym.toUpperCase(Locale.ROOT), List.copyOf(values)));
    }

    /**
     * Build corpus knowledge from a document snapshot, replacing the previous analysis.
     */
    public void analyzeCorpus(final List<DocumentSearchResult> documents) {
        final long start = System.nanoTime();
        final CorpusAnalysis analysis = CorpusAnalysis.analyze(documents);
        corpus = analysis;
        final CorpusStats stats = analysis.stats();
        logger.info("Analyzed corpus of {} documents: {} unique terms, {} technical terms, {} concept clusters in {} ms",
                documents.size(), stats.uniqueTerms(), stats.technicalTerms(), stats.conceptClusters(),
                (System.nanoTime() - start) / 1_000_000);
    }

    public ExpandedQuery expandQuery(final String query) {
        return expandQuery(query, 10, Language.EN);
    }

    /**
     * Expand a query.
     *
     * @param query         the query text
     * @param maxExpansions maximum number of expansion terms returned
     * @param language      query language; Arabic terms are also looked up without the definite article
     */
    public ExpandedQuery expandQuery(final String query, final int maxExpansions, final Language language) {
        final CorpusAnalysis analysis = corpus;
        final List<String> originalTerms = queryTerms(query);

        // Entries are not de-duplicated across sources
        final List<Candidate> candidates = new ArrayList<>();
        for (final String term : originalTerms) {
            final String lookup = dictionaryKey(term, language);

            for (final String synonym : synonyms.getOrDefault(lookup, List.of())) {
                candidates.add(new Candidate(term, ExpansionTerm.of(synonym, ExpansionType.SYNONYM,
                        SYNONYM_CONFIDENCE, ExpansionSource.DICTIONARY)));
            }

            for (final String expansion : acronyms.getOrDefault(term.toUpperCase(Locale.ROOT), List.of())) {
                candidates.add(new Candidate(term, ExpansionTerm.of(expansion, ExpansionType.ACRONYM,
                        ACRONYM_CONFIDENCE, ExpansionSource.DICTIONARY)));
            }

            if (analysis != null) {
                for (final String definition : analysis.acronymDefinitions(term)) {
                    candidates.add(new Candidate(term, ExpansionTerm.of(definition, ExpansionType.ACRONYM,
                            ACRONYM_CONFIDENCE, ExpansionSource.CORPUS)));
                }

                for (final String related : analysis.cluster(term)) {
                    final int frequency = analysis.frequency(related);
                    candidates.add(new Candidate(term, new ExpansionTerm(related, ExpansionType.RELATED,
                            Math.min(RELATED_CONFIDENCE_CAP, frequency / 100.0), frequency, ExpansionSource.CORPUS)));
                }

                if (analysis.isTechnical(term)) {
                    candidates.add(new Candidate(term, ExpansionTerm.of("technical:" + term, ExpansionType.TECHNICAL,
                            TECHNICAL_CONFIDENCE, ExpansionSource.CORPUS)));
                }
            }
        }

        final List<Candidate> selected = candidates.stream()
                .sorted(Comparator.comparingDouble((Candidate c) -> c.expansion().confidence()).reversed())
                .limit(Math.max(0, maxExpansions))
                .toList();

        final ExpandedQuery expanded = new ExpandedQuery(
                query,
                selected.stream().map(Candidate::expansion).toList(),
                rankVariations(query, selected),
                suggestFilters(originalTerms, analysis));

        if (logger.isDebugEnabled()) {
            logger.debug("Expanded '{}' into {} terms and {} variations", query,
                    expanded.expandedTerms().size(), expanded.rankedVariations().size());
        }
        return expanded;
    }

    private List<RankedVariation> rankVariations(final String query, final List<Candidate> selected) {
        final Map<String, RankedVariation> variations = new LinkedHashMap<>();

        for (final Candidate candidate : selected) {
            final ExpansionTerm expansion = candidate.expansion();
            if (expansion.type() != ExpansionType.SYNONYM && expansion.type() != ExpansionType.RELATED) {
                continue;
            }
            final Matcher matcher = QuerySanitizer.wholeWord(candidate.originalTerm()).matcher(query);
            final String variation = matcher.replaceAll(Matcher.quoteReplacement(expansion.term()));
            if (variation.equalsIgnoreCase(query)) {
                continue;
            }
            variations.putIfAbsent(variation, new RankedVariation(variation, expansion.confidence(),
                    "Replaced \"" + candidate.originalTerm() + "\" with \"" + expansion.term() + "\" ("
                            + expansion.type().code() + ")"));
        }

        for (final Candidate candidate : selected) {
            final ExpansionTerm expansion = candidate.expansion();
            if (expansion.type() == ExpansionType.ACRONYM) {
                final String variation = query + " OR " + expansion.term();
                variations.putIfAbsent(variation, new RankedVariation(variation, expansion.confidence(),
                        "Added acronym expansion: \"" + expansion.term() + "\""));
            }
        }

        return variations.values().stream()
                .sorted(Comparator.comparingDouble(RankedVariation::score).reversed())
                .limit(MAX_VARIATIONS)
                .toList();
    }

    private static List<SuggestedFilter> suggestFilters(final List<String> terms, final @Nullable CorpusAnalysis analysis) {
        final Map<String, SuggestedFilter> filters = new LinkedHashMap<>();
        for (final String term : terms) {
            if (DOCUMENT_TYPE_WORDS.contains(term)) {
                filters.putIfAbsent("documentType:" + term, new SuggestedFilter("documentType", term, 0.8));
            }
            if (RECENT_WORDS.contains(term)) {
                filters.putIfAbsent("dateRange:last30days", new SuggestedFilter("dateRange", "last30days", 0.7));
            } else if (OLDER_WORDS.contains(term)) {
                filters.putIfAbsent("dateRange:older", new SuggestedFilter("dateRange", "older", 0.7));
            }
            if (analysis != null && analysis.isTechnical(term)) {
                filters.putIfAbsent("category:technical", new SuggestedFilter("category", "technical", 0.6));
            }
        }
        return filters.values().stream()
                .sorted(Comparator.comparingDouble(SuggestedFilter::relevance).reversed())
                .limit(MAX_FILTERS)
                .toList();
    }

    /**
     * Single-word query terms plus every multi-word dictionary key that occurs as a phrase.
     */
    private List<String> queryTerms(final String query) {
        final String lower = query.toLowerCase(Locale.ROOT);
        final Set<String> terms = new LinkedHashSet<>(CorpusAnalysis.extractTerms(lower));
        for (final String key : synonyms.keySet()) {
            if (key.indexOf(' ') >= 0 && QuerySanitizer.wholeWord(key).matcher(lower).find()) {
                terms.add(key);
            }
        }
        return new ArrayList<>(terms);
    }

    private String dictionaryKey(final String term, final Language language) {
        if (language == Language.AR && !synonyms.containsKey(term)
                && term.startsWith(ARABIC_ARTICLE) && term.length() > ARABIC_ARTICLE.length() + 1) {
            final String stripped = term.substring(ARABIC_ARTICLE.length());
            if (synonyms.containsKey(stripped)) {
                return stripped;
            }
        }
        return term;
    }

    /**
     * Append synonyms to a term's dictionary entry.
     */
    public void addSynonymMapping(final String term, final List<String> additional) {
        synonyms.merge(term.toLowerCase(Locale.ROOT), List.copyOf(additional), QueryExpander::concat);
    }

    /**
     * Append expansions to an acronym's dictionary entry. Acronyms are stored uppercase.
     */
    public void addAcronymMapping(final String acronym, final List<String> expansions) {
        acronyms.merge(acronym.toUpperCase(Locale.ROOT), List.copyOf(expansions), QueryExpander::concat);
    }

    public List<String> synonymsOf(final String term) {
        return synonyms.getOrDefault(term.toLowerCase(Locale.ROOT), List.of());
    }

    public List<String> acronymExpansionsOf(final String acronym) {
        return acronyms.getOrDefault(acronym.toUpperCase(Locale.ROOT), List.of());
    }

    /**
     * Figures of the last corpus analysis, empty before the first one.
     */
    public Optional<CorpusStats> getCorpusStats() {
        final CorpusAnalysis analysis = corpus;
        return analysis == null ? Optional.empty() : Optional.of(analysis.stats());
    }

    public List<TermFrequency> getMostFrequentTerms(final int limit) {
        final CorpusAnalysis analysis = corpus;
        if (analysis == null) {
            return List.of();
        }
        return analysis.termFrequency().entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(Math.max(0, limit))
                .map(e -> new TermFrequency(e.getKey(), e.getValue()))
                .toList();
    }

    public void resetCorpusAnalysis() {
        corpus = null;
    }

    /**
     * Touch the technical patterns and dictionaries once.
     */
    public void warmUp() {
        CorpusAnalysis.analyze(List.of(DocumentSearchResult.of("warmup",
                "Application Programming Interface (API) setup",
                "server_config api-gateway HttpClient 10.0.0.1 example.com", "text")));
        final ExpandedQuery sample = expandQuery("server API report", 10, Language.EN);
        logger.debug("Query expander warmed up ({} sample expansions)", sample.expandedTerms().size());
    }

    private static List<String> concat(final List<String> existing, final List<String> additional) {
        final List<String> merged = new ArrayList<>(existing);
        merged.addAll(additional);
        return List.copyOf(merged);
    }

    private record Candidate(String originalTerm, ExpansionTerm expansion) {
    }
}
