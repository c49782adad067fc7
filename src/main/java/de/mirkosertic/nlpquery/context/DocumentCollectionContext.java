package de.mirkosertic.nlpquery.context;

import de.mirkosertic.nlpquery.search.DocumentSearchResult;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statistics of the searchable document collection. Instances are immutable and replaced as a whole.
 *
 * @param averageDocumentAgeMs  summed age of dated documents divided by the total document count
 * @param mostAccessedDocuments ids of up to 10 documents by descending access count
 * @param commonTerms           frequency of words longer than three letters
 */
public record DocumentCollectionContext(
        int totalDocuments,
        Map<String, Integer> documentTypes,
        List<String> authors,
        List<String> topics,
        double averageDocumentAgeMs,
        List<String> mostAccessedDocuments,
        Map<String, Integer> commonTerms,
        Map<String, Integer> languageDistribution
) {

    private static final int MAX_MOST_ACCESSED = 10;
    private static final int MIN_COMMON_TERM_LENGTH = 4;
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z\\u0600-\\u06FF]{3,}\\b");

    public DocumentCollectionContext {
        documentTypes = Collections.unmodifiableMap(new LinkedHashMap<>(documentTypes));
        authors = List.copyOf(authors);
        topics = List.copyOf(topics);
        mostAccessedDocuments = List.copyOf(mostAccessedDocuments);
        commonTerms = Collections.unmodifiableMap(new LinkedHashMap<>(commonTerms));
        languageDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(languageDistribution));
    }

    public static DocumentCollectionContext empty() {
        return new DocumentCollectionContext(0, Map.of(), List.of(), List.of(), 0, List.of(), Map.of(), Map.of());
    }

    /**
     * Compute the statistics of a document snapshot. Document ages are measured against the clock.
     */
    public static DocumentCollectionContext of(final List<DocumentSearchResult> documents, final Clock clock) {
        final Map<String, Integer> types = new LinkedHashMap<>();
        final Set<String> authors = new LinkedHashSet<>();
        final Set<String> topics = new LinkedHashSet<>();
        final Map<String, Integer> terms = new LinkedHashMap<>();
        final Map<String, Integer> languages = new LinkedHashMap<>();
        final Map<String, Integer> accessCounts = new LinkedHashMap<>();
        long totalAgeMs = 0;

        for (final DocumentSearchResult document : documents) {
            types.merge(document.type() == null ? "unknown" : document.type(), 1, Integer::sum);
            if (document.author() != null) {
                authors.add(document.author());
            }
            topics.addAll(document.tags());
            if (document.createdAt() != null) {
                totalAgeMs += Duration.between(document.createdAt(), clock.instant()).toMillis();
            }
            languages.merge(document.language() == null ? "unknown" : document.language(), 1, Integer::sum);
            if (document.accessCount() != null && document.accessCount() > 0) {
                accessCounts.put(document.id(), document.accessCount());
            }

            final Matcher words = WORD.matcher(document.fullText().toLowerCase(Locale.ROOT));
            while (words.find()) {
                if (words.group().length() >= MIN_COMMON_TERM_LENGTH) {
                    terms.merge(words.group(), 1, Integer::sum);
                }
            }
        }

        final List<String> mostAccessed = accessCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_MOST_ACCESSED)
                .map(Map.Entry::getKey)
                .toList();

        final double averageAge = documents.isEmpty() ? 0 : (double) totalAgeMs / documents.size();
        return new DocumentCollectionContext(documents.size(), types, List.copyOf(authors), List.copyOf(topics),
                averageAge, mostAccessed, terms, languages);
    }

    /**
     * Up to {@code limit} document types by descending count.
     */
    public List<String> topDocumentTypes(final int limit) {
        return documentTypes.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }
}
