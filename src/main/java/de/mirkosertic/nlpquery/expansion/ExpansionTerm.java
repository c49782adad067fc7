package de.mirkosertic.nlpquery.expansion;

import org.jspecify.annotations.Nullable;

/**
 * A related or alternate term suggested to broaden a search.
 *
 * @param term       the expansion text
 * @param type       how the term relates to the query term
 * @param confidence confidence in [0,1]
 * @param frequency  corpus frequency for corpus derived terms, null otherwise
 * @param source     the knowledge source that produced the term
 */
public record ExpansionTerm(
        String term,
        ExpansionType type,
        double confidence,
        @Nullable Integer frequency,
        ExpansionSource source
) {

    public static ExpansionTerm of(final String term, final ExpansionType type, final double confidence,
                                   final ExpansionSource source) {
        return new ExpansionTerm(term, type, confidence, null, source);
    }
}
