package de.mirkosertic.nlpquery.multilingual;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.ar.ArabicNormalizationFilter;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzer used to compare query terms with document text across English and Arabic.
 *
 * <p>Chain: {@code StandardTokenizer -> LowerCaseFilter -> ArabicNormalizationFilter}. The Arabic
 * normalization folds alef variants, teh marbuta and alef maksura and drops diacritics and
 * tatweel, so spelling variants of the same Arabic word produce the same token.</p>
 */
public class QueryTextAnalyzer extends Analyzer {

    private static final String FIELD = "text";

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ArabicNormalizationFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }

    /**
     * Normalized tokens of {@code text} in order.
     */
    public List<String> terms(final String text) {
        final List<String> tokens = new ArrayList<>();
        try (final TokenStream tokenStream = tokenStream(FIELD, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // Reading from an in-memory string
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }

    /**
     * The normalized tokens joined by single spaces.
     */
    public String normalize(final String text) {
        return String.join(" ", terms(text));
    }
}
