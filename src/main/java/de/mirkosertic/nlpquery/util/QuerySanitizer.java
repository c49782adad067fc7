package de.mirkosertic.nlpquery.util;

import java.util.regex.Pattern;

/**
 * Strips markup, script fragments and invisible characters from free-text queries.
 *
 * <p>Removal happens in this order:</p>
 * <ol>
 *   <li>{@code <script>} blocks including their content</li>
 *   <li>any remaining HTML tag</li>
 *   <li>{@code javascript:} protocol prefixes</li>
 *   <li>inline event handler assignments such as {@code onclick=}</li>
 *   <li>stray angle brackets</li>
 *   <li>control, zero-width and replacement characters</li>
 * </ol>
 * <p>Whitespace runs are collapsed to a single space and the result is trimmed.</p>
 */
public final class QuerySanitizer {

    private static final Pattern SCRIPT_BLOCKS = Pattern.compile("<script[^>]*>.*?</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HTML_TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern JAVASCRIPT_PROTOCOL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLERS = Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKUP_CHARS = Pattern.compile("[<>]");

    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[" +
            "\\u0000-\\u0008" +             // NULL and control chars before TAB
            "\\u000B-\\u000C" +
            "\\u000E-\\u001F" +
            "\\u007F" +                    // DEL
            "\\u200B-\\u200D" +             // zero-width space / joiners
            "\\uFEFF" +                    // BOM
            "\\uFFFD" +                    // replacement character
            "]"
    );

    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    private QuerySanitizer() {
        // Utility class, no instances
    }

    /**
     * Sanitize a query for analysis.
     *
     * @param query the raw query (may be null)
     * @return the sanitized query, or an empty string for null input
     */
    public static String sanitize(final String query) {
        if (query == null || query.isEmpty()) {
            return "";
        }

        String sanitized = SCRIPT_BLOCKS.matcher(query).replaceAll("");
        sanitized = HTML_TAGS.matcher(sanitized).replaceAll("");
        sanitized = JAVASCRIPT_PROTOCOL.matcher(sanitized).replaceAll("");
        sanitized = EVENT_HANDLERS.matcher(sanitized).replaceAll("");
        sanitized = MARKUP_CHARS.matcher(sanitized).replaceAll("");
        sanitized = INVISIBLE_CHARS.matcher(sanitized).replaceAll("");

        return collapseWhitespace(sanitized);
    }

    /**
     * Collapse every whitespace run into a single space and trim.
     */
    public static String collapseWhitespace(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUNS.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Quote a literal for use inside a whole-word regular expression.
     */
    public static Pattern wholeWord(final String literal) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(literal) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
