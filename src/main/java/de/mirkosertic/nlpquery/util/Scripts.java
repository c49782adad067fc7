package de.mirkosertic.nlpquery.util;

/**
 * Character classification helpers for Arabic and Latin script.
 */
public final class Scripts {

    private Scripts() {
        // Utility class, no instances
    }

    public static boolean isArabicLetter(final int codePoint) {
        return Character.isLetter(codePoint)
                && Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.ARABIC;
    }

    public static boolean isLatinLetter(final int codePoint) {
        return Character.isLetter(codePoint)
                && Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.LATIN;
    }

    public static boolean containsArabic(final String text) {
        return text != null && text.codePoints().anyMatch(Scripts::isArabicLetter);
    }

    public static long countArabicLetters(final String text) {
        return text == null ? 0 : text.codePoints().filter(Scripts::isArabicLetter).count();
    }

    public static long countLatinLetters(final String text) {
        return text == null ? 0 : text.codePoints().filter(Scripts::isLatinLetter).count();
    }
}
