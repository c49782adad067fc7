package de.mirkosertic.nlpquery.multilingual;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTextAnalyzerTest {

    @Test
    void shouldLowercaseLatinAndNormalizeArabicSpelling() {
        try (final QueryTextAnalyzer analyzer = new QueryTextAnalyzer()) {
            assertThat(analyzer.terms("Budget الميزانيّة")).containsExactly("budget", "الميزانيه");
            assertThat(analyzer.normalize("أمان")).isEqualTo(analyzer.normalize("امان"));
        }
    }

    @Test
    void shouldDropPunctuation() {
        try (final QueryTextAnalyzer analyzer = new QueryTextAnalyzer()) {
            assertThat(analyzer.normalize("Report, (final)!")).isEqualTo("report final");
            assertThat(analyzer.terms("  ")).isEmpty();
        }
    }
}
