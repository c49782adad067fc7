package de.mirkosertic.nlpquery.search;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A document returned by the document-search backend.
 */
public record DocumentSearchResult(
        String id,
        String title,
        @Nullable String content,
        String type,
        @Nullable String author,
        @Nullable Instant createdAt,
        @Nullable String language,
        List<String> tags,
        @Nullable Integer accessCount,
        @Nullable Double score
) {
    public DocumentSearchResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Minimal document with only id, title, content and type.
     */
    public static DocumentSearchResult of(final String id, final String title, final String content, final String type) {
        return new DocumentSearchResult(id, title, content, type, null, null, null, List.of(), null, null);
    }

    /**
     * Title and content joined by a single space, content omitted when absent.
     */
    public String fullText() {
        return content == null ? title : title + " " + content;
    }

    public DocumentSearchResult withAuthor(final String newAuthor) {
        return new DocumentSearchResult(id, title, content, type, newAuthor, createdAt, language, tags, accessCount, score);
    }

    public DocumentSearchResult withTags(final List<String> newTags) {
        return new DocumentSearchResult(id, title, content, type, author, createdAt, language, newTags, accessCount, score);
    }

    public DocumentSearchResult withScore(final double newScore) {
        return new DocumentSearchResult(id, title, content, type, author, createdAt, language, tags, accessCount, newScore);
    }

    public DocumentSearchResult withAccessCount(final int newAccessCount) {
        return new DocumentSearchResult(id, title, content, type, author, createdAt, language, tags, newAccessCount, score);
    }

    public DocumentSearchResult withCreatedAt(final Instant newCreatedAt) {
        return new DocumentSearchResult(id, title, content, type, author, newCreatedAt, language, tags, accessCount, score);
    }

    public DocumentSearchResult withLanguage(final String newLanguage) {
        return new DocumentSearchResult(id, title, content, type, author, createdAt, newLanguage, tags, accessCount, score);
    }
}
