package de.mirkosertic.nlpquery;

import org.jspecify.annotations.Nullable;

/**
 * Per-call options of {@link NlpQueryPipeline#processQuery(String, ProcessingOptions)}.
 *
 * @param language  query language, inferred from the script when null
 * @param userId    the user issuing the query, part of the cache key
 * @param sessionId refinement session to add the query to, a per-user session when null
 * @param skipCache bypass the cache lookup; the fresh result is still cached
 */
public record ProcessingOptions(
        @Nullable Language language,
        @Nullable String userId,
        @Nullable String sessionId,
        boolean skipCache,
        Priority priority
) {

    public ProcessingOptions {
        if (language == Language.MIXED) {
            throw new ValidationException("Language must be either \"en\" or \"ar\"");
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(null, null, null, false, Priority.NORMAL);
    }

    public ProcessingOptions withLanguage(final Language newLanguage) {
        return new ProcessingOptions(newLanguage, userId, sessionId, skipCache, priority);
    }

    public ProcessingOptions withUserId(final String newUserId) {
        return new ProcessingOptions(language, newUserId, sessionId, skipCache, priority);
    }

    public ProcessingOptions withSessionId(final String newSessionId) {
        return new ProcessingOptions(language, userId, newSessionId, skipCache, priority);
    }

    public ProcessingOptions withSkipCache(final boolean newSkipCache) {
        return new ProcessingOptions(language, userId, sessionId, newSkipCache, priority);
    }

    public ProcessingOptions withPriority(final Priority newPriority) {
        return new ProcessingOptions(language, userId, sessionId, skipCache, newPriority);
    }
}
