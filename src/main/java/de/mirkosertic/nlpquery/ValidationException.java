package de.mirkosertic.nlpquery;

/**
 * Raised synchronously for input the pipeline refuses to process: empty or
 * oversized queries, unsupported languages, missing template parameters.
 * Never retried.
 */
public class ValidationException extends NlpQueryException {

    public ValidationException(final String message) {
        super(message);
    }
}
