package de.mirkosertic.nlpquery;

/**
 * Base class of all exceptions raised by the query understanding pipeline.
 */
public class NlpQueryException extends RuntimeException {

    public NlpQueryException(final String message) {
        super(message);
    }

    public NlpQueryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
