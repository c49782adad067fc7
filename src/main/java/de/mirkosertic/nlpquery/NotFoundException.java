package de.mirkosertic.nlpquery;

/**
 * Raised when a session, template or refinement id is unknown.
 */
public class NotFoundException extends NlpQueryException {

    private final String kind;
    private final String id;

    public NotFoundException(final String kind, final String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
