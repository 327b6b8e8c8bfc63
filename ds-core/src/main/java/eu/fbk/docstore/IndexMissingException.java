package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals that a query requires a composite index that is not available in the backend, and
 * strict index mode is enabled.
 */
public class IndexMissingException extends DatastoreException {

    private static final long serialVersionUID = 1L;

    public IndexMissingException(final String message, @Nullable final String operation) {
        this(message, operation, null);
    }

    public IndexMissingException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(message, operation, cause);
    }

}
