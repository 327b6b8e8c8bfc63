package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals a query that cannot be translated to the document backend (e.g., inequality filters on
 * multiple properties without a matching index, unindexed filter values, excessive offset).
 */
public class UnsupportedQueryException extends DatastoreException {

    private static final long serialVersionUID = 1L;

    public UnsupportedQueryException(final String message, @Nullable final String operation) {
        this(message, operation, null);
    }

    public UnsupportedQueryException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(message, operation, cause);
    }

}
