package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals that the document backend could not be reached or failed to perform an operation.
 */
public class BackendUnavailableException extends DatastoreException {

    private static final long serialVersionUID = 1L;

    public BackendUnavailableException(final String message, @Nullable final String operation) {
        this(message, operation, null);
    }

    public BackendUnavailableException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(message, operation, cause);
    }

}
