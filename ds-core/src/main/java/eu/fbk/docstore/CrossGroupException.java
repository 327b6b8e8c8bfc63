package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals an operation within a transaction that targets an entity group different from the one
 * the transaction is bound to.
 */
public class CrossGroupException extends DatastoreException {

    private static final long serialVersionUID = 1L;

    public CrossGroupException(final String message, @Nullable final String operation) {
        this(message, operation, null);
    }

    public CrossGroupException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(message, operation, cause);
    }

}
