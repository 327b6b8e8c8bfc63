package eu.fbk.docstore;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Base class of the checked exceptions raised by datastore operations.
 * <p>
 * Each {@code DatastoreException} carries a short description of the operation that failed
 * (e.g., the kind, key or query involved), available via {@link #getOperation()}, so that callers
 * and logs can relate a failure to the request that caused it without parsing the message.
 * </p>
 */
public class DatastoreException extends IOException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final String operation;

    /**
     * Creates a new instance with the message, operation description and cause specified.
     *
     * @param message
     *            the error message
     * @param operation
     *            an optional description of the failed operation
     * @param cause
     *            the optional cause of this exception
     */
    public DatastoreException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(operation == null ? message : message + " [" + operation + "]", cause);
        this.operation = operation;
    }

    /**
     * Returns the description of the operation that failed, if known.
     *
     * @return the operation description, or null if not available
     */
    @Nullable
    public String getOperation() {
        return this.operation;
    }

}
