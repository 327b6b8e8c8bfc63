package eu.fbk.docstore.runtime;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals that a stored document cannot be decoded.
 * <p>
 * This exception is thrown when a document read from the backend lacks mandatory fields, carries
 * an unknown value type tag or has a malformed key. It is distinguished from other
 * {@code IOException}s as it cannot be addressed by retrying the operation: the stored data has
 * to be repaired, usually by manual intervention.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    public DataCorruptedException(final String message) {
        this(message, null);
    }

    /**
     * Creates a new instance with the error message and optional cause specified.
     *
     * @param message
     *            a message describing the corrupted data
     * @param cause
     *            the optional cause of this exception
     */
    public DataCorruptedException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
