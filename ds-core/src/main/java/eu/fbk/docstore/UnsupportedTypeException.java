package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals an attempt to store a value (or property) that cannot be represented, e.g., a nested
 * list or an object of an unsupported Java type.
 */
public class UnsupportedTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final String operation;

    public UnsupportedTypeException(final String message, @Nullable final String operation) {
        this(message, operation, null);
    }

    public UnsupportedTypeException(final String message, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super(operation == null ? message : message + " [" + operation + "]", cause);
        this.operation = operation;
    }

    @Nullable
    public String getOperation() {
        return this.operation;
    }

}
