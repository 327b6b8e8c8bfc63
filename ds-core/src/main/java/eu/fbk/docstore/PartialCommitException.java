package eu.fbk.docstore;

import javax.annotation.Nullable;

/**
 * Signals that the commit of an emulated transaction failed after some of its queued writes had
 * already been applied.
 * <p>
 * Writes are applied in the order they were queued: those preceding the {@link #getFailedIndex()
 * failed one} are persisted, while the failed one and those following it are not. No rollback is
 * attempted.
 * </p>
 */
public class PartialCommitException extends DatastoreException {

    private static final long serialVersionUID = 1L;

    private final int failedIndex;

    /**
     * Creates a new instance.
     *
     * @param failedIndex
     *            the zero-based index of the queued write that failed
     * @param operation
     *            an optional description of the failed write
     * @param cause
     *            the failure of the write
     */
    public PartialCommitException(final int failedIndex, @Nullable final String operation,
            @Nullable final Throwable cause) {
        super("Commit failed at queued write #" + failedIndex + ", previous writes applied",
                operation, cause);
        this.failedIndex = failedIndex;
    }

    /**
     * Returns the zero-based index of the queued write whose execution failed.
     *
     * @return the index of the failed write
     */
    public int getFailedIndex() {
        return this.failedIndex;
    }

}
