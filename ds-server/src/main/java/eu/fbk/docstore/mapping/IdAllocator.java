package eu.fbk.docstore.mapping;

import java.io.IOException;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.BackendUnavailableException;
import eu.fbk.docstore.backend.DocumentStore;

/**
 * Allocates numeric entity IDs using persistent per-kind counters.
 * <p>
 * Each kind has a counter document in the counters collection, whose {@link #COUNTER_FIELD}
 * holds the last allocated ID. Allocation atomically increments the counter on the backend, so
 * that IDs are unique across concurrent callers and processes, strictly increasing for each kind
 * and never reused, even after restarts. Allocated IDs are consumed even if never used.
 * </p>
 */
public final class IdAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(IdAllocator.class);

    /** Default name of the counters collection. */
    public static final String DEFAULT_COLLECTION = "__counters__";

    /** Counter field holding the last allocated ID. */
    public static final String COUNTER_FIELD = "last";

    private final DocumentStore store;

    private final String collection;

    public IdAllocator(final DocumentStore store, final String collection) {
        Preconditions.checkArgument(!collection.isEmpty(), "Empty counters collection");
        this.store = Preconditions.checkNotNull(store);
        this.collection = collection;
    }

    public String getCollection() {
        return this.collection;
    }

    /**
     * Allocates a single ID for the kind specified.
     *
     * @param kind
     *            the kind
     * @return the allocated ID, positive
     * @throws BackendUnavailableException
     *             if the counter cannot be incremented
     */
    public long allocate(final String kind) throws BackendUnavailableException {
        return allocate(kind, 1);
    }

    /**
     * Allocates a contiguous range of IDs for the kind specified.
     *
     * @param kind
     *            the kind
     * @param count
     *            the number of IDs to allocate, positive
     * @return the first allocated ID; the range ends at this ID plus {@code count - 1}
     * @throws BackendUnavailableException
     *             if the counter cannot be incremented
     */
    public long allocate(final String kind, final int count) throws BackendUnavailableException {
        Preconditions.checkArgument(count > 0, "Invalid ID count %s", count);
        final long last;
        try {
            last = this.store.increment(this.collection, kind, COUNTER_FIELD, count);
        } catch (final IOException ex) {
            LOGGER.error("Allocation of " + count + " IDs for kind " + kind + " failed", ex);
            throw new BackendUnavailableException("ID allocation failed", "allocate " + count
                    + " IDs for kind " + kind, ex);
        }
        LOGGER.trace("Allocated IDs {}-{} for kind {}", last - count + 1, last, kind);
        return last - count + 1;
    }

}
