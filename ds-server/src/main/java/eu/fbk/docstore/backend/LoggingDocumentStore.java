package eu.fbk.docstore.backend;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@code DocumentStore} wrapper that logs calls to the operations of a wrapped
 * {@code DocumentStore} and their execution times.
 * <p>
 * Request information and execution times are logged via SLF4J (level DEBUG, logger named after
 * this class). The overhead introduced by this wrapper when logging is disabled is negligible.
 * </p>
 */
public final class LoggingDocumentStore extends ForwardingDocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDocumentStore.class);

    private final DocumentStore delegate;

    /**
     * Creates a new instance for the wrapped {@code DocumentStore} specified.
     *
     * @param delegate
     *            the wrapped {@code DocumentStore}
     */
    public LoggingDocumentStore(final DocumentStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected DocumentStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.init();
        }
    }

    @Nullable
    @Override
    public Map<String, Object> get(final String collection, final String id) throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Map<String, Object> result = super.get(collection, id);
            LOGGER.debug("{} - get {}/{} {} in {} ms", this, collection,
                    DocumentOrdering.toString(id), result == null ? "missed" : "found",
                    System.currentTimeMillis() - ts);
            return result;
        } else {
            return super.get(collection, id);
        }
    }

    @Override
    public void put(final String collection, final Map<String, Object> document)
            throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.put(collection, document);
            LOGGER.debug("{} - put {}/{} in {} ms", this, collection,
                    DocumentOrdering.toString(document.get(ID_FIELD)),
                    System.currentTimeMillis() - ts);
        } else {
            super.put(collection, document);
        }
    }

    @Override
    public boolean delete(final String collection, final String id) throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final boolean deleted = super.delete(collection, id);
            LOGGER.debug("{} - delete {}/{} ({}) in {} ms", this, collection,
                    DocumentOrdering.toString(id), deleted ? "deleted" : "missing",
                    System.currentTimeMillis() - ts);
            return deleted;
        } else {
            return super.delete(collection, id);
        }
    }

    @Override
    public List<Map<String, Object>> find(final String collection, final DocumentQuery query)
            throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<Map<String, Object>> result = super.find(collection, query);
            LOGGER.debug("{} - find {} [{}]: {} documents in {} ms", this, collection, query,
                    result.size(), System.currentTimeMillis() - ts);
            return result;
        } else {
            return super.find(collection, query);
        }
    }

    @Override
    public long count(final String collection, final DocumentFilter filter) throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final long result = super.count(collection, filter);
            LOGGER.debug("{} - count {} [{}]: {} documents in {} ms", this, collection, filter,
                    result, System.currentTimeMillis() - ts);
            return result;
        } else {
            return super.count(collection, filter);
        }
    }

    @Override
    public long increment(final String collection, final String id, final String field,
            final long delta) throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final long result = super.increment(collection, id, field, delta);
            LOGGER.debug("{} - increment {}/{}.{} by {} = {} in {} ms", this, collection, id,
                    field, delta, result, System.currentTimeMillis() - ts);
            return result;
        } else {
            return super.increment(collection, id, field, delta);
        }
    }

    @Override
    public void createIndex(final String collection, final DocumentIndex index)
            throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.createIndex(collection, index);
            LOGGER.debug("{} - index {} on {} created in {} ms", this, index, collection,
                    System.currentTimeMillis() - ts);
        } else {
            super.createIndex(collection, index);
        }
    }

    @Override
    public void close() {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.delegate + ")";
    }

}
