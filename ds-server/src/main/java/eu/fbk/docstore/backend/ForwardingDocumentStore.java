package eu.fbk.docstore.backend;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

/**
 * A {@code DocumentStore} forwarding all its method calls to another {@code DocumentStore}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code DocumentStore} interface. Subclasses must implement method {@link #delegate()} and
 * override the methods they want to decorate.
 * </p>
 */
public abstract class ForwardingDocumentStore extends ForwardingObject implements DocumentStore {

    @Override
    protected abstract DocumentStore delegate();

    @Override
    public void init() throws IOException {
        delegate().init();
    }

    @Nullable
    @Override
    public Map<String, Object> get(final String collection, final String id) throws IOException {
        return delegate().get(collection, id);
    }

    @Override
    public void put(final String collection, final Map<String, Object> document)
            throws IOException {
        delegate().put(collection, document);
    }

    @Override
    public boolean delete(final String collection, final String id) throws IOException {
        return delegate().delete(collection, id);
    }

    @Override
    public List<Map<String, Object>> find(final String collection, final DocumentQuery query)
            throws IOException {
        return delegate().find(collection, query);
    }

    @Override
    public long count(final String collection, final DocumentFilter filter) throws IOException {
        return delegate().count(collection, filter);
    }

    @Override
    public long increment(final String collection, final String id, final String field,
            final long delta) throws IOException {
        return delegate().increment(collection, id, field, delta);
    }

    @Override
    public List<DocumentIndex> listIndexes(final String collection) throws IOException {
        return delegate().listIndexes(collection);
    }

    @Override
    public void createIndex(final String collection, final DocumentIndex index)
            throws IOException {
        delegate().createIndex(collection, index);
    }

    @Override
    public void close() {
        delegate().close();
    }

}
