package eu.fbk.docstore.server;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.BackendUnavailableException;
import eu.fbk.docstore.Datastore;
import eu.fbk.docstore.DatastoreException;
import eu.fbk.docstore.Transaction;
import eu.fbk.docstore.UnsupportedTypeException;
import eu.fbk.docstore.backend.DocumentQuery;
import eu.fbk.docstore.backend.DocumentStore;
import eu.fbk.docstore.backend.LoggingDocumentStore;
import eu.fbk.docstore.data.Cursor;
import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.QueryResult;
import eu.fbk.docstore.mapping.EntityCodec;
import eu.fbk.docstore.mapping.IdAllocator;
import eu.fbk.docstore.mapping.IndexManager;
import eu.fbk.docstore.mapping.KeyCodec;
import eu.fbk.docstore.mapping.QueryTranslator;
import eu.fbk.docstore.mapping.TranslatedQuery;
import eu.fbk.docstore.runtime.Component;

/**
 * A {@link Datastore} implementation storing entities in a {@link DocumentStore}.
 * <p>
 * Each entity is stored as a document (see {@link EntityCodec}) in the collection named after
 * its kind; numeric IDs are minted by an {@link IdAllocator} backed by the counters collection;
 * queries are checked by the {@link IndexManager} and translated by the {@link QueryTranslator}.
 * The instance must be initialized via {@link #init()} before use, and closing it closes the
 * wrapped {@code DocumentStore}.
 * </p>
 * <p>
 * This class is thread safe, provided the wrapped {@code DocumentStore} is.
 * </p>
 */
public final class DocumentDatastore implements Datastore, Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentDatastore.class);

    private final DatastoreConfiguration configuration;

    private final DocumentStore store;

    private final IdAllocator allocator;

    private final IndexManager indexManager;

    private final QueryTranslator translator;

    private final Multiset<Query> history;

    private volatile boolean initialized;

    private volatile boolean closed;

    /**
     * Creates a new instance on top of the document store and with the configuration specified.
     *
     * @param store
     *            the document store, not initialized yet
     * @param configuration
     *            the configuration
     */
    public DocumentDatastore(final DocumentStore store,
            final DatastoreConfiguration configuration) {
        Preconditions.checkNotNull(store);
        this.configuration = Preconditions.checkNotNull(configuration);
        this.store = configuration.isLogCalls() ? new LoggingDocumentStore(store) : store;
        this.allocator = new IdAllocator(this.store, configuration.getCountersCollection());
        this.indexManager = new IndexManager(this.store, configuration.isRequireIndexes());
        this.translator = new QueryTranslator(this.indexManager);
        this.history = ConcurrentHashMultiset.create();
        LOGGER.info("{} configured, {}", getClass().getSimpleName(), configuration);
    }

    public DatastoreConfiguration getConfiguration() {
        return this.configuration;
    }

    public IndexManager getIndexManager() {
        return this.indexManager;
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.store.init();
        this.indexManager.reconcile(this.configuration.getIndexes());
        this.initialized = true;
        LOGGER.info("{} initialized, app_id={}", getClass().getSimpleName(),
                this.configuration.getAppId());
    }

    @Nullable
    @Override
    public Entity get(final Key key) throws DatastoreException {
        checkActive();
        Preconditions.checkArgument(key.isComplete(), "Incomplete key %s", key);
        final String operation = "get " + key;
        try {
            final Map<String, Object> document = this.store.get(key.getKind(),
                    KeyCodec.encode(key));
            return document == null ? null : EntityCodec.documentToEntity(document, key
                    .getKind());
        } catch (final IOException ex) {
            throw wrap(ex, operation);
        }
    }

    @Override
    public Map<Key, Entity> get(final Iterable<Key> keys) throws DatastoreException {
        final Map<Key, Entity> result = Maps.newLinkedHashMap();
        for (final Key key : keys) {
            final Entity entity = get(key);
            if (entity != null) {
                result.put(key, entity);
            }
        }
        return result;
    }

    @Override
    public Key put(final Entity entity) throws DatastoreException, UnsupportedTypeException {
        checkActive();
        complete(entity);
        write(entity);
        return entity.getKey();
    }

    @Override
    public List<Key> put(final Iterable<Entity> entities) throws DatastoreException,
            UnsupportedTypeException {
        final List<Key> keys = Lists.newArrayList();
        for (final Entity entity : entities) {
            keys.add(put(entity));
        }
        return keys;
    }

    @Override
    public void delete(final Key key) throws DatastoreException {
        checkActive();
        remove(key);
    }

    @Override
    public void delete(final Iterable<Key> keys) throws DatastoreException {
        for (final Key key : keys) {
            delete(key);
        }
    }

    @Override
    public QueryResult run(final Query query) throws DatastoreException {
        checkActive();
        this.indexManager.checkQuery(query);
        final TranslatedQuery translated = this.translator.translate(query);
        record(query);

        final Integer limit = query.getLimit();
        final DocumentQuery documentQuery = translated.getDocumentQuery();
        final List<Map<String, Object>> documents;
        try {
            documents = this.store.find(translated.getCollection(), limit == null
                    || limit == Integer.MAX_VALUE ? documentQuery : documentQuery
                    .withLimit(limit + 1));
        } catch (final IOException ex) {
            throw wrap(ex, "run " + query);
        }

        final boolean more = limit != null && documents.size() > limit;
        final List<Map<String, Object>> page = more ? documents.subList(0, limit) : documents;
        final List<Entity> entities = Lists.newArrayListWithCapacity(page.size());
        Cursor endCursor = query.getCursor();
        try {
            for (final Map<String, Object> document : page) {
                entities.add(EntityCodec.documentToEntity(document, query.getKind()));
            }
            if (!page.isEmpty()) {
                endCursor = QueryTranslator.endCursor(translated, page.get(page.size() - 1));
            }
        } catch (final IOException ex) {
            throw wrap(ex, "run " + query);
        }

        LOGGER.debug("Query {} returned {} entities (more={})", query, entities.size(), more);
        return new QueryResult(entities, endCursor, more);
    }

    @Override
    public long count(final Query query) throws DatastoreException {
        checkActive();
        this.indexManager.checkQuery(query);
        final TranslatedQuery translated = this.translator.translate(query);
        record(query);
        final long total;
        try {
            total = this.store.count(translated.getCollection(), translated.getFilter());
        } catch (final IOException ex) {
            throw wrap(ex, "count " + query);
        }
        final long count = Math.max(0L, total - query.getOffset());
        return query.getLimit() == null ? count : Math.min(count, query.getLimit());
    }

    @Override
    public List<Key> allocateIds(@Nullable final Key parent, final String kind, final int count)
            throws DatastoreException {
        checkActive();
        final long first = this.allocator.allocate(kind, count);
        final ImmutableList.Builder<Key> builder = ImmutableList.builder();
        for (int i = 0; i < count; ++i) {
            builder.add(Key.create(parent, kind, first + i));
        }
        return builder.build();
    }

    @Override
    public Transaction beginTransaction() {
        checkActive();
        return new EmulatedTransaction(this);
    }

    private void record(final Query query) {
        // pages of the same query share an entry
        this.history.add(query.getCursor() == null ? query : query.toBuilder().cursor(null)
                .build());
    }

    @Override
    public Map<Query, Integer> getQueryHistory() {
        final ImmutableMap.Builder<Query, Integer> builder = ImmutableMap.builder();
        for (final Multiset.Entry<Query> entry : this.history.entrySet()) {
            builder.put(entry.getElement(), entry.getCount());
        }
        return builder.build();
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        this.store.close();
        LOGGER.info("{} closed", getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.configuration.getAppId() + ")";
    }

    /**
     * Assigns a newly allocated ID to an entity with an incomplete key.
     *
     * @param entity
     *            the entity, modified in place
     * @throws BackendUnavailableException
     *             if ID allocation fails
     */
    void complete(final Entity entity) throws BackendUnavailableException {
        final Key key = entity.getKey();
        if (!key.isComplete()) {
            entity.setKey(key.withId(this.allocator.allocate(key.getKind())));
        }
    }

    void write(final Entity entity) throws DatastoreException, UnsupportedTypeException {
        final Key key = entity.getKey();
        final Map<String, Object> document = EntityCodec.entityToDocument(entity);
        try {
            this.store.put(key.getKind(), document);
        } catch (final IOException ex) {
            throw wrap(ex, "put " + key);
        }
    }

    void remove(final Key key) throws DatastoreException {
        Preconditions.checkArgument(key.isComplete(), "Incomplete key %s", key);
        try {
            this.store.delete(key.getKind(), KeyCodec.encode(key));
        } catch (final IOException ex) {
            throw wrap(ex, "delete " + key);
        }
    }

    void checkActive() {
        Preconditions.checkState(this.initialized && !this.closed, "%s not active", this);
    }

    private static DatastoreException wrap(final IOException ex, final String operation) {
        if (ex instanceof BackendUnavailableException) {
            final BackendUnavailableException bue = (BackendUnavailableException) ex;
            return bue.getOperation() != null ? bue : new BackendUnavailableException(
                    "Backend unavailable", operation, ex);
        } else if (ex instanceof DatastoreException) {
            return (DatastoreException) ex;
        }
        return new DatastoreException("Backend operation failed: " + ex.getMessage(),
                operation, ex);
    }

}
