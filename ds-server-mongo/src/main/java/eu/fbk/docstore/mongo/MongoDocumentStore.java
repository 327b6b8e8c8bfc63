package eu.fbk.docstore.mongo;

import java.io.IOException;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.bson.Document;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.Block;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import com.mongodb.connection.ClusterSettings;
import com.mongodb.connection.SocketSettings;

import eu.fbk.docstore.BackendUnavailableException;
import eu.fbk.docstore.backend.DocumentFilter;
import eu.fbk.docstore.backend.DocumentIndex;
import eu.fbk.docstore.backend.DocumentQuery;
import eu.fbk.docstore.backend.DocumentQuery.Sort;
import eu.fbk.docstore.backend.DocumentStore;
import eu.fbk.docstore.runtime.DataCorruptedException;

/**
 * A {@code DocumentStore} backed by a MongoDB database.
 * <p>
 * Each collection of the store is a MongoDB collection of the configured database. Documents
 * read from MongoDB are normalized to the natives accepted by {@code DocumentStore}: embedded
 * documents become {@code LinkedHashMap}s, binary data {@code byte[]} and 32 bit integers
 * {@code Long}s. Timeouts and network failures are reported as
 * {@link BackendUnavailableException}s.
 * </p>
 */
public class MongoDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDocumentStore.class);

    private static final String ID_INDEX_NAME = "_id_";

    private final MongoConfigurations configs;

    private final String databaseName;

    @Nullable
    private MongoClient client;

    @Nullable
    private MongoDatabase database;

    private volatile boolean closed;

    public MongoDocumentStore(final MongoConfigurations configs, final String databaseName) {
        Preconditions.checkArgument(!databaseName.isEmpty(), "Empty database name");
        this.configs = Preconditions.checkNotNull(configs);
        this.databaseName = databaseName;
        LOGGER.info("{} configured, {}, database={}", getClass().getSimpleName(), configs,
                databaseName);
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(this.client == null && !this.closed);
        final MongoClientSettings settings = MongoClientSettings.builder()
                .applyToClusterSettings(new Block<ClusterSettings.Builder>() {

                    @Override
                    public void apply(final ClusterSettings.Builder builder) {
                        builder.hosts(Arrays.asList(new ServerAddress(
                                MongoDocumentStore.this.configs.getHost(),
                                MongoDocumentStore.this.configs.getPort())));
                        builder.serverSelectionTimeout(
                                MongoDocumentStore.this.configs.getServerSelectionTimeout(),
                                TimeUnit.MILLISECONDS);
                    }

                }).applyToSocketSettings(new Block<SocketSettings.Builder>() {

                    @Override
                    public void apply(final SocketSettings.Builder builder) {
                        builder.connectTimeout(MongoDocumentStore.this.configs.getConnectTimeout(),
                                TimeUnit.MILLISECONDS);
                        builder.readTimeout(MongoDocumentStore.this.configs.getSocketTimeout(),
                                TimeUnit.MILLISECONDS);
                    }

                }).build();
        this.client = MongoClients.create(settings);
        this.database = this.client.getDatabase(this.databaseName);
        LOGGER.info("{} initialized, connected to {}:{}/{}", getClass().getSimpleName(),
                this.configs.getHost(), this.configs.getPort(), this.databaseName);
    }

    @Nullable
    @Override
    public Map<String, Object> get(final String collection, final String id) throws IOException {
        try {
            final Document document = collection(collection).find(Filters.eq(ID_FIELD, id))
                    .first();
            return document == null ? null : normalize(document);
        } catch (final MongoException ex) {
            throw translate(ex, "get " + collection);
        }
    }

    @Override
    public void put(final String collection, final Map<String, Object> document)
            throws IOException {
        final Object id = document.get(ID_FIELD);
        Preconditions.checkArgument(id instanceof String, "Missing or invalid %s", ID_FIELD);
        try {
            collection(collection).replaceOne(Filters.eq(ID_FIELD, id), new Document(document),
                    new ReplaceOptions().upsert(true));
        } catch (final MongoException ex) {
            throw translate(ex, "put " + collection);
        }
    }

    @Override
    public boolean delete(final String collection, final String id) throws IOException {
        try {
            return collection(collection).deleteOne(Filters.eq(ID_FIELD, id))
                    .getDeletedCount() > 0;
        } catch (final MongoException ex) {
            throw translate(ex, "delete " + collection);
        }
    }

    @Override
    public List<Map<String, Object>> find(final String collection, final DocumentQuery query)
            throws IOException {
        try {
            FindIterable<Document> iterable = collection(collection).find(
                    MongoFilters.toBson(query.getFilter()));
            if (!query.getSorts().isEmpty()) {
                iterable = iterable.sort(MongoFilters.toBson(query.getSorts()));
            }
            if (query.getSkip() > 0) {
                iterable = iterable.skip(query.getSkip());
            }
            if (query.getLimit() != null) {
                if (query.getLimit() == 0) {
                    return ImmutableList.of();
                }
                iterable = iterable.limit(query.getLimit());
            }
            final List<Map<String, Object>> result = Lists.newArrayList();
            for (final Document document : iterable) {
                result.add(normalize(document));
            }
            return result;
        } catch (final MongoException ex) {
            throw translate(ex, "find " + collection);
        }
    }

    @Override
    public long count(final String collection, final DocumentFilter filter) throws IOException {
        try {
            return collection(collection).countDocuments(MongoFilters.toBson(filter));
        } catch (final MongoException ex) {
            throw translate(ex, "count " + collection);
        }
    }

    @Override
    public long increment(final String collection, final String id, final String field,
            final long delta) throws IOException {
        final Document document;
        try {
            document = collection(collection).findOneAndUpdate(Filters.eq(ID_FIELD, id),
                    Updates.inc(field, delta), new FindOneAndUpdateOptions().upsert(true)
                            .returnDocument(ReturnDocument.AFTER));
        } catch (final MongoException ex) {
            throw translate(ex, "increment " + collection);
        }
        final Object value = document == null ? null : document.get(field);
        if (!(value instanceof Long) && !(value instanceof Integer)) {
            throw new DataCorruptedException("Non-integer field " + field + " in " + collection
                    + "/" + id + ": " + value);
        }
        return ((Number) value).longValue();
    }

    @Override
    public List<DocumentIndex> listIndexes(final String collection) throws IOException {
        final List<DocumentIndex> result = Lists.newArrayList();
        try {
            for (final Document index : collection(collection).listIndexes()) {
                if (ID_INDEX_NAME.equals(index.getString("name"))) {
                    continue;
                }
                final List<Sort> fields = Lists.newArrayList();
                final Document key = (Document) index.get("key");
                for (final Map.Entry<String, Object> entry : key.entrySet()) {
                    if (!(entry.getValue() instanceof Number)) {
                        fields.clear(); // text, hashed or geo index
                        break;
                    }
                    fields.add(new Sort(entry.getKey(),
                            ((Number) entry.getValue()).doubleValue() > 0));
                }
                if (!fields.isEmpty()) {
                    result.add(new DocumentIndex(fields));
                }
            }
        } catch (final MongoException ex) {
            throw translate(ex, "listIndexes " + collection);
        }
        return result;
    }

    @Override
    public void createIndex(final String collection, final DocumentIndex index)
            throws IOException {
        try {
            collection(collection).createIndex(MongoFilters.toBson(index.getFields()),
                    new IndexOptions().name(index.getName()));
            LOGGER.info("{} - created index {} on {}", this, index, collection);
        } catch (final MongoException ex) {
            throw translate(ex, "createIndex " + collection);
        }
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.client != null) {
            this.client.close();
            LOGGER.info("{} closed", getClass().getSimpleName());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.databaseName + ")";
    }

    private synchronized MongoCollection<Document> collection(final String name) {
        Preconditions.checkState(this.database != null && !this.closed, "%s not active", this);
        return this.database.getCollection(name);
    }

    private static IOException translate(final MongoException ex, final String operation) {
        if (ex instanceof MongoTimeoutException || ex instanceof MongoSocketException) {
            LOGGER.error("MongoDB unreachable during {}: {}", operation, ex.getMessage());
            return new BackendUnavailableException("MongoDB unreachable", operation, ex);
        }
        return new IOException("MongoDB " + operation + " failed: " + ex.getMessage(), ex);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> normalize(final Map<String, Object> document) {
        return (Map<String, Object>) normalizeValue(document);
    }

    @Nullable
    private static Object normalizeValue(@Nullable final Object value) {
        if (value instanceof Map<?, ?>) {
            final Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                map.put((String) entry.getKey(), normalizeValue(entry.getValue()));
            }
            return map;
        } else if (value instanceof List<?>) {
            final List<Object> list = Lists.newArrayListWithCapacity(((List<?>) value).size());
            for (final Object element : (List<?>) value) {
                list.add(normalizeValue(element));
            }
            return list;
        } else if (value instanceof Binary) {
            return ((Binary) value).getData();
        } else if (value instanceof Integer) {
            return ((Integer) value).longValue();
        } else if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

}
