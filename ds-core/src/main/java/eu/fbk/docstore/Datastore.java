package eu.fbk.docstore;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.QueryResult;

/**
 * The datastore API used by application code.
 * <p>
 * A {@code Datastore} stores {@link Entity} objects identified by hierarchical {@link Key}s and
 * answers {@link Query}s over them. Implementations are thread safe. Each single-entity operation
 * is atomic; batch operations are executed entity by entity and are not atomic as a whole.
 * Multi-operation atomicity is only emulated by {@link #beginTransaction()}, without isolation
 * nor all-or-nothing guarantees.
 * </p>
 * <p>
 * Failures of the underlying storage are reported as {@link DatastoreException}s; attempts to
 * store unrepresentable values raise {@link UnsupportedTypeException}s.
 * </p>
 */
public interface Datastore extends Closeable {

    /**
     * Retrieves the entity with the key specified.
     *
     * @param key
     *            the complete key of the entity
     * @return the entity, or null if it does not exist
     * @throws DatastoreException
     *             on failure
     */
    @Nullable
    Entity get(Key key) throws DatastoreException;

    /**
     * Retrieves the entities with the keys specified. Missing entities are omitted from the
     * returned map.
     *
     * @param keys
     *            the complete keys of the entities
     * @return a map from key to entity, in the iteration order of the supplied keys
     * @throws DatastoreException
     *             on failure
     */
    Map<Key, Entity> get(Iterable<Key> keys) throws DatastoreException;

    /**
     * Stores an entity, replacing any entity with the same key. If the entity key is incomplete,
     * a new numeric ID is allocated and the entity key is updated in place.
     *
     * @param entity
     *            the entity to store
     * @return the complete key of the stored entity
     * @throws DatastoreException
     *             on failure
     * @throws UnsupportedTypeException
     *             if some property cannot be stored
     */
    Key put(Entity entity) throws DatastoreException, UnsupportedTypeException;

    List<Key> put(Iterable<Entity> entities) throws DatastoreException, UnsupportedTypeException;

    /**
     * Deletes the entity with the key specified, if it exists.
     *
     * @param key
     *            the complete key of the entity
     * @throws DatastoreException
     *             on failure
     */
    void delete(Key key) throws DatastoreException;

    void delete(Iterable<Key> keys) throws DatastoreException;

    /**
     * Runs a query, returning a page of results with its end cursor.
     *
     * @param query
     *            the query
     * @return the query result
     * @throws UnsupportedQueryException
     *             if the query cannot be executed
     * @throws IndexMissingException
     *             if strict index mode is enabled and a required index is missing
     * @throws DatastoreException
     *             on other failures
     */
    QueryResult run(Query query) throws DatastoreException;

    /**
     * Counts the entities matching a query, honouring its offset and limit.
     *
     * @param query
     *            the query
     * @return the number of matching entities
     * @throws DatastoreException
     *             on failure
     */
    long count(Query query) throws DatastoreException;

    /**
     * Allocates numeric IDs for the kind specified, returning the corresponding keys. Allocated
     * IDs are never returned again, neither by this method nor on put.
     *
     * @param parent
     *            the optional parent of the keys to create
     * @param kind
     *            the kind
     * @param count
     *            the number of IDs to allocate, positive
     * @return the allocated keys, in increasing ID order
     * @throws DatastoreException
     *             on failure
     */
    List<Key> allocateIds(@Nullable Key parent, String kind, int count) throws DatastoreException;

    /**
     * Begins a new emulated transaction. The returned transaction is {@code OPEN}.
     *
     * @return the transaction
     */
    Transaction beginTransaction();

    /**
     * Returns how many times each distinct query has been run since the datastore was
     * initialized. Queries differing only in their start cursor are counted together.
     *
     * @return an immutable snapshot of query counts
     */
    Map<Query, Integer> getQueryHistory();

    @Override
    void close();

}
