package eu.fbk.docstore;

import javax.annotation.Nullable;

import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.QueryResult;

/**
 * An emulated, single entity-group transaction.
 * <p>
 * A transaction becomes bound to the entity group (i.e., the root key) of the first key it
 * operates on; operations on other groups fail with {@link CrossGroupException}. Reads are
 * executed immediately against the current datastore state, without isolation. Writes are queued
 * and applied sequentially on {@link #commit()}: a failure stops the commit, leaving the earlier
 * writes applied, and is reported as a {@link PartialCommitException}. Operations other than
 * {@link #getState()} and {@link #getEntityGroup()} fail with {@code IllegalStateException} if
 * the transaction is not {@link State#OPEN}.
 * </p>
 * <p>
 * Transactions are not thread safe.
 * </p>
 */
public interface Transaction {

    State getState();

    /**
     * Returns the root key of the entity group this transaction is bound to.
     *
     * @return the entity group root, or null if no key has been used yet
     */
    @Nullable
    Key getEntityGroup();

    @Nullable
    Entity get(Key key) throws DatastoreException;

    /**
     * Runs an ancestor query within the transaction entity group.
     *
     * @param query
     *            the query, which must specify an ancestor
     * @return the query result
     * @throws DatastoreException
     *             on failure
     */
    QueryResult run(Query query) throws DatastoreException;

    /**
     * Queues the storage of an entity. An incomplete key is completed immediately by allocating
     * a new ID.
     *
     * @param entity
     *            the entity
     * @return the complete key of the entity
     * @throws DatastoreException
     *             on failure to allocate an ID, or if the entity belongs to another group
     */
    Key put(Entity entity) throws DatastoreException;

    void delete(Key key) throws DatastoreException;

    /**
     * Applies the queued writes, in order.
     *
     * @throws PartialCommitException
     *             if a write fails
     */
    void commit() throws DatastoreException;

    void rollback();

    enum State {

        IDLE,

        OPEN,

        COMMITTING,

        COMMITTED,

        FAILED,

        ROLLED_BACK

    }

}
