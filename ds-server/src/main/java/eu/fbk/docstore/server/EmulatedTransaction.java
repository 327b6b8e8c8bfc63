package eu.fbk.docstore.server;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.CrossGroupException;
import eu.fbk.docstore.DatastoreException;
import eu.fbk.docstore.PartialCommitException;
import eu.fbk.docstore.Transaction;
import eu.fbk.docstore.UnsupportedQueryException;
import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.QueryResult;
import eu.fbk.docstore.mapping.EntityCodec;

/**
 * A {@link Transaction} emulated on top of a {@link DocumentDatastore}, with no isolation and no
 * atomicity: writes are buffered and applied one at a time on commit.
 */
final class EmulatedTransaction implements Transaction {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmulatedTransaction.class);

    private final DocumentDatastore datastore;

    private final List<Write> writes;

    private State state;

    @Nullable
    private Key group;

    EmulatedTransaction(final DocumentDatastore datastore) {
        this.datastore = Preconditions.checkNotNull(datastore);
        this.writes = Lists.newArrayList();
        this.state = State.OPEN;
    }

    @Override
    public State getState() {
        return this.state;
    }

    @Nullable
    @Override
    public Key getEntityGroup() {
        return this.group;
    }

    @Nullable
    @Override
    public Entity get(final Key key) throws DatastoreException {
        checkOpen();
        checkGroup(key, "get " + key);
        return this.datastore.get(key);
    }

    @Override
    public QueryResult run(final Query query) throws DatastoreException {
        checkOpen();
        final Key ancestor = query.getAncestor();
        if (ancestor == null) {
            throw new UnsupportedQueryException("Only ancestor queries are allowed in "
                    + "transactions", query.toString());
        }
        checkGroup(ancestor, "run " + query);
        return this.datastore.run(query);
    }

    @Override
    public Key put(final Entity entity) throws DatastoreException {
        checkOpen();
        if (!entity.getKey().isComplete() && entity.getKey().getParent() != null) {
            checkGroup(entity.getKey().getParent(), "put " + entity.getKey());
        }
        this.datastore.complete(entity);
        final Key key = entity.getKey();
        checkGroup(key, "put " + key);
        EntityCodec.entityToDocument(entity);
        this.writes.add(new Write(key, entity.clone()));
        return key;
    }

    @Override
    public void delete(final Key key) throws DatastoreException {
        checkOpen();
        checkGroup(key, "delete " + key);
        this.writes.add(new Write(key, null));
    }

    @Override
    public void commit() throws DatastoreException {
        checkOpen();
        this.state = State.COMMITTING;
        LOGGER.warn("Committing transaction on entity group {} without transactional "
                + "guarantees ({} writes applied one at a time)", this.group, this.writes.size());
        for (int i = 0; i < this.writes.size(); ++i) {
            final Write write = this.writes.get(i);
            try {
                if (write.entity != null) {
                    this.datastore.write(write.entity);
                } else {
                    this.datastore.remove(write.key);
                }
            } catch (final DatastoreException | RuntimeException ex) {
                this.state = State.FAILED;
                throw new PartialCommitException(i, write.toString(), ex);
            }
        }
        this.state = State.COMMITTED;
    }

    @Override
    public void rollback() {
        checkOpen();
        this.writes.clear();
        this.state = State.ROLLED_BACK;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.state + ", group " + this.group + ", "
                + this.writes.size() + " queued writes)";
    }

    private void checkOpen() {
        Preconditions.checkState(this.state == State.OPEN, "Transaction is %s", this.state);
    }

    private void checkGroup(final Key key, final String operation) throws CrossGroupException {
        final Key root = key.getRoot();
        if (this.group == null) {
            this.group = root;
        } else if (!this.group.equals(root)) {
            throw new CrossGroupException("Transaction bound to entity group " + this.group
                    + " cannot access entity group " + root, operation);
        }
    }

    private static final class Write {

        final Key key;

        @Nullable
        final Entity entity;

        Write(final Key key, @Nullable final Entity entity) {
            this.key = key;
            this.entity = entity;
        }

        @Override
        public String toString() {
            return (this.entity != null ? "put " : "delete ") + this.key;
        }

    }

}
