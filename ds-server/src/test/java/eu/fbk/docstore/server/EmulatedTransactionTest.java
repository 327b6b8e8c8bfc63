package eu.fbk.docstore.server;

import java.util.Properties;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import eu.fbk.docstore.CrossGroupException;
import eu.fbk.docstore.PartialCommitException;
import eu.fbk.docstore.Transaction;
import eu.fbk.docstore.Transaction.State;
import eu.fbk.docstore.UnsupportedQueryException;
import eu.fbk.docstore.backend.InstrumentedDocumentStore;
import eu.fbk.docstore.backend.MemoryDocumentStore;
import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;

public class EmulatedTransactionTest {

    private static final Key LIST = Key.create("List", 1L);

    private InstrumentedDocumentStore store;

    private DocumentDatastore datastore;

    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp() throws Throwable {
        final Properties properties = new Properties();
        properties.setProperty("datastore.app_id", "test-app");
        this.store = new InstrumentedDocumentStore(new MemoryDocumentStore());
        this.datastore = new DocumentDatastore(this.store,
                DatastoreConfiguration.create(properties));
        this.datastore.init();

        this.appender = new ListAppender<ILoggingEvent>();
        this.appender.start();
        ((Logger) LoggerFactory.getLogger(EmulatedTransaction.class))
                .addAppender(this.appender);
    }

    @After
    public void tearDown() {
        ((Logger) LoggerFactory.getLogger(EmulatedTransaction.class))
                .detachAppender(this.appender);
        this.datastore.close();
    }

    private static Entity task(final String name) {
        return new Entity(Key.create(LIST, "Task", name)).set("title", name);
    }

    @Test
    public void testCommit() throws Throwable {
        this.datastore.put(task("old"));
        final Transaction tx = this.datastore.beginTransaction();
        Assert.assertEquals(State.OPEN, tx.getState());
        Assert.assertNull(tx.getEntityGroup());

        tx.put(task("a"));
        final Key generated = tx.put(new Entity(Key.createIncomplete(LIST, "Task")));
        tx.delete(Key.create(LIST, "Task", "old"));
        Assert.assertEquals(LIST, tx.getEntityGroup());
        Assert.assertNotNull(generated.getId());

        // writes are buffered until commit
        Assert.assertNull(this.datastore.get(generated));
        Assert.assertNotNull(tx.get(Key.create(LIST, "Task", "old")));

        tx.commit();
        Assert.assertEquals(State.COMMITTED, tx.getState());
        Assert.assertNotNull(this.datastore.get(Key.create(LIST, "Task", "a")));
        Assert.assertNotNull(this.datastore.get(generated));
        Assert.assertNull(this.datastore.get(Key.create(LIST, "Task", "old")));

        Assert.assertEquals(1, this.appender.list.size());
        final ILoggingEvent event = this.appender.list.get(0);
        Assert.assertEquals(Level.WARN, event.getLevel());
        Assert.assertTrue(event.getFormattedMessage().contains("without transactional"));
    }

    @Test
    public void testPartialCommit() throws Throwable {
        final Transaction tx = this.datastore.beginTransaction();
        tx.put(task("first"));
        tx.put(task("second"));
        tx.put(task("third"));
        this.store.failPut(1);
        try {
            tx.commit();
            Assert.fail();
        } catch (final PartialCommitException ex) {
            Assert.assertEquals(1, ex.getFailedIndex());
            Assert.assertTrue(ex.getOperation().contains("second"));
        }
        Assert.assertEquals(State.FAILED, tx.getState());
        Assert.assertNotNull(this.datastore.get(Key.create(LIST, "Task", "first")));
        Assert.assertNull(this.datastore.get(Key.create(LIST, "Task", "second")));
        Assert.assertNull(this.datastore.get(Key.create(LIST, "Task", "third")));
    }

    @Test
    public void testCrossGroup() throws Throwable {
        final Transaction tx = this.datastore.beginTransaction();
        tx.put(task("a"));
        try {
            tx.put(new Entity(Key.create(Key.create("List", 2L), "Task", "b")));
            Assert.fail();
        } catch (final CrossGroupException ex) {
            Assert.assertNotNull(ex.getOperation());
        }
        try {
            tx.get(Key.create("List", 2L));
            Assert.fail();
        } catch (final CrossGroupException ex) {
            // expected
        }
        Assert.assertEquals(State.OPEN, tx.getState());
        tx.commit();
        Assert.assertNotNull(this.datastore.get(Key.create(LIST, "Task", "a")));
    }

    @Test
    public void testQueries() throws Throwable {
        this.datastore.put(task("a"));
        final Transaction tx = this.datastore.beginTransaction();
        try {
            tx.run(Query.builder("Task").build());
            Assert.fail();
        } catch (final UnsupportedQueryException ex) {
            // expected
        }
        Assert.assertEquals(1, tx.run(Query.builder("Task").ancestor(LIST).build()).size());
        Assert.assertEquals(LIST, tx.getEntityGroup());
    }

    @Test
    public void testRollback() throws Throwable {
        final Transaction tx = this.datastore.beginTransaction();
        tx.put(task("a"));
        tx.rollback();
        Assert.assertEquals(State.ROLLED_BACK, tx.getState());
        Assert.assertNull(this.datastore.get(Key.create(LIST, "Task", "a")));
        Assert.assertEquals(0, this.store.getPutCalls());
        Assert.assertTrue(this.appender.list.isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedAfterCommit() throws Throwable {
        final Transaction tx = this.datastore.beginTransaction();
        tx.commit();
        tx.put(task("a"));
    }

}
