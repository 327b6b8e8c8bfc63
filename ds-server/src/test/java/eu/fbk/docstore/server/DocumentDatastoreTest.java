package eu.fbk.docstore.server;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.fbk.docstore.BackendUnavailableException;
import eu.fbk.docstore.IndexMissingException;
import eu.fbk.docstore.UnsupportedQueryException;
import eu.fbk.docstore.UnsupportedTypeException;
import eu.fbk.docstore.backend.InstrumentedDocumentStore;
import eu.fbk.docstore.backend.MemoryDocumentStore;
import eu.fbk.docstore.data.Cursor;
import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.data.Query.Operator;
import eu.fbk.docstore.data.QueryResult;
import eu.fbk.docstore.data.Value;

public class DocumentDatastoreTest {

    private InstrumentedDocumentStore store;

    private DocumentDatastore datastore;

    @Before
    public void setUp() throws Throwable {
        this.datastore = create(false);
    }

    @After
    public void tearDown() {
        this.datastore.close();
    }

    private DocumentDatastore create(final boolean strict, final String... indexes)
            throws Throwable {
        final Properties properties = new Properties();
        properties.setProperty("datastore.app_id", "test-app");
        properties.setProperty("datastore.require_indexes", Boolean.toString(strict));
        for (int i = 0; i < indexes.length; ++i) {
            properties.setProperty("datastore.index." + (i + 1), indexes[i]);
        }
        this.store = new InstrumentedDocumentStore(new MemoryDocumentStore());
        final DocumentDatastore datastore = new DocumentDatastore(this.store,
                DatastoreConfiguration.create(properties));
        datastore.init();
        return datastore;
    }

    private void recreate(final boolean strict, final String... indexes) throws Throwable {
        this.datastore.close();
        this.datastore = create(strict, indexes);
    }

    private List<Key> putTasks(final int count) throws Throwable {
        final List<Key> keys = Lists.newArrayList();
        for (int i = 0; i < count; ++i) {
            final Entity task = new Entity("Task");
            task.set("n", (long) i);
            task.set("group", (long) (i % 3));
            task.set("done", i % 2 == 0);
            task.set("created", (long) (100 - i));
            keys.add(this.datastore.put(task));
        }
        return keys;
    }

    @Test
    public void testPutAllocatesIncreasingIds() throws Throwable {
        final Entity first = new Entity("Task");
        first.set("title", "a");
        first.set("done", false);
        final Key key1 = this.datastore.put(first);
        Assert.assertEquals(Long.valueOf(1L), key1.getId());

        final Entity read = this.datastore.get(key1);
        Assert.assertNotNull(read);
        Assert.assertEquals(key1, read.getKey());
        Assert.assertEquals(2, read.getProperties().size());
        Assert.assertEquals(Value.of("a"), read.get("title"));
        Assert.assertEquals(Value.of(false), read.get("done"));

        final Entity second = new Entity("Task");
        second.set("title", "a");
        second.set("done", false);
        Assert.assertEquals(Long.valueOf(2L), this.datastore.put(second).getId());
    }

    @Test
    public void testIdsNotReusedAfterDelete() throws Throwable {
        final Key key = this.datastore.put(new Entity("Task"));
        this.datastore.delete(key);
        Assert.assertNull(this.datastore.get(key));
        Assert.assertEquals(Long.valueOf(2L), this.datastore.put(new Entity("Task")).getId());
    }

    @Test
    public void testNamedKeysAndReplacement() throws Throwable {
        final Key key = Key.create("Config", "main");
        this.datastore.put(new Entity(key).set("a", 1L).set("b", "x"));
        this.datastore.put(new Entity(key).set("a", 2L));
        final Entity read = this.datastore.get(key);
        Assert.assertEquals(Value.of(2L), read.get("a"));
        Assert.assertFalse(read.has("b"));
    }

    @Test
    public void testBatchOperations() throws Throwable {
        final List<Key> keys = this.datastore.put(ImmutableList.of(new Entity("Task").set("n",
                1L), new Entity("Task").set("n", 2L)));
        Assert.assertEquals(2, keys.size());
        final Key missing = Key.create("Task", 99L);
        final Map<Key, Entity> entities = this.datastore.get(ImmutableList.of(keys.get(0),
                missing, keys.get(1)));
        Assert.assertEquals(ImmutableList.of(keys.get(0), keys.get(1)),
                ImmutableList.copyOf(entities.keySet()));
        this.datastore.delete(keys);
        Assert.assertTrue(this.datastore.get(keys).isEmpty());
    }

    @Test
    public void testMissingKey() throws Throwable {
        Assert.assertNull(this.datastore.get(Key.create("Task", 5L)));
        Assert.assertNull(this.datastore.get(Key.fromPath("List", 1L, "Task", "x")));
    }

    @Test
    public void testInvalidPropertyName() throws Throwable {
        try {
            this.datastore.put(new Entity("Task").set("a.b", 1L));
            Assert.fail();
        } catch (final UnsupportedTypeException ex) {
            Assert.assertNotNull(ex.getOperation());
        }
        Assert.assertEquals(0, this.store.getPutCalls());
    }

    @Test
    public void testAncestorIsolation() throws Throwable {
        final Key list1 = Key.create("List", 1L);
        final Key list10 = Key.create("List", 10L);
        final Key task1 = Key.create(list1, "Task", "t");
        final Key task10 = Key.create(list10, "Task", "t");
        this.datastore.put(new Entity(task1).set("owner", "one"));
        this.datastore.put(new Entity(task10).set("owner", "ten"));
        this.datastore.put(new Entity(Key.create(task1, "Task", "sub")).set("owner", "one"));

        Assert.assertEquals(Value.of("one"), this.datastore.get(task1).get("owner"));
        Assert.assertEquals(Value.of("ten"), this.datastore.get(task10).get("owner"));

        final QueryResult result = this.datastore.run(Query.builder("Task").ancestor(list1)
                .build());
        Assert.assertEquals(2, result.size());
        for (final Entity entity : result) {
            Assert.assertEquals(list1, entity.getKey().getRoot());
        }
        Assert.assertEquals(1, this.datastore.run(Query.builder("Task").ancestor(list10).build())
                .size());
        Assert.assertEquals(3, this.datastore.run(Query.builder("Task").build()).size());
    }

    @Test
    public void testPagination() throws Throwable {
        putTasks(25);
        final Query query = Query.builder("Task").order("n", Direction.DESCENDING).limit(10)
                .build();
        final List<Long> visited = Lists.newArrayList();
        final int[] expectedSizes = { 10, 10, 5 };
        Cursor cursor = null;
        for (int page = 0; page < expectedSizes.length; ++page) {
            final QueryResult result = this.datastore.run(query.toBuilder().cursor(cursor)
                    .build());
            Assert.assertEquals(expectedSizes[page], result.size());
            Assert.assertEquals(page < 2, result.hasMore());
            for (final Entity entity : result) {
                visited.add(entity.get("n").asLong());
            }
            cursor = Cursor.fromWebSafeString(result.getEndCursor().toWebSafeString());
        }
        Assert.assertEquals(25, visited.size());
        for (int i = 0; i < visited.size(); ++i) {
            Assert.assertEquals(24L - i, visited.get(i).longValue());
        }

        final QueryResult empty = this.datastore.run(query.toBuilder().cursor(cursor).build());
        Assert.assertEquals(0, empty.size());
        Assert.assertFalse(empty.hasMore());
        Assert.assertEquals(cursor, empty.getEndCursor());
    }

    @Test
    public void testPaginationWithTies() throws Throwable {
        putTasks(20);
        for (final int pageSize : new int[] { 1, 3, 7, 20 }) {
            final Query query = Query.builder("Task").order("group").limit(pageSize).build();
            final Set<Long> seen = Sets.newHashSet();
            long lastGroup = Long.MIN_VALUE;
            Cursor cursor = null;
            QueryResult result;
            do {
                result = this.datastore.run(query.toBuilder().cursor(cursor).build());
                for (final Entity entity : result) {
                    final long group = entity.get("group").asLong();
                    Assert.assertTrue(group >= lastGroup);
                    lastGroup = group;
                    Assert.assertTrue(seen.add(entity.getKey().getId()));
                }
                cursor = result.getEndCursor();
            } while (result.hasMore());
            Assert.assertEquals(20, seen.size());
        }
    }

    @Test
    public void testOffsetAfterCursor() throws Throwable {
        putTasks(10);
        final QueryResult first = this.datastore.run(Query.builder("Task").order("n").limit(3)
                .build());
        final QueryResult second = this.datastore.run(Query.builder("Task").order("n")
                .cursor(first.getEndCursor()).offset(2).limit(3).build());
        Assert.assertEquals(5L, second.getEntities().get(0).get("n").asLong());
    }

    @Test
    public void testCount() throws Throwable {
        putTasks(25);
        Assert.assertEquals(25L, this.datastore.count(Query.builder("Task").build()));
        Assert.assertEquals(13L, this.datastore.count(Query.builder("Task").filter("done",
                Operator.EQUAL, true).build()));
        Assert.assertEquals(10L, this.datastore.count(Query.builder("Task").offset(5).limit(10)
                .build()));
        Assert.assertEquals(5L, this.datastore.count(Query.builder("Task").offset(20).limit(10)
                .build()));
        Assert.assertEquals(0L, this.datastore.count(Query.builder("Task").offset(30).build()));
    }

    @Test
    public void testFilters() throws Throwable {
        putTasks(10);
        Assert.assertEquals(4, this.datastore.run(Query.builder("Task").filter("n",
                Operator.GREATER_THAN_OR_EQUAL, 6L).build()).size());
        Assert.assertEquals(3, this.datastore.run(Query.builder("Task").in("n",
                ImmutableList.of(1L, 3L, 5L, 42L)).build()).size());
        Assert.assertEquals(9, this.datastore.run(Query.builder("Task").filter("n",
                Operator.NOT_EQUAL, 4L).build()).size());
    }

    private List<String> pageNames(final Query query) throws Throwable {
        final List<String> names = Lists.newArrayList();
        Cursor cursor = null;
        for (int page = 0; page < 20; ++page) {
            final QueryResult result = this.datastore.run(query.toBuilder().cursor(cursor)
                    .build());
            for (final Entity entity : result) {
                names.add(entity.getKey().getName());
            }
            if (!result.hasMore()) {
                break;
            }
            cursor = Cursor.fromWebSafeString(result.getEndCursor().toWebSafeString());
        }
        return names;
    }

    @Test
    public void testPaginationOverListProperty() throws Throwable {
        this.datastore.put(new Entity(Key.create("Task", "a")).set("x", ImmutableList.of(1L, 5L)));
        this.datastore.put(new Entity(Key.create("Task", "b")).set("x", 2L));
        this.datastore.put(new Entity(Key.create("Task", "c")).set("x", 3L));
        this.datastore.put(new Entity(Key.create("Task", "d")).set("x", ImmutableList.of(3L, 4L)));
        this.datastore.put(new Entity(Key.create("Task", "e")).set("x", ImmutableList.of(4L, 1L)));

        // descending by max element, ascending by min element, ties by key
        final List<String> descending = ImmutableList.of("a", "d", "e", "c", "b");
        final List<String> ascending = ImmutableList.of("a", "e", "b", "c", "d");
        for (final int size : new int[] { 1, 2, 10 }) {
            Assert.assertEquals(descending, pageNames(Query.builder("Task").order("x",
                    Direction.DESCENDING).limit(size).build()));
            Assert.assertEquals(ascending, pageNames(Query.builder("Task").order("x",
                    Direction.ASCENDING).limit(size).build()));
        }
    }

    @Test
    public void testPaginationOverLongStrings() throws Throwable {
        for (final String name : new String[] { "a", "b", "c" }) {
            this.datastore.put(new Entity(Key.create("Task", name)).set("title", Strings
                    .repeat(name, 70000)));
        }
        Assert.assertEquals(ImmutableList.of("a", "b", "c"), pageNames(Query.builder("Task")
                .order("title", Direction.ASCENDING).limit(1).build()));
    }

    @Test
    public void testQueryHistoryIgnoresCursor() throws Throwable {
        putTasks(25);
        final Query query = Query.builder("Task").order("n", Direction.DESCENDING).limit(10)
                .build();
        Assert.assertEquals(25, pageNames(query).size());
        Assert.assertEquals(ImmutableMap.of(query, 3), this.datastore.getQueryHistory());
    }

    @Test
    public void testQueryHistory() throws Throwable {
        putTasks(3);
        final Query query = Query.builder("Task").filter("done", Operator.EQUAL, true).build();
        this.datastore.run(query);
        this.datastore.run(query);
        Assert.assertEquals(Integer.valueOf(2), this.datastore.getQueryHistory().get(query));

        final Query invalid = Query.builder("Task").filter("n", Operator.LESS_THAN, 3L)
                .filter("created", Operator.GREATER_THAN, 1L).build();
        try {
            this.datastore.run(invalid);
            Assert.fail();
        } catch (final UnsupportedQueryException ex) {
            // expected
        }
        Assert.assertFalse(this.datastore.getQueryHistory().containsKey(invalid));
    }

    @Test
    public void testStrictModeMissingIndex() throws Throwable {
        recreate(true);
        putTasks(6);
        final Query query = Query.builder("Task").filter("done", Operator.EQUAL, true)
                .order("created", Direction.DESCENDING).build();
        try {
            this.datastore.run(query);
            Assert.fail();
        } catch (final IndexMissingException ex) {
            Assert.assertEquals(query.toString(), ex.getOperation());
        }
        Assert.assertEquals(0, this.store.getFindCalls());
    }

    @Test
    public void testNonStrictModeExecutesWithoutIndex() throws Throwable {
        putTasks(6);
        final Query query = Query.builder("Task").filter("done", Operator.EQUAL, true)
                .order("created", Direction.DESCENDING).build();
        final QueryResult result = this.datastore.run(query);
        Assert.assertEquals(3, result.size());
        long last = Long.MAX_VALUE;
        for (final Entity entity : result) {
            Assert.assertTrue(entity.get("done").asBoolean());
            final long created = entity.get("created").asLong();
            Assert.assertTrue(created < last);
            last = created;
        }
    }

    @Test
    public void testStrictModeWithDeclaredIndex() throws Throwable {
        recreate(true, "Task ancestor: done, created desc");
        putTasks(6);
        final Query query = Query.builder("Task").filter("done", Operator.EQUAL, false)
                .order("created", Direction.DESCENDING).build();
        Assert.assertEquals(3, this.datastore.run(query).size());
        Assert.assertEquals(1, this.store.getFindCalls());
    }

    @Test
    public void testBackendOutage() throws Throwable {
        final Key key = this.datastore.put(new Entity("Task"));
        this.store.setUnavailable(true);
        try {
            this.datastore.get(key);
            Assert.fail();
        } catch (final BackendUnavailableException ex) {
            Assert.assertEquals("get " + key, ex.getOperation());
        }
        try {
            this.datastore.put(new Entity("Task"));
            Assert.fail();
        } catch (final BackendUnavailableException ex) {
            Assert.assertNotNull(ex.getOperation());
        }
        this.store.setUnavailable(false);
        Assert.assertNotNull(this.datastore.get(key));
    }

    @Test
    public void testAllocateIds() throws Throwable {
        final Key parent = Key.create("List", 1L);
        final List<Key> keys = this.datastore.allocateIds(parent, "Task", 3);
        Assert.assertEquals(3, keys.size());
        for (int i = 0; i < 3; ++i) {
            Assert.assertEquals(Long.valueOf(i + 1), keys.get(i).getId());
            Assert.assertEquals(parent, keys.get(i).getParent());
        }
        Assert.assertEquals(Long.valueOf(4L), this.datastore.put(new Entity("Task")).getId());
    }

    @Test(expected = IllegalStateException.class)
    public void testClosed() throws Throwable {
        this.datastore.close();
        this.datastore.get(Key.create("Task", 1L));
    }

}
