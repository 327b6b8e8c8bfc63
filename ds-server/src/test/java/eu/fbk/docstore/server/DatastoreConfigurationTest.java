package eu.fbk.docstore.server;

import java.util.Properties;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.docstore.data.IndexDescriptor;
import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.mapping.IdAllocator;

public class DatastoreConfigurationTest {

    @Test
    public void testLoad() {
        final DatastoreConfiguration configuration = DatastoreConfiguration
                .load("docstore-test.properties");
        Assert.assertEquals("test-app", configuration.getAppId());
        Assert.assertTrue(configuration.isRequireIndexes());
        Assert.assertEquals("__ids__", configuration.getCountersCollection());
        Assert.assertTrue(configuration.isLogCalls());
        Assert.assertEquals(ImmutableList.of(
                IndexDescriptor.create("Task", true, "done", Direction.ASCENDING, "created",
                        Direction.DESCENDING),
                IndexDescriptor.create("Task", false, "priority", Direction.ASCENDING,
                        "created", Direction.DESCENDING)), configuration.getIndexes());
    }

    @Test
    public void testDefaults() {
        final Properties properties = new Properties();
        properties.setProperty("datastore.app_id", "app");
        final DatastoreConfiguration configuration = DatastoreConfiguration.create(properties);
        Assert.assertFalse(configuration.isRequireIndexes());
        Assert.assertFalse(configuration.isLogCalls());
        Assert.assertEquals(IdAllocator.DEFAULT_COLLECTION,
                configuration.getCountersCollection());
        Assert.assertTrue(configuration.getIndexes().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingAppId() {
        DatastoreConfiguration.create(new Properties());
    }

    @Test
    public void testParseIndex() {
        Assert.assertEquals(IndexDescriptor.create("Task", false, "a", Direction.ASCENDING),
                DatastoreConfiguration.parseIndex("Task: a"));
        for (final String declaration : new String[] { "Task a", "Task: ", "Task foo: a",
                "Task: a sideways", ": a", "Task: a asc desc" }) {
            try {
                DatastoreConfiguration.parseIndex(declaration);
                Assert.fail("Expected failure for " + declaration);
            } catch (final IllegalArgumentException ex) {
                // expected
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidIndexSetting() {
        final Properties properties = new Properties();
        properties.setProperty("datastore.app_id", "app");
        properties.setProperty("datastore.index.1", "Task");
        DatastoreConfiguration.create(properties);
    }

}
