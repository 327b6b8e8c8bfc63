package eu.fbk.docstore.mongo;

import java.io.IOException;
import java.util.Properties;

import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import eu.fbk.docstore.BackendUnavailableException;
import eu.fbk.docstore.backend.AbstractDocumentStoreTest;
import eu.fbk.docstore.backend.DocumentStore;
import eu.fbk.docstore.runtime.Settings;

/**
 * Runs the document store tests against a live MongoDB instance, enabled by passing
 * {@code -Dmongo.host=<host>} (and optionally {@code -Dmongo.port=<port>}) to the build.
 */
public class MongoDocumentStoreTest extends AbstractDocumentStoreTest {

    private MongoConfigurations configs;

    private String databaseName;

    @Before
    @Override
    public void setUp() throws IOException {
        Assume.assumeTrue(System.getProperty("mongo.host") != null);
        final Properties properties = new Properties();
        properties.setProperty("mongo.host", System.getProperty("mongo.host"));
        properties.setProperty("mongo.port", System.getProperty("mongo.port", "27017"));
        properties.setProperty("mongo.server_selection_timeout", "5000");
        this.configs = new MongoConfigurations(Settings.create(properties));
        this.databaseName = "docstore_test_" + System.nanoTime();
        super.setUp();
    }

    @Override
    protected DocumentStore createStore() {
        return new MongoDocumentStore(this.configs, this.databaseName);
    }

    @After
    @Override
    public void tearDown() throws IOException {
        if (this.configs == null) {
            return;
        }
        try (MongoClient client = MongoClients.create("mongodb://" + this.configs.getHost()
                + ":" + this.configs.getPort())) {
            client.getDatabase(this.databaseName).drop();
        }
        super.tearDown();
    }

    @Test
    public void testUnreachable() throws Throwable {
        final Properties properties = new Properties();
        properties.setProperty("mongo.host", "127.0.0.1");
        properties.setProperty("mongo.port", "1");
        properties.setProperty("mongo.server_selection_timeout", "200");
        final MongoDocumentStore store = new MongoDocumentStore(new MongoConfigurations(Settings
                .create(properties)), "unreachable");
        store.init();
        try {
            store.get("Docs", "a");
            Assert.fail();
        } catch (final BackendUnavailableException ex) {
            Assert.assertEquals("get Docs", ex.getOperation());
        } finally {
            store.close();
        }
    }

}
