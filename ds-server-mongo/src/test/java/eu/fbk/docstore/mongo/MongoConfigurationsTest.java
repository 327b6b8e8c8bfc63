package eu.fbk.docstore.mongo;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.docstore.runtime.Settings;

public class MongoConfigurationsTest {

    @Test
    public void testDefaults() {
        final MongoConfigurations configs = new MongoConfigurations(Settings
                .create(new Properties()));
        Assert.assertEquals("localhost", configs.getHost());
        Assert.assertEquals(MongoConfigurations.DEFAULT_PORT, configs.getPort());
        Assert.assertEquals(10000, configs.getConnectTimeout());
        Assert.assertEquals(0, configs.getSocketTimeout());
        Assert.assertEquals(30000, configs.getServerSelectionTimeout());
    }

    @Test
    public void testExplicit() {
        final Properties properties = new Properties();
        properties.setProperty("mongo.host", "db.example.org");
        properties.setProperty("mongo.port", "27018");
        properties.setProperty("mongo.server_selection_timeout", "500");
        final MongoConfigurations configs = new MongoConfigurations(Settings.create(properties));
        Assert.assertEquals("db.example.org", configs.getHost());
        Assert.assertEquals(27018, configs.getPort());
        Assert.assertEquals(500, configs.getServerSelectionTimeout());
        Assert.assertTrue(configs.toString().contains("port=27018"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPort() {
        final Properties properties = new Properties();
        properties.setProperty("mongo.port", "70000");
        new MongoConfigurations(Settings.create(properties));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericTimeout() {
        final Properties properties = new Properties();
        properties.setProperty("mongo.connect_timeout", "soon");
        new MongoConfigurations(Settings.create(properties));
    }

}
