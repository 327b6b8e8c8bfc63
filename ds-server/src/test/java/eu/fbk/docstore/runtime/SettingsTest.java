package eu.fbk.docstore.runtime;

import java.io.File;
import java.util.Properties;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SettingsTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testClasspath() {
        final Settings settings = Settings.load("docstore-test.properties");
        Assert.assertEquals("test-app", settings.get("datastore.app_id"));
        Assert.assertTrue(settings.getBoolean("datastore.require_indexes", false));
    }

    @Test
    public void testFile() throws Throwable {
        final File file = this.folder.newFile("settings.properties");
        Files.asCharSink(file, Charsets.UTF_8).write("a = 1\nb = text \n");
        final Settings settings = Settings.load(file.getAbsolutePath());
        Assert.assertEquals(1, settings.getInt("a", 0));
        Assert.assertEquals("text", settings.get("b"));
        Assert.assertEquals("x", settings.get("c", "x"));
        Assert.assertEquals(7L, settings.getLong("c", 7L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingFile() {
        Settings.load(new File(this.folder.getRoot(), "missing.properties").getPath());
    }

    @Test
    public void testMalformedValues() {
        final Settings settings = Settings.create(ImmutableMap.of("n", "x", "b", "maybe"));
        try {
            settings.getInt("n", 0);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains("n"));
        }
        try {
            settings.getBoolean("b", false);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains("maybe"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequired() {
        final Properties properties = new Properties();
        properties.setProperty("key", "");
        Settings.create(properties).getRequired("key");
    }

}
