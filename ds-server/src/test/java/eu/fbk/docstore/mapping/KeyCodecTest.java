package eu.fbk.docstore.mapping;

import java.util.List;

import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.docstore.backend.DocumentOrdering;
import eu.fbk.docstore.data.Key;

public class KeyCodecTest {

    @Test
    public void testEncode() {
        Assert.assertEquals("Task\u0002\u00030000000000000000042",
                KeyCodec.encode(Key.create("Task", 42L)));
        Assert.assertEquals("List\u0002\u0004home\u0001Task\u0002\u00030000000000000000001",
                KeyCodec.encode(Key.fromPath("List", "home", "Task", 1L)));
        Assert.assertEquals("List:$home/Task:#0000000000000000001", KeyCodec.printable(KeyCodec
                .encode(Key.fromPath("List", "home", "Task", 1L))));
    }

    @Test
    public void testDecode() {
        final Key key = Key.fromPath("A", Long.MAX_VALUE, "B", "name with spaces", "C", 1L);
        Assert.assertEquals(key, KeyCodec.decode(KeyCodec.encode(key)));
    }

    @Test
    public void testOrderPreserved() {
        final List<Key> keys = Lists.newArrayList(Key.create("A", 2L), Key.fromPath("A", 2L,
                "B", 1L), Key.create("A", 10L), Key.create("A", "a"), Key.create("AB", 1L));
        for (int i = 0; i < keys.size() - 1; ++i) {
            Assert.assertTrue(keys.get(i).compareTo(keys.get(i + 1)) < 0);
            Assert.assertTrue(DocumentOrdering.compare(KeyCodec.encode(keys.get(i)),
                    KeyCodec.encode(keys.get(i + 1))) < 0);
        }
    }

    @Test
    public void testAncestorPrefix() {
        final Key parent = Key.create("List", 1L);
        final String prefix = KeyCodec.ancestorPrefix(parent);
        Assert.assertTrue(KeyCodec.encode(Key.create(parent, "Task", 5L)).startsWith(prefix));
        Assert.assertFalse(KeyCodec.encode(Key.create("List", 10L)).startsWith(prefix));
        Assert.assertFalse(KeyCodec.encode(parent).startsWith(prefix));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompleteKey() {
        KeyCodec.encode(Key.create("Task"));
    }

    @Test
    public void testMalformed() {
        for (final String string : new String[] { "", "Task", "Task\u0002",
                "Task\u0002\u000342", "Task\u0002\u0005x", "\u0002\u0004x",
                "Task\u0002\u0003000000000000000000x" }) {
            try {
                KeyCodec.decode(string);
                Assert.fail("Expected failure for " + KeyCodec.printable(string));
            } catch (final IllegalArgumentException ex) {
                // expected
            }
        }
    }

}
