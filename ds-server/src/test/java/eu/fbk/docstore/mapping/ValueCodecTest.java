package eu.fbk.docstore.mapping;

import java.util.Date;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Value;
import eu.fbk.docstore.runtime.DataCorruptedException;

public class ValueCodecTest {

    @Test
    public void testScalars() throws Throwable {
        check(Value.ofNull(), "null", null);
        check(Value.of("s"), "string", "s");
        check(Value.ofText("long text"), "text", "long text");
        check(Value.of(7L), "int", 7L);
        check(Value.of(0.5), "double", 0.5);
        check(Value.of(true), "bool", true);
        check(Value.ofTimestamp(1500000L), "timestamp", new Date(1500L));
        check(Value.ofCategory("c"), "category", "c");
        check(Value.ofEmail("a@b.c"), "email", "a@b.c");
        check(Value.ofLink("http://x"), "link", "http://x");
        check(Value.ofPhoneNumber("+39"), "phone", "+39");
        check(Value.ofPostalAddress("Via X"), "postal", "Via X");
        check(Value.ofRating(80), "rating", 80L);
        check(Value.of(Key.create("A", 1L)), "key", KeyCodec.encode(Key.create("A", 1L)));
        check(Value.of(new Value.GeoPt(1.5, -2.0)), "geopt",
                ImmutableMap.of("lat", 1.5, "lon", -2.0));
        check(Value.of(new Value.User("u@x", "x")), "user",
                ImmutableMap.of("email", "u@x", "auth_domain", "x"));
        check(Value.of(new Value.Im("xmpp", "u@x")), "im",
                ImmutableMap.of("protocol", "xmpp", "address", "u@x"));
    }

    @Test
    public void testBlob() throws Throwable {
        final Map<String, Object> document = ValueCodec.encode(Value.of(new byte[] { 1, 2 }));
        Assert.assertEquals("blob", document.get(ValueCodec.TYPE_FIELD));
        Assert.assertArrayEquals(new byte[] { 1, 2 },
                (byte[]) document.get(ValueCodec.VALUE_FIELD));
        Assert.assertEquals(Value.of(new byte[] { 1, 2 }), ValueCodec.decode(document));
    }

    @Test
    public void testTimestampTruncation() throws Throwable {
        final Value decoded = ValueCodec.decode(ValueCodec.encode(Value.ofTimestamp(1234567L)));
        Assert.assertEquals(1234000L, decoded.asTimestamp());
    }

    @Test
    public void testList() throws Throwable {
        final Value list = Value.ofList(ImmutableList.of(1L, "a", Value.ofText("t")));
        final Map<String, Object> document = ValueCodec.encode(list);
        Assert.assertEquals("list", document.get(ValueCodec.TYPE_FIELD));
        Assert.assertEquals(ImmutableList.of(1L, "a", "t"), document.get(ValueCodec.VALUE_FIELD));
        Assert.assertEquals(ImmutableList.of("int", "string", "text"),
                document.get(ValueCodec.ELEMENTS_FIELD));
        Assert.assertEquals(list, ValueCodec.decode(document));
    }

    @Test
    public void testEmptyList() throws Throwable {
        final Value list = Value.ofList(ImmutableList.of());
        final Map<String, Object> document = ValueCodec.encode(list);
        Assert.assertFalse(document.containsKey(ValueCodec.VALUE_FIELD));
        Assert.assertEquals(ImmutableList.of(), document.get(ValueCodec.ELEMENTS_FIELD));
        Assert.assertEquals(list, ValueCodec.decode(document));
    }

    @Test
    public void testCorrupted() {
        final List<Map<String, Object>> documents = ImmutableList.<Map<String, Object>>of(
                ImmutableMap.<String, Object>of("v", 1L),
                ImmutableMap.<String, Object>of("t", "unknown", "v", 1L),
                ImmutableMap.<String, Object>of("t", "int", "v", "x"),
                ImmutableMap.<String, Object>of("t", "string"),
                ImmutableMap.<String, Object>of("t", "key", "v", "bad"),
                ImmutableMap.<String, Object>of("t", "list", "v", ImmutableList.of(1L), "e",
                        ImmutableList.of()),
                ImmutableMap.<String, Object>of("t", "list", "v", ImmutableList.of(1L), "e",
                        ImmutableList.of("list")));
        for (final Map<String, Object> document : documents) {
            try {
                ValueCodec.decode(document);
                Assert.fail("Expected failure for " + document);
            } catch (final DataCorruptedException ex) {
                // expected
            }
        }
    }

    private static void check(final Value value, final String tag, final Object expectedNative)
            throws Throwable {
        final Map<String, Object> document = ValueCodec.encode(value);
        Assert.assertEquals(tag, document.get(ValueCodec.TYPE_FIELD));
        Assert.assertTrue(document.containsKey(ValueCodec.VALUE_FIELD));
        Assert.assertEquals(expectedNative, document.get(ValueCodec.VALUE_FIELD));
        Assert.assertEquals(value, ValueCodec.decode(document));
    }

}
