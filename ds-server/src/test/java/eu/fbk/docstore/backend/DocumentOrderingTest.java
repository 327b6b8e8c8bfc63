package eu.fbk.docstore.backend;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

public class DocumentOrderingTest {

    @Test
    public void testTypeRanks() {
        final Map<String, Object> document = new LinkedHashMap<String, Object>();
        document.put("a", 1L);
        final List<Object> values = Lists.newArrayList(new Date(0L), true, new byte[] { 0 },
                document, "s", 2.5, null);
        Collections.sort(values, DocumentOrdering.COMPARATOR);
        Assert.assertNull(values.get(0));
        Assert.assertEquals(2.5, values.get(1));
        Assert.assertEquals("s", values.get(2));
        Assert.assertSame(document, values.get(3));
        Assert.assertTrue(values.get(4) instanceof byte[]);
        Assert.assertEquals(Boolean.TRUE, values.get(5));
        Assert.assertEquals(new Date(0L), values.get(6));
    }

    @Test
    public void testWithinRank() {
        Assert.assertTrue(DocumentOrdering.compare(2L, 2.5) < 0);
        Assert.assertEquals(0, DocumentOrdering.compare(2L, 2.0));
        Assert.assertTrue(DocumentOrdering.compare(Long.MAX_VALUE - 1, Long.MAX_VALUE) < 0);
        Assert.assertTrue(DocumentOrdering.compare("Z", "a") < 0);
        Assert.assertTrue(DocumentOrdering.compare("\uffff", "\ud83d\ude00") < 0);
        Assert.assertTrue(DocumentOrdering.compare(new byte[] { (byte) 0xff },
                new byte[] { 0, 0 }) < 0);
        Assert.assertTrue(DocumentOrdering.compare(new byte[] { 1 },
                new byte[] { (byte) 0x80 }) < 0);
        Assert.assertTrue(DocumentOrdering.compare(false, true) < 0);
    }

    @Test
    public void testResolve() {
        final Map<String, Object> inner = new LinkedHashMap<String, Object>();
        inner.put("v", ImmutableList.of(1L, 2L));
        final Map<String, Object> document = new LinkedHashMap<String, Object>();
        document.put("p", inner);
        document.put("n", null);
        Assert.assertEquals(ImmutableList.of(1L, 2L), DocumentOrdering.resolve(document, "p.v"));
        Assert.assertEquals(Collections.singletonList(null), DocumentOrdering.resolve(document,
                "n"));
        Assert.assertTrue(DocumentOrdering.resolve(document, "p.x").isEmpty());
        Assert.assertTrue(DocumentOrdering.exists(document, "n"));
        Assert.assertFalse(DocumentOrdering.exists(document, "n.x"));
        Assert.assertEquals(1L, DocumentOrdering.sortKey(document, "p.v", true));
        Assert.assertEquals(2L, DocumentOrdering.sortKey(document, "p.v", false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedNative() {
        DocumentOrdering.copy(ImmutableList.of(1));
    }

}
