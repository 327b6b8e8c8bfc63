package eu.fbk.docstore.data;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

public class KeyTest {

    @Test
    public void testAccessors() {
        final Key parent = Key.create("Parent", 7L);
        final Key child = Key.create(parent, "Child", "c1");
        Assert.assertEquals("Child", child.getKind());
        Assert.assertEquals("c1", child.getName());
        Assert.assertNull(child.getId());
        Assert.assertEquals(parent, child.getParent());
        Assert.assertEquals(parent, child.getRoot());
        Assert.assertSame(parent, parent.getRoot());
        Assert.assertNull(parent.getParent());
        Assert.assertTrue(parent.isAncestorOf(child));
        Assert.assertTrue(child.isAncestorOf(child));
        Assert.assertFalse(child.isAncestorOf(parent));
        Assert.assertEquals(child, Key.fromPath("Parent", 7, "Child", "c1"));
        Assert.assertEquals("Parent(7)/Child('c1')", child.toString());
    }

    @Test
    public void testIncomplete() {
        final Key incomplete = Key.createIncomplete(Key.create("A", "a"), "B");
        Assert.assertFalse(incomplete.isComplete());
        final Key complete = incomplete.withId(42L);
        Assert.assertTrue(complete.isComplete());
        Assert.assertEquals(Long.valueOf(42L), complete.getId());
        Assert.assertEquals(incomplete.getParent(), complete.getParent());
        try {
            complete.withId(43L);
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompleteParentRejected() {
        Key.create(Key.create("A"), "B", 1L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReservedKindRejected() {
        Key.create("__Stat", 1L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveIdRejected() {
        Key.create("A", 0L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testControlCharacterRejected() {
        Key.create("A", "bad\u0001name");
    }

    @Test
    public void testOrdering() {
        final List<Key> keys = Lists.newArrayList(Key.create("B", 1L), Key.create("A", "z"),
                Key.fromPath("A", 2L, "C", 1L), Key.create("A", 10L), Key.create("A", 2L));
        Collections.sort(keys);
        Assert.assertEquals(Lists.newArrayList(Key.create("A", 2L),
                Key.fromPath("A", 2L, "C", 1L), Key.create("A", 10L), Key.create("A", "z"),
                Key.create("B", 1L)), keys);
    }

}
