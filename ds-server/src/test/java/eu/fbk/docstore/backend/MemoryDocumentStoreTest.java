package eu.fbk.docstore.backend;

import java.io.File;
import java.io.IOException;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.docstore.backend.DocumentQuery.Sort;
import eu.fbk.docstore.runtime.DataCorruptedException;

public class MemoryDocumentStoreTest extends AbstractDocumentStoreTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Override
    protected DocumentStore createStore() {
        return new MemoryDocumentStore();
    }

    @Test
    public void testPersistence() throws Throwable {
        final File file = new File(this.folder.getRoot(), "data/store.bin");
        final DocumentIndex index = new DocumentIndex(ImmutableList.of(new Sort("n", false)));

        final MemoryDocumentStore first = new MemoryDocumentStore(file);
        first.init();
        first.put(COLLECTION, doc("a", "n", 1L));
        first.put(COLLECTION, doc("b", "n", 2L));
        first.increment("Counters", "Docs", "last", 2L);
        first.createIndex(COLLECTION, index);
        first.close();
        Assert.assertTrue(file.exists());
        Assert.assertFalse(new File(file.getPath() + ".new").exists());

        final MemoryDocumentStore second = new MemoryDocumentStore(file);
        second.init();
        try {
            Assert.assertEquals(2L, second.count(COLLECTION, DocumentFilter.all()));
            Assert.assertEquals(1L, second.get(COLLECTION, "a").get("n"));
            Assert.assertEquals(3L, second.increment("Counters", "Docs", "last", 1L));
            Assert.assertEquals(ImmutableList.of(index), second.listIndexes(COLLECTION));
        } finally {
            second.close();
        }
    }

    @Test
    public void testSavedOnEveryWrite() throws Throwable {
        final File file = new File(this.folder.getRoot(), "eager.bin");
        final MemoryDocumentStore first = new MemoryDocumentStore(file);
        first.init();
        first.put(COLLECTION, doc("a", "n", 1L));
        first.put(COLLECTION, doc("b", "n", 2L));
        Assert.assertTrue(first.delete(COLLECTION, "b"));
        Assert.assertTrue(file.exists());

        final MemoryDocumentStore second = new MemoryDocumentStore(file);
        second.init();
        try {
            Assert.assertNotNull(second.get(COLLECTION, "a"));
            Assert.assertNull(second.get(COLLECTION, "b"));
        } finally {
            second.close();
        }
    }

    @Test(expected = DataCorruptedException.class)
    public void testCorruptedFile() throws Throwable {
        final File file = this.folder.newFile("corrupted.bin");
        Files.asCharSink(file, Charsets.UTF_8).write("garbage");
        final MemoryDocumentStore store = new MemoryDocumentStore(file);
        try {
            store.init();
        } finally {
            store.close();
        }
    }

    @Test
    public void testDocumentsAreCopied() throws Throwable {
        final Map<String, Object> document = doc("a", "n", 1L);
        getStore().put(COLLECTION, document);
        document.put("n", 2L);
        Assert.assertEquals(1L, getStore().get(COLLECTION, "a").get("n"));
        getStore().get(COLLECTION, "a").put("n", 3L);
        Assert.assertEquals(1L, getStore().get(COLLECTION, "a").get("n"));
    }

    @Test(expected = IllegalStateException.class)
    public void testNotInitialized() throws IOException {
        new MemoryDocumentStore().get(COLLECTION, "a");
    }

}
