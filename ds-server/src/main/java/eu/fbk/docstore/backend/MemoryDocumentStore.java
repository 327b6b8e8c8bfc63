package eu.fbk.docstore.backend;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.backend.DocumentQuery.Sort;
import eu.fbk.docstore.runtime.DataCorruptedException;

/**
 * A {@code DocumentStore} implementation that keeps all documents in memory, with optional
 * persistence provided by loading / saving data to file.
 * <p>
 * This class realizes a low-performance, functional implementation of the {@code DocumentStore}
 * component, useful for testing and for running without a document store server. Filter, sort
 * and counter semantics mimic the ones of a document store (see {@link DocumentFilter} and
 * {@link DocumentOrdering}); indexes are only recorded, as every query is answered with a full
 * scan. If a file is configured, data is loaded from it at initialization and written back after
 * every modification, going through a temporary file that replaces the previous one only once
 * completely written.
 * </p>
 */
public class MemoryDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryDocumentStore.class);

    private final Map<String, TreeMap<String, Map<String, Object>>> collections;

    private final Map<String, Set<DocumentIndex>> indexes;

    @Nullable
    private final File file;

    private boolean initialized;

    private boolean closed;

    private boolean dirty;

    /**
     * Creates a new {@code MemoryDocumentStore} instance without persistence.
     */
    public MemoryDocumentStore() {
        this(null);
    }

    /**
     * Creates a new {@code MemoryDocumentStore} instance loading/storing data in the file
     * specified.
     *
     * @param file
     *            the file where to read/write data, null to disable persistence
     */
    public MemoryDocumentStore(@Nullable final File file) {
        this.collections = Maps.newHashMap();
        this.indexes = Maps.newHashMap();
        this.file = file == null ? null : file.getAbsoluteFile();
        this.initialized = false;
        this.closed = false;
        LOGGER.info("{} configured, file={}", getClass().getSimpleName(), this.file);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);

        if (this.file == null || !this.file.exists()) {
            this.initialized = true;
            LOGGER.info("{} initialized, no document loaded", getClass().getSimpleName());
            return;
        }

        final Map<String, Object> data;
        try (ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(
                new FileInputStream(this.file)))) {
            data = (Map<String, Object>) in.readObject();
        } catch (final ClassNotFoundException | ClassCastException | ObjectStreamException ex) {
            throw new DataCorruptedException("Invalid data file " + this.file, ex);
        }

        int count = 0;
        for (final Map.Entry<String, Object> entry : ((Map<String, Object>) data
                .get("collections")).entrySet()) {
            final TreeMap<String, Map<String, Object>> documents = getCollection(entry.getKey());
            for (final Map<String, Object> document : (List<Map<String, Object>>) entry
                    .getValue()) {
                documents.put((String) document.get(ID_FIELD), document);
                ++count;
            }
        }
        for (final Map.Entry<String, Object> entry : ((Map<String, Object>) data.get("indexes"))
                .entrySet()) {
            for (final List<Object> fields : (List<List<Object>>) entry.getValue()) {
                final List<Sort> sorts = Lists.newArrayList();
                for (int i = 0; i < fields.size(); i += 2) {
                    sorts.add(new Sort((String) fields.get(i), (Boolean) fields.get(i + 1)));
                }
                getIndexes(entry.getKey()).add(new DocumentIndex(sorts));
            }
        }
        this.initialized = true;
        LOGGER.info("{} initialized, {} documents loaded from {}", getClass().getSimpleName(),
                count, this.file);
    }

    @Nullable
    @Override
    public synchronized Map<String, Object> get(final String collection, final String id)
            throws IOException {
        checkActive();
        final TreeMap<String, Map<String, Object>> documents = this.collections.get(collection);
        return documents == null ? null : copy(documents.get(id));
    }

    @Override
    public synchronized void put(final String collection, final Map<String, Object> document)
            throws IOException {
        checkActive();
        final Object id = document.get(ID_FIELD);
        Preconditions.checkArgument(id instanceof String, "Missing or invalid %s", ID_FIELD);
        getCollection(collection).put((String) id, copy(document));
        modified();
    }

    @Override
    public synchronized boolean delete(final String collection, final String id)
            throws IOException {
        checkActive();
        final TreeMap<String, Map<String, Object>> documents = this.collections.get(collection);
        if (documents == null || documents.remove(id) == null) {
            return false;
        }
        modified();
        return true;
    }

    @Override
    public synchronized List<Map<String, Object>> find(final String collection,
            final DocumentQuery query) throws IOException {
        checkActive();
        final List<Map<String, Object>> matches = select(collection, query.getFilter());
        if (!query.getSorts().isEmpty()) {
            Collections.sort(matches, comparator(query.getSorts()));
        }
        final int from = Math.min(query.getSkip(), matches.size());
        final int to = query.getLimit() == null ? matches.size() : (int) Math.min(
                (long) from + query.getLimit(), matches.size());
        final List<Map<String, Object>> result = Lists.newArrayListWithCapacity(to - from);
        for (final Map<String, Object> document : matches.subList(from, to)) {
            result.add(copy(document));
        }
        return result;
    }

    @Override
    public synchronized long count(final String collection, final DocumentFilter filter)
            throws IOException {
        checkActive();
        return select(collection, filter).size();
    }

    @Override
    public synchronized long increment(final String collection, final String id,
            final String field, final long delta) throws IOException {
        checkActive();
        final TreeMap<String, Map<String, Object>> documents = getCollection(collection);
        Map<String, Object> document = documents.get(id);
        if (document == null) {
            document = new LinkedHashMap<String, Object>();
            document.put(ID_FIELD, id);
            documents.put(id, document);
        }
        final Object current = document.get(field);
        if (current != null && !(current instanceof Long)) {
            throw new DataCorruptedException("Non-integer field " + field + " in " + collection
                    + "/" + id + ": " + current);
        }
        final long value = (current == null ? 0L : (Long) current) + delta;
        document.put(field, value);
        modified();
        return value;
    }

    @Override
    public synchronized List<DocumentIndex> listIndexes(final String collection)
            throws IOException {
        checkActive();
        final Set<DocumentIndex> set = this.indexes.get(collection);
        return set == null ? ImmutableList.<DocumentIndex>of() : ImmutableList.copyOf(set);
    }

    @Override
    public synchronized void createIndex(final String collection, final DocumentIndex index)
            throws IOException {
        checkActive();
        if (getIndexes(collection).add(index)) {
            LOGGER.info("{} - created index {} on {}", this, index, collection);
            modified();
        }
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.initialized && this.dirty) {
            try {
                save();
            } catch (final IOException ex) {
                LOGGER.error(getClass().getSimpleName() + " - failed to save data to "
                        + this.file, ex);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private void modified() throws IOException {
        if (this.file != null) {
            this.dirty = true;
            save();
        }
    }

    private void save() throws IOException {
        final Map<String, Object> collectionData = Maps.newHashMap();
        int count = 0;
        for (final Map.Entry<String, TreeMap<String, Map<String, Object>>> entry : this.collections
                .entrySet()) {
            collectionData.put(entry.getKey(), Lists.newArrayList(entry.getValue().values()));
            count += entry.getValue().size();
        }
        final Map<String, Object> indexData = Maps.newHashMap();
        for (final Map.Entry<String, Set<DocumentIndex>> entry : this.indexes.entrySet()) {
            final List<List<Object>> list = Lists.newArrayList();
            for (final DocumentIndex index : entry.getValue()) {
                final List<Object> fields = Lists.newArrayList();
                for (final Sort sort : index.getFields()) {
                    fields.add(sort.getField());
                    fields.add(sort.isAscending());
                }
                list.add(fields);
            }
            indexData.put(entry.getKey(), list);
        }
        final Map<String, Object> data = Maps.newHashMap();
        data.put("collections", collectionData);
        data.put("indexes", indexData);

        final File tmp = new File(this.file.getPath() + ".new");
        Files.createParentDirs(this.file);
        try (ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(
                new FileOutputStream(tmp)))) {
            out.writeObject(data);
        }
        if (this.file.exists() && !this.file.delete()) {
            throw new IOException("Cannot replace " + this.file);
        }
        Files.move(tmp, this.file);
        this.dirty = false;
        LOGGER.debug("{} - {} documents saved to {}", this, count, this.file);
    }

    private void checkActive() {
        Preconditions.checkState(this.initialized && !this.closed, "%s not active", this);
    }

    private TreeMap<String, Map<String, Object>> getCollection(final String collection) {
        TreeMap<String, Map<String, Object>> documents = this.collections.get(collection);
        if (documents == null) {
            documents = new TreeMap<String, Map<String, Object>>(new Comparator<String>() {

                @Override
                public int compare(final String first, final String second) {
                    return DocumentOrdering.compare(first, second);
                }

            });
            this.collections.put(collection, documents);
        }
        return documents;
    }

    private Set<DocumentIndex> getIndexes(final String collection) {
        Set<DocumentIndex> set = this.indexes.get(collection);
        if (set == null) {
            set = new LinkedHashSet<DocumentIndex>();
            this.indexes.put(collection, set);
        }
        return set;
    }

    private List<Map<String, Object>> select(final String collection,
            final DocumentFilter filter) {
        final List<Map<String, Object>> result = Lists.newArrayList();
        final TreeMap<String, Map<String, Object>> documents = this.collections.get(collection);
        if (documents != null) {
            for (final Map<String, Object> document : documents.values()) {
                if (matches(document, filter)) {
                    result.add(document);
                }
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    @Nullable
    private static Map<String, Object> copy(@Nullable final Map<String, Object> document) {
        return document == null ? null : (Map<String, Object>) DocumentOrdering.copy(document);
    }

    private static Comparator<Map<String, Object>> comparator(final List<Sort> sorts) {
        return new Comparator<Map<String, Object>>() {

            @Override
            public int compare(final Map<String, Object> first, final Map<String, Object> second) {
                for (final Sort sort : sorts) {
                    final Object v1 = DocumentOrdering.sortKey(first, sort.getField(),
                            sort.isAscending());
                    final Object v2 = DocumentOrdering.sortKey(second, sort.getField(),
                            sort.isAscending());
                    final int result = DocumentOrdering.compare(v1, v2);
                    if (result != 0) {
                        return sort.isAscending() ? result : -result;
                    }
                }
                return 0;
            }

        };
    }

    static boolean matches(final Map<String, Object> document, final DocumentFilter filter) {
        switch (filter.getKind()) {
        case ALL:
            return true;
        case AND:
            for (final DocumentFilter child : filter.getChildren()) {
                if (!matches(document, child)) {
                    return false;
                }
            }
            return true;
        case OR:
            for (final DocumentFilter child : filter.getChildren()) {
                if (matches(document, child)) {
                    return true;
                }
            }
            return false;
        case NOT:
            return !matches(document, filter.getChildren().get(0));
        case EXISTS:
            return DocumentOrdering.exists(document, filter.getField()) == Boolean.TRUE
                    .equals(filter.getValue());
        case EQ:
            return matchesEqual(document, filter.getField(), filter.getValue());
        case NE:
            return !matchesEqual(document, filter.getField(), filter.getValue());
        case IN:
            for (final Object value : filter.getValues()) {
                if (matchesEqual(document, filter.getField(), value)) {
                    return true;
                }
            }
            return false;
        default:
            for (final Object value : DocumentOrdering.resolve(document, filter.getField())) {
                if (matchesValue(value, filter.getKind(), filter.getValue())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static boolean matchesEqual(final Map<String, Object> document, final String field,
            @Nullable final Object operand) {
        final List<Object> values = DocumentOrdering.resolve(document, field);
        if (operand == null && values.isEmpty()) {
            return true;
        }
        for (final Object value : values) {
            if (DocumentOrdering.compare(value, operand) == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesValue(@Nullable final Object value,
            final DocumentFilter.Kind kind, @Nullable final Object operand) {
        switch (kind) {
        case AFTER:
            return DocumentOrdering.compare(value, operand) > 0;
        case BEFORE:
            return DocumentOrdering.compare(value, operand) < 0;
        case PREFIX:
            return value instanceof String && ((String) value).startsWith((String) operand);
        default:
            if (DocumentOrdering.rank(value) != DocumentOrdering.rank(operand)
                    || value == null) {
                return false;
            }
            final int result = DocumentOrdering.compare(value, operand);
            switch (kind) {
            case LT:
                return result < 0;
            case LTE:
                return result <= 0;
            case GT:
                return result > 0;
            case GTE:
                return result >= 0;
            default:
                throw new IllegalArgumentException("Unexpected filter kind " + kind);
            }
        }
    }

}
