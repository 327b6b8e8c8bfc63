package eu.fbk.docstore.mapping;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.DatastoreException;
import eu.fbk.docstore.IndexMissingException;
import eu.fbk.docstore.backend.DocumentIndex;
import eu.fbk.docstore.backend.DocumentQuery.Sort;
import eu.fbk.docstore.backend.DocumentStore;
import eu.fbk.docstore.data.IndexDescriptor;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.data.Query.Filter;
import eu.fbk.docstore.data.Query.Order;

/**
 * Keeps declared composite indexes and physical backend indexes aligned, and checks queries
 * against them.
 * <p>
 * An {@link IndexDescriptor} is realized as a {@link DocumentIndex} on the collection of its kind,
 * with a field {@code p.<property>.v} for each indexed property (or {@code _id} for the
 * {@code __key__} pseudo-property) and the declared directions; the ancestor flag has no physical
 * counterpart. Index metadata read from the backend is cached per collection and refreshed on a
 * miss.
 * </p>
 * <p>
 * In <i>strict</i> mode {@link #ensureIndex(IndexDescriptor)} creates missing indexes and
 * {@link #checkQuery(Query)} rejects queries whose composite index is missing; otherwise both
 * methods do nothing and no index is ever created implicitly.
 * </p>
 */
public final class IndexManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexManager.class);

    private final DocumentStore store;

    private final boolean strict;

    private final Map<String, List<DocumentIndex>> cache;

    public IndexManager(final DocumentStore store, final boolean strict) {
        this.store = Preconditions.checkNotNull(store);
        this.strict = strict;
        this.cache = new ConcurrentHashMap<String, List<DocumentIndex>>();
    }

    public boolean isStrict() {
        return this.strict;
    }

    /**
     * Creates the physical index for a descriptor if missing, when in strict mode.
     *
     * @param descriptor
     *            the index descriptor
     * @throws DatastoreException
     *             on failure
     */
    public void ensureIndex(final IndexDescriptor descriptor) throws DatastoreException {
        if (!this.strict || hasIndex(descriptor)) {
            return;
        }
        final DocumentIndex index = toDocumentIndex(descriptor);
        try {
            this.store.createIndex(descriptor.getKind(), index);
        } catch (final IOException ex) {
            throw wrap(ex, "create index " + index + " for " + descriptor);
        }
        this.cache.remove(descriptor.getKind());
        LOGGER.info("Created index {} on {} for {}", index, descriptor.getKind(), descriptor);
    }

    /**
     * Ensures that all the declared indexes exist (strict mode only).
     *
     * @param descriptors
     *            the declared index descriptors
     * @throws DatastoreException
     *             on failure
     */
    public void reconcile(final Iterable<IndexDescriptor> descriptors) throws DatastoreException {
        int count = 0;
        for (final IndexDescriptor descriptor : descriptors) {
            ensureIndex(descriptor);
            ++count;
        }
        LOGGER.debug("{} declared indexes reconciled (strict={})", count, this.strict);
    }

    /**
     * Checks that the composite index required by a query exists, when in strict mode.
     *
     * @param query
     *            the query to check
     * @throws IndexMissingException
     *             if strict mode is enabled and the required index is missing
     * @throws DatastoreException
     *             on failure to read index metadata
     */
    public void checkQuery(final Query query) throws DatastoreException {
        if (!this.strict) {
            return;
        }
        final IndexDescriptor required = requiredIndex(query);
        if (required != null && !hasIndex(required, equalityPrefix(query))) {
            throw new IndexMissingException("Missing composite index " + required, query
                    .toString());
        }
    }

    /**
     * Returns whether a physical index exists for the descriptor specified.
     *
     * @param descriptor
     *            the descriptor
     * @return true if a matching index exists
     * @throws DatastoreException
     *             on failure to read index metadata
     */
    public boolean hasIndex(final IndexDescriptor descriptor) throws DatastoreException {
        return hasIndex(descriptor, 0);
    }

    /**
     * Returns whether the composite index required by a query, if any, exists.
     *
     * @param query
     *            the query
     * @return true if no composite index is needed or it exists
     * @throws DatastoreException
     *             on failure to read index metadata
     */
    public boolean hasIndexFor(final Query query) throws DatastoreException {
        final IndexDescriptor required = requiredIndex(query);
        return required == null || hasIndex(required, equalityPrefix(query));
    }

    private boolean hasIndex(final IndexDescriptor descriptor, final int equalityPrefix)
            throws DatastoreException {
        final String collection = descriptor.getKind();
        List<DocumentIndex> indexes = this.cache.get(collection);
        if (indexes != null && containsMatch(indexes, descriptor, equalityPrefix)) {
            return true;
        }
        try {
            indexes = ImmutableList.copyOf(this.store.listIndexes(collection));
        } catch (final IOException ex) {
            throw wrap(ex, "list indexes of " + collection);
        }
        this.cache.put(collection, indexes);
        return containsMatch(indexes, descriptor, equalityPrefix);
    }

    private static boolean containsMatch(final List<DocumentIndex> indexes,
            final IndexDescriptor descriptor, final int equalityPrefix) {
        final List<Sort> required = toDocumentIndex(descriptor).getFields();
        for (final DocumentIndex index : indexes) {
            if (matches(index.getFields(), required, equalityPrefix)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(final List<Sort> actual, final List<Sort> required,
            final int equalityPrefix) {
        if (actual.size() != required.size()) {
            return false;
        }
        final Set<String> actualPrefix = Sets.newHashSet();
        final Set<String> requiredPrefix = Sets.newHashSet();
        for (int i = 0; i < equalityPrefix; ++i) {
            actualPrefix.add(actual.get(i).getField());
            requiredPrefix.add(required.get(i).getField());
        }
        if (!actualPrefix.equals(requiredPrefix)) {
            return false;
        }
        return actual.subList(equalityPrefix, actual.size()).equals(
                required.subList(equalityPrefix, required.size()));
    }

    /**
     * Converts an index descriptor to the physical index realizing it.
     *
     * @param descriptor
     *            the descriptor
     * @return the physical index
     */
    public static DocumentIndex toDocumentIndex(final IndexDescriptor descriptor) {
        final List<Sort> fields = Lists.newArrayList();
        for (final Order order : descriptor.getProperties()) {
            fields.add(new Sort(fieldFor(order.getProperty()), order.getDirection()
                    == Direction.ASCENDING));
        }
        return new DocumentIndex(fields);
    }

    /**
     * Computes the composite index a query needs, if any.
     * <p>
     * No composite index is needed for kind-only queries, queries with only equality filters
     * (and possibly an ancestor), and queries filtering or sorting on a single property (or on
     * the key only). Otherwise, the composite index lists the equality-filtered properties, then
     * the inequality-filtered properties not already sorted on, then the sort orders.
     * </p>
     *
     * @param query
     *            the query
     * @return the required index, or null if built-in indexes suffice
     */
    @Nullable
    public static IndexDescriptor requiredIndex(final Query query) {
        final Set<String> equalities = Sets.newLinkedHashSet();
        final Set<String> inequalities = Sets.newLinkedHashSet();
        for (final Filter filter : query.getFilters()) {
            if (!filter.getProperty().equals(Query.KEY_PROPERTY)) {
                (filter.getOperator().isInequality() ? inequalities : equalities).add(filter
                        .getProperty());
            }
        }
        final List<Order> orders = Lists.newArrayList();
        for (final Order order : query.getOrders()) {
            if (!order.getProperty().equals(Query.KEY_PROPERTY)) {
                orders.add(order);
            }
        }
        if (orders.isEmpty() && inequalities.isEmpty()) {
            return null;
        }
        final List<Order> properties = Lists.newArrayList();
        final Set<String> seen = Sets.newHashSet();
        for (final String property : equalities) {
            if (!inequalities.contains(property) && seen.add(property)) {
                properties.add(new Order(property, Direction.ASCENDING));
            }
        }
        for (final String property : inequalities) {
            if (orders.isEmpty() || !orders.get(0).getProperty().equals(property)) {
                if (seen.add(property)) {
                    properties.add(new Order(property, Direction.ASCENDING));
                }
            }
        }
        for (final Order order : orders) {
            if (seen.add(order.getProperty())) {
                properties.add(order);
            }
        }
        if (properties.size() <= 1 && query.getAncestor() == null) {
            return null;
        }
        return new IndexDescriptor(query.getKind(), query.getAncestor() != null, properties);
    }

    private static int equalityPrefix(final Query query) {
        final Set<String> equalities = Sets.newHashSet();
        final Set<String> inequalities = Sets.newHashSet();
        for (final Filter filter : query.getFilters()) {
            if (!filter.getProperty().equals(Query.KEY_PROPERTY)) {
                (filter.getOperator().isInequality() ? inequalities : equalities).add(filter
                        .getProperty());
            }
        }
        equalities.removeAll(inequalities);
        return equalities.size();
    }

    static String fieldFor(final String property) {
        return property.equals(Query.KEY_PROPERTY) ? EntityCodec.ID_FIELD : EntityCodec
                .propertyPath(property);
    }

    private static DatastoreException wrap(final IOException ex, final String operation) {
        if (ex instanceof DatastoreException) {
            return (DatastoreException) ex;
        }
        return new DatastoreException("Index metadata operation failed", operation, ex);
    }

}
