package eu.fbk.docstore.mapping;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import eu.fbk.docstore.DatastoreException;
import eu.fbk.docstore.UnsupportedQueryException;
import eu.fbk.docstore.UnsupportedTypeException;
import eu.fbk.docstore.backend.DocumentFilter;
import eu.fbk.docstore.backend.DocumentOrdering;
import eu.fbk.docstore.backend.DocumentQuery;
import eu.fbk.docstore.backend.DocumentQuery.Sort;
import eu.fbk.docstore.data.Cursor;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.data.Query.Filter;
import eu.fbk.docstore.data.Query.Operator;
import eu.fbk.docstore.data.Query.Order;
import eu.fbk.docstore.data.Value;
import eu.fbk.docstore.runtime.DataCorruptedException;

/**
 * Translates datastore {@link Query}s into backend {@link DocumentQuery}s.
 * <p>
 * Filters are mapped onto the {@code p.<property>.v} field of the kind collection, or onto
 * {@code _id} for the {@code __key__} pseudo-property. Only entities where each filtered or
 * sorted property exists with an indexed value type (not {@code TEXT} nor {@code BLOB}) can match.
 * Sort orders are followed by an ascending key order, unless the key order is already present,
 * making the order total and cursors deterministic. An ancestor restricts the results to the
 * documents whose identifier equals the encoded ancestor or starts with its
 * {@link KeyCodec#ancestorPrefix(Key) prefix}. A cursor restricts the results to the documents
 * strictly following the cursor position in the effective sort order.
 * </p>
 * <p>
 * Queries that cannot be answered are rejected with {@link UnsupportedQueryException}: filters on
 * unindexed values, lists or null range operands, inequality filters on multiple properties
 * without a matching composite index, offsets above {@value #MAX_OFFSET}, more than
 * {@value #MAX_COMPONENTS} filters, orders and ancestor in total, and cursors not produced for
 * the same kind and sort orders.
 * </p>
 */
public final class QueryTranslator {

    /** Maximum supported query offset. */
    public static final int MAX_OFFSET = 1000;

    /** Maximum number of filters, sort orders and ancestor in a query. */
    public static final int MAX_COMPONENTS = 100;

    private final IndexManager indexManager;

    public QueryTranslator(final IndexManager indexManager) {
        this.indexManager = Preconditions.checkNotNull(indexManager);
    }

    /**
     * Translates a query.
     *
     * @param query
     *            the query to translate
     * @return the translated query
     * @throws UnsupportedQueryException
     *             if the query cannot be translated
     * @throws DatastoreException
     *             on failure to read index metadata
     */
    public TranslatedQuery translate(final Query query) throws DatastoreException {

        final String operation = query.toString();
        final int components = query.getFilters().size() + query.getOrders().size()
                + (query.getAncestor() == null ? 0 : 1);
        if (components > MAX_COMPONENTS) {
            throw new UnsupportedQueryException("Too many query components (" + components
                    + " > " + MAX_COMPONENTS + ")", operation);
        }
        if (query.getOffset() > MAX_OFFSET) {
            throw new UnsupportedQueryException("Query offset " + query.getOffset()
                    + " exceeds maximum " + MAX_OFFSET, operation);
        }

        final List<DocumentFilter> conjuncts = Lists.newArrayList();
        final Set<String> constrained = Sets.newLinkedHashSet();
        final Set<String> inequalities = Sets.newHashSet();

        for (final Filter filter : query.getFilters()) {
            conjuncts.add(translateFilter(query.getKind(), filter, operation));
            if (!filter.getProperty().equals(Query.KEY_PROPERTY)) {
                constrained.add(filter.getProperty());
                if (filter.getOperator().isInequality()) {
                    inequalities.add(filter.getProperty());
                }
            }
        }
        if (inequalities.size() > 1 && !this.indexManager.hasIndexFor(query)) {
            throw new UnsupportedQueryException("Inequality filters on multiple properties "
                    + inequalities + " require a composite index", operation);
        }

        final Key ancestor = query.getAncestor();
        if (ancestor != null) {
            final String id = KeyCodec.encode(ancestor);
            final String prefix = KeyCodec.ancestorPrefix(ancestor);
            conjuncts.add(DocumentFilter.or(DocumentFilter.eq(EntityCodec.ID_FIELD, id),
                    DocumentFilter.prefix(EntityCodec.ID_FIELD, prefix)));
        }

        final List<Order> orders = Lists.newArrayList();
        final List<Sort> sorts = Lists.newArrayList();
        boolean keyOrdered = false;
        for (final Order order : query.getOrders()) {
            final String property = order.getProperty();
            if (property.equals(Query.KEY_PROPERTY)) {
                keyOrdered = true;
            } else {
                checkProperty(query.getKind(), property, operation);
                constrained.add(property);
            }
            orders.add(order);
            sorts.add(new Sort(IndexManager.fieldFor(property),
                    order.getDirection() == Direction.ASCENDING));
        }
        if (!keyOrdered) {
            orders.add(new Order(Query.KEY_PROPERTY, Direction.ASCENDING));
            sorts.add(new Sort(EntityCodec.ID_FIELD, true));
        }

        for (final String property : constrained) {
            conjuncts.add(indexed(property));
        }

        final Cursor cursor = query.getCursor();
        if (cursor != null) {
            conjuncts.add(translateCursor(query.getKind(), cursor, sorts, operation));
        }

        final DocumentQuery documentQuery = new DocumentQuery(DocumentFilter.and(conjuncts),
                sorts, query.getOffset(), query.getLimit());
        return new TranslatedQuery(query, query.getKind(), documentQuery, orders);
    }

    /**
     * Builds the cursor pointing after a document returned by a translated query.
     *
     * @param query
     *            the translated query
     * @param document
     *            the last returned document
     * @return the end cursor
     * @throws DataCorruptedException
     *             if the document cannot be decoded
     */
    public static Cursor endCursor(final TranslatedQuery query,
            final Map<String, Object> document) throws DataCorruptedException {
        final Object id = document.get(EntityCodec.ID_FIELD);
        final Key key;
        try {
            key = KeyCodec.decode((String) id);
        } catch (final ClassCastException | NullPointerException | IllegalArgumentException ex) {
            throw new DataCorruptedException("Invalid document id " + id, ex);
        }
        final Object properties = document.get(EntityCodec.PROPERTIES_FIELD);
        final List<Value> values = Lists.newArrayList();
        for (final Order order : query.getOrders()) {
            if (order.getProperty().equals(Query.KEY_PROPERTY)) {
                values.add(Value.of(key));
                continue;
            }
            final Object property = properties instanceof Map<?, ?> ? ((Map<?, ?>) properties)
                    .get(order.getProperty()) : null;
            if (!(property instanceof Map<?, ?>)) {
                throw new DataCorruptedException("Sort property " + order.getProperty()
                        + " missing in " + key);
            }
            final Value value = ValueCodec.decode((Map<?, ?>) property);
            values.add(value.getType() != Value.Type.LIST ? value : sortElement(value
                    .asList(), order.getDirection() == Direction.ASCENDING));
        }
        return new Cursor(key, values);
    }

    private static Value sortElement(final List<Value> elements, final boolean ascending) {
        Value result = Value.ofNull();
        Object resultNative = null;
        boolean first = true;
        for (final Value element : elements) {
            final Object elementNative = ValueCodec.encodeNative(element);
            final int comparison = DocumentOrdering.compare(elementNative, resultNative);
            if (first || (ascending ? comparison < 0 : comparison > 0)) {
                result = element;
                resultNative = elementNative;
                first = false;
            }
        }
        return result;
    }

    private static DocumentFilter translateFilter(final String kind, final Filter filter,
            final String operation) throws UnsupportedQueryException {

        final String property = filter.getProperty();
        final boolean isKey = property.equals(Query.KEY_PROPERTY);
        if (!isKey) {
            checkProperty(kind, property, operation);
        }
        final String field = IndexManager.fieldFor(property);

        final List<Object> operands = Lists.newArrayList();
        for (final Value value : filter.getValues()) {
            if (isKey && value.getType() != Value.Type.KEY) {
                throw new UnsupportedQueryException("Filter on " + Query.KEY_PROPERTY
                        + " requires a key value, got " + value, operation);
            } else if (value.getType() == Value.Type.LIST) {
                throw new UnsupportedQueryException("List values cannot be used in filters",
                        operation);
            } else if (!value.getType().isIndexed()) {
                throw new UnsupportedQueryException("Unindexed " + value.getType()
                        + " values cannot be used in filters", operation);
            }
            operands.add(ValueCodec.encodeNative(value));
        }

        final Operator operator = filter.getOperator();
        final Object operand = operands.get(0);
        if (operand == null && operator != Operator.EQUAL && operator != Operator.NOT_EQUAL
                && operator != Operator.IN) {
            throw new UnsupportedQueryException("Null operand not supported for operator "
                    + operator, operation);
        }

        switch (operator) {
        case EQUAL:
            return DocumentFilter.eq(field, operand);
        case NOT_EQUAL:
            return DocumentFilter.ne(field, operand);
        case LESS_THAN:
            return DocumentFilter.lt(field, operand);
        case LESS_THAN_OR_EQUAL:
            return DocumentFilter.lte(field, operand);
        case GREATER_THAN:
            return DocumentFilter.gt(field, operand);
        case GREATER_THAN_OR_EQUAL:
            return DocumentFilter.gte(field, operand);
        case IN:
            return DocumentFilter.in(field, operands);
        default:
            throw new UnsupportedQueryException("Unsupported operator " + operator, operation);
        }
    }

    private static DocumentFilter translateCursor(final String kind, final Cursor cursor,
            final List<Sort> sorts, final String operation) throws UnsupportedQueryException {

        if (!cursor.getKey().getKind().equals(kind)) {
            throw new UnsupportedQueryException("Cursor for kind "
                    + cursor.getKey().getKind() + " used in query for kind " + kind, operation);
        }
        final List<Value> values = cursor.getSortValues();
        if (values.size() != sorts.size()) {
            throw new UnsupportedQueryException("Cursor has " + values.size()
                    + " sort values, query has " + sorts.size() + " sort orders", operation);
        }

        final List<Object> natives = Lists.newArrayList();
        for (final Value value : values) {
            try {
                natives.add(ValueCodec.encodeNative(value));
            } catch (final UnsupportedTypeException ex) {
                throw new UnsupportedQueryException("Invalid cursor value " + value, operation,
                        ex);
            }
        }

        final List<DocumentFilter> disjuncts = Lists.newArrayList();
        for (int i = 0; i < sorts.size(); ++i) {
            final List<DocumentFilter> conjuncts = Lists.newArrayList();
            for (int j = 0; j < i; ++j) {
                conjuncts.add(tieWith(sorts.get(j), natives.get(j)));
            }
            conjuncts.add(strictlyAfter(sorts.get(i), natives.get(i)));
            disjuncts.add(DocumentFilter.and(conjuncts));
            if (sorts.get(i).getField().equals(EntityCodec.ID_FIELD)) {
                break; // key order is total
            }
        }
        return DocumentFilter.or(disjuncts);
    }

    // Sort keys of array fields are their min (ascending) or max (descending) element, so
    // cursor predicates must constrain all elements, not just one of them.

    private static DocumentFilter strictlyAfter(final Sort sort, @Nullable final Object value) {
        final String field = sort.getField();
        if (field.equals(EntityCodec.ID_FIELD)) {
            return DocumentFilter.after(field, value);
        }
        final DocumentFilter notAfter = sort.isAscending() ? DocumentFilter.before(field, value)
                : DocumentFilter.after(field, value);
        return DocumentFilter.not(DocumentFilter.or(notAfter, DocumentFilter.eq(field, value)));
    }

    private static DocumentFilter tieWith(final Sort sort, @Nullable final Object value) {
        final String field = sort.getField();
        if (field.equals(EntityCodec.ID_FIELD)) {
            return DocumentFilter.eq(field, value);
        }
        return DocumentFilter.and(DocumentFilter.eq(field, value), DocumentFilter.not(sort
                .isAscending() ? DocumentFilter.before(field, value) : DocumentFilter.after(
                field, value)));
    }

    private static DocumentFilter indexed(final String property) {
        final String typeField = EntityCodec.PROPERTIES_FIELD + "." + property + "."
                + ValueCodec.TYPE_FIELD;
        return DocumentFilter.and(DocumentFilter.exists(EntityCodec.propertyPath(property), true),
                DocumentFilter.ne(typeField, Value.Type.TEXT.getTag()),
                DocumentFilter.ne(typeField, Value.Type.BLOB.getTag()));
    }

    private static void checkProperty(final String kind, final String property,
            final String operation) throws UnsupportedQueryException {
        try {
            EntityCodec.checkPropertyName(kind, property);
        } catch (final UnsupportedTypeException ex) {
            throw new UnsupportedQueryException(ex.getMessage(), operation, ex);
        }
    }

}
