package eu.fbk.docstore.data;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * An immutable datastore query over the entities of a kind.
 * <p>
 * A query consists of a kind, a conjunction of property {@link Filter}s, a list of sort
 * {@link Order}s, an optional ancestor restricting results to the descendants of (and including)
 * a given key, an optional {@link Cursor} to resume after a previous page, an optional limit and
 * an offset. The special property {@link #KEY_PROPERTY} denotes the entity key and can be used
 * both in filters (with {@code KEY} values) and in sort orders. Queries are created via
 * {@link #builder(String)}.
 * </p>
 */
public final class Query implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Special property name denoting the entity key. */
    public static final String KEY_PROPERTY = "__key__";

    private final String kind;

    private final List<Filter> filters;

    private final List<Order> orders;

    @Nullable
    private final Key ancestor;

    @Nullable
    private final Cursor cursor;

    @Nullable
    private final Integer limit;

    private final int offset;

    private Query(final Builder builder) {
        this.kind = builder.kind;
        this.filters = ImmutableList.copyOf(builder.filters);
        this.orders = ImmutableList.copyOf(builder.orders);
        this.ancestor = builder.ancestor;
        this.cursor = builder.cursor;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder(final String kind) {
        return new Builder(kind);
    }

    public String getKind() {
        return this.kind;
    }

    public List<Filter> getFilters() {
        return this.filters;
    }

    public List<Order> getOrders() {
        return this.orders;
    }

    @Nullable
    public Key getAncestor() {
        return this.ancestor;
    }

    @Nullable
    public Cursor getCursor() {
        return this.cursor;
    }

    @Nullable
    public Integer getLimit() {
        return this.limit;
    }

    public int getOffset() {
        return this.offset;
    }

    /**
     * Returns a builder initialized with the contents of this query, which can be used to derive
     * a modified query (e.g., with a different cursor).
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        final Builder builder = new Builder(this.kind);
        builder.filters.addAll(this.filters);
        builder.orders.addAll(this.orders);
        builder.ancestor = this.ancestor;
        builder.cursor = this.cursor;
        builder.limit = this.limit;
        builder.offset = this.offset;
        return builder;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Query)) {
            return false;
        }
        final Query other = (Query) object;
        return this.kind.equals(other.kind) && this.filters.equals(other.filters)
                && this.orders.equals(other.orders) && Objects.equal(this.ancestor, other.ancestor)
                && Objects.equal(this.cursor, other.cursor)
                && Objects.equal(this.limit, other.limit) && this.offset == other.offset;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.kind, this.filters, this.orders, this.ancestor, this.cursor,
                this.limit, this.offset);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("SELECT * FROM ").append(this.kind);
        String separator = " WHERE ";
        if (this.ancestor != null) {
            builder.append(separator).append("ANCESTOR IS ").append(this.ancestor);
            separator = " AND ";
        }
        for (final Filter filter : this.filters) {
            builder.append(separator).append(filter);
            separator = " AND ";
        }
        separator = " ORDER BY ";
        for (final Order order : this.orders) {
            builder.append(separator).append(order);
            separator = ", ";
        }
        if (this.limit != null) {
            builder.append(" LIMIT ").append(this.limit);
        }
        if (this.offset > 0) {
            builder.append(" OFFSET ").append(this.offset);
        }
        if (this.cursor != null) {
            builder.append(" AFTER ").append(this.cursor.getKey());
        }
        return builder.toString();
    }

    public enum Operator {

        EQUAL("=", false),

        NOT_EQUAL("!=", true),

        LESS_THAN("<", true),

        LESS_THAN_OR_EQUAL("<=", true),

        GREATER_THAN(">", true),

        GREATER_THAN_OR_EQUAL(">=", true),

        IN("IN", false);

        private final String symbol;

        private final boolean inequality;

        private Operator(final String symbol, final boolean inequality) {
            this.symbol = symbol;
            this.inequality = inequality;
        }

        public String getSymbol() {
            return this.symbol;
        }

        /**
         * Returns whether the operator is an inequality, i.e., it selects a range (or the
         * complement of a value) rather than specific values.
         *
         * @return true for inequality operators
         */
        public boolean isInequality() {
            return this.inequality;
        }

    }

    public enum Direction {

        ASCENDING,

        DESCENDING

    }

    /**
     * A filter on a property. {@code IN} filters carry one or more values, the other operators
     * exactly one.
     */
    public static final class Filter implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String property;

        private final Operator operator;

        private final List<Value> values;

        public Filter(final String property, final Operator operator, final Iterable<?> values) {
            Preconditions.checkArgument(!property.isEmpty(), "Empty property name");
            final ImmutableList.Builder<Value> builder = ImmutableList.builder();
            for (final Object value : values) {
                builder.add(Value.of(value));
            }
            this.property = property;
            this.operator = Preconditions.checkNotNull(operator);
            this.values = builder.build();
            if (operator == Operator.IN) {
                Preconditions.checkArgument(!this.values.isEmpty(), "No values for IN filter");
            } else {
                Preconditions.checkArgument(this.values.size() == 1,
                        "Operator %s requires exactly one value", operator);
            }
        }

        public String getProperty() {
            return this.property;
        }

        public Operator getOperator() {
            return this.operator;
        }

        public List<Value> getValues() {
            return this.values;
        }

        public Value getValue() {
            return this.values.get(0);
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Filter)) {
                return false;
            }
            final Filter other = (Filter) object;
            return this.property.equals(other.property) && this.operator == other.operator
                    && this.values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.property, this.operator, this.values);
        }

        @Override
        public String toString() {
            return this.property + " " + this.operator.getSymbol() + " "
                    + (this.operator == Operator.IN ? this.values : this.values.get(0));
        }

    }

    public static final class Order implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String property;

        private final Direction direction;

        public Order(final String property, final Direction direction) {
            Preconditions.checkArgument(!property.isEmpty(), "Empty property name");
            this.property = property;
            this.direction = Preconditions.checkNotNull(direction);
        }

        public String getProperty() {
            return this.property;
        }

        public Direction getDirection() {
            return this.direction;
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Order)) {
                return false;
            }
            final Order other = (Order) object;
            return this.property.equals(other.property) && this.direction == other.direction;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.property, this.direction);
        }

        @Override
        public String toString() {
            return this.property + (this.direction == Direction.DESCENDING ? " DESC" : "");
        }

    }

    public static final class Builder {

        private final String kind;

        private final List<Filter> filters;

        private final List<Order> orders;

        @Nullable
        private Key ancestor;

        @Nullable
        private Cursor cursor;

        @Nullable
        private Integer limit;

        private int offset;

        Builder(final String kind) {
            Preconditions.checkArgument(!kind.isEmpty(), "Empty kind");
            this.kind = kind;
            this.filters = Lists.newArrayList();
            this.orders = Lists.newArrayList();
        }

        public Builder filter(final String property, final Operator operator,
                @Nullable final Object value) {
            this.filters.add(new Filter(property, operator, Collections.singletonList(value)));
            return this;
        }

        public Builder in(final String property, final Iterable<?> values) {
            this.filters.add(new Filter(property, Operator.IN, values));
            return this;
        }

        public Builder order(final String property, final Direction direction) {
            this.orders.add(new Order(property, direction));
            return this;
        }

        public Builder order(final String property) {
            return order(property, Direction.ASCENDING);
        }

        public Builder ancestor(@Nullable final Key ancestor) {
            Preconditions.checkArgument(ancestor == null || ancestor.isComplete(),
                    "Incomplete ancestor key %s", ancestor);
            this.ancestor = ancestor;
            return this;
        }

        public Builder cursor(@Nullable final Cursor cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder limit(@Nullable final Integer limit) {
            Preconditions.checkArgument(limit == null || limit >= 0, "Negative limit %s", limit);
            this.limit = limit;
            return this;
        }

        public Builder offset(final int offset) {
            Preconditions.checkArgument(offset >= 0, "Negative offset %s", offset);
            this.offset = offset;
            return this;
        }

        public Query build() {
            return new Query(this);
        }

    }

}
