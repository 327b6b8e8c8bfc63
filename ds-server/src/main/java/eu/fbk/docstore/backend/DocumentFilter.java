package eu.fbk.docstore.backend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A backend-neutral filter over stored documents.
 * <p>
 * A {@code DocumentFilter} is an immutable tree whose leaves test a dotted field path against one
 * or more native values (see {@link DocumentStore} for the supported natives) and whose inner
 * nodes are conjunctions and disjunctions. Leaf semantics follow document-store conventions:
 * </p>
 * <ul>
 * <li>if the field holds an array, the leaf matches when any element matches;</li>
 * <li>{@code EQ} with a null value also matches documents where the field is missing, while
 * {@code NE} is the exact negation of {@code EQ};</li>
 * <li>range leaves ({@code LT}, {@code LTE}, {@code GT}, {@code GTE}) only match values whose
 * type is comparable with the operand (numbers with numbers, strings with strings, etc.);</li>
 * <li>{@code AFTER} and {@code BEFORE} compare values across types according to
 * {@link DocumentOrdering}, matching values strictly following / preceding the operand in sort
 * order;</li>
 * <li>{@code PREFIX} matches strings starting with the operand;</li>
 * <li>{@code EXISTS} tests the presence (operand true) or absence (operand false) of the
 * field;</li>
 * <li>{@code NOT} negates its single child, so {@code not(lte(f, v))} matches documents where
 * no element of {@code f} is {@code <= v}.</li>
 * </ul>
 */
public final class DocumentFilter {

    private static final DocumentFilter ALL = new DocumentFilter(Kind.ALL, null,
            ImmutableList.of(), ImmutableList.<DocumentFilter>of());

    private final Kind kind;

    @Nullable
    private final String field;

    private final List<Object> values;

    private final List<DocumentFilter> children;

    private DocumentFilter(final Kind kind, @Nullable final String field,
            final List<Object> values, final List<DocumentFilter> children) {
        this.kind = kind;
        this.field = field;
        this.values = values;
        this.children = children;
    }

    public static DocumentFilter all() {
        return ALL;
    }

    public static DocumentFilter eq(final String field, @Nullable final Object value) {
        return leaf(Kind.EQ, field, value);
    }

    public static DocumentFilter ne(final String field, @Nullable final Object value) {
        return leaf(Kind.NE, field, value);
    }

    public static DocumentFilter lt(final String field, final Object value) {
        return leaf(Kind.LT, field, Preconditions.checkNotNull(value));
    }

    public static DocumentFilter lte(final String field, final Object value) {
        return leaf(Kind.LTE, field, Preconditions.checkNotNull(value));
    }

    public static DocumentFilter gt(final String field, final Object value) {
        return leaf(Kind.GT, field, Preconditions.checkNotNull(value));
    }

    public static DocumentFilter gte(final String field, final Object value) {
        return leaf(Kind.GTE, field, Preconditions.checkNotNull(value));
    }

    public static DocumentFilter after(final String field, @Nullable final Object value) {
        return leaf(Kind.AFTER, field, value);
    }

    public static DocumentFilter before(final String field, @Nullable final Object value) {
        return leaf(Kind.BEFORE, field, value);
    }

    public static DocumentFilter prefix(final String field, final String prefix) {
        return leaf(Kind.PREFIX, field, prefix);
    }

    public static DocumentFilter exists(final String field, final boolean exists) {
        return leaf(Kind.EXISTS, field, exists);
    }

    public static DocumentFilter in(final String field, final List<?> values) {
        Preconditions.checkArgument(!values.isEmpty(), "Empty IN values");
        return new DocumentFilter(Kind.IN, field,
                Collections.unmodifiableList(new ArrayList<Object>(values)),
                ImmutableList.<DocumentFilter>of());
    }

    public static DocumentFilter and(final DocumentFilter... children) {
        return compose(Kind.AND, Arrays.asList(children));
    }

    public static DocumentFilter and(final List<DocumentFilter> children) {
        return compose(Kind.AND, children);
    }

    public static DocumentFilter or(final DocumentFilter... children) {
        return compose(Kind.OR, Arrays.asList(children));
    }

    public static DocumentFilter or(final List<DocumentFilter> children) {
        return compose(Kind.OR, children);
    }

    public static DocumentFilter not(final DocumentFilter child) {
        Preconditions.checkArgument(child.kind != Kind.ALL, "Cannot negate *");
        if (child.kind == Kind.NOT) {
            return child.children.get(0);
        }
        return new DocumentFilter(Kind.NOT, null, ImmutableList.of(), ImmutableList.of(child));
    }

    private static DocumentFilter leaf(final Kind kind, final String field,
            @Nullable final Object value) {
        Preconditions.checkArgument(!field.isEmpty(), "Empty field");
        return new DocumentFilter(kind, field, Collections.singletonList(value),
                ImmutableList.<DocumentFilter>of());
    }

    private static DocumentFilter compose(final Kind kind, final List<DocumentFilter> children) {
        final ImmutableList.Builder<DocumentFilter> builder = ImmutableList.builder();
        for (final DocumentFilter child : children) {
            if (kind == Kind.AND && child.kind == Kind.ALL) {
                continue;
            } else if (child.kind == kind) {
                builder.addAll(child.children);
            } else {
                builder.add(child);
            }
        }
        final List<DocumentFilter> list = builder.build();
        if (kind == Kind.AND && list.isEmpty()) {
            return ALL;
        } else if (list.size() == 1) {
            return list.get(0);
        }
        Preconditions.checkArgument(!list.isEmpty(), "Empty disjunction");
        return new DocumentFilter(kind, null, ImmutableList.of(), list);
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the dotted field path tested by a leaf filter.
     *
     * @return the field, or null for {@code ALL} and composite filters
     */
    @Nullable
    public String getField() {
        return this.field;
    }

    /**
     * Returns the operand of a leaf filter other than {@code IN}.
     *
     * @return the operand, possibly null
     */
    @Nullable
    public Object getValue() {
        return this.values.get(0);
    }

    public List<Object> getValues() {
        return this.values;
    }

    public List<DocumentFilter> getChildren() {
        return this.children;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof DocumentFilter)) {
            return false;
        }
        final DocumentFilter other = (DocumentFilter) object;
        return this.kind == other.kind && Objects.equal(this.field, other.field)
                && DocumentOrdering.deepEquals(this.values, other.values)
                && this.children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.kind, this.field, this.children);
    }

    @Override
    public String toString() {
        switch (this.kind) {
        case ALL:
            return "*";
        case NOT:
            return "!" + this.children.get(0);
        case AND:
        case OR:
            final StringBuilder builder = new StringBuilder("(");
            for (final DocumentFilter child : this.children) {
                if (builder.length() > 1) {
                    builder.append(this.kind == Kind.AND ? " && " : " || ");
                }
                builder.append(child);
            }
            return builder.append(")").toString();
        case IN:
            return this.field + " in " + DocumentOrdering.toString(this.values);
        default:
            return this.field + " " + this.kind.name().toLowerCase() + " "
                    + DocumentOrdering.toString(getValue());
        }
    }

    public enum Kind {

        ALL,

        EQ,

        NE,

        LT,

        LTE,

        GT,

        GTE,

        IN,

        EXISTS,

        PREFIX,

        AFTER,

        BEFORE,

        AND,

        OR,

        NOT

    }

}
