package eu.fbk.docstore.backend;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A backend-neutral document query: a filter, an ordered list of sort fields, a number of
 * documents to skip and an optional limit.
 */
public final class DocumentQuery {

    private final DocumentFilter filter;

    private final List<Sort> sorts;

    private final int skip;

    @Nullable
    private final Integer limit;

    public DocumentQuery(final DocumentFilter filter, final List<Sort> sorts, final int skip,
            @Nullable final Integer limit) {
        Preconditions.checkArgument(skip >= 0, "Negative skip %s", skip);
        Preconditions.checkArgument(limit == null || limit >= 0, "Negative limit %s", limit);
        this.filter = Preconditions.checkNotNull(filter);
        this.sorts = ImmutableList.copyOf(sorts);
        this.skip = skip;
        this.limit = limit;
    }

    public DocumentFilter getFilter() {
        return this.filter;
    }

    public List<Sort> getSorts() {
        return this.sorts;
    }

    public int getSkip() {
        return this.skip;
    }

    @Nullable
    public Integer getLimit() {
        return this.limit;
    }

    /**
     * Returns a copy of this query with a different limit.
     *
     * @param limit
     *            the new limit, null for no limit
     * @return the modified query
     */
    public DocumentQuery withLimit(@Nullable final Integer limit) {
        return new DocumentQuery(this.filter, this.sorts, this.skip, limit);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof DocumentQuery)) {
            return false;
        }
        final DocumentQuery other = (DocumentQuery) object;
        return this.filter.equals(other.filter) && this.sorts.equals(other.sorts)
                && this.skip == other.skip && Objects.equal(this.limit, other.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.filter, this.sorts, this.skip, this.limit);
    }

    @Override
    public String toString() {
        return "filter " + this.filter + ", sort " + this.sorts + ", skip " + this.skip
                + (this.limit == null ? "" : ", limit " + this.limit);
    }

    /** A sort field with its direction. */
    public static final class Sort {

        private final String field;

        private final boolean ascending;

        public Sort(final String field, final boolean ascending) {
            Preconditions.checkArgument(!field.isEmpty(), "Empty sort field");
            this.field = field;
            this.ascending = ascending;
        }

        public String getField() {
            return this.field;
        }

        public boolean isAscending() {
            return this.ascending;
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Sort)) {
                return false;
            }
            final Sort other = (Sort) object;
            return this.field.equals(other.field) && this.ascending == other.ascending;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.field, this.ascending);
        }

        @Override
        public String toString() {
            return this.field + (this.ascending ? " asc" : " desc");
        }

    }

}
