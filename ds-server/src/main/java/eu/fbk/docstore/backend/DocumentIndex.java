package eu.fbk.docstore.backend;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.docstore.backend.DocumentQuery.Sort;

/**
 * A physical compound index of a document collection, i.e., an ordered list of fields with
 * their directions.
 */
public final class DocumentIndex {

    private final List<Sort> fields;

    public DocumentIndex(final List<Sort> fields) {
        Preconditions.checkArgument(!fields.isEmpty(), "No index fields");
        this.fields = ImmutableList.copyOf(fields);
    }

    public List<Sort> getFields() {
        return this.fields;
    }

    /**
     * Returns a name for the index derived from its fields, following the document store
     * convention {@code field1_1_field2_-1}.
     *
     * @return the index name
     */
    public String getName() {
        final StringBuilder builder = new StringBuilder();
        for (final Sort field : this.fields) {
            if (builder.length() > 0) {
                builder.append('_');
            }
            builder.append(field.getField()).append(field.isAscending() ? "_1" : "_-1");
        }
        return builder.toString();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof DocumentIndex)) {
            return false;
        }
        return this.fields.equals(((DocumentIndex) object).fields);
    }

    @Override
    public int hashCode() {
        return this.fields.hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }

}
