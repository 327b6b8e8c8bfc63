package eu.fbk.docstore.data;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.data.Query.Order;

/**
 * A composite index declaration: a kind, an ordered list of (property, direction) pairs and an
 * ancestor flag.
 * <p>
 * The ancestor flag is recorded for compatibility with datastore index definitions but has no
 * physical counterpart, as ancestor restrictions are evaluated as key prefix matches.
 * </p>
 */
public final class IndexDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kind;

    private final boolean ancestor;

    private final List<Order> properties;

    public IndexDescriptor(final String kind, final boolean ancestor, final List<Order> properties) {
        Preconditions.checkArgument(!kind.isEmpty(), "Empty kind");
        this.kind = kind;
        this.ancestor = ancestor;
        this.properties = ImmutableList.copyOf(properties);
    }

    /**
     * Convenience factory method accepting alternating property names and {@link Direction}s.
     *
     * @param kind
     *            the kind
     * @param ancestor
     *            the ancestor flag
     * @param propertiesAndDirections
     *            alternating property names and directions
     * @return the created descriptor
     */
    public static IndexDescriptor create(final String kind, final boolean ancestor,
            final Object... propertiesAndDirections) {
        Preconditions.checkArgument(propertiesAndDirections.length % 2 == 0,
                "Odd number of properties and directions");
        final ImmutableList.Builder<Order> builder = ImmutableList.builder();
        for (int i = 0; i < propertiesAndDirections.length; i += 2) {
            builder.add(new Order((String) propertiesAndDirections[i],
                    (Direction) propertiesAndDirections[i + 1]));
        }
        return new IndexDescriptor(kind, ancestor, builder.build());
    }

    public String getKind() {
        return this.kind;
    }

    public boolean isAncestor() {
        return this.ancestor;
    }

    public List<Order> getProperties() {
        return this.properties;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof IndexDescriptor)) {
            return false;
        }
        final IndexDescriptor other = (IndexDescriptor) object;
        return this.kind.equals(other.kind) && this.ancestor == other.ancestor
                && this.properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.kind, this.ancestor, this.properties);
    }

    @Override
    public String toString() {
        return this.kind + (this.ancestor ? "[ancestor]" : "") + this.properties;
    }

}
