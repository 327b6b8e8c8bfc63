package eu.fbk.docstore.data;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import eu.fbk.docstore.UnsupportedTypeException;

/**
 * A datastore entity, consisting of a {@link Key} and a set of named, typed properties.
 * <p>
 * An {@code Entity} is a mutable, non thread-safe bag of properties. Property order is not
 * significant. A property explicitly set to {@link Value#ofNull()} is distinct from an absent
 * property: the former matches equality filters on {@code null}, the latter is excluded from any
 * query filtering or sorting on that property. The key may be incomplete before the entity is
 * first stored; storing an entity replaces any previously stored entity with the same key as a
 * whole.
 * </p>
 */
public final class Entity implements Serializable, Cloneable {

    private static final long serialVersionUID = 1L;

    private Key key;

    private final Map<String, Value> properties;

    /**
     * Creates a new entity with the key specified and no properties.
     *
     * @param key
     *            the entity key, possibly incomplete
     */
    public Entity(final Key key) {
        this.key = Preconditions.checkNotNull(key);
        this.properties = new TreeMap<String, Value>();
    }

    /**
     * Creates a new entity with an incomplete root key of the kind specified.
     *
     * @param kind
     *            the entity kind
     */
    public Entity(final String kind) {
        this(Key.create(kind));
    }

    public Key getKey() {
        return this.key;
    }

    public String getKind() {
        return this.key.getKind();
    }

    /**
     * Replaces the entity key. The new key must have the same path of the old one, apart for the
     * identifier of its last element, which can be assigned if missing.
     *
     * @param key
     *            the new key
     */
    public void setKey(final Key key) {
        Preconditions.checkArgument(key.getKind().equals(this.key.getKind()),
                "Cannot change kind of %s to %s", this.key, key);
        this.key = key;
    }

    /**
     * Sets a property, converting the supplied object via {@link Value#of(Object)}.
     *
     * @param name
     *            the property name
     * @param value
     *            the property value, possibly null (for a {@code NULL} property) or a {@code Value}
     * @return this entity, for call chaining
     * @throws UnsupportedTypeException
     *             if the value cannot be represented
     */
    public Entity set(final String name, @Nullable final Object value)
            throws UnsupportedTypeException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty property name");
        this.properties.put(name, Value.of(value));
        return this;
    }

    @Nullable
    public Value get(final String name) {
        return this.properties.get(name);
    }

    public boolean has(final String name) {
        return this.properties.containsKey(name);
    }

    @Nullable
    public Value remove(final String name) {
        return this.properties.remove(name);
    }

    /**
     * Returns an unmodifiable view of the entity properties, sorted by name.
     *
     * @return the properties map
     */
    public Map<String, Value> getProperties() {
        return Collections.unmodifiableMap(this.properties);
    }

    @Override
    public Entity clone() {
        final Entity entity = new Entity(this.key);
        entity.properties.putAll(this.properties);
        return entity;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Entity)) {
            return false;
        }
        final Entity other = (Entity) object;
        return this.key.equals(other.key) && this.properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.key, this.properties);
    }

    @Override
    public String toString() {
        return this.key + " " + this.properties;
    }

}
