package eu.fbk.docstore.data;

import java.io.Serializable;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;

/**
 * A hierarchical entity key, consisting of an ancestor path and a final (kind, identifier) pair.
 * <p>
 * A {@code Key} is an ordered, non-empty sequence of {@link Element}s. The kind of the last
 * element is the kind of the identified entity, while the preceding elements form its
 * <i>ancestor path</i>; the first element identifies the <i>entity group</i> root. Each element
 * carries either a positive numeric ID (normally minted by the ID allocator) or an application
 * assigned name. Only the last element of a key can lack an identifier: such a key is
 * <i>incomplete</i> and is completed on first put via {@link #withId(long)}.
 * </p>
 * <p>
 * Keys are immutable and thread safe. They are ordered by path: elements are compared pairwise
 * by kind first, then numeric IDs come before names, IDs being compared numerically and names by
 * code point; a key sorts immediately before its descendants. Kinds must be non-empty, must not
 * start with the reserved prefix {@code __} and, as names, must not contain control characters
 * (which are reserved for the storage encoding of keys).
 * </p>
 */
public final class Key implements Serializable, Comparable<Key> {

    private static final long serialVersionUID = 1L;

    /** Prefix of reserved kind and property names. */
    public static final String RESERVED_PREFIX = "__";

    private final ImmutableList<Element> path;

    private Key(final ImmutableList<Element> path) {
        this.path = path;
    }

    /**
     * Creates an incomplete root key of the kind specified.
     *
     * @param kind
     *            the kind
     * @return the created key
     */
    public static Key create(final String kind) {
        return new Key(ImmutableList.of(new Element(kind, null, null)));
    }

    /**
     * Creates a root key with the kind and numeric ID specified.
     *
     * @param kind
     *            the kind
     * @param id
     *            the positive numeric ID
     * @return the created key
     */
    public static Key create(final String kind, final long id) {
        return create(null, kind, id);
    }

    /**
     * Creates a root key with the kind and name specified.
     *
     * @param kind
     *            the kind
     * @param name
     *            the name
     * @return the created key
     */
    public static Key create(final String kind, final String name) {
        return create(null, kind, name);
    }

    /**
     * Creates a key with the optional parent, kind and numeric ID specified.
     *
     * @param parent
     *            the parent key, null for a root key; must be complete
     * @param kind
     *            the kind
     * @param id
     *            the positive numeric ID
     * @return the created key
     */
    public static Key create(@Nullable final Key parent, final String kind, final long id) {
        Preconditions.checkArgument(id > 0, "Invalid numeric ID %s", id);
        return append(parent, new Element(kind, id, null));
    }

    /**
     * Creates a key with the optional parent, kind and name specified.
     *
     * @param parent
     *            the parent key, null for a root key; must be complete
     * @param kind
     *            the kind
     * @param name
     *            the name
     * @return the created key
     */
    public static Key create(@Nullable final Key parent, final String kind, final String name) {
        return append(parent, new Element(kind, null, Preconditions.checkNotNull(name)));
    }

    /**
     * Creates an incomplete key with the optional parent and kind specified.
     *
     * @param parent
     *            the parent key, null for a root key; must be complete
     * @param kind
     *            the kind
     * @return the created key
     */
    public static Key createIncomplete(@Nullable final Key parent, final String kind) {
        return append(parent, new Element(kind, null, null));
    }

    /**
     * Creates a complete key from a sequence of alternating kinds and identifiers, where each
     * identifier is either a {@code String} name or an integral {@code Number} ID, e.g.
     * {@code Key.fromPath("Parent", 1L, "Child", "name")}.
     *
     * @param kindsAndIdentifiers
     *            the alternating kinds and identifiers
     * @return the created key
     */
    public static Key fromPath(final Object... kindsAndIdentifiers) {
        Preconditions.checkArgument(kindsAndIdentifiers.length > 0
                && kindsAndIdentifiers.length % 2 == 0, "Odd or empty key path");
        Key key = null;
        for (int i = 0; i < kindsAndIdentifiers.length; i += 2) {
            final String kind = (String) kindsAndIdentifiers[i];
            final Object identifier = kindsAndIdentifiers[i + 1];
            if (identifier instanceof String) {
                key = create(key, kind, (String) identifier);
            } else if (identifier instanceof Long || identifier instanceof Integer
                    || identifier instanceof Short || identifier instanceof Byte) {
                key = create(key, kind, ((Number) identifier).longValue());
            } else {
                throw new IllegalArgumentException("Invalid key identifier: " + identifier);
            }
        }
        return key;
    }

    /**
     * Creates a key from the list of path elements specified.
     *
     * @param elements
     *            the path elements, not empty; all elements but the last must be complete
     * @return the created key
     */
    public static Key fromElements(final List<Element> elements) {
        Preconditions.checkArgument(!elements.isEmpty(), "Empty key path");
        for (int i = 0; i < elements.size() - 1; ++i) {
            Preconditions.checkArgument(elements.get(i).isComplete(),
                    "Incomplete ancestor element in key path %s", elements);
        }
        return new Key(ImmutableList.copyOf(elements));
    }

    private static Key append(@Nullable final Key parent, final Element element) {
        if (parent == null) {
            return new Key(ImmutableList.of(element));
        }
        Preconditions.checkArgument(parent.isComplete(), "Incomplete parent key %s", parent);
        return new Key(ImmutableList.<Element>builder().addAll(parent.path).add(element).build());
    }

    /**
     * Returns the path elements of this key, from the root to the key itself.
     *
     * @return an immutable, non-empty list of elements
     */
    public List<Element> getPath() {
        return this.path;
    }

    /**
     * Returns the kind of the entity identified by this key.
     *
     * @return the kind
     */
    public String getKind() {
        return last().getKind();
    }

    /**
     * Returns the numeric ID of this key, if any.
     *
     * @return the ID, or null if the key has a name or is incomplete
     */
    @Nullable
    public Long getId() {
        return last().getId();
    }

    /**
     * Returns the name of this key, if any.
     *
     * @return the name, or null if the key has a numeric ID or is incomplete
     */
    @Nullable
    public String getName() {
        return last().getName();
    }

    /**
     * Returns the parent of this key, if any.
     *
     * @return the parent key, or null for a root key
     */
    @Nullable
    public Key getParent() {
        return this.path.size() == 1 ? null : new Key(this.path.subList(0, this.path.size() - 1));
    }

    /**
     * Returns the root of the entity group this key belongs to.
     *
     * @return the root key, possibly this key itself
     */
    public Key getRoot() {
        return this.path.size() == 1 ? this : new Key(this.path.subList(0, 1));
    }

    /**
     * Returns whether the last element of this key carries an identifier.
     *
     * @return true if the key is complete
     */
    public boolean isComplete() {
        return last().isComplete();
    }

    /**
     * Returns whether this key is an ancestor of, or equal to, the key specified.
     *
     * @param key
     *            the key to test
     * @return true if this key is a prefix of the supplied key path
     */
    public boolean isAncestorOf(final Key key) {
        return key.path.size() >= this.path.size()
                && key.path.subList(0, this.path.size()).equals(this.path);
    }

    /**
     * Returns a complete copy of this incomplete key, using the numeric ID specified.
     *
     * @param id
     *            the positive numeric ID
     * @return the completed key
     */
    public Key withId(final long id) {
        Preconditions.checkState(!isComplete(), "Key %s already complete", this);
        return create(getParent(), getKind(), id);
    }

    private Element last() {
        return this.path.get(this.path.size() - 1);
    }

    @Override
    public int compareTo(final Key other) {
        final int size = Math.min(this.path.size(), other.path.size());
        for (int i = 0; i < size; ++i) {
            final int result = this.path.get(i).compareTo(other.path.get(i));
            if (result != 0) {
                return result;
            }
        }
        return this.path.size() - other.path.size();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Key)) {
            return false;
        }
        return this.path.equals(((Key) object).path);
    }

    @Override
    public int hashCode() {
        return this.path.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final Element element : this.path) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(element);
        }
        return builder.toString();
    }

    static int compareCodePoints(final String first, final String second) {
        int i = 0;
        int j = 0;
        while (i < first.length() && j < second.length()) {
            final int c1 = first.codePointAt(i);
            final int c2 = second.codePointAt(j);
            if (c1 != c2) {
                return c1 < c2 ? -1 : 1;
            }
            i += Character.charCount(c1);
            j += Character.charCount(c2);
        }
        return (first.length() - i) - (second.length() - j);
    }

    private static String checkIdentifier(final String string, final String what) {
        Preconditions.checkArgument(!string.isEmpty(), "Empty %s", what);
        for (int i = 0; i < string.length(); ++i) {
            Preconditions.checkArgument(string.charAt(i) >= 0x20,
                    "Control character in %s '%s'", what, string);
        }
        return string;
    }

    /**
     * An element of a key path, consisting of a kind and an optional numeric ID or name.
     */
    public static final class Element implements Serializable, Comparable<Element> {

        private static final long serialVersionUID = 1L;

        private final String kind;

        @Nullable
        private final Long id;

        @Nullable
        private final String name;

        Element(final String kind, @Nullable final Long id, @Nullable final String name) {
            checkIdentifier(Preconditions.checkNotNull(kind), "kind");
            Preconditions.checkArgument(!kind.startsWith(RESERVED_PREFIX), "Reserved kind %s",
                    kind);
            if (name != null) {
                checkIdentifier(name, "name");
            }
            this.kind = kind;
            this.id = id;
            this.name = name;
        }

        /**
         * Creates a complete element with the kind and numeric ID specified.
         *
         * @param kind
         *            the kind
         * @param id
         *            the positive numeric ID
         * @return the created element
         */
        public static Element create(final String kind, final long id) {
            Preconditions.checkArgument(id > 0, "Invalid numeric ID %s", id);
            return new Element(kind, id, null);
        }

        /**
         * Creates a complete element with the kind and name specified.
         *
         * @param kind
         *            the kind
         * @param name
         *            the name
         * @return the created element
         */
        public static Element create(final String kind, final String name) {
            return new Element(kind, null, Preconditions.checkNotNull(name));
        }

        public String getKind() {
            return this.kind;
        }

        @Nullable
        public Long getId() {
            return this.id;
        }

        @Nullable
        public String getName() {
            return this.name;
        }

        public boolean isComplete() {
            return this.id != null || this.name != null;
        }

        @Override
        public int compareTo(final Element other) {
            int result = compareCodePoints(this.kind, other.kind);
            if (result == 0) {
                if (this.id != null) {
                    result = other.id != null ? Longs.compare(this.id, other.id) : -1;
                } else if (this.name != null) {
                    result = other.id != null ? 1 : other.name == null ? 1 : compareCodePoints(
                            this.name, other.name);
                } else {
                    result = other.isComplete() ? -1 : 0;
                }
            }
            return result;
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Element)) {
                return false;
            }
            final Element other = (Element) object;
            return this.kind.equals(other.kind) && Objects.equal(this.id, other.id)
                    && Objects.equal(this.name, other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.kind, this.id, this.name);
        }

        @Override
        public String toString() {
            if (this.id != null) {
                return this.kind + "(" + this.id + ")";
            } else if (this.name != null) {
                return this.kind + "('" + this.name + "')";
            } else {
                return this.kind + "(?)";
            }
        }

    }

}
