package eu.fbk.docstore.data;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;

import eu.fbk.docstore.UnsupportedTypeException;

/**
 * A typed property value.
 * <p>
 * A {@code Value} is a tagged union: its {@link Type} identifies how the wrapped Java object has
 * to be interpreted, so that values with the same Java representation but a different meaning
 * (e.g., a {@code STRING} and a {@code TEXT}, or an {@code INTEGER} and a {@code RATING}) remain
 * distinguishable. Values are immutable; {@code BLOB} contents are defensively copied.
 * </p>
 * <p>
 * Values are normally obtained via {@link #of(Object)}, which maps plain Java objects to the
 * corresponding type ({@code String}, integral numbers, {@code Float} / {@code Double},
 * {@code Boolean}, {@code Date}, {@code byte[]}, {@link Key}, {@link GeoPt}, {@link User},
 * {@link Im}, {@code Iterable}s of the former, and {@code null}); the other types are created
 * through the dedicated factory methods. Lists cannot be nested.
 * </p>
 * <p>
 * Timestamps are kept with microsecond precision, but are persisted with millisecond precision
 * only: the sub-millisecond part is truncated when a value is written.
 * </p>
 */
public final class Value implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Value NULL = new Value(Type.NULL, null);

    private static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);

    private static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;

    @Nullable
    private final Object object;

    private Value(final Type type, @Nullable final Object object) {
        this.type = type;
        this.object = object;
    }

    public static Value ofNull() {
        return NULL;
    }

    public static Value of(final String string) {
        return new Value(Type.STRING, Preconditions.checkNotNull(string));
    }

    public static Value of(final long number) {
        return new Value(Type.INTEGER, number);
    }

    public static Value of(final double number) {
        return new Value(Type.DOUBLE, number);
    }

    public static Value of(final boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public static Value of(final Date date) {
        return ofTimestamp(date.getTime() * 1000L);
    }

    public static Value of(final byte[] bytes) {
        return new Value(Type.BLOB, bytes.clone());
    }

    public static Value of(final Key key) {
        Preconditions.checkArgument(key.isComplete(), "Incomplete key %s", key);
        return new Value(Type.KEY, key);
    }

    public static Value of(final GeoPt point) {
        return new Value(Type.GEO_PT, Preconditions.checkNotNull(point));
    }

    public static Value of(final User user) {
        return new Value(Type.USER, Preconditions.checkNotNull(user));
    }

    public static Value of(final Im im) {
        return new Value(Type.IM, Preconditions.checkNotNull(im));
    }

    /**
     * Creates a timestamp value.
     *
     * @param micros
     *            microseconds since the epoch
     * @return the created value
     */
    public static Value ofTimestamp(final long micros) {
        return new Value(Type.TIMESTAMP, micros);
    }

    public static Value ofText(final String text) {
        return new Value(Type.TEXT, Preconditions.checkNotNull(text));
    }

    public static Value ofCategory(final String category) {
        return new Value(Type.CATEGORY, Preconditions.checkNotNull(category));
    }

    public static Value ofEmail(final String email) {
        return new Value(Type.EMAIL, Preconditions.checkNotNull(email));
    }

    public static Value ofLink(final String link) {
        return new Value(Type.LINK, Preconditions.checkNotNull(link));
    }

    public static Value ofPhoneNumber(final String number) {
        return new Value(Type.PHONE_NUMBER, Preconditions.checkNotNull(number));
    }

    public static Value ofPostalAddress(final String address) {
        return new Value(Type.POSTAL_ADDRESS, Preconditions.checkNotNull(address));
    }

    /**
     * Creates a rating value.
     *
     * @param rating
     *            the rating, between 0 and 100 inclusive
     * @return the created value
     */
    public static Value ofRating(final long rating) {
        Preconditions.checkArgument(rating >= 0 && rating <= 100, "Invalid rating %s", rating);
        return new Value(Type.RATING, rating);
    }

    /**
     * Creates a list value, converting each element via {@link #of(Object)}. Empty lists are
     * allowed, nested lists are not.
     *
     * @param elements
     *            the list elements
     * @return the created value
     * @throws UnsupportedTypeException
     *             if some element cannot be represented or is a list itself
     */
    public static Value ofList(final Iterable<?> elements) throws UnsupportedTypeException {
        final ImmutableList.Builder<Value> builder = ImmutableList.builder();
        for (final Object element : elements) {
            final Value value = of(element);
            if (value.type == Type.LIST) {
                throw new UnsupportedTypeException("Nested lists are not supported", null);
            }
            builder.add(value);
        }
        return new Value(Type.LIST, builder.build());
    }

    /**
     * Maps a plain Java object to a value.
     *
     * @param object
     *            the object to convert, possibly null or already a {@code Value}
     * @return the corresponding value
     * @throws UnsupportedTypeException
     *             in case the object type cannot be represented
     */
    public static Value of(@Nullable final Object object) throws UnsupportedTypeException {
        if (object == null) {
            return NULL;
        } else if (object instanceof Value) {
            return (Value) object;
        } else if (object instanceof String) {
            return of((String) object);
        } else if (object instanceof Long || object instanceof Integer
                || object instanceof Short || object instanceof Byte) {
            return of(((Number) object).longValue());
        } else if (object instanceof Double || object instanceof Float) {
            return of(((Number) object).doubleValue());
        } else if (object instanceof Boolean) {
            return of(((Boolean) object).booleanValue());
        } else if (object instanceof Date) {
            return of((Date) object);
        } else if (object instanceof byte[]) {
            return of((byte[]) object);
        } else if (object instanceof Key) {
            return of((Key) object);
        } else if (object instanceof GeoPt) {
            return of((GeoPt) object);
        } else if (object instanceof User) {
            return of((User) object);
        } else if (object instanceof Im) {
            return of((Im) object);
        } else if (object instanceof Iterable<?>) {
            return ofList((Iterable<?>) object);
        } else if (object instanceof Object[]) {
            return ofList(Arrays.asList((Object[]) object));
        }
        throw new UnsupportedTypeException("Unsupported value type "
                + object.getClass().getName(), null);
    }

    public Type getType() {
        return this.type;
    }

    public boolean isNull() {
        return this.type == Type.NULL;
    }

    /**
     * Returns the string wrapped by a {@code STRING}, {@code TEXT}, {@code CATEGORY},
     * {@code EMAIL}, {@code LINK}, {@code PHONE_NUMBER} or {@code POSTAL_ADDRESS} value.
     *
     * @return the string
     */
    public String asString() {
        Preconditions.checkState(this.object instanceof String, "Not a string value: %s", this);
        return (String) this.object;
    }

    /**
     * Returns the number wrapped by an {@code INTEGER} or {@code RATING} value.
     *
     * @return the number
     */
    public long asLong() {
        checkType(Type.INTEGER, Type.RATING);
        return (Long) this.object;
    }

    public double asDouble() {
        checkType(Type.DOUBLE);
        return (Double) this.object;
    }

    public boolean asBoolean() {
        checkType(Type.BOOLEAN);
        return (Boolean) this.object;
    }

    /**
     * Returns the microseconds since the epoch of a {@code TIMESTAMP} value.
     *
     * @return the timestamp in microseconds
     */
    public long asTimestamp() {
        checkType(Type.TIMESTAMP);
        return (Long) this.object;
    }

    /**
     * Returns a {@code TIMESTAMP} value as a {@code Date}, truncated to milliseconds.
     *
     * @return the date
     */
    public Date asDate() {
        return new Date(Math.floorDiv(asTimestamp(), 1000L));
    }

    public byte[] asBytes() {
        checkType(Type.BLOB);
        return ((byte[]) this.object).clone();
    }

    public Key asKey() {
        checkType(Type.KEY);
        return (Key) this.object;
    }

    public GeoPt asGeoPt() {
        checkType(Type.GEO_PT);
        return (GeoPt) this.object;
    }

    public User asUser() {
        checkType(Type.USER);
        return (User) this.object;
    }

    public Im asIm() {
        checkType(Type.IM);
        return (Im) this.object;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        checkType(Type.LIST);
        return (List<Value>) this.object;
    }

    /**
     * Returns the plain Java object wrapped by this value: {@code null}, a {@code String}, a
     * {@code Long}, a {@code Double}, a {@code Boolean}, a {@code Date} (for timestamps), a
     * {@code byte[]}, a {@link Key}, a {@link GeoPt}, a {@link User}, an {@link Im} or a list of
     * such objects.
     *
     * @return the wrapped object
     */
    @Nullable
    public Object toJava() {
        switch (this.type) {
        case TIMESTAMP:
            return asDate();
        case BLOB:
            return asBytes();
        case LIST:
            final List<Object> list = new java.util.ArrayList<Object>();
            for (final Value element : asList()) {
                list.add(element.toJava());
            }
            return list;
        default:
            return this.object;
        }
    }

    private void checkType(final Type... types) {
        for (final Type type : types) {
            if (this.type == type) {
                return;
            }
        }
        throw new IllegalStateException("Expected " + Arrays.toString(types) + ", got " + this);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Value)) {
            return false;
        }
        final Value other = (Value) object;
        if (this.type != other.type) {
            return false;
        }
        if (this.type == Type.BLOB) {
            return Arrays.equals((byte[]) this.object, (byte[]) other.object);
        }
        return Objects.equal(this.object, other.object);
    }

    @Override
    public int hashCode() {
        if (this.type == Type.BLOB) {
            return this.type.hashCode() * 31 + Arrays.hashCode((byte[]) this.object);
        }
        return Objects.hashCode(this.type, this.object);
    }

    @Override
    public String toString() {
        switch (this.type) {
        case NULL:
            return "null";
        case STRING:
            return "'" + this.object + "'";
        case INTEGER:
        case DOUBLE:
        case BOOLEAN:
        case LIST:
            return String.valueOf(this.object);
        case BLOB:
            return "blob:" + BaseEncoding.base16().lowerCase().encode((byte[]) this.object);
        default:
            return this.type.getTag() + ":" + this.object;
        }
    }

    /**
     * The types a {@code Value} can have, each identified by a short, stable tag.
     */
    public enum Type {

        NULL("null", true),

        STRING("string", true),

        TEXT("text", false),

        INTEGER("int", true),

        DOUBLE("double", true),

        BOOLEAN("bool", true),

        TIMESTAMP("timestamp", true),

        BLOB("blob", false),

        KEY("key", true),

        LIST("list", true),

        CATEGORY("category", true),

        EMAIL("email", true),

        LINK("link", true),

        PHONE_NUMBER("phone", true),

        POSTAL_ADDRESS("postal", true),

        RATING("rating", true),

        GEO_PT("geopt", true),

        USER("user", true),

        IM("im", true);

        private final String tag;

        private final boolean indexed;

        private Type(final String tag, final boolean indexed) {
            this.tag = tag;
            this.indexed = indexed;
        }

        /**
         * Returns the tag identifying this type in persisted data.
         *
         * @return the tag
         */
        public String getTag() {
            return this.tag;
        }

        /**
         * Returns whether values of this type can be used in query filters and sort orders.
         *
         * @return true for indexed types
         */
        public boolean isIndexed() {
            return this.indexed;
        }

        /**
         * Returns the type with the tag specified.
         *
         * @param tag
         *            the tag
         * @return the corresponding type
         * @throws IllegalArgumentException
         *             if no type has the tag specified
         */
        public static Type forTag(final String tag) {
            for (final Type type : values()) {
                if (type.tag.equals(tag)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown value type tag '" + tag + "'");
        }

    }

    /** A geographical point. */
    public static final class GeoPt implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double latitude;

        private final double longitude;

        public GeoPt(final double latitude, final double longitude) {
            Preconditions.checkArgument(latitude >= -90.0 && latitude <= 90.0,
                    "Invalid latitude %s", latitude);
            Preconditions.checkArgument(longitude >= -180.0 && longitude <= 180.0,
                    "Invalid longitude %s", longitude);
            this.latitude = latitude;
            this.longitude = longitude;
        }

        public double getLatitude() {
            return this.latitude;
        }

        public double getLongitude() {
            return this.longitude;
        }

        @Override
        public boolean equals(final Object object) {
            if (!(object instanceof GeoPt)) {
                return false;
            }
            final GeoPt other = (GeoPt) object;
            return Double.compare(this.latitude, other.latitude) == 0
                    && Double.compare(this.longitude, other.longitude) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.latitude, this.longitude);
        }

        @Override
        public String toString() {
            return this.latitude + "," + this.longitude;
        }

    }

    /** A user, identified by email and optional authentication domain. */
    public static final class User implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String email;

        private final String authDomain;

        public User(final String email, @Nullable final String authDomain) {
            this.email = Preconditions.checkNotNull(email);
            this.authDomain = authDomain == null ? "" : authDomain;
        }

        public String getEmail() {
            return this.email;
        }

        public String getAuthDomain() {
            return this.authDomain;
        }

        @Override
        public boolean equals(final Object object) {
            if (!(object instanceof User)) {
                return false;
            }
            final User other = (User) object;
            return this.email.equals(other.email) && this.authDomain.equals(other.authDomain);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.email, this.authDomain);
        }

        @Override
        public String toString() {
            return this.authDomain.isEmpty() ? this.email : this.email + "@@" + this.authDomain;
        }

    }

    /** An instant messaging handle. */
    public static final class Im implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String protocol;

        private final String address;

        public Im(final String protocol, final String address) {
            this.protocol = Preconditions.checkNotNull(protocol);
            this.address = Preconditions.checkNotNull(address);
        }

        public String getProtocol() {
            return this.protocol;
        }

        public String getAddress() {
            return this.address;
        }

        @Override
        public boolean equals(final Object object) {
            if (!(object instanceof Im)) {
                return false;
            }
            final Im other = (Im) object;
            return this.protocol.equals(other.protocol) && this.address.equals(other.address);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.protocol, this.address);
        }

        @Override
        public String toString() {
            return this.protocol + " " + this.address;
        }

    }

}
