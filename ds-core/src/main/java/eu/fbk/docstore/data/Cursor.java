package eu.fbk.docstore.data;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * A query cursor, pointing right after the last entity returned by a query page.
 * <p>
 * A cursor records the key of the last returned entity and the values it had for the sort orders
 * of the query (in order, including the implicit trailing key order). A query resumed from a
 * cursor returns only the entities strictly following that position. Cursors are exchanged with
 * clients as opaque, web-safe strings via {@link #toWebSafeString()} and
 * {@link #fromWebSafeString(String)}.
 * </p>
 */
public final class Cursor implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final BaseEncoding ENCODING = BaseEncoding.base64Url().omitPadding();

    private static final byte VERSION = 2;

    private final Key key;

    private final List<Value> sortValues;

    public Cursor(final Key key, final List<Value> sortValues) {
        Preconditions.checkArgument(key.isComplete(), "Incomplete cursor key %s", key);
        this.key = key;
        this.sortValues = ImmutableList.copyOf(sortValues);
    }

    public Key getKey() {
        return this.key;
    }

    /**
     * Returns the sort values of the last returned entity, one for each effective sort order.
     *
     * @return an immutable list of values
     */
    public List<Value> getSortValues() {
        return this.sortValues;
    }

    public String toWebSafeString() {
        final ByteArrayDataOutput out = ByteStreams.newDataOutput();
        out.writeByte(VERSION);
        writeKey(out, this.key);
        out.writeInt(this.sortValues.size());
        for (final Value value : this.sortValues) {
            writeValue(out, value);
        }
        return ENCODING.encode(out.toByteArray());
    }

    /**
     * Parses a cursor from its web-safe string representation.
     *
     * @param string
     *            the string produced by {@link #toWebSafeString()}
     * @return the parsed cursor
     * @throws IllegalArgumentException
     *             if the string is not a valid cursor
     */
    public static Cursor fromWebSafeString(final String string) throws IllegalArgumentException {
        try {
            final byte[] bytes = ENCODING.decode(string);
            final ByteArrayDataInput in = ByteStreams.newDataInput(bytes);
            final byte version = in.readByte();
            Preconditions.checkArgument(version == VERSION, "Unsupported cursor version %s",
                    version);
            final Key key = readKey(in, bytes.length);
            final int size = in.readInt();
            Preconditions.checkArgument(size >= 0 && size <= 1000, "Invalid cursor");
            final ImmutableList.Builder<Value> values = ImmutableList.builder();
            for (int i = 0; i < size; ++i) {
                values.add(readValue(in, bytes.length));
            }
            return new Cursor(key, values.build());
        } catch (final IllegalStateException ex) {
            throw new IllegalArgumentException("Invalid cursor '" + string + "'", ex);
        }
    }

    private static void writeKey(final ByteArrayDataOutput out, final Key key) {
        out.writeInt(key.getPath().size());
        for (final Key.Element element : key.getPath()) {
            writeString(out, element.getKind());
            if (element.getId() != null) {
                out.writeBoolean(true);
                out.writeLong(element.getId());
            } else {
                out.writeBoolean(false);
                writeString(out, element.getName());
            }
        }
    }

    private static Key readKey(final ByteArrayDataInput in, final int limit) {
        final int size = in.readInt();
        Preconditions.checkArgument(size > 0 && size <= 100, "Invalid cursor key length");
        final List<Key.Element> elements = Lists.newArrayListWithCapacity(size);
        for (int i = 0; i < size; ++i) {
            final String kind = readString(in, limit);
            elements.add(in.readBoolean() ? Key.Element.create(kind, in.readLong()) : Key.Element
                    .create(kind, readString(in, limit)));
        }
        return Key.fromElements(elements);
    }

    private static void writeValue(final ByteArrayDataOutput out, final Value value) {
        final Value.Type type = value.getType();
        writeString(out, type.getTag());
        switch (type) {
        case NULL:
            break;
        case INTEGER:
        case RATING:
            out.writeLong(value.asLong());
            break;
        case TIMESTAMP:
            out.writeLong(value.asTimestamp());
            break;
        case DOUBLE:
            out.writeDouble(value.asDouble());
            break;
        case BOOLEAN:
            out.writeBoolean(value.asBoolean());
            break;
        case KEY:
            writeKey(out, value.asKey());
            break;
        case GEO_PT:
            out.writeDouble(value.asGeoPt().getLatitude());
            out.writeDouble(value.asGeoPt().getLongitude());
            break;
        case USER:
            writeString(out, value.asUser().getEmail());
            writeString(out, value.asUser().getAuthDomain());
            break;
        case IM:
            writeString(out, value.asIm().getProtocol());
            writeString(out, value.asIm().getAddress());
            break;
        case BLOB: // TEXT and BLOB only occur as the extreme element of a sorted list
            writeBytes(out, value.asBytes());
            break;
        case LIST:
            throw new IllegalArgumentException("Value type " + type + " cannot be sorted");
        default:
            writeString(out, value.asString());
        }
    }

    private static Value readValue(final ByteArrayDataInput in, final int limit) {
        final Value.Type type = Value.Type.forTag(readString(in, limit));
        switch (type) {
        case NULL:
            return Value.ofNull();
        case INTEGER:
            return Value.of(in.readLong());
        case RATING:
            return Value.ofRating(in.readLong());
        case TIMESTAMP:
            return Value.ofTimestamp(in.readLong());
        case DOUBLE:
            return Value.of(in.readDouble());
        case BOOLEAN:
            return Value.of(in.readBoolean());
        case KEY:
            return Value.of(readKey(in, limit));
        case GEO_PT:
            return Value.of(new Value.GeoPt(in.readDouble(), in.readDouble()));
        case USER:
            return Value.of(new Value.User(readString(in, limit), readString(in, limit)));
        case IM:
            return Value.of(new Value.Im(readString(in, limit), readString(in, limit)));
        case STRING:
            return Value.of(readString(in, limit));
        case TEXT:
            return Value.ofText(readString(in, limit));
        case BLOB:
            return Value.of(readBytes(in, limit));
        case CATEGORY:
            return Value.ofCategory(readString(in, limit));
        case EMAIL:
            return Value.ofEmail(readString(in, limit));
        case LINK:
            return Value.ofLink(readString(in, limit));
        case PHONE_NUMBER:
            return Value.ofPhoneNumber(readString(in, limit));
        case POSTAL_ADDRESS:
            return Value.ofPostalAddress(readString(in, limit));
        default:
            throw new IllegalArgumentException("Unexpected cursor value type " + type);
        }
    }

    private static void writeString(final ByteArrayDataOutput out, final String string) {
        writeBytes(out, string.getBytes(StandardCharsets.UTF_8));
    }

    private static String readString(final ByteArrayDataInput in, final int limit) {
        return new String(readBytes(in, limit), StandardCharsets.UTF_8);
    }

    private static void writeBytes(final ByteArrayDataOutput out, final byte[] bytes) {
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static byte[] readBytes(final ByteArrayDataInput in, final int limit) {
        final int length = in.readInt();
        Preconditions.checkArgument(length >= 0 && length <= limit, "Invalid cursor");
        final byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Cursor)) {
            return false;
        }
        final Cursor other = (Cursor) object;
        return this.key.equals(other.key) && this.sortValues.equals(other.sortValues);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.key, this.sortValues);
    }

    @Override
    public String toString() {
        return toWebSafeString();
    }

}
