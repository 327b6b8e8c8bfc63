package eu.fbk.docstore.mapping;

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;

import eu.fbk.docstore.UnsupportedTypeException;
import eu.fbk.docstore.data.Value;
import eu.fbk.docstore.runtime.DataCorruptedException;

/**
 * Encodes typed {@link Value}s as property sub-documents and backend natives.
 * <p>
 * Each property is stored as a sub-document {@code {t: <type tag>, v: <native>}}. Lists are
 * stored as {@code {t: "list", v: [<native>...], e: [<type tag>...]}}, so that {@code v} is the
 * single field to filter and sort on for both scalar and list properties; the {@code v} field is
 * omitted for empty lists, which therefore never match filters or sort orders. Natives are:
 * </p>
 * <ul>
 * <li>{@code null} for {@code NULL};</li>
 * <li>{@code String} for string-like types and for keys (encoded via {@link KeyCodec});</li>
 * <li>{@code Long} for {@code INTEGER} and {@code RATING}, {@code Double} for {@code DOUBLE},
 * {@code Boolean} for {@code BOOLEAN};</li>
 * <li>{@code Date} for {@code TIMESTAMP}, whose sub-millisecond part is truncated;</li>
 * <li>{@code byte[]} for {@code BLOB};</li>
 * <li>embedded documents with fixed field order for {@code GEO_PT} ({@code lat}, {@code lon}),
 * {@code USER} ({@code email}, {@code auth_domain}) and {@code IM} ({@code protocol},
 * {@code address}).</li>
 * </ul>
 */
public final class ValueCodec {

    /** Field of a property sub-document holding the type tag. */
    public static final String TYPE_FIELD = "t";

    /** Field of a property sub-document holding the native value(s). */
    public static final String VALUE_FIELD = "v";

    /** Field of a list property sub-document holding the element type tags. */
    public static final String ELEMENTS_FIELD = "e";

    private ValueCodec() {
    }

    /**
     * Encodes a Java object, converting it first via {@link Value#of(Object)}.
     *
     * @param object
     *            the object to encode
     * @return the property sub-document
     * @throws UnsupportedTypeException
     *             if the object cannot be represented
     */
    public static Map<String, Object> encode(@Nullable final Object object)
            throws UnsupportedTypeException {
        return encode(Value.of(object));
    }

    public static Map<String, Object> encode(final Value value) {
        final Map<String, Object> document = new LinkedHashMap<String, Object>();
        document.put(TYPE_FIELD, value.getType().getTag());
        if (value.getType() == Value.Type.LIST) {
            final List<Object> natives = Lists.newArrayList();
            final List<Object> tags = Lists.newArrayList();
            for (final Value element : value.asList()) {
                natives.add(encodeNative(element));
                tags.add(element.getType().getTag());
            }
            if (!natives.isEmpty()) {
                document.put(VALUE_FIELD, natives);
            }
            document.put(ELEMENTS_FIELD, tags);
        } else {
            document.put(VALUE_FIELD, encodeNative(value));
        }
        return document;
    }

    /**
     * Returns the native a scalar value is stored as, which is also the operand to use when
     * filtering on it.
     *
     * @param value
     *            the scalar value
     * @return the native, possibly null
     * @throws UnsupportedTypeException
     *             if the value is a list
     */
    @Nullable
    public static Object encodeNative(final Value value) throws UnsupportedTypeException {
        switch (value.getType()) {
        case NULL:
            return null;
        case INTEGER:
        case RATING:
            return value.asLong();
        case DOUBLE:
            return value.asDouble();
        case BOOLEAN:
            return value.asBoolean();
        case TIMESTAMP:
            return value.asDate();
        case BLOB:
            return value.asBytes();
        case KEY:
            return KeyCodec.encode(value.asKey());
        case GEO_PT:
            final Map<String, Object> point = new LinkedHashMap<String, Object>();
            point.put("lat", value.asGeoPt().getLatitude());
            point.put("lon", value.asGeoPt().getLongitude());
            return point;
        case USER:
            final Map<String, Object> user = new LinkedHashMap<String, Object>();
            user.put("email", value.asUser().getEmail());
            user.put("auth_domain", value.asUser().getAuthDomain());
            return user;
        case IM:
            final Map<String, Object> im = new LinkedHashMap<String, Object>();
            im.put("protocol", value.asIm().getProtocol());
            im.put("address", value.asIm().getAddress());
            return im;
        case LIST:
            throw new UnsupportedTypeException("Nested lists are not supported", null);
        default:
            return value.asString();
        }
    }

    /**
     * Decodes a property sub-document.
     *
     * @param document
     *            the property sub-document
     * @return the decoded value
     * @throws DataCorruptedException
     *             if the sub-document is malformed
     */
    public static Value decode(final Map<?, ?> document) throws DataCorruptedException {
        final Object tag = document.get(TYPE_FIELD);
        final Value.Type type = parseTag(tag);
        if (type != Value.Type.LIST) {
            return decodeNative(type, document.get(VALUE_FIELD));
        }
        final Object tags = document.get(ELEMENTS_FIELD);
        final Object natives = document.containsKey(VALUE_FIELD) ? document.get(VALUE_FIELD)
                : Lists.newArrayList();
        if (!(tags instanceof List<?>) || !(natives instanceof List<?>)
                || ((List<?>) tags).size() != ((List<?>) natives).size()) {
            throw new DataCorruptedException("Malformed list property " + document);
        }
        final List<Value> elements = Lists.newArrayList();
        for (int i = 0; i < ((List<?>) tags).size(); ++i) {
            final Value.Type elementType = parseTag(((List<?>) tags).get(i));
            if (elementType == Value.Type.LIST) {
                throw new DataCorruptedException("Nested list in property " + document);
            }
            elements.add(decodeNative(elementType, ((List<?>) natives).get(i)));
        }
        return Value.ofList(elements);
    }

    /**
     * Decodes the native of a scalar value of the type specified.
     *
     * @param type
     *            the value type, not {@code LIST}
     * @param object
     *            the native
     * @return the decoded value
     * @throws DataCorruptedException
     *             if the native does not match the type
     */
    public static Value decodeNative(final Value.Type type, @Nullable final Object object)
            throws DataCorruptedException {
        try {
            switch (type) {
            case NULL:
                check(object == null, type, object);
                return Value.ofNull();
            case STRING:
                return Value.of((String) checkNotNull(object, type));
            case TEXT:
                return Value.ofText((String) checkNotNull(object, type));
            case CATEGORY:
                return Value.ofCategory((String) checkNotNull(object, type));
            case EMAIL:
                return Value.ofEmail((String) checkNotNull(object, type));
            case LINK:
                return Value.ofLink((String) checkNotNull(object, type));
            case PHONE_NUMBER:
                return Value.ofPhoneNumber((String) checkNotNull(object, type));
            case POSTAL_ADDRESS:
                return Value.ofPostalAddress((String) checkNotNull(object, type));
            case INTEGER:
                return Value.of(((Number) checkNotNull(object, type)).longValue());
            case RATING:
                return Value.ofRating(((Number) checkNotNull(object, type)).longValue());
            case DOUBLE:
                return Value.of(((Number) checkNotNull(object, type)).doubleValue());
            case BOOLEAN:
                return Value.of(((Boolean) checkNotNull(object, type)).booleanValue());
            case TIMESTAMP:
                return Value.ofTimestamp(((Date) checkNotNull(object, type)).getTime() * 1000L);
            case BLOB:
                return Value.of((byte[]) checkNotNull(object, type));
            case KEY:
                return Value.of(KeyCodec.decode((String) checkNotNull(object, type)));
            case GEO_PT:
                final Map<?, ?> point = (Map<?, ?>) checkNotNull(object, type);
                return Value.of(new Value.GeoPt(((Number) point.get("lat")).doubleValue(),
                        ((Number) point.get("lon")).doubleValue()));
            case USER:
                final Map<?, ?> user = (Map<?, ?>) checkNotNull(object, type);
                return Value.of(new Value.User((String) user.get("email"), (String) user
                        .get("auth_domain")));
            case IM:
                final Map<?, ?> im = (Map<?, ?>) checkNotNull(object, type);
                return Value.of(new Value.Im((String) im.get("protocol"), (String) im
                        .get("address")));
            default:
                throw new DataCorruptedException("Unexpected value type " + type);
            }
        } catch (final ClassCastException | NullPointerException | IllegalArgumentException ex) {
            throw new DataCorruptedException("Invalid " + type.getTag() + " value " + object, ex);
        }
    }

    private static Value.Type parseTag(@Nullable final Object tag) throws DataCorruptedException {
        if (!(tag instanceof String)) {
            throw new DataCorruptedException("Missing or invalid value type tag " + tag);
        }
        try {
            return Value.Type.forTag((String) tag);
        } catch (final IllegalArgumentException ex) {
            throw new DataCorruptedException("Unknown value type tag '" + tag + "'", ex);
        }
    }

    private static Object checkNotNull(@Nullable final Object object, final Value.Type type)
            throws DataCorruptedException {
        check(object != null, type, object);
        return object;
    }

    private static void check(final boolean condition, final Value.Type type,
            @Nullable final Object object) throws DataCorruptedException {
        if (!condition) {
            throw new DataCorruptedException("Invalid " + type.getTag() + " value " + object);
        }
    }

}
