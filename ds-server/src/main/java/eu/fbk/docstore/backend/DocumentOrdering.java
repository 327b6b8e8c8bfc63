package eu.fbk.docstore.backend;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Longs;
import com.google.common.primitives.UnsignedBytes;

/**
 * Total ordering and helper functions for the native values stored in documents.
 * <p>
 * Natives are ordered first by type rank ({@code null} &lt; numbers &lt; strings &lt; embedded
 * documents &lt; binary data &lt; booleans &lt; dates), and then by value within the same rank:
 * numbers numerically regardless of their {@code Long} / {@code Double} representation, strings
 * by code point, embedded documents field by field, binary data by length and then byte-wise,
 * booleans with {@code false} first and dates chronologically. This is the ordering document
 * stores apply when sorting fields of mixed types.
 * </p>
 */
public final class DocumentOrdering {

    /** Comparator implementing the native ordering. */
    public static final Comparator<Object> COMPARATOR = new Comparator<Object>() {

        @Override
        public int compare(final Object first, final Object second) {
            return DocumentOrdering.compare(first, second);
        }

    };

    public static final int RANK_NULL = 1;

    public static final int RANK_NUMBER = 2;

    public static final int RANK_STRING = 3;

    public static final int RANK_DOCUMENT = 4;

    public static final int RANK_BINARY = 5;

    public static final int RANK_BOOLEAN = 6;

    public static final int RANK_DATE = 7;

    private DocumentOrdering() {
    }

    /**
     * Returns the type rank of a scalar native.
     *
     * @param value
     *            the native, not a list
     * @return the rank, one of the {@code RANK_XXX} constants
     * @throws IllegalArgumentException
     *             if the value is not a supported scalar native
     */
    public static int rank(@Nullable final Object value) {
        if (value == null) {
            return RANK_NULL;
        } else if (value instanceof Long || value instanceof Double) {
            return RANK_NUMBER;
        } else if (value instanceof String) {
            return RANK_STRING;
        } else if (value instanceof Map<?, ?>) {
            return RANK_DOCUMENT;
        } else if (value instanceof byte[]) {
            return RANK_BINARY;
        } else if (value instanceof Boolean) {
            return RANK_BOOLEAN;
        } else if (value instanceof Date) {
            return RANK_DATE;
        }
        throw new IllegalArgumentException("Unsupported native " + value.getClass().getName());
    }

    public static int compare(@Nullable final Object first, @Nullable final Object second) {
        final int firstRank = rank(first);
        final int secondRank = rank(second);
        if (firstRank != secondRank) {
            return firstRank - secondRank;
        }
        switch (firstRank) {
        case RANK_NULL:
            return 0;
        case RANK_NUMBER:
            return compareNumbers((Number) first, (Number) second);
        case RANK_STRING:
            return compareStrings((String) first, (String) second);
        case RANK_DOCUMENT:
            return compareDocuments((Map<?, ?>) first, (Map<?, ?>) second);
        case RANK_BINARY:
            final byte[] firstBytes = (byte[]) first;
            final byte[] secondBytes = (byte[]) second;
            return firstBytes.length != secondBytes.length ? firstBytes.length
                    - secondBytes.length : UnsignedBytes.lexicographicalComparator().compare(
                    firstBytes, secondBytes);
        case RANK_BOOLEAN:
            return Boolean.compare((Boolean) first, (Boolean) second);
        default:
            return Longs.compare(((Date) first).getTime(), ((Date) second).getTime());
        }
    }

    private static int compareNumbers(final Number first, final Number second) {
        if (first instanceof Long && second instanceof Long) {
            return Longs.compare(first.longValue(), second.longValue());
        }
        return Double.compare(first.doubleValue(), second.doubleValue());
    }

    private static int compareStrings(final String first, final String second) {
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

    private static int compareDocuments(final Map<?, ?> first, final Map<?, ?> second) {
        final Iterator<? extends Map.Entry<?, ?>> i = first.entrySet().iterator();
        final Iterator<? extends Map.Entry<?, ?>> j = second.entrySet().iterator();
        while (i.hasNext() && j.hasNext()) {
            final Map.Entry<?, ?> e1 = i.next();
            final Map.Entry<?, ?> e2 = j.next();
            int result = rank(e1.getValue()) - rank(e2.getValue());
            if (result == 0) {
                result = compareStrings((String) e1.getKey(), (String) e2.getKey());
            }
            if (result == 0) {
                result = compare(e1.getValue(), e2.getValue());
            }
            if (result != 0) {
                return result;
            }
        }
        return i.hasNext() ? 1 : j.hasNext() ? -1 : 0;
    }

    /**
     * Resolves a dotted path in a document, returning the values found there. Arrays found at
     * the end of the path are flattened, so that their elements are returned individually.
     *
     * @param document
     *            the document
     * @param path
     *            the dotted path
     * @return the values found, empty if the path does not exist; a single null element if the
     *         field exists with a null value
     */
    public static List<Object> resolve(final Map<String, ?> document, final String path) {
        final List<Object> result = Lists.newArrayList();
        resolve(document, path.split("\\."), 0, result);
        return result;
    }

    private static void resolve(@Nullable final Object node, final String[] path,
            final int index, final List<Object> result) {
        if (index == path.length) {
            if (node instanceof List<?>) {
                result.addAll((List<?>) node);
            } else {
                result.add(node);
            }
        } else if (node instanceof Map<?, ?>) {
            final Map<?, ?> map = (Map<?, ?>) node;
            if (map.containsKey(path[index])) {
                resolve(map.get(path[index]), path, index + 1, result);
            }
        } else if (node instanceof List<?>) {
            for (final Object element : (List<?>) node) {
                if (element instanceof Map<?, ?>) {
                    resolve(element, path, index, result);
                }
            }
        }
    }

    /**
     * Returns whether a dotted path exists in a document, possibly with a null value.
     *
     * @param document
     *            the document
     * @param path
     *            the dotted path
     * @return true if the path exists
     */
    public static boolean exists(final Map<String, ?> document, final String path) {
        Object node = document;
        for (final String name : path.split("\\.")) {
            if (!(node instanceof Map<?, ?>) || !((Map<?, ?>) node).containsKey(name)) {
                return false;
            }
            node = ((Map<?, ?>) node).get(name);
        }
        return true;
    }

    /**
     * Deep copies a native, checking that it (and anything it contains) is supported. Embedded
     * documents are copied into {@code LinkedHashMap}s so that field order is preserved.
     *
     * @param value
     *            the native to copy
     * @return the copy
     * @throws IllegalArgumentException
     *             if an unsupported native is found
     */
    @Nullable
    public static Object copy(@Nullable final Object value) {
        if (value instanceof List<?>) {
            final List<Object> list = Lists.newArrayListWithCapacity(((List<?>) value).size());
            for (final Object element : (List<?>) value) {
                list.add(copy(element));
            }
            return list;
        } else if (value instanceof Map<?, ?>) {
            final Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                map.put((String) entry.getKey(), copy(entry.getValue()));
            }
            return map;
        } else if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        } else if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        rank(value);
        return value;
    }

    /**
     * Compares natives for equality, comparing binary data by content and numbers by value
     * regardless of their representation.
     *
     * @param first
     *            the first native
     * @param second
     *            the second native
     * @return true if equal
     */
    public static boolean deepEquals(@Nullable final Object first, @Nullable final Object second) {
        if (first instanceof List<?> || second instanceof List<?>) {
            if (!(first instanceof List<?>) || !(second instanceof List<?>)) {
                return false;
            }
            final List<?> l1 = (List<?>) first;
            final List<?> l2 = (List<?>) second;
            if (l1.size() != l2.size()) {
                return false;
            }
            for (int i = 0; i < l1.size(); ++i) {
                if (!deepEquals(l1.get(i), l2.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return compare(first, second) == 0;
    }

    /**
     * Returns the minimum (for ascending sorts) or maximum (for descending sorts) of the values
     * at a path, as used when sorting on a field holding an array.
     *
     * @param document
     *            the document
     * @param path
     *            the dotted path
     * @param ascending
     *            true to return the minimum, false for the maximum
     * @return the sort key, null if the path is missing or holds an empty array
     */
    @Nullable
    public static Object sortKey(final Map<String, ?> document, final String path,
            final boolean ascending) {
        Object result = null;
        boolean first = true;
        for (final Object value : resolve(document, path)) {
            if (first || (ascending ? compare(value, result) < 0 : compare(value, result) > 0)) {
                result = value;
                first = false;
            }
        }
        return result;
    }

    public static String toString(@Nullable final Object value) {
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\u0001", "\\1").replace("\u0002", "\\2")
                    .replace("\u0003", "\\3").replace("\u0004", "\\4") + "\"";
        } else if (value instanceof byte[]) {
            return "0x" + BaseEncoding.base16().lowerCase().encode((byte[]) value);
        } else if (value instanceof Date) {
            return "date(" + ((Date) value).getTime() + ")";
        } else if (value instanceof List<?>) {
            final StringBuilder builder = new StringBuilder("[");
            for (final Object element : (List<?>) value) {
                builder.append(builder.length() > 1 ? ", " : "").append(toString(element));
            }
            return builder.append("]").toString();
        } else if (value instanceof Object[]) {
            return toString(Arrays.asList((Object[]) value));
        }
        return String.valueOf(value);
    }

}
