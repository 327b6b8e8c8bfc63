package eu.fbk.docstore.mapping;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import eu.fbk.docstore.data.Key;

/**
 * Encodes {@link Key}s as order-preserving strings, used as document identifiers.
 * <p>
 * A key is encoded by joining its path elements with {@link #ELEMENT_SEPARATOR}; each element is
 * encoded as its kind, followed by {@link #KIND_SEPARATOR} and by a token that is either
 * {@link #ID_MARKER} followed by the numeric ID zero-padded to 19 digits, or
 * {@link #NAME_MARKER} followed by the name. As kinds and names cannot contain control
 * characters, the encoding is lossless, and comparing encoded keys by code point yields the same
 * order of {@link Key#compareTo(Key)}: in particular, the encodings of all the descendants of a
 * key share the prefix returned by {@link #ancestorPrefix(Key)}.
 * </p>
 */
public final class KeyCodec {

    public static final char ELEMENT_SEPARATOR = '\u0001';

    public static final char KIND_SEPARATOR = '\u0002';

    public static final char ID_MARKER = '\u0003';

    public static final char NAME_MARKER = '\u0004';

    private static final int ID_DIGITS = 19;

    private static final Splitter ELEMENT_SPLITTER = Splitter.on(ELEMENT_SEPARATOR);

    private KeyCodec() {
    }

    /**
     * Encodes a complete key.
     *
     * @param key
     *            the key to encode
     * @return the encoded key
     * @throws IllegalArgumentException
     *             if the key is incomplete
     */
    public static String encode(final Key key) throws IllegalArgumentException {
        Preconditions.checkArgument(key.isComplete(), "Cannot encode incomplete key %s", key);
        final StringBuilder builder = new StringBuilder();
        for (final Key.Element element : key.getPath()) {
            if (builder.length() > 0) {
                builder.append(ELEMENT_SEPARATOR);
            }
            builder.append(element.getKind()).append(KIND_SEPARATOR);
            if (element.getId() != null) {
                builder.append(ID_MARKER).append(
                        Strings.padStart(Long.toString(element.getId()), ID_DIGITS, '0'));
            } else {
                builder.append(NAME_MARKER).append(element.getName());
            }
        }
        return builder.toString();
    }

    /**
     * Decodes a key previously encoded with {@link #encode(Key)}.
     *
     * @param string
     *            the encoded key
     * @return the decoded key
     * @throws IllegalArgumentException
     *             if the string is not a valid key encoding
     */
    public static Key decode(final String string) throws IllegalArgumentException {
        final List<Key.Element> elements = Lists.newArrayList();
        for (final String token : ELEMENT_SPLITTER.split(string)) {
            final int index = token.indexOf(KIND_SEPARATOR);
            if (index <= 0 || index == token.length() - 1) {
                throw new IllegalArgumentException("Malformed key element in '"
                        + printable(string) + "'");
            }
            final String kind = token.substring(0, index);
            final char marker = token.charAt(index + 1);
            final String identifier = token.substring(index + 2);
            if (marker == ID_MARKER) {
                if (identifier.length() != ID_DIGITS) {
                    throw new IllegalArgumentException("Malformed numeric ID in '"
                            + printable(string) + "'");
                }
                final long id;
                try {
                    id = Long.parseLong(identifier);
                } catch (final NumberFormatException ex) {
                    throw new IllegalArgumentException("Malformed numeric ID in '"
                            + printable(string) + "'", ex);
                }
                elements.add(Key.Element.create(kind, id));
            } else if (marker == NAME_MARKER) {
                elements.add(Key.Element.create(kind, identifier));
            } else {
                throw new IllegalArgumentException("Unknown identifier marker in '"
                        + printable(string) + "'");
            }
        }
        return Key.fromElements(elements);
    }

    /**
     * Returns the prefix shared by the encodings of all the strict descendants of a key.
     *
     * @param ancestor
     *            the complete ancestor key
     * @return the encoded ancestor followed by the element separator
     */
    public static String ancestorPrefix(final Key ancestor) {
        return encode(ancestor) + ELEMENT_SEPARATOR;
    }

    /**
     * Renders an encoded key in a readable way, replacing control characters.
     *
     * @param encoded
     *            the encoded key
     * @return a printable string
     */
    public static String printable(final String encoded) {
        final StringBuilder builder = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); ++i) {
            final char c = encoded.charAt(i);
            if (c == ELEMENT_SEPARATOR) {
                builder.append('/');
            } else if (c == KIND_SEPARATOR) {
                builder.append(':');
            } else if (c == ID_MARKER) {
                builder.append('#');
            } else if (c == NAME_MARKER) {
                builder.append('$');
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

}
