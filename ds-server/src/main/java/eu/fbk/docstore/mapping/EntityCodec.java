package eu.fbk.docstore.mapping;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.docstore.UnsupportedTypeException;
import eu.fbk.docstore.backend.DocumentStore;
import eu.fbk.docstore.data.Entity;
import eu.fbk.docstore.data.Key;
import eu.fbk.docstore.data.Value;
import eu.fbk.docstore.runtime.DataCorruptedException;

/**
 * Maps {@link Entity} objects to stored documents and back.
 * <p>
 * An entity is stored in the collection named after its kind, as a document with fields
 * {@code _id} (the key encoded via {@link KeyCodec}), {@code _kind}, {@code _parent} (the encoded
 * parent key, for root entities omitted) and {@code p}, a sub-document mapping each property name
 * to the property sub-document produced by {@link ValueCodec}. Property names are used as field
 * names, hence they must not be empty, start with {@code $}, contain {@code .} or start with the
 * reserved prefix {@code __}.
 * </p>
 */
public final class EntityCodec {

    public static final String ID_FIELD = DocumentStore.ID_FIELD;

    public static final String KIND_FIELD = "_kind";

    public static final String PARENT_FIELD = "_parent";

    public static final String PROPERTIES_FIELD = "p";

    private EntityCodec() {
    }

    /**
     * Returns the dotted path to filter or sort on for the property specified.
     *
     * @param property
     *            the property name
     * @return the path of the property native value(s)
     */
    public static String propertyPath(final String property) {
        return PROPERTIES_FIELD + "." + property + "." + ValueCodec.VALUE_FIELD;
    }

    /**
     * Checks that a property name can be stored.
     *
     * @param kind
     *            the kind the property belongs to, used in the error message
     * @param property
     *            the property name
     * @throws UnsupportedTypeException
     *             if the name cannot be used as a document field name
     */
    public static void checkPropertyName(final String kind, final String property)
            throws UnsupportedTypeException {
        final String problem;
        if (property.isEmpty()) {
            problem = "empty";
        } else if (property.startsWith(Key.RESERVED_PREFIX)) {
            problem = "reserved prefix " + Key.RESERVED_PREFIX;
        } else if (property.startsWith("$")) {
            problem = "leading $";
        } else if (property.indexOf('.') >= 0) {
            problem = "contains '.'";
        } else {
            return;
        }
        throw new UnsupportedTypeException("Invalid property name '" + property + "' ("
                + problem + ")", "kind " + kind);
    }

    /**
     * Encodes a complete entity.
     *
     * @param entity
     *            the entity
     * @return the document
     * @throws UnsupportedTypeException
     *             if some property cannot be stored
     */
    public static Map<String, Object> entityToDocument(final Entity entity)
            throws UnsupportedTypeException {
        final Key key = entity.getKey();
        final Map<String, Object> document = new LinkedHashMap<String, Object>();
        document.put(ID_FIELD, KeyCodec.encode(key));
        document.put(KIND_FIELD, key.getKind());
        if (key.getParent() != null) {
            document.put(PARENT_FIELD, KeyCodec.encode(key.getParent()));
        }
        final Map<String, Object> properties = new LinkedHashMap<String, Object>();
        for (final Map.Entry<String, Value> entry : entity.getProperties().entrySet()) {
            final String name = entry.getKey();
            checkPropertyName(key.getKind(), name);
            try {
                properties.put(name, ValueCodec.encode(entry.getValue()));
            } catch (final UnsupportedTypeException ex) {
                throw new UnsupportedTypeException(ex.getMessage(), "entity " + key
                        + ", property " + name, ex);
            }
        }
        document.put(PROPERTIES_FIELD, properties);
        return document;
    }

    /**
     * Decodes a stored document.
     *
     * @param document
     *            the document
     * @param kindHint
     *            the expected kind, null if unknown
     * @return the decoded entity
     * @throws DataCorruptedException
     *             if the document is malformed or of a different kind
     */
    public static Entity documentToEntity(final Map<String, Object> document,
            @Nullable final String kindHint) throws DataCorruptedException {
        final Object id = document.get(ID_FIELD);
        if (!(id instanceof String)) {
            throw new DataCorruptedException("Missing or invalid " + ID_FIELD + " in " + document);
        }
        final Key key;
        try {
            key = KeyCodec.decode((String) id);
        } catch (final IllegalArgumentException ex) {
            throw new DataCorruptedException("Invalid key in document " + document, ex);
        }
        if (kindHint != null && !kindHint.equals(key.getKind())) {
            throw new DataCorruptedException("Document " + key + " found where kind " + kindHint
                    + " was expected");
        }
        final Entity entity = new Entity(key);
        final Object properties = document.get(PROPERTIES_FIELD);
        if (properties != null) {
            if (!(properties instanceof Map<?, ?>)) {
                throw new DataCorruptedException("Invalid properties in document " + key);
            }
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) properties).entrySet()) {
                if (!(entry.getValue() instanceof Map<?, ?>)) {
                    throw new DataCorruptedException("Invalid property " + entry.getKey()
                            + " in document " + key);
                }
                try {
                    entity.set((String) entry.getKey(),
                            ValueCodec.decode((Map<?, ?>) entry.getValue()));
                } catch (final DataCorruptedException ex) {
                    throw new DataCorruptedException("Invalid property " + entry.getKey()
                            + " in document " + key + ": " + ex.getMessage(), ex);
                }
            }
        }
        return entity;
    }

}
