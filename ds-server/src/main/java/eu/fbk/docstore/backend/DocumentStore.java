package eu.fbk.docstore.backend;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.docstore.runtime.Component;

/**
 * A document store backend, organized in named collections of documents.
 * <p>
 * A document is a {@code Map<String, Object>} identified by the string in its {@link #ID_FIELD}
 * field. Field values are <i>natives</i>: {@code null}, {@code String}, {@code Long},
 * {@code Double}, {@code Boolean}, {@code Date}, {@code byte[]}, {@code List}s of natives and
 * nested {@code Map<String, Object>} documents (whose field order is preserved). Documents passed
 * to and returned by a {@code DocumentStore} are never shared with it: implementations copy them
 * as needed.
 * </p>
 * <p>
 * Single-document operations are atomic. Implementations must be thread safe. Failures to reach
 * the backend are reported as {@link eu.fbk.docstore.BackendUnavailableException}s, other
 * failures as generic {@code IOException}s.
 * </p>
 */
public interface DocumentStore extends Component {

    /** The field holding the document identifier. */
    String ID_FIELD = "_id";

    /**
     * Retrieves a document by identifier.
     *
     * @param collection
     *            the collection name
     * @param id
     *            the document identifier
     * @return the document, or null if it does not exist
     * @throws IOException
     *             on failure
     */
    @Nullable
    Map<String, Object> get(String collection, String id) throws IOException;

    /**
     * Stores a document, replacing any document with the same identifier.
     *
     * @param collection
     *            the collection name
     * @param document
     *            the document, which must contain a string {@link #ID_FIELD}
     * @throws IOException
     *             on failure
     */
    void put(String collection, Map<String, Object> document) throws IOException;

    /**
     * Deletes a document, if it exists.
     *
     * @param collection
     *            the collection name
     * @param id
     *            the document identifier
     * @return true if a document was deleted
     * @throws IOException
     *             on failure
     */
    boolean delete(String collection, String id) throws IOException;

    /**
     * Returns the documents matching a query, in the query sort order.
     *
     * @param collection
     *            the collection name
     * @param query
     *            the query
     * @return the matching documents, after skip and limit are applied
     * @throws IOException
     *             on failure
     */
    List<Map<String, Object>> find(String collection, DocumentQuery query) throws IOException;

    long count(String collection, DocumentFilter filter) throws IOException;

    /**
     * Atomically increments a numeric field of a document, creating the document (with the field
     * initialized to zero) if missing.
     *
     * @param collection
     *            the collection name
     * @param id
     *            the document identifier
     * @param field
     *            the field to increment
     * @param delta
     *            the increment
     * @return the value of the field after the increment
     * @throws IOException
     *             on failure
     */
    long increment(String collection, String id, String field, long delta) throws IOException;

    /**
     * Lists the compound indexes of a collection, excluding the built-in identifier index.
     *
     * @param collection
     *            the collection name
     * @return the indexes, empty if the collection does not exist
     * @throws IOException
     *             on failure
     */
    List<DocumentIndex> listIndexes(String collection) throws IOException;

    /**
     * Creates an index, waiting for its creation to complete. Creating an index that already
     * exists has no effect.
     *
     * @param collection
     *            the collection name
     * @param index
     *            the index to create
     * @throws IOException
     *             on failure
     */
    void createIndex(String collection, DocumentIndex index) throws IOException;

}
