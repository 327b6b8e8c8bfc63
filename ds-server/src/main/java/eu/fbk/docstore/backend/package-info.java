/**
 * Document store backend SPI ({@code ds-server}).
 * <p>
 * This package defines the {@link eu.fbk.docstore.backend.DocumentStore} interface the datastore
 * maps entities onto, together with the backend-neutral filter, query and index objects it
 * accepts. It also provides an in-memory implementation
 * ({@link eu.fbk.docstore.backend.MemoryDocumentStore}, good for testing) and decorators for
 * forwarding and logging calls.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.backend;

