/**
 * Public datastore API ({@code ds-core}).
 * <p>
 * This package defines the {@link eu.fbk.docstore.Datastore} and
 * {@link eu.fbk.docstore.Transaction} interfaces used by application code, together with the
 * exceptions they may raise. All checked failures extend
 * {@link eu.fbk.docstore.DatastoreException}, an {@code IOException} carrying a description of
 * the failed operation.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore;

