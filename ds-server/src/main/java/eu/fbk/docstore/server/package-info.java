/**
 * The document-backed {@code Datastore} implementation and its configuration.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.server;
