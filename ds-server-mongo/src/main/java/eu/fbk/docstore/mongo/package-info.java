/**
 * MongoDB implementation of the {@code DocumentStore} backend.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.mongo;
