/**
 * Datastore data model: keys, typed values, entities, queries, cursors and index descriptors.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.data;

