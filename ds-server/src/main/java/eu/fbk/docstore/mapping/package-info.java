/**
 * Mapping of datastore entities, keys, values and queries onto documents ({@code ds-server}).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.mapping;

