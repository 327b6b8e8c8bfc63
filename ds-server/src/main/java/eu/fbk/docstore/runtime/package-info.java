/**
 * Runtime support shared by datastore components ({@code ds-server}): component lifecycle,
 * configuration loading and data corruption signalling.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.docstore.runtime;

