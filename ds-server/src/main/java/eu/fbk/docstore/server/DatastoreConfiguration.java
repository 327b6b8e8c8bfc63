package eu.fbk.docstore.server;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.data.IndexDescriptor;
import eu.fbk.docstore.data.Query.Direction;
import eu.fbk.docstore.data.Query.Order;
import eu.fbk.docstore.mapping.IdAllocator;
import eu.fbk.docstore.runtime.Settings;

/**
 * Configuration of a {@link DocumentDatastore}.
 * <p>
 * Recognized settings:
 * </p>
 * <ul>
 * <li>{@code datastore.app_id} (required) - the application identifier, used as database
 * name;</li>
 * <li>{@code datastore.require_indexes} (default false) - enables strict index mode;</li>
 * <li>{@code datastore.counters_collection} (default {@code __counters__}) - the collection
 * holding ID counters;</li>
 * <li>{@code datastore.log_calls} (default false) - logs backend calls at DEBUG level;</li>
 * <li>{@code datastore.index.<n>} - declared composite indexes, in the form
 * {@code Kind [ancestor]: prop1 [asc|desc], prop2 [asc|desc], ...}, created at initialization in
 * strict mode.</li>
 * </ul>
 */
public final class DatastoreConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatastoreConfiguration.class);

    private static final String INDEX_PREFIX = "datastore.index.";

    private final String appId;

    private final boolean requireIndexes;

    private final String countersCollection;

    private final boolean logCalls;

    private final List<IndexDescriptor> indexes;

    public DatastoreConfiguration(final Settings settings) {
        this.appId = settings.getRequired("datastore.app_id");
        this.requireIndexes = settings.getBoolean("datastore.require_indexes", false);
        this.countersCollection = settings.get("datastore.counters_collection",
                IdAllocator.DEFAULT_COLLECTION);
        this.logCalls = settings.getBoolean("datastore.log_calls", false);

        final Map<String, String> sorted = new TreeMap<String, String>();
        for (final Map.Entry<String, String> entry : settings.asMap().entrySet()) {
            if (entry.getKey().startsWith(INDEX_PREFIX)) {
                sorted.put(entry.getKey(), entry.getValue());
            }
        }
        final List<IndexDescriptor> indexes = Lists.newArrayList();
        for (final Map.Entry<String, String> entry : sorted.entrySet()) {
            try {
                indexes.add(parseIndex(entry.getValue()));
            } catch (final IllegalArgumentException ex) {
                throw new IllegalArgumentException("Invalid index declaration " + entry.getKey()
                        + ": " + ex.getMessage(), ex);
            }
        }
        this.indexes = ImmutableList.copyOf(indexes);

        LOGGER.debug("Datastore configuration loaded: app_id={}, require_indexes={}, "
                + "counters_collection={}, log_calls={}, {} declared indexes", this.appId,
                this.requireIndexes, this.countersCollection, this.logCalls, indexes.size());
    }

    /**
     * Loads the configuration from the properties file specified, looked up on the classpath
     * first and then on the filesystem.
     *
     * @param path
     *            the path of the properties file
     * @return the loaded configuration
     */
    public static DatastoreConfiguration load(final String path) {
        return new DatastoreConfiguration(Settings.load(path));
    }

    public static DatastoreConfiguration create(final Properties properties) {
        return new DatastoreConfiguration(Settings.create(properties));
    }

    /**
     * Parses an index declaration of the form
     * {@code Kind [ancestor]: prop1 [asc|desc], prop2 [asc|desc], ...}.
     *
     * @param declaration
     *            the declaration to parse
     * @return the parsed index descriptor
     * @throws IllegalArgumentException
     *             if the declaration is malformed
     */
    public static IndexDescriptor parseIndex(final String declaration)
            throws IllegalArgumentException {
        final int index = declaration.indexOf(':');
        if (index < 0) {
            throw new IllegalArgumentException("Missing ':' in '" + declaration + "'");
        }
        final List<String> head = Splitter.on(' ').trimResults().omitEmptyStrings()
                .splitToList(declaration.substring(0, index));
        if (head.isEmpty() || head.size() > 2 || head.size() == 2
                && !"ancestor".equalsIgnoreCase(head.get(1))) {
            throw new IllegalArgumentException("Invalid kind specification in '" + declaration
                    + "'");
        }
        final List<Order> orders = Lists.newArrayList();
        for (final String property : Splitter.on(',').trimResults().omitEmptyStrings()
                .split(declaration.substring(index + 1))) {
            final List<String> tokens = Splitter.on(' ').omitEmptyStrings().splitToList(property);
            Direction direction = Direction.ASCENDING;
            if (tokens.size() == 2 && "desc".equalsIgnoreCase(tokens.get(1))) {
                direction = Direction.DESCENDING;
            } else if (tokens.size() != 1
                    && (tokens.size() != 2 || !"asc".equalsIgnoreCase(tokens.get(1)))) {
                throw new IllegalArgumentException("Invalid property specification '"
                        + property + "'");
            }
            orders.add(new Order(tokens.get(0), direction));
        }
        if (orders.isEmpty()) {
            throw new IllegalArgumentException("No properties in '" + declaration + "'");
        }
        return new IndexDescriptor(head.get(0), head.size() == 2, orders);
    }

    public String getAppId() {
        return this.appId;
    }

    public boolean isRequireIndexes() {
        return this.requireIndexes;
    }

    public String getCountersCollection() {
        return this.countersCollection;
    }

    public boolean isLogCalls() {
        return this.logCalls;
    }

    public List<IndexDescriptor> getIndexes() {
        return this.indexes;
    }

    @Override
    public String toString() {
        return "app_id=" + this.appId + ", require_indexes=" + this.requireIndexes
                + ", counters_collection=" + this.countersCollection + ", log_calls="
                + this.logCalls + ", indexes=" + this.indexes;
    }

}
