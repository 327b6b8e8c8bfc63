package eu.fbk.docstore.mongo;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.docstore.runtime.Settings;

/**
 * Connection settings of a {@link MongoDocumentStore}.
 * <p>
 * Recognized settings: {@code mongo.host} (default {@code localhost}), {@code mongo.port}
 * (default 27017), {@code mongo.connect_timeout}, {@code mongo.socket_timeout} and
 * {@code mongo.server_selection_timeout} (milliseconds, defaults 10000, 0 = none and 30000).
 * </p>
 */
public final class MongoConfigurations {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoConfigurations.class);

    public static final int DEFAULT_PORT = 27017;

    private final String host;

    private final int port;

    private final int connectTimeout;

    private final int socketTimeout;

    private final int serverSelectionTimeout;

    public MongoConfigurations(final Settings settings) {
        this.host = settings.get("mongo.host", "localhost");
        this.port = settings.getInt("mongo.port", DEFAULT_PORT);
        this.connectTimeout = settings.getInt("mongo.connect_timeout", 10000);
        this.socketTimeout = settings.getInt("mongo.socket_timeout", 0);
        this.serverSelectionTimeout = settings.getInt("mongo.server_selection_timeout", 30000);
        Preconditions.checkArgument(this.port > 0 && this.port < 65536, "Invalid port %s",
                this.port);
        Preconditions.checkArgument(this.connectTimeout >= 0 && this.socketTimeout >= 0
                && this.serverSelectionTimeout >= 0, "Negative timeout");
        LOGGER.debug("MongoDB configuration loaded: {}", this);
    }

    public static MongoConfigurations load(final String path) {
        return new MongoConfigurations(Settings.load(path));
    }

    public String getHost() {
        return this.host;
    }

    public int getPort() {
        return this.port;
    }

    public int getConnectTimeout() {
        return this.connectTimeout;
    }

    public int getSocketTimeout() {
        return this.socketTimeout;
    }

    public int getServerSelectionTimeout() {
        return this.serverSelectionTimeout;
    }

    @Override
    public String toString() {
        return "host=" + this.host + ", port=" + this.port + ", connect_timeout="
                + this.connectTimeout + ", socket_timeout=" + this.socketTimeout
                + ", server_selection_timeout=" + this.serverSelectionTimeout;
    }

}
