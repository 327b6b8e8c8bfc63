package eu.fbk.docstore.runtime;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.util.Map;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable set of key/value configuration settings with typed accessors.
 * <p>
 * Settings are loaded from a properties file via {@link #load(String)}, which looks the path up
 * first on the classpath and then on the filesystem, or are built from an existing
 * {@code Properties} / {@code Map} object. Malformed values are reported with
 * {@code IllegalArgumentException}s naming the offending key.
 * </p>
 */
public final class Settings {

    private static final Logger LOGGER = LoggerFactory.getLogger(Settings.class);

    private final Map<String, String> map;

    private Settings(final Map<String, String> map) {
        this.map = ImmutableMap.copyOf(map);
    }

    /**
     * Loads settings from the properties file at the path specified, looked up first on the
     * classpath and then on the filesystem.
     *
     * @param path
     *            the path of the properties file
     * @return the loaded settings
     * @throws IllegalArgumentException
     *             if the file cannot be found or read
     */
    public static Settings load(final String path) throws IllegalArgumentException {
        final Properties properties = new Properties();
        final URL url = Settings.class.getClassLoader().getResource(path);
        try {
            if (url != null) {
                LOGGER.debug("Loading settings from classpath resource {}", url);
                try (Reader reader = Resources.asCharSource(url, Charsets.UTF_8).openStream()) {
                    properties.load(reader);
                }
            } else {
                final File file = new File(path);
                if (!file.isFile()) {
                    throw new IllegalArgumentException("Settings file " + path + " not found");
                }
                LOGGER.debug("Loading settings from file {}", file.getAbsolutePath());
                try (Reader reader = Files.newReader(file, Charsets.UTF_8)) {
                    properties.load(reader);
                }
            }
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Failed to load settings from " + path, ex);
        }
        return create(properties);
    }

    public static Settings create(final Properties properties) {
        final Map<String, String> map = Maps.newHashMap();
        for (final String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name).trim());
        }
        return new Settings(map);
    }

    public static Settings create(final Map<String, String> map) {
        return new Settings(map);
    }

    public Map<String, String> asMap() {
        return this.map;
    }

    @Nullable
    public String get(final String key) {
        return this.map.get(key);
    }

    public String get(final String key, final String defaultValue) {
        final String value = this.map.get(key);
        return value == null ? defaultValue : value;
    }

    public String getRequired(final String key) {
        final String value = this.map.get(key);
        Preconditions.checkArgument(value != null && !value.isEmpty(), "Missing setting %s", key);
        return value;
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        final String value = this.map.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        } else if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for setting " + key + ": " + value);
    }

    public int getInt(final String key, final int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    public long getLong(final String key, final long defaultValue) {
        final String value = this.map.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (final NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for setting " + key + ": "
                    + value, ex);
        }
    }

    @Override
    public String toString() {
        return this.map.toString();
    }

}
