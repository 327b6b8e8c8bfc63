package eu.fbk.docstore.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A datastore internal component.
 * <p>
 * This interface defines the basic lifecycle shared by the internal components of the datastore
 * (document backends and the datastore front end itself):
 * <ul>
 * <li>The {@code Component} instance is created starting from its configuration. In case the
 * configuration is incorrect an exception is thrown; otherwise the component is configured but
 * still inactive: no connection is opened and no persistent data is modified.</li>
 * <li>Method {@link #init()} is called to make the component operational; differently from the
 * constructor, it is allowed to allocate resources, connect to external services and modify
 * persisted data.</li>
 * <li>Method {@link #close()} is called to dispose the component, freeing allocated resources.
 * It can be called at any time after instantiation, even before initialization, and calling it
 * multiple times has no effect.</li>
 * </ul>
 * </p>
 * <p>
 * Components access external resources, hence methods in this interface and its specializations
 * may throw {@link IOException}s, including {@link DataCorruptedException} in case stored data is
 * found to be corrupted.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the component. This method is called after instantiation and before any other
     * instance method is called.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this component, freeing allocated resources. Stored data is not affected. Calling
     * this method on a component not initialized or already closed has no effect.
     */
    @Override
    void close();

}
