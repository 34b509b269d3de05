package com.mimecast.mailstore.config;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Storage configuration.
 *
 * <p>This class provides type safe access to the storage node configuration.
 * <p>The storage engine itself reads more keys than these; only the ones the update pipe needs are exposed here.
 *
 * @see UpdatePipeConfig
 */
public class StorageConfig extends BasicConfig {

    /**
     * Constructs a new StorageConfig instance.
     */
    public StorageConfig() {
        super();
    }

    /**
     * Constructs a new StorageConfig instance.
     *
     * @param map Configuration map.
     */
    public StorageConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new StorageConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public StorageConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets storage driver name.
     *
     * @return Driver name, empty if not set.
     */
    public String getDriver() {
        return getStringProperty("driver", "");
    }

    /**
     * Gets data source name.
     * <p>Accepts either a single string or a list of strings.
     *
     * @return List of DSN parts.
     */
    public List<String> getDsn() {
        return getStringListProperty("dsn");
    }

    /**
     * Checks if debug logging is enabled.
     *
     * @return Boolean.
     */
    public boolean isDebug() {
        return getBooleanProperty("debug", false);
    }

    /**
     * Gets update pipe configuration.
     *
     * @return UpdatePipeConfig instance.
     */
    public UpdatePipeConfig getUpdatePipe() {
        return new UpdatePipeConfig(getMapProperty("updatePipe"));
    }
}
