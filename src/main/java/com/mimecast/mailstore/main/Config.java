package com.mimecast.mailstore.main;

import com.mimecast.mailstore.config.StorageConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Master configuration initializer and container.
 *
 * <p>StorageConfig holds the storage node configuration including the update pipe settings.
 * <p>Until initialized an empty configuration is returned which leaves the update pipe disabled.
 *
 * @see StorageConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Storage configuration filename inside the configuration directory.
     */
    public static final String STORAGE_FILENAME = "storage.json5";

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Storage configuration.
     */
    private static volatile StorageConfig storage = new StorageConfig();

    /**
     * Gets storage config.
     *
     * @return StorageConfig.
     */
    public static StorageConfig getStorage() {
        return storage;
    }

    /**
     * Init storage config from file.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initStorage(String path) throws IOException {
        storage = new StorageConfig(path);
        log.info("Loaded storage configuration: {}", path);
    }

    /**
     * Init storage config from a configuration directory.
     *
     * @param dir Directory containing {@code storage.json5}.
     * @throws IOException Unable to read file.
     */
    public static void init(String dir) throws IOException {
        initStorage(Paths.get(dir, STORAGE_FILENAME).toString());
    }

    /**
     * Replaces the storage config.
     * <p>Used by embedded setups and tests that build configuration in code.
     *
     * @param config StorageConfig instance.
     */
    public static void setStorage(StorageConfig config) {
        storage = config != null ? config : new StorageConfig();
    }
}
