package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.config.StorageConfig;

/**
 * Creates the update pipe for a storage node.
 * <p>Defaults to {@link UpdatePipeFactory#create(StorageConfig)}.
 */
@FunctionalInterface
public interface UpdatePipeProvider {

    /**
     * Creates a pipe that is not yet activated.
     *
     * @param config Storage configuration.
     * @return UpdatePipe instance.
     * @throws TransportUnavailableException No transport fits the configuration.
     */
    UpdatePipe create(StorageConfig config) throws TransportUnavailableException;
}
