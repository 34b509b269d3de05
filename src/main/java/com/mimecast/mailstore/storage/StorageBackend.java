package com.mimecast.mailstore.storage;

import com.mimecast.mailstore.update.UpdateSource;

import java.io.Closeable;

/**
 * Storage engine as seen by the update pipe.
 *
 * <p>The engine publishes one update per mailbox mutation, in mutation order, on a bounded source.
 * <br>Implementations should create the source on first request so nothing piles up when nobody listens.
 */
public interface StorageBackend extends Closeable {

    /**
     * Gets the live update source.
     * <p>Repeated calls return the same source.
     *
     * @return UpdateSource with a fixed capacity.
     */
    UpdateSource getUpdates();

    /**
     * Gets the capacity of the update source without creating it.
     *
     * @return Positive capacity.
     */
    int getUpdatesCapacity();

    /**
     * Stops generating updates and closes the update source.
     * <p>Updates already buffered stay readable.
     */
    @Override
    void close();
}
