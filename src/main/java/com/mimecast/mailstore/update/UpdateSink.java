package com.mimecast.mailstore.update;

/**
 * Write side of an update stream.
 * <p>Implementations must accept concurrent writers.
 */
public interface UpdateSink {

    /**
     * Appends an update, waiting while the buffer is full.
     *
     * @param update Update to append.
     * @return false if the stream is closed and the update was not accepted.
     * @throws InterruptedException If interrupted while waiting for space.
     */
    boolean put(MailboxUpdate update) throws InterruptedException;
}
