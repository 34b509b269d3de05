package com.mimecast.mailstore.update;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Read side of an ordered, bounded update stream.
 *
 * <p>A closed source still yields the updates buffered before closure.
 * <br>Once those are consumed, reads return {@code null} which marks the end of the stream.
 */
public interface UpdateSource {

    /**
     * Waits for the next update.
     *
     * @return Next update, or null once the source is closed and drained.
     * @throws InterruptedException If interrupted while waiting.
     */
    MailboxUpdate take() throws InterruptedException;

    /**
     * Waits up to the given time for the next update.
     *
     * @param timeout How long to wait.
     * @param unit    Timeout unit.
     * @return Next update, or null on timeout or end of stream.
     * @throws InterruptedException If interrupted while waiting.
     */
    MailboxUpdate poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Moves up to {@code max} buffered updates into the target without waiting.
     *
     * @param target Collection to add to.
     * @param max    Maximum number of updates to move.
     * @return Number of updates moved.
     */
    int drainTo(Collection<? super MailboxUpdate> target, int max);

    /**
     * Gets buffer capacity.
     *
     * @return Maximum number of buffered updates.
     */
    int capacity();

    /**
     * Gets number of buffered updates.
     *
     * @return Count.
     */
    int size();

    /**
     * Checks if the source is closed and has nothing left to read.
     *
     * @return Boolean.
     */
    boolean isDrained();
}
