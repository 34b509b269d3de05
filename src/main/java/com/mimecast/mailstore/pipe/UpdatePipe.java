package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateSink;

import java.io.Closeable;

/**
 * Replication channel between storage nodes sharing one mail store.
 *
 * <p>Receiving, transmitting and releasing are independent so a node may act as source, sink or both.
 * <br>A failure in one direction does not prevent the other from working.
 *
 * <p>Lifecycle of one handle:
 * <ol>
 *   <li>{@link #listen(UpdateSink)} at most once, if remote updates are wanted</li>
 *   <li>{@link #initPush()} at most once</li>
 *   <li>{@link #push(MailboxUpdate)} for every local update</li>
 *   <li>{@link #close()} once all pushing is done</li>
 * </ol>
 *
 * <p>Implementations drop updates they published themselves when those come back through the listener.
 */
public interface UpdatePipe extends Closeable {

    /**
     * Starts delivering updates originated by other nodes into the sink.
     * <p>Listening runs in the background until {@link #close()}.
     *
     * @param sink Write side of the local update stream.
     * @throws TransportUnavailableException Transport cannot be bound.
     * @throws AlreadyActiveException        Already listening.
     */
    void listen(UpdateSink sink) throws TransportUnavailableException, AlreadyActiveException;

    /**
     * Prepares the pipe to publish updates.
     *
     * @throws TransportUnavailableException Transport cannot be connected.
     * @throws AlreadyActiveException        Push already initialized.
     */
    void initPush() throws TransportUnavailableException, AlreadyActiveException;

    /**
     * Publishes one update to other nodes, fire once.
     * <p>If push was not initialized, one connection attempt is made first.
     *
     * @param update Update to publish.
     * @throws TransmitFailureException Update could not be published.
     */
    void push(MailboxUpdate update) throws TransmitFailureException;

    /**
     * Stops background activity and frees transport resources.
     * <p>Idempotent, and a no-op on a handle that was never activated.
     */
    @Override
    void close();
}
