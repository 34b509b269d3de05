package com.mimecast.mailstore.storage;

import com.mimecast.mailstore.config.StorageConfig;
import com.mimecast.mailstore.config.UpdatePipeConfig;
import com.mimecast.mailstore.main.Config;
import com.mimecast.mailstore.pipe.AlreadyActiveException;
import com.mimecast.mailstore.pipe.AlreadyConsumingException;
import com.mimecast.mailstore.pipe.PipeMode;
import com.mimecast.mailstore.pipe.TransportUnavailableException;
import com.mimecast.mailstore.pipe.UpdatePipe;
import com.mimecast.mailstore.pipe.UpdatePipeException;
import com.mimecast.mailstore.pipe.UpdatePipeFactory;
import com.mimecast.mailstore.pipe.UpdatePipeProvider;
import com.mimecast.mailstore.pipe.metrics.UpdatePipeMetrics;
import com.mimecast.mailstore.update.UpdateQueue;
import com.mimecast.mailstore.update.UpdateSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;

/**
 * Storage node owning the backend, the optional update pipe and the local update stream.
 *
 * <p>Without a pipe, {@link #getUpdates()} hands out the backend source directly.
 * <br>With a pipe, an {@link UpdateForwarder} sits between the backend and a local stream of twice the
 * backend capacity, and remote updates arrive on that same stream.
 *
 * <p>The pipe must be enabled before anything reads updates.
 */
public class MailStorage implements Closeable {
    private static final Logger log = LogManager.getLogger(MailStorage.class);

    private final StorageBackend backend;
    private final StorageConfig config;
    private final UpdatePipeProvider pipeProvider;

    private UpdatePipe pipe;
    private UpdateForwarder forwarder;
    private UpdateQueue localUpdates;
    private volatile UpdateSource updates;
    private boolean closed = false;

    /**
     * Constructs a new MailStorage instance using the global storage configuration.
     *
     * @param backend Storage backend.
     */
    public MailStorage(StorageBackend backend) {
        this(backend, Config.getStorage());
    }

    /**
     * Constructs a new MailStorage instance.
     *
     * @param backend Storage backend.
     * @param config  Storage configuration.
     */
    public MailStorage(StorageBackend backend, StorageConfig config) {
        this(backend, config, UpdatePipeFactory::create);
    }

    /**
     * Constructs a new MailStorage instance with a custom pipe provider.
     *
     * @param backend      Storage backend.
     * @param config       Storage configuration.
     * @param pipeProvider Update pipe provider.
     */
    public MailStorage(StorageBackend backend, StorageConfig config, UpdatePipeProvider pipeProvider) {
        this.backend = backend;
        this.config = config;
        this.pipeProvider = pipeProvider;
    }

    /**
     * Applies the update pipe configuration.
     * <p>When {@code updatePipe.enabled} is set, the pipe is enabled in the configured mode.
     * <br>An unavailable transport is logged and the node carries on local only.
     *
     * @return Self.
     * @throws UpdatePipeException Pipe activation misuse.
     */
    public MailStorage open() throws UpdatePipeException {
        UpdatePipeConfig pipeConfig = config.getUpdatePipe();
        if (!pipeConfig.isEnabled()) {
            log.info("Update pipe disabled, local updates only");
            return this;
        }

        UpdatePipeMetrics.initialize();
        try {
            enableUpdatePipe(pipeConfig.getMode());
        } catch (TransportUnavailableException e) {
            log.warn("Update pipe unavailable, local updates only: {}", e.getMessage());
        }
        return this;
    }

    /**
     * Enables cross node update exchange.
     * <p>On failure the pipe is released and the node stays local only.
     *
     * @param mode Pipe mode.
     * @throws AlreadyActiveException        Pipe already enabled or storage closed.
     * @throws AlreadyConsumingException     Backend updates already handed out.
     * @throws TransportUnavailableException Pipe cannot be created or activated.
     */
    public synchronized void enableUpdatePipe(PipeMode mode) throws UpdatePipeException {
        if (closed) {
            throw new AlreadyActiveException("Storage is closed");
        }
        if (pipe != null) {
            throw new AlreadyActiveException("Update pipe already enabled in " + forwarder.getMode().getName() + " mode");
        }
        if (updates != null) {
            throw new AlreadyConsumingException("Update pipe must be enabled before updates are consumed");
        }

        UpdatePipe candidate = pipeProvider.create(config);
        UpdateQueue queue = new UpdateQueue(Math.multiplyExact(backend.getUpdatesCapacity(), 2));
        try {
            if (mode.isListening()) {
                candidate.listen(queue);
            }
            candidate.initPush();
        } catch (UpdatePipeException e) {
            log.error("Update pipe activation failed in {} mode: {}", mode.getName(), e.getMessage());
            candidate.close();
            queue.close();
            throw e;
        }

        // Claimed only once the pipe is up so a failed activation leaves no unread source behind.
        UpdateSource source = backend.getUpdates();
        UpdateForwarder candidateForwarder = new UpdateForwarder(source, candidate, queue, mode,
                config.getUpdatePipe().getStopPollMillis());
        candidateForwarder.start();

        pipe = candidate;
        forwarder = candidateForwarder;
        localUpdates = queue;
        updates = queue;
        log.info("Update pipe enabled in {} mode", mode.getName());
    }

    /**
     * Gets the update stream for local consumers.
     * <p>Memoized. Without a pipe this claims the backend source.
     *
     * @return UpdateSource instance.
     */
    public UpdateSource getUpdates() {
        UpdateSource current = updates;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (updates == null) {
                updates = backend.getUpdates();
            }
            return updates;
        }
    }

    /**
     * Checks if the update pipe is enabled.
     *
     * @return Boolean.
     */
    public synchronized boolean isReplicating() {
        return pipe != null;
    }

    /**
     * Gets storage backend.
     *
     * @return StorageBackend instance.
     */
    public StorageBackend getBackend() {
        return backend;
    }

    /**
     * Shuts down the node.
     * <p>The backend stops first, then the forwarder drains, then the pipe and the local stream close.
     * <br>Idempotent. Runs without holding the storage lock so consumers can keep draining the local stream.
     */
    @Override
    public void close() {
        UpdateForwarder stoppingForwarder;
        UpdatePipe closingPipe;
        UpdateQueue closingUpdates;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            stoppingForwarder = forwarder;
            closingPipe = pipe;
            closingUpdates = localUpdates;
        }

        backend.close();
        if (stoppingForwarder != null) {
            stoppingForwarder.stop();
        }
        if (closingPipe != null) {
            closingPipe.close();
        }
        if (closingUpdates != null) {
            closingUpdates.close();
        }
        log.info("Mail storage closed");
    }
}
