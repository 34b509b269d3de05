package com.mimecast.mailstore.storage;

import com.mimecast.mailstore.pipe.AlreadyActiveException;
import com.mimecast.mailstore.pipe.PipeMode;
import com.mimecast.mailstore.pipe.TransmitFailureException;
import com.mimecast.mailstore.pipe.UpdatePipe;
import com.mimecast.mailstore.pipe.metrics.UpdatePipeMetrics;
import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateSink;
import com.mimecast.mailstore.update.UpdateSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background task moving backend updates to the pipe and the local update stream.
 *
 * <p>Every update read from the source is pushed to the pipe first.
 * <br>Unless the mode is {@link PipeMode#PUSH} it is then put on the local stream, blocking while that is full.
 * <br>A failed push never prevents local delivery.
 * <br>Unexpected faults while handling one update, errors included, are logged and counted and the loop moves on.
 *
 * <p>Shutdown is a two step handshake over single use latches:
 * <ol>
 *   <li>{@link #stop()} counts down the stop request</li>
 *   <li>the task forwards whatever the source still buffers, then counts down the acknowledgement</li>
 * </ol>
 * <p>Nothing is forwarded after the acknowledgement.
 */
public class UpdateForwarder {
    private static final Logger log = LogManager.getLogger(UpdateForwarder.class);

    private static final AtomicInteger instances = new AtomicInteger();

    /**
     * Forwarder lifecycle.
     */
    public enum State {
        UNINITIALIZED,
        RUNNING,
        STOPPING,
        STOPPED
    }

    private final UpdateSource source;
    private final UpdatePipe pipe;
    private final UpdateSink local;
    private final PipeMode mode;
    private final long stopPollMillis;

    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private final CountDownLatch stopAcknowledged = new CountDownLatch(1);

    private volatile State state = State.UNINITIALIZED;
    private Thread thread;

    /**
     * Constructs a new UpdateForwarder instance.
     *
     * @param source         Backend update source.
     * @param pipe           Pipe to push every update to.
     * @param local          Local update stream.
     * @param mode           Pipe mode.
     * @param stopPollMillis How long one source read waits before checking for a stop request.
     */
    public UpdateForwarder(UpdateSource source, UpdatePipe pipe, UpdateSink local, PipeMode mode, long stopPollMillis) {
        this.source = source;
        this.pipe = pipe;
        this.local = local;
        this.mode = mode;
        this.stopPollMillis = Math.max(1L, stopPollMillis);
    }

    /**
     * Gets current state.
     *
     * @return State.
     */
    public State getState() {
        return state;
    }

    /**
     * Gets pipe mode.
     *
     * @return PipeMode.
     */
    public PipeMode getMode() {
        return mode;
    }

    /**
     * Starts the forwarding thread.
     *
     * @throws AlreadyActiveException Forwarder was started before.
     */
    public synchronized void start() throws AlreadyActiveException {
        if (state != State.UNINITIALIZED) {
            throw new AlreadyActiveException("Update forwarder is " + state.name().toLowerCase());
        }

        thread = new Thread(this::run, "update-forwarder-" + instances.incrementAndGet());
        thread.setDaemon(true);
        state = State.RUNNING;
        thread.start();
        log.info("Update forwarder started in {} mode", mode.getName());
    }

    /**
     * Stops the forwarding thread.
     * <p>Blocks until every update buffered in the source at the time of the call has been forwarded.
     * <br>Returns immediately if the forwarder is already stopped or was never started.
     */
    public void stop() {
        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            if (state == State.UNINITIALIZED) {
                state = State.STOPPED;
                return;
            }
            if (state == State.RUNNING) {
                state = State.STOPPING;
                stopRequested.countDown();
            }
        }

        boolean interrupted = false;
        while (true) {
            try {
                stopAcknowledged.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        synchronized (this) {
            state = State.STOPPED;
        }
        log.info("Update forwarder stopped");
    }

    private void run() {
        try {
            while (true) {
                if (stopRequested.getCount() == 0) {
                    drainRemaining();
                    return;
                }

                MailboxUpdate update = source.poll(stopPollMillis, TimeUnit.MILLISECONDS);
                if (update != null) {
                    forward(update);
                } else if (source.isDrained()) {
                    log.debug("Update source closed, waiting for stop request");
                    stopRequested.await();
                    return;
                }
            }
        } catch (InterruptedException e) {
            log.warn("Update forwarder interrupted");
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            log.error("Update forwarder failed: {}", t.getMessage(), t);
            UpdatePipeMetrics.incrementFault(t.getClass().getSimpleName());
        } finally {
            stopAcknowledged.countDown();
        }
    }

    private void drainRemaining() throws InterruptedException {
        List<MailboxUpdate> pending = new ArrayList<>();
        source.drainTo(pending, Integer.MAX_VALUE);
        if (!pending.isEmpty()) {
            log.debug("Forwarding {} buffered updates before stopping", pending.size());
        }
        for (MailboxUpdate update : pending) {
            forward(update);
        }
    }

    private void forward(MailboxUpdate update) throws InterruptedException {
        try {
            pipe.push(update);
            UpdatePipeMetrics.incrementPushed();
        } catch (TransmitFailureException e) {
            log.error("Failed to push update {}: {}", update.describe(), e.getMessage());
            UpdatePipeMetrics.incrementPushFailure();
        } catch (RuntimeException | Error e) {
            log.error("Unexpected error pushing update {}", update.describe(), e);
            UpdatePipeMetrics.incrementFault(e.getClass().getSimpleName());
        }

        if (!mode.isForwardingLocally()) {
            return;
        }

        try {
            if (local.put(update)) {
                UpdatePipeMetrics.incrementForwarded();
            } else {
                log.warn("Local update stream closed, dropping {}", update.describe());
            }
        } catch (RuntimeException | Error e) {
            log.error("Unexpected error forwarding update {}", update.describe(), e);
            UpdatePipeMetrics.incrementFault(e.getClass().getSimpleName());
        }
    }
}
