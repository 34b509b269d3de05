package com.mimecast.mailstore.update;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO update stream with an end-of-stream marker.
 *
 * <p>Used both as the storage engine update channel and as the node's local update stream.
 * <p>Any number of threads may write and read concurrently.
 * <br>Writers block while the buffer is full, readers block while it is empty.
 * <p>Closing stops new writes but keeps buffered updates readable.
 * <br>After the last buffered update is read, readers get {@code null}.
 */
public class UpdateQueue implements UpdateSource, UpdateSink, Closeable {

    private final int capacity;
    private final ArrayDeque<MailboxUpdate> buffer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed = false;

    /**
     * Constructs a new UpdateQueue instance.
     *
     * @param capacity Maximum number of buffered updates.
     * @throws IllegalArgumentException If capacity is less than one.
     */
    public UpdateQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public boolean put(MailboxUpdate update) throws InterruptedException {
        if (update == null) {
            throw new NullPointerException("update");
        }
        lock.lockInterruptibly();
        try {
            while (buffer.size() == capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            buffer.addLast(update);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MailboxUpdate take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MailboxUpdate poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super MailboxUpdate> target, int max) {
        lock.lock();
        try {
            int moved = 0;
            while (moved < max && !buffer.isEmpty()) {
                target.add(buffer.pollFirst());
                moved++;
            }
            if (moved > 0) {
                notFull.signalAll();
            }
            return moved;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private MailboxUpdate dequeue() {
        MailboxUpdate update = buffer.pollFirst();
        if (update != null) {
            notFull.signal();
        }
        return update;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks if the queue is closed for writing.
     *
     * @return Boolean.
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue for writing and wakes every waiting thread.
     * <p>Safe to call more than once.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                notEmpty.signalAll();
                notFull.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }
}
