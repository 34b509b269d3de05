package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.pipe.metrics.UpdatePipeMetrics;
import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Update pipe over a Unix domain socket.
 *
 * <p>Every process pointing at the same store derives the same socket path from its DSN.
 * <br>The listening process binds the socket and reads newline delimited envelopes from each connected peer.
 * <br>Pushing processes connect to the socket and write one envelope per update.
 * <p>A process that both listens and pushes connects to its own socket.
 * <br>Its own envelopes come back through the listener and are dropped by sender id.
 *
 * @see UpdateCodec
 * @see UpdatePipeFactory#socketPath(String, java.util.List)
 */
public class UnixSockPipe implements UpdatePipe {
    private static final Logger log = LogManager.getLogger(UnixSockPipe.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /**
     * Longest envelope line accepted from a peer, in characters.
     * <br>A peer sending a longer line is disconnected.
     */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private final Path sockPath;
    private final String myId;

    private ServerSocketChannel server;
    private Thread acceptThread;
    private ExecutorService readers;
    private final Set<SocketChannel> peers = ConcurrentHashMap.newKeySet();

    private SocketChannel sender;
    private boolean pushInitialized = false;
    private volatile boolean closed = false;

    /**
     * Constructs a new UnixSockPipe instance.
     *
     * @param sockPath Socket file path.
     */
    public UnixSockPipe(Path sockPath) {
        this.sockPath = sockPath;
        this.myId = ProcessHandle.current().pid() + "-" + Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * Gets socket path.
     *
     * @return Path.
     */
    public Path getSockPath() {
        return sockPath;
    }

    /**
     * Gets sender id stamped on pushed envelopes.
     *
     * @return Sender id.
     */
    public String getId() {
        return myId;
    }

    @Override
    public synchronized void listen(UpdateSink sink) throws TransportUnavailableException, AlreadyActiveException {
        if (server != null) {
            throw new AlreadyActiveException("Already listening on " + sockPath);
        }
        if (closed) {
            throw new TransportUnavailableException("Update pipe is closed: " + sockPath);
        }

        ServerSocketChannel channel;
        try {
            removeStaleSocket();
            channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        } catch (IOException e) {
            throw new TransportUnavailableException("Unable to listen on " + sockPath + ": " + e.getMessage(), e);
        }
        try {
            channel.bind(UnixDomainSocketAddress.of(sockPath));
        } catch (IOException e) {
            closeQuietly(channel);
            throw new TransportUnavailableException("Unable to listen on " + sockPath + ": " + e.getMessage(), e);
        }

        server = channel;
        int instance = THREAD_COUNTER.incrementAndGet();
        readers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "update-pipe-reader-" + instance);
            thread.setDaemon(true);
            return thread;
        });
        acceptThread = new Thread(() -> acceptLoop(channel, sink), "update-pipe-accept-" + instance);
        acceptThread.setDaemon(true);
        acceptThread.start();

        log.info("Update pipe listening on {}", sockPath);
    }

    /**
     * Replaces a socket file nobody listens on any more.
     *
     * @throws IOException Socket is live or cannot be removed.
     */
    private void removeStaleSocket() throws IOException {
        if (!Files.exists(sockPath)) {
            return;
        }
        boolean live;
        try (SocketChannel existing = SocketChannel.open(UnixDomainSocketAddress.of(sockPath))) {
            live = existing.isConnected();
        } catch (IOException e) {
            live = false;
        }
        if (live) {
            throw new IOException("Address already in use by another process");
        }
        log.warn("Removing stale update pipe socket {}", sockPath);
        Files.deleteIfExists(sockPath);
    }

    private void acceptLoop(ServerSocketChannel channel, UpdateSink sink) {
        try {
            while (!closed) {
                SocketChannel peer = channel.accept();
                peers.add(peer);
                if (closed) {
                    closeQuietly(peer);
                    break;
                }
                log.debug("Update pipe peer connected on {}", sockPath);
                try {
                    readers.submit(() -> readUpdates(peer, sink));
                } catch (RejectedExecutionException e) {
                    closeQuietly(peer);
                    break;
                }
            }
        } catch (ClosedChannelException e) {
            log.debug("Update pipe listener closed: {}", sockPath);
        } catch (IOException e) {
            if (!closed) {
                log.error("Update pipe accept failed on {}: {}", sockPath, e.getMessage());
            }
        }
    }

    private void readUpdates(SocketChannel peer, UpdateSink sink) {
        try (BufferedReader reader = new BufferedReader(Channels.newReader(peer, StandardCharsets.UTF_8))) {
            String line;
            while ((line = readLine(reader, MAX_LINE_LENGTH)) != null) {
                if (line.isBlank()) {
                    continue;
                }

                UpdateCodec.Envelope envelope;
                try {
                    envelope = UpdateCodec.decode(line);
                } catch (IllegalArgumentException e) {
                    log.error("Malformed update received on {}: {} [{}]", sockPath, e.getMessage(), line);
                    continue;
                }

                if (myId.equals(envelope.getSender())) {
                    continue;
                }

                if (!sink.put(envelope.getUpdate())) {
                    log.debug("Local update stream closed, dropping remote update {}", envelope.getUpdate().describe());
                    return;
                }
                UpdatePipeMetrics.incrementReceived();
                log.debug("Received remote update {}", envelope.getUpdate().describe());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed) {
                log.warn("Update pipe peer read failed on {}: {}", sockPath, e.getMessage());
            }
        } finally {
            peers.remove(peer);
            closeQuietly(peer);
        }
    }

    @Override
    public synchronized void initPush() throws TransportUnavailableException, AlreadyActiveException {
        if (pushInitialized) {
            throw new AlreadyActiveException("Push already initialized on " + sockPath);
        }
        connect();
        pushInitialized = true;
    }

    private void connect() throws TransportUnavailableException {
        if (closed) {
            throw new TransportUnavailableException("Update pipe is closed: " + sockPath);
        }
        try {
            sender = SocketChannel.open(UnixDomainSocketAddress.of(sockPath));
            log.debug("Update pipe connected to {}", sockPath);
        } catch (IOException e) {
            throw new TransportUnavailableException("Unable to connect to " + sockPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void push(MailboxUpdate update) throws TransmitFailureException {
        if (sender == null) {
            try {
                connect();
                pushInitialized = true;
            } catch (TransportUnavailableException e) {
                throw new TransmitFailureException(e.getMessage(), e);
            }
        }

        ByteBuffer buffer = ByteBuffer.wrap((UpdateCodec.encode(myId, update) + "\n").getBytes(StandardCharsets.UTF_8));
        try {
            while (buffer.hasRemaining()) {
                sender.write(buffer);
            }
        } catch (IOException e) {
            // Reconnect on the next push.
            closeQuietly(sender);
            sender = null;
            throw new TransmitFailureException("Unable to push update to " + sockPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        Thread accept;
        ExecutorService pool;
        boolean listening;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;

            closeQuietly(sender);
            sender = null;

            listening = server != null;
            closeQuietly(server);
            accept = acceptThread;
            pool = readers;
        }

        for (SocketChannel peer : peers) {
            closeQuietly(peer);
        }

        if (accept != null) {
            try {
                accept.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (pool != null) {
            // Interrupts readers blocked on a full local stream.
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Update pipe readers did not stop in time: {}", sockPath);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (listening) {
            try {
                Files.deleteIfExists(sockPath);
            } catch (IOException e) {
                log.warn("Unable to remove update pipe socket {}: {}", sockPath, e.getMessage());
            }
            log.info("Update pipe stopped listening on {}", sockPath);
        }
    }

    /**
     * Reads one newline terminated line, dropping a trailing carriage return.
     *
     * @param reader    Reader.
     * @param maxLength Longest line accepted.
     * @return Line without terminator, or null at end of stream.
     * @throws IOException Read failed or line too long.
     */
    static String readLine(Reader reader, int maxLength) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (sb.length() >= maxLength) {
                throw new IOException("Update line exceeds " + maxLength + " characters");
            }
            sb.append((char) c);
        }
        if (c == -1 && sb.length() == 0) {
            return null;
        }
        int end = sb.length();
        if (end > 0 && sb.charAt(end - 1) == '\r') {
            sb.setLength(end - 1);
        }
        return sb.toString();
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error closing update pipe channel: {}", e.getMessage());
        }
    }
}
