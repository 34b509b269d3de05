package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.pipe.metrics.UpdatePipeMetrics;
import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.JedisPubSub;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Update pipe over Redis pub/sub.
 * <p>Suited to SQL drivers where nodes do not share a host and therefore cannot share a socket file.
 * <p>All nodes of one store publish to and subscribe on the same channel, named after the DSN hash.
 * <br>Own messages are dropped by sender id.
 *
 * @see UpdatePipeFactory#redisChannel(String, java.util.List)
 */
public class RedisUpdatePipe implements UpdatePipe {
    private static final Logger log = LogManager.getLogger(RedisUpdatePipe.class);

    private static final long SUBSCRIBE_TIMEOUT_SECONDS = 5L;

    private final String host;
    private final int port;
    private final String channel;
    private final String myId;

    private JedisPool pool;
    private boolean pushInitialized = false;

    private Jedis subscriber;
    private Subscription subscription;
    private Thread subscriberThread;

    private volatile boolean closed = false;

    /**
     * Constructs a new RedisUpdatePipe instance.
     *
     * @param host    Redis host.
     * @param port    Redis port.
     * @param channel Pub/sub channel name.
     */
    public RedisUpdatePipe(String host, int port, String channel) {
        this.host = host;
        this.port = port;
        this.channel = channel;
        this.myId = ProcessHandle.current().pid() + "-" + Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * Gets pub/sub channel name.
     *
     * @return Channel name.
     */
    public String getChannel() {
        return channel;
    }

    /**
     * Gets sender id stamped on published envelopes.
     *
     * @return Sender id.
     */
    public String getId() {
        return myId;
    }

    /**
     * Subscription delivering channel messages into the sink.
     */
    private class Subscription extends JedisPubSub {
        private final UpdateSink sink;
        private final CountDownLatch subscribed = new CountDownLatch(1);

        Subscription(UpdateSink sink) {
            this.sink = sink;
        }

        @Override
        public void onSubscribe(String subscribedChannel, int subscribedChannels) {
            subscribed.countDown();
        }

        @Override
        public void onMessage(String messageChannel, String message) {
            UpdateCodec.Envelope envelope;
            try {
                envelope = UpdateCodec.decode(message);
            } catch (IllegalArgumentException e) {
                log.error("Malformed update received on {}: {} [{}]", channel, e.getMessage(), message);
                return;
            }

            if (myId.equals(envelope.getSender())) {
                return;
            }

            try {
                if (sink.put(envelope.getUpdate())) {
                    UpdatePipeMetrics.incrementReceived();
                    log.debug("Received remote update {}", envelope.getUpdate().describe());
                } else {
                    log.debug("Local update stream closed, dropping remote update {}", envelope.getUpdate().describe());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public synchronized void listen(UpdateSink sink) throws TransportUnavailableException, AlreadyActiveException {
        if (subscription != null) {
            throw new AlreadyActiveException("Already subscribed to " + channel);
        }
        if (closed) {
            throw new TransportUnavailableException("Update pipe is closed: " + channel);
        }

        Jedis jedis = new Jedis(host, port);
        try {
            jedis.ping();
        } catch (Exception e) {
            jedis.close();
            throw new TransportUnavailableException("Unable to reach Redis at " + host + ":" + port + ": " + e.getMessage(), e);
        }

        Subscription sub = new Subscription(sink);
        Thread thread = new Thread(() -> {
            try {
                jedis.subscribe(sub, channel);
            } catch (Exception e) {
                if (!closed) {
                    log.error("Redis update subscription on {} ended: {}", channel, e.getMessage());
                }
            }
        }, "update-pipe-redis-" + channel);
        thread.setDaemon(true);
        thread.start();

        boolean ready;
        try {
            ready = sub.subscribed.await(SUBSCRIBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ready = false;
        }
        if (!ready) {
            jedis.close();
            throw new TransportUnavailableException("Redis subscription to " + channel + " not confirmed");
        }

        subscriber = jedis;
        subscription = sub;
        subscriberThread = thread;
        log.info("Update pipe subscribed to {} on {}:{}", channel, host, port);
    }

    @Override
    public synchronized void initPush() throws TransportUnavailableException, AlreadyActiveException {
        if (pushInitialized) {
            throw new AlreadyActiveException("Push already initialized on " + channel);
        }
        connect();
        pushInitialized = true;
    }

    private void connect() throws TransportUnavailableException {
        if (closed) {
            throw new TransportUnavailableException("Update pipe is closed: " + channel);
        }
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(2);
        poolConfig.setMaxIdle(1);
        poolConfig.setTestOnBorrow(true);

        JedisPool candidate = new JedisPool(poolConfig, host, port);
        try (Jedis jedis = candidate.getResource()) {
            jedis.ping();
        } catch (Exception e) {
            candidate.close();
            throw new TransportUnavailableException("Unable to reach Redis at " + host + ":" + port + ": " + e.getMessage(), e);
        }
        pool = candidate;
    }

    @Override
    public synchronized void push(MailboxUpdate update) throws TransmitFailureException {
        if (pool == null) {
            try {
                connect();
                pushInitialized = true;
            } catch (TransportUnavailableException e) {
                throw new TransmitFailureException(e.getMessage(), e);
            }
        }

        try (Jedis jedis = pool.getResource()) {
            jedis.publish(channel, UpdateCodec.encode(myId, update));
        } catch (Exception e) {
            throw new TransmitFailureException("Unable to publish update to " + channel + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        Thread thread;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;

            if (subscription != null) {
                try {
                    if (subscription.isSubscribed()) {
                        subscription.unsubscribe();
                    }
                } catch (Exception e) {
                    log.debug("Redis unsubscribe from {} failed: {}", channel, e.getMessage());
                }
            }
            thread = subscriberThread;
            if (thread != null) {
                // Wakes a subscriber blocked on a full local stream.
                thread.interrupt();
            }
        }

        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(SUBSCRIBE_TIMEOUT_SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        synchronized (this) {
            if (subscriber != null) {
                subscriber.close();
                subscriber = null;
            }
            if (pool != null) {
                pool.close();
                pool = null;
            }
        }
        log.info("Update pipe closed for {}", channel);
    }
}
