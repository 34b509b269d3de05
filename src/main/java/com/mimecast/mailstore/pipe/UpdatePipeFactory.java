package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.config.StorageConfig;
import com.mimecast.mailstore.config.UpdatePipeConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Factory for creating UpdatePipe instances based on configuration.
 * <p>Transport selection from {@code updatePipe.transport}:
 * <ol>
 *   <li>unix - Unix domain socket in {@code updatePipe.runtimeDirectory}</li>
 *   <li>redis - Redis pub/sub using {@code updatePipe.redis}</li>
 *   <li>auto - unix for the sqlite3 driver, otherwise unavailable</li>
 * </ol>
 * <p>Rendezvous addresses are derived from the DSN alone, so every process pointing at the same store
 * finds the others without a registry.
 */
public class UpdatePipeFactory {
    private static final Logger log = LogManager.getLogger(UpdatePipeFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private UpdatePipeFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates an UpdatePipe for the given storage configuration.
     * <p>The pipe is not activated.
     *
     * @param config Storage configuration.
     * @return UpdatePipe instance.
     * @throws TransportUnavailableException No transport fits the configuration.
     */
    public static UpdatePipe create(StorageConfig config) throws TransportUnavailableException {
        UpdatePipeConfig pipeConfig = config.getUpdatePipe();
        List<String> dsn = config.getDsn();
        if (dsn.isEmpty()) {
            throw new TransportUnavailableException("Storage dsn is required for an update pipe");
        }

        String transport = pipeConfig.getTransport();
        if (UpdatePipeConfig.TRANSPORT_AUTO.equals(transport)) {
            if ("sqlite3".equals(config.getDriver())) {
                transport = UpdatePipeConfig.TRANSPORT_UNIX;
            } else {
                throw new TransportUnavailableException("Driver '" + config.getDriver() + "' does not have an update pipe implementation");
            }
        }

        switch (transport) {
            case UpdatePipeConfig.TRANSPORT_UNIX:
                Path sockPath = socketPath(pipeConfig.getRuntimeDirectory(), dsn);
                log.info("Using unix socket update pipe: {}", sockPath);
                return new UnixSockPipe(sockPath);

            case UpdatePipeConfig.TRANSPORT_REDIS:
                String channel = redisChannel(pipeConfig.getRedisChannelPrefix(), dsn);
                log.info("Using redis update pipe: {}:{} channel={}", pipeConfig.getRedisHost(), pipeConfig.getRedisPort(), channel);
                return new RedisUpdatePipe(pipeConfig.getRedisHost(), pipeConfig.getRedisPort(), channel);

            default:
                throw new TransportUnavailableException("Unknown update pipe transport: " + transport);
        }
    }

    /**
     * Computes the store identity shared by all processes using the same DSN.
     *
     * @param dsn DSN parts.
     * @return Lower case hex SHA-1 of the parts joined by single spaces.
     */
    public static String pipeId(List<String> dsn) {
        return DigestUtils.sha1Hex(String.join(" ", dsn));
    }

    /**
     * Computes the Unix socket path for a store.
     *
     * @param runtimeDirectory Runtime directory.
     * @param dsn              DSN parts.
     * @return Socket path.
     */
    public static Path socketPath(String runtimeDirectory, List<String> dsn) {
        return Paths.get(runtimeDirectory, "sql-" + pipeId(dsn) + ".sock");
    }

    /**
     * Computes the Redis channel for a store.
     *
     * @param prefix Channel prefix.
     * @param dsn    DSN parts.
     * @return Channel name.
     */
    public static String redisChannel(String prefix, List<String> dsn) {
        return prefix + ":" + pipeId(dsn);
    }
}
