package com.mimecast.mailstore.config;

import com.mimecast.mailstore.pipe.PipeMode;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Update pipe configuration.
 *
 * <p>This class provides type safe access to the replication pipe settings found under {@code updatePipe}.
 */
public class UpdatePipeConfig extends BasicConfig {

    /**
     * Automatic transport selection based on storage driver.
     */
    public static final String TRANSPORT_AUTO = "auto";

    /**
     * Unix domain socket transport.
     */
    public static final String TRANSPORT_UNIX = "unix";

    /**
     * Redis pub/sub transport.
     */
    public static final String TRANSPORT_REDIS = "redis";

    /**
     * Constructs a new UpdatePipeConfig instance.
     *
     * @param map Configuration map.
     */
    public UpdatePipeConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if the update pipe is enabled.
     *
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets pipe mode.
     *
     * @return PipeMode, REPLICATE if unset.
     * @throws IllegalArgumentException Unknown mode name.
     */
    public PipeMode getMode() {
        return PipeMode.fromName(getStringProperty("mode", PipeMode.REPLICATE.getName()));
    }

    /**
     * Gets transport name.
     *
     * @return One of auto, unix or redis.
     */
    public String getTransport() {
        return StringUtils.lowerCase(StringUtils.trimToEmpty(getStringProperty("transport", TRANSPORT_AUTO)));
    }

    /**
     * Gets runtime directory where socket files live.
     *
     * @return Directory path.
     */
    public String getRuntimeDirectory() {
        return getStringProperty("runtimeDirectory", "/run/mailstore");
    }

    /**
     * Gets how often the forwarder checks for a stop request while idle.
     *
     * @return Milliseconds.
     */
    public long getStopPollMillis() {
        return Math.max(1L, getLongProperty("stopPollMillis", 50L));
    }

    /**
     * Gets Redis host.
     *
     * @return Hostname.
     */
    public String getRedisHost() {
        return new BasicConfig(getMapProperty("redis")).getStringProperty("host", "localhost");
    }

    /**
     * Gets Redis port.
     *
     * @return Port number.
     */
    public int getRedisPort() {
        return Math.toIntExact(new BasicConfig(getMapProperty("redis")).getLongProperty("port", 6379L));
    }

    /**
     * Gets Redis channel prefix.
     *
     * @return Channel prefix.
     */
    public String getRedisChannelPrefix() {
        return new BasicConfig(getMapProperty("redis")).getStringProperty("channelPrefix", "mailstore:updates");
    }
}
