package com.mimecast.mailstore.config;

import com.mimecast.mailstore.pipe.PipeMode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StorageConfig and UpdatePipeConfig.
 */
class StorageConfigTest {

    @Test
    void testDefaultValues() {
        StorageConfig config = new StorageConfig(new HashMap<>());

        assertEquals("", config.getDriver(), "Default driver should be empty");
        assertTrue(config.getDsn().isEmpty(), "Default dsn should be empty");
        assertFalse(config.isDebug(), "Default debug should be false");

        UpdatePipeConfig pipe = config.getUpdatePipe();
        assertFalse(pipe.isEnabled(), "Default enabled should be false");
        assertEquals(PipeMode.REPLICATE, pipe.getMode(), "Default mode should be replicate");
        assertEquals(UpdatePipeConfig.TRANSPORT_AUTO, pipe.getTransport(), "Default transport should be auto");
        assertEquals("/run/mailstore", pipe.getRuntimeDirectory(), "Default runtime directory");
        assertEquals(50L, pipe.getStopPollMillis(), "Default stop poll interval");
        assertEquals("localhost", pipe.getRedisHost(), "Default Redis host");
        assertEquals(6379, pipe.getRedisPort(), "Default Redis port");
        assertEquals("mailstore:updates", pipe.getRedisChannelPrefix(), "Default Redis channel prefix");
    }

    @Test
    void testCustomValues() {
        Map<String, Object> redis = new HashMap<>();
        redis.put("host", "redis.example.com");
        redis.put("port", 6380.0);
        redis.put("channelPrefix", "store");

        Map<String, Object> pipe = new HashMap<>();
        pipe.put("enabled", true);
        pipe.put("mode", "PUSH");
        pipe.put("transport", "Redis");
        pipe.put("runtimeDirectory", "/tmp/run");
        pipe.put("stopPollMillis", 0);
        pipe.put("redis", redis);

        Map<String, Object> map = new HashMap<>();
        map.put("driver", "postgres");
        map.put("dsn", List.of("host=db", "dbname=mail"));
        map.put("debug", true);
        map.put("updatePipe", pipe);

        StorageConfig config = new StorageConfig(map);
        assertEquals("postgres", config.getDriver(), "Driver");
        assertEquals(List.of("host=db", "dbname=mail"), config.getDsn(), "DSN parts");
        assertTrue(config.isDebug(), "Debug");

        UpdatePipeConfig pipeConfig = config.getUpdatePipe();
        assertTrue(pipeConfig.isEnabled(), "Enabled");
        assertEquals(PipeMode.PUSH, pipeConfig.getMode(), "Mode should be case insensitive");
        assertEquals(UpdatePipeConfig.TRANSPORT_REDIS, pipeConfig.getTransport(), "Transport should be lower case");
        assertEquals("/tmp/run", pipeConfig.getRuntimeDirectory(), "Runtime directory");
        assertEquals(1L, pipeConfig.getStopPollMillis(), "Stop poll interval should be at least 1");
        assertEquals("redis.example.com", pipeConfig.getRedisHost(), "Redis host");
        assertEquals(6380, pipeConfig.getRedisPort(), "Redis port");
        assertEquals("store", pipeConfig.getRedisChannelPrefix(), "Redis channel prefix");
    }

    @Test
    void testSingleDsnString() {
        Map<String, Object> map = new HashMap<>();
        map.put("dsn", "/var/lib/mail.db");
        assertEquals(List.of("/var/lib/mail.db"), new StorageConfig(map).getDsn(), "Scalar DSN should become a list");
    }

    @Test
    void testInvalidMode() {
        Map<String, Object> pipe = new HashMap<>();
        pipe.put("mode", "mirror");
        Map<String, Object> map = new HashMap<>();
        map.put("updatePipe", pipe);

        UpdatePipeConfig config = new StorageConfig(map).getUpdatePipe();
        assertThrows(IllegalArgumentException.class, config::getMode, "Unknown mode should fail");
    }
}
