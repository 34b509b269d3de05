package com.mimecast.mailstore.pipe.metrics;

import com.mimecast.mailstore.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UpdatePipeMetrics.
 */
class UpdatePipeMetricsTest {

    private PrometheusMeterRegistry testRegistry;

    @BeforeEach
    void setUp() {
        testRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(testRegistry);
        UpdatePipeMetrics.resetCounters();
    }

    @AfterEach
    void tearDown() {
        MetricsRegistry.register(null);
        UpdatePipeMetrics.resetCounters();
    }

    @Test
    void testCounters() {
        UpdatePipeMetrics.incrementPushed();
        UpdatePipeMetrics.incrementPushed();
        UpdatePipeMetrics.incrementPushFailure();
        UpdatePipeMetrics.incrementForwarded();
        UpdatePipeMetrics.incrementReceived();
        UpdatePipeMetrics.incrementReceived();
        UpdatePipeMetrics.incrementReceived();

        assertEquals(2.0, testRegistry.find(UpdatePipeMetrics.PUSHED).counter().count(), 0.001, "Pushed count");
        assertEquals(1.0, testRegistry.find(UpdatePipeMetrics.PUSH_FAILURES).counter().count(), 0.001, "Failure count");
        assertEquals(1.0, testRegistry.find(UpdatePipeMetrics.FORWARDED).counter().count(), 0.001, "Forwarded count");
        assertEquals(3.0, testRegistry.find(UpdatePipeMetrics.RECEIVED).counter().count(), 0.001, "Received count");
    }

    @Test
    void testFaultsTaggedByType() {
        UpdatePipeMetrics.incrementFault("IllegalStateException");
        UpdatePipeMetrics.incrementFault("IllegalStateException");
        UpdatePipeMetrics.incrementFault("NullPointerException");

        Counter ise = testRegistry.find(UpdatePipeMetrics.FAULTS).tag("exception_type", "IllegalStateException").counter();
        assertNotNull(ise, "IllegalStateException counter should be registered");
        assertEquals(2.0, ise.count(), 0.001, "IllegalStateException count");

        Counter npe = testRegistry.find(UpdatePipeMetrics.FAULTS).tag("exception_type", "NullPointerException").counter();
        assertNotNull(npe, "NullPointerException counter should be registered");
        assertEquals(1.0, npe.count(), 0.001, "NullPointerException count");
    }

    @Test
    void testInitializeRegistersCounters() {
        UpdatePipeMetrics.initialize();
        assertNotNull(testRegistry.find(UpdatePipeMetrics.PUSHED).counter(), "Pushed counter should be registered");
        assertNotNull(testRegistry.find(UpdatePipeMetrics.RECEIVED).counter(), "Received counter should be registered");
    }

    @Test
    void testNoRegistryIsNoOp() {
        MetricsRegistry.register(null);
        UpdatePipeMetrics.resetCounters();

        assertDoesNotThrow(() -> {
            UpdatePipeMetrics.initialize();
            UpdatePipeMetrics.incrementPushed();
            UpdatePipeMetrics.incrementFault("IOException");
        }, "Metrics should be optional");
    }

    @Test
    void testNoRegistrySkipsCounterLock() throws Exception {
        MetricsRegistry.register(null);
        UpdatePipeMetrics.resetCounters();

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            synchronized (UpdatePipeMetrics.class) {
                held.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "test-lock-holder");
        holder.start();
        try {
            assertTrue(held.await(5, TimeUnit.SECONDS), "Holder should take the lock");
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                for (int i = 0; i < 1000; i++) {
                    UpdatePipeMetrics.incrementPushed();
                    UpdatePipeMetrics.incrementReceived();
                }
            }, "Increments without a registry should not wait for the counter lock");
        } finally {
            release.countDown();
            holder.join(5000);
        }
    }

    @Test
    void testRegistryRegisteredLaterIsUsed() {
        MetricsRegistry.register(null);
        UpdatePipeMetrics.resetCounters();
        UpdatePipeMetrics.incrementPushed();

        MetricsRegistry.register(testRegistry);
        UpdatePipeMetrics.incrementPushed();

        Counter pushed = testRegistry.find(UpdatePipeMetrics.PUSHED).counter();
        assertNotNull(pushed, "Pushed counter should be registered once a registry exists");
        assertEquals(1.0, pushed.count(), 0.001, "Only the increment after registration should count");
    }
}
