package com.mimecast.mailstore.pipe.metrics;

import com.mimecast.mailstore.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Supplier;

/**
 * Update pipe Micrometer metrics.
 *
 * <p>Provides counters for pushed, failed, forwarded and received updates plus forwarder faults.
 * <p>Without a registered Prometheus registry every call is a no-op.
 */
public final class UpdatePipeMetrics {
    private static final Logger log = LogManager.getLogger(UpdatePipeMetrics.class);

    public static final String PUSHED = "mailstore.updates.pushed";
    public static final String PUSH_FAILURES = "mailstore.updates.push.failures";
    public static final String FORWARDED = "mailstore.updates.forwarded";
    public static final String RECEIVED = "mailstore.updates.received";
    public static final String FAULTS = "mailstore.updates.faults";

    private static volatile Counter pushedCounter;
    private static volatile Counter pushFailureCounter;
    private static volatile Counter forwardedCounter;
    private static volatile Counter receivedCounter;

    /**
     * Private constructor for utility class.
     */
    private UpdatePipeMetrics() {
    }

    /**
     * Initialize all metrics with zero values.
     * <p>Call once the registry is registered so counters show up before any traffic.
     */
    public static void initialize() {
        try {
            if (MetricsRegistry.getPrometheusRegistry() != null) {
                initializeCounters();
                log.info("Update pipe metrics initialized");
            } else {
                log.warn("Cannot initialize update pipe metrics - Prometheus registry is null");
            }
        } catch (Exception e) {
            log.error("Failed to initialize update pipe metrics: {}", e.getMessage(), e);
        }
    }

    /**
     * Increment the pushed counter.
     * <p>Called after an update was handed to the pipe without error.
     */
    public static void incrementPushed() {
        increment(() -> pushedCounter);
    }

    /**
     * Increment the push failure counter.
     */
    public static void incrementPushFailure() {
        increment(() -> pushFailureCounter);
    }

    /**
     * Increment the forwarded counter.
     * <p>Called after a local update was put on the local update stream.
     */
    public static void incrementForwarded() {
        increment(() -> forwardedCounter);
    }

    /**
     * Increment the received counter.
     * <p>Called after a remote update was put on the local update stream.
     */
    public static void incrementReceived() {
        increment(() -> receivedCounter);
    }

    /**
     * Increment the forwarder fault counter.
     *
     * @param exceptionType Simple class name of the fault.
     */
    public static void incrementFault(String exceptionType) {
        try {
            PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                Counter.builder(FAULTS)
                        .description("Unexpected faults caught by the update forwarder")
                        .tag("exception_type", exceptionType)
                        .register(registry)
                        .increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment update fault counter: {}", e.getMessage());
        }
    }

    private static void increment(Supplier<Counter> counter) {
        if (MetricsRegistry.getPrometheusRegistry() == null) {
            return;
        }
        try {
            if (counter.get() == null) {
                synchronized (UpdatePipeMetrics.class) {
                    if (counter.get() == null) {
                        initializeCounters();
                    }
                }
            }
            Counter current = counter.get();
            if (current != null) {
                current.increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment update pipe counter: {}", e.getMessage());
        }
    }

    private static void initializeCounters() {
        PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        pushedCounter = Counter.builder(PUSHED)
                .description("Updates published to other nodes")
                .register(registry);
        pushFailureCounter = Counter.builder(PUSH_FAILURES)
                .description("Updates that failed to publish")
                .register(registry);
        forwardedCounter = Counter.builder(FORWARDED)
                .description("Local updates put on the local update stream")
                .register(registry);
        receivedCounter = Counter.builder(RECEIVED)
                .description("Remote updates put on the local update stream")
                .register(registry);
    }

    /**
     * Reset counter references.
     * <p>Used by tests after swapping registries.
     */
    public static void resetCounters() {
        synchronized (UpdatePipeMetrics.class) {
            pushedCounter = null;
            pushFailureCounter = null;
            forwardedCounter = null;
            receivedCounter = null;
        }
    }
}
