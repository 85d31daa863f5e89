package io.pollwatch;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tuning knobs of a {@link PollingObserver}.
 *
 * <p>Values can be overridden without code changes through system properties or environment
 * variables, checked in that order:
 *
 * <pre>
 * -Dpollwatch.interval.ms=1000          POLLWATCH_INTERVAL_MS
 * -Dpollwatch.queue.capacity=10000      POLLWATCH_QUEUE_CAPACITY   (0 = unbounded)
 * -Dpollwatch.backpressure=block        POLLWATCH_BACKPRESSURE     (block, drop-oldest, drop-newest)
 * -Dpollwatch.dispatch.wait.ms=100      POLLWATCH_DISPATCH_WAIT_MS
 * -Dpollwatch.shutdown.timeout.ms=5000  POLLWATCH_SHUTDOWN_TIMEOUT_MS
 * </pre>
 *
 * @param defaultInterval polling interval for rules added without an explicit one
 * @param queueCapacity maximum number of queued events, 0 for unbounded
 * @param backpressure what to do when the queue is full
 * @param dispatchWait longest time the dispatcher blocks on the queue before re-checking its state
 * @param shutdownTimeout longest time {@code stop} waits for in-flight polls before closing the queue
 */
public record ObserverConfig(
        Duration defaultInterval,
        int queueCapacity,
        BackpressurePolicy backpressure,
        Duration dispatchWait,
        Duration shutdownTimeout) {
    private static final Logger logger = LogManager.getLogger(ObserverConfig.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final BackpressurePolicy DEFAULT_BACKPRESSURE = BackpressurePolicy.BLOCK;
    public static final Duration DEFAULT_DISPATCH_WAIT = Duration.ofMillis(100);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    static final String INTERVAL_PROPERTY = "pollwatch.interval.ms";
    static final String QUEUE_CAPACITY_PROPERTY = "pollwatch.queue.capacity";
    static final String BACKPRESSURE_PROPERTY = "pollwatch.backpressure";
    static final String DISPATCH_WAIT_PROPERTY = "pollwatch.dispatch.wait.ms";
    static final String SHUTDOWN_TIMEOUT_PROPERTY = "pollwatch.shutdown.timeout.ms";

    public ObserverConfig {
        Objects.requireNonNull(defaultInterval, "defaultInterval");
        Objects.requireNonNull(backpressure, "backpressure");
        Objects.requireNonNull(dispatchWait, "dispatchWait");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        WatchedPath.requireValidInterval(defaultInterval, "defaultInterval");
        requirePositive(dispatchWait, "dispatchWait");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative, got " + shutdownTimeout);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0, got " + queueCapacity);
        }
    }

    public static ObserverConfig defaults() {
        return new ObserverConfig(
                DEFAULT_INTERVAL,
                DEFAULT_QUEUE_CAPACITY,
                DEFAULT_BACKPRESSURE,
                DEFAULT_DISPATCH_WAIT,
                DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /** Defaults overridden by system properties, then by environment variables. */
    public static ObserverConfig fromEnvironment() {
        return fromLookup(System::getProperty, System::getenv);
    }

    /** Package-private for testing. */
    static ObserverConfig fromLookup(Function<String, String> properties, Function<String, String> environment) {
        Function<String, String> lookup = property -> {
            var value = properties.apply(property);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = environment.apply(toEnvironmentName(property));
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        };

        return new ObserverConfig(
                Duration.ofMillis(parsePositiveLong(lookup, INTERVAL_PROPERTY, DEFAULT_INTERVAL.toMillis())),
                (int) parseLong(lookup, QUEUE_CAPACITY_PROPERTY, DEFAULT_QUEUE_CAPACITY, 0, Integer.MAX_VALUE),
                parseBackpressure(lookup),
                Duration.ofMillis(parsePositiveLong(lookup, DISPATCH_WAIT_PROPERTY, DEFAULT_DISPATCH_WAIT.toMillis())),
                Duration.ofMillis(
                        parseLong(lookup, SHUTDOWN_TIMEOUT_PROPERTY, DEFAULT_SHUTDOWN_TIMEOUT.toMillis(), 0, Long.MAX_VALUE)));
    }

    public ObserverConfig withDefaultInterval(Duration interval) {
        return new ObserverConfig(interval, queueCapacity, backpressure, dispatchWait, shutdownTimeout);
    }

    public ObserverConfig withQueueCapacity(int capacity) {
        return new ObserverConfig(defaultInterval, capacity, backpressure, dispatchWait, shutdownTimeout);
    }

    public ObserverConfig withBackpressure(BackpressurePolicy policy) {
        return new ObserverConfig(defaultInterval, queueCapacity, policy, dispatchWait, shutdownTimeout);
    }

    public ObserverConfig withDispatchWait(Duration wait) {
        return new ObserverConfig(defaultInterval, queueCapacity, backpressure, wait, shutdownTimeout);
    }

    public ObserverConfig withShutdownTimeout(Duration timeout) {
        return new ObserverConfig(defaultInterval, queueCapacity, backpressure, dispatchWait, timeout);
    }

    /** "pollwatch.queue.capacity" -> "POLLWATCH_QUEUE_CAPACITY" */
    static String toEnvironmentName(String property) {
        return property.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + duration);
        }
    }

    private static long parsePositiveLong(Function<String, String> lookup, String property, long fallback) {
        return parseLong(lookup, property, fallback, 1, Long.MAX_VALUE);
    }

    private static long parseLong(Function<String, String> lookup, String property, long fallback, long min, long max) {
        var raw = lookup.apply(property);
        if (raw == null) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw);
            if (value < min || value > max) {
                logger.warn("Ignoring out-of-range value '{}' for {}; using {}", raw, property, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, property, fallback);
            return fallback;
        }
    }

    private static BackpressurePolicy parseBackpressure(Function<String, String> lookup) {
        var raw = lookup.apply(BACKPRESSURE_PROPERTY);
        if (raw == null) {
            return DEFAULT_BACKPRESSURE;
        }
        try {
            return BackpressurePolicy.parse(raw);
        } catch (IllegalArgumentException e) {
            logger.warn(
                    "Ignoring unknown value '{}' for {}; using {}", raw, BACKPRESSURE_PROPERTY, DEFAULT_BACKPRESSURE);
            return DEFAULT_BACKPRESSURE;
        }
    }
}
