package com.userhealth.metrics;

import com.userhealth.user.repository.UserRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * User store Micrometer metrics.
 *
 * <p>Counters are created lazily against {@link MetricsRegistry}.
 * <br>When no registry is registered every increment is a no-op.
 */
public final class UserMetrics {
    private static final Logger log = LogManager.getLogger(UserMetrics.class);

    public static final String CREATED = "userhealth.users.created";
    public static final String DELETED = "userhealth.users.deleted";
    public static final String REJECTED = "userhealth.users.rejected";
    public static final String STORED = "userhealth.users.stored";

    private static volatile Counter createdCounter;
    private static volatile Counter deletedCounter;
    private static volatile Counter rejectedCounter;

    /**
     * Private constructor for utility class.
     */
    private UserMetrics() {
    }

    /**
     * Initialize counters with zero values so they are exposed before any traffic.
     */
    public static void initialize() {
        try {
            if (MetricsRegistry.getPrometheusRegistry() != null) {
                initializeCounters();
                log.info("User metrics initialized");
            } else {
                log.warn("Cannot initialize user metrics - Prometheus registry is null");
            }
        } catch (Exception e) {
            log.error("Failed to initialize user metrics: {}", e.getMessage(), e);
        }
    }

    /**
     * Registers a gauge reporting the number of stored users.
     *
     * @param repository Store to observe.
     */
    public static void bindStore(UserRepository repository) {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        Gauge.builder(STORED, repository, UserRepository::size)
                .description("Users currently held in the store")
                .register(registry);
    }

    /**
     * Increment the created counter.
     */
    public static void incrementCreated() {
        increment(createdCounter, Kind.CREATED);
    }

    /**
     * Increment the deleted counter.
     */
    public static void incrementDeleted() {
        increment(deletedCounter, Kind.DELETED);
    }

    /**
     * Increment the rejected counter.
     * <p>Called when a create request fails validation.
     */
    public static void incrementRejected() {
        increment(rejectedCounter, Kind.REJECTED);
    }

    /**
     * Drops cached counters so a newly registered registry is picked up.
     */
    public static void resetCounters() {
        synchronized (UserMetrics.class) {
            createdCounter = null;
            deletedCounter = null;
            rejectedCounter = null;
        }
    }

    private enum Kind {
        CREATED, DELETED, REJECTED
    }

    private static void increment(Counter cached, Kind kind) {
        try {
            Counter counter = cached;
            if (counter == null) {
                synchronized (UserMetrics.class) {
                    initializeCounters();
                }
                counter = switch (kind) {
                    case CREATED -> createdCounter;
                    case DELETED -> deletedCounter;
                    case REJECTED -> rejectedCounter;
                };
            }
            if (counter != null) {
                counter.increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", kind, e.getMessage());
        }
    }

    private static void initializeCounters() {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        if (createdCounter == null) {
            createdCounter = Counter.builder(CREATED)
                    .description("Users created")
                    .register(registry);
        }
        if (deletedCounter == null) {
            deletedCounter = Counter.builder(DELETED)
                    .description("Users deleted")
                    .register(registry);
        }
        if (rejectedCounter == null) {
            rejectedCounter = Counter.builder(REJECTED)
                    .description("User create requests rejected by validation")
                    .register(registry);
        }
    }
}
