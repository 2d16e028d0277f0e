package tally.core.service.usage;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.CounterStoreConfig;
import tally.core.config.UsageConfig;
import tally.core.model.usage.MetricType;
import tally.core.model.usage.UsageKey;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;

/**
 * Counts billable events into per-tenant, per-day, per-metric counters.
 *
 * <p>Recording is best effort: a counter store failure is logged and counted, and the
 * returned Uni still completes normally so the caller's request is never failed by it.
 */
@ApplicationScoped
public class UsageRecorder {

    private static final Logger LOG = Logger.getLogger(UsageRecorder.class);

    private final CounterStore counterStore;
    private final Metrics metrics;
    private final Clock clock;
    private final String keyPrefix;
    private final UsageConfig config;

    @Inject
    public UsageRecorder(
            CounterStore counterStore,
            Metrics metrics,
            Clock clock,
            CounterStoreConfig counterStoreConfig,
            UsageConfig config) {
        this.counterStore = counterStore;
        this.metrics = metrics;
        this.clock = clock;
        this.keyPrefix = counterStoreConfig.keyPrefix();
        this.config = config;
    }

    /**
     * Record one event for today (UTC).
     */
    public Uni<Void> record(String tenantId, MetricType metricType) {
        return record(tenantId, metricType, today(), 1);
    }

    /**
     * Record one event for the given day.
     */
    public Uni<Void> record(String tenantId, MetricType metricType, LocalDate day) {
        return record(tenantId, metricType, day, 1);
    }

    /**
     * Record {@code amount} events for the given day.
     *
     * @param tenantId the tenant
     * @param metricType the metric
     * @param day the UTC day the events belong to
     * @param amount number of events, strictly positive
     * @return Uni completing once the counter was incremented or the failure was logged
     * @throws IllegalArgumentException if {@code amount} is not positive or the tenant is blank
     */
    public Uni<Void> record(String tenantId, MetricType metricType, LocalDate day, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive, got " + amount);
        }
        final var key = new UsageKey(tenantId, day, metricType).toCacheKey(keyPrefix);

        return counterStore
                .increment(key, amount, config.counterTtl())
                .invoke(value -> {
                    metrics.recordUsage(metricType, amount);
                    LOG.debugf("Recorded %d %s for tenant %s on %s (now %d)", amount, metricType.value(), tenantId, day, value);
                })
                .replaceWithVoid()
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.warnv(
                            "Failed to record {0} {1} for tenant {2}: {3}",
                            amount, metricType.value(), tenantId, error.getMessage());
                    metrics.recordUsageFailure(metricType);
                    return Uni.createFrom().voidItem();
                });
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
}
