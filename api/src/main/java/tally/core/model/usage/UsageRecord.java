package tally.core.model.usage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Durable per-tenant, per-day, per-metric usage total.
 *
 * <p>Unique on {@code (tenantId, day, metricType)}. Writes overwrite the value with the
 * latest counter reading; they never add to it.
 *
 * @param tenantId the tenant
 * @param day the UTC calendar day
 * @param metricType the metric
 * @param value the total
 * @param updatedAt when the record was last written
 */
public record UsageRecord(String tenantId, LocalDate day, MetricType metricType, long value, Instant updatedAt) {

    public UsageRecord {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(day, "day must not be null");
        Objects.requireNonNull(metricType, "metricType must not be null");
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative");
        }
    }

    public static UsageRecord of(UsageKey key, long value, Instant updatedAt) {
        return new UsageRecord(key.tenantId(), key.day(), key.metricType(), value, updatedAt);
    }

    public UsageKey key() {
        return new UsageKey(tenantId, day, metricType);
    }
}
