package tally.core.model.usage;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a per-tenant, per-day, per-metric usage counter.
 *
 * <p>Key format: {@code {prefix}usage:{tenantId}:{day}:{metricType}}, day as ISO date.
 * Tenant ids may themselves contain colons; parsing therefore reads the metric and the
 * day from the right.
 *
 * @param tenantId the tenant
 * @param day the UTC calendar day
 * @param metricType the metric
 */
public record UsageKey(String tenantId, LocalDate day, MetricType metricType) {

    private static final String SEGMENT = "usage:";

    public UsageKey {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(day, "day must not be null");
        Objects.requireNonNull(metricType, "metricType must not be null");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    public String toCacheKey(String prefix) {
        return prefix + SEGMENT + tenantId + ":" + day + ":" + metricType.value();
    }

    /**
     * Parse a counter key produced by {@link #toCacheKey(String)}.
     *
     * @param prefix the configured key prefix
     * @param cacheKey the raw key
     * @return the parsed key, or empty if the key is malformed or names an unknown metric
     */
    public static Optional<UsageKey> parse(String prefix, String cacheKey) {
        final var head = prefix + SEGMENT;
        if (cacheKey == null || !cacheKey.startsWith(head)) {
            return Optional.empty();
        }
        final var rest = cacheKey.substring(head.length());
        final var metricSep = rest.lastIndexOf(':');
        if (metricSep <= 0) {
            return Optional.empty();
        }
        final var daySep = rest.lastIndexOf(':', metricSep - 1);
        if (daySep <= 0) {
            return Optional.empty();
        }

        final var tenantId = rest.substring(0, daySep);
        final var metric = MetricType.fromValue(rest.substring(metricSep + 1));
        if (metric.isEmpty()) {
            return Optional.empty();
        }
        try {
            final var day = LocalDate.parse(rest.substring(daySep + 1, metricSep));
            return Optional.of(new UsageKey(tenantId, day, metric.get()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * SCAN pattern matching every usage counter of a day.
     */
    public static String dayPattern(String prefix, LocalDate day) {
        return escapeGlob(prefix) + SEGMENT + "*:" + day + ":*";
    }

    /**
     * SCAN pattern matching the usage counters of one tenant on a day.
     */
    public static String tenantDayPattern(String prefix, String tenantId, LocalDate day) {
        return escapeGlob(prefix) + SEGMENT + escapeGlob(tenantId) + ":" + day + ":*";
    }

    static String escapeGlob(String value) {
        final var sb = new StringBuilder(value.length());
        for (final var c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
