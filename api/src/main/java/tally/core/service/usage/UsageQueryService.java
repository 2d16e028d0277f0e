package tally.core.service.usage;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.CounterStoreConfig;
import tally.core.model.usage.DailyUsage;
import tally.core.model.usage.MetricType;
import tally.core.model.usage.UsageKey;
import tally.core.model.usage.UsageRecord;
import tally.core.port.out.CounterStore;
import tally.core.port.out.UsageLedger;

/**
 * Read side of the usage pipeline: per-day totals for a tenant.
 *
 * <p>Totals come from the ledger. The ledger trails the counters by up to one aggregation
 * interval, so for the current day the live counter is used whenever it is ahead.
 */
@ApplicationScoped
public class UsageQueryService {

    private static final Logger LOG = Logger.getLogger(UsageQueryService.class);
    static final int MAX_QUERY_DAYS = 366;

    private final UsageLedger ledger;
    private final CounterStore counterStore;
    private final Clock clock;
    private final String keyPrefix;

    @Inject
    public UsageQueryService(
            UsageLedger ledger, CounterStore counterStore, Clock clock, CounterStoreConfig counterStoreConfig) {
        this.ledger = ledger;
        this.counterStore = counterStore;
        this.clock = clock;
        this.keyPrefix = counterStoreConfig.keyPrefix();
    }

    /**
     * Usage history of a tenant, ordered by day then metric.
     *
     * @param tenantId the tenant
     * @param metric restrict to one metric, or all metrics when empty
     * @param from first day, inclusive
     * @param to last day, inclusive
     * @return Uni with one entry per day and metric that has usage
     * @throws IllegalArgumentException if the range is inverted or too long
     */
    public Uni<List<DailyUsage>> history(String tenantId, Optional<MetricType> metric, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from (%s) must not be after to (%s)".formatted(from, to));
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_QUERY_DAYS) {
            throw new IllegalArgumentException("Query range must not exceed " + MAX_QUERY_DAYS + " days");
        }

        final var today = today();
        return ledger.findByTenant(tenantId, from, to).flatMap(records -> {
            final var series = new ArrayList<DailyUsage>();
            records.stream()
                    .filter(r -> metric.map(m -> m == r.metricType()).orElse(true))
                    .filter(r -> !r.day().equals(today))
                    .map(r -> new DailyUsage(r.day(), r.metricType(), r.value(), false))
                    .forEach(series::add);

            if (today.isBefore(from) || today.isAfter(to)) {
                return Uni.createFrom().item(sorted(series));
            }
            return todayUsage(tenantId, metric, today, records).map(live -> {
                series.addAll(live);
                return sorted(series);
            });
        });
    }

    /**
     * Sum a history per metric.
     */
    public static Map<MetricType, Long> totals(List<DailyUsage> history) {
        final var totals = new EnumMap<MetricType, Long>(MetricType.class);
        history.forEach(entry -> totals.merge(entry.metricType(), entry.value(), Long::sum));
        return totals;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private Uni<List<DailyUsage>> todayUsage(
            String tenantId, Optional<MetricType> metric, LocalDate today, List<UsageRecord> records) {
        final var metrics = metric.map(List::of).orElseGet(() -> Arrays.asList(MetricType.values()));

        return Multi.createFrom()
                .iterable(metrics)
                .onItem()
                .transformToUniAndConcatenate(type -> {
                    final var ledgerValue = records.stream()
                            .filter(r -> r.day().equals(today) && r.metricType() == type)
                            .mapToLong(UsageRecord::value)
                            .findFirst();
                    return liveValue(new UsageKey(tenantId, today, type)).map(live -> {
                        final var stored = ledgerValue.isPresent() ? Optional.of(ledgerValue.getAsLong()) : Optional.<Long>empty();
                        if (live.isPresent() && (stored.isEmpty() || live.get() > stored.get())) {
                            return Optional.of(new DailyUsage(today, type, live.get(), true));
                        }
                        return stored.map(value -> new DailyUsage(today, type, value, false));
                    });
                })
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList();
    }

    private Uni<Optional<Long>> liveValue(UsageKey key) {
        return counterStore
                .get(key.toCacheKey(keyPrefix))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Live usage read failed for {0}, using ledger value: {1}", key, error.getMessage());
                    return Optional.empty();
                });
    }

    private static List<DailyUsage> sorted(List<DailyUsage> series) {
        series.sort(Comparator.comparing(DailyUsage::day).thenComparing(DailyUsage::metricType));
        return series;
    }
}
