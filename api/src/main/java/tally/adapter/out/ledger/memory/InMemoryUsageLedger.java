package tally.adapter.out.ledger.memory;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import tally.core.model.usage.UsageKey;
import tally.core.model.usage.UsageRecord;
import tally.core.port.out.UsageLedger;

/**
 * In-memory usage ledger for development and tests.
 *
 * <p>{@link ConcurrentMap#put} keyed on {@code (tenant, day, metric)} gives the same
 * overwrite semantics as the Cassandra primary-key upsert.
 */
public class InMemoryUsageLedger implements UsageLedger {

    private static final Comparator<UsageRecord> ORDER = Comparator.comparing(UsageRecord::day)
            .thenComparing(UsageRecord::tenantId)
            .thenComparing(UsageRecord::metricType);

    private final ConcurrentMap<UsageKey, UsageRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> upsert(UsageRecord record) {
        return Uni.createFrom().item(() -> records.put(record.key(), record)).replaceWithVoid();
    }

    @Override
    public Uni<List<UsageRecord>> findByDay(LocalDate day) {
        return Uni.createFrom().item(() -> records.values().stream()
                .filter(r -> r.day().equals(day))
                .sorted(ORDER)
                .toList());
    }

    @Override
    public Uni<List<UsageRecord>> findByTenant(String tenantId, LocalDate from, LocalDate to) {
        return Uni.createFrom().item(() -> records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .filter(r -> !r.day().isBefore(from) && !r.day().isAfter(to))
                .sorted(ORDER)
                .toList());
    }
}
