package tally.core.service.usage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.CounterStoreConfig;
import tally.core.config.ResiliencyConfig;
import tally.core.config.UsageConfig;
import tally.core.model.common.InvalidCounterValueException;
import tally.core.model.common.LedgerReadException;
import tally.core.model.common.LedgerWriteException;
import tally.core.model.usage.AggregationRun;
import tally.core.model.usage.AggregationStatus;
import tally.core.model.usage.UsageKey;
import tally.core.model.usage.UsageRecord;
import tally.core.port.in.AggregationManagement;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;
import tally.core.port.out.UsageLedger;

/**
 * Reconciles usage counters into the ledger.
 *
 * <p>A run scans the counter store with a cursor for the day's usage keys, reads each
 * counter and overwrites the matching ledger record with the value read. The ledger only
 * ever receives the latest absolute value, so runs can be repeated, overlap across instances
 * or be replayed after a crash without double counting.
 *
 * <p>Keys are isolated from each other: a key whose read or write still fails after the
 * configured retries is counted as an error and the run moves on. Keys that are malformed,
 * name an unknown metric, hold a non-numeric value or expired between the scan and the read
 * are skipped.
 */
@ApplicationScoped
public class UsageAggregationJob implements AggregationManagement {

    private static final Logger LOG = Logger.getLogger(UsageAggregationJob.class);
    private static final int MAX_ERROR_DETAILS = 20;

    private final CounterStore counterStore;
    private final UsageLedger ledger;
    private final Metrics metrics;
    private final Clock clock;
    private final String keyPrefix;
    private final UsageConfig.AggregationConfig config;
    private final Duration ledgerTimeout;

    @Inject
    public UsageAggregationJob(
            CounterStore counterStore,
            UsageLedger ledger,
            Metrics metrics,
            Clock clock,
            CounterStoreConfig counterStoreConfig,
            UsageConfig usageConfig,
            ResiliencyConfig resiliencyConfig) {
        this.counterStore = counterStore;
        this.ledger = ledger;
        this.metrics = metrics;
        this.clock = clock;
        this.keyPrefix = counterStoreConfig.keyPrefix();
        this.config = usageConfig.aggregation();
        this.ledgerTimeout = resiliencyConfig.ledger().timeout();
    }

    @Override
    public Uni<AggregationRun> run(LocalDate day) {
        return aggregate(day, Optional.empty(), UsageKey.dayPattern(keyPrefix, day));
    }

    @Override
    public Uni<List<AggregationRun>> runRange(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start (%s) must not be after end (%s)".formatted(start, end));
        }
        final var days = ChronoUnit.DAYS.between(start, end) + 1;
        if (days > config.maxRangeDays()) {
            throw new IllegalArgumentException(
                    "Range of %d days exceeds the maximum of %d".formatted(days, config.maxRangeDays()));
        }

        LOG.infov("Aggregating usage from {0} to {1} ({2} days)", start, end, days);
        return Multi.createFrom()
                .iterable(start.datesUntil(end.plusDays(1)).toList())
                .onItem()
                .transformToUniAndConcatenate(this::run)
                .collect()
                .asList();
    }

    @Override
    public Uni<AggregationRun> runForTenant(String tenantId, LocalDate day) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return aggregate(day, Optional.of(tenantId), UsageKey.tenantDayPattern(keyPrefix, tenantId, day));
    }

    @Override
    public Uni<AggregationStatus> status(LocalDate day) {
        return ledger.findByDay(day)
                .ifNoItem()
                .after(ledgerTimeout)
                .failWith(() -> new LedgerReadException("Timed out reading ledger for " + day))
                .map(records -> new AggregationStatus(
                        day,
                        !records.isEmpty(),
                        records.stream().map(UsageRecord::tenantId).distinct().count(),
                        records.size()));
    }

    private Uni<AggregationRun> aggregate(LocalDate day, Optional<String> tenantId, String pattern) {
        final var startedAt = clock.instant();
        final var progress = new Progress();
        LOG.debugf("Scanning usage counters matching %s", pattern);

        return counterStore
                .scan(pattern, config.batchSize())
                .onItem()
                .<String>disjoint()
                .onItem()
                .transformToUniAndConcatenate(key -> aggregateKey(key, day, tenantId, progress))
                .collect()
                .last()
                .map(ignored -> progress.toRun(day, tenantId, false, startedAt, clock.instant()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv("Usage scan for {0} failed: {1}", day, error.getMessage());
                    progress.error("scan: " + error.getMessage());
                    return progress.toRun(day, tenantId, true, startedAt, clock.instant());
                })
                .invoke(run -> {
                    metrics.recordAggregationRun(run);
                    LOG.infov(
                            "Aggregation for {0}{1}: scanned={2}, written={3}, skipped={4}, errors={5}, outcome={6}",
                            day,
                            tenantId.map(t -> " (tenant " + t + ")").orElse(""),
                            run.keysScanned(),
                            run.recordsWritten(),
                            run.keysSkipped(),
                            run.errors(),
                            run.outcome());
                });
    }

    private Uni<Boolean> aggregateKey(String cacheKey, LocalDate day, Optional<String> tenantId, Progress progress) {
        progress.keysScanned.incrementAndGet();

        final var parsed = UsageKey.parse(keyPrefix, cacheKey)
                .filter(key -> key.day().equals(day))
                .filter(key -> tenantId.map(key.tenantId()::equals).orElse(true));
        if (parsed.isEmpty()) {
            LOG.debugf("Skipping unrecognised usage key %s", cacheKey);
            progress.keysSkipped.incrementAndGet();
            return Uni.createFrom().item(false);
        }
        final var key = parsed.get();

        return withRetries(counterStore.get(cacheKey).flatMap(value -> {
                    if (value.isEmpty()) {
                        return Uni.createFrom().item(false);
                    }
                    final var record = UsageRecord.of(key, value.get(), clock.instant());
                    return ledger.upsert(record)
                            .ifNoItem()
                            .after(ledgerTimeout)
                            .failWith(() -> new LedgerWriteException("Timed out writing " + cacheKey))
                            .replaceWith(true);
                }))
                .invoke(written -> {
                    if (written) {
                        progress.recordsWritten.incrementAndGet();
                    } else {
                        LOG.debugf("Usage key %s expired before it was read", cacheKey);
                        progress.keysSkipped.incrementAndGet();
                    }
                })
                .onFailure(InvalidCounterValueException.class)
                .recoverWithItem(error -> {
                    LOG.warnv("Skipping usage key {0}: {1}", cacheKey, error.getMessage());
                    progress.keysSkipped.incrementAndGet();
                    return false;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Failed to aggregate {0}: {1}", cacheKey, error.getMessage());
                    progress.error(cacheKey + ": " + error.getMessage());
                    return false;
                });
    }

    private <T> Uni<T> withRetries(Uni<T> attempt) {
        if (config.maxRetries() <= 0) {
            return attempt;
        }
        final var backoff = config.retryBackoff();
        final Predicate<Throwable> retryable = error -> !(error instanceof InvalidCounterValueException);
        if (backoff.isZero() || backoff.isNegative()) {
            return attempt.onFailure(retryable).retry().atMost(config.maxRetries());
        }
        return attempt.onFailure(retryable)
                .retry()
                .withBackOff(backoff, backoff.multipliedBy(10))
                .atMost(config.maxRetries());
    }

    private static final class Progress {
        private final AtomicLong keysScanned = new AtomicLong();
        private final AtomicLong recordsWritten = new AtomicLong();
        private final AtomicLong keysSkipped = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private final List<String> errorDetails = Collections.synchronizedList(new ArrayList<>());

        void error(String detail) {
            errors.incrementAndGet();
            if (errorDetails.size() < MAX_ERROR_DETAILS) {
                errorDetails.add(detail);
            }
        }

        AggregationRun toRun(
                LocalDate day, Optional<String> tenantId, boolean scanFailed, Instant startedAt, Instant completedAt) {
            return new AggregationRun(
                    day,
                    tenantId,
                    keysScanned.get(),
                    recordsWritten.get(),
                    keysSkipped.get(),
                    errors.get(),
                    new ArrayList<>(errorDetails),
                    scanFailed,
                    startedAt,
                    completedAt);
        }
    }
}
