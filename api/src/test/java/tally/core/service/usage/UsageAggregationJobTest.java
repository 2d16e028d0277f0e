package tally.core.service.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tally.adapter.out.counter.memory.InMemoryCounterStore;
import tally.adapter.out.ledger.memory.InMemoryUsageLedger;
import tally.core.model.common.CounterStoreUnavailableException;
import tally.core.model.common.InvalidCounterValueException;
import tally.core.model.common.LedgerReadException;
import tally.core.model.common.LedgerWriteException;
import tally.core.model.usage.AggregationOutcome;
import tally.core.model.usage.AggregationRun;
import tally.core.model.usage.MetricType;
import tally.core.model.usage.UsageRecord;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;
import tally.core.port.out.UsageLedger;
import tally.testing.MutableClock;
import tally.testing.TestConfigs;

@DisplayName("UsageAggregationJob")
class UsageAggregationJobTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    private MutableClock clock;
    private InMemoryCounterStore store;
    private InMemoryUsageLedger ledger;
    private Metrics metrics;
    private UsageRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T18:00:00Z");
        store = new InMemoryCounterStore(clock);
        ledger = new InMemoryUsageLedger();
        metrics = mock(Metrics.class);
        recorder = new UsageRecorder(store, metrics, clock, TestConfigs.counterStore(), TestConfigs.usage(2));
    }

    private UsageAggregationJob job(CounterStore counterStore, UsageLedger usageLedger) {
        return new UsageAggregationJob(
                counterStore,
                usageLedger,
                metrics,
                clock,
                TestConfigs.counterStore(),
                TestConfigs.usage(2),
                TestConfigs.resiliency());
    }

    private UsageAggregationJob job() {
        return job(store, ledger);
    }

    private void record(String tenant, MetricType metric, long amount) {
        recorder.record(tenant, metric, DAY, amount).await().atMost(TIMEOUT);
    }

    private long ledgerValue(String tenant, MetricType metric) {
        return ledger.findByTenant(tenant, DAY, DAY).await().atMost(TIMEOUT).stream()
                .filter(r -> r.metricType() == metric)
                .mapToLong(UsageRecord::value)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Idempotent overwrite")
    class IdempotenceTests {

        @Test
        @DisplayName("should write the counter value to the ledger")
        void shouldWriteCounterValue() {
            record("acme", MetricType.QUERIES, 10);
            record("globex", MetricType.DOCUMENTS, 4);

            var run = job().run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.SUCCESS, run.outcome());
            assertEquals(2, run.keysScanned());
            assertEquals(2, run.recordsWritten());
            assertEquals(10, ledgerValue("acme", MetricType.QUERIES));
            assertEquals(4, ledgerValue("globex", MetricType.DOCUMENTS));
            verify(metrics).recordAggregationRun(run);
        }

        @Test
        @DisplayName("should produce the same ledger when run twice")
        void shouldBeIdempotent() {
            record("acme", MetricType.QUERIES, 10);

            job().run(DAY).await().atMost(TIMEOUT);
            job().run(DAY).await().atMost(TIMEOUT);

            var records = ledger.findByDay(DAY).await().atMost(TIMEOUT);
            assertEquals(1, records.size());
            assertEquals(10, records.get(0).value());
        }

        @Test
        @DisplayName("should converge to 13, not 23, after more events arrive")
        void shouldOverwriteWithLatestValue() {
            record("acme", MetricType.QUERIES, 10);
            job().run(DAY).await().atMost(TIMEOUT);

            record("acme", MetricType.QUERIES, 1);
            record("acme", MetricType.QUERIES, 1);
            record("acme", MetricType.QUERIES, 1);
            job().run(DAY).await().atMost(TIMEOUT);

            assertEquals(13, ledgerValue("acme", MetricType.QUERIES));
        }

        @Test
        @DisplayName("should ignore counters of other days")
        void shouldIgnoreOtherDays() {
            record("acme", MetricType.QUERIES, 10);
            recorder.record("acme", MetricType.QUERIES, DAY.minusDays(1), 7).await().atMost(TIMEOUT);

            var run = job().run(DAY).await().atMost(TIMEOUT);

            assertEquals(1, run.recordsWritten());
            assertTrue(ledger.findByDay(DAY.minusDays(1)).await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("Per-key isolation")
    class IsolationTests {

        @Test
        @DisplayName("should write 49 of 50 keys when one key keeps failing")
        void shouldIsolateFailingKey() {
            for (int i = 0; i < 50; i++) {
                record("tenant-" + i, MetricType.API_CALLS, i + 1);
            }
            var attempts = new AtomicInteger();
            var flaky = new FailingLedger(ledger, Set.of("tenant-13"), attempts, Integer.MAX_VALUE);

            var run = job(store, flaky).run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.PARTIAL, run.outcome());
            assertEquals(1, run.outcome().exitCode());
            assertEquals(50, run.keysScanned());
            assertEquals(49, run.recordsWritten());
            assertEquals(1, run.errors());
            assertEquals(3, attempts.get(), "initial attempt plus two retries");
            assertTrue(run.errorDetails().get(0).contains("tenant-13"));
            assertEquals(49, ledger.findByDay(DAY).await().atMost(TIMEOUT).size());
        }

        @Test
        @DisplayName("should succeed when a retry recovers from a transient failure")
        void shouldRecoverOnRetry() {
            record("acme", MetricType.QUERIES, 5);
            var attempts = new AtomicInteger();
            var flaky = new FailingLedger(ledger, Set.of("acme"), attempts, 1);

            var run = job(store, flaky).run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.SUCCESS, run.outcome());
            assertEquals(1, run.recordsWritten());
            assertEquals(5, ledgerValue("acme", MetricType.QUERIES));
        }

        @Test
        @DisplayName("should skip malformed keys and unknown metrics")
        void shouldSkipMalformedKeys() {
            record("acme", MetricType.QUERIES, 3);
            store.increment("tally:usage:acme:2024-05-01:bananas", 1, Duration.ofHours(1))
                    .await()
                    .atMost(TIMEOUT);
            store.increment("tally:usage:2024-05-01:queries", 1, Duration.ofHours(1))
                    .await()
                    .atMost(TIMEOUT);

            var run = job().run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.SUCCESS, run.outcome());
            assertEquals(1, run.recordsWritten());
            assertEquals(run.keysScanned() - 1, run.keysSkipped());
        }
    }

    @Nested
    @DisplayName("Counter store outage")
    class OutageTests {

        @Test
        @DisplayName("should report FAILED when the scan fails")
        void shouldFailWhenScanFails() {
            var failing = mock(CounterStore.class);
            when(failing.scan(anyString(), anyInt()))
                    .thenReturn(Multi.createFrom().failure(new CounterStoreUnavailableException("scan", "down")));

            var run = job(failing, ledger).run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.FAILED, run.outcome());
            assertEquals(2, run.outcome().exitCode());
            assertTrue(run.scanFailed());
            assertEquals(0, run.recordsWritten());
        }

        @Test
        @DisplayName("should count keys whose read keeps failing as errors")
        void shouldCountReadFailures() {
            var failing = mock(CounterStore.class);
            when(failing.scan(anyString(), anyInt()))
                    .thenReturn(Multi.createFrom().item(List.of("tally:usage:acme:2024-05-01:queries")));
            when(failing.get(anyString()))
                    .thenReturn(Uni.createFrom().failure(new CounterStoreUnavailableException("get", "down")));

            var run = job(failing, ledger).run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.PARTIAL, run.outcome());
            assertEquals(1, run.errors());
        }

        @Test
        @DisplayName("should skip non-numeric counters without retrying them")
        void shouldSkipNonNumericCounters() {
            var key = "tally:usage:acme:2024-05-01:queries";
            var corrupt = mock(CounterStore.class);
            when(corrupt.scan(anyString(), anyInt())).thenReturn(Multi.createFrom().item(List.of(key)));
            when(corrupt.get(key)).thenReturn(Uni.createFrom().failure(new InvalidCounterValueException(key, "abc")));

            var run = job(corrupt, ledger).run(DAY).await().atMost(TIMEOUT);

            assertEquals(AggregationOutcome.SUCCESS, run.outcome());
            assertEquals(1, run.keysSkipped());
            assertEquals(0, run.errors());
            assertEquals(0, run.recordsWritten());
            verify(corrupt, times(1)).get(key);
        }

        @Test
        @DisplayName("should report a ledger read failure when status cannot be read")
        void shouldFailStatusWhenLedgerUnreadable() {
            var unreadable = mock(UsageLedger.class);
            when(unreadable.findByDay(DAY)).thenReturn(Uni.createFrom().nothing());

            var status = job(store, unreadable).status(DAY);

            assertThrows(LedgerReadException.class, () -> status.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Ranges, tenants and status")
    class RangeTests {

        @Test
        @DisplayName("should aggregate each day of a range in order")
        void shouldAggregateRange() {
            recorder.record("acme", MetricType.QUERIES, DAY.minusDays(2), 2).await().atMost(TIMEOUT);
            record("acme", MetricType.QUERIES, 5);

            var runs = job().runRange(DAY.minusDays(2), DAY).await().atMost(TIMEOUT);

            assertEquals(
                    List.of(DAY.minusDays(2), DAY.minusDays(1), DAY),
                    runs.stream().map(AggregationRun::targetDay).toList());
            assertEquals(1, runs.get(0).recordsWritten());
            assertEquals(0, runs.get(1).recordsWritten());
            assertEquals(1, runs.get(2).recordsWritten());
        }

        @Test
        @DisplayName("should reject inverted and oversized ranges")
        void shouldRejectInvalidRanges() {
            var job = job();

            assertThrows(IllegalArgumentException.class, () -> job.runRange(DAY, DAY.minusDays(1)));
            assertThrows(IllegalArgumentException.class, () -> job.runRange(DAY.minusDays(31), DAY));
        }

        @Test
        @DisplayName("should only aggregate the requested tenant")
        void shouldScopeToTenant() {
            record("acme", MetricType.QUERIES, 5);
            record("globex", MetricType.QUERIES, 8);

            var run = job().runForTenant("acme", DAY).await().atMost(TIMEOUT);

            assertEquals(1, run.recordsWritten());
            assertEquals("acme", run.tenantId().orElseThrow());
            assertEquals(1, ledger.findByDay(DAY).await().atMost(TIMEOUT).size());
        }

        @Test
        @DisplayName("should treat glob characters in tenant ids literally")
        void shouldEscapeGlobInTenant() {
            record("acme", MetricType.QUERIES, 5);

            var run = job().runForTenant("ac*", DAY).await().atMost(TIMEOUT);

            assertEquals(0, run.keysScanned());
            assertEquals(0, run.recordsWritten());
        }

        @Test
        @DisplayName("should report status before and after aggregation")
        void shouldReportStatus() {
            record("acme", MetricType.QUERIES, 5);
            record("acme", MetricType.DOCUMENTS, 1);
            record("globex", MetricType.QUERIES, 2);
            var job = job();

            assertFalse(job.status(DAY).await().atMost(TIMEOUT).aggregated());

            job.run(DAY).await().atMost(TIMEOUT);
            var status = job.status(DAY).await().atMost(TIMEOUT);

            assertTrue(status.aggregated());
            assertEquals(2, status.tenantCount());
            assertEquals(3, status.recordCount());
        }
    }

    /**
     * Ledger that fails upserts for selected tenants a limited number of times.
     */
    private static final class FailingLedger implements UsageLedger {
        private final UsageLedger delegate;
        private final Set<String> failingTenants;
        private final AtomicInteger attempts;
        private final int failures;

        FailingLedger(UsageLedger delegate, Set<String> failingTenants, AtomicInteger attempts, int failures) {
            this.delegate = delegate;
            this.failingTenants = failingTenants;
            this.attempts = attempts;
            this.failures = failures;
        }

        @Override
        public Uni<Void> upsert(UsageRecord record) {
            return Uni.createFrom().deferred(() -> {
                if (failingTenants.contains(record.tenantId())) {
                    if (attempts.incrementAndGet() <= failures) {
                        return Uni.createFrom().failure(new LedgerWriteException("write failed"));
                    }
                }
                return delegate.upsert(record);
            });
        }

        @Override
        public Uni<List<UsageRecord>> findByDay(LocalDate day) {
            return delegate.findByDay(day);
        }

        @Override
        public Uni<List<UsageRecord>> findByTenant(String tenantId, LocalDate from, LocalDate to) {
            return delegate.findByTenant(tenantId, from, to);
        }
    }
}
