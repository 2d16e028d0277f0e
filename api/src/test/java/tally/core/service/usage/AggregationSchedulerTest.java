package tally.core.service.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import tally.core.config.UsageConfig;
import tally.core.model.usage.AggregationRun;
import tally.core.port.in.AggregationManagement;
import tally.testing.MutableClock;
import tally.testing.TestConfigs;

@DisplayName("AggregationScheduler")
class AggregationSchedulerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private AggregationManagement aggregation;
    private UsageConfig config;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        aggregation = mock(AggregationManagement.class);
        config = TestConfigs.usage(Duration.ofDays(1), Duration.ofHours(1), 2);
        clock = MutableClock.at("2024-05-02T00:10:00Z");
    }

    private static AggregationRun emptyRun(LocalDate day) {
        var now = Instant.parse("2024-05-02T00:10:00Z");
        return new AggregationRun(day, Optional.empty(), 0, 0, 0, 0, List.of(), false, now, now);
    }

    @Test
    @DisplayName("should cover yesterday and today, oldest first")
    void shouldCoverCatchUpDays() {
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2)), scheduler.daysToAggregate());
    }

    @Test
    @DisplayName("should still cover yesterday without catch-up days while counters outlive their day")
    void shouldCoverYesterdayForShortTtl() {
        config = TestConfigs.usage(Duration.ofHours(3), Duration.ofHours(1), 2);
        when(config.aggregation().catchUpDays()).thenReturn(0);
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2)), scheduler.daysToAggregate());
    }

    @Test
    @DisplayName("should fold in every day whose counters are still retained")
    void shouldCoverDaysWithinCounterTtl() {
        config = TestConfigs.usage(2);
        clock = MutableClock.at("2024-05-03T00:10:00Z");
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        var days = scheduler.daysToAggregate();

        assertEquals(8, days.size());
        assertEquals(LocalDate.of(2024, 4, 26), days.get(0));
        assertEquals(LocalDate.of(2024, 5, 3), days.get(7));
        assertTrue(days.contains(LocalDate.of(2024, 5, 1)));
    }

    @Test
    @DisplayName("should count partial days of TTL as a whole day")
    void shouldRoundTtlUpToWholeDays() {
        assertEquals(7, AggregationScheduler.daysSpanned(Duration.ofDays(7)));
        assertEquals(1, AggregationScheduler.daysSpanned(Duration.ofDays(1)));
        assertEquals(1, AggregationScheduler.daysSpanned(Duration.ofHours(3)));
        assertEquals(2, AggregationScheduler.daysSpanned(Duration.ofDays(1).plusSeconds(1)));
    }

    @Test
    @DisplayName("should run each day sequentially")
    void shouldRunEachDay() {
        when(aggregation.run(any())).thenAnswer(invocation -> Uni.createFrom().item(emptyRun(invocation.getArgument(0))));
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        scheduler.aggregate().await().atMost(TIMEOUT);

        InOrder order = Mockito.inOrder(aggregation);
        order.verify(aggregation).run(LocalDate.of(2024, 5, 1));
        order.verify(aggregation).run(LocalDate.of(2024, 5, 2));
    }

    @Test
    @DisplayName("should swallow failures so the next tick still runs")
    void shouldSwallowFailures() {
        when(aggregation.run(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        scheduler.aggregate().await().atMost(TIMEOUT);

        verify(aggregation).run(LocalDate.of(2024, 5, 1));
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        when(config.aggregation().enabled()).thenReturn(false);
        var scheduler = new AggregationScheduler(aggregation, config, clock);

        scheduler.aggregate().await().atMost(TIMEOUT);

        verify(aggregation, never()).run(any());
    }
}
