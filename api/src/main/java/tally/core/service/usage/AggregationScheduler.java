package tally.core.service.usage;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.UsageConfig;
import tally.core.port.in.AggregationManagement;

/**
 * Periodically folds usage counters into the ledger.
 *
 * <p>Each tick re-aggregates today and every previous day whose counters may still be in the
 * counter store: at least {@code catch-up-days}, and as many days as the counter TTL spans.
 * Counts that land after midnight still reach yesterday's record, and days missed while the
 * job was down are folded in on the first tick after recovery. Overlapping runs on several
 * instances are harmless because every write is an overwrite with the latest value.
 */
@ApplicationScoped
public class AggregationScheduler {

    private static final Logger LOG = Logger.getLogger(AggregationScheduler.class);

    private final AggregationManagement aggregation;
    private final UsageConfig.AggregationConfig config;
    private final Duration counterTtl;
    private final Clock clock;

    @Inject
    public AggregationScheduler(AggregationManagement aggregation, UsageConfig usageConfig, Clock clock) {
        this.aggregation = aggregation;
        this.config = usageConfig.aggregation();
        this.counterTtl = usageConfig.counterTtl();
        this.clock = clock;
    }

    @Scheduled(
            every = "${tally.usage.aggregation.interval:1h}",
            delayed = "${tally.usage.aggregation.initial-delay:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> aggregate() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        final var days = daysToAggregate();
        LOG.debugv("Scheduled usage aggregation for {0}", days);

        return Multi.createFrom()
                .iterable(days)
                .onItem()
                .transformToUniAndConcatenate(aggregation::run)
                .onItem()
                .ignoreAsUni()
                .onFailure()
                .invoke(e -> LOG.error("Scheduled usage aggregation failed", e))
                .onFailure()
                .recoverWithNull()
                .replaceWithVoid();
    }

    /**
     * Days covered by one tick, oldest first, ending with today (UTC).
     */
    List<LocalDate> daysToAggregate() {
        final var today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        final var previousDays = Math.max(config.catchUpDays(), daysSpanned(counterTtl));
        final var days = new ArrayList<LocalDate>(previousDays + 1);
        for (int i = previousDays; i >= 0; i--) {
            days.add(today.minusDays(i));
        }
        return days;
    }

    /**
     * Whole days a counter written at the last instant of its day can outlive that day.
     */
    static int daysSpanned(Duration ttl) {
        final var days = ttl.toDays();
        return (int) (ttl.compareTo(Duration.ofDays(days)) > 0 ? days + 1 : days);
    }
}
