package tally.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tally.core.config.TelemetryConfig;
import tally.core.model.ratelimit.LimitStrategy;
import tally.core.model.usage.AggregationRun;
import tally.core.model.usage.MetricType;
import tally.core.port.out.Metrics;

/**
 * Records usage-pipeline metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tally.ratelimit.checks} - Rate-limit checks by strategy, result and degradation</li>
 *   <li>{@code tally.ratelimit.exceeded} - Requests rejected with 429, by strategy</li>
 *   <li>{@code tally.counterstore.failures} - Counter store failures by operation</li>
 *   <li>{@code tally.counterstore.timeouts} - Counter store timeouts by operation</li>
 *   <li>{@code tally.usage.recorded} - Usage events counted, by metric</li>
 *   <li>{@code tally.usage.record.failures} - Usage events lost to counter store failures</li>
 *   <li>{@code tally.aggregation.runs} - Aggregation runs by outcome</li>
 *   <li>{@code tally.aggregation.records} - Ledger records written</li>
 *   <li>{@code tally.aggregation.errors} - Keys that failed aggregation</li>
 * </ul>
 */
@ApplicationScoped
public class UsageMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public UsageMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRateLimitCheck(LimitStrategy strategy, boolean allowed, boolean degraded) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.ratelimit.checks")
                .description("Rate-limit checks performed")
                .tag("strategy", strategy.keySegment())
                .tag("result", allowed ? "allowed" : "rejected")
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitExceeded(LimitStrategy strategy) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.ratelimit.exceeded")
                .description("Requests rejected because a rate limit was exceeded")
                .tag("strategy", strategy.keySegment())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCounterStoreFailure(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counterstore.failures")
                .description("Counter store operation failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCounterStoreTimeout(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counterstore.timeouts")
                .description("Counter store operation timeouts")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsage(MetricType metricType, long amount) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.usage.recorded")
                .description("Usage events counted")
                .tag("metric", metricType.value())
                .register(registry)
                .increment(amount);
    }

    @Override
    public void recordUsageFailure(MetricType metricType) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.usage.record.failures")
                .description("Usage events that could not be counted")
                .tag("metric", metricType.value())
                .register(registry)
                .increment();
    }

    @Override
    public void recordAggregationRun(AggregationRun run) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.aggregation.runs")
                .description("Aggregation runs by outcome")
                .tag("outcome", run.outcome().name().toLowerCase())
                .tag("scope", run.tenantId().isPresent() ? "tenant" : "day")
                .register(registry)
                .increment();

        Counter.builder("tally.aggregation.records")
                .description("Usage records written to the ledger")
                .register(registry)
                .increment(run.recordsWritten());

        Counter.builder("tally.aggregation.errors")
                .description("Usage keys that failed aggregation")
                .register(registry)
                .increment(run.errors());
    }
}
