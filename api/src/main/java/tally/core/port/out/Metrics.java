package tally.core.port.out;

import tally.core.model.ratelimit.LimitStrategy;
import tally.core.model.usage.AggregationRun;
import tally.core.model.usage.MetricType;

/**
 * Port interface for recording usage-pipeline metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a single rate-limit check.
     *
     * @param strategy the strategy that was checked
     * @param allowed whether the request was allowed
     * @param degraded whether the decision was a fail-open fallback
     */
    void recordRateLimitCheck(LimitStrategy strategy, boolean allowed, boolean degraded);

    /**
     * Record a request rejected with 429.
     *
     * @param strategy the strategy that rejected it
     */
    void recordRateLimitExceeded(LimitStrategy strategy);

    /**
     * Record a counter store operation failure.
     *
     * @param operation the operation (e.g., "increment", "scan")
     */
    void recordCounterStoreFailure(String operation);

    /**
     * Record a counter store operation timeout.
     *
     * @param operation the operation (e.g., "increment", "scan")
     */
    void recordCounterStoreTimeout(String operation);

    /**
     * Record usage events counted.
     *
     * @param metricType the metric
     * @param amount the amount added
     */
    void recordUsage(MetricType metricType, long amount);

    /**
     * Record usage events that could not be counted.
     *
     * @param metricType the metric
     */
    void recordUsageFailure(MetricType metricType);

    /**
     * Record a completed aggregation run.
     *
     * @param run the run summary
     */
    void recordAggregationRun(AggregationRun run);
}
