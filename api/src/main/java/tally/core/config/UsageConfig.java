package tally.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for usage counting and aggregation.
 *
 * <p>Configuration prefix: {@code tally.usage}
 *
 * <p>The counter TTL must cover at least three aggregation intervals so a counter cannot
 * expire before it has been reconciled; this is checked at startup.
 */
@ConfigMapping(prefix = "tally.usage")
public interface UsageConfig {

    /**
     * Expiry applied to usage counters when they have none.
     *
     * @return counter TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration counterTtl();

    AggregationConfig aggregation();

    interface AggregationConfig {

        /**
         * Enable the periodic aggregation job. On-demand runs are always available.
         *
         * @return true if the scheduler runs (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Interval between scheduled runs.
         *
         * @return the interval (default: 1 hour)
         */
        @WithDefault("1h")
        Duration interval();

        /**
         * Delay before the first scheduled run after startup.
         *
         * @return the delay (default: 30 seconds)
         */
        @WithDefault("30s")
        Duration initialDelay();

        /**
         * Minimum number of previous days re-aggregated on every scheduled tick, in addition to
         * today. The scheduler widens this to every day the counter TTL can still cover.
         *
         * @return number of previous days (default: 1)
         */
        @WithDefault("1")
        int catchUpDays();

        /**
         * Keys requested per SCAN page.
         *
         * @return the page size (default: 100)
         */
        @WithDefault("100")
        int batchSize();

        /**
         * Retries per key after the first failed attempt.
         *
         * @return retry count (default: 2)
         */
        @WithDefault("2")
        int maxRetries();

        /**
         * Initial backoff between retries.
         *
         * @return backoff (default: 100ms)
         */
        @WithDefault("PT0.1S")
        Duration retryBackoff();

        /**
         * Longest range accepted by a range run, in days.
         *
         * @return maximum days (default: 31)
         */
        @WithDefault("31")
        int maxRangeDays();
    }
}
