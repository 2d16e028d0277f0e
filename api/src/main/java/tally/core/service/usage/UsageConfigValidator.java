package tally.core.service.usage;

import tally.core.config.UsageConfig;
import tally.core.model.common.ConfigurationException;

/**
 * Startup checks for {@link UsageConfig}.
 */
public final class UsageConfigValidator {

    /** Counters must outlive this many aggregation intervals. */
    static final int MIN_TTL_INTERVALS = 3;

    private UsageConfigValidator() {}

    /**
     * @param config the usage configuration
     * @throws ConfigurationException if the configuration could lose counts
     */
    public static void validate(UsageConfig config) {
        final var aggregation = config.aggregation();
        if (aggregation.interval().isNegative() || aggregation.interval().isZero()) {
            throw new ConfigurationException("tally.usage.aggregation.interval must be positive");
        }
        final var minimumTtl = aggregation.interval().multipliedBy(MIN_TTL_INTERVALS);
        if (config.counterTtl().compareTo(minimumTtl) < 0) {
            throw new ConfigurationException("tally.usage.counter-ttl (%s) must be at least %d x the aggregation interval (%s)"
                    .formatted(config.counterTtl(), MIN_TTL_INTERVALS, aggregation.interval()));
        }
        if (aggregation.batchSize() <= 0) {
            throw new ConfigurationException("tally.usage.aggregation.batch-size must be positive");
        }
        if (aggregation.maxRetries() < 0) {
            throw new ConfigurationException("tally.usage.aggregation.max-retries must not be negative");
        }
        if (aggregation.catchUpDays() < 0) {
            throw new ConfigurationException("tally.usage.aggregation.catch-up-days must not be negative");
        }
        if (aggregation.maxRangeDays() < 1) {
            throw new ConfigurationException("tally.usage.aggregation.max-range-days must be at least 1");
        }
    }
}
