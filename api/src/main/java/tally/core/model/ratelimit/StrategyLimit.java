package tally.core.model.ratelimit;

import java.util.Objects;

import tally.core.model.common.ConfigurationException;

/**
 * Limit and window for one strategy.
 *
 * <p>Built once at startup from configuration and immutable afterwards. Invalid values
 * are a {@link ConfigurationException} so that a bad deployment fails to start instead of
 * degrading at runtime.
 *
 * @param strategy the strategy this limit applies to
 * @param limit maximum requests per window
 * @param windowSeconds window length in seconds
 */
public record StrategyLimit(LimitStrategy strategy, long limit, long windowSeconds) {

    public StrategyLimit {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (limit <= 0) {
            throw new ConfigurationException(
                    "Rate limit for %s must be positive, got %d".formatted(strategy, limit));
        }
        if (windowSeconds <= 0) {
            throw new ConfigurationException(
                    "Window for %s must be positive, got %d seconds".formatted(strategy, windowSeconds));
        }
    }

    public static StrategyLimit of(LimitStrategy strategy, long limit, long windowSeconds) {
        return new StrategyLimit(strategy, limit, windowSeconds);
    }
}
