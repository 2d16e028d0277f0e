package tally.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a fixed-window check.
 *
 * @param strategy the strategy that produced the decision
 * @param allowed whether the request may proceed
 * @param count the window count after this request (0 when degraded)
 * @param limit the ceiling of the window
 * @param remaining requests left in the window, never negative
 * @param windowSeconds the window length
 * @param resetAt end of the window
 * @param retryAfterSeconds seconds until the window ends (only meaningful when rejected)
 * @param degraded true when the counter store could not be consulted and the check failed open
 */
public record RateLimitDecision(
        LimitStrategy strategy,
        boolean allowed,
        long count,
        long limit,
        long remaining,
        long windowSeconds,
        Instant resetAt,
        long retryAfterSeconds,
        boolean degraded) {

    /**
     * Build a decision from the post-increment window count.
     *
     * @param limit the applied limit
     * @param count count returned by the atomic increment
     * @param windowStartEpochSeconds start of the window
     * @param now the current time
     * @return the decision
     */
    public static RateLimitDecision fromCount(
            StrategyLimit limit, long count, long windowStartEpochSeconds, Instant now) {
        final var resetAt = Instant.ofEpochSecond(windowStartEpochSeconds + limit.windowSeconds());
        final var allowed = count <= limit.limit();
        final var remaining = Math.max(0, limit.limit() - count);
        return new RateLimitDecision(
                limit.strategy(),
                allowed,
                count,
                limit.limit(),
                remaining,
                limit.windowSeconds(),
                resetAt,
                secondsUntil(now, resetAt),
                false);
    }

    /**
     * Decision used when the counter store is unavailable: allow with a full window.
     */
    public static RateLimitDecision failOpen(StrategyLimit limit, long windowStartEpochSeconds, Instant now) {
        final var resetAt = Instant.ofEpochSecond(windowStartEpochSeconds + limit.windowSeconds());
        return new RateLimitDecision(
                limit.strategy(),
                true,
                0,
                limit.limit(),
                limit.limit(),
                limit.windowSeconds(),
                resetAt,
                secondsUntil(now, resetAt),
                true);
    }

    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }

    private static long secondsUntil(Instant now, Instant resetAt) {
        final var millis = resetAt.toEpochMilli() - now.toEpochMilli();
        return Math.max(1, (millis + 999) / 1000);
    }
}
