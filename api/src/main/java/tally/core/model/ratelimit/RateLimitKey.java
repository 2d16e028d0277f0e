package tally.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies one fixed-window counter.
 *
 * <p>Key format: {@code {prefix}ratelimit:{strategy}:{scopeId}:{windowStart}}, where
 * {@code windowStart} is in epoch seconds. A new window start yields a new key, so
 * old windows are never reset in place; they simply expire.
 *
 * @param strategy the strategy that owns the counter
 * @param scopeId the address, tenant id, credential id or endpoint/address pair
 * @param windowStartEpochSeconds start of the window
 */
public record RateLimitKey(LimitStrategy strategy, String scopeId, long windowStartEpochSeconds) {

    public RateLimitKey {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(scopeId, "scopeId must not be null");
    }

    /**
     * Align a timestamp to the start of its window.
     *
     * @param nowEpochSeconds the current time
     * @param windowSeconds the window length
     * @return the window start in epoch seconds
     */
    public static long windowStart(long nowEpochSeconds, long windowSeconds) {
        return Math.floorDiv(nowEpochSeconds, windowSeconds) * windowSeconds;
    }

    public static RateLimitKey forWindow(LimitStrategy strategy, String scopeId, long nowEpochSeconds, long windowSeconds) {
        return new RateLimitKey(strategy, scopeId, windowStart(nowEpochSeconds, windowSeconds));
    }

    /**
     * Scope for the endpoint strategy: the endpoint and the caller's address.
     */
    public static String endpointScope(String endpoint, String sourceAddress) {
        return endpoint + "|" + sourceAddress;
    }

    public String toCacheKey(String prefix) {
        return prefix + "ratelimit:" + strategy.keySegment() + ":" + scopeId + ":" + windowStartEpochSeconds;
    }
}
