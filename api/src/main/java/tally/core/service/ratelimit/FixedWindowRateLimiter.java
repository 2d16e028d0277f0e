package tally.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.CounterStoreConfig;
import tally.core.model.ratelimit.RateLimitDecision;
import tally.core.model.ratelimit.RateLimitKey;
import tally.core.model.ratelimit.StrategyLimit;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;

/**
 * Fixed-window counter check against the shared counter store.
 *
 * <p>One request costs one atomic increment of the current window's key. The window key
 * carries the window start, so crossing a boundary starts a fresh count without any reset.
 * Up to twice the limit can pass around a boundary; that burst is accepted.
 *
 * <p>Counter store failures fail open: the request is allowed, the decision is flagged as
 * degraded and the failure is logged and counted, never surfaced.
 */
@ApplicationScoped
public class FixedWindowRateLimiter {

    private static final Logger LOG = Logger.getLogger(FixedWindowRateLimiter.class);

    private final CounterStore counterStore;
    private final Metrics metrics;
    private final Clock clock;
    private final String keyPrefix;

    @Inject
    public FixedWindowRateLimiter(
            CounterStore counterStore, Metrics metrics, Clock clock, CounterStoreConfig counterStoreConfig) {
        this(counterStore, metrics, clock, counterStoreConfig.keyPrefix());
    }

    public FixedWindowRateLimiter(CounterStore counterStore, Metrics metrics, Clock clock, String keyPrefix) {
        this.counterStore = counterStore;
        this.metrics = metrics;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    /**
     * Count one request against a window and decide whether it may proceed.
     *
     * @param limit the strategy limit to apply
     * @param scopeId the scope being limited (address, tenant, credential, endpoint/address)
     * @return Uni with the decision; never fails
     */
    public Uni<RateLimitDecision> check(StrategyLimit limit, String scopeId) {
        final var now = clock.instant();
        final var key = RateLimitKey.forWindow(limit.strategy(), scopeId, now.getEpochSecond(), limit.windowSeconds());
        final var cacheKey = key.toCacheKey(keyPrefix);

        return counterStore
                .increment(cacheKey, 1, Duration.ofSeconds(limit.windowSeconds()))
                .map(count -> RateLimitDecision.fromCount(limit, count, key.windowStartEpochSeconds(), now))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Rate limit check for {0} failed open ({1}): {2}",
                            limit.strategy(), cacheKey, error.getMessage());
                    return RateLimitDecision.failOpen(limit, key.windowStartEpochSeconds(), now);
                })
                .invoke(decision -> metrics.recordRateLimitCheck(
                        decision.strategy(), decision.allowed(), decision.degraded()));
    }
}
