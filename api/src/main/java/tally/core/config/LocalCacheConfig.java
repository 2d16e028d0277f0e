package tally.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for local in-memory caches.
 *
 * <p>Configuration prefix: {@code tally.cache.local}
 *
 * <p>Lower TTL values propagate plan changes faster but increase load on the plan source.
 */
@ConfigMapping(prefix = "tally.cache.local")
public interface LocalCacheConfig {

    /**
     * TTL for resolved tenant plans.
     *
     * @return TTL duration (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration tenantPlanTtl();

    /**
     * Maximum number of entries in local caches.
     *
     * @return maximum entries (default: 10000)
     */
    @WithDefault("10000")
    long maxEntries();

    /**
     * TTL jitter factor (0.0 to 0.5) to spread refreshes across instances.
     *
     * @return jitter factor (default: 0.1)
     */
    @WithDefault("0.1")
    double jitterFactor();
}
