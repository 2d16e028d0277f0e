package tally.spi;

import tally.core.port.out.CounterStore;

/**
 * Service Provider Interface for counter store implementations.
 *
 * <p>Providers are selected by priority unless {@code tally.counter-store.provider} names one
 * explicitly.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - single instance only, used in development and tests</li>
 *   <li>Redis (priority 10) - shared across instances, the production default</li>
 * </ul>
 *
 * @see tally.core.port.out.CounterStore
 */
public interface CounterStoreProvider {

    /**
     * Return the priority of this provider. Higher values win.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider is usable in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the counter store. Called once at startup; the instance must be thread-safe.
     *
     * @return the counter store
     */
    CounterStore createCounterStore();
}
