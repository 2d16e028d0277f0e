package tally.adapter.out.counter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import tally.adapter.out.counter.memory.InMemoryCounterStoreProvider;
import tally.adapter.out.counter.redis.RedisCounterStoreProvider;
import tally.core.config.CounterStoreConfig;
import tally.core.config.ResiliencyConfig;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;
import tally.spi.CounterStoreProvider;
import tally.spi.StorageProviderException;

/**
 * CDI producer for the counter store.
 *
 * <p>Selection:
 * <ol>
 *   <li>If {@code tally.counter-store.provider} is set, that provider is used and must be available</li>
 *   <li>Otherwise the highest priority available provider: Redis (10) when a data source
 *       is configured, else in-memory (0)</li>
 * </ol>
 */
@ApplicationScoped
public class CounterStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CounterStoreProviderLoader.class);

    private final CounterStoreConfig config;
    private final ResiliencyConfig resiliencyConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public CounterStoreProviderLoader(
            CounterStoreConfig config,
            ResiliencyConfig resiliencyConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.resiliencyConfig = resiliencyConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Produces the counter store instance for CDI injection.
     *
     * @return the selected counter store
     */
    @Produces
    @ApplicationScoped
    public CounterStore produceCounterStore() {
        final var provider = select(providers());
        LOG.infov("Using counter store provider: {0} (key prefix {1})", provider.name(), config.keyPrefix());
        return provider.createCounterStore();
    }

    CounterStoreProvider select(List<CounterStoreProvider> providers) {
        final var configured = config.provider().filter(name -> !name.isBlank());
        if (configured.isPresent()) {
            final var name = configured.get();
            final var provider = providers.stream()
                    .filter(p -> p.name().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured counter store provider not found: "
                            + name + ". Available: "
                            + providers.stream().map(CounterStoreProvider::name).toList()));
            if (!provider.isAvailable()) {
                throw new StorageProviderException("Configured counter store provider is not available: " + name);
            }
            return provider;
        }

        return providers.stream()
                .filter(CounterStoreProvider::isAvailable)
                .max(Comparator.comparingInt(CounterStoreProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available counter store providers"));
    }

    private List<CounterStoreProvider> providers() {
        final var providers = new ArrayList<CounterStoreProvider>();
        providers.add(new InMemoryCounterStoreProvider(clock));
        // Only touch the Redis client when it may actually be selected
        final var configured = config.provider().filter(name -> !name.isBlank());
        final var redis = configured.isEmpty() || configured.get().equals("redis") ? resolveRedis() : null;
        providers.add(new RedisCounterStoreProvider(redis, resiliencyConfig.counterStore().timeout(), metrics));
        return providers;
    }

    private ReactiveRedisDataSource resolveRedis() {
        if (!redisDataSource.isResolvable()) {
            LOG.debug("No ReactiveRedisDataSource available");
            return null;
        }
        try {
            return redisDataSource.get();
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis data source, Redis counter store unavailable");
            return null;
        }
    }
}
