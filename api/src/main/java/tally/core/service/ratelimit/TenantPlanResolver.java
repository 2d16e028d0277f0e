package tally.core.service.ratelimit;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.cache.CaffeineLocalCache;
import tally.core.cache.LocalCache;
import tally.core.config.LocalCacheConfig;
import tally.core.model.common.ConfigurationException;
import tally.core.model.ratelimit.LimitStrategy;
import tally.core.model.ratelimit.RateLimitPolicy;
import tally.core.model.ratelimit.StrategyLimit;
import tally.core.model.usage.TenantPlan;
import tally.core.port.out.TenantPlanRepository;

/**
 * Resolves the tenant-strategy limit for a tenant from its plan.
 *
 * <p>Resolved limits are cached locally. Tenants without a plan, plans with unusable values
 * and lookup failures all fall back to the configured tenant default; failures are not cached.
 */
@ApplicationScoped
public class TenantPlanResolver {

    private static final Logger LOG = Logger.getLogger(TenantPlanResolver.class);

    private final TenantPlanRepository repository;
    private final RateLimitPolicy policy;
    private final LocalCache<String, StrategyLimit> cache;

    @Inject
    public TenantPlanResolver(TenantPlanRepository repository, RateLimitPolicy policy, LocalCacheConfig cacheConfig) {
        this(
                repository,
                policy,
                new CaffeineLocalCache<>(
                        cacheConfig.tenantPlanTtl(), cacheConfig.maxEntries(), cacheConfig.jitterFactor()));
    }

    TenantPlanResolver(TenantPlanRepository repository, RateLimitPolicy policy, LocalCache<String, StrategyLimit> cache) {
        this.repository = repository;
        this.policy = policy;
        this.cache = cache;
    }

    /**
     * @param tenantId the tenant
     * @return Uni with the tenant's limit, empty when the tenant strategy is disabled
     */
    public Uni<Optional<StrategyLimit>> limitFor(String tenantId) {
        if (policy.tenantDefault().isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var fallback = policy.tenantDefault().get();

        final var cached = cache.get(tenantId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }

        return repository
                .findByTenant(tenantId)
                .map(plan -> {
                    final var limit = plan.map(p -> toLimit(tenantId, p, fallback)).orElse(fallback);
                    cache.put(tenantId, limit);
                    return Optional.of(limit);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Plan lookup failed for tenant {0}, using default limit: {1}", tenantId, error.getMessage());
                    return Optional.of(fallback);
                });
    }

    /**
     * Drop a cached limit, e.g. after a plan change.
     */
    public void invalidate(String tenantId) {
        cache.invalidate(tenantId);
    }

    private static StrategyLimit toLimit(String tenantId, TenantPlan plan, StrategyLimit fallback) {
        try {
            return StrategyLimit.of(LimitStrategy.TENANT, plan.requestsPerWindow(), plan.windowSeconds());
        } catch (ConfigurationException e) {
            LOG.warnv("Plan {0} of tenant {1} is invalid, using default limit: {2}", plan.planId(), tenantId, e.getMessage());
            return fallback;
        }
    }
}
