package tally.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import tally.core.config.RateLimitingConfig;
import tally.core.config.RateLimitingConfig.StrategyConfig;
import tally.core.model.common.ConfigurationException;
import tally.core.model.ratelimit.EndpointRule;
import tally.core.model.ratelimit.LimitStrategy;
import tally.core.model.ratelimit.RateLimitPolicy;
import tally.core.model.ratelimit.StrategyLimit;

/**
 * Builds the {@link RateLimitPolicy} from configuration.
 *
 * <p>Any invalid limit, window or endpoint rule raises a {@link ConfigurationException}, which
 * aborts startup.
 */
@ApplicationScoped
public class RateLimitPolicyProducer {

    private static final Logger LOG = Logger.getLogger(RateLimitPolicyProducer.class);

    private final RateLimitingConfig config;

    @Inject
    public RateLimitPolicyProducer(RateLimitingConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public RateLimitPolicy rateLimitPolicy() {
        final var policy = fromConfig(config);
        if (!policy.enabled()) {
            LOG.info("Rate limiting is disabled");
            return policy;
        }
        LOG.infov(
                "Rate limiting enabled: sourceAddress={0}, tenant={1}, credential={2}, endpointRules={3}",
                describe(policy.sourceAddress()),
                describe(policy.tenantDefault()),
                describe(policy.credentialDefault()),
                policy.endpointRules().size());
        return policy;
    }

    /**
     * Translate configuration into a validated policy.
     *
     * @param config the rate limiting configuration
     * @return the policy
     * @throws ConfigurationException if any value is invalid
     */
    public static RateLimitPolicy fromConfig(RateLimitingConfig config) {
        if (!config.enabled()) {
            return RateLimitPolicy.disabled();
        }

        final var rules = new ArrayList<EndpointRule>();
        if (config.endpoint().enabled()) {
            config.endpoint().rules().forEach((name, rule) -> {
                if (rule.path() == null || rule.path().isBlank()) {
                    throw new ConfigurationException("Endpoint rule '" + name + "' has no path");
                }
                rules.add(new EndpointRule(
                        rule.path(),
                        StrategyLimit.of(LimitStrategy.ENDPOINT, rule.requestsPerWindow(), rule.windowSeconds())));
            });
        }

        return new RateLimitPolicy(
                true,
                limit(LimitStrategy.SOURCE_ADDRESS, config.sourceAddress()),
                limit(LimitStrategy.TENANT, config.tenant()),
                limit(LimitStrategy.CREDENTIAL, config.credential()),
                config.credential().enabled() ? config.credential().overrides() : Map.of(),
                rules);
    }

    private static Optional<StrategyLimit> limit(LimitStrategy strategy, StrategyConfig config) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        return Optional.of(StrategyLimit.of(strategy, config.requestsPerWindow(), config.windowSeconds()));
    }

    private static String describe(Optional<StrategyLimit> limit) {
        return limit.map(l -> l.limit() + "/" + l.windowSeconds() + "s").orElse("off");
    }
}
