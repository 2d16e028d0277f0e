package tally.core.model.ratelimit;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import tally.core.model.common.ConfigurationException;

/**
 * Immutable, validated set of limits applied by the rate limiter.
 *
 * <p>An empty strategy limit means the strategy is disabled.
 *
 * @param enabled global switch
 * @param sourceAddress per address limit
 * @param tenantDefault per tenant limit for tenants without a plan
 * @param credentialDefault per credential limit
 * @param credentialOverrides per credential ceilings keyed by credential id
 * @param endpointRules endpoint rules, longest prefix first
 */
public record RateLimitPolicy(
        boolean enabled,
        Optional<StrategyLimit> sourceAddress,
        Optional<StrategyLimit> tenantDefault,
        Optional<StrategyLimit> credentialDefault,
        Map<String, Long> credentialOverrides,
        List<EndpointRule> endpointRules) {

    public RateLimitPolicy {
        Objects.requireNonNull(sourceAddress, "sourceAddress must not be null");
        Objects.requireNonNull(tenantDefault, "tenantDefault must not be null");
        Objects.requireNonNull(credentialDefault, "credentialDefault must not be null");
        credentialOverrides = Map.copyOf(credentialOverrides);
        endpointRules = endpointRules.stream()
                .sorted(Comparator.comparingInt((EndpointRule r) -> r.pathPrefix().length())
                        .reversed())
                .toList();

        credentialOverrides.forEach((id, ceiling) -> {
            if (ceiling == null || ceiling <= 0) {
                throw new ConfigurationException(
                        "Credential override for %s must be positive, got %s".formatted(id, ceiling));
            }
        });
        final var distinct = endpointRules.stream().map(EndpointRule::pathPrefix).distinct().count();
        if (distinct != endpointRules.size()) {
            throw new ConfigurationException("Duplicate endpoint rule paths: " + endpointRules);
        }
    }

    /**
     * Policy under which every request is unrestricted.
     */
    public static RateLimitPolicy disabled() {
        return new RateLimitPolicy(false, Optional.empty(), Optional.empty(), Optional.empty(), Map.of(), List.of());
    }

    /**
     * Limit for a credential, honouring per credential overrides.
     *
     * @param credentialId the credential
     * @return the limit, empty if the credential strategy is disabled
     */
    public Optional<StrategyLimit> credentialLimit(String credentialId) {
        return credentialDefault.map(base -> {
            final var override = credentialOverrides.get(credentialId);
            return override == null ? base : StrategyLimit.of(LimitStrategy.CREDENTIAL, override, base.windowSeconds());
        });
    }

    /**
     * Most specific endpoint rule covering a path.
     *
     * @param path the request path
     * @return the rule with the longest matching prefix, empty if none matches
     */
    public Optional<EndpointRule> endpointRuleFor(String path) {
        return endpointRules.stream().filter(rule -> rule.matches(path)).findFirst();
    }
}
