package tally.core.model.ratelimit;

import java.util.Objects;

import tally.core.model.common.ConfigurationException;

/**
 * Extra limit applied per caller address to requests under a path prefix.
 *
 * @param pathPrefix the path prefix, e.g. {@code /auth/login}
 * @param limit the limit applied to matching requests
 */
public record EndpointRule(String pathPrefix, StrategyLimit limit) {

    public EndpointRule {
        Objects.requireNonNull(limit, "limit must not be null");
        if (pathPrefix == null || !pathPrefix.startsWith("/")) {
            throw new ConfigurationException("Endpoint rule path must start with '/', got: " + pathPrefix);
        }
        if (limit.strategy() != LimitStrategy.ENDPOINT) {
            throw new ConfigurationException("Endpoint rule must carry an ENDPOINT limit");
        }
    }

    /**
     * Whether the rule covers a request path: the prefix itself or anything below it.
     */
    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        if (path.equals(pathPrefix) || "/".equals(pathPrefix)) {
            return true;
        }
        final var base = pathPrefix.endsWith("/") ? pathPrefix : pathPrefix + "/";
        return path.startsWith(base);
    }
}
