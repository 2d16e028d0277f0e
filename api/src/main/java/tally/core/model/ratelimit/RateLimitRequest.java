package tally.core.model.ratelimit;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of an inbound unit of work, as far as rate limiting is concerned.
 *
 * <p>Tenant and credential are resolved upstream by the authentication layer; either
 * may be absent, in which case the corresponding strategy is skipped.
 *
 * @param sourceAddress the client address
 * @param tenantId the tenant, if known
 * @param credentialId the API key id, if the request carried one
 * @param endpoint the request path
 */
public record RateLimitRequest(
        String sourceAddress, Optional<String> tenantId, Optional<String> credentialId, String endpoint) {

    public RateLimitRequest {
        Objects.requireNonNull(sourceAddress, "sourceAddress must not be null");
        tenantId = Objects.requireNonNullElse(tenantId, Optional.empty());
        credentialId = Objects.requireNonNullElse(credentialId, Optional.empty());
        endpoint = Objects.requireNonNullElse(endpoint, "/");
    }

    public static RateLimitRequest of(String sourceAddress, String tenantId, String credentialId, String endpoint) {
        return new RateLimitRequest(
                sourceAddress, nonBlank(tenantId), nonBlank(credentialId), endpoint);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
