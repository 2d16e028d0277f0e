package tally.system.filter;

import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import tally.adapter.in.problem.ErrorResponse;
import tally.adapter.in.problem.RequestIds;
import tally.core.config.RateLimitingConfig;
import tally.core.config.TelemetryConfig;
import tally.core.model.ratelimit.RateLimitDecision;
import tally.core.model.ratelimit.RateLimitOutcome;
import tally.core.model.ratelimit.RateLimitRequest;
import tally.core.model.usage.MetricType;
import tally.core.service.ratelimit.RateLimitService;
import tally.core.service.usage.UsageRecorder;

/**
 * Reactive filter that enforces request rate limits.
 *
 * <p>Runs at priority AUTHENTICATION - 50 so excessive traffic is rejected before any
 * downstream work. Tenant and credential identity are read from the {@code X-Tenant-ID} and
 * {@code X-API-Key-ID} headers set by the authentication layer in front of this service.
 *
 * <p>Allowed requests carrying a tenant are counted as one {@code api_calls} usage event.
 */
public class RateLimitFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    static final String TENANT_HEADER = "X-Tenant-ID";
    static final String CREDENTIAL_HEADER = "X-API-Key-ID";
    private static final String RATE_LIMIT_OUTCOME_ATTR = "tally.ratelimit.outcome";

    private final RateLimitService rateLimitService;
    private final UsageRecorder usageRecorder;
    private final RateLimitingConfig config;
    private final TelemetryConfig telemetryConfig;

    @Inject
    public RateLimitFilter(
            RateLimitService rateLimitService,
            UsageRecorder usageRecorder,
            RateLimitingConfig config,
            TelemetryConfig telemetryConfig) {
        this.rateLimitService = rateLimitService;
        this.usageRecorder = usageRecorder;
        this.config = config;
        this.telemetryConfig = telemetryConfig;
    }

    /**
     * Reactive filter method for request rate limiting.
     *
     * @param requestContext the request context
     * @param request the underlying HTTP request, used for the peer address
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 50)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        final var requestId = RequestIds.resolve(requestContext);
        if (!rateLimitService.isEnabled()) {
            return Uni.createFrom().nullItem();
        }

        final var path = normalize(requestContext.getUriInfo().getPath());
        if (isSkipped(path)) {
            return Uni.createFrom().nullItem();
        }

        final var limitRequest = RateLimitRequest.of(
                ClientAddressResolver.resolve(requestContext, request),
                requestContext.getHeaderString(TENANT_HEADER),
                requestContext.getHeaderString(CREDENTIAL_HEADER),
                path);

        return rateLimitService.evaluate(limitRequest).map(outcome -> {
            requestContext.setProperty(RATE_LIMIT_OUTCOME_ATTR, outcome);
            setSpanAttributes(outcome);

            final var effective = outcome.effective();
            if (effective.isPresent() && !effective.get().allowed()) {
                return buildRateLimitResponse(effective.get(), requestId);
            }

            limitRequest.tenantId().ifPresent(this::recordApiCall);
            return null;
        });
    }

    /**
     * Adds {@code X-RateLimit-*} headers to responses of allowed requests.
     */
    @ServerResponseFilter
    public void addRateLimitHeaders(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!config.includeHeaders()) {
            return;
        }
        getOutcome(requestContext)
                .flatMap(RateLimitOutcome::effective)
                .filter(RateLimitDecision::allowed)
                .ifPresent(decision -> {
                    final var headers = responseContext.getHeaders();
                    headers.putSingle("X-RateLimit-Limit", decision.limit());
                    headers.putSingle("X-RateLimit-Remaining", decision.remaining());
                    headers.putSingle("X-RateLimit-Reset", decision.resetAtEpochSeconds());
                });
    }

    private void recordApiCall(String tenantId) {
        usageRecorder
                .record(tenantId, MetricType.API_CALLS)
                .subscribe()
                .with(
                        ignored -> {},
                        failure -> LOG.warnv("Failed to record API call for tenant {0}: {1}", tenantId, failure));
    }

    private Response buildRateLimitResponse(RateLimitDecision decision, String requestId) {
        var builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type(MediaType.APPLICATION_JSON)
                .header("Retry-After", decision.retryAfterSeconds())
                .entity(ErrorResponse.of(errorTitle(decision), errorMessage(decision), requestId));

        if (config.includeHeaders()) {
            builder = builder.header("X-RateLimit-Limit", decision.limit())
                    .header("X-RateLimit-Remaining", decision.remaining())
                    .header("X-RateLimit-Reset", decision.resetAtEpochSeconds());
        }
        return builder.build();
    }

    static String errorTitle(RateLimitDecision decision) {
        return switch (decision.strategy()) {
            case SOURCE_ADDRESS -> "Too many requests from this IP address";
            case TENANT -> "Tenant rate limit exceeded";
            case CREDENTIAL -> "API key rate limit exceeded";
            case ENDPOINT -> "Too many requests";
        };
    }

    static String errorMessage(RateLimitDecision decision) {
        return switch (decision.strategy()) {
            case SOURCE_ADDRESS -> "Rate limit exceeded. Please try again in %d seconds."
                    .formatted(decision.retryAfterSeconds());
            case TENANT -> "This tenant has exceeded its rate limit of %d requests per %d seconds."
                    .formatted(decision.limit(), decision.windowSeconds());
            case CREDENTIAL -> "This API key has exceeded its rate limit of %d requests per %d seconds."
                    .formatted(decision.limit(), decision.windowSeconds());
            case ENDPOINT -> "Rate limit exceeded for this endpoint. Please try again in %d seconds."
                    .formatted(decision.retryAfterSeconds());
        };
    }

    private void setSpanAttributes(RateLimitOutcome outcome) {
        if (!telemetryConfig.enabled() || !telemetryConfig.tracing().enabled()) {
            return;
        }
        final var span = Span.current();
        span.setAttribute("tally.ratelimit.limited", !outcome.allowed());
        outcome.effective().ifPresent(decision -> {
            span.setAttribute("tally.ratelimit.strategy", decision.strategy().keySegment());
            span.setAttribute("tally.ratelimit.remaining", decision.remaining());
            span.setAttribute("tally.ratelimit.degraded", decision.degraded());
            if (!decision.allowed()) {
                span.setAttribute("tally.ratelimit.retry_after", decision.retryAfterSeconds());
                // Rate limiting is expected behavior, not an error
                span.setStatus(StatusCode.OK, "Rate limit exceeded");
            }
        });
    }

    private boolean isSkipped(String path) {
        for (final var prefix : config.skipPaths()) {
            if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    /**
     * Get the rate limit outcome from the request context.
     *
     * @param ctx the request context
     * @return the outcome, or empty if the request was not checked
     */
    public static Optional<RateLimitOutcome> getOutcome(ContainerRequestContext ctx) {
        return Optional.ofNullable((RateLimitOutcome) ctx.getProperty(RATE_LIMIT_OUTCOME_ATTR));
    }
}
