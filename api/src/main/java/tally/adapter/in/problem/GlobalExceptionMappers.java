package tally.adapter.in.problem;

import java.time.format.DateTimeParseException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tally.core.model.common.ConfigurationException;
import tally.core.model.common.CounterStoreUnavailableException;
import tally.core.model.common.LedgerReadException;
import tally.core.model.common.LedgerWriteException;

/**
 * Global exception mappers converting exceptions to {@link ErrorResponse} bodies.
 *
 * <p>Client errors are logged at debug level; backend outages at warn.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e, ContainerRequestContext ctx) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(Response.Status.BAD_REQUEST, "Validation error", e.getMessage(), ctx);
    }

    @ServerExceptionMapper
    public Response mapDateTimeParseException(DateTimeParseException e, ContainerRequestContext ctx) {
        LOG.debugv("Invalid date: {0}", e.getParsedString());
        return toResponse(
                Response.Status.BAD_REQUEST,
                "Validation error",
                "Invalid date '%s', expected YYYY-MM-DD".formatted(e.getParsedString()),
                ctx);
    }

    @ServerExceptionMapper
    public Response mapNotFoundException(NotFoundException e, ContainerRequestContext ctx) {
        return toResponse(Response.Status.NOT_FOUND, "Not found", "No resource at this path", ctx);
    }

    @ServerExceptionMapper
    public Response mapLedgerWriteException(LedgerWriteException e, ContainerRequestContext ctx) {
        LOG.warnv("Usage ledger unavailable: {0}", e.getMessage());
        return toResponse(Response.Status.SERVICE_UNAVAILABLE, "Usage ledger unavailable", e.getMessage(), ctx);
    }

    @ServerExceptionMapper
    public Response mapLedgerReadException(LedgerReadException e, ContainerRequestContext ctx) {
        LOG.warnv("Usage ledger read failed: {0}", e.getMessage());
        return toResponse(Response.Status.SERVICE_UNAVAILABLE, "Usage ledger unavailable", e.getMessage(), ctx);
    }

    @ServerExceptionMapper
    public Response mapCounterStoreUnavailableException(
            CounterStoreUnavailableException e, ContainerRequestContext ctx) {
        LOG.warnv("Counter store unavailable: {0}", e.getMessage());
        return toResponse(Response.Status.SERVICE_UNAVAILABLE, "Counter store unavailable", e.getMessage(), ctx);
    }

    @ServerExceptionMapper
    public Response mapConfigurationException(ConfigurationException e, ContainerRequestContext ctx) {
        LOG.errorv("Configuration error: {0}", e.getMessage());
        return toResponse(Response.Status.INTERNAL_SERVER_ERROR, "Configuration error", e.getMessage(), ctx);
    }

    private Response toResponse(Response.Status status, String error, String message, ContainerRequestContext ctx) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(error, message, RequestIds.resolve(ctx)))
                .build();
    }
}
