package tally.adapter.in.rest;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.adapter.in.dto.AggregationRangeDto;
import tally.adapter.in.dto.AggregationRunDto;
import tally.adapter.in.dto.AggregationStatusDto;
import tally.core.model.usage.AggregationOutcome;
import tally.core.port.in.AggregationManagement;

/**
 * REST resource for triggering usage aggregation on demand.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Aggregating one day (default: the previous UTC day)</li>
 * <li>Aggregating an inclusive range of days</li>
 * <li>Re-aggregating a single tenant</li>
 * <li>Checking whether a day has been aggregated</li>
 * </ul>
 *
 * <p>
 * The run outcome maps onto the HTTP status: SUCCESS is 200, PARTIAL is 207 and FAILED is 503.
 * The body always carries {@code outcome} and {@code exitCode} so scripted callers can
 * propagate the same exit code.
 */
@Path("/admin/usage/aggregations")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AggregationResource {

    private static final Logger LOG = Logger.getLogger(AggregationResource.class);
    private static final int MULTI_STATUS = 207;

    private final AggregationManagement aggregation;
    private final Clock clock;

    public AggregationResource(AggregationManagement aggregation, Clock clock) {
        this.aggregation = aggregation;
        this.clock = clock;
    }

    /**
     * Aggregate every counter of one day.
     *
     * @param day the day as YYYY-MM-DD, defaults to yesterday (UTC)
     * @return the run summary
     */
    @POST
    @Path("/run")
    public Uni<Response> run(@QueryParam("day") String day) {
        final var target = dayOrYesterday(day);
        LOG.infov("Aggregation requested for {0}", target);
        return aggregation.run(target).map(run -> {
            final var dto = AggregationRunDto.fromModel(run);
            return Response.status(statusFor(run.outcome())).entity(dto).build();
        });
    }

    /**
     * Aggregate each day of an inclusive range.
     *
     * @param start first day
     * @param end last day
     * @return one summary per day, plus the worst outcome
     */
    @POST
    @Path("/range")
    public Uni<Response> runRange(@QueryParam("start") String start, @QueryParam("end") String end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end are required");
        }
        final var from = LocalDate.parse(start);
        final var to = LocalDate.parse(end);
        LOG.infov("Aggregation requested for {0}..{1}", from, to);

        return aggregation.runRange(from, to).map(runs -> {
            final var dto = AggregationRangeDto.fromModel(from.toString(), to.toString(), runs);
            return Response.status(statusFor(AggregationRangeDto.worstOutcome(runs)))
                    .entity(dto)
                    .build();
        });
    }

    /**
     * Aggregate one tenant's counters for a day.
     *
     * @param tenantId the tenant
     * @param day the day as YYYY-MM-DD, defaults to yesterday (UTC)
     * @return the run summary
     */
    @POST
    @Path("/tenants/{tenantId}")
    public Uni<Response> runForTenant(@PathParam("tenantId") String tenantId, @QueryParam("day") String day) {
        final var target = dayOrYesterday(day);
        LOG.infov("Aggregation requested for tenant {0} on {1}", tenantId, target);
        return aggregation.runForTenant(tenantId, target).map(run -> Response.status(statusFor(run.outcome()))
                .entity(AggregationRunDto.fromModel(run))
                .build());
    }

    /**
     * Report whether a day has been aggregated.
     *
     * @param day the day as YYYY-MM-DD, defaults to yesterday (UTC)
     * @return the status
     */
    @GET
    @Path("/status")
    public Uni<AggregationStatusDto> status(@QueryParam("day") String day) {
        return aggregation.status(dayOrYesterday(day)).map(AggregationStatusDto::fromModel);
    }

    static int statusFor(AggregationOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> Response.Status.OK.getStatusCode();
            case PARTIAL -> MULTI_STATUS;
            case FAILED -> Response.Status.SERVICE_UNAVAILABLE.getStatusCode();
        };
    }

    private LocalDate dayOrYesterday(String day) {
        if (day == null || day.isBlank()) {
            return LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        }
        return LocalDate.parse(day.trim());
    }
}
