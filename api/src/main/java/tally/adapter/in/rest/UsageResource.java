package tally.adapter.in.rest;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import tally.adapter.in.dto.RecordUsageRequest;
import tally.adapter.in.dto.UsageHistoryDto;
import tally.core.model.usage.MetricType;
import tally.core.service.usage.UsageQueryService;
import tally.core.service.usage.UsageRecorder;

/**
 * REST resource for reporting and reading tenant usage.
 */
@Path("/usage")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class UsageResource {

    private final UsageRecorder recorder;
    private final UsageQueryService queryService;

    public UsageResource(UsageRecorder recorder, UsageQueryService queryService) {
        this.recorder = recorder;
        this.queryService = queryService;
    }

    /**
     * Record billable events reported by another service.
     *
     * <p>Recording is best effort: a counter store outage is logged and the call still
     * returns 202.
     *
     * @param request the events
     * @return 202 Accepted
     */
    @POST
    @Path("/events")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> recordEvent(RecordUsageRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.tenantId() == null || request.tenantId().isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        final var metric = parseMetric(request.metricType())
                .orElseThrow(() -> new IllegalArgumentException("metricType is required"));
        final var amount = request.amount() != null ? request.amount() : 1L;
        final var day = request.day() != null ? LocalDate.parse(request.day()) : recorder.today();

        return recorder.record(request.tenantId(), metric, day, amount)
                .map(ignored -> Response.accepted(Map.of(
                                "tenantId", request.tenantId(),
                                "metricType", metric.value(),
                                "day", day.toString(),
                                "amount", amount))
                        .build());
    }

    /**
     * Usage history of a tenant.
     *
     * @param tenantId the tenant
     * @param metric restrict to one metric
     * @param from first day, defaults to the first day of the current month
     * @param to last day, defaults to today
     * @return daily values and totals per metric
     */
    @GET
    @Path("/tenants/{tenantId}")
    public Uni<UsageHistoryDto> history(
            @PathParam("tenantId") String tenantId,
            @QueryParam("metric") String metric,
            @QueryParam("from") String from,
            @QueryParam("to") String to) {
        final var today = queryService.today();
        final var end = to != null ? LocalDate.parse(to) : today;
        final var start = from != null ? LocalDate.parse(from) : today.withDayOfMonth(1);

        return queryService
                .history(tenantId, parseMetric(metric), start, end)
                .map(history -> UsageHistoryDto.fromModel(tenantId, start.toString(), end.toString(), history));
    }

    private Optional<MetricType> parseMetric(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(MetricType.fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric type: " + value)));
    }
}
