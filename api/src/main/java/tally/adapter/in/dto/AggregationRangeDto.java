package tally.adapter.in.dto;

import java.util.List;

import tally.core.model.usage.AggregationOutcome;
import tally.core.model.usage.AggregationRun;

/**
 * DTO for a multi-day aggregation.
 *
 * @param start    first day of the range
 * @param end      last day of the range
 * @param runs     one summary per day, in order
 * @param outcome  the worst outcome across all days
 * @param exitCode exit code of {@code outcome}
 */
public record AggregationRangeDto(String start, String end, List<AggregationRunDto> runs, String outcome, int exitCode) {

    public static AggregationRangeDto fromModel(String start, String end, List<AggregationRun> runs) {
        final var worst = worstOutcome(runs);
        return new AggregationRangeDto(
                start,
                end,
                runs.stream().map(AggregationRunDto::fromModel).toList(),
                worst.name(),
                worst.exitCode());
    }

    public static AggregationOutcome worstOutcome(List<AggregationRun> runs) {
        var worst = AggregationOutcome.SUCCESS;
        for (final var run : runs) {
            worst = worst.worst(run.outcome());
        }
        return worst;
    }
}
