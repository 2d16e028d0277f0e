package tally.core.model.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AggregationRun")
class AggregationRunTest {

    private static AggregationRun run(long written, long errors, boolean scanFailed) {
        var now = Instant.parse("2024-05-02T00:00:00Z");
        return new AggregationRun(
                LocalDate.of(2024, 5, 1), Optional.empty(), 10, written, 0, errors, List.of(), scanFailed, now, now);
    }

    @Test
    @DisplayName("should succeed when there are no errors")
    void shouldSucceedWithoutErrors() {
        assertEquals(AggregationOutcome.SUCCESS, run(10, 0, false).outcome());
        assertEquals(0, run(10, 0, false).outcome().exitCode());
    }

    @Test
    @DisplayName("should be partial when some keys failed")
    void shouldBePartialWithErrors() {
        assertEquals(AggregationOutcome.PARTIAL, run(9, 1, false).outcome());
    }

    @Test
    @DisplayName("should fail when the scan failed and nothing was written")
    void shouldFailWhenScanFailedAndNothingWritten() {
        assertEquals(AggregationOutcome.FAILED, run(0, 1, true).outcome());
        assertEquals(2, run(0, 1, true).outcome().exitCode());
    }

    @Test
    @DisplayName("should be partial when the scan failed after some writes")
    void shouldBePartialWhenScanFailedAfterWrites() {
        assertEquals(AggregationOutcome.PARTIAL, run(3, 1, true).outcome());
    }

    @Test
    @DisplayName("worst should pick the higher exit code")
    void worstShouldPickHigherExitCode() {
        assertEquals(AggregationOutcome.PARTIAL, AggregationOutcome.SUCCESS.worst(AggregationOutcome.PARTIAL));
        assertEquals(AggregationOutcome.FAILED, AggregationOutcome.FAILED.worst(AggregationOutcome.SUCCESS));
    }
}
