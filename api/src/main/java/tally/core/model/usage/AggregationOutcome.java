package tally.core.model.usage;

/**
 * Overall result of an aggregation run, with the exit code the trigger surface reports.
 */
public enum AggregationOutcome {
    /** Every scanned key was written or legitimately skipped. */
    SUCCESS(0),
    /** The run completed but some keys failed. */
    PARTIAL(1),
    /** The counter store could not be scanned at all; nothing was written. */
    FAILED(2);

    private final int exitCode;

    AggregationOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Return the worse of two outcomes.
     */
    public AggregationOutcome worst(AggregationOutcome other) {
        return other.exitCode > exitCode ? other : this;
    }
}
