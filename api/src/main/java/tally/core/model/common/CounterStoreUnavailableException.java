package tally.core.model.common;

/**
 * The counter store could not be reached, timed out, or returned an error.
 *
 * <p>On the request path this always fails open; during aggregation the affected key is
 * counted as an error and skipped.
 */
public class CounterStoreUnavailableException extends RuntimeException {

    private final String operation;

    public CounterStoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public CounterStoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the counter store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
