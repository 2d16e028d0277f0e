package tally.core.model.common;

/**
 * A counter key holds a value that is not an integer.
 *
 * <p>The store itself is healthy, so this is never retried; the aggregation job skips the key.
 */
public class InvalidCounterValueException extends RuntimeException {

    private final String key;

    public InvalidCounterValueException(String key, String value) {
        super("Counter " + key + " holds a non-numeric value: " + value);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
