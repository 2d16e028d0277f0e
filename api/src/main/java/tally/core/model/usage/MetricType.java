package tally.core.model.usage;

import java.util.Arrays;
import java.util.Optional;

/**
 * Billable or limited usage metrics tracked per tenant per day.
 */
public enum MetricType {
    QUERIES("queries"),
    DOCUMENTS("documents"),
    API_CALLS("api_calls"),
    STORAGE_GB("storage_gb");

    private final String value;

    MetricType(String value) {
        this.value = value;
    }

    /**
     * Wire and storage name of the metric ({@code api_calls}, not {@code API_CALLS}).
     *
     * @return the metric value
     */
    public String value() {
        return value;
    }

    /**
     * Resolve a metric from its stored value. Enum constant names are accepted too.
     *
     * @param value the stored value
     * @return the metric, or empty if unknown
     */
    public static Optional<MetricType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.value.equals(value) || m.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
