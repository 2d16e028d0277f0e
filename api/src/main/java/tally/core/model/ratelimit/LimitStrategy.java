package tally.core.model.ratelimit;

/**
 * Independent limiting strategies, listed in the order they are evaluated.
 *
 * <p>Each strategy counts requests in its own fixed-window keyspace:
 * <ul>
 *   <li>{@link #SOURCE_ADDRESS} - coarse abuse protection keyed by client address</li>
 *   <li>{@link #TENANT} - plan-derived ceiling keyed by tenant id</li>
 *   <li>{@link #CREDENTIAL} - per issued credential (API key id)</li>
 *   <li>{@link #ENDPOINT} - tighter ceilings on sensitive paths, keyed by endpoint and address</li>
 * </ul>
 */
public enum LimitStrategy {
    SOURCE_ADDRESS("ip"),
    TENANT("tenant"),
    CREDENTIAL("credential"),
    ENDPOINT("endpoint");

    private final String keySegment;

    LimitStrategy(String keySegment) {
        this.keySegment = keySegment;
    }

    /**
     * Segment used for this strategy in counter store keys and metric tags.
     *
     * @return the key segment
     */
    public String keySegment() {
        return keySegment;
    }
}
