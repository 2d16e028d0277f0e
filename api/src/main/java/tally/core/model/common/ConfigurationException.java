package tally.core.model.common;

/**
 * Invalid limit, window or retention configuration detected at startup.
 *
 * <p>Always fatal: the application refuses to start rather than run with limits it
 * cannot honour.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
