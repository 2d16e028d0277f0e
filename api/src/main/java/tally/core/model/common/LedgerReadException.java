package tally.core.model.common;

/**
 * Reading from the usage ledger failed (connectivity loss or timeout).
 */
public class LedgerReadException extends RuntimeException {

    public LedgerReadException(String message) {
        super(message);
    }

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
