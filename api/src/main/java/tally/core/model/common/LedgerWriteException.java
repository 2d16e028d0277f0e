package tally.core.model.common;

/**
 * An upsert into the usage ledger failed (connectivity loss, timeout, or a rejected write).
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message) {
        super(message);
    }

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
