package tally.spi;

import tally.core.port.out.UsageLedger;

/**
 * Service Provider Interface for usage ledger implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/tally.spi.LedgerStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: tally.ledger.provider=your-provider-name</li>
 * </ol>
 */
public interface LedgerStorageProvider {

    /**
     * Unique name identifying this provider, used in {@code tally.ledger.provider}.
     *
     * @return the provider name
     */
    String name();

    default String description() {
        return name() + " usage ledger";
    }

    /**
     * Priority for auto-selection when no provider is configured. Higher wins.
     *
     * <p>Built-in providers use memory: 0 and cassandra: 10.
     *
     * @return the provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * @return true if the provider's dependencies are present
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the ledger. Called once at startup; the instance must be thread-safe.
     *
     * @param config access to configuration properties
     * @return the ledger
     * @throws StorageProviderException if initialization fails
     */
    UsageLedger createLedger(StorageAdapterConfig config);
}
