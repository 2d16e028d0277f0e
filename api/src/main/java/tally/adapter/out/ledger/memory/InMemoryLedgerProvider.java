package tally.adapter.out.ledger.memory;

import tally.core.port.out.UsageLedger;
import tally.spi.LedgerStorageProvider;
import tally.spi.StorageAdapterConfig;

/**
 * In-memory ledger provider, the fallback when no durable provider is available.
 */
public class InMemoryLedgerProvider implements LedgerStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory usage ledger (non-durable, single instance)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public UsageLedger createLedger(StorageAdapterConfig config) {
        return new InMemoryUsageLedger();
    }
}
