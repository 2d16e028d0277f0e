package tally.adapter.out.counter.memory;

import java.time.Clock;

import tally.core.port.out.CounterStore;
import tally.spi.CounterStoreProvider;

/**
 * In-memory counter store provider. Always available; lowest priority.
 */
public final class InMemoryCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Clock clock;

    public InMemoryCounterStoreProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CounterStore createCounterStore() {
        return new InMemoryCounterStore(clock);
    }
}
