package tally.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for timeouts on the counter store and the ledger.
 *
 * <p>Configuration prefix: {@code tally.resiliency}
 */
@ConfigMapping(prefix = "tally.resiliency")
public interface ResiliencyConfig {

    CounterStoreTimeouts counterStore();

    LedgerTimeouts ledger();

    interface CounterStoreTimeouts {

        /**
         * Maximum time to wait for a counter store operation.
         *
         * <p>On the request path a timeout fails open; during aggregation the key is retried.
         *
         * @return operation timeout (default: 250ms)
         */
        @WithDefault("PT0.25S")
        Duration timeout();
    }

    interface LedgerTimeouts {

        /**
         * Maximum time to wait for a ledger read or write.
         *
         * @return operation timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();
    }
}
