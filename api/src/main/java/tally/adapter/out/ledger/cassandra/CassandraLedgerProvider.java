package tally.adapter.out.ledger.cassandra;

import java.net.InetSocketAddress;
import java.time.Duration;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import org.jboss.logging.Logger;

import tally.core.port.out.UsageLedger;
import tally.spi.LedgerStorageProvider;
import tally.spi.StorageAdapterConfig;
import tally.spi.StorageProviderException;

/**
 * Cassandra ledger provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tally.ledger.cassandra.contact-points - Comma-separated host:port pairs (default: localhost:9042)</li>
 *   <li>tally.ledger.cassandra.datacenter - Local datacenter name (default: datacenter1)</li>
 *   <li>tally.ledger.cassandra.keyspace - Keyspace name (default: tally)</li>
 *   <li>tally.ledger.cassandra.username / password - Credentials (optional)</li>
 *   <li>tally.ledger.cassandra.run-migrations - Apply CQL migrations at startup (default: false)</li>
 *   <li>tally.ledger.cassandra.request-timeout - Driver request timeout (default: PT2S)</li>
 *   <li>tally.ledger.cassandra.pool-local-size - Connections per local node (default: 2)</li>
 * </ul>
 */
public class CassandraLedgerProvider implements LedgerStorageProvider {

    private static final Logger LOG = Logger.getLogger(CassandraLedgerProvider.class);
    private static final String PREFIX = "tally.ledger.cassandra.";

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public String description() {
        return "Apache Cassandra usage ledger";
    }

    @Override
    public int priority() {
        return 10; // Higher than memory
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public UsageLedger createLedger(StorageAdapterConfig config) {
        final var keyspace = config.getOrDefault(PREFIX + "keyspace", "tally");
        if (config.getBoolean(PREFIX + "run-migrations").orElse(false)) {
            runMigrations(config, keyspace);
        }
        return new CassandraUsageLedger(buildSession(config, keyspace));
    }

    private void runMigrations(StorageAdapterConfig config, String keyspace) {
        LOG.info("Running Cassandra ledger migrations...");

        try (CqlSession noKeyspaceSession = buildSession(config, null)) {
            new CassandraMigrationRunner(noKeyspaceSession, keyspace).runKeyspaceMigration();
        }

        try (CqlSession keyspaceSession = buildSession(config, keyspace)) {
            new CassandraMigrationRunner(keyspaceSession, keyspace).runMigrations();
        }

        LOG.info("Cassandra ledger migrations completed");
    }

    private CqlSession buildSession(StorageAdapterConfig config, String keyspace) {
        final var contactPoints = config.getOrDefault(PREFIX + "contact-points", "localhost:9042");
        final var datacenter = config.getOrDefault(PREFIX + "datacenter", "datacenter1");
        final var requestTimeout = config.getDuration(PREFIX + "request-timeout").orElse(Duration.ofSeconds(2));
        final var poolLocalSize = config.getInt(PREFIX + "pool-local-size").orElse(2);

        final var driverConfig = DriverConfigLoader.programmaticBuilder()
                .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, requestTimeout)
                .withInt(DefaultDriverOption.CONNECTION_POOL_LOCAL_SIZE, poolLocalSize)
                .build();

        CqlSessionBuilder builder =
                CqlSession.builder().withConfigLoader(driverConfig).withLocalDatacenter(datacenter);
        if (keyspace != null) {
            builder.withKeyspace(keyspace);
        }

        for (String contactPoint : contactPoints.split(",")) {
            String[] parts = contactPoint.trim().split(":");
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }

        config.get(PREFIX + "username").ifPresent(username -> {
            String password = config.get(PREFIX + "password")
                    .orElseThrow(() ->
                            new StorageProviderException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Failed to connect to Cassandra", e);
        }
    }
}
