package tally.adapter.out.ledger.cassandra;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.datastax.oss.driver.api.core.CqlSession;
import org.jboss.logging.Logger;

/**
 * Applies the ledger's CQL migrations.
 *
 * <p>Migration files live on the classpath under {@code db/cassandra/} and are named
 * {@code V{version}__{description}.cql}. V1 creates the keyspace and runs on a session without
 * a keyspace; later versions are tracked in {@code schema_migrations} and applied once.
 */
public class CassandraMigrationRunner {

    private static final Logger LOG = Logger.getLogger(CassandraMigrationRunner.class);
    private static final String MIGRATIONS_PATH = "db/cassandra/";
    private static final Pattern MIGRATION_PATTERN = Pattern.compile("V(\\d+)__.*\\.cql");

    /** Known migrations; jar resources cannot be listed reliably. Append new files here. */
    static final List<String> MIGRATIONS = List.of("V1__create_keyspace.cql", "V2__create_usage_records.cql");

    private final CqlSession session;
    private final String keyspace;

    public CassandraMigrationRunner(CqlSession session, String keyspace) {
        this.session = session;
        this.keyspace = keyspace;
    }

    /**
     * Create the keyspace. Must be called with a session not bound to any keyspace.
     */
    public void runKeyspaceMigration() {
        final var migration = load(MIGRATIONS.get(0));
        LOG.infov("Ensuring keyspace {0} exists...", keyspace);
        for (final var statement : statements(migration.content())) {
            session.execute(statement);
        }
    }

    /**
     * Apply all pending migrations after V1.
     *
     * @return the number of migrations applied
     */
    public int runMigrations() {
        ensureMigrationTableExists();
        final var applied = appliedVersions();

        var count = 0;
        for (final var migration : discover()) {
            if (migration.version() == 1 || applied.contains(migration.version())) {
                continue;
            }
            apply(migration);
            count++;
        }

        if (count > 0) {
            LOG.infov("Applied {0} ledger migration(s)", count);
        } else {
            LOG.debug("No pending ledger migrations");
        }
        return count;
    }

    private void ensureMigrationTableExists() {
        session.execute(
                """
                CREATE TABLE IF NOT EXISTS %s.schema_migrations (
                    version int PRIMARY KEY,
                    script_name text,
                    applied_at timestamp
                )
                """
                        .formatted(keyspace));
    }

    private Set<Integer> appliedVersions() {
        final var rs = session.execute("SELECT version FROM %s.schema_migrations".formatted(keyspace));
        return rs.all().stream().map(row -> row.getInt("version")).collect(Collectors.toSet());
    }

    private List<Migration> discover() {
        final var migrations = new ArrayList<Migration>();
        for (final var filename : MIGRATIONS) {
            if (getClass().getClassLoader().getResource(MIGRATIONS_PATH + filename) != null) {
                migrations.add(load(filename));
            }
        }
        migrations.sort(Comparator.comparingInt(Migration::version));
        return migrations;
    }

    private Migration load(String filename) {
        final var matcher = MIGRATION_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            throw new IllegalStateException("Invalid migration file name: " + filename);
        }
        final var path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalStateException("Migration file not found: " + path);
            }
            final var content = new String(is.readAllBytes(), StandardCharsets.UTF_8).replace("${keyspace}", keyspace);
            return new Migration(Integer.parseInt(matcher.group(1)), filename, content);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read migration " + path, e);
        }
    }

    private void apply(Migration migration) {
        LOG.infov("Applying migration V{0}: {1}", migration.version(), migration.filename());
        for (final var statement : statements(migration.content())) {
            try {
                session.execute(statement);
            } catch (RuntimeException e) {
                LOG.errorv("Failed to execute statement in {0}: {1}", migration.filename(), e.getMessage());
                throw new IllegalStateException("Migration failed: " + migration.filename(), e);
            }
        }

        session.execute(
                """
                INSERT INTO %s.schema_migrations (version, script_name, applied_at)
                VALUES (?, ?, ?)
                """
                        .formatted(keyspace),
                migration.version(),
                migration.filename(),
                Instant.now());
    }

    /**
     * Split a script into executable statements, dropping comments, blanks and USE.
     */
    static List<String> statements(String content) {
        final var withoutComments = content.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        final var statements = new ArrayList<String>();
        for (final var statement : withoutComments.split(";")) {
            final var trimmed = statement.trim();
            if (trimmed.isEmpty() || trimmed.toUpperCase().startsWith("USE ")) {
                continue;
            }
            statements.add(trimmed);
        }
        return statements;
    }

    private record Migration(int version, String filename, String content) {}
}
