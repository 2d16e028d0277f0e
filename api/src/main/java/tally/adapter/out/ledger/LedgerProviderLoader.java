package tally.adapter.out.ledger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tally.core.port.out.UsageLedger;
import tally.spi.LedgerStorageProvider;
import tally.spi.StorageAdapterConfig;
import tally.spi.StorageProviderException;

/**
 * Discovers ledger providers via ServiceLoader and produces the {@link UsageLedger}.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If tally.ledger.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class LedgerProviderLoader {

    private static final Logger LOG = Logger.getLogger(LedgerProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    @Inject
    public LedgerProviderLoader(
            @ConfigProperty(name = "tally.ledger.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public UsageLedger usageLedger() {
        final var providers = new ArrayList<LedgerStorageProvider>();
        ServiceLoader.load(LedgerStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No ledger providers found. Ensure a provider JAR is on the classpath.");
        }
        LOG.infof(
                "Found %d ledger provider(s): %s",
                providers.size(),
                providers.stream().map(LedgerStorageProvider::name).toList());

        final var provider = select(providers, configuredProvider.orElse(null));
        LOG.infof("Creating usage ledger from provider: %s (%s)", provider.name(), provider.description());
        return provider.createLedger(config);
    }

    static LedgerStorageProvider select(List<LedgerStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured ledger provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(LedgerStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(LedgerStorageProvider::isAvailable)
                .max(Comparator.comparingInt(LedgerStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available ledger providers"));
    }
}
