package fwapi.adapter.out.storage;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import fwapi.core.port.out.RuleRepository;
import fwapi.spi.RuleStorageProvider;
import fwapi.spi.StorageAdapterConfig;
import fwapi.spi.StorageProviderException;

/**
 * Picks the rule storage backend and produces the application's
 * {@link RuleRepository}.
 *
 * <p>Providers come from {@code META-INF/services/fwapi.spi.RuleStorageProvider}.
 * When {@code fwapi.rules.storage.provider} names one, it is used whether or
 * not it reports itself available. Otherwise the available provider with the
 * highest priority wins. Two providers registering the same name is a
 * deployment error.
 */
@ApplicationScoped
public class RuleStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(RuleStorageProviderLoader.class);

    private final Optional<String> providerName;
    private final StorageAdapterConfig config;

    private RuleStorageProvider selected;

    @Inject
    public RuleStorageProviderLoader(
            @ConfigProperty(name = "fwapi.rules.storage.provider") Optional<String> providerName,
            StorageAdapterConfig config) {
        this.providerName = providerName;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public RuleRepository ruleRepository() {
        final var provider = getStorageProvider();
        LOG.infof("Rule store: %s (%s)", provider.name(), provider.description());
        return provider.createRepository(config);
    }

    synchronized RuleStorageProvider getStorageProvider() {
        if (selected == null) {
            final var discovered = ServiceLoader.load(RuleStorageProvider.class).stream()
                    .map(ServiceLoader.Provider::get)
                    .toList();
            LOG.debugf("Discovered rule storage providers: %s", discovered.stream().map(RuleStorageProvider::name).toList());
            selected = selectProvider(discovered, providerName.orElse(null));
        }
        return selected;
    }

    static RuleStorageProvider selectProvider(List<RuleStorageProvider> discovered, String configured) {
        final Map<String, RuleStorageProvider> byName = new LinkedHashMap<>();
        for (final var provider : discovered) {
            if (byName.putIfAbsent(provider.name(), provider) != null) {
                throw new StorageProviderException("Duplicate rule storage provider name: " + provider.name());
            }
        }

        if (configured != null && !configured.isBlank()) {
            final var provider = byName.get(configured.trim());
            if (provider == null) {
                throw new StorageProviderException(
                        "Unknown rule storage provider '%s', installed: %s".formatted(configured, byName.keySet()));
            }
            return provider;
        }

        return byName.values().stream()
                .filter(RuleStorageProvider::isAvailable)
                .max(Comparator.comparingInt(RuleStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException(
                        "No rule storage provider is available, installed: " + byName.keySet()));
    }
}
