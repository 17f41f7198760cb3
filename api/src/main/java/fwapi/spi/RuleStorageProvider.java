package fwapi.spi;

import fwapi.core.port.out.RuleRepository;

/**
 * A pluggable rule store.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/fwapi.spi.RuleStorageProvider} and selected once at
 * startup, either by {@code fwapi.rules.storage.provider} or by priority
 * among the providers that report themselves available.
 *
 * <p>The repository a provider creates must treat deleting an unknown rule as
 * a normal outcome ({@code false}), and must fail with
 * {@link RuleRepository.RuleStoreException} when its backend cannot answer.
 */
public interface RuleStorageProvider {

    /**
     * @return the name used in {@code fwapi.rules.storage.provider}, unique among installed providers
     */
    String name();

    String description();

    /**
     * Rank used when no provider is configured; the highest available wins.
     * The bundled {@code memory} provider ranks 0.
     */
    int priority();

    /**
     * Whether the provider can run in this deployment, for example because its
     * driver is present. Ignored when the provider is named explicitly.
     */
    default boolean isAvailable() {
        return true;
    }

    RuleRepository createRepository(StorageAdapterConfig config);
}
