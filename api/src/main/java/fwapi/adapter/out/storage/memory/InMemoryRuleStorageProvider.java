package fwapi.adapter.out.storage.memory;

import java.util.Arrays;
import java.util.stream.Collectors;

import fwapi.core.port.out.RuleRepository;
import fwapi.spi.RuleStorageProvider;
import fwapi.spi.StorageAdapterConfig;

/**
 * In-memory storage provider for firewall rules.
 *
 * <p>Reads {@code fwapi.rules.storage.memory.vm-wildcards}, a comma-separated
 * list of wildcard tokens that select every VM of an owner (default
 * {@code any,vmall}).
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryRuleStorageProvider implements RuleStorageProvider {

    static final String VM_WILDCARDS_KEY = "fwapi.rules.storage.memory.vm-wildcards";
    static final String DEFAULT_VM_WILDCARDS = "any,vmall";

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory rule storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public RuleRepository createRepository(StorageAdapterConfig config) {
        final var wildcards = Arrays.stream(
                        config.getOrDefault(VM_WILDCARDS_KEY, DEFAULT_VM_WILDCARDS).split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
        return new InMemoryRuleRepository(wildcards);
    }
}
