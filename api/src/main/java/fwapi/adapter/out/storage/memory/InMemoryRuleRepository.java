package fwapi.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import io.smallrye.mutiny.Uni;

import fwapi.core.model.rule.Rule;
import fwapi.core.model.rule.RuleFilter;
import fwapi.core.port.out.RuleRepository;

/**
 * In-memory implementation of RuleRepository.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for
 * development, testing, and as the fallback when no persistent provider is
 * configured.
 *
 * <p>A rule is a candidate for a filter when it lists one of the filter's VMs,
 * or when it is global or owned by the filter's owner and either selects all
 * VMs through a wildcard or selects one of the VM's tags. Candidates are
 * returned in insertion order.
 *
 * <p>Thread-safety: all access to the backing map is synchronized on it.
 */
public class InMemoryRuleRepository implements RuleRepository {

    private final Map<String, Rule> storage = new LinkedHashMap<>();
    private final Set<String> vmWildcards;

    public InMemoryRuleRepository(Set<String> vmWildcards) {
        this.vmWildcards = Set.copyOf(vmWildcards);
    }

    @Override
    public Uni<List<Rule>> findMatching(RuleFilter filter) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.values().stream().filter(rule -> matches(rule, filter)).toList();
            }
        });
    }

    @Override
    public Uni<Optional<Rule>> findById(String ruleUuid) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return Optional.ofNullable(storage.get(ruleUuid));
            }
        });
    }

    @Override
    public Uni<Void> save(Rule rule) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(rule.uuid(), rule);
            }
            return null;
        });
    }

    @Override
    public Uni<Boolean> delete(String ruleUuid) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.remove(ruleUuid) != null;
            }
        });
    }

    @Override
    public Uni<List<Rule>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }

    private boolean matches(Rule rule, RuleFilter filter) {
        if (filter.vms().stream().anyMatch(rule::references)) {
            return true;
        }

        final var inScope = rule.global() || (rule.ownerUuid() != null && rule.ownerUuid().equals(filter.ownerUuid()));
        if (!inScope) {
            return false;
        }

        return selectsAllVms(rule) || selectsTag(rule, filter.tags());
    }

    private boolean selectsAllVms(Rule rule) {
        return Stream.concat(rule.from().wildcards().stream(), rule.to().wildcards().stream())
                .anyMatch(vmWildcards::contains);
    }

    private static boolean selectsTag(Rule rule, Map<String, Object> vmTags) {
        if (vmTags.isEmpty()) {
            return false;
        }

        return Stream.of(rule.tags().stream(), rule.from().tags().stream(), rule.to().tags().stream())
                .flatMap(s -> s)
                .anyMatch(token -> tagMatches(token, vmTags));
    }

    private static boolean tagMatches(String token, Map<String, Object> vmTags) {
        final var eq = token.indexOf('=');
        if (eq < 0) {
            return vmTags.containsKey(token);
        }

        final var value = vmTags.get(token.substring(0, eq));
        return value != null && String.valueOf(value).equals(token.substring(eq + 1));
    }
}
