package fwapi.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import fwapi.core.model.rule.Rule;
import fwapi.core.model.rule.RuleFilter;

/**
 * Port interface for the firewall rule store.
 *
 * <p>The garbage collector only reads candidate rules and deletes vacuous
 * ones. Deletion by id must be idempotent: deleting a rule that is already
 * gone reports {@code false} instead of failing.
 *
 * <p>Backend failures fail the returned Uni with {@link RuleStoreException}.
 */
public interface RuleRepository {

    /**
     * Find every rule that could apply to the VM described by the filter.
     *
     * @param filter owner, tags and VM ids of the VM
     * @return Uni with the candidate rules, in a stable store order
     */
    Uni<List<Rule>> findMatching(RuleFilter filter);

    /**
     * Find a rule by id.
     *
     * @param ruleUuid the rule id
     * @return Uni with Optional containing the rule if found
     */
    Uni<Optional<Rule>> findById(String ruleUuid);

    /**
     * Save or replace a rule.
     *
     * @param rule the rule to persist
     * @return Uni completing when the write is durable
     */
    Uni<Void> save(Rule rule);

    /**
     * Delete a rule by id.
     *
     * @param ruleUuid the rule id
     * @return Uni with true if deleted, false if it did not exist
     */
    Uni<Boolean> delete(String ruleUuid);

    /**
     * Retrieve all rules.
     *
     * @return Uni with every stored rule
     */
    Uni<List<Rule>> findAll();

    /**
     * Thrown when the rule store cannot complete an operation.
     */
    class RuleStoreException extends RuntimeException {
        public RuleStoreException(String message) {
            super(message);
        }

        public RuleStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
