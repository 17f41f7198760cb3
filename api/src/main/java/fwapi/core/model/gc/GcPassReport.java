package fwapi.core.model.gc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one garbage-collection pass for a target VM.
 *
 * <p>Reports are immutable. A running pass folds its decisions into a
 * {@link Builder} and takes the report once the pass ends.
 *
 * @param vmUuid     the target VM
 * @param candidates number of candidate rules returned by the store
 * @param evaluated  number of rules that reached a decision (including a failed one)
 * @param deleted    ids of rules deleted in this pass, in processing order
 * @param kept       number of rules kept
 * @param failure    the failure that stopped the pass, if any
 */
public record GcPassReport(
        String vmUuid, int candidates, int evaluated, List<String> deleted, int kept, Optional<GcFailure> failure) {

    public GcPassReport {
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
        failure = failure == null ? Optional.empty() : failure;
    }

    /**
     * Start folding a pass over the given number of candidates.
     */
    public static Builder builder(String vmUuid, int candidates) {
        return new Builder(vmUuid, candidates);
    }

    /**
     * Report a pass that failed before any rule could be evaluated.
     *
     * @param vmUuid the target VM
     * @param reason why the pass could not start
     */
    public static GcPassReport aborted(String vmUuid, String reason) {
        return new GcPassReport(vmUuid, 0, 0, List.of(), 0, Optional.of(new GcFailure(null, reason)));
    }

    public boolean failed() {
        return failure.isPresent();
    }

    /**
     * Why a pass stopped.
     *
     * @param ruleUuid the rule being processed, or null when the pass failed before evaluating rules
     * @param reason   human-readable cause
     */
    public record GcFailure(String ruleUuid, String reason) {}

    /**
     * Accumulates the decisions of one pass. Not thread-safe; a pass records
     * its decisions one after another.
     */
    public static final class Builder {
        private final String vmUuid;
        private final int candidates;
        private final List<String> deleted = new ArrayList<>();
        private int evaluated;
        private int kept;
        private GcFailure failure;

        private Builder(String vmUuid, int candidates) {
            this.vmUuid = vmUuid;
            this.candidates = candidates;
        }

        public String vmUuid() {
            return vmUuid;
        }

        /**
         * Fold one rule's decision into the pass.
         *
         * @param ruleUuid the evaluated rule
         * @param decision its decision
         * @return this builder
         */
        public Builder record(String ruleUuid, GcDecision decision) {
            evaluated++;
            if (decision instanceof GcDecision.Delete) {
                deleted.add(ruleUuid);
            } else if (decision instanceof GcDecision.Fail fail) {
                failure = new GcFailure(ruleUuid, fail.reason());
            } else {
                kept++;
            }
            return this;
        }

        public boolean failed() {
            return failure != null;
        }

        public GcPassReport build() {
            return new GcPassReport(vmUuid, candidates, evaluated, deleted, kept, Optional.ofNullable(failure));
        }
    }
}
