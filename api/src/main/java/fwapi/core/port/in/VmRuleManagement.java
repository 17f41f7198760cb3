package fwapi.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import fwapi.core.model.gc.GcPassReport;
import fwapi.core.model.rule.Rule;

/**
 * Port for the rule operations keyed by a VM.
 */
public interface VmRuleManagement {

    /**
     * List the rules that could apply to a VM.
     *
     * @param vmUuid    the VM id
     * @param ownerUuid optional owner scope for the VM lookup
     * @return Uni with the candidate rules
     * @throws VmNotFoundException (as Uni failure) if the inventory does not know the VM
     */
    Uni<List<Rule>> listRules(String vmUuid, Optional<String> ownerUuid);

    /**
     * Run one garbage-collection pass for a VM that is being removed.
     *
     * <p>Rules are processed one at a time in store order. The pass stops at
     * the first rule that cannot be decided; deletions already made stay in
     * place, so the caller may simply retry.
     *
     * @param vmUuid    the target VM id
     * @param ownerUuid optional owner scope for the VM lookup
     * @return Uni with the pass report; a failed pass is reported, not thrown
     */
    Uni<GcPassReport> collectGarbage(String vmUuid, Optional<String> ownerUuid);

    /**
     * Thrown when the VM named by a request does not exist.
     */
    class VmNotFoundException extends RuntimeException {
        private final String vmUuid;

        public VmNotFoundException(String vmUuid) {
            super("VM not found: " + vmUuid);
            this.vmUuid = vmUuid;
        }

        public String vmUuid() {
            return vmUuid;
        }
    }
}
