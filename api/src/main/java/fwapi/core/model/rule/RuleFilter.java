package fwapi.core.model.rule;

import java.util.List;
import java.util.Map;

import fwapi.core.model.vm.Vm;

/**
 * Candidate selection for rules that could apply to a VM.
 *
 * <p>Matching is owned by the rule store. A rule listing one of {@code vms}
 * is always a candidate. A global rule, or one of the same owner, is a
 * candidate when it selects every VM or one of the VM's tags.
 *
 * @param ownerUuid owner of the VM
 * @param tags      the VM's tags
 * @param vms       VM ids that a candidate may list
 */
public record RuleFilter(String ownerUuid, Map<String, Object> tags, List<String> vms) {

    public RuleFilter {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        vms = vms == null ? List.of() : List.copyOf(vms);
    }

    public static RuleFilter forVm(Vm vm) {
        return new RuleFilter(vm.ownerUuid(), vm.tags(), List.of(vm.uuid()));
    }
}
