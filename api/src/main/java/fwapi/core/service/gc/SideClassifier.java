package fwapi.core.service.gc;

import fwapi.core.model.rule.RuleSide;

/**
 * Tells structural rule sides apart from VM-bound ones.
 *
 * <p>A structural side selects wildcards, IPs or subnets, so removing a VM
 * can never empty it. Side-level tags are not considered.
 */
public final class SideClassifier {

    private SideClassifier() {}

    public static boolean isStructural(RuleSide side) {
        return !side.wildcards().isEmpty()
                || !side.ips().isEmpty()
                || !side.subnets().isEmpty();
    }
}
