package fwapi.core.model.rule;

import java.util.List;
import java.util.Set;

/**
 * One endpoint ({@code FROM} or {@code TO}) of a firewall rule.
 *
 * <p>A side is a combination of selectors. Wildcards, IPs and subnets are
 * structural: they stay meaningful no matter which VMs exist. VM ids only
 * denote something while the named VMs are alive. Tag expressions are opaque
 * to this service.
 *
 * @param wildcards wildcard tokens such as {@code any} or {@code vmall}
 * @param vms       VM ids in storage order
 * @param tags      tag-match expressions ({@code key} or {@code key=value})
 * @param ips       literal IP addresses
 * @param subnets   CIDR subnets
 */
public record RuleSide(Set<String> wildcards, List<String> vms, Set<String> tags, Set<String> ips, Set<String> subnets) {

    private static final RuleSide EMPTY = new RuleSide(null, null, null, null, null);

    public RuleSide {
        wildcards = wildcards == null ? Set.of() : Set.copyOf(wildcards);
        vms = vms == null ? List.of() : List.copyOf(vms);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        ips = ips == null ? Set.of() : Set.copyOf(ips);
        subnets = subnets == null ? Set.of() : Set.copyOf(subnets);
    }

    public static RuleSide empty() {
        return EMPTY;
    }

    public static RuleSide ofVms(String... vmIds) {
        return new RuleSide(null, List.of(vmIds), null, null, null);
    }

    public static RuleSide ofWildcards(String... wildcards) {
        return new RuleSide(Set.of(wildcards), null, null, null, null);
    }

    public static RuleSide ofTags(String... tags) {
        return new RuleSide(null, null, Set.of(tags), null, null);
    }

    public static RuleSide ofIps(String... ips) {
        return new RuleSide(null, null, null, Set.of(ips), null);
    }

    public static RuleSide ofSubnets(String... subnets) {
        return new RuleSide(null, null, null, null, Set.of(subnets));
    }

    public boolean hasVms() {
        return !vms.isEmpty();
    }

    /**
     * Check whether this side names the given VM.
     *
     * @param vmUuid the VM id
     * @return true if the id appears in {@link #vms()}
     */
    public boolean references(String vmUuid) {
        return vms.contains(vmUuid);
    }
}
