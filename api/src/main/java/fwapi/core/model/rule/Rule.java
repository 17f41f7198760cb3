package fwapi.core.model.rule;

import java.util.Set;

/**
 * A stored firewall rule, as read by the garbage collector.
 *
 * <p>Only the fields that decide whether a rule is still meaningful are
 * modelled. The action, protocol and ports live in {@code ruleText} and are
 * never inspected here.
 *
 * @param uuid        unique rule id
 * @param version     opaque storage version
 * @param enabled     whether the rule is active
 * @param global      whether the rule applies to every owner
 * @param ownerUuid   owning account, required unless {@code global}
 * @param description free-form description (may be null)
 * @param ruleText    source text of the rule as stored
 * @param tags        rule-level tag selectors; a non-empty set exempts the rule from VM-triggered cleanup
 * @param from        source side
 * @param to          destination side
 */
public record Rule(
        String uuid,
        String version,
        boolean enabled,
        boolean global,
        String ownerUuid,
        String description,
        String ruleText,
        Set<String> tags,
        RuleSide from,
        RuleSide to) {

    public Rule {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("Rule UUID cannot be null or blank");
        }
        if (!global && (ownerUuid == null || ownerUuid.isBlank())) {
            throw new IllegalArgumentException("Rule " + uuid + " must have an owner unless it is global");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        from = from == null ? RuleSide.empty() : from;
        to = to == null ? RuleSide.empty() : to;
    }

    public static Builder builder(String uuid) {
        return new Builder(uuid);
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }

    /**
     * Check whether either side lists the given VM.
     *
     * @param vmUuid the VM id
     * @return true if {@code from} or {@code to} references the VM
     */
    public boolean references(String vmUuid) {
        return from.references(vmUuid) || to.references(vmUuid);
    }

    public static final class Builder {
        private final String uuid;
        private String version = "1";
        private boolean enabled = true;
        private boolean global;
        private String ownerUuid;
        private String description;
        private String ruleText;
        private Set<String> tags = Set.of();
        private RuleSide from = RuleSide.empty();
        private RuleSide to = RuleSide.empty();

        private Builder(String uuid) {
            this.uuid = uuid;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder global(boolean global) {
            this.global = global;
            return this;
        }

        public Builder ownerUuid(String ownerUuid) {
            this.ownerUuid = ownerUuid;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder ruleText(String ruleText) {
            this.ruleText = ruleText;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder from(RuleSide from) {
            this.from = from;
            return this;
        }

        public Builder to(RuleSide to) {
            this.to = to;
            return this;
        }

        public Rule build() {
            return new Rule(uuid, version, enabled, global, ownerUuid, description, ruleText, tags, from, to);
        }
    }
}
