package fwapi.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import fwapi.core.model.rule.Rule;

/**
 * Serialized form of a firewall rule.
 *
 * <p>{@code global} is only present for global rules; {@code owner_uuid} and
 * {@code description} are omitted when absent.
 */
public record RuleResponse(
        String uuid,
        String version,
        boolean enabled,
        Boolean global,
        @JsonProperty("owner_uuid") String ownerUuid,
        String description,
        String rule) {

    public static RuleResponse fromModel(Rule model) {
        return new RuleResponse(
                model.uuid(),
                model.version(),
                model.enabled(),
                model.global() ? Boolean.TRUE : null,
                model.ownerUuid(),
                model.description(),
                model.ruleText());
    }
}
