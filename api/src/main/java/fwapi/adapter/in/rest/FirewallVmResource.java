package fwapi.adapter.in.rest;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import fwapi.adapter.in.dto.GcPassResponse;
import fwapi.adapter.in.dto.RuleResponse;
import fwapi.adapter.in.problem.FirewallProblem;
import fwapi.adapter.in.validation.UuidValidator;
import fwapi.core.port.in.VmRuleManagement;

/**
 * REST resource for the firewall rules that apply to a VM.
 *
 * <ul>
 * <li>{@code GET /firewalls/vms/{uuid}} lists every rule that could apply to the VM</li>
 * <li>{@code DELETE /firewalls/vms/{uuid}} runs a garbage-collection pass for a VM
 *     being removed, deleting rules that no live VM can match any more</li>
 * </ul>
 *
 * <p>Both accept an optional {@code owner_uuid} query parameter that scopes the
 * VM lookup. Malformed UUIDs are rejected with 422 before any backend call.
 */
@Path("/firewalls/vms")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class FirewallVmResource {

    private final VmRuleManagement vmRuleService;

    @Inject
    public FirewallVmResource(VmRuleManagement vmRuleService) {
        this.vmRuleService = vmRuleService;
    }

    /**
     * List the rules that could apply to a VM.
     *
     * @param uuid      the VM id
     * @param ownerUuid optional owner of the VM
     * @return 200 with the rules, 404 if the VM is unknown, 503 on backend failure
     */
    @GET
    @Path("/{uuid}")
    public Uni<List<RuleResponse>> getVmRules(
            @PathParam("uuid") String uuid, @QueryParam("owner_uuid") String ownerUuid) {
        UuidValidator.validateVmParams(uuid, ownerUuid);

        return vmRuleService
                .listRules(uuid, Optional.ofNullable(ownerUuid))
                .map(rules -> rules.stream().map(RuleResponse::fromModel).toList());
    }

    /**
     * Delete the rules left without a live endpoint by the removal of a VM.
     *
     * @param uuid      the VM being removed
     * @param ownerUuid optional owner of the VM
     * @return 200 with the pass summary, or 503 if the pass stopped early (safe to retry)
     */
    @DELETE
    @Path("/{uuid}")
    public Uni<Response> deleteVmRules(@PathParam("uuid") String uuid, @QueryParam("owner_uuid") String ownerUuid) {
        UuidValidator.validateVmParams(uuid, ownerUuid);

        return vmRuleService.collectGarbage(uuid, Optional.ofNullable(ownerUuid)).map(report -> {
            if (report.failed()) {
                throw FirewallProblem.serviceUnavailable(report.failure().get().reason());
            }
            return Response.ok(GcPassResponse.fromModel(report)).build();
        });
    }
}
