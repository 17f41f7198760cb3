package fwapi.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import fwapi.core.port.in.VmRuleManagement.VmNotFoundException;
import fwapi.core.port.out.RuleRepository.RuleStoreException;
import fwapi.core.port.out.VmInventory.InventoryUnavailableException;

/**
 * Maps domain exceptions escaping the REST layer to Problem Details.
 *
 * <p>An unknown VM is a 404. An unreachable VM inventory or rule store is a
 * 503, which callers may retry.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapVmNotFound(VmNotFoundException e) {
        LOG.debugv("VM not found: {0}", e.vmUuid());
        return toResponse(FirewallProblem.vmNotFound(e.vmUuid()));
    }

    @ServerExceptionMapper
    public Response mapInventoryUnavailable(InventoryUnavailableException e) {
        LOG.warnv("VM inventory unavailable: {0}", e.getMessage());
        return toResponse(FirewallProblem.serviceUnavailable("VM inventory unavailable: " + e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapRuleStoreFailure(RuleStoreException e) {
        LOG.warnv("Rule store unavailable: {0}", e.getMessage());
        return toResponse(FirewallProblem.serviceUnavailable("Rule store unavailable: " + e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
