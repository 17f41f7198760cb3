package fwapi.core.service.gc;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import fwapi.core.model.vm.Vm;
import fwapi.core.port.out.GcMetrics;
import fwapi.core.port.out.VmInventory;

/**
 * Checks whether a list of VMs still has a live member.
 *
 * <p>VMs are looked up one at a time, in list order, and probing stops at the
 * first live VM: the first live answer cancels the rest of the list. A VM counts as dead when the inventory does not know it,
 * when it is the VM being removed, or when it is destroyed. Any other lookup
 * failure aborts the probe and is propagated unchanged.
 */
@ApplicationScoped
public class VmListProber {

    private static final Logger LOG = Logger.getLogger(VmListProber.class);

    private final VmInventory inventory;
    private final GcMetrics metrics;

    @Inject
    public VmListProber(VmInventory inventory, GcMetrics metrics) {
        this.inventory = inventory;
        this.metrics = metrics;
    }

    /**
     * Probe a VM list for a live member.
     *
     * @param vmUuids  VM ids in the order to probe
     * @param ignoreId the VM whose removal triggered the pass; always treated as dead
     * @return Uni with true at the first live VM, false once the list is exhausted
     */
    public Uni<Boolean> hasLiveMember(List<String> vmUuids, String ignoreId) {
        return Multi.createFrom()
                .iterable(vmUuids)
                .onItem()
                .transformToUniAndConcatenate(vmUuid -> lookup(vmUuid, ignoreId))
                .select()
                .where(Boolean::booleanValue)
                .toUni()
                .onItem()
                .ifNull()
                .continueWith(false);
    }

    private Uni<Boolean> lookup(String vmUuid, String ignoreId) {
        return inventory
                .getVm(vmUuid)
                .onFailure()
                .invoke(error -> {
                    metrics.recordLookup("error");
                    LOG.warnf("VM lookup failed while probing %s: %s", vmUuid, error.getMessage());
                })
                .map(vm -> {
                    if (isLive(vm, ignoreId)) {
                        metrics.recordLookup("live");
                        LOG.debugf("VM %s is live", vmUuid);
                        return true;
                    }
                    metrics.recordLookup("dead");
                    LOG.debugf("VM %s counts as dead", vmUuid);
                    return false;
                });
    }

    private static boolean isLive(Optional<Vm> vm, String ignoreId) {
        return vm.filter(v -> !v.uuid().equals(ignoreId))
                .filter(v -> !v.isDestroyed())
                .isPresent();
    }
}
