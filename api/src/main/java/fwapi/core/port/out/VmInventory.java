package fwapi.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import fwapi.core.model.vm.Vm;

/**
 * Port interface for point lookups against the VM inventory.
 *
 * <p>A missing VM is an expected answer and is reported as an empty
 * Optional. Every other problem (transport errors, timeouts, unexpected
 * status codes) fails the Uni with {@link InventoryUnavailableException}.
 */
public interface VmInventory {

    /**
     * Look up a VM by id.
     *
     * @param vmUuid the VM id
     * @return Uni with the VM, or empty if the inventory does not know it
     */
    default Uni<Optional<Vm>> getVm(String vmUuid) {
        return getVm(vmUuid, Optional.empty());
    }

    /**
     * Look up a VM by id, restricted to one owner.
     *
     * @param vmUuid    the VM id
     * @param ownerUuid when present, a VM of another owner is reported as not found
     * @return Uni with the VM, or empty if not found
     */
    Uni<Optional<Vm>> getVm(String vmUuid, Optional<String> ownerUuid);

    /**
     * Thrown when the inventory cannot answer a lookup.
     */
    class InventoryUnavailableException extends RuntimeException {
        public InventoryUnavailableException(String message) {
            super(message);
        }

        public InventoryUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
