package fwapi.core.model.vm;

import java.util.Map;

/**
 * A virtual machine as reported by the VM inventory.
 *
 * @param uuid      VM id
 * @param ownerUuid owning account
 * @param tags      tag name to value
 * @param state     lifecycle state such as {@code running}, {@code stopped} or {@code destroyed}
 */
public record Vm(String uuid, String ownerUuid, Map<String, Object> tags, String state) {

    public static final String STATE_DESTROYED = "destroyed";

    public Vm {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("VM UUID cannot be null or blank");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public boolean isDestroyed() {
        return STATE_DESTROYED.equalsIgnoreCase(state);
    }
}
