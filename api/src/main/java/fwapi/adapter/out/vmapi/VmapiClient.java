package fwapi.adapter.out.vmapi;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import fwapi.core.config.VmapiConfig;
import fwapi.core.model.vm.Vm;
import fwapi.core.port.out.VmInventory;

/**
 * VM inventory adapter backed by the VMAPI HTTP service.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET /vms/{uuid}?owner_uuid={owner}
 * Accept: application/json
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "uuid": "...",
 *   "owner_uuid": "...",
 *   "state": "running",
 *   "tags": { "role": "web" }
 * }
 * }</pre>
 *
 * <p>A 404 is reported as an empty Optional. Any other non-200 status, a
 * malformed body or a transport error fails with
 * {@link VmInventory.InventoryUnavailableException}.
 */
@ApplicationScoped
public class VmapiClient implements VmInventory {

    private static final Logger LOG = Logger.getLogger(VmapiClient.class);

    private final WebClient webClient;
    private final VmapiConfig config;

    @Inject
    public VmapiClient(Vertx vertx, VmapiConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<Optional<Vm>> getVm(String vmUuid, Optional<String> ownerUuid) {
        final var url = vmUrl(vmUuid);
        final var startTime = System.currentTimeMillis();

        LOG.debugf("Looking up VM: url=%s, owner=%s", url, ownerUuid.orElse("-"));

        final var request =
                webClient.getAbs(url).timeout(config.timeout().toMillis()).putHeader("Accept", "application/json");
        ownerUuid.ifPresent(owner -> request.addQueryParam("owner_uuid", owner));

        return request.send()
                .onFailure()
                .transform(error -> new InventoryUnavailableException(
                        "VMAPI request failed for VM " + vmUuid + ": " + error.getMessage(), error))
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    LOG.debugf("VMAPI responded: url=%s, status=%d, duration=%dms", url, response.statusCode(), duration);
                    return toVm(vmUuid, response);
                });
    }

    private String vmUrl(String vmUuid) {
        final var base = config.url();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/vms/" + vmUuid;
    }

    private Optional<Vm> toVm(String vmUuid, HttpResponse<Buffer> response) {
        if (response.statusCode() == 404) {
            return Optional.empty();
        }

        if (response.statusCode() != 200) {
            LOG.warnf("VMAPI lookup failed: vm=%s, status=%d, body=%s", vmUuid, response.statusCode(), response.bodyAsString());
            throw new InventoryUnavailableException("VMAPI returned status " + response.statusCode() + " for VM " + vmUuid);
        }

        try {
            return Optional.of(parseVm(response.bodyAsJsonObject()));
        } catch (RuntimeException e) {
            throw new InventoryUnavailableException("VMAPI returned an unreadable VM " + vmUuid, e);
        }
    }

    private Vm parseVm(JsonObject json) {
        final Map<String, Object> tags = new HashMap<>();
        final var tagsJson = json.getJsonObject("tags");
        if (tagsJson != null) {
            tagsJson.forEach(entry -> {
                if (entry.getValue() != null) {
                    tags.put(entry.getKey(), entry.getValue());
                }
            });
        }

        return new Vm(json.getString("uuid"), json.getString("owner_uuid"), tags, json.getString("state"));
    }
}
