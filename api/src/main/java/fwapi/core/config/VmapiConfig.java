package fwapi.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the VM inventory (VMAPI) client.
 *
 * <p>Configuration prefix: {@code fwapi.vmapi}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * fwapi.vmapi.url=http://vmapi.example.com
 * fwapi.vmapi.timeout=PT5S
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * FWAPI_VMAPI_URL=http://vmapi.example.com
 * FWAPI_VMAPI_TIMEOUT=PT5S
 * </pre>
 */
@ConfigMapping(prefix = "fwapi.vmapi")
public interface VmapiConfig {

    /**
     * Base URL of the VM inventory. VMs are read from {@code {url}/vms/{uuid}}.
     *
     * @return base URL (default: http://localhost:8081)
     */
    @WithDefault("http://localhost:8081")
    String url();

    /**
     * Maximum time to wait for a single VM lookup.
     *
     * <p>A lookup that times out fails the current garbage-collection pass.
     *
     * @return request timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();
}
