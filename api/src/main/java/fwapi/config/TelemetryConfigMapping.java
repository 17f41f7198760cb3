package fwapi.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Telemetry settings.
 *
 * <pre>{@code
 * fwapi.telemetry.metrics.enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "fwapi.telemetry")
public interface TelemetryConfigMapping {

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Record garbage-collection counters. When off, every
         * {@link fwapi.core.port.out.GcMetrics} call is a no-op.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
