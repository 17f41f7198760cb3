package fwapi.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import fwapi.config.TelemetryConfigMapping;
import fwapi.core.model.gc.GcDecision;
import fwapi.core.model.gc.GcPassReport;
import fwapi.core.port.out.GcMetrics;

/**
 * Micrometer counters for garbage-collection passes.
 *
 * <p>With {@code fwapi.telemetry.metrics.enabled=false} nothing is registered.
 *
 * <p>Counters:
 * <ul>
 *   <li>{@code fwapi.gc.decisions.total} - Rule decisions by outcome (keep, delete, fail)</li>
 *   <li>{@code fwapi.gc.passes.total} - Completed and failed passes</li>
 *   <li>{@code fwapi.gc.rules.deleted.total} - Rules deleted across all passes</li>
 *   <li>{@code fwapi.vmapi.lookups.total} - VM lookups made while probing, by result</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerGcMetrics implements GcMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerGcMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(GcDecision decision) {
        if (!enabled) {
            return;
        }

        Counter.builder("fwapi.gc.decisions.total")
                .description("Garbage-collection decisions per rule")
                .tag("outcome", decision.outcome())
                .register(registry)
                .increment();
    }

    @Override
    public void recordPass(GcPassReport report) {
        if (!enabled) {
            return;
        }

        Counter.builder("fwapi.gc.passes.total")
                .description("Garbage-collection passes")
                .tag("result", report.failed() ? "failed" : "completed")
                .register(registry)
                .increment();

        if (!report.deleted().isEmpty()) {
            Counter.builder("fwapi.gc.rules.deleted.total")
                    .description("Rules deleted by garbage collection")
                    .register(registry)
                    .increment(report.deleted().size());
        }
    }

    @Override
    public void recordLookup(String result) {
        if (!enabled) {
            return;
        }

        Counter.builder("fwapi.vmapi.lookups.total")
                .description("VM inventory lookups made while probing rule sides")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
