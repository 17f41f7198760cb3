package fwapi.core.port.out;

import fwapi.core.model.gc.GcDecision;
import fwapi.core.model.gc.GcPassReport;

/**
 * Port interface for recording garbage-collection metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface GcMetrics {

    /**
     * Record the decision reached for one rule.
     *
     * @param decision the decision
     */
    void recordDecision(GcDecision decision);

    /**
     * Record the end of a pass.
     *
     * @param report the final pass report
     */
    void recordPass(GcPassReport report);

    /**
     * Record one inventory lookup made while probing.
     *
     * @param result {@code live}, {@code dead} or {@code error}
     */
    void recordLookup(String result);

    static GcMetrics noop() {
        return new GcMetrics() {
            @Override
            public void recordDecision(GcDecision decision) {}

            @Override
            public void recordPass(GcPassReport report) {}

            @Override
            public void recordLookup(String result) {}
        };
    }
}
