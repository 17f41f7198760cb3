package fwapi.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import fwapi.core.model.gc.GcPassReport;

/**
 * Response body of a completed garbage-collection pass.
 *
 * @param vmUuid     the target VM
 * @param candidates number of candidate rules
 * @param evaluated  number of rules evaluated
 * @param deleted    ids of the rules deleted by this pass
 * @param kept       number of rules kept
 */
public record GcPassResponse(
        @JsonProperty("vm_uuid") String vmUuid, int candidates, int evaluated, List<String> deleted, int kept) {

    public static GcPassResponse fromModel(GcPassReport report) {
        return new GcPassResponse(
                report.vmUuid(), report.candidates(), report.evaluated(), report.deleted(), report.kept());
    }
}
