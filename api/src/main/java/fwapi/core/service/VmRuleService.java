package fwapi.core.service;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import fwapi.core.model.gc.GcDecision;
import fwapi.core.model.gc.GcPassReport;
import fwapi.core.model.rule.Rule;
import fwapi.core.model.rule.RuleFilter;
import fwapi.core.model.vm.Vm;
import fwapi.core.port.in.VmRuleManagement;
import fwapi.core.port.out.GcMetrics;
import fwapi.core.port.out.RuleRepository;
import fwapi.core.port.out.VmInventory;
import fwapi.core.service.gc.RuleGcEngine;

/**
 * Service for the rule operations keyed by a VM.
 *
 * <p>Both operations resolve the VM first and select candidate rules with
 * the VM's owner, tags and id. The garbage-collection pass then runs the
 * {@link RuleGcEngine} over the candidates strictly one after another and
 * stops at the first failure.
 */
@ApplicationScoped
public class VmRuleService implements VmRuleManagement {

    private static final Logger LOG = Logger.getLogger(VmRuleService.class);

    private final VmInventory inventory;
    private final RuleRepository repository;
    private final RuleGcEngine engine;
    private final GcMetrics metrics;

    @Inject
    public VmRuleService(VmInventory inventory, RuleRepository repository, RuleGcEngine engine, GcMetrics metrics) {
        this.inventory = inventory;
        this.repository = repository;
        this.engine = engine;
        this.metrics = metrics;
    }

    @Override
    public Uni<List<Rule>> listRules(String vmUuid, Optional<String> ownerUuid) {
        return inventory.getVm(vmUuid, ownerUuid).flatMap(vm -> {
            if (vm.isEmpty()) {
                return Uni.createFrom().failure(new VmNotFoundException(vmUuid));
            }

            final var filter = RuleFilter.forVm(vm.get());
            LOG.debugf("Filtering rules with %s", filter);
            return repository.findMatching(filter);
        });
    }

    @Override
    public Uni<GcPassReport> collectGarbage(String vmUuid, Optional<String> ownerUuid) {
        return inventory
                .getVm(vmUuid, ownerUuid)
                .onItemOrFailure()
                .transformToUni((vm, error) -> {
                    if (error != null) {
                        return Uni.createFrom()
                                .item(GcPassReport.aborted(vmUuid, "Cannot resolve VM: " + error.getMessage()));
                    }
                    if (vm.isEmpty()) {
                        return Uni.createFrom().item(GcPassReport.aborted(vmUuid, "VM not found: " + vmUuid));
                    }
                    return collectForVm(vm.get());
                })
                .invoke(report -> {
                    metrics.recordPass(report);
                    if (report.failed()) {
                        LOG.warnf("GC pass for VM %s stopped: %s", vmUuid, report.failure().get().reason());
                    } else {
                        LOG.infof(
                                "GC pass for VM %s complete: candidates=%d, deleted=%d, kept=%d",
                                vmUuid, report.candidates(), report.deleted().size(), report.kept());
                    }
                });
    }

    private Uni<GcPassReport> collectForVm(Vm vm) {
        final var filter = RuleFilter.forVm(vm);
        LOG.debugf("Filtering rules with %s", filter);

        return repository.findMatching(filter).onItemOrFailure().transformToUni((rules, error) -> {
            if (error != null) {
                return Uni.createFrom()
                        .item(GcPassReport.aborted(vm.uuid(), "Failed to fetch candidate rules: " + error.getMessage()));
            }
            return collectAll(rules, GcPassReport.builder(vm.uuid(), rules.size()));
        });
    }

    /**
     * Run the engine over the rules one at a time. Once a rule fails, the
     * remaining rules are skipped without being evaluated.
     */
    private Uni<GcPassReport> collectAll(List<Rule> rules, GcPassReport.Builder pass) {
        return Multi.createFrom()
                .iterable(rules)
                .onItem()
                .transformToUniAndConcatenate(rule -> Uni.createFrom().deferred(() -> {
                    if (pass.failed()) {
                        return Uni.createFrom().<GcDecision>nullItem();
                    }
                    return engine.collect(rule, pass.vmUuid()).invoke(decision -> pass.record(rule.uuid(), decision));
                }))
                .collect()
                .last()
                .map(ignored -> pass.build());
    }
}
