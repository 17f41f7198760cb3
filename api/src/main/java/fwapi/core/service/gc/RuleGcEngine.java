package fwapi.core.service.gc;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import fwapi.core.model.gc.GcDecision;
import fwapi.core.model.rule.Rule;
import fwapi.core.model.rule.RuleSide;
import fwapi.core.port.out.GcMetrics;
import fwapi.core.port.out.RuleRepository;

/**
 * Decides whether a rule survives the removal of a VM, and deletes it if not.
 *
 * <p>Decision procedure for a candidate rule and target VM:
 * <ol>
 *   <li>Rules with rule-level tags are kept without probing.</li>
 *   <li>Rules whose sides are both structural are kept.</li>
 *   <li>With one structural side, the rule is kept iff the other side still
 *       has a live VM.</li>
 *   <li>With two VM-bound sides, the {@code from} side is probed first; if it
 *       has no live VM the rule is deleted without probing {@code to}.
 *       Otherwise the rule is kept iff {@code to} has a live VM.</li>
 * </ol>
 *
 * <p>A VM-bound side without VMs means the stored rule is malformed. It is
 * logged and the rule is kept.
 *
 * <p>Deleting a rule that is already gone counts as success. Any backend
 * error turns into {@link GcDecision.Fail}; this class never fails its Uni.
 */
@ApplicationScoped
public class RuleGcEngine {

    private static final Logger LOG = Logger.getLogger(RuleGcEngine.class);

    private final VmListProber prober;
    private final RuleRepository repository;
    private final GcMetrics metrics;

    @Inject
    public RuleGcEngine(VmListProber prober, RuleRepository repository, GcMetrics metrics) {
        this.prober = prober;
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Decide and apply: delete the rule if the decision is {@code Delete}.
     *
     * @param rule     the candidate rule
     * @param targetVm the VM being removed
     * @return Uni with the final decision; a failed deletion becomes {@code Fail}
     */
    public Uni<GcDecision> collect(Rule rule, String targetVm) {
        return decide(rule, targetVm)
                .flatMap(decision -> decision.isDelete() ? deleteRule(rule, decision) : Uni.createFrom().item(decision))
                .invoke(decision -> {
                    metrics.recordDecision(decision);
                    logDecision(rule, targetVm, decision);
                });
    }

    /**
     * Decide without side effects.
     *
     * @param rule     the candidate rule
     * @param targetVm the VM being removed
     * @return Uni with {@code Keep}, {@code Delete} or {@code Fail}
     */
    public Uni<GcDecision> decide(Rule rule, String targetVm) {
        if (rule.hasTags()) {
            return keep("rule selects tags");
        }

        final var fromStructural = SideClassifier.isStructural(rule.from());
        final var toStructural = SideClassifier.isStructural(rule.to());

        final Uni<GcDecision> decision;
        if (fromStructural && toStructural) {
            decision = keep("both sides are structural");
        } else if (fromStructural || toStructural) {
            decision = decideOneBound(rule, fromStructural ? rule.to() : rule.from(), targetVm);
        } else {
            decision = decideBothBound(rule, targetVm);
        }

        return decision.onFailure().recoverWithItem(error -> GcDecision.fail(probeFailure(rule, error), error));
    }

    private Uni<GcDecision> decideOneBound(Rule rule, RuleSide bound, String targetVm) {
        if (!bound.hasVms()) {
            return keepMalformed(rule);
        }

        return prober.hasLiveMember(bound.vms(), targetVm)
                .map(hasLive -> hasLive
                        ? GcDecision.keep("VM-bound side has a live VM")
                        : GcDecision.delete("VM-bound side has no live VM"));
    }

    private Uni<GcDecision> decideBothBound(Rule rule, String targetVm) {
        if (!rule.from().hasVms() || !rule.to().hasVms()) {
            return keepMalformed(rule);
        }

        return prober.hasLiveMember(rule.from().vms(), targetVm).flatMap(hasLiveFrom -> {
            if (!hasLiveFrom) {
                return Uni.createFrom().item(GcDecision.delete("FROM side has no live VM"));
            }
            return prober.hasLiveMember(rule.to().vms(), targetVm)
                    .map(hasLiveTo -> hasLiveTo
                            ? GcDecision.keep("both sides have a live VM")
                            : GcDecision.delete("TO side has no live VM"));
        });
    }

    private Uni<GcDecision> deleteRule(Rule rule, GcDecision decision) {
        return repository
                .delete(rule.uuid())
                .map(deleted -> {
                    if (!deleted) {
                        LOG.debugf("Rule %s was already deleted", rule.uuid());
                    }
                    return decision;
                })
                .onFailure()
                .recoverWithItem(error -> GcDecision.fail(
                        "Failed to delete rule %s: %s".formatted(rule.uuid(), error.getMessage()), error));
    }

    private Uni<GcDecision> keepMalformed(Rule rule) {
        LOG.warnf("Rule %s has a VM-bound side without VMs; keeping it", rule.uuid());
        return keep("VM-bound side lists no VMs");
    }

    private static Uni<GcDecision> keep(String reason) {
        return Uni.createFrom().item(GcDecision.keep(reason));
    }

    private static String probeFailure(Rule rule, Throwable error) {
        return "Failed to probe VMs of rule %s: %s".formatted(rule.uuid(), error.getMessage());
    }

    private void logDecision(Rule rule, String targetVm, GcDecision decision) {
        if (decision instanceof GcDecision.Delete delete) {
            LOG.infof("Deleted rule %s for VM %s: %s", rule.uuid(), targetVm, delete.reason());
        } else if (decision instanceof GcDecision.Fail fail) {
            LOG.warnf("Could not decide rule %s for VM %s: %s", rule.uuid(), targetVm, fail.reason());
        } else if (decision instanceof GcDecision.Keep keep) {
            LOG.debugf("Keeping rule %s for VM %s: %s", rule.uuid(), targetVm, keep.reason());
        }
    }
}
