package fwapi.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import fwapi.adapter.out.storage.memory.InMemoryRuleRepository;
import fwapi.core.model.gc.GcPassReport;
import fwapi.core.model.rule.Rule;
import fwapi.core.model.rule.RuleFilter;
import fwapi.core.model.rule.RuleSide;
import fwapi.core.model.vm.Vm;
import fwapi.core.port.in.VmRuleManagement.VmNotFoundException;
import fwapi.core.port.out.GcMetrics;
import fwapi.core.port.out.RuleRepository;
import fwapi.core.port.out.RuleRepository.RuleStoreException;
import fwapi.core.port.out.VmInventory;
import fwapi.core.port.out.VmInventory.InventoryUnavailableException;
import fwapi.core.service.gc.RuleGcEngine;
import fwapi.core.service.gc.VmListProber;

@DisplayName("VmRuleService")
@ExtendWith(MockitoExtension.class)
class VmRuleServiceTest {

    private static final String OWNER = "930896af-bf8c-48d4-885c-6573a94b1853";
    private static final String OTHER_OWNER = "00000000-0000-4000-8000-00000000ffff";
    private static final String A = "aaaaaaaa-0000-4000-8000-000000000001";
    private static final String B = "bbbbbbbb-0000-4000-8000-000000000002";
    private static final String C = "cccccccc-0000-4000-8000-000000000003";

    @Mock
    private VmInventory inventory;

    private InMemoryRuleRepository repository;
    private VmRuleService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRuleRepository(Set.of("any", "vmall"));
        service = serviceWith(repository);
    }

    private VmRuleService serviceWith(RuleRepository rules) {
        final var metrics = GcMetrics.noop();
        final var engine = new RuleGcEngine(new VmListProber(inventory, metrics), rules, metrics);
        return new VmRuleService(inventory, rules, engine, metrics);
    }

    private void store(Rule rule) {
        repository.save(rule).await().atMost(Duration.ofSeconds(1));
    }

    private boolean exists(String ruleUuid) {
        return repository.findById(ruleUuid).await().atMost(Duration.ofSeconds(1)).isPresent();
    }

    private static Vm running(String uuid, Map<String, Object> tags) {
        return new Vm(uuid, OWNER, tags, "running");
    }

    private void resolves(Vm vm) {
        when(inventory.getVm(vm.uuid(), Optional.empty())).thenReturn(Uni.createFrom().item(Optional.of(vm)));
    }

    private void probes(Vm vm) {
        when(inventory.getVm(vm.uuid())).thenReturn(Uni.createFrom().item(Optional.of(vm)));
    }

    private GcPassReport collect(String vmUuid) {
        return service.collectGarbage(vmUuid, Optional.empty()).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("listRules()")
    class ListRulesTests {

        @Test
        @DisplayName("should return rules referencing the VM, selecting its tags or selecting all VMs")
        void shouldReturnCandidates() {
            resolves(running(A, Map.of("role", "web")));
            store(Rule.builder("r-ref").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofIps("10.0.0.1")).build());
            store(Rule.builder("r-tag").ownerUuid(OWNER).to(RuleSide.ofTags("role=web")).from(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r-all").global(true).from(RuleSide.ofWildcards("vmall")).to(RuleSide.ofSubnets("10.0.0.0/8")).build());
            store(Rule.builder("r-other").ownerUuid(OTHER_OWNER).from(RuleSide.ofWildcards("vmall")).build());
            store(Rule.builder("r-unrelated").ownerUuid(OWNER).from(RuleSide.ofVms(B)).to(RuleSide.ofIps("10.0.0.2")).build());

            final var rules = service.listRules(A, Optional.empty()).await().atMost(Duration.ofSeconds(1));

            assertEquals(List.of("r-ref", "r-tag", "r-all"), rules.stream().map(Rule::uuid).toList());
        }

        @Test
        @DisplayName("should fail with VmNotFoundException for an unknown VM")
        void shouldFailForUnknownVm() {
            when(inventory.getVm(A, Optional.of(OWNER))).thenReturn(Uni.createFrom().item(Optional.empty()));

            final var uni = service.listRules(A, Optional.of(OWNER));

            final var error = assertThrows(VmNotFoundException.class, () -> uni.await().atMost(Duration.ofSeconds(1)));
            assertEquals(A, error.vmUuid());
        }
    }

    @Nested
    @DisplayName("collectGarbage()")
    class CollectGarbageTests {

        @Test
        @DisplayName("should delete vacuous rules and keep the rest")
        void shouldDeleteVacuousRules() {
            final var target = running(A, Map.of());
            resolves(target);
            probes(target);
            probes(running(C, Map.of()));
            store(Rule.builder("r-singular").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r-shared").ownerUuid(OWNER).from(RuleSide.ofVms(A, C)).to(RuleSide.ofIps("10.0.0.1")).build());
            store(Rule.builder("r-tagged").ownerUuid(OWNER).tags(Set.of("web")).from(RuleSide.ofVms(A)).build());

            final var report = collect(A);

            assertFalse(report.failed());
            assertEquals(3, report.candidates());
            assertEquals(3, report.evaluated());
            assertEquals(List.of("r-singular"), report.deleted());
            assertEquals(2, report.kept());
            assertFalse(exists("r-singular"));
            assertTrue(exists("r-shared"));
            assertTrue(exists("r-tagged"));
        }

        @Test
        @DisplayName("should stop at the first failing rule and leave later rules untouched")
        void shouldStopAtFirstFailure() {
            final var target = running(A, Map.of());
            resolves(target);
            probes(target);
            when(inventory.getVm(B)).thenReturn(Uni.createFrom().failure(new InventoryUnavailableException("timeout")));
            store(Rule.builder("r1").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r2").ownerUuid(OWNER).from(RuleSide.ofVms(B)).to(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r3").ownerUuid(OWNER).from(RuleSide.ofVms(C)).to(RuleSide.ofWildcards("any")).build());

            final var report = collect(A);

            assertTrue(report.failed());
            assertEquals("r2", report.failure().get().ruleUuid());
            assertEquals(3, report.candidates());
            assertEquals(2, report.evaluated());
            assertEquals(List.of("r1"), report.deleted());
            assertFalse(exists("r1"));
            assertTrue(exists("r2"));
            assertTrue(exists("r3"));
            verify(inventory, never()).getVm(C);
        }

        @Test
        @DisplayName("should delete nothing on a repeated pass")
        void shouldBeIdempotent() {
            final var target = running(A, Map.of());
            resolves(target);
            probes(target);
            probes(running(C, Map.of()));
            store(Rule.builder("r-singular").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r-shared").ownerUuid(OWNER).from(RuleSide.ofVms(A, C)).to(RuleSide.ofIps("10.0.0.1")).build());

            final var first = collect(A);
            final var second = collect(A);

            assertEquals(List.of("r-singular"), first.deleted());
            assertFalse(second.failed());
            assertEquals(1, second.candidates());
            assertTrue(second.deleted().isEmpty());
            assertTrue(exists("r-shared"));
        }

        @Test
        @DisplayName("should report an aborted pass for an unknown VM")
        void shouldAbortForUnknownVm() {
            when(inventory.getVm(A, Optional.empty())).thenReturn(Uni.createFrom().item(Optional.empty()));
            store(Rule.builder("r1").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());

            final var report = collect(A);

            assertTrue(report.failed());
            assertNull(report.failure().get().ruleUuid());
            assertEquals(0, report.evaluated());
            assertTrue(exists("r1"));
        }

        @Test
        @DisplayName("should report an aborted pass when the VM cannot be resolved")
        void shouldAbortWhenInventoryFails() {
            when(inventory.getVm(A, Optional.empty()))
                    .thenReturn(Uni.createFrom().failure(new InventoryUnavailableException("VMAPI returned status 500")));

            final var report = collect(A);

            assertTrue(report.failed());
            assertTrue(report.failure().get().reason().startsWith("Cannot resolve VM"));
        }

        @Test
        @DisplayName("should report an aborted pass when candidates cannot be fetched")
        void shouldAbortWhenStoreFails() {
            final var failingRepository = mock(RuleRepository.class);
            when(failingRepository.findMatching(any(RuleFilter.class)))
                    .thenReturn(Uni.createFrom().failure(new RuleStoreException("store down")));
            resolves(running(A, Map.of()));

            final var report = serviceWith(failingRepository)
                    .collectGarbage(A, Optional.empty())
                    .await()
                    .atMost(Duration.ofSeconds(1));

            assertTrue(report.failed());
            assertTrue(report.failure().get().reason().contains("store down"));
            verify(failingRepository, never()).delete(any());
        }

        @Test
        @DisplayName("should evaluate thousands of rules that decide without lookups")
        void shouldEvaluateManyExemptRules() {
            resolves(running(A, Map.of()));
            for (int i = 0; i < 5_000; i++) {
                store(Rule.builder("r" + i).ownerUuid(OWNER).tags(Set.of("t")).from(RuleSide.ofVms(A)).build());
            }

            final var report = service.collectGarbage(A, Optional.empty()).await().atMost(Duration.ofSeconds(30));

            assertFalse(report.failed());
            assertEquals(5_000, report.candidates());
            assertEquals(5_000, report.evaluated());
            assertEquals(5_000, report.kept());
        }

        @Test
        @DisplayName("should delete thousands of vacuous rules in one pass")
        void shouldDeleteManyRules() {
            final var target = running(A, Map.of());
            resolves(target);
            probes(target);
            for (int i = 0; i < 3_000; i++) {
                store(Rule.builder("r" + i).ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());
            }

            final var report = service.collectGarbage(A, Optional.empty()).await().atMost(Duration.ofSeconds(30));

            assertFalse(report.failed());
            assertEquals(3_000, report.deleted().size());
            assertEquals("r2999", report.deleted().get(2_999));
            assertTrue(repository.findAll().await().atMost(Duration.ofSeconds(1)).isEmpty());
        }

        @Test
        @DisplayName("should skip every rule after a failure in a long pass")
        void shouldStopLongPassAtFailure() {
            resolves(running(A, Map.of()));
            when(inventory.getVm(B)).thenReturn(Uni.createFrom().failure(new InventoryUnavailableException("timeout")));
            for (int i = 0; i < 1_000; i++) {
                store(Rule.builder("exempt" + i).ownerUuid(OWNER).tags(Set.of("t")).from(RuleSide.ofVms(A)).build());
            }
            store(Rule.builder("r-fail").ownerUuid(OWNER).from(RuleSide.ofVms(B)).to(RuleSide.ofWildcards("any")).build());
            store(Rule.builder("r-after").ownerUuid(OWNER).from(RuleSide.ofVms(A)).to(RuleSide.ofWildcards("any")).build());

            final var report = service.collectGarbage(A, Optional.empty()).await().atMost(Duration.ofSeconds(30));

            assertTrue(report.failed());
            assertEquals("r-fail", report.failure().get().ruleUuid());
            assertEquals(1_001, report.evaluated());
            assertTrue(exists("r-after"));
            verify(inventory, never()).getVm(A);
        }

        @Test
        @DisplayName("should report an empty pass when no rule applies")
        void shouldCompleteWithNoCandidates() {
            resolves(running(A, Map.of()));

            final var report = collect(A);

            assertFalse(report.failed());
            assertEquals(0, report.candidates());
            assertTrue(report.deleted().isEmpty());
        }
    }
}
