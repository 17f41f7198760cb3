package fwapi.core.service.gc;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import fwapi.core.model.rule.RuleSide;

@DisplayName("SideClassifier")
class SideClassifierTest {

    @Test
    @DisplayName("wildcard side is structural")
    void wildcardIsStructural() {
        assertTrue(SideClassifier.isStructural(RuleSide.ofWildcards("any")));
    }

    @Test
    @DisplayName("IP side is structural")
    void ipIsStructural() {
        assertTrue(SideClassifier.isStructural(RuleSide.ofIps("10.0.0.1")));
    }

    @Test
    @DisplayName("subnet side is structural")
    void subnetIsStructural() {
        assertTrue(SideClassifier.isStructural(RuleSide.ofSubnets("10.0.0.0/24")));
    }

    @Test
    @DisplayName("VM-only side is not structural")
    void vmSideIsNotStructural() {
        assertFalse(SideClassifier.isStructural(RuleSide.ofVms("vm-1", "vm-2")));
    }

    @Test
    @DisplayName("tag-only side is not structural")
    void tagSideIsNotStructural() {
        assertFalse(SideClassifier.isStructural(RuleSide.ofTags("role=web")));
    }

    @Test
    @DisplayName("empty side is not structural")
    void emptySideIsNotStructural() {
        assertFalse(SideClassifier.isStructural(RuleSide.empty()));
    }

    @Test
    @DisplayName("VMs mixed with a subnet is structural")
    void mixedSideIsStructural() {
        final var side = new RuleSide(null, List.of("vm-1"), null, null, Set.of("192.168.0.0/16"));

        assertTrue(SideClassifier.isStructural(side));
    }
}
