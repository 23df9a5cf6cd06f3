package work.agentflow.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.agentflow.report.IssueKind;
import work.agentflow.support.CatalogFixtures;

class PhaseGraphTest {
    @Test
    void buildsTopologicalPhaseOrder() {
        var order = CatalogFixtures.linearGraph().build();
        assertEquals(List.of(1, 2, 3, 4, 5, 6), order.phases());
        assertEquals(0, order.rankOfCategory("architecture"));
        assertEquals(3, order.rankOfCategory("styling"));
        assertEquals(3, order.rankOfCategory("data-access"));
    }

    @Test
    void unrankedCategoriesSortAfterEveryPhase() {
        var order = CatalogFixtures.linearGraph().build();
        assertEquals(PhaseTable.UNRANKED, order.table().phaseOf("other"));
        assertEquals(order.phases().size(), order.rankOfCategory("other"));
        assertTrue(order.rankOfCategory("security") < order.rankOfCategory("other"));
    }

    @Test
    void precedesFollowsEdgesTransitively() {
        var order = CatalogFixtures.linearGraph().build();
        assertTrue(order.precedes("architecture", "security"));
        assertTrue(order.precedes("state-management", "data-access"));
        assertFalse(order.precedes("security", "architecture"));
        assertFalse(order.precedes("styling", "data-access"));
        assertFalse(order.precedes("architecture", "other"));
    }

    @Test
    void edgesMayContradictNumericOrdinals() {
        var table = new PhaseTable(Map.of("review", 1, "design", 2));
        var order = new PhaseGraph(table).addPrecedence("design", "review").build();
        assertEquals(List.of(2, 1), order.phases());
        assertTrue(order.rankOfCategory("design") < order.rankOfCategory("review"));
    }

    @Test
    void detectsCycleAndNamesItsCategories() {
        var table = new PhaseTable(Map.of("a", 1, "b", 2, "c", 3, "d", 4));
        var graph = new PhaseGraph(table)
            .addPrecedence("a", "b")
            .addPrecedence("b", "c")
            .addPrecedence("c", "d")
            .addPrecedence("c", "a");

        var ex = assertThrows(CycleException.class, graph::build);
        assertEquals(IssueKind.CYCLE, ex.kind());
        assertEquals(List.of("a", "b", "c"), ex.categories());
    }

    @Test
    void precedenceInsideOnePhaseIsACycle() {
        var table = new PhaseTable(Map.of("components", 2, "domain-modeling", 2));
        var graph = new PhaseGraph(table).addPrecedence("components", "domain-modeling");

        var ex = assertThrows(CycleException.class, graph::build);
        assertEquals(List.of("components", "domain-modeling"), ex.categories());
    }

    @Test
    void rejectsUnknownCategories() {
        var graph = CatalogFixtures.linearGraph();
        assertThrows(IllegalArgumentException.class, () -> graph.addPrecedence("architecture", "deployment"));
    }

    @Test
    void phaseTableRejectsInvalidOrdinals() {
        assertThrows(IllegalArgumentException.class, () -> new PhaseTable(Map.of("a", 0)));
        assertThrows(IllegalArgumentException.class, () -> new PhaseTable(Map.of("a", 1, "A", 2)));
    }
}
