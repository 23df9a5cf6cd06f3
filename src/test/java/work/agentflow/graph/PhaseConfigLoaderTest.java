package work.agentflow.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PhaseConfigLoaderTest {
    @Test
    void bundledDefaultEncodesTheWorkflowNarrative() {
        var graph = PhaseConfigLoader.loadDefault();
        var table = graph.table();
        assertEquals(11, table.categories().size());
        assertEquals(1, table.phaseOf("architecture"));
        assertEquals(6, table.phaseOf("testing"));
        assertEquals(7, table.phaseOf("security"));

        var order = graph.build();
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), order.phases());
        assertTrue(order.precedes("architecture", "security"));
        assertTrue(order.precedes("domain-modeling", "data-access"));
        assertEquals(Set.of("components", "domain-modeling"), graph.edges().get("architecture"));
    }

    @Test
    void acceptsSingleTargetAsString() {
        var graph = PhaseConfigLoader.parse("""
            [phases]
            plan = 1
            ship = 2

            [[precedence]]
            before = "plan"
            after = "ship"
            """, "inline");
        assertTrue(graph.build().precedes("plan", "ship"));
    }

    @Test
    void cyclicFileLoadsButFailsToBuild() {
        var graph = PhaseConfigLoader.parse("""
            [phases]
            a = 1
            b = 2

            [[precedence]]
            before = "a"
            after = ["b"]

            [[precedence]]
            before = "b"
            after = ["a"]
            """, "inline");
        assertThrows(CycleException.class, graph::build);
    }

    @Test
    void rejectsMalformedTables() {
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("[phases", "broken"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("title = \"x\"", "no-phases"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("[phases]\na = \"one\"", "text"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("[phases]\na = 9999999999", "overflow"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("[phases]\na = -9999999999", "underflow"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.parse("""
            [phases]
            a = 1

            [[precedence]]
            before = "a"
            after = ["missing"]
            """, "unknown"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("phases.toml");
        Files.writeString(file, "[phases]\ndesign = 1\n");
        assertEquals(1, PhaseConfigLoader.load(file).table().phaseOf("design"));
        assertThrows(PhaseConfigException.class, () -> PhaseConfigLoader.load(dir.resolve("absent.toml")));
    }
}
