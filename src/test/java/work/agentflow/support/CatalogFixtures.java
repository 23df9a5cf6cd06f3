package work.agentflow.support;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.graph.PhaseGraph;
import work.agentflow.graph.PhaseTable;

/**
 * Shared catalog builders for the test suites.
 */
public final class CatalogFixtures {
    private CatalogFixtures() {}

    public static Path fixtureCatalog() {
        return Path.of("src", "test", "resources", "catalog").toAbsolutePath();
    }

    /**
     * architecture(1) → components(2) → state-management(3) → styling, data-access(4) → testing(5) → security(6).
     */
    public static PhaseGraph linearGraph() {
        Map<String, Integer> phases = new LinkedHashMap<>();
        phases.put("architecture", 1);
        phases.put("components", 2);
        phases.put("state-management", 3);
        phases.put("styling", 4);
        phases.put("data-access", 4);
        phases.put("testing", 5);
        phases.put("security", 6);
        return new PhaseGraph(new PhaseTable(phases))
            .addPrecedence("architecture", "components")
            .addPrecedence("components", "state-management")
            .addPrecedence("state-management", "styling")
            .addPrecedence("state-management", "data-access")
            .addPrecedence("styling", "testing")
            .addPrecedence("data-access", "testing")
            .addPrecedence("testing", "security");
    }

    public static AgentRecord agent(PhaseTable table, String id, String category, String... tags) {
        return new AgentRecord(
            id,
            id,
            "Fixture agent " + id,
            category,
            Set.copyOf(Arrays.asList(tags)),
            table.phaseOf(category),
            category + "/" + id + ".md",
            null
        );
    }

    public static String document(String name, String category, String... tags) {
        var builder = new StringBuilder("---\n")
            .append("name: ").append(name).append('\n')
            .append("description: Fixture agent ").append(name).append('\n');
        if (category != null) {
            builder.append("category: ").append(category).append('\n');
        }
        if (tags.length > 0) {
            builder.append("stackTags: [").append(String.join(", ", tags)).append("]\n");
        }
        return builder.append("---\n\n# ").append(name).append('\n').toString();
    }

    public static Path write(Path root, String relativePath, String content) throws IOException {
        Path target = root.resolve(relativePath);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }
}
