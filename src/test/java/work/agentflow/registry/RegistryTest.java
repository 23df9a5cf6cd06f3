package work.agentflow.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.agentflow.support.CatalogFixtures.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.graph.PhaseTable;
import work.agentflow.report.IssueKind;
import work.agentflow.support.CatalogFixtures;

class RegistryTest {
    private final PhaseTable table = CatalogFixtures.linearGraph().table();

    @Test
    void lookupReturnsTheRegisteredRecord() {
        var registry = new Registry();
        var records = List.of(
            agent(table, "react-architect", "architecture", "react"),
            agent(table, "spring-architect", "architecture", "spring"),
            agent(table, "frontend-tester", "testing", "react")
        );
        records.forEach(registry::register);

        for (int round = 0; round < 3; round++) {
            for (AgentRecord record : records) {
                assertSame(record, registry.lookup(record.category(), record.id()));
            }
        }
        assertEquals(3, registry.size());
    }

    @Test
    void duplicateRegistrationLeavesRegistryUnchanged() {
        var registry = new Registry();
        var first = agent(table, "tailwind-specialist", "styling", "tailwind");
        var second = new AgentRecord(
            "tailwind-specialist", "Tailwind v2", "Another one", "styling",
            Set.of("css"), first.phase(), "other/tailwind.md", null
        );
        registry.register(first);

        var ex = assertThrows(DuplicateNameException.class, () -> registry.register(second));
        assertEquals(IssueKind.DUPLICATE_NAME, ex.kind());
        assertSame(first, ex.existing());
        assertSame(second, ex.rejected());
        assertSame(first, registry.lookup("styling", "tailwind-specialist"));
        assertEquals(List.of(first), registry.listByCategory("styling"));
        assertEquals(1, registry.size());
    }

    @Test
    void sameIdInDifferentCategoriesIsAllowed() {
        var registry = new Registry();
        registry.register(agent(table, "reviewer", "testing"));
        registry.register(agent(table, "reviewer", "security"));
        assertEquals(2, registry.size());
    }

    @Test
    void lookupOfUnknownAgentFails() {
        var registry = new Registry();
        registry.register(agent(table, "react-architect", "architecture"));

        var ex = assertThrows(AgentNotFoundException.class, () -> registry.lookup("architecture", "vue-architect"));
        assertEquals("architecture", ex.category());
        assertEquals("vue-architect", ex.id());
        assertThrows(AgentNotFoundException.class, () -> registry.lookup("security", "react-architect"));
    }

    @Test
    void lookupNormalizesCategoryAndId() {
        var registry = new Registry();
        var record = agent(table, "react-architect", "architecture");
        registry.register(record);

        assertSame(record, registry.lookup(" Architecture ", "React_Architect"));
        assertSame(record, registry.lookup("architecture", "React Architect"));
        assertThrows(AgentNotFoundException.class, () -> registry.lookup("architecture", "  "));
    }

    @Test
    void listByCategorySortsById() {
        var registry = new Registry();
        registry.register(agent(table, "zeta", "testing"));
        registry.register(agent(table, "alpha", "testing"));
        registry.register(agent(table, "mid", "testing"));

        var ids = registry.listByCategory("Testing").stream().map(AgentRecord::id).toList();
        assertEquals(List.of("alpha", "mid", "zeta"), ids);
        assertTrue(registry.listByCategory("security").isEmpty());
    }

    @Test
    void recordsAreSortedByCategoryThenId() {
        var registry = new Registry();
        registry.register(agent(table, "b", "testing"));
        registry.register(agent(table, "a", "testing"));
        registry.register(agent(table, "c", "architecture"));

        var keys = registry.records().stream().map(r -> r.category() + ":" + r.id()).toList();
        assertEquals(List.of("architecture:c", "testing:a", "testing:b"), keys);
        assertEquals(List.of("architecture", "testing"), List.copyOf(registry.categories()));
    }

    @Test
    void concurrentWritersRegisterEachKeyOnce() throws Exception {
        var registry = new Registry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < 200; i++) {
                String id = "agent-" + (i % 50);
                tasks.add(() -> {
                    try {
                        registry.register(agent(table, id, "testing"));
                        return true;
                    } catch (DuplicateNameException ex) {
                        return false;
                    }
                });
            }
            int accepted = 0;
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                if (future.get()) {
                    accepted++;
                }
            }
            assertEquals(50, accepted);
            assertEquals(50, registry.size());
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
