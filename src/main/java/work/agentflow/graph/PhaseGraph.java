package work.agentflow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import work.agentflow.shared.Names;

/**
 * Precedence relation between category phases. Built once, single-threaded, then read-only.
 */
public final class PhaseGraph {
    private final PhaseTable table;
    private final Map<String, Set<String>> edges = new TreeMap<>();

    public PhaseGraph(PhaseTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public PhaseTable table() {
        return table;
    }

    /**
     * Declares that the phase of {@code before} must come before the phase of {@code after}.
     */
    public PhaseGraph addPrecedence(String before, String after) {
        String from = requireKnown(before);
        String to = requireKnown(after);
        edges.computeIfAbsent(from, key -> new TreeSet<>()).add(to);
        return this;
    }

    public Map<String, Set<String>> edges() {
        var copy = new TreeMap<String, Set<String>>();
        edges.forEach((from, targets) -> copy.put(from, Collections.unmodifiableSet(new TreeSet<>(targets))));
        return Collections.unmodifiableMap(copy);
    }

    public PhaseOrder build() {
        Map<Integer, Map<Integer, Set<String>>> phaseEdges = new TreeMap<>();
        for (var entry : edges.entrySet()) {
            int from = table.phaseOf(entry.getKey());
            for (String target : entry.getValue()) {
                int to = table.phaseOf(target);
                var contributors = phaseEdges
                    .computeIfAbsent(from, key -> new TreeMap<>())
                    .computeIfAbsent(to, key -> new TreeSet<>());
                contributors.add(entry.getKey());
                contributors.add(target);
            }
        }

        var visited = new HashSet<Integer>();
        for (int phase : table.ordinals()) {
            detectCycle(phase, phaseEdges, visited, new LinkedHashSet<>());
        }

        Map<Integer, Set<Integer>> successors = new HashMap<>();
        Map<Integer, Integer> inDegree = new HashMap<>();
        for (int phase : table.ordinals()) {
            inDegree.put(phase, 0);
        }
        phaseEdges.forEach((from, targets) -> {
            successors.put(from, Collections.unmodifiableSet(new TreeSet<>(targets.keySet())));
            for (int to : targets.keySet()) {
                inDegree.merge(to, 1, Integer::sum);
            }
        });

        var ready = new PriorityQueue<Integer>();
        inDegree.forEach((phase, degree) -> {
            if (degree == 0) {
                ready.add(phase);
            }
        });
        var ordered = new ArrayList<Integer>();
        while (!ready.isEmpty()) {
            int phase = ready.poll();
            ordered.add(phase);
            for (int next : successors.getOrDefault(phase, Set.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return new PhaseOrder(table, ordered, Collections.unmodifiableMap(successors));
    }

    private static void detectCycle(
        int phase,
        Map<Integer, Map<Integer, Set<String>>> phaseEdges,
        Set<Integer> visited,
        LinkedHashSet<Integer> stack
    ) {
        if (visited.contains(phase)) {
            return;
        }
        stack.add(phase);
        for (int next : phaseEdges.getOrDefault(phase, Map.of()).keySet()) {
            if (stack.contains(next)) {
                throw new CycleException(cycleCategories(next, stack, phaseEdges));
            }
            detectCycle(next, phaseEdges, visited, stack);
        }
        stack.remove(phase);
        visited.add(phase);
    }

    private static List<String> cycleCategories(
        int start,
        LinkedHashSet<Integer> stack,
        Map<Integer, Map<Integer, Set<String>>> phaseEdges
    ) {
        var path = new ArrayList<Integer>();
        boolean inCycle = false;
        for (int phase : stack) {
            if (phase == start) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(phase);
            }
        }
        path.add(start);
        var categories = new TreeSet<String>();
        for (int i = 0; i + 1 < path.size(); i++) {
            categories.addAll(phaseEdges.get(path.get(i)).get(path.get(i + 1)));
        }
        return List.copyOf(categories);
    }

    private String requireKnown(String category) {
        String normalized = Names.category(category);
        if (normalized == null || !table.contains(normalized)) {
            throw new IllegalArgumentException("Unknown category in precedence: " + category);
        }
        return normalized;
    }
}
