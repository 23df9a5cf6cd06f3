package work.agentflow.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of a successful {@link PhaseGraph#build()}: a total order over the ranked phases.
 */
public final class PhaseOrder {
    private final PhaseTable table;
    private final List<Integer> phases;
    private final Map<Integer, Integer> ranks;
    private final Map<Integer, Set<Integer>> successors;

    PhaseOrder(PhaseTable table, List<Integer> phases, Map<Integer, Set<Integer>> successors) {
        this.table = table;
        this.phases = List.copyOf(phases);
        var byPhase = new HashMap<Integer, Integer>();
        for (int i = 0; i < phases.size(); i++) {
            byPhase.put(phases.get(i), i);
        }
        this.ranks = Collections.unmodifiableMap(byPhase);
        this.successors = successors;
    }

    public PhaseTable table() {
        return table;
    }

    /** Ranked phase ordinals in execution order. */
    public List<Integer> phases() {
        return phases;
    }

    public int rankOf(int phase) {
        return ranks.getOrDefault(phase, phases.size());
    }

    public int rankOfCategory(String category) {
        return rankOf(table.phaseOf(category));
    }

    /**
     * True when the phase of {@code before} transitively precedes the phase of {@code after}.
     */
    public boolean precedes(String before, String after) {
        int from = table.phaseOf(before);
        int to = table.phaseOf(after);
        if (!PhaseTable.isRanked(from) || !PhaseTable.isRanked(to)) {
            return false;
        }
        var seen = new HashSet<Integer>();
        var queue = new ArrayDeque<Integer>(successors.getOrDefault(from, Set.of()));
        while (!queue.isEmpty()) {
            int next = queue.poll();
            if (next == to) {
                return true;
            }
            if (seen.add(next)) {
                queue.addAll(successors.getOrDefault(next, Set.of()));
            }
        }
        return false;
    }
}
