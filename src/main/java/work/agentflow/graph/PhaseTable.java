package work.agentflow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.agentflow.shared.Names;

/**
 * Pre-declared category to phase mapping. Categories missing from the table map to {@link #UNRANKED}.
 */
public final class PhaseTable {
    /** Sentinel phase that sorts after every ranked phase. */
    public static final int UNRANKED = Integer.MAX_VALUE;

    private final Map<String, Integer> phases;

    public PhaseTable(Map<String, Integer> phases) {
        Objects.requireNonNull(phases, "phases");
        var entries = new ArrayList<Map.Entry<String, Integer>>();
        for (var entry : phases.entrySet()) {
            String category = Names.category(entry.getKey());
            if (category == null) {
                throw new IllegalArgumentException("Phase table contains a blank category");
            }
            Integer ordinal = entry.getValue();
            if (ordinal == null || ordinal < 1 || ordinal == UNRANKED) {
                throw new IllegalArgumentException("Invalid phase ordinal for " + category + ": " + ordinal);
            }
            entries.add(Map.entry(category, ordinal));
        }
        entries.sort(Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.<String, Integer>comparingByKey()));
        var ordered = new LinkedHashMap<String, Integer>();
        for (var entry : entries) {
            if (ordered.put(entry.getKey(), entry.getValue()) != null) {
                throw new IllegalArgumentException("Category declared twice: " + entry.getKey());
            }
        }
        this.phases = Collections.unmodifiableMap(ordered);
    }

    public int phaseOf(String category) {
        String normalized = Names.category(category);
        if (normalized == null) {
            return UNRANKED;
        }
        return phases.getOrDefault(normalized, UNRANKED);
    }

    public boolean contains(String category) {
        String normalized = Names.category(category);
        return normalized != null && phases.containsKey(normalized);
    }

    /**
     * Categories ordered by phase, then name.
     */
    public List<String> categories() {
        return List.copyOf(phases.keySet());
    }

    public List<Integer> ordinals() {
        return phases.values().stream().distinct().sorted(Comparator.naturalOrder()).toList();
    }

    public static boolean isRanked(int phase) {
        return phase != UNRANKED;
    }
}
