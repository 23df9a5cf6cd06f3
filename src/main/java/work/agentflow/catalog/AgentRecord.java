package work.agentflow.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import work.agentflow.graph.PhaseTable;

/**
 * One catalog entry derived from a document's metadata block.
 */
public record AgentRecord(
    String id,
    String name,
    String description,
    String category,
    Set<String> stackTags,
    int phase,
    String sourcePath,
    String model
) {
    public AgentRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(category, "category");
        stackTags = stackTags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(stackTags));
        sourcePath = sourcePath == null ? "" : sourcePath;
    }

    public boolean matchesAny(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return false;
        }
        for (String tag : tags) {
            if (stackTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public Map<String, Object> toSummaryMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", id);
        summary.put("name", name);
        summary.put("category", category);
        summary.put("phase", PhaseTable.isRanked(phase) ? phase : null);
        return summary;
    }

    public Map<String, Object> toDetailMap() {
        Map<String, Object> detail = toSummaryMap();
        detail.put("description", description);
        detail.put("stackTags", stackTags);
        if (model != null) {
            detail.put("model", model);
        }
        detail.put("sourcePath", sourcePath);
        return detail;
    }
}
