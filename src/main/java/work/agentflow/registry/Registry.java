package work.agentflow.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.shared.Names;

/**
 * Indexed store of agent records keyed by {@code (category, id)}.
 */
public final class Registry {
    private static final Comparator<AgentRecord> BY_ID = Comparator.comparing(AgentRecord::id);

    private final Map<String, Map<String, AgentRecord>> byCategory = new ConcurrentHashMap<>();

    /**
     * Adds a record. On conflict the registry is left untouched and the first record stays.
     */
    public synchronized Registry register(AgentRecord record) {
        Objects.requireNonNull(record, "record");
        var agents = byCategory.get(record.category());
        AgentRecord existing = agents == null ? null : agents.get(record.id());
        if (existing != null) {
            throw new DuplicateNameException(existing, record);
        }
        byCategory.computeIfAbsent(record.category(), key -> new ConcurrentHashMap<>()).put(record.id(), record);
        return this;
    }

    public AgentRecord lookup(String category, String id) {
        String normalized = Names.category(category);
        String key = Names.slug(id);
        var agents = normalized == null ? null : byCategory.get(normalized);
        AgentRecord record = agents == null || key == null ? null : agents.get(key);
        if (record == null) {
            throw new AgentNotFoundException(normalized == null ? String.valueOf(category) : normalized, id);
        }
        return record;
    }

    /**
     * Records of a category sorted by id, independent of registration order.
     */
    public List<AgentRecord> listByCategory(String category) {
        String normalized = Names.category(category);
        var agents = normalized == null ? null : byCategory.get(normalized);
        if (agents == null || agents.isEmpty()) {
            return List.of();
        }
        var sorted = new ArrayList<>(agents.values());
        sorted.sort(BY_ID);
        return Collections.unmodifiableList(sorted);
    }

    public Set<String> categories() {
        return Collections.unmodifiableSet(new TreeSet<>(byCategory.keySet()));
    }

    /** Every record, sorted by category then id. */
    public List<AgentRecord> records() {
        var all = new ArrayList<AgentRecord>();
        for (String category : categories()) {
            all.addAll(listByCategory(category));
        }
        return Collections.unmodifiableList(all);
    }

    public int size() {
        return byCategory.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
