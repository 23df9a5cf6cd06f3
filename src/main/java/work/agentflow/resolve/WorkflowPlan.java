package work.agentflow.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.report.Issue;

/**
 * Ordered agents for a request, the categories nothing could cover, and every issue seen.
 */
public record WorkflowPlan(List<AgentRecord> orderedAgents, Set<String> unresolved, List<Issue> issues) {
    public WorkflowPlan {
        orderedAgents = List.copyOf(orderedAgents);
        unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
        issues = List.copyOf(issues);
    }

    public WorkflowPlan withLeadingIssues(List<Issue> earlier) {
        if (earlier == null || earlier.isEmpty()) {
            return this;
        }
        var combined = new ArrayList<Issue>(earlier);
        combined.addAll(issues);
        return new WorkflowPlan(orderedAgents, unresolved, combined);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("agents", orderedAgents.stream().map(AgentRecord::toSummaryMap).toList());
        serializable.put("unresolved", List.copyOf(unresolved));
        serializable.put("issues", issues.stream().map(Issue::toSerializableMap).toList());
        return serializable;
    }
}
