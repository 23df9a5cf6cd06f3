package work.agentflow.graph;

import java.util.List;
import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

/**
 * Raised when the phase precedence relation is not acyclic. Always fatal.
 */
public final class CycleException extends AgentflowException {
    private final List<String> categories;

    public CycleException(List<String> categories) {
        super(IssueKind.CYCLE, "Phase precedence cycle between categories: " + String.join(", ", categories));
        this.categories = List.copyOf(categories);
    }

    public List<String> categories() {
        return categories;
    }
}
