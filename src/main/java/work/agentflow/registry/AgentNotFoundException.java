package work.agentflow.registry;

import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

public final class AgentNotFoundException extends AgentflowException {
    private final String category;
    private final String id;

    public AgentNotFoundException(String category, String id) {
        super(IssueKind.NOT_FOUND, "No agent '" + id + "' in category '" + category + "'");
        this.category = category;
        this.id = id;
    }

    public String category() {
        return category;
    }

    public String id() {
        return id;
    }
}
