package work.agentflow.registry;

import work.agentflow.catalog.AgentRecord;
import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

public final class DuplicateNameException extends AgentflowException {
    private final AgentRecord existing;
    private final AgentRecord rejected;

    public DuplicateNameException(AgentRecord existing, AgentRecord rejected) {
        super(
            IssueKind.DUPLICATE_NAME,
            "Agent '" + rejected.id() + "' already registered in category '" + rejected.category()
                + "' by " + existing.sourcePath() + "; rejected " + rejected.sourcePath()
        );
        this.existing = existing;
        this.rejected = rejected;
    }

    public AgentRecord existing() {
        return existing;
    }

    public AgentRecord rejected() {
        return rejected;
    }
}
