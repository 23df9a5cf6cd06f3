package work.agentflow.shared;

import work.agentflow.report.IssueKind;

/**
 * Base failure type carrying the issue kind it is reported under.
 */
public class AgentflowException extends RuntimeException {
    private final IssueKind kind;

    public AgentflowException(IssueKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentflowException(IssueKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public IssueKind kind() {
        return kind;
    }
}
