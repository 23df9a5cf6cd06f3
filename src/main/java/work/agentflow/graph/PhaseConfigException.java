package work.agentflow.graph;

import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

/**
 * Phase table file missing, unreadable or malformed.
 */
public final class PhaseConfigException extends AgentflowException {
    public PhaseConfigException(String message) {
        super(IssueKind.IO_ERROR, message);
    }

    public PhaseConfigException(String message, Throwable cause) {
        super(IssueKind.IO_ERROR, message, cause);
    }
}
