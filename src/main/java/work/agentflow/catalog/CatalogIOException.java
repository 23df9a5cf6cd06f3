package work.agentflow.catalog;

import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

/**
 * Catalog root missing or unreadable. Fatal for the run.
 */
public final class CatalogIOException extends AgentflowException {
    public CatalogIOException(String message) {
        super(IssueKind.IO_ERROR, message);
    }

    public CatalogIOException(String message, Throwable cause) {
        super(IssueKind.IO_ERROR, message, cause);
    }
}
