package work.agentflow.catalog;

import work.agentflow.report.IssueKind;
import work.agentflow.shared.AgentflowException;

/**
 * Metadata block missing, malformed, or lacking a required field. The document is skipped.
 */
public final class ParseException extends AgentflowException {
    private final String sourcePath;

    public ParseException(String sourcePath, String message) {
        super(IssueKind.PARSE_ERROR, sourcePath + ": " + message);
        this.sourcePath = sourcePath;
    }

    public ParseException(String sourcePath, String message, Throwable cause) {
        super(IssueKind.PARSE_ERROR, sourcePath + ": " + message, cause);
        this.sourcePath = sourcePath;
    }

    public String sourcePath() {
        return sourcePath;
    }
}
