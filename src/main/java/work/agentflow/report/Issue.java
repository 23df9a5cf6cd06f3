package work.agentflow.report;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A warning or error raised while loading the catalog or resolving a request.
 */
public record Issue(Severity severity, IssueKind kind, String message, String context) {
    public Issue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        context = context == null ? "" : context;
    }

    public static Issue warning(IssueKind kind, String message, String context) {
        return new Issue(Severity.WARNING, kind, message, context);
    }

    public static Issue error(IssueKind kind, String message, String context) {
        return new Issue(Severity.ERROR, kind, message, context);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("severity", severity.label());
        serializable.put("kind", kind.label());
        serializable.put("message", message);
        return serializable;
    }
}
