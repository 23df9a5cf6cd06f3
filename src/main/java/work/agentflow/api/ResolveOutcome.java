package work.agentflow.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.agentflow.graph.CycleException;
import work.agentflow.report.ValidationReporter;
import work.agentflow.resolve.WorkflowPlan;
import work.agentflow.shared.AgentflowException;

/**
 * Outcome of an {@link AgentflowRunner} call: either a plan or the fatal error that prevented one.
 */
public record ResolveOutcome(
    SessionState state,
    Optional<WorkflowPlan> plan,
    Optional<AgentflowException> failure,
    ValidationReporter.Summary summary,
    Map<String, Object> payload,
    int exitCode
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    static ResolveOutcome resolved(WorkflowPlan plan, ValidationReporter.Summary summary, int exitCode) {
        return new ResolveOutcome(
            SessionState.RESOLVED,
            Optional.of(plan),
            Optional.empty(),
            summary,
            plan.toSerializableMap(),
            exitCode
        );
    }

    static ResolveOutcome listed(Map<String, Object> payload, ValidationReporter.Summary summary, int exitCode) {
        return new ResolveOutcome(SessionState.RESOLVED, Optional.empty(), Optional.empty(), summary, payload, exitCode);
    }

    static ResolveOutcome failed(AgentflowException failure, ValidationReporter.Summary summary, int exitCode) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", failure.kind().label());
        error.put("message", failure.getMessage());
        if (failure instanceof CycleException cycle) {
            error.put("categories", cycle.categories());
        }
        return new ResolveOutcome(
            SessionState.FAILED,
            Optional.empty(),
            Optional.of(failure),
            summary,
            Map.of("error", error),
            exitCode
        );
    }

    public boolean succeeded() {
        return state == SessionState.RESOLVED;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize result payload: " + ex.getOriginalMessage(), ex);
        }
    }

    public List<String> unresolved() {
        return plan.map(value -> List.copyOf(value.unresolved())).orElse(List.of());
    }
}
