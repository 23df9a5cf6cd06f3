package work.agentflow.resolve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.graph.PhaseOrder;
import work.agentflow.registry.AgentNotFoundException;
import work.agentflow.registry.Registry;
import work.agentflow.report.Issue;
import work.agentflow.report.IssueKind;

/**
 * Turns a {@link WorkflowRequest} into a phase-ordered {@link WorkflowPlan}.
 *
 * <p>Stateless and read-only with respect to its inputs; safe to call from several threads
 * against the same registry and phase order.
 */
public final class WorkflowResolver {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowResolver.class);

    public WorkflowPlan resolve(WorkflowRequest request, Registry registry, PhaseOrder phaseOrder) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(phaseOrder, "phaseOrder");

        var selected = new ArrayList<AgentRecord>();
        var unresolved = new TreeSet<String>();
        var issues = new ArrayList<Issue>();

        for (String category : new TreeSet<>(request.requiredCategories())) {
            String pick = request.explicitPicks().get(category);
            if (pick != null) {
                try {
                    selected.add(registry.lookup(category, pick));
                } catch (AgentNotFoundException ex) {
                    unresolved.add(category);
                    issues.add(Issue.error(IssueKind.NOT_FOUND, ex.getMessage(), category));
                }
                continue;
            }
            Optional<AgentRecord> candidate = selectCandidate(registry.listByCategory(category), request);
            if (candidate.isPresent()) {
                selected.add(candidate.get());
            } else {
                unresolved.add(category);
                String message = "No agent available for category '" + category + "'";
                issues.add(request.strict()
                    ? Issue.error(IssueKind.UNRESOLVED_CATEGORY, message, category)
                    : Issue.warning(IssueKind.UNRESOLVED_CATEGORY, message, category));
            }
        }

        selected.sort(executionOrder(phaseOrder));
        LOG.debug("Resolved {} agents, {} unresolved categories", selected.size(), unresolved.size());
        return new WorkflowPlan(selected, new LinkedHashSet<>(unresolved), issues);
    }

    /**
     * Phase rank first, then category, then id.
     */
    public static Comparator<AgentRecord> executionOrder(PhaseOrder phaseOrder) {
        return Comparator.<AgentRecord>comparingInt(record -> phaseOrder.rankOf(record.phase()))
            .thenComparing(AgentRecord::category)
            .thenComparing(AgentRecord::id);
    }

    private static Optional<AgentRecord> selectCandidate(List<AgentRecord> candidates, WorkflowRequest request) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
            .filter(record -> record.matchesAny(request.stackTags()))
            .findFirst()
            .or(() -> Optional.of(candidates.get(0)));
    }
}
