package work.agentflow.api;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.catalog.AgentRecord;
import work.agentflow.catalog.CatalogIOException;
import work.agentflow.catalog.CatalogLoadResult;
import work.agentflow.catalog.CatalogLoader;
import work.agentflow.graph.CycleException;
import work.agentflow.graph.PhaseConfigException;
import work.agentflow.graph.PhaseConfigLoader;
import work.agentflow.graph.PhaseGraph;
import work.agentflow.graph.PhaseOrder;
import work.agentflow.graph.PhaseTable;
import work.agentflow.report.Issue;
import work.agentflow.report.ValidationReporter;
import work.agentflow.resolve.WorkflowPlan;
import work.agentflow.resolve.WorkflowRequest;
import work.agentflow.resolve.WorkflowResolver;
import work.agentflow.shared.AgentflowException;

/**
 * Public entry point: load the catalog, build the phase graph, resolve the request.
 */
public final class AgentflowRunner {
    private static final Logger LOG = LoggerFactory.getLogger(AgentflowRunner.class);

    private final WorkflowResolver resolver = new WorkflowResolver();
    private final ValidationReporter reporter = new ValidationReporter();

    public ResolveOutcome run(ResolveConfiguration configuration) {
        var session = new ResolutionSession();
        try {
            session.moveTo(SessionState.LOADING);
            PhaseGraph graph = loadPhaseGraph(configuration);
            CatalogLoadResult loaded = loadCatalog(configuration, graph.table());
            PhaseOrder order = graph.build();
            session.moveTo(SessionState.GRAPH_BUILT);

            session.moveTo(SessionState.RESOLVING);
            WorkflowRequest request = effectiveRequest(configuration.request(), graph.table());
            WorkflowPlan plan = resolver.resolve(request, loaded.registry(), order)
                .withLeadingIssues(loaded.issues());
            session.moveTo(SessionState.RESOLVED);

            var summary = reporter.summarize(plan.issues());
            LOG.info(
                "Resolved {} agents for {} categories ({} unresolved)",
                plan.orderedAgents().size(),
                request.requiredCategories().size(),
                plan.unresolved().size()
            );
            return ResolveOutcome.resolved(plan, summary, reporter.exitCode(plan.issues()));
        } catch (CycleException | CatalogIOException | PhaseConfigException ex) {
            return fail(session, ex);
        }
    }

    /**
     * Loads the catalog only and reports every registered record.
     */
    public ResolveOutcome list(ResolveConfiguration configuration) {
        var session = new ResolutionSession();
        try {
            session.moveTo(SessionState.LOADING);
            PhaseGraph graph = loadPhaseGraph(configuration);
            CatalogLoadResult loaded = loadCatalog(configuration, graph.table());
            graph.build();
            session.moveTo(SessionState.GRAPH_BUILT);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("agents", loaded.registry().records().stream().map(AgentRecord::toDetailMap).toList());
            payload.put("issues", loaded.issues().stream().map(Issue::toSerializableMap).toList());
            return ResolveOutcome.listed(payload, reporter.summarize(loaded.issues()), reporter.exitCode(loaded.issues()));
        } catch (CycleException | CatalogIOException | PhaseConfigException ex) {
            return fail(session, ex);
        }
    }

    private ResolveOutcome fail(ResolutionSession session, AgentflowException ex) {
        session.moveTo(SessionState.FAILED);
        LOG.error("{}: {}", ex.kind().label(), ex.getMessage());
        if (Boolean.getBoolean("agentflow.debug")) {
            LOG.error("Failure details", ex);
        }
        var issues = List.of(Issue.error(ex.kind(), ex.getMessage(), ""));
        return ResolveOutcome.failed(ex, reporter.summarize(issues), reporter.exitCode(ex.kind()));
    }

    private static PhaseGraph loadPhaseGraph(ResolveConfiguration configuration) {
        return configuration.phaseFile()
            .map(PhaseConfigLoader::load)
            .orElseGet(PhaseConfigLoader::loadDefault);
    }

    private static CatalogLoadResult loadCatalog(ResolveConfiguration configuration, PhaseTable table) {
        var loader = new CatalogLoader(table, configuration.parallelism(), configuration.timeout());
        return loader.load(configuration.catalogDirectory());
    }

    static WorkflowRequest effectiveRequest(WorkflowRequest request, PhaseTable table) {
        if (!request.requiredCategories().isEmpty()) {
            return request;
        }
        return new WorkflowRequest(
            new LinkedHashSet<>(table.categories()),
            request.explicitPicks(),
            request.stackTags(),
            request.strict()
        );
    }
}
