package work.agentflow.catalog;

import java.util.List;
import work.agentflow.registry.Registry;
import work.agentflow.report.Issue;

/**
 * Registry produced by a load plus everything that was skipped or rejected on the way.
 */
public record CatalogLoadResult(Registry registry, List<Issue> issues, int documentsScanned, int documentsSkipped) {
    public CatalogLoadResult {
        issues = List.copyOf(issues);
    }

    public boolean truncated() {
        return documentsSkipped > 0;
    }
}
