package work.agentflow.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies collected issues and decides the process exit code.
 */
public final class ValidationReporter {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_VALIDATION_FAILURE = 1;
    public static final int EXIT_IO_FAILURE = 2;

    public Summary summarize(List<Issue> issues) {
        Objects.requireNonNull(issues, "issues");
        Map<Severity, Map<IssueKind, Integer>> counts = new EnumMap<>(Severity.class);
        for (Issue issue : issues) {
            counts.computeIfAbsent(issue.severity(), key -> new EnumMap<>(IssueKind.class))
                .merge(issue.kind(), 1, Integer::sum);
        }
        boolean hasErrors = counts.containsKey(Severity.ERROR);

        var report = new StringBuilder();
        if (issues.isEmpty()) {
            report.append("No issues.");
        }
        for (Severity severity : Severity.values()) {
            var byKind = counts.get(severity);
            if (byKind == null) {
                continue;
            }
            int total = byKind.values().stream().mapToInt(Integer::intValue).sum();
            appendLine(report, severity.label() + "s (" + total + "):");
            byKind.forEach((kind, count) -> {
                appendLine(report, "  " + kind.label() + " (" + count + ")");
                for (Issue issue : issues) {
                    if (issue.severity() == severity && issue.kind() == kind) {
                        appendLine(report, "    - " + issue.message());
                    }
                }
            });
        }
        return new Summary(hasErrors, report.toString(), counts);
    }

    /**
     * Exit code for a run that produced a plan.
     */
    public int exitCode(List<Issue> issues) {
        return summarize(issues).hasErrors() ? EXIT_VALIDATION_FAILURE : EXIT_SUCCESS;
    }

    /**
     * Exit code for a run aborted before any plan existed.
     */
    public int exitCode(IssueKind fatalKind) {
        return fatalKind == IssueKind.IO_ERROR ? EXIT_IO_FAILURE : EXIT_VALIDATION_FAILURE;
    }

    private static void appendLine(StringBuilder report, String line) {
        if (report.length() > 0) {
            report.append(System.lineSeparator());
        }
        report.append(line);
    }

    public record Summary(boolean hasErrors, String report, Map<Severity, Map<IssueKind, Integer>> counts) {
        public int count(Severity severity) {
            var byKind = counts.get(severity);
            return byKind == null ? 0 : byKind.values().stream().mapToInt(Integer::intValue).sum();
        }

        public int count(Severity severity, IssueKind kind) {
            var byKind = counts.get(severity);
            return byKind == null ? 0 : byKind.getOrDefault(kind, 0);
        }
    }
}
