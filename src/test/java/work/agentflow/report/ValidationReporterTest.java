package work.agentflow.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationReporterTest {
    private final ValidationReporter reporter = new ValidationReporter();

    @Test
    void emptyIssueListIsClean() {
        var summary = reporter.summarize(List.of());
        assertFalse(summary.hasErrors());
        assertEquals("No issues.", summary.report());
        assertEquals(ValidationReporter.EXIT_SUCCESS, reporter.exitCode(List.of()));
    }

    @Test
    void warningsAloneDoNotFail() {
        var issues = List.of(
            Issue.warning(IssueKind.PARSE_ERROR, "a.md: no metadata block", "a.md"),
            Issue.warning(IssueKind.UNRESOLVED_CATEGORY, "No agent available for category 'security'", "security")
        );
        var summary = reporter.summarize(issues);
        assertFalse(summary.hasErrors());
        assertEquals(2, summary.count(Severity.WARNING));
        assertEquals(ValidationReporter.EXIT_SUCCESS, reporter.exitCode(issues));
    }

    @Test
    void groupsBySeverityThenKind() {
        var issues = List.of(
            Issue.warning(IssueKind.PARSE_ERROR, "first parse problem", "a.md"),
            Issue.error(IssueKind.DUPLICATE_NAME, "duplicate tailwind-specialist", "b.md"),
            Issue.warning(IssueKind.PARSE_ERROR, "second parse problem", "c.md"),
            Issue.error(IssueKind.UNRESOLVED_CATEGORY, "No agent for security", "security")
        );
        var summary = reporter.summarize(issues);

        assertTrue(summary.hasErrors());
        assertEquals(2, summary.count(Severity.ERROR));
        assertEquals(2, summary.count(Severity.WARNING, IssueKind.PARSE_ERROR));
        assertEquals(0, summary.count(Severity.WARNING, IssueKind.CYCLE));

        String report = summary.report();
        assertTrue(report.indexOf("errors (2):") < report.indexOf("warnings (2):"), report);
        assertTrue(report.indexOf("DuplicateNameError (1)") < report.indexOf("UnresolvedCategoryError (1)"), report);
        assertTrue(report.contains("ParseError (2)"), report);
        assertTrue(report.indexOf("first parse problem") < report.indexOf("second parse problem"), report);
        assertEquals(ValidationReporter.EXIT_VALIDATION_FAILURE, reporter.exitCode(issues));
    }

    @Test
    void fatalKindsMapToExitCodes() {
        assertEquals(ValidationReporter.EXIT_IO_FAILURE, reporter.exitCode(IssueKind.IO_ERROR));
        assertEquals(ValidationReporter.EXIT_VALIDATION_FAILURE, reporter.exitCode(IssueKind.CYCLE));
    }

    @Test
    void serializesIssueWithoutContext() {
        var map = Issue.error(IssueKind.CYCLE, "cycle", "a").toSerializableMap();
        assertEquals(List.of("severity", "kind", "message"), List.copyOf(map.keySet()));
        assertEquals("error", map.get("severity"));
        assertEquals("CycleError", map.get("kind"));
    }
}
