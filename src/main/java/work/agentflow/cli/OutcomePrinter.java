package work.agentflow.cli;

import picocli.CommandLine;
import work.agentflow.api.ResolveOutcome;

/**
 * JSON goes to stdout; the human-readable issue summary goes to stderr.
 */
final class OutcomePrinter {
    private OutcomePrinter() {}

    static void print(CommandLine commandLine, ResolveOutcome outcome) {
        commandLine.getOut().println(outcome.toPrettyJson());
        commandLine.getOut().flush();
        if (!outcome.summary().counts().isEmpty()) {
            commandLine.getErr().println(outcome.summary().report());
            commandLine.getErr().flush();
        }
    }
}
