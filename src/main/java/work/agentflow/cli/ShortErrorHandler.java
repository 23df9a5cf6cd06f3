package work.agentflow.cli;

import picocli.CommandLine;
import work.agentflow.report.ValidationReporter;
import work.agentflow.shared.AgentflowException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private final ValidationReporter reporter = new ValidationReporter();

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof AgentflowException failure) {
            message = failure.kind().label() + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("agentflow.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof AgentflowException failure) {
            return reporter.exitCode(failure.kind());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
