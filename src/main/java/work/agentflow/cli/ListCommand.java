package work.agentflow.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.api.AgentflowRunner;
import work.agentflow.api.ResolveOutcome;
import work.agentflow.resolve.WorkflowRequest;

@CommandLine.Command(
    name = "list",
    description = "Load the catalog and print every registered agent (JSON on stdout).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ListCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private CatalogOptions catalog = new CatalogOptions();

    @Override
    public Integer call() {
        CommandLine commandLine = spec.commandLine();
        var configuration = catalog.toConfiguration(commandLine, WorkflowRequest.builder().build());
        ResolveOutcome outcome = new AgentflowRunner().list(configuration);
        OutcomePrinter.print(commandLine, outcome);
        return outcome.exitCode();
    }
}
