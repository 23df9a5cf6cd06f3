package work.agentflow.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.api.AgentflowRunner;
import work.agentflow.api.ResolveOutcome;
import work.agentflow.resolve.WorkflowRequest;

@CommandLine.Command(
    name = "resolve",
    description = "Resolve the requested categories into a phase-ordered agent plan (JSON on stdout).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ResolveCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private CatalogOptions catalog = new CatalogOptions();

    @CommandLine.Option(
        names = {"-s", "--stack"},
        paramLabel = "TAG",
        split = ",",
        description = "Stack tags used to choose between agents of one category."
    )
    private List<String> stack = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--category"},
        paramLabel = "CATEGORY",
        split = ",",
        description = "Categories to cover (default: every category of the phase table)."
    )
    private List<String> categories = new ArrayList<>();

    @CommandLine.Option(
        names = "--pick",
        paramLabel = "CATEGORY=ID",
        description = "Pin a specific agent for a category."
    )
    private Map<String, String> picks = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--strict",
        description = "Treat categories without an agent as errors."
    )
    private boolean strict;

    @Override
    public Integer call() {
        CommandLine commandLine = spec.commandLine();
        WorkflowRequest request = WorkflowRequest.builder()
            .categories(categories)
            .picks(picks)
            .stackTags(stack)
            .strict(strict)
            .build();
        ResolveOutcome outcome = new AgentflowRunner().run(catalog.toConfiguration(commandLine, request));
        OutcomePrinter.print(commandLine, outcome);
        return outcome.exitCode();
    }
}
