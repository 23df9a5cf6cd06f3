package work.agentflow.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "agentflow",
    description = "Load an agent catalog and resolve phase-ordered workflows.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ResolveCommand.class,
        ListCommand.class
    }
)
final class AgentflowCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: resolve or list.");
    }
}
