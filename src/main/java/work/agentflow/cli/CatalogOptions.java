package work.agentflow.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import picocli.CommandLine;
import work.agentflow.api.LogLevel;
import work.agentflow.api.ResolveConfiguration;
import work.agentflow.resolve.WorkflowRequest;
import work.agentflow.shared.DurationParser;

/**
 * Options shared by every command that loads a catalog.
 */
final class CatalogOptions {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Option(
        names = {"-d", "--dir"},
        paramLabel = "PATH",
        description = "Catalog directory (default: $AGENTS_DIR).",
        defaultValue = "${env:AGENTS_DIR}"
    )
    String dir;

    @CommandLine.Option(
        names = "--phases",
        paramLabel = "FILE",
        description = "TOML phase table replacing the bundled default.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String phases;

    @CommandLine.Option(
        names = "--timeout",
        description = "Loading deadline (e.g. 500ms, 30s, 2m); unparsed documents are skipped.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String timeoutRaw;

    @CommandLine.Option(
        names = "--parallelism",
        description = "Parser threads (default: available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Integer parallelism;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic log threshold on stderr (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    ResolveConfiguration toConfiguration(CommandLine commandLine, WorkflowRequest request) {
        if (dir == null || dir.isBlank()) {
            throw new CommandLine.ParameterException(commandLine, "Missing catalog directory: pass --dir or set AGENTS_DIR.");
        }
        LogLevel logLevel = parse(commandLine, () -> LogLevel.from(logLevelRaw));
        if (logLevelRaw != null) {
            System.setProperty(LOG_LEVEL_PROPERTY, logLevel.simpleLoggerName());
        }
        Optional<Duration> timeout = parse(commandLine, () -> DurationParser.parse(timeoutRaw));
        if (parallelism != null && parallelism < 1) {
            throw new CommandLine.ParameterException(commandLine, "--parallelism must be at least 1");
        }
        var builder = ResolveConfiguration.builder()
            .catalogDirectory(Paths.get(dir).toAbsolutePath().normalize())
            .phaseFile(Optional.ofNullable(phases).map(value -> Path.of(value).toAbsolutePath().normalize()))
            .request(request)
            .timeout(timeout);
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        return builder.build();
    }

    private static <T> T parse(CommandLine commandLine, Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(commandLine, ex.getMessage());
        }
    }
}
