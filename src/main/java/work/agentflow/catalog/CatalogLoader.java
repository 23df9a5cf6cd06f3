package work.agentflow.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.graph.PhaseTable;
import work.agentflow.registry.DuplicateNameException;
import work.agentflow.registry.Registry;
import work.agentflow.report.Issue;
import work.agentflow.report.IssueKind;

/**
 * Walks a catalog directory and registers one {@link AgentRecord} per well-formed document.
 *
 * <p>Documents are parsed on a bounded pool; results are registered by the calling thread in
 * source path order, so the outcome does not depend on which worker finishes first.
 */
public final class CatalogLoader {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);

    private final FrontMatterParser parser;
    private final int parallelism;
    private final Optional<Duration> timeout;

    public CatalogLoader(PhaseTable phaseTable) {
        this(phaseTable, Runtime.getRuntime().availableProcessors(), Optional.empty());
    }

    public CatalogLoader(PhaseTable phaseTable, int parallelism, Optional<Duration> timeout) {
        this.parser = new FrontMatterParser(Objects.requireNonNull(phaseTable, "phaseTable"));
        this.parallelism = Math.max(1, parallelism);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public CatalogLoadResult load(Path rootDir) {
        Path root = requireReadableDirectory(rootDir);
        Map<String, Path> documents = listDocuments(root);
        LOG.debug("Found {} candidate documents under {}", documents.size(), root);

        var tasks = new ArrayList<Callable<ParseOutcome>>();
        documents.forEach((sourcePath, file) -> tasks.add(() -> parseFile(file, sourcePath)));
        return register(runAll(tasks), documents.size());
    }

    /**
     * Loads documents held in memory, keyed by source path. Used by fixtures and embedders.
     */
    public CatalogLoadResult loadSources(Map<String, String> sources) {
        var ordered = new TreeMap<>(sources);
        var outcomes = new ArrayList<ParseOutcome>();
        ordered.forEach((sourcePath, content) -> outcomes.add(parseContent(content, sourcePath)));
        return register(outcomes.stream().map(Optional::of).collect(Collectors.toList()), ordered.size());
    }

    private Path requireReadableDirectory(Path rootDir) {
        if (rootDir == null) {
            throw new CatalogIOException("Catalog directory is not set");
        }
        Path root = rootDir.toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new CatalogIOException("Catalog directory does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new CatalogIOException("Catalog path is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new CatalogIOException("Catalog directory is not readable: " + root);
        }
        return root;
    }

    private Map<String, Path> listDocuments(Path root) {
        var documents = new TreeMap<String, Path>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                .filter(path -> isDocument(root.relativize(path)))
                .forEach(path -> documents.put(toSourcePath(root.relativize(path)), path));
        } catch (IOException | UncheckedIOException ex) {
            throw new CatalogIOException("Unable to read catalog directory " + root + ": " + ex.getMessage(), ex);
        }
        return documents;
    }

    private static boolean isDocument(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return false;
            }
        }
        String fileName = relative.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.startsWith("readme")) {
            return false;
        }
        return fileName.endsWith(".md") || fileName.endsWith(".markdown");
    }

    private static String toSourcePath(Path relative) {
        var parts = new ArrayList<String>();
        relative.forEach(part -> parts.add(part.toString()));
        return String.join("/", parts);
    }

    private List<Optional<ParseOutcome>> runAll(List<Callable<ParseOutcome>> tasks) {
        var outcomes = new ArrayList<Optional<ParseOutcome>>();
        if (tasks.isEmpty()) {
            return outcomes;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()), parserThreads());
        try {
            List<Future<ParseOutcome>> futures = timeout.isPresent()
                ? pool.invokeAll(tasks, timeout.get().toMillis(), TimeUnit.MILLISECONDS)
                : pool.invokeAll(tasks);
            for (Future<ParseOutcome> future : futures) {
                outcomes.add(collect(future));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Catalog loading interrupted; continuing with {} parsed documents", outcomes.size());
        } finally {
            pool.shutdownNow();
        }
        while (outcomes.size() < tasks.size()) {
            outcomes.add(Optional.empty());
        }
        return outcomes;
    }

    private static Optional<ParseOutcome> collect(Future<ParseOutcome> future) throws InterruptedException {
        if (future.isCancelled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(future.get());
        } catch (CancellationException ex) {
            return Optional.empty();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new IllegalStateException("Document parser failed: " + cause.getMessage(), cause);
        }
    }

    private CatalogLoadResult register(List<Optional<ParseOutcome>> outcomes, int scanned) {
        var registry = new Registry();
        var issues = new ArrayList<Issue>();
        int skipped = 0;
        for (Optional<ParseOutcome> outcome : outcomes) {
            if (outcome.isEmpty()) {
                skipped++;
                continue;
            }
            ParseOutcome parsed = outcome.get();
            if (parsed.issue() != null) {
                issues.add(parsed.issue());
                continue;
            }
            AgentRecord record = parsed.record();
            try {
                registry.register(record);
                if (!PhaseTable.isRanked(record.phase())) {
                    LOG.debug("{} uses unranked category '{}'", record.sourcePath(), record.category());
                }
            } catch (DuplicateNameException ex) {
                LOG.debug("Rejected duplicate agent: {}", ex.getMessage());
                issues.add(Issue.error(IssueKind.DUPLICATE_NAME, ex.getMessage(), record.sourcePath()));
            }
        }
        if (skipped > 0) {
            issues.add(Issue.warning(
                IssueKind.LOAD_TRUNCATED,
                "Catalog loading stopped early; " + skipped + " of " + scanned + " documents were not parsed",
                ""
            ));
        }
        LOG.info("Loaded {} agents from {} documents ({} issues)", registry.size(), scanned, issues.size());
        return new CatalogLoadResult(registry, issues, scanned, skipped);
    }

    private ParseOutcome parseFile(Path file, String sourcePath) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException ex) {
            return ParseOutcome.failed(Issue.warning(
                IssueKind.PARSE_ERROR,
                sourcePath + ": unable to read document (" + ex.getMessage() + ")",
                sourcePath
            ));
        }
        return parseContent(content, sourcePath);
    }

    private ParseOutcome parseContent(String content, String sourcePath) {
        try {
            return ParseOutcome.parsed(parser.parse(content, sourcePath));
        } catch (ParseException ex) {
            LOG.debug("Skipping {}", ex.getMessage());
            return ParseOutcome.failed(Issue.warning(IssueKind.PARSE_ERROR, ex.getMessage(), sourcePath));
        }
    }

    private static ThreadFactory parserThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "catalog-parser-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record ParseOutcome(AgentRecord record, Issue issue) {
        static ParseOutcome parsed(AgentRecord record) {
            return new ParseOutcome(record, null);
        }

        static ParseOutcome failed(Issue issue) {
            return new ParseOutcome(null, issue);
        }
    }
}
