package work.agentflow.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.agentflow.resolve.WorkflowRequest;

/**
 * Immutable configuration for one load-and-resolve run.
 *
 * <p>An empty set of required categories in {@code request} means "every category of the phase table".
 */
public record ResolveConfiguration(
    Path catalogDirectory,
    Optional<Path> phaseFile,
    WorkflowRequest request,
    Optional<Duration> timeout,
    int parallelism
) {
    public ResolveConfiguration {
        Objects.requireNonNull(catalogDirectory, "catalogDirectory");
        Objects.requireNonNull(phaseFile, "phaseFile");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path catalogDirectory;
        private Optional<Path> phaseFile = Optional.empty();
        private WorkflowRequest request = WorkflowRequest.builder().build();
        private Optional<Duration> timeout = Optional.empty();
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public Builder catalogDirectory(Path catalogDirectory) {
            this.catalogDirectory = catalogDirectory;
            return this;
        }

        public Builder phaseFile(Optional<Path> phaseFile) {
            this.phaseFile = phaseFile;
            return this;
        }

        public Builder request(WorkflowRequest request) {
            this.request = request;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public ResolveConfiguration build() {
            return new ResolveConfiguration(catalogDirectory, phaseFile, request, timeout, parallelism);
        }
    }
}
