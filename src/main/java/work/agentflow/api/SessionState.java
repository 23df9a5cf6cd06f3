package work.agentflow.api;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single resolution run.
 */
public enum SessionState {
    IDLE,
    LOADING,
    GRAPH_BUILT,
    RESOLVING,
    RESOLVED,
    FAILED;

    public Set<SessionState> next() {
        return switch (this) {
            case IDLE -> EnumSet.of(LOADING);
            case LOADING -> EnumSet.of(GRAPH_BUILT, FAILED);
            case GRAPH_BUILT -> EnumSet.of(RESOLVING, FAILED);
            case RESOLVING -> EnumSet.of(RESOLVED);
            case RESOLVED, FAILED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public boolean isTerminal() {
        return next().isEmpty();
    }
}
