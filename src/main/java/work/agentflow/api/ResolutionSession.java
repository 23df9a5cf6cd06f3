package work.agentflow.api;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the state transitions of one run and rejects illegal ones.
 */
final class ResolutionSession {
    private static final Logger LOG = LoggerFactory.getLogger(ResolutionSession.class);

    private final List<SessionState> history = new ArrayList<>(List.of(SessionState.IDLE));

    SessionState state() {
        return history.get(history.size() - 1);
    }

    List<SessionState> history() {
        return List.copyOf(history);
    }

    void moveTo(SessionState next) {
        SessionState current = state();
        if (!current.next().contains(next)) {
            throw new IllegalStateException("Illegal session transition " + current + " -> " + next);
        }
        LOG.debug("Session {} -> {}", current, next);
        history.add(next);
    }
}
