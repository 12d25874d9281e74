package taskmesh.node.session;

import taskmesh.node.exception.AlreadyResolvedException;
import taskmesh.node.model.SubtaskState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Per-subtask protocol state. Terminal states are kept until purged so a
 * late second outcome is detected rather than applied.
 */
class SubtaskOutcomes {

    private record Resolution(SubtaskState state, Instant at) {
    }

    private final Map<String, SubtaskState> states = new HashMap<>();
    private final Map<String, Resolution> resolved = new HashMap<>();

    /**
     * Move a subtask to a non-terminal state.
     *
     * @return false if the subtask is already settled
     */
    boolean transition(String subtaskId, SubtaskState state) {
        if (state.isTerminal()) {
            throw new IllegalArgumentException("use resolve() for terminal state " + state);
        }
        if (resolved.containsKey(subtaskId)) {
            return false;
        }
        states.put(subtaskId, state);
        return true;
    }

    /**
     * Settle a subtask.
     *
     * @throws AlreadyResolvedException if it was settled before
     */
    void resolve(String subtaskId, SubtaskState state, Instant at) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException(state + " is not terminal");
        }
        Resolution previous = resolved.get(subtaskId);
        if (previous != null) {
            throw new AlreadyResolvedException(subtaskId, previous.state().name());
        }
        states.remove(subtaskId);
        resolved.put(subtaskId, new Resolution(state, at));
    }

    boolean isResolved(String subtaskId) {
        return resolved.containsKey(subtaskId);
    }

    Optional<SubtaskState> state(String subtaskId) {
        Resolution resolution = resolved.get(subtaskId);
        if (resolution != null) {
            return Optional.of(resolution.state());
        }
        return Optional.ofNullable(states.get(subtaskId));
    }

    int purgeResolvedBefore(Instant cutoff) {
        int purged = 0;
        for (Iterator<Resolution> it = resolved.values().iterator(); it.hasNext();) {
            if (it.next().at().isBefore(cutoff)) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }
}
