package taskmesh.node.spi;

import taskmesh.node.model.TaskHeader;

import java.util.Set;

/**
 * Decides whether this node can compute tasks advertised by a header.
 */
@FunctionalInterface
public interface CapabilityFilter {

    boolean supports(TaskHeader header);

    /** Accept headers whose environment is one of {@code environments}. */
    static CapabilityFilter environments(Set<String> environments) {
        Set<String> copy = Set.copyOf(environments);
        return header -> copy.contains(header.environment());
    }
}
