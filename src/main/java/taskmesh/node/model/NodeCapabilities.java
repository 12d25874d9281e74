package taskmesh.node.model;

/**
 * What this node offers when asking an owner for a subtask.
 */
public record NodeCapabilities(
        double estimatedPerformance,
        long maxResourceSize,
        long maxMemorySize,
        int numCores) {

    public NodeCapabilities {
        if (numCores <= 0) {
            throw new IllegalArgumentException("numCores must be positive");
        }
        if (maxResourceSize < 0 || maxMemorySize < 0) {
            throw new IllegalArgumentException("size limits must be non-negative");
        }
    }
}
